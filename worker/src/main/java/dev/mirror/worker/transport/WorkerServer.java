package dev.mirror.worker.transport;

import dev.mirror.worker.engine.NetworkTransport;
import dev.mirror.worker.relay.RelayEscalator;
import dev.mirror.worker.service.WorkerRequestHandler;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts controller connections on the loopback interface. The worker owns a single content
 * store, so it serves one controller at a time; further connections are refused until the current
 * one goes away.
 */
public class WorkerServer implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerServer.class);

    private final int port;
    private final WorkerRequestHandler handler;
    private final Function<RelayEscalator, NetworkTransport> transportFactory;
    private final ExecutorService connectionExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "worker-connection");
        t.setDaemon(true);
        return t;
    });
    private final AtomicReference<WorkerConnection> active = new AtomicReference<>();

    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile boolean running;

    public WorkerServer(int port, WorkerRequestHandler handler,
                        Function<RelayEscalator, NetworkTransport> transportFactory) {
        this.port = port;
        this.handler = handler;
        this.transportFactory = transportFactory;
    }

    public void start() throws IOException {
        if (running) {
            return;
        }
        serverSocket = new ServerSocket(port, 50, InetAddress.getLoopbackAddress());
        running = true;
        acceptThread = new Thread(this::acceptLoop, "worker-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        LOGGER.info("Worker listening on port {}", serverSocket.getLocalPort());
    }

    /**
     * Port actually bound, useful when configured with {@code 0}.
     */
    public int boundPort() {
        return serverSocket == null ? -1 : serverSocket.getLocalPort();
    }

    private void acceptLoop() {
        while (running) {
            try {
                Socket socket = serverSocket.accept();
                socket.setTcpNoDelay(true);
                String connectionId = socket.getRemoteSocketAddress().toString();
                WorkerConnection connection = new WorkerConnection(connectionId, socket.getInputStream(),
                    socket.getOutputStream(), handler, transportFactory);
                if (!active.compareAndSet(null, connection)) {
                    LOGGER.warn("Refusing {}, worker already serves a controller", connectionId);
                    connection.close();
                    socket.close();
                    continue;
                }
                connection.onClose(() -> active.compareAndSet(connection, null));
                connectionExecutor.submit(() -> {
                    try (socket) {
                        connection.run();
                    } catch (IOException e) {
                        LOGGER.warn("Error closing socket of {}", connectionId, e);
                    }
                });
            } catch (IOException e) {
                if (running) {
                    LOGGER.error("Error accepting connection", e);
                }
            } catch (RejectedExecutionException e) {
                LOGGER.warn("Connection executor rejected connection");
            }
        }
    }

    public void stop() {
        running = false;
        if (serverSocket != null) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                LOGGER.warn("Error closing server socket", e);
            }
        }
        if (acceptThread != null) {
            try {
                acceptThread.join(Duration.ofSeconds(1).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        WorkerConnection connection = active.get();
        if (connection != null) {
            connection.close();
        }
        connectionExecutor.shutdown();
        try {
            if (!connectionExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                connectionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Worker stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
