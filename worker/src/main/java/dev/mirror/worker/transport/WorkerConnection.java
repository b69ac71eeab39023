package dev.mirror.worker.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dev.mirror.transport.ErrorKind;
import dev.mirror.transport.LengthPrefixedCodec;
import dev.mirror.transport.Messages;
import dev.mirror.transport.MirrorException;
import dev.mirror.transport.PendingCalls;
import dev.mirror.transport.Wire;
import dev.mirror.transport.message.ChannelMessage;
import dev.mirror.transport.relay.RelayEnvelope;
import dev.mirror.transport.relay.RelayResult;
import dev.mirror.worker.engine.NetworkTransport;
import dev.mirror.worker.relay.RelayEscalator;
import dev.mirror.worker.service.WorkerRequestHandler;
import dev.mirror.worker.service.WorkerSession;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileSystemException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker side of one controller connection. Announces readiness, then executes requests one at a
 * time in arrival order while the read loop keeps accepting relay results, so a request that
 * waits on an escalated network call can be resumed.
 */
public class WorkerConnection implements Closeable, RelayEscalator {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerConnection.class);

    private final String connectionId;
    private final InputStream in;
    private final OutputStream out;
    private final WorkerRequestHandler handler;
    private final WorkerSession session;
    private final ExecutorService requestExecutor;
    private final PendingCalls<RelayResult> relays;

    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile boolean open = true;
    private volatile Runnable onClose = () -> { };

    public WorkerConnection(String connectionId, InputStream in, OutputStream out, WorkerRequestHandler handler,
                            Function<RelayEscalator, NetworkTransport> transportFactory) {
        this.connectionId = connectionId;
        this.in = in;
        this.out = out;
        this.handler = handler;
        this.session = new WorkerSession(transportFactory.apply(this));
        this.relays = new PendingCalls<>("relay@" + connectionId);
        this.requestExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "worker-request-" + connectionId);
            t.setDaemon(true);
            return t;
        });
    }

    void onClose(Runnable callback) {
        this.onClose = callback;
    }

    WorkerSession session() {
        return session;
    }

    /**
     * Runs the read loop until the controller goes away. Blocks the calling thread.
     */
    public void run() {
        LOGGER.info("Serving controller {}", connectionId);
        try {
            send(new ChannelMessage.Ready());
            while (open) {
                String frame = LengthPrefixedCodec.readFrame(in);
                if (frame == null) {
                    break;
                }
                ChannelMessage message;
                try {
                    message = Messages.decode(frame);
                } catch (JsonProcessingException e) {
                    LOGGER.warn("Dropping undecodable frame from {}: {}", connectionId, e.getOriginalMessage());
                    continue;
                }
                Wire.rx(connectionId, message);
                if (message instanceof ChannelMessage.Request request) {
                    submit(request);
                } else if (message instanceof ChannelMessage.FetchResult result) {
                    handleFetchResult(result);
                } else {
                    LOGGER.warn("Unexpected message type {} from {}", message.type(), connectionId);
                }
            }
        } catch (IOException e) {
            if (open) {
                LOGGER.error("Connection error {}", connectionId, e);
            }
        } finally {
            close();
        }
    }

    private void submit(ChannelMessage.Request request) {
        try {
            requestExecutor.submit(() -> execute(request));
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Connection {} is closing, dropping request {}", connectionId, request.id());
        }
    }

    private void execute(ChannelMessage.Request request) {
        String id = request.id();
        AtomicInteger seq = new AtomicInteger();
        try {
            JsonNode payload = handler.handle(request.request(), session,
                event -> sendQuietly(new ChannelMessage.Progress(id, seq.incrementAndGet(), event)));
            sendQuietly(new ChannelMessage.Success(id, payload));
        } catch (Exception e) {
            ErrorKind kind = MirrorException.kindOf(e);
            LOGGER.warn("Error in worker action {} ({}): {}", request.request().kind().wireName(), id, describe(e));
            LOGGER.debug("Failure detail for {}", id, e);
            sendQuietly(new ChannelMessage.Failure(id, kind, describe(e)));
        }
    }

    private void handleFetchResult(ChannelMessage.FetchResult result) {
        boolean delivered;
        if (result.error() != null) {
            ErrorKind kind = result.errorKind() != null ? result.errorKind() : ErrorKind.NETWORK_ERROR;
            delivered = relays.fail(result.id(), new MirrorException(kind, result.error()));
        } else {
            delivered = relays.complete(result.id(), result.payload());
        }
        if (!delivered) {
            LOGGER.debug("Discarded late or duplicate relay result {}", result.id());
        }
    }

    @Override
    public CompletableFuture<RelayResult> escalate(RelayEnvelope envelope, Duration timeout) {
        String id = envelope.id();
        CompletableFuture<RelayResult> future = relays.register(id, timeout,
            () -> new MirrorException(ErrorKind.RELAY_TIMEOUT, "Relay " + id + " timed out after " + timeout));
        if (!open) {
            relays.fail(id, new MirrorException(ErrorKind.CHANNEL_CLOSED, "Controller connection closed"));
            return future;
        }
        try {
            send(new ChannelMessage.FetchProxy(id, envelope));
        } catch (IOException e) {
            relays.fail(id, new MirrorException(ErrorKind.CHANNEL_CLOSED, "Unable to reach controller", e));
        }
        return future;
    }

    private void sendQuietly(ChannelMessage message) {
        try {
            send(message);
        } catch (IOException e) {
            LOGGER.warn("Unable to send {} for {} to {}", message.type(), message.id(), connectionId, e);
        }
    }

    private void send(ChannelMessage message) throws IOException {
        String json = Messages.encode(message);
        Wire.tx(connectionId, message);
        synchronized (out) {
            LengthPrefixedCodec.writeFrame(out, json);
        }
    }

    private static String describe(Throwable error) {
        Throwable cause = MirrorException.unwrap(error);
        if (cause instanceof FileSystemException fileError && fileError.getReason() == null) {
            return cause.getClass().getSimpleName() + ": " + fileError.getFile();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        open = false;
        int failed = relays.failAll(() -> new MirrorException(ErrorKind.CHANNEL_CRASHED, "Controller connection closed"));
        if (failed > 0) {
            LOGGER.warn("Failed {} pending relays of {}", failed, connectionId);
        }
        requestExecutor.shutdownNow();
        try {
            if (!requestExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                LOGGER.warn("Request of {} still running after close", connectionId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        closeQuietly(in);
        closeQuietly(out);
        onClose.run();
        LOGGER.info("Connection {} closed", connectionId);
    }

    private void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            LOGGER.warn("Error closing stream of {}", connectionId, e);
        }
    }
}
