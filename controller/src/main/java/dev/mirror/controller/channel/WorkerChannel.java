package dev.mirror.controller.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dev.mirror.controller.relay.PrivilegedNetworkProxy;
import dev.mirror.transport.CorrelationIds;
import dev.mirror.transport.ErrorKind;
import dev.mirror.transport.LengthPrefixedCodec;
import dev.mirror.transport.Messages;
import dev.mirror.transport.MirrorException;
import dev.mirror.transport.PendingCalls;
import dev.mirror.transport.Wire;
import dev.mirror.transport.message.ChannelMessage;
import dev.mirror.transport.message.ProgressEvent;
import dev.mirror.transport.message.WorkerRequest;
import dev.mirror.transport.relay.RelayEnvelope;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Controller end of the RPC channel to the worker.
 *
 * <p>Calls issued before the worker's ready signal are queued and sent, in issue order, once it
 * arrives. If it does not arrive within the startup timeout the channel fails for good. Each call
 * is bounded by its own timeout; an expired call is rejected whether or not the worker is still
 * busy with it. Progress and terminal responses are delivered on a single callback thread in the
 * order they were read, so progress for an id always precedes its result. When the worker goes
 * away every pending call is rejected and the channel is not reopened.
 *
 * <p>Relay requests from the worker are handed to the configured {@link PrivilegedNetworkProxy}
 * and answered under the worker's correlation id.
 */
public class WorkerChannel implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerChannel.class);

    private final String name;
    private final InputStream in;
    private final OutputStream out;
    private final ChannelSettings settings;
    private final PrivilegedNetworkProxy proxy;
    private final CorrelationIds ids = new CorrelationIds();
    private final PendingCalls<JsonNode> calls = new PendingCalls<>("rpc");
    private final CompletableFuture<Void> ready = new CompletableFuture<>();
    private final ExecutorService callbackExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "worker-channel-callbacks");
        t.setDaemon(true);
        return t;
    });
    private final Object lock = new Object();
    private final List<QueuedCall> queued = new ArrayList<>();

    private Thread readerThread;
    private volatile boolean running;
    private MirrorException terminalFailure;
    private boolean readyReceived;

    public WorkerChannel(String name, InputStream in, OutputStream out, ChannelSettings settings,
                         PrivilegedNetworkProxy proxy) {
        this.name = name;
        this.in = in;
        this.out = out;
        this.settings = settings;
        this.proxy = proxy;
    }

    /**
     * Connects to a worker listening on TCP and starts the channel.
     */
    public static WorkerChannel connect(String host, int port, ChannelSettings settings,
                                       PrivilegedNetworkProxy proxy) throws IOException {
        Socket socket = new Socket(host, port);
        socket.setTcpNoDelay(true);
        WorkerChannel channel = new WorkerChannel(host + ":" + port, socket.getInputStream(),
            socket.getOutputStream(), settings, proxy);
        LOGGER.info("Connected to worker {}:{}", host, port);
        return channel.start();
    }

    public WorkerChannel start() {
        synchronized (lock) {
            if (readerThread != null) {
                return this;
            }
            running = true;
            readerThread = new Thread(this::readLoop, "worker-channel-reader");
            readerThread.setDaemon(true);
            readerThread.start();
        }
        Duration startupTimeout = settings.startupTimeout();
        CompletableFuture.delayedExecutor(startupTimeout.toMillis(), TimeUnit.MILLISECONDS).execute(() ->
            failStartup(new MirrorException(ErrorKind.STARTUP_TIMEOUT,
                "Worker failed to signal ready within " + startupTimeout.toSeconds() + "s")));
        return this;
    }

    /**
     * Completes when the worker signalled readiness, fails when it never will.
     */
    public CompletableFuture<Void> readiness() {
        return ready.copy();
    }

    public CompletableFuture<JsonNode> send(WorkerRequest request) {
        return send(request, null);
    }

    /**
     * Sends a request.
     * @param request typed request
     * @param onProgress receives progress events of this call, may be {@code null}
     * @return future completed with the success payload or failed with a {@link MirrorException}
     */
    public CompletableFuture<JsonNode> send(WorkerRequest request, Consumer<ProgressEvent> onProgress) {
        synchronized (lock) {
            if (terminalFailure != null) {
                return CompletableFuture.failedFuture(terminalFailure);
            }
            if (!readyReceived) {
                QueuedCall call = new QueuedCall(request, onProgress, new CompletableFuture<>());
                queued.add(call);
                LOGGER.debug("Queued {} until the worker is ready", request.kind().wireName());
                return call.result();
            }
        }
        return dispatch(request, onProgress);
    }

    private CompletableFuture<JsonNode> dispatch(WorkerRequest request, Consumer<ProgressEvent> onProgress) {
        String id = ids.next(CorrelationIds.Scope.RPC);
        Duration timeout = request.kind().bulk() ? settings.bulkCallTimeout() : settings.callTimeout();
        CompletableFuture<JsonNode> future = calls.register(id, timeout,
            () -> new MirrorException(ErrorKind.CALL_TIMEOUT,
                "Worker request " + request.kind().wireName() + " timed out after " + timeout),
            onProgress);
        synchronized (lock) {
            // the channel may have died after send() looked, and after terminate() drained the calls
            if (terminalFailure != null) {
                calls.fail(id, terminalFailure);
                return future;
            }
        }
        try {
            write(new ChannelMessage.Request(id, request));
        } catch (IOException e) {
            calls.fail(id, new MirrorException(ErrorKind.CHANNEL_CLOSED, "Unable to reach worker", e));
        }
        return future;
    }

    private void readLoop() {
        MirrorException failure = new MirrorException(ErrorKind.CHANNEL_CRASHED, "Worker crashed");
        try {
            while (running) {
                String frame = LengthPrefixedCodec.readFrame(in);
                if (frame == null) {
                    break;
                }
                ChannelMessage message;
                try {
                    message = Messages.decode(frame);
                } catch (JsonProcessingException e) {
                    LOGGER.warn("Dropping undecodable frame from {}: {}", name, e.getOriginalMessage());
                    continue;
                }
                Wire.rx(name, message);
                route(message);
            }
        } catch (IOException e) {
            if (running) {
                LOGGER.error("Worker channel {} failed", name, e);
                failure = new MirrorException(ErrorKind.CHANNEL_CRASHED, "Worker crashed: " + e.getMessage(), e);
            }
        } finally {
            if (running) {
                LOGGER.error("Worker {} terminated unexpectedly", name);
                terminate(failure);
            }
        }
    }

    private void route(ChannelMessage message) {
        if (message instanceof ChannelMessage.Ready) {
            onReady();
        } else if (message instanceof ChannelMessage.Progress progress) {
            callbackExecutor.execute(() -> deliverProgress(progress));
        } else if (message instanceof ChannelMessage.Success success) {
            callbackExecutor.execute(() -> calls.complete(success.id(), success.payload()));
        } else if (message instanceof ChannelMessage.Failure failure) {
            callbackExecutor.execute(() -> calls.fail(failure.id(),
                new MirrorException(failure.kind() != null ? failure.kind() : ErrorKind.FAILED, failure.message())));
        } else if (message instanceof ChannelMessage.FetchProxy fetch) {
            handleFetchProxy(fetch);
        } else {
            LOGGER.warn("Unexpected message type {} from {}", message.type(), name);
        }
    }

    private void deliverProgress(ChannelMessage.Progress progress) {
        try {
            if (!calls.progress(progress.id(), progress.event())) {
                LOGGER.debug("Progress for unknown or retired call {}", progress.id());
            }
        } catch (RuntimeException e) {
            LOGGER.warn("Progress callback of {} failed", progress.id(), e);
        }
    }

    private void onReady() {
        synchronized (lock) {
            if (readyReceived || terminalFailure != null) {
                LOGGER.debug("Ignoring ready signal from {}", name);
                return;
            }
            readyReceived = true;
            LOGGER.info("Worker {} handshake successful", name);
            for (QueuedCall call : queued) {
                dispatch(call.request(), call.onProgress()).whenComplete((payload, error) -> {
                    if (error != null) {
                        call.result().completeExceptionally(MirrorException.unwrap(error));
                    } else {
                        call.result().complete(payload);
                    }
                });
            }
            queued.clear();
        }
        ready.complete(null);
    }

    private void handleFetchProxy(ChannelMessage.FetchProxy fetch) {
        String id = fetch.id();
        if (proxy == null) {
            writeQuietly(ChannelMessage.FetchResult.failure(id, "No network relay configured"));
            return;
        }
        RelayEnvelope envelope = fetch.envelope().id() == null ? fetch.envelope().withId(id) : fetch.envelope();
        CompletableFuture<ChannelMessage.FetchResult> answer;
        try {
            answer = proxy.relay(envelope).handle((result, error) -> error == null
                ? ChannelMessage.FetchResult.success(id, result)
                : ChannelMessage.FetchResult.failure(id, MirrorException.kindOf(error),
                    MirrorException.unwrap(error).getMessage()));
        } catch (RuntimeException e) {
            answer = CompletableFuture.completedFuture(ChannelMessage.FetchResult.failure(id, e.getMessage()));
        }
        answer.thenAccept(this::writeQuietly);
    }

    private void failStartup(MirrorException failure) {
        synchronized (lock) {
            if (readyReceived || terminalFailure != null) {
                return;
            }
        }
        LOGGER.error(failure.getMessage());
        terminate(failure);
    }

    private void terminate(MirrorException failure) {
        List<QueuedCall> dropped;
        synchronized (lock) {
            if (terminalFailure != null) {
                return;
            }
            terminalFailure = failure;
            dropped = new ArrayList<>(queued);
            queued.clear();
        }
        running = false;
        ready.completeExceptionally(failure);
        for (QueuedCall call : dropped) {
            call.result().completeExceptionally(failure);
        }
        callbackExecutor.execute(() -> {
            int failed = calls.failAll(() -> failure);
            if (failed > 0) {
                LOGGER.warn("Rejected {} pending calls: {}", failed, failure.getMessage());
            }
        });
    }

    private void writeQuietly(ChannelMessage message) {
        try {
            write(message);
        } catch (IOException e) {
            LOGGER.warn("Unable to send {} for {} to {}", message.type(), message.id(), name, e);
        }
    }

    private void write(ChannelMessage message) throws IOException {
        String json = Messages.encode(message);
        Wire.tx(name, message);
        synchronized (out) {
            LengthPrefixedCodec.writeFrame(out, json);
        }
    }

    @Override
    public void close() throws IOException {
        terminate(new MirrorException(ErrorKind.CHANNEL_CLOSED, "Worker channel closed"));
        try {
            in.close();
        } finally {
            out.close();
            callbackExecutor.shutdown();
            if (readerThread != null) {
                try {
                    readerThread.join(500);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    private record QueuedCall(WorkerRequest request, Consumer<ProgressEvent> onProgress,
                              CompletableFuture<JsonNode> result) {
    }
}
