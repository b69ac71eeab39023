package dev.mirror.transport;

import dev.mirror.transport.message.ProgressEvent;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of calls waiting for a terminal answer, keyed by correlation id. A call leaves the
 * registry exactly once: on completion, on failure, or when its timeout evicts it. Answers for
 * ids that are no longer registered are dropped, which is how late and duplicate results are
 * discarded.
 *
 * @param <T> result type of the call
 */
public final class PendingCalls<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(PendingCalls.class);

    private final String name;
    private final Map<String, Pending<T>> pending = new ConcurrentHashMap<>();

    public PendingCalls(String name) {
        this.name = name;
    }

    public CompletableFuture<T> register(String id, Duration timeout, Supplier<MirrorException> onTimeout) {
        return register(id, timeout, onTimeout, null);
    }

    public CompletableFuture<T> register(String id, Duration timeout, Supplier<MirrorException> onTimeout,
                                         Consumer<ProgressEvent> progressSink) {
        CompletableFuture<T> future = new CompletableFuture<>();
        Pending<T> record = new Pending<>(future, progressSink);
        if (pending.putIfAbsent(id, record) != null) {
            throw new IllegalStateException(name + ": id already pending " + id);
        }
        if (timeout != null) {
            CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
                if (pending.remove(id, record)) {
                    LOGGER.warn("{}: call {} evicted after {}", name, id, timeout);
                    future.completeExceptionally(onTimeout.get());
                }
            });
        }
        return future;
    }

    /**
     * Delivers a progress item to the call's sink, if it is still pending.
     * @return {@code false} when the id is unknown
     */
    public boolean progress(String id, ProgressEvent item) {
        Pending<T> record = pending.get(id);
        if (record == null) {
            return false;
        }
        if (record.progressSink() != null) {
            record.progressSink().accept(item);
        }
        return true;
    }

    public boolean complete(String id, T value) {
        Pending<T> record = pending.remove(id);
        if (record == null) {
            LOGGER.debug("{}: discarding result for unknown or retired id {}", name, id);
            return false;
        }
        return record.future().complete(value);
    }

    public boolean fail(String id, Throwable error) {
        Pending<T> record = pending.remove(id);
        if (record == null) {
            LOGGER.debug("{}: discarding failure for unknown or retired id {}", name, id);
            return false;
        }
        return record.future().completeExceptionally(error);
    }

    public int failAll(Supplier<? extends Throwable> error) {
        List<Pending<T>> drained = new ArrayList<>();
        for (String id : new ArrayList<>(pending.keySet())) {
            Pending<T> record = pending.remove(id);
            if (record != null) {
                drained.add(record);
            }
        }
        for (Pending<T> record : drained) {
            record.future().completeExceptionally(error.get());
        }
        return drained.size();
    }

    public boolean isPending(String id) {
        return pending.containsKey(id);
    }

    public int size() {
        return pending.size();
    }

    private record Pending<T>(CompletableFuture<T> future, Consumer<ProgressEvent> progressSink) {
    }
}
