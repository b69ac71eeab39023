package dev.mirror.transport;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues correlation ids. Each scope has its own prefix, so an RPC id can never equal a relay id
 * even when both are in flight on the same channel.
 */
public final class CorrelationIds {

    public enum Scope {
        RPC("rpc"),
        RELAY("relay"),
        EXTENSION("ext");

        private final String prefix;

        Scope(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    private final String instance = UUID.randomUUID().toString().substring(0, 8);
    private final AtomicLong counter = new AtomicLong();

    public String next(Scope scope) {
        return scope.prefix() + "-" + instance + "-" + counter.incrementAndGet();
    }

    public static boolean belongsTo(String id, Scope scope) {
        return id != null && id.startsWith(scope.prefix() + "-");
    }
}
