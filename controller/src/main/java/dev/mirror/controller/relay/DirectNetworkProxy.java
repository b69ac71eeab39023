package dev.mirror.controller.relay;

import dev.mirror.transport.ErrorKind;
import dev.mirror.transport.MirrorException;
import dev.mirror.transport.relay.NetworkFetcher;
import dev.mirror.transport.relay.RelayEnvelope;
import dev.mirror.transport.relay.RelayResult;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Issues relayed requests straight from the controller, for environments without origin
 * restrictions.
 */
public class DirectNetworkProxy implements PrivilegedNetworkProxy {

    private final NetworkFetcher fetcher;
    private final Executor executor;

    public DirectNetworkProxy(NetworkFetcher fetcher, Executor executor) {
        this.fetcher = fetcher;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<RelayResult> relay(RelayEnvelope envelope) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return fetcher.fetch(envelope);
            } catch (IOException e) {
                throw new CompletionException(new MirrorException(ErrorKind.NETWORK_ERROR,
                    envelope.method() + " " + envelope.url() + " failed: " + e.getMessage(), e));
            }
        }, executor);
    }
}
