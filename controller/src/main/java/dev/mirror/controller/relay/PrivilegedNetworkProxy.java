package dev.mirror.controller.relay;

import dev.mirror.transport.relay.RelayEnvelope;
import dev.mirror.transport.relay.RelayResult;
import java.util.concurrent.CompletableFuture;

/**
 * Performs a network request on behalf of a context that may not issue it itself.
 */
public interface PrivilegedNetworkProxy {

    /**
     * @return future completed exactly once with the response, or failed with a
     *     {@link dev.mirror.transport.MirrorException}
     */
    CompletableFuture<RelayResult> relay(RelayEnvelope envelope);
}
