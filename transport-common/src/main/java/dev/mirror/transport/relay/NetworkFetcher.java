package dev.mirror.transport.relay;

import java.io.IOException;

/**
 * The hop that actually talks to the network.
 */
@FunctionalInterface
public interface NetworkFetcher {

    /**
     * Performs the request and returns whatever status the server answered with.
     * @throws IOException on transport failure
     */
    RelayResult fetch(RelayEnvelope envelope) throws IOException;
}
