package dev.mirror.worker.relay;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import dev.mirror.transport.relay.RelayEnvelope;
import dev.mirror.transport.relay.RelayResult;

/**
 * Hands a network request to the controller context, which relays it on behalf of the worker.
 */
public interface RelayEscalator {

	/**
	 * Escalate a request.
	 * @param envelope request carrying a relay-scoped correlation id
	 * @param timeout how long to wait for the result before failing with a relay timeout
	 * @return future completed with the relayed response, exactly once
	 */
	CompletableFuture<RelayResult> escalate(RelayEnvelope envelope, Duration timeout);

}
