package dev.mirror.worker.engine;

import java.io.IOException;
import java.util.Map;

import dev.mirror.transport.relay.RelayResult;

/**
 * Network access handed to the {@link VersioningEngine}. Implementations decide whether a
 * request is issued directly or relayed through a more privileged context.
 */
@FunctionalInterface
public interface NetworkTransport {

	/**
	 * Issue a network request.
	 * @param url absolute target URL
	 * @param method HTTP method
	 * @param headers request headers
	 * @param body raw request body, {@code null} for none
	 * @return the response, with a body indistinguishable from a direct call
	 * @throws IOException when the request cannot be completed
	 */
	RelayResult request(String url, String method, Map<String, String> headers, byte[] body) throws IOException;

}
