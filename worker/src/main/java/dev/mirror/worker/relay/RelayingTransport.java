package dev.mirror.worker.relay;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.mirror.transport.CorrelationIds;
import dev.mirror.transport.ErrorKind;
import dev.mirror.transport.MirrorException;
import dev.mirror.transport.relay.NetworkFetcher;
import dev.mirror.transport.relay.RelayEnvelope;
import dev.mirror.transport.relay.RelayResult;
import dev.mirror.worker.engine.NetworkTransport;

/**
 * {@link NetworkTransport} of the worker. Same-origin requests and requests addressed to the
 * configured open relay endpoint are fetched directly; everything else is escalated to the
 * controller under a relay-scoped correlation id.
 */
public class RelayingTransport implements NetworkTransport {

	private static final Logger logger = LoggerFactory.getLogger(RelayingTransport.class);

	private final NetworkFetcher fetcher;

	private final RelayEscalator escalator;

	private final String origin;

	private final String corsProxy;

	private final Duration timeout;

	private final CorrelationIds correlationIds = new CorrelationIds();

	public RelayingTransport(NetworkFetcher fetcher, RelayEscalator escalator, String origin, String corsProxy,
			Duration timeout) {
		this.fetcher = fetcher;
		this.escalator = escalator;
		this.origin = (origin != null && !origin.isBlank()) ? RelayEnvelope.originOf(origin) : "";
		this.corsProxy = corsProxy;
		this.timeout = timeout;
	}

	@Override
	public RelayResult request(String url, String method, Map<String, String> headers, byte[] body)
			throws IOException {
		RelayEnvelope envelope = new RelayEnvelope(this.correlationIds.next(CorrelationIds.Scope.RELAY), url, method,
				headers, body);
		RelayResult result = isDirect(url) ? fetchDirect(envelope) : escalate(envelope);
		if (!result.ok()) {
			throw new MirrorException(ErrorKind.NETWORK_ERROR, envelope.method() + " " + url + " failed: HTTP "
					+ result.statusCode() + " " + result.statusMessage());
		}
		return result;
	}

	/**
	 * Decide whether a URL can be fetched without escalation.
	 * @param url absolute target URL
	 * @return {@code true} for same-origin targets and the open relay endpoint
	 */
	public boolean isDirect(String url) {
		if (underCorsProxy(url)) {
			return true;
		}
		return !this.origin.isEmpty() && this.origin.equals(RelayEnvelope.originOf(url));
	}

	private boolean underCorsProxy(String url) {
		if (this.corsProxy == null || this.corsProxy.isBlank()) {
			return false;
		}
		// the proxy prefix must end at a path boundary, not inside a longer host name
		String prefix = this.corsProxy.endsWith("/") ? this.corsProxy : this.corsProxy + "/";
		return url.equals(this.corsProxy) || url.startsWith(prefix);
	}

	private RelayResult fetchDirect(RelayEnvelope envelope) throws IOException {
		logger.debug("Fetching {} {} directly", envelope.method(), envelope.url());
		try {
			return this.fetcher.fetch(envelope);
		}
		catch (InterruptedIOException ex) {
			throw ex;
		}
		catch (IOException ex) {
			throw new MirrorException(ErrorKind.NETWORK_ERROR,
					envelope.method() + " " + envelope.url() + " failed: " + ex.getMessage(), ex);
		}
	}

	private RelayResult escalate(RelayEnvelope envelope) throws IOException {
		logger.debug("Escalating {} {} as {}", envelope.method(), envelope.url(), envelope.id());
		try {
			return this.escalator.escalate(envelope, this.timeout).get();
		}
		catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new InterruptedIOException("Interrupted while waiting for relay " + envelope.id());
		}
		catch (ExecutionException ex) {
			Throwable cause = MirrorException.unwrap(ex);
			if (cause instanceof MirrorException mirror) {
				throw mirror;
			}
			throw new MirrorException(ErrorKind.NETWORK_ERROR,
					envelope.method() + " " + envelope.url() + " failed: " + cause.getMessage(), cause);
		}
	}

}
