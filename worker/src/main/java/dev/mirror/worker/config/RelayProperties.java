package dev.mirror.worker.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings deciding how the worker reaches the network.
 */
@ConfigurationProperties(prefix = "mirror.relay")
public class RelayProperties {

	/**
	 * Origin the worker runs under. Requests to this origin are issued directly.
	 */
	private String origin = "http://localhost:7071";

	/**
	 * Open relay endpoint. Requests already addressed to it are issued directly.
	 */
	private String corsProxy = "https://cors.isomorphic-git.org";

	/**
	 * How long the worker waits for an escalated request to come back.
	 */
	private Duration timeout = Duration.ofSeconds(65);

	/**
	 * Connect timeout of direct network calls.
	 */
	private Duration connectTimeout = Duration.ofSeconds(10);

	public String getOrigin() {
		return this.origin;
	}

	public void setOrigin(String origin) {
		this.origin = origin;
	}

	public String getCorsProxy() {
		return this.corsProxy;
	}

	public void setCorsProxy(String corsProxy) {
		this.corsProxy = corsProxy;
	}

	public Duration getTimeout() {
		return this.timeout;
	}

	public void setTimeout(Duration timeout) {
		this.timeout = timeout;
	}

	public Duration getConnectTimeout() {
		return this.connectTimeout;
	}

	public void setConnectTimeout(Duration connectTimeout) {
		this.connectTimeout = connectTimeout;
	}

}
