package dev.mirror.worker.engine;

import dev.mirror.transport.ErrorKind;
import dev.mirror.transport.MirrorException;

/**
 * Placeholder used when no engine bean is provided. Every operation fails with a descriptive
 * message so the controller sees a regular error response.
 */
public class UnsupportedVersioningEngine implements VersioningEngine {

	@Override
	public void clone(EngineContext context, String url, String ref, CloneOptions options) {
		throw unsupported("clone");
	}

	@Override
	public void checkout(EngineContext context, String ref, CheckoutOptions options) {
		throw unsupported("checkout");
	}

	@Override
	public void pull(EngineContext context, String url, String ref, PullOptions options) {
		throw unsupported("pull");
	}

	private static MirrorException unsupported(String operation) {
		return new MirrorException(ErrorKind.FAILED,
				"No versioning engine configured, cannot " + operation + " (provide a VersioningEngine bean)");
	}

}
