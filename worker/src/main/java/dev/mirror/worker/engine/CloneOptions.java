package dev.mirror.worker.engine;

import java.util.function.Consumer;

/**
 * Options of {@link VersioningEngine#clone}.
 * @param singleBranch fetch only the requested ref
 * @param depth history depth, {@code 0} for full history
 * @param noCheckout leave the working tree empty
 * @param proxy open relay endpoint prefixed to remote URLs, {@code null} for none
 * @param onMessage receives human readable engine messages
 */
public record CloneOptions(boolean singleBranch, int depth, boolean noCheckout, String proxy,
		Consumer<String> onMessage) {

	public CloneOptions {
		onMessage = (onMessage != null) ? onMessage : message -> {
		};
	}

}
