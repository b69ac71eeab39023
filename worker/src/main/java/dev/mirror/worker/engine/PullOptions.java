package dev.mirror.worker.engine;

import java.util.function.Consumer;

/**
 * Options of {@link VersioningEngine#pull}.
 * @param singleBranch fetch only the requested ref
 * @param proxy open relay endpoint prefixed to remote URLs, {@code null} for none
 * @param onMessage receives human readable engine messages
 */
public record PullOptions(boolean singleBranch, String proxy, Consumer<String> onMessage) {

	public PullOptions {
		onMessage = (onMessage != null) ? onMessage : message -> {
		};
	}

}
