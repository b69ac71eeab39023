package dev.mirror.worker.engine;

/**
 * Options of {@link VersioningEngine#checkout}.
 * @param force overwrite local modifications of the working tree
 */
public record CheckoutOptions(boolean force) {
}
