package dev.mirror.worker.sync;

/**
 * A source file and the destination path it mirrors to.
 * @param sourcePath absolute content store path
 * @param relativePath destination path relative to the destination root
 */
record TransferPair(String sourcePath, String relativePath) {
}
