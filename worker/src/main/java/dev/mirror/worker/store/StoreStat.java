package dev.mirror.worker.store;

import java.time.Instant;

/**
 * Metadata of a content store entry.
 * @param path absolute store path
 * @param directory {@code true} for directories
 * @param size size in bytes, {@code 0} for directories
 * @param lastModified last modification time, when known
 */
public record StoreStat(String path, boolean directory, long size, Instant lastModified) {

	public boolean isFile() {
		return !this.directory;
	}

}
