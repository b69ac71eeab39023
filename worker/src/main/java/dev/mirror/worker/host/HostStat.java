package dev.mirror.worker.host;

import java.time.Instant;

/**
 * Metadata of a destination entry.
 * @param path path relative to the destination root
 * @param kind entry kind
 * @param size size in bytes, {@code 0} for directories
 * @param lastModified last modification timestamp
 */
public record HostStat(String path, EntryKind kind, long size, Instant lastModified) {
}
