package dev.mirror.transport.message;

/**
 * Summary of one sync run. Only used for reporting.
 * @param totalEntries files counted by the pre-flight walk
 * @param processed files that went through the consistency check
 * @param skipped files that were already consistent
 * @param updated files written to the destination
 * @param deleted destination entries removed by mirror cleanup
 * @param failed files whose transfer failed and was skipped
 */
public record SyncStats(int totalEntries, int processed, int skipped, int updated, int deleted, int failed) {

    public String summaryLine() {
        return "Synced %d files (%d updated, %d unchanged, %d removed, %d failed)"
            .formatted(processed, updated, skipped, deleted, failed);
    }
}
