package dev.mirror.transport.message;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Intermediate output of a running request. Callers may see the same line twice.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(ProgressEvent.Message.class),
    @JsonSubTypes.Type(ProgressEvent.SyncProgress.class)
})
public interface ProgressEvent {

    @JsonTypeName("message")
    record Message(String text) implements ProgressEvent {
    }

    /**
     * Emitted once per processed file during a sync run.
     * @param current files processed so far, including this one
     * @param total files counted by the pre-flight walk
     * @param path relative destination path of the file
     * @param skipped files found consistent so far
     * @param updated files written so far
     */
    @JsonTypeName("sync")
    record SyncProgress(int current, int total, String path, int skipped, int updated) implements ProgressEvent {

        public int percent() {
            return total <= 0 ? 100 : Math.min(100, (int) Math.round(current * 100.0 / total));
        }
    }
}
