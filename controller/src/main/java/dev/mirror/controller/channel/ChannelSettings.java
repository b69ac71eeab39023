package dev.mirror.controller.channel;

import java.time.Duration;
import java.util.Objects;

/**
 * Timeouts of a {@link WorkerChannel}.
 * @param startupTimeout how long to wait for the worker's ready signal
 * @param callTimeout lifetime of a pending metadata call
 * @param bulkCallTimeout lifetime of a pending clone, pull, sync or wipe call
 */
public record ChannelSettings(Duration startupTimeout, Duration callTimeout, Duration bulkCallTimeout) {

    public ChannelSettings {
        Objects.requireNonNull(startupTimeout, "startupTimeout");
        Objects.requireNonNull(callTimeout, "callTimeout");
        Objects.requireNonNull(bulkCallTimeout, "bulkCallTimeout");
    }

    public static ChannelSettings defaults() {
        return new ChannelSettings(Duration.ofSeconds(10), Duration.ofSeconds(30), Duration.ofMinutes(5));
    }
}
