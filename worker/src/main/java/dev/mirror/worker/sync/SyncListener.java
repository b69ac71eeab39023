package dev.mirror.worker.sync;

import dev.mirror.transport.message.ProgressEvent;

/**
 * Receives one event per processed file. Events may arrive on transfer threads, but never
 * concurrently, and {@code current} increases by one with each event.
 */
@FunctionalInterface
public interface SyncListener {

	SyncListener NONE = progress -> {
	};

	void onProgress(ProgressEvent.SyncProgress progress);

}
