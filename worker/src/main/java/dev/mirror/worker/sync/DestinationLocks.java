package dev.mirror.worker.sync;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Serializes sync runs whose destination trees overlap. A run on {@code /a} waits for a run on
 * {@code /a/b} and the other way round; runs on disjoint trees proceed in parallel.
 */
public final class DestinationLocks {

	private final Set<Path> active = new HashSet<>();

	/**
	 * Block until no active run overlaps the given root, then claim it.
	 * @param root destination root of the run
	 * @return lease that releases the claim when closed
	 * @throws InterruptedException when interrupted while waiting
	 */
	public synchronized Lease acquire(Path root) throws InterruptedException {
		Path normalized = root.toAbsolutePath().normalize();
		while (overlaps(normalized)) {
			wait();
		}
		this.active.add(normalized);
		return () -> release(normalized);
	}

	/**
	 * Number of runs currently holding a claim.
	 * @return active claim count
	 */
	public synchronized int activeCount() {
		return this.active.size();
	}

	private synchronized void release(Path root) {
		this.active.remove(root);
		notifyAll();
	}

	private boolean overlaps(Path root) {
		for (Path other : this.active) {
			if (other.startsWith(root) || root.startsWith(other)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Claim on a destination tree.
	 */
	public interface Lease extends AutoCloseable {

		@Override
		void close();

	}

}
