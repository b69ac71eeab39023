package dev.mirror.worker.sync;

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.mirror.transport.message.ProgressEvent;
import dev.mirror.transport.message.SyncStats;
import dev.mirror.worker.host.EntryKind;
import dev.mirror.worker.host.EntryKindMismatchException;
import dev.mirror.worker.host.HostFileSystem;
import dev.mirror.worker.host.HostStat;
import dev.mirror.worker.store.ContentStore;
import dev.mirror.worker.store.StoreStat;

/**
 * Mirrors a content store subtree onto a destination tree.
 * <p>
 * A run counts the source files, walks the source creating destination directories up front,
 * then transfers files in fixed-size batches: the files of one batch are checked and written
 * concurrently and the next batch starts once the whole batch is done. Only files the
 * {@link ConsistencyChecker} reports as inconsistent are written. When the run covers the whole
 * repository, destination entries without a source counterpart are removed afterwards, making
 * the destination an exact mirror. Version metadata directories ({@code .git}) are neither
 * copied nor cleaned.
 * <p>
 * Runs on overlapping destination trees are serialized through {@link DestinationLocks}.
 */
public class SyncEngine implements Closeable {

	private static final Logger logger = LoggerFactory.getLogger(SyncEngine.class);

	public static final int DEFAULT_BATCH_SIZE = 10;

	static final String METADATA_DIR = ".git";

	private final ConsistencyChecker checker;

	private final int batchSize;

	private final ExecutorService transferExecutor;

	private final DestinationLocks locks;

	public SyncEngine(ConsistencyChecker checker) {
		this(checker, DEFAULT_BATCH_SIZE, new DestinationLocks());
	}

	/**
	 * Create an engine.
	 * @param checker consistency checker deciding which files to write
	 * @param batchSize number of files transferred concurrently
	 * @param locks registry serializing runs on overlapping destinations
	 */
	public SyncEngine(ConsistencyChecker checker, int batchSize, DestinationLocks locks) {
		if (batchSize < 1) {
			throw new IllegalArgumentException("batchSize must be >= 1");
		}
		this.checker = checker;
		this.batchSize = batchSize;
		this.locks = locks;
		AtomicInteger threadCounter = new AtomicInteger();
		this.transferExecutor = Executors.newFixedThreadPool(batchSize, r -> {
			Thread t = new Thread(r, "sync-transfer-" + threadCounter.incrementAndGet());
			t.setDaemon(true);
			return t;
		});
	}

	/**
	 * Mirror {@code sourcePath} onto the destination.
	 * @param store content store holding the source
	 * @param repositoryRoot store path of the repository root, destination paths are relative to it
	 * @param sourcePath store path to sync, the repository root or anything below it
	 * @param destination destination adapter
	 * @param listener receives one event per processed file
	 * @return statistics of the run
	 * @throws NoSuchFileException when the source path does not exist
	 * @throws IOException when the source cannot be walked, which aborts the run
	 */
	public SyncStats sync(ContentStore store, String repositoryRoot, String sourcePath, HostFileSystem destination,
			SyncListener listener) throws IOException {
		String root = trimTrailingSlash(repositoryRoot);
		String source = trimTrailingSlash(sourcePath);
		String relativeRoot = relativize(root, source);
		boolean fullMirror = relativeRoot.isEmpty();

		DestinationLocks.Lease lease;
		try {
			lease = this.locks.acquire(destination.root());
		}
		catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new InterruptedIOException("Interrupted while waiting for destination " + destination.root());
		}
		try (lease) {
			StoreStat sourceStat = store.stat(source);
			int total = sourceStat.directory() ? countFiles(store, source) : 1;
			logger.info("Syncing {} ({} files) to {}", source, total, destination.root());

			List<TransferPair> pairs = new ArrayList<>(total);
			if (sourceStat.directory()) {
				collect(store, source, relativeRoot, destination, pairs);
			}
			else {
				ensureParent(destination, relativeRoot);
				pairs.add(new TransferPair(source, relativeRoot));
			}

			RunState state = new RunState(total, listener);
			for (int start = 0; start < pairs.size(); start += this.batchSize) {
				List<TransferPair> batch = pairs.subList(start, Math.min(start + this.batchSize, pairs.size()));
				List<CompletableFuture<Void>> transfers = new ArrayList<>(batch.size());
				for (TransferPair pair : batch) {
					transfers.add(CompletableFuture.runAsync(() -> transfer(store, destination, pair, state),
							this.transferExecutor));
				}
				CompletableFuture.allOf(transfers.toArray(new CompletableFuture[0])).join();
			}

			int deleted = 0;
			if (fullMirror) {
				deleted = cleanup(store, root, destination, "");
			}
			SyncStats stats = new SyncStats(total, state.processed, state.skipped, state.updated, deleted,
					state.failed);
			logger.info("{} into {}", stats.summaryLine(), destination.root());
			return stats;
		}
	}

	private int countFiles(ContentStore store, String directory) throws IOException {
		int count = 0;
		for (String name : store.readdir(directory)) {
			if (METADATA_DIR.equals(name)) {
				continue;
			}
			String child = directory + "/" + name;
			if (store.stat(child).directory()) {
				count += countFiles(store, child);
			}
			else {
				count++;
			}
		}
		return count;
	}

	private void collect(ContentStore store, String directory, String relative, HostFileSystem destination,
			List<TransferPair> pairs) throws IOException {
		if (!relative.isEmpty()) {
			ensureDirectory(destination, relative);
		}
		for (String name : store.readdir(directory)) {
			if (METADATA_DIR.equals(name)) {
				continue;
			}
			String child = directory + "/" + name;
			String childRelative = relative.isEmpty() ? name : relative + "/" + name;
			if (store.stat(child).directory()) {
				collect(store, child, childRelative, destination, pairs);
			}
			else {
				pairs.add(new TransferPair(child, childRelative));
			}
		}
	}

	private void ensureParent(HostFileSystem destination, String relative) {
		int slash = relative.lastIndexOf('/');
		if (slash > 0) {
			ensureDirectory(destination, relative.substring(0, slash));
		}
	}

	private void ensureDirectory(HostFileSystem destination, String relative) {
		try {
			destination.mkdir(relative);
		}
		catch (EntryKindMismatchException ex) {
			// a file sits where the source has a directory
			try {
				destination.unlink(ex.getFile());
				destination.mkdir(relative);
			}
			catch (IOException retry) {
				logger.warn("Unable to replace {} with a directory", ex.getFile(), retry);
			}
		}
		catch (IOException ex) {
			logger.warn("Unable to create destination directory {}", relative, ex);
		}
	}

	private void transfer(ContentStore store, HostFileSystem destination, TransferPair pair, RunState state) {
		ConsistencyResult result = this.checker.check(store, pair.sourcePath(), destination, pair.relativePath());
		if (result.consistent()) {
			state.record(pair.relativePath(), Outcome.SKIPPED);
			return;
		}
		try {
			write(destination, pair.relativePath(), result.sourceBytes());
			state.record(pair.relativePath(), Outcome.UPDATED);
		}
		catch (IOException | RuntimeException ex) {
			logger.error("Failed to write {}", pair.relativePath(), ex);
			state.record(pair.relativePath(), Outcome.FAILED);
		}
	}

	private void write(HostFileSystem destination, String relative, byte[] data) throws IOException {
		try {
			destination.writeFile(relative, data);
		}
		catch (EntryKindMismatchException ex) {
			// the destination holds the other kind of entry somewhere on the path
			if (ex.expected() == EntryKind.FILE) {
				destination.rmdir(ex.getFile(), true);
			}
			else {
				destination.unlink(ex.getFile());
			}
			destination.writeFile(relative, data);
		}
	}

	private int cleanup(ContentStore store, String repositoryRoot, HostFileSystem destination, String relative) {
		List<String> names;
		try {
			names = destination.readdir(relative);
		}
		catch (IOException ex) {
			logger.warn("Unable to list destination directory {} for cleanup", relative, ex);
			return 0;
		}
		int deleted = 0;
		for (String name : names) {
			if (METADATA_DIR.equals(name)) {
				continue;
			}
			String childRelative = relative.isEmpty() ? name : relative + "/" + name;
			String sourceChild = repositoryRoot + "/" + childRelative;
			try {
				HostStat stat = destination.stat(childRelative);
				if (!store.exists(sourceChild)) {
					if (stat.kind() == EntryKind.DIRECTORY) {
						destination.rmdir(childRelative, true);
					}
					else {
						destination.unlink(childRelative);
					}
					logger.debug("Removed {} from destination, absent from source", childRelative);
					deleted++;
				}
				else if (stat.kind() == EntryKind.DIRECTORY) {
					deleted += cleanup(store, repositoryRoot, destination, childRelative);
				}
			}
			catch (IOException ex) {
				logger.warn("Unable to clean up destination entry {}", childRelative, ex);
			}
		}
		return deleted;
	}

	/**
	 * Path of {@code path} relative to {@code root}, without leading slashes.
	 * @param root repository root store path
	 * @param path store path at or below the root
	 * @return relative destination path, empty for the root itself
	 */
	static String relativize(String root, String path) {
		String relative = path.startsWith(root + "/") || path.equals(root) ? path.substring(root.length()) : path;
		while (relative.startsWith("/")) {
			relative = relative.substring(1);
		}
		return relative;
	}

	private static String trimTrailingSlash(String path) {
		String trimmed = path == null || path.isBlank() ? "/" : path;
		while (trimmed.length() > 1 && trimmed.endsWith("/")) {
			trimmed = trimmed.substring(0, trimmed.length() - 1);
		}
		return trimmed;
	}

	@Override
	public void close() {
		this.transferExecutor.shutdown();
		try {
			if (!this.transferExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
				this.transferExecutor.shutdownNow();
			}
		}
		catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			this.transferExecutor.shutdownNow();
		}
	}

	private enum Outcome {

		SKIPPED, UPDATED, FAILED

	}

	/**
	 * Counters of one run. Updated and published under the instance lock so events go out in
	 * the order the counters moved.
	 */
	private static final class RunState {

		private final int total;

		private final SyncListener listener;

		private int processed;

		private int skipped;

		private int updated;

		private int failed;

		RunState(int total, SyncListener listener) {
			this.total = total;
			this.listener = listener == null ? SyncListener.NONE : listener;
		}

		synchronized void record(String path, Outcome outcome) {
			this.processed++;
			switch (outcome) {
				case SKIPPED -> this.skipped++;
				case UPDATED -> this.updated++;
				case FAILED -> this.failed++;
			}
			try {
				this.listener.onProgress(new ProgressEvent.SyncProgress(this.processed, this.total, path,
						this.skipped, this.updated));
			}
			catch (RuntimeException ex) {
				logger.warn("Sync progress listener failed", ex);
			}
		}

	}

}
