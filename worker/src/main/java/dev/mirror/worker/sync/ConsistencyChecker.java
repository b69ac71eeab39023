package dev.mirror.worker.sync;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.mirror.worker.host.EntryKindMismatchException;
import dev.mirror.worker.host.FileHandle;
import dev.mirror.worker.host.HostFileSystem;
import dev.mirror.worker.host.ResolveOptions;
import dev.mirror.worker.store.ContentStore;

/**
 * Decides whether a destination file already matches its source, using the cheapest test that
 * settles the question: existence, then size, then a direct byte comparison for small files or a
 * SHA-256 digest comparison for large ones.
 */
public class ConsistencyChecker {

	private static final Logger logger = LoggerFactory.getLogger(ConsistencyChecker.class);

	/**
	 * Files strictly smaller than this are compared byte by byte.
	 */
	public static final int DEFAULT_DIRECT_COMPARE_THRESHOLD = 10 * 1024;

	private static final int DIGEST_BUFFER_SIZE = 64 * 1024;

	private final int directCompareThreshold;

	public ConsistencyChecker() {
		this(DEFAULT_DIRECT_COMPARE_THRESHOLD);
	}

	/**
	 * Create a checker with a custom byte-comparison threshold.
	 * @param directCompareThreshold size in bytes below which files are compared directly
	 */
	public ConsistencyChecker(int directCompareThreshold) {
		if (directCompareThreshold < 0) {
			throw new IllegalArgumentException("directCompareThreshold must be >= 0");
		}
		this.directCompareThreshold = directCompareThreshold;
	}

	/**
	 * Compare a content store file with a destination file.
	 * <p>
	 * A source that cannot be read is reported as consistent, there is nothing to write. Any
	 * failure while probing the destination is reported as inconsistent, which forces a rewrite.
	 * @param store content store holding the source
	 * @param sourcePath absolute store path of the source file
	 * @param destination destination adapter
	 * @param destRelativePath destination path relative to its root
	 * @return the decision, carrying the source bytes when a write is needed
	 */
	public ConsistencyResult check(ContentStore store, String sourcePath, HostFileSystem destination,
			String destRelativePath) {
		byte[] source;
		try {
			source = store.readFile(sourcePath);
		}
		catch (IOException ex) {
			logger.warn("Cannot read source {}, leaving destination untouched", sourcePath, ex);
			return ConsistencyResult.upToDate();
		}

		try {
			FileHandle target;
			try {
				target = (FileHandle) destination.resolve(destRelativePath, ResolveOptions.file());
			}
			catch (NoSuchFileException | EntryKindMismatchException ex) {
				return ConsistencyResult.stale(source);
			}
			if (target.size() != source.length) {
				return ConsistencyResult.stale(source);
			}
			boolean equal = source.length < this.directCompareThreshold ? bytesEqual(source, target)
					: digestsEqual(source, target);
			return equal ? ConsistencyResult.upToDate() : ConsistencyResult.stale(source);
		}
		catch (IOException | RuntimeException ex) {
			logger.debug("Consistency probe failed for {}, forcing rewrite", destRelativePath, ex);
			return ConsistencyResult.stale(source);
		}
	}

	private boolean bytesEqual(byte[] source, FileHandle target) throws IOException {
		byte[] existing = target.read();
		if (existing.length != source.length) {
			return false;
		}
		for (int i = 0; i < source.length; i++) {
			if (existing[i] != source[i]) {
				return false;
			}
		}
		return true;
	}

	private boolean digestsEqual(byte[] source, FileHandle target) throws IOException {
		MessageDigest digest = sha256();
		byte[] sourceDigest = digest.digest(source);
		digest.reset();
		try (InputStream in = target.open()) {
			byte[] buffer = new byte[DIGEST_BUFFER_SIZE];
			int read;
			while ((read = in.read(buffer)) != -1) {
				digest.update(buffer, 0, read);
			}
		}
		return MessageDigest.isEqual(sourceDigest, digest.digest());
	}

	private static MessageDigest sha256() {
		try {
			return MessageDigest.getInstance("SHA-256");
		}
		catch (NoSuchAlgorithmException ex) {
			throw new IllegalStateException("SHA-256 not available", ex);
		}
	}

}
