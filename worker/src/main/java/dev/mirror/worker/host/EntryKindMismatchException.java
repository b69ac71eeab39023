package dev.mirror.worker.host;

import java.nio.file.FileSystemException;

/**
 * Raised when an entry exists with a different kind than the one requested, such as a file
 * where a directory was expected.
 */
public class EntryKindMismatchException extends FileSystemException {

	private final EntryKind expected;

	public EntryKindMismatchException(String path, EntryKind expected) {
		super(path, null, "Entry exists but is not a " + expected.name().toLowerCase());
		this.expected = expected;
	}

	public EntryKind expected() {
		return this.expected;
	}

}
