package dev.mirror.worker.host;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Handle on a regular file of the destination tree.
 */
public final class FileHandle extends HostHandle {

	FileHandle(Path location, String relativePath) {
		super(location, relativePath);
	}

	@Override
	public EntryKind kind() {
		return EntryKind.FILE;
	}

	/**
	 * Read the whole file.
	 * @return file content
	 * @throws IOException when the file cannot be read
	 */
	public byte[] read() throws IOException {
		return Files.readAllBytes(location());
	}

	/**
	 * Open the file for streaming reads. The caller closes the stream.
	 * @return input stream over the file content
	 * @throws IOException when the file cannot be opened
	 */
	public InputStream open() throws IOException {
		return Files.newInputStream(location());
	}

	/**
	 * Current size of the file.
	 * @return size in bytes
	 * @throws IOException when the size cannot be read
	 */
	public long size() throws IOException {
		return Files.size(location());
	}

	/**
	 * Replace the file content. Bytes are written to a sibling temporary file that is then moved
	 * over the target, so readers never observe a half-written file.
	 * @param data new content
	 * @throws IOException when the write fails
	 */
	public void write(byte[] data) throws IOException {
		Path target = location();
		Path temp = target.resolveSibling("." + target.getFileName() + ".mirror-tmp");
		try {
			Files.write(temp, data);
			try {
				Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			}
			catch (AtomicMoveNotSupportedException ignored) {
				Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
			}
		}
		finally {
			Files.deleteIfExists(temp);
		}
	}

}
