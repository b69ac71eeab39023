package dev.mirror.worker.store;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.List;

/**
 * Byte-oriented filesystem owned by the worker. Paths are absolute and slash-delimited, such as
 * {@code /repo/src/Main.java}. This is the interface the versioning engine works against.
 */
public interface ContentStore {

	/**
	 * Read a whole file.
	 * @param path absolute store path
	 * @return file content
	 * @throws NoSuchFileException when the file does not exist
	 * @throws IOException when the entry is not a file or cannot be read
	 */
	byte[] readFile(String path) throws IOException;

	/**
	 * Create or truncate a file and write the given content. Parent directories must exist.
	 * @param path absolute store path
	 * @param data content to write
	 * @throws IOException when the write fails
	 */
	void writeFile(String path, byte[] data) throws IOException;

	/**
	 * Describe an entry.
	 * @param path absolute store path
	 * @return entry metadata
	 * @throws NoSuchFileException when nothing exists at the path
	 */
	StoreStat stat(String path) throws IOException;

	/**
	 * List the names inside a directory, sorted.
	 * @param path absolute store path of a directory
	 * @return entry names
	 * @throws IOException when the directory cannot be listed
	 */
	List<String> readdir(String path) throws IOException;

	/**
	 * Create a single directory.
	 * @param path absolute store path
	 * @throws java.nio.file.FileAlreadyExistsException when the entry already exists
	 * @throws IOException when the directory cannot be created
	 */
	void mkdir(String path) throws IOException;

	/**
	 * Delete a file.
	 * @param path absolute store path
	 * @throws IOException when the file cannot be removed
	 */
	void unlink(String path) throws IOException;

	/**
	 * Delete an empty directory.
	 * @param path absolute store path
	 * @throws IOException when the directory is missing, not empty, or cannot be removed
	 */
	void rmdir(String path) throws IOException;

	/**
	 * Remove everything the store holds.
	 * @throws IOException when the store cannot be cleared
	 */
	void wipe() throws IOException;

	/**
	 * Determine whether an entry exists.
	 * @param path absolute store path
	 * @return {@code true} when {@link #stat(String)} would succeed
	 */
	default boolean exists(String path) {
		try {
			stat(path);
			return true;
		}
		catch (IOException ex) {
			return false;
		}
	}

}
