package dev.mirror.worker.host;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapter over a destination directory the user granted access to. All destination paths are
 * slash-delimited and relative to that root; this class is the only place they are turned into
 * handles. Each instance is bound to one root, so several destinations can be served side by
 * side.
 * <p>Symbolic links under the root are never followed. A link is reported as a file by
 * {@link #stat(String)} and counts as an entry of the wrong kind when a file or directory is
 * requested, so writers replace the link itself instead of reaching through it.
 */
public class HostFileSystem {

	private static final Logger logger = LoggerFactory.getLogger(HostFileSystem.class);

	private final Path root;

	/**
	 * Bind an adapter to an existing directory.
	 * @param root granted destination directory
	 * @throws NoSuchFileException when the directory does not exist
	 * @throws NotDirectoryException when the path is not a directory
	 */
	public HostFileSystem(Path root) throws IOException {
		Path normalized = root.toAbsolutePath().normalize();
		if (!Files.exists(normalized)) {
			throw new NoSuchFileException(normalized.toString());
		}
		if (!Files.isDirectory(normalized)) {
			throw new NotDirectoryException(normalized.toString());
		}
		this.root = normalized;
	}

	/**
	 * Retrieve the destination root directory.
	 * @return absolute, normalized root
	 */
	public Path root() {
		return this.root;
	}

	/**
	 * Resolve a relative path into a handle, walking from the root one segment at a time.
	 * Intermediate segments must be directories; with {@code create} set, missing ones are
	 * created. The final segment yields a file or directory handle according to
	 * {@link ResolveOptions#kind()}; when no kind is given a file is tried first, then a
	 * directory, and nothing is created.
	 * @param relativePath slash-delimited path, empty or {@code "."} for the root
	 * @param options creation flag and requested kind
	 * @return handle on the resolved entry
	 * @throws NoSuchFileException when an entry is missing and may not be created
	 * @throws EntryKindMismatchException when an entry exists with the wrong kind
	 * @throws IOException when the path escapes the root or the filesystem fails
	 */
	public HostHandle resolve(String relativePath, ResolveOptions options) throws IOException {
		List<String> parts = split(relativePath);
		DirectoryHandle current = new DirectoryHandle(this.root, "");
		if (parts.isEmpty()) {
			if (options.kind() == EntryKind.FILE) {
				throw new EntryKindMismatchException("/", EntryKind.FILE);
			}
			return current;
		}
		for (int i = 0; i < parts.size() - 1; i++) {
			current = directoryChild(current, parts.get(i), options.create());
		}
		String last = parts.get(parts.size() - 1);
		if (options.kind() == EntryKind.FILE) {
			return fileChild(current, last, options.create());
		}
		if (options.kind() == EntryKind.DIRECTORY) {
			return directoryChild(current, last, options.create());
		}
		Path candidate = current.location().resolve(last);
		if (Files.isRegularFile(candidate, LinkOption.NOFOLLOW_LINKS) || Files.isSymbolicLink(candidate)) {
			return new FileHandle(candidate, current.childPath(last));
		}
		return directoryChild(current, last, false);
	}

	/**
	 * Read a whole destination file.
	 * @param relativePath path of the file
	 * @return file content
	 * @throws IOException when the file is missing or unreadable
	 */
	public byte[] readFile(String relativePath) throws IOException {
		return ((FileHandle) resolve(relativePath, ResolveOptions.file())).read();
	}

	/**
	 * Create or truncate a destination file, creating parent directories as needed.
	 * @param relativePath path of the file
	 * @param data content to write
	 * @throws IOException when the write fails
	 */
	public void writeFile(String relativePath, byte[] data) throws IOException {
		((FileHandle) resolve(relativePath, ResolveOptions.createFile())).write(data);
	}

	/**
	 * Create a directory and any missing parents.
	 * @param relativePath path of the directory
	 * @return handle on the directory
	 * @throws IOException when the directory cannot be created
	 */
	public DirectoryHandle mkdir(String relativePath) throws IOException {
		return (DirectoryHandle) resolve(relativePath, ResolveOptions.createDirectory());
	}

	/**
	 * Describe a destination entry.
	 * @param relativePath path of the entry
	 * @return entry metadata
	 * @throws NoSuchFileException when nothing exists at the path
	 */
	public HostStat stat(String relativePath) throws IOException {
		HostHandle handle;
		try {
			handle = resolve(relativePath, ResolveOptions.lookup());
		}
		catch (EntryKindMismatchException ex) {
			// a file in the middle of the path means the entry cannot exist
			throw new NoSuchFileException(relativePath);
		}
		BasicFileAttributes attributes = Files.readAttributes(handle.location(), BasicFileAttributes.class,
				LinkOption.NOFOLLOW_LINKS);
		return new HostStat(handle.relativePath(), handle.kind(), attributes.isDirectory() ? 0L : attributes.size(),
				attributes.lastModifiedTime().toInstant());
	}

	/**
	 * Determine whether an entry exists at the given path.
	 * @param relativePath path of the entry
	 * @return {@code true} when the entry exists
	 */
	public boolean exists(String relativePath) {
		try {
			stat(relativePath);
			return true;
		}
		catch (IOException ex) {
			return false;
		}
	}

	/**
	 * List the names inside a destination directory.
	 * @param relativePath path of the directory
	 * @return sorted entry names
	 * @throws IOException when the directory is missing or unreadable
	 */
	public List<String> readdir(String relativePath) throws IOException {
		return ((DirectoryHandle) resolve(relativePath, ResolveOptions.directory())).entries();
	}

	/**
	 * Delete a destination file.
	 * @param relativePath path of the file
	 * @throws IOException when the file is missing or cannot be removed
	 */
	public void unlink(String relativePath) throws IOException {
		remove(relativePath, false);
	}

	/**
	 * Delete a destination directory.
	 * @param relativePath path of the directory
	 * @param recursive {@code true} to remove the directory content as well
	 * @throws IOException when the directory is missing or cannot be removed
	 */
	public void rmdir(String relativePath, boolean recursive) throws IOException {
		remove(relativePath, recursive);
	}

	private void remove(String relativePath, boolean recursive) throws IOException {
		List<String> parts = split(relativePath);
		if (parts.isEmpty()) {
			throw new IOException("Refusing to remove the destination root");
		}
		String parentPath = String.join("/", parts.subList(0, parts.size() - 1));
		DirectoryHandle parent = (DirectoryHandle) resolve(parentPath, ResolveOptions.directory());
		parent.removeEntry(parts.get(parts.size() - 1), recursive);
	}

	private DirectoryHandle directoryChild(DirectoryHandle parent, String name, boolean create) throws IOException {
		Path child = parent.location().resolve(name);
		String childPath = parent.childPath(name);
		if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
			return new DirectoryHandle(child, childPath);
		}
		if (Files.exists(child, LinkOption.NOFOLLOW_LINKS)) {
			throw new EntryKindMismatchException(childPath, EntryKind.DIRECTORY);
		}
		if (!create) {
			throw new NoSuchFileException(childPath);
		}
		try {
			Files.createDirectory(child);
			logger.debug("Created directory {}", childPath);
		}
		catch (FileAlreadyExistsException ex) {
			// another writer got there first
			if (!Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
				throw new EntryKindMismatchException(childPath, EntryKind.DIRECTORY);
			}
		}
		return new DirectoryHandle(child, childPath);
	}

	private FileHandle fileChild(DirectoryHandle parent, String name, boolean create) throws IOException {
		Path child = parent.location().resolve(name);
		String childPath = parent.childPath(name);
		if (Files.isRegularFile(child, LinkOption.NOFOLLOW_LINKS)) {
			return new FileHandle(child, childPath);
		}
		if (Files.exists(child, LinkOption.NOFOLLOW_LINKS)) {
			throw new EntryKindMismatchException(childPath, EntryKind.FILE);
		}
		if (!create) {
			throw new NoSuchFileException(childPath);
		}
		try {
			Files.createFile(child);
		}
		catch (FileAlreadyExistsException ex) {
			if (!Files.isRegularFile(child, LinkOption.NOFOLLOW_LINKS)) {
				throw new EntryKindMismatchException(childPath, EntryKind.FILE);
			}
		}
		return new FileHandle(child, childPath);
	}

	/**
	 * Split a relative path into segments, rejecting any that would leave the root.
	 * @param relativePath slash or backslash delimited path
	 * @return non-empty segments in order
	 * @throws IOException when a segment is {@code ..}
	 */
	static List<String> split(String relativePath) throws IOException {
		List<String> parts = new ArrayList<>();
		if (relativePath == null) {
			return parts;
		}
		for (String part : relativePath.replace('\\', '/').split("/")) {
			if (part.isEmpty() || ".".equals(part)) {
				continue;
			}
			if ("..".equals(part)) {
				throw new IOException("Path escapes destination root: " + relativePath);
			}
			parts.add(part);
		}
		return parts;
	}

}
