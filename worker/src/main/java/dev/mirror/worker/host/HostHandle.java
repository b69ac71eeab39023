package dev.mirror.worker.host;

import java.nio.file.Path;

/**
 * Handle on one entry of the destination tree, obtained through
 * {@link HostFileSystem#resolve(String, ResolveOptions)}.
 */
public abstract class HostHandle {

	private final Path location;

	private final String relativePath;

	HostHandle(Path location, String relativePath) {
		this.location = location;
		this.relativePath = relativePath;
	}

	/**
	 * Retrieve the entry name, empty for the destination root.
	 * @return last path segment
	 */
	public String name() {
		int slash = this.relativePath.lastIndexOf('/');
		return slash < 0 ? this.relativePath : this.relativePath.substring(slash + 1);
	}

	/**
	 * Retrieve the slash-delimited path relative to the destination root.
	 * @return relative path, empty for the root
	 */
	public String relativePath() {
		return this.relativePath;
	}

	/**
	 * Kind of the entry this handle points to.
	 * @return entry kind
	 */
	public abstract EntryKind kind();

	Path location() {
		return this.location;
	}

	String childPath(String name) {
		return this.relativePath.isEmpty() ? name : this.relativePath + "/" + name;
	}

	@Override
	public String toString() {
		return kind().name().toLowerCase() + ":" + (this.relativePath.isEmpty() ? "/" : this.relativePath);
	}

}
