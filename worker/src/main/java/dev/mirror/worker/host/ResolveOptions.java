package dev.mirror.worker.host;

/**
 * How {@link HostFileSystem#resolve(String, ResolveOptions)} treats missing entries and which kind
 * of handle it hands back.
 * @param create {@code true} to create missing intermediate directories and the final entry
 * @param kind requested kind of the final entry, {@code null} to accept whichever exists
 */
public record ResolveOptions(boolean create, EntryKind kind) {

	public static ResolveOptions lookup() {
		return new ResolveOptions(false, null);
	}

	public static ResolveOptions file() {
		return new ResolveOptions(false, EntryKind.FILE);
	}

	public static ResolveOptions directory() {
		return new ResolveOptions(false, EntryKind.DIRECTORY);
	}

	public static ResolveOptions createFile() {
		return new ResolveOptions(true, EntryKind.FILE);
	}

	public static ResolveOptions createDirectory() {
		return new ResolveOptions(true, EntryKind.DIRECTORY);
	}

}
