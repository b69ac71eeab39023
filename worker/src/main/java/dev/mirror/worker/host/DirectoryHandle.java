package dev.mirror.worker.host;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle on a directory of the destination tree.
 */
public final class DirectoryHandle extends HostHandle {

	private static final Logger logger = LoggerFactory.getLogger(DirectoryHandle.class);

	DirectoryHandle(Path location, String relativePath) {
		super(location, relativePath);
	}

	@Override
	public EntryKind kind() {
		return EntryKind.DIRECTORY;
	}

	/**
	 * List the names of the entries inside this directory, sorted.
	 * @return entry names
	 * @throws IOException when the directory cannot be listed
	 */
	public List<String> entries() throws IOException {
		List<String> names = new ArrayList<>();
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(location())) {
			for (Path entry : stream) {
				names.add(entry.getFileName().toString());
			}
		}
		names.sort(String::compareTo);
		return names;
	}

	/**
	 * Remove a direct child of this directory. A recursive removal keeps going past entries it
	 * fails to delete, logging each one, and only reports failure when the child itself is left
	 * behind.
	 * @param name child entry name
	 * @param recursive {@code true} to remove a non-empty directory with its content
	 * @throws NoSuchFileException when the child does not exist
	 * @throws IOException when the child could not be removed
	 */
	public void removeEntry(String name, boolean recursive) throws IOException {
		Path child = location().resolve(name);
		if (!Files.exists(child, LinkOption.NOFOLLOW_LINKS)) {
			throw new NoSuchFileException(childPath(name));
		}
		if (recursive && Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
			int failures = deleteContents(child);
			if (failures > 0) {
				logger.warn("{} entries under {} could not be removed", failures, childPath(name));
			}
		}
		Files.delete(child);
		logger.debug("Removed {}", childPath(name));
	}

	private int deleteContents(Path directory) {
		int failures = 0;
		List<Path> children = new ArrayList<>();
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
			stream.forEach(children::add);
		}
		catch (IOException ex) {
			logger.warn("Unable to list {} for removal", directory, ex);
			return 1;
		}
		for (Path child : children) {
			if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
				failures += deleteContents(child);
			}
			try {
				Files.delete(child);
			}
			catch (IOException ex) {
				logger.warn("Unable to remove {}", child, ex);
				failures++;
			}
		}
		return failures;
	}

}
