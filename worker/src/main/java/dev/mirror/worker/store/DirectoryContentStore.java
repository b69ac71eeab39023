package dev.mirror.worker.store;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ContentStore} kept in a private directory of the local machine. Store paths map onto
 * that directory; a path can never resolve outside of it.
 */
public class DirectoryContentStore implements ContentStore {

	private static final Logger logger = LoggerFactory.getLogger(DirectoryContentStore.class);

	private final Path baseDirectory;

	/**
	 * Create a store rooted at the given directory, creating it when needed.
	 * @param baseDirectory directory that holds the store content
	 */
	public DirectoryContentStore(Path baseDirectory) {
		this.baseDirectory = ensureDirectory(baseDirectory.toAbsolutePath().normalize());
		logger.info("Using content store directory {}", this.baseDirectory);
	}

	/**
	 * Retrieve the directory this store lives in.
	 * @return absolute base directory
	 */
	public Path baseDirectory() {
		return this.baseDirectory;
	}

	@Override
	public byte[] readFile(String path) throws IOException {
		Path file = resolve(path);
		if (!Files.exists(file)) {
			throw new NoSuchFileException(path);
		}
		if (!Files.isRegularFile(file)) {
			throw new IOException("Target exists but is not a regular file: " + path);
		}
		return Files.readAllBytes(file);
	}

	@Override
	public void writeFile(String path, byte[] data) throws IOException {
		Path target = resolve(path);
		if (Files.isDirectory(target)) {
			throw new IOException("Target exists and is not a regular file: " + path);
		}
		Files.write(target, data, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
				StandardOpenOption.WRITE);
	}

	@Override
	public StoreStat stat(String path) throws IOException {
		Path target = resolve(path);
		if (!Files.exists(target)) {
			throw new NoSuchFileException(path);
		}
		BasicFileAttributes attributes = Files.readAttributes(target, BasicFileAttributes.class);
		return new StoreStat(path, attributes.isDirectory(), attributes.isDirectory() ? 0L : attributes.size(),
				attributes.lastModifiedTime().toInstant());
	}

	@Override
	public List<String> readdir(String path) throws IOException {
		Path directory = resolve(path);
		if (!Files.exists(directory)) {
			throw new NoSuchFileException(path);
		}
		if (!Files.isDirectory(directory)) {
			throw new NotDirectoryException(path);
		}
		List<String> names = new ArrayList<>();
		try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
			for (Path entry : entries) {
				names.add(entry.getFileName().toString());
			}
		}
		names.sort(String::compareTo);
		return names;
	}

	@Override
	public void mkdir(String path) throws IOException {
		Files.createDirectory(resolve(path));
	}

	@Override
	public void unlink(String path) throws IOException {
		Path target = resolve(path);
		if (Files.isDirectory(target)) {
			throw new IOException("Target is a directory: " + path);
		}
		Files.delete(target);
	}

	@Override
	public void rmdir(String path) throws IOException {
		Path target = resolve(path);
		if (target.equals(this.baseDirectory)) {
			throw new IOException("Refusing to remove the store root");
		}
		if (!Files.isDirectory(target)) {
			throw new NotDirectoryException(path);
		}
		try {
			Files.delete(target);
		}
		catch (DirectoryNotEmptyException ex) {
			throw new IOException("Directory not empty: " + path, ex);
		}
	}

	@Override
	public void wipe() throws IOException {
		Files.walkFileTree(this.baseDirectory, new SimpleFileVisitor<>() {
			@Override
			public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
				Files.delete(file);
				return FileVisitResult.CONTINUE;
			}

			@Override
			public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
				if (exc != null) {
					throw exc;
				}
				if (!dir.equals(baseDirectory)) {
					Files.delete(dir);
				}
				return FileVisitResult.CONTINUE;
			}
		});
		logger.info("Wiped content store {}", this.baseDirectory);
	}

	/**
	 * Resolve a store path against the base directory, preventing directory traversal.
	 * @param path absolute store path
	 * @return resolved path within the base directory
	 * @throws IOException when the path would escape the base directory
	 */
	Path resolve(String path) throws IOException {
		String relative = path == null ? "" : path.replace('\\', '/');
		while (relative.startsWith("/")) {
			relative = relative.substring(1);
		}
		Path candidate = this.baseDirectory.resolve(relative).normalize();
		if (!candidate.startsWith(this.baseDirectory)) {
			throw new IOException("Path escapes content store: " + path);
		}
		return candidate;
	}

	private static Path ensureDirectory(Path directory) {
		try {
			Files.createDirectories(directory);
			return directory;
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to prepare content store directory: " + directory, e);
		}
	}

}
