package dev.mirror.worker.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectoryContentStoreTest {

	@TempDir
	Path baseDirectory;

	private DirectoryContentStore store;

	@BeforeEach
	void setUp() {
		this.store = new DirectoryContentStore(this.baseDirectory);
	}

	@Test
	void storePathsMapOntoBaseDirectory() throws IOException {
		this.store.mkdir("/repo");
		this.store.writeFile("/repo/a.txt", "hello".getBytes(StandardCharsets.UTF_8));

		assertThat(this.baseDirectory.resolve("repo/a.txt")).hasContent("hello");
		assertThat(this.store.stat("/repo/a.txt").size()).isEqualTo(5);
		assertThat(this.store.stat("/repo").directory()).isTrue();
		assertThat(this.store.readdir("/repo")).containsExactly("a.txt");
	}

	@Test
	void mkdirOfExistingDirectoryFails() throws IOException {
		this.store.mkdir("/repo");

		assertThatThrownBy(() -> this.store.mkdir("/repo")).isInstanceOf(FileAlreadyExistsException.class);
	}

	@Test
	void missingEntriesAreNotFound() {
		assertThatThrownBy(() -> this.store.readFile("/repo/none")).isInstanceOf(NoSuchFileException.class);
		assertThatThrownBy(() -> this.store.stat("/repo/none")).isInstanceOf(NoSuchFileException.class);
		assertThat(this.store.exists("/repo/none")).isFalse();
	}

	@Test
	void rmdirOnlyRemovesEmptyDirectories() throws IOException {
		this.store.mkdir("/repo");
		this.store.writeFile("/repo/a.txt", new byte[] { 1 });

		assertThatThrownBy(() -> this.store.rmdir("/repo")).isInstanceOf(IOException.class);
		this.store.unlink("/repo/a.txt");
		this.store.rmdir("/repo");

		assertThat(this.store.exists("/repo")).isFalse();
	}

	@Test
	void wipeKeepsOnlyTheBaseDirectory() throws IOException {
		this.store.mkdir("/repo");
		this.store.mkdir("/repo/.git");
		this.store.writeFile("/repo/.git/HEAD", new byte[] { 1 });

		this.store.wipe();

		assertThat(this.baseDirectory).isEmptyDirectory();
	}

	@Test
	void pathsCannotEscapeTheStore() {
		assertThatThrownBy(() -> this.store.writeFile("/../escape.txt", new byte[] { 1 }))
			.isInstanceOf(IOException.class)
			.hasMessageContaining("escapes");
		assertThat(Files.exists(this.baseDirectory.getParent().resolve("escape.txt"))).isFalse();
	}

}
