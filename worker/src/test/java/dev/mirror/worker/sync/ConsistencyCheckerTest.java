package dev.mirror.worker.sync;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import dev.mirror.worker.host.HostFileSystem;
import dev.mirror.worker.store.ContentStore;
import dev.mirror.worker.store.DirectoryContentStore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConsistencyCheckerTest {

	@TempDir
	Path storeDir;

	@TempDir
	Path destinationDir;

	private ContentStore store;

	private HostFileSystem destination;

	@BeforeEach
	void setUp() throws IOException {
		this.store = new DirectoryContentStore(this.storeDir);
		this.store.mkdir("/repo");
		this.destination = new HostFileSystem(this.destinationDir);
	}

	@Test
	void missingDestinationIsInconsistentAndCarriesSourceBytes() throws IOException {
		this.store.writeFile("/repo/a.txt", bytes("hello"));

		ConsistencyResult result = new ConsistencyChecker().check(this.store, "/repo/a.txt", this.destination,
				"a.txt");

		assertThat(result.consistent()).isFalse();
		assertThat(result.sourceBytes()).isEqualTo(bytes("hello"));
	}

	@Test
	void identicalSmallFileIsConsistentWithoutBytes() throws IOException {
		this.store.writeFile("/repo/a.txt", bytes("hello"));
		Files.write(this.destinationDir.resolve("a.txt"), bytes("hello"));

		ConsistencyResult result = new ConsistencyChecker().check(this.store, "/repo/a.txt", this.destination,
				"a.txt");

		assertThat(result.consistent()).isTrue();
		assertThat(result.sourceBytes()).isNull();
	}

	@Test
	void sizeMismatchIsInconsistent() throws IOException {
		this.store.writeFile("/repo/a.txt", bytes("hello"));
		Files.write(this.destinationDir.resolve("a.txt"), bytes("hello!"));

		assertThat(new ConsistencyChecker().check(this.store, "/repo/a.txt", this.destination, "a.txt")
			.consistent()).isFalse();
	}

	@Test
	void directoryAtDestinationIsInconsistent() throws IOException {
		this.store.writeFile("/repo/a.txt", bytes("hello"));
		Files.createDirectories(this.destinationDir.resolve("a.txt"));

		assertThat(new ConsistencyChecker().check(this.store, "/repo/a.txt", this.destination, "a.txt")
			.consistent()).isFalse();
	}

	@ParameterizedTest
	@ValueSource(ints = { 0, 1, 10 * 1024, 1 << 20 })
	void decisionDoesNotDependOnThreshold(int threshold) throws IOException {
		byte[] large = new byte[64 * 1024];
		new Random(7).nextBytes(large);
		byte[] oneByteOff = Arrays.copyOf(large, large.length);
		oneByteOff[large.length - 1] ^= 1;
		this.store.writeFile("/repo/same.bin", large);
		this.store.writeFile("/repo/diff.bin", large);
		Files.write(this.destinationDir.resolve("same.bin"), large);
		Files.write(this.destinationDir.resolve("diff.bin"), oneByteOff);
		ConsistencyChecker checker = new ConsistencyChecker(threshold);

		assertThat(checker.check(this.store, "/repo/same.bin", this.destination, "same.bin").consistent()).isTrue();
		assertThat(checker.check(this.store, "/repo/diff.bin", this.destination, "diff.bin").consistent()).isFalse();
	}

	@Test
	void unreadableSourceIsReportedConsistent() throws IOException {
		ContentStore failing = mock(ContentStore.class);
		when(failing.readFile(anyString())).thenThrow(new NoSuchFileException("/repo/gone.txt"));

		ConsistencyResult result = new ConsistencyChecker().check(failing, "/repo/gone.txt", this.destination,
				"gone.txt");

		assertThat(result.consistent()).isTrue();
		assertThat(this.destinationDir.resolve("gone.txt")).doesNotExist();
	}

	@Test
	void probeFailureForcesRewrite() throws IOException {
		this.store.writeFile("/repo/a.txt", bytes("hello"));

		ConsistencyResult result = new ConsistencyChecker().check(this.store, "/repo/a.txt", this.destination,
				"../outside.txt");

		assertThat(result.consistent()).isFalse();
		assertThat(result.sourceBytes()).isEqualTo(bytes("hello"));
	}

	private static byte[] bytes(String text) {
		return text.getBytes(java.nio.charset.StandardCharsets.UTF_8);
	}

}
