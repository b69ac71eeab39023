package dev.mirror.worker.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.mirror.transport.message.SyncStats;
import dev.mirror.transport.message.TreeNode;
import dev.mirror.worker.config.RelayProperties;
import dev.mirror.worker.config.WorkerProperties;
import dev.mirror.worker.engine.CheckoutOptions;
import dev.mirror.worker.engine.CloneOptions;
import dev.mirror.worker.engine.EngineContext;
import dev.mirror.worker.engine.PullOptions;
import dev.mirror.worker.engine.VersioningEngine;
import dev.mirror.worker.host.HostFileSystem;
import dev.mirror.worker.store.DirectoryContentStore;
import dev.mirror.worker.sync.ConsistencyChecker;
import dev.mirror.worker.sync.SyncEngine;
import dev.mirror.worker.sync.SyncListener;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RepositoryServiceTest {

	@TempDir
	Path storeDir;

	@TempDir
	Path destinationDir;

	private DirectoryContentStore store;

	private RecordingEngine engine;

	private SyncEngine syncEngine;

	private RelayProperties relayProperties;

	private RepositoryService service;

	@BeforeEach
	void setUp() {
		this.store = new DirectoryContentStore(this.storeDir);
		this.engine = new RecordingEngine();
		this.syncEngine = new SyncEngine(new ConsistencyChecker());
		this.relayProperties = new RelayProperties();
		this.relayProperties.setCorsProxy("https://cors.example.org");
		this.service = new RepositoryService(this.store, this.engine, this.syncEngine, new WorkerProperties(),
				this.relayProperties);
	}

	@AfterEach
	void tearDown() {
		this.syncEngine.close();
	}

	@Test
	void initIsIdempotent() throws IOException {
		this.service.init();
		this.service.init();

		assertThat(this.store.stat("/repo").directory()).isTrue();
	}

	@Test
	void cloneClearsRepositoryThenClonesShallowAndForcesCheckout() throws IOException {
		this.service.init();
		this.store.writeFile("/repo/leftover.txt", bytes("old"));
		this.store.mkdir("/repo/old");
		this.store.writeFile("/repo/old/x.txt", bytes("old"));
		List<String> messages = new ArrayList<>();

		this.service.cloneRepository("https://github.com/a/b.git", "main", true, null, messages::add);

		assertThat(this.engine.calls).containsExactly("clone main", "checkout main");
		assertThat(this.engine.cloneOptions.singleBranch()).isTrue();
		assertThat(this.engine.cloneOptions.depth()).isEqualTo(1);
		assertThat(this.engine.cloneOptions.noCheckout()).isTrue();
		assertThat(this.engine.cloneOptions.proxy()).isEqualTo("https://cors.example.org");
		assertThat(this.engine.checkoutOptions.force()).isTrue();
		assertThat(this.engine.contentsAtClone).isEmpty();
		assertThat(this.store.exists("/repo")).isTrue();
		assertThat(messages).containsExactly("Receiving objects: 100%");
	}

	@Test
	void cloneWithoutProxyPassesNone() throws IOException {
		this.service.cloneRepository("https://github.com/a/b.git", "dev", false, null, null);

		assertThat(this.engine.cloneOptions.proxy()).isNull();
		assertThat(this.store.exists("/repo")).isTrue();
	}

	@Test
	void pullDelegatesToEngine() throws IOException {
		this.service.init();

		this.service.pull("https://github.com/a/b.git", "main", true, null, null);

		assertThat(this.engine.calls).containsExactly("pull main");
		assertThat(this.engine.pullOptions.proxy()).isEqualTo("https://cors.example.org");
	}

	@Test
	void fileTreeListsWorkingTreeWithoutMetadata() throws IOException {
		populate();

		List<TreeNode> tree = this.service.fileTree();

		assertThat(tree).extracting(TreeNode::name).containsExactly("README.md", "src");
		TreeNode src = tree.get(1);
		assertThat(src.isDirectory()).isTrue();
		assertThat(src.path()).isEqualTo("/repo/src");
		assertThat(src.children()).extracting(TreeNode::path).containsExactly("/repo/src/Main.java");
		assertThat(tree.get(0).children()).isNull();
	}

	@Test
	void fileTreeOfMissingRepositoryIsNotFound() {
		assertThatThrownBy(() -> this.service.fileTree()).isInstanceOf(NoSuchFileException.class);
	}

	@Test
	void readFileDecodesUtf8() throws IOException {
		populate();

		assertThat(this.service.readFile("/repo/README.md")).isEqualTo("# Tïtle");
		assertThatThrownBy(() -> this.service.readFile("/repo/nope.md")).isInstanceOf(NoSuchFileException.class);
	}

	@Test
	void blankSyncPathMirrorsWholeRepository() throws IOException {
		populate();

		SyncStats stats = this.service.syncToLocal(" ", new HostFileSystem(this.destinationDir), SyncListener.NONE);

		assertThat(stats.updated()).isEqualTo(2);
		assertThat(this.destinationDir.resolve("src/Main.java")).hasContent("class Main {}");
		assertThat(this.destinationDir.resolve(".git")).doesNotExist();
	}

	@Test
	void wipeEmptiesTheStore() throws IOException {
		populate();

		this.service.wipe();

		assertThat(this.store.exists("/repo")).isFalse();
	}

	private void populate() throws IOException {
		this.service.init();
		this.store.writeFile("/repo/README.md", bytes("# Tïtle"));
		this.store.mkdir("/repo/src");
		this.store.writeFile("/repo/src/Main.java", bytes("class Main {}"));
		this.store.mkdir("/repo/.git");
		this.store.writeFile("/repo/.git/HEAD", bytes("ref: refs/heads/main"));
	}

	private static byte[] bytes(String text) {
		return text.getBytes(StandardCharsets.UTF_8);
	}

	private static final class RecordingEngine implements VersioningEngine {

		private final List<String> calls = new ArrayList<>();

		private CloneOptions cloneOptions;

		private CheckoutOptions checkoutOptions;

		private PullOptions pullOptions;

		private List<String> contentsAtClone;

		@Override
		public void clone(EngineContext context, String url, String ref, CloneOptions options) throws IOException {
			this.calls.add("clone " + ref);
			this.cloneOptions = options;
			this.contentsAtClone = context.store().readdir(context.dir());
			options.onMessage().accept("Receiving objects: 100%");
		}

		@Override
		public void checkout(EngineContext context, String ref, CheckoutOptions options) {
			this.calls.add("checkout " + ref);
			this.checkoutOptions = options;
		}

		@Override
		public void pull(EngineContext context, String url, String ref, PullOptions options) {
			this.calls.add("pull " + ref);
			this.pullOptions = options;
		}

	}

}
