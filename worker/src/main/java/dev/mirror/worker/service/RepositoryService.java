package dev.mirror.worker.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import dev.mirror.transport.message.SyncStats;
import dev.mirror.transport.message.TreeNode;
import dev.mirror.worker.config.RelayProperties;
import dev.mirror.worker.config.WorkerProperties;
import dev.mirror.worker.engine.CheckoutOptions;
import dev.mirror.worker.engine.CloneOptions;
import dev.mirror.worker.engine.EngineContext;
import dev.mirror.worker.engine.NetworkTransport;
import dev.mirror.worker.engine.PullOptions;
import dev.mirror.worker.engine.VersioningEngine;
import dev.mirror.worker.host.HostFileSystem;
import dev.mirror.worker.store.ContentStore;
import dev.mirror.worker.sync.SyncEngine;
import dev.mirror.worker.sync.SyncListener;
import lombok.RequiredArgsConstructor;

/**
 * Service layer for everything the worker does with the repository held in the content store:
 * materializing it through the versioning engine, exposing its tree and files, and mirroring it
 * onto a destination.
 */
@Service
@RequiredArgsConstructor
public class RepositoryService {

	private static final Logger logger = LoggerFactory.getLogger(RepositoryService.class);

	private static final String METADATA_DIR = ".git";

	private final ContentStore store;

	private final VersioningEngine engine;

	private final SyncEngine syncEngine;

	private final WorkerProperties workerProperties;

	private final RelayProperties relayProperties;

	/**
	 * Store path of the repository working tree.
	 * @return repository directory
	 */
	public String repositoryDir() {
		return this.workerProperties.getRepoDir();
	}

	/**
	 * Create the repository directory when it does not exist yet.
	 * @throws IOException when the directory cannot be created
	 */
	public void init() throws IOException {
		try {
			this.store.mkdir(repositoryDir());
			logger.info("Created repository directory {}", repositoryDir());
		}
		catch (FileAlreadyExistsException ex) {
			logger.debug("Repository directory {} already exists", repositoryDir());
		}
	}

	/**
	 * Replace the repository with a fresh shallow clone of a remote ref. The repository
	 * directory is emptied, not removed, before the engine clones into it.
	 * @param url remote repository URL
	 * @param ref branch or tag
	 * @param useProxy route remote requests through the configured open relay endpoint
	 * @param http network access of the calling session
	 * @param onMessage receives engine progress lines
	 * @throws IOException when the store or the network fails
	 */
	public void cloneRepository(String url, String ref, boolean useProxy, NetworkTransport http,
			Consumer<String> onMessage) throws IOException {
		logger.info("Cloning {} [{}]", url, ref);
		clearDirectoryContents(repositoryDir());
		EngineContext context = new EngineContext(this.store, repositoryDir(), http);
		this.engine.clone(context, url, ref, new CloneOptions(true, 1, true, proxy(useProxy), onMessage));
		this.engine.checkout(context, ref, new CheckoutOptions(true));
		logger.info("Clone of {} finished", url);
	}

	/**
	 * Pull a remote ref into the existing repository.
	 * @param url remote repository URL
	 * @param ref branch
	 * @param useProxy route remote requests through the configured open relay endpoint
	 * @param http network access of the calling session
	 * @param onMessage receives engine progress lines
	 * @throws IOException when the store or the network fails
	 */
	public void pull(String url, String ref, boolean useProxy, NetworkTransport http, Consumer<String> onMessage)
			throws IOException {
		logger.info("Pulling {} [{}]", url, ref);
		EngineContext context = new EngineContext(this.store, repositoryDir(), http);
		this.engine.pull(context, url, ref, new PullOptions(true, proxy(useProxy), onMessage));
		logger.info("Pull of {} finished", url);
	}

	/**
	 * Build the working tree of the repository, version metadata excluded.
	 * @return top-level nodes, directories carrying their children
	 * @throws NoSuchFileException when the repository directory does not exist
	 * @throws IOException when the store cannot be walked
	 */
	public List<TreeNode> fileTree() throws IOException {
		List<TreeNode> tree = buildTree(repositoryDir());
		logger.debug("Tree built with {} top-level items", tree.size());
		return tree;
	}

	/**
	 * Read a file of the content store as UTF-8 text.
	 * @param path absolute store path, as found in the file tree
	 * @return file content
	 * @throws NoSuchFileException when the file does not exist
	 * @throws IOException when the file cannot be read
	 */
	public String readFile(String path) throws IOException {
		return new String(this.store.readFile(path), StandardCharsets.UTF_8);
	}

	/**
	 * Mirror a store path onto a destination.
	 * @param path store path to sync, the repository directory for a full mirror
	 * @param destination destination granted by the controller
	 * @param listener receives per-file progress
	 * @return statistics of the run
	 * @throws IOException when the source cannot be walked
	 */
	public SyncStats syncToLocal(String path, HostFileSystem destination, SyncListener listener)
			throws IOException {
		String source = (path == null || path.isBlank()) ? repositoryDir() : path;
		return this.syncEngine.sync(this.store, repositoryDir(), source, destination, listener);
	}

	/**
	 * Delete the whole content store.
	 * @throws IOException when the store cannot be cleared
	 */
	public void wipe() throws IOException {
		logger.info("Wiping content store");
		this.store.wipe();
	}

	private String proxy(boolean useProxy) {
		return useProxy ? this.relayProperties.getCorsProxy() : null;
	}

	private List<TreeNode> buildTree(String directory) throws IOException {
		List<TreeNode> nodes = new ArrayList<>();
		for (String name : this.store.readdir(directory)) {
			if (METADATA_DIR.equals(name)) {
				continue;
			}
			String child = directory + "/" + name;
			if (this.store.stat(child).directory()) {
				nodes.add(TreeNode.directory(name, child, buildTree(child)));
			}
			else {
				nodes.add(TreeNode.file(name, child));
			}
		}
		return nodes;
	}

	private void clearDirectoryContents(String directory) throws IOException {
		List<String> names;
		try {
			names = this.store.readdir(directory);
		}
		catch (NoSuchFileException ex) {
			this.store.mkdir(directory);
			return;
		}
		for (String name : names) {
			deleteRecursively(directory + "/" + name);
		}
	}

	private void deleteRecursively(String path) {
		try {
			if (this.store.stat(path).directory()) {
				for (String name : this.store.readdir(path)) {
					deleteRecursively(path + "/" + name);
				}
				this.store.rmdir(path);
			}
			else {
				this.store.unlink(path);
			}
		}
		catch (IOException ex) {
			logger.warn("Unable to delete {} from content store", path, ex);
		}
	}

}
