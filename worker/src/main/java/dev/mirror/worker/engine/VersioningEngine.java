package dev.mirror.worker.engine;

import java.io.IOException;

/**
 * Boundary to the engine that owns the version data model. The worker never interprets
 * commits, trees or refs itself; it only asks the engine to materialize a ref into the store.
 */
public interface VersioningEngine {

	/**
	 * Clone a remote repository into {@link EngineContext#dir()}.
	 * @param context store, directory and network to operate on
	 * @param url remote repository URL
	 * @param ref branch or tag to clone
	 * @param options clone options
	 * @throws IOException when the store or the network fails
	 */
	void clone(EngineContext context, String url, String ref, CloneOptions options) throws IOException;

	/**
	 * Check out a ref into the working tree.
	 * @param context store and directory to operate on
	 * @param ref branch or tag to check out
	 * @param options checkout options
	 * @throws IOException when the store fails
	 */
	void checkout(EngineContext context, String ref, CheckoutOptions options) throws IOException;

	/**
	 * Fetch and merge the remote ref into the working tree.
	 * @param context store, directory and network to operate on
	 * @param url remote repository URL
	 * @param ref branch to pull
	 * @param options pull options
	 * @throws IOException when the store or the network fails
	 */
	void pull(EngineContext context, String url, String ref, PullOptions options) throws IOException;

}
