package dev.mirror.worker.engine;

import dev.mirror.worker.store.ContentStore;

/**
 * What a versioning engine operates on: the content store, the repository directory inside it,
 * and the network.
 * @param store byte-oriented store holding working tree and version metadata
 * @param dir store path of the repository working tree
 * @param http network access
 */
public record EngineContext(ContentStore store, String dir, NetworkTransport http) {
}
