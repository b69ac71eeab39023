package dev.mirror.controller;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mirror.controller.channel.WorkerChannel;
import dev.mirror.transport.Messages;
import dev.mirror.transport.message.ProgressEvent;
import dev.mirror.transport.message.SyncStats;
import dev.mirror.transport.message.TreeNode;
import dev.mirror.transport.message.WorkerRequest;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Typed operations on a worker. Every method returns the future of a single RPC call.
 */
public class MirrorClient implements Closeable {

    public static final String REPOSITORY_DIR = "/repo";
    public static final String DEFAULT_REF = "main";

    private static final TypeReference<List<TreeNode>> TREE = new TypeReference<>() {
    };

    private final ObjectMapper mapper = Messages.mapper();
    private final WorkerChannel channel;
    private volatile boolean localConnected;

    public MirrorClient(WorkerChannel channel) {
        this.channel = channel;
    }

    public CompletableFuture<Void> init() {
        return channel.send(new WorkerRequest.Init()).thenApply(payload -> null);
    }

    public CompletableFuture<Void> clone(String url, String ref, boolean useProxy, Consumer<String> onProgress) {
        return channel.send(new WorkerRequest.Clone(url, refOrDefault(ref), useProxy), messages(onProgress))
            .thenApply(payload -> null);
    }

    public CompletableFuture<Void> pull(String url, String ref, boolean useProxy, Consumer<String> onProgress) {
        return channel.send(new WorkerRequest.Pull(url, refOrDefault(ref), useProxy), messages(onProgress))
            .thenApply(payload -> null);
    }

    public CompletableFuture<List<TreeNode>> getFileTree() {
        return channel.send(new WorkerRequest.GetFileTree()).thenApply(payload -> mapper.convertValue(payload, TREE));
    }

    public CompletableFuture<String> readFile(String path) {
        return channel.send(new WorkerRequest.ReadFile(path)).thenApply(JsonNode::asText);
    }

    /**
     * Grants the worker a local directory to mirror into.
     */
    public CompletableFuture<Void> useLocalDirectory(Path directory) {
        String root = directory.toAbsolutePath().normalize().toString();
        return channel.send(new WorkerRequest.SetLocalRoot(root)).thenApply(payload -> {
            localConnected = true;
            return null;
        });
    }

    public boolean isLocalConnected() {
        return localConnected;
    }

    public CompletableFuture<SyncStats> syncToLocal(String path, Consumer<ProgressEvent.SyncProgress> onProgress) {
        Consumer<ProgressEvent> sink = event -> {
            if (onProgress != null && event instanceof ProgressEvent.SyncProgress sync) {
                onProgress.accept(sync);
            }
        };
        return channel.send(new WorkerRequest.SyncToLocal(path), sink)
            .thenApply(payload -> mapper.convertValue(payload, SyncStats.class));
    }

    /**
     * Mirrors the whole repository, which also removes local entries absent from it.
     */
    public CompletableFuture<SyncStats> syncAll(Consumer<ProgressEvent.SyncProgress> onProgress) {
        return syncToLocal(REPOSITORY_DIR, onProgress);
    }

    /**
     * Deletes everything the worker stores.
     */
    public CompletableFuture<Void> resetApp() {
        return channel.send(new WorkerRequest.Wipe()).thenApply(payload -> null);
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    private static String refOrDefault(String ref) {
        return ref == null || ref.isBlank() ? DEFAULT_REF : ref;
    }

    private static Consumer<ProgressEvent> messages(Consumer<String> onProgress) {
        return event -> {
            if (onProgress != null && event instanceof ProgressEvent.Message message) {
                onProgress.accept(message.text());
            }
        };
    }
}
