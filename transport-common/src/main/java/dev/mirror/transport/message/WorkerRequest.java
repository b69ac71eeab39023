package dev.mirror.transport.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Typed payload of an RPC request, discriminated by {@code kind}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(WorkerRequest.Init.class),
    @JsonSubTypes.Type(WorkerRequest.Clone.class),
    @JsonSubTypes.Type(WorkerRequest.Pull.class),
    @JsonSubTypes.Type(WorkerRequest.GetFileTree.class),
    @JsonSubTypes.Type(WorkerRequest.ReadFile.class),
    @JsonSubTypes.Type(WorkerRequest.SetLocalRoot.class),
    @JsonSubTypes.Type(WorkerRequest.SyncToLocal.class),
    @JsonSubTypes.Type(WorkerRequest.Wipe.class)
})
public interface WorkerRequest {

    @JsonIgnore
    RequestKind kind();

    @JsonTypeName("init")
    record Init() implements WorkerRequest {
        @Override
        public RequestKind kind() {
            return RequestKind.INIT;
        }
    }

    @JsonTypeName("clone")
    record Clone(String url, String ref, boolean useProxy) implements WorkerRequest {
        @Override
        public RequestKind kind() {
            return RequestKind.CLONE;
        }
    }

    @JsonTypeName("pull")
    record Pull(String url, String ref, boolean useProxy) implements WorkerRequest {
        @Override
        public RequestKind kind() {
            return RequestKind.PULL;
        }
    }

    @JsonTypeName("getFileTree")
    record GetFileTree() implements WorkerRequest {
        @Override
        public RequestKind kind() {
            return RequestKind.GET_FILE_TREE;
        }
    }

    @JsonTypeName("readFile")
    record ReadFile(String path) implements WorkerRequest {
        @Override
        public RequestKind kind() {
            return RequestKind.READ_FILE;
        }
    }

    /**
     * Grants the worker a destination directory. {@code root} is an absolute local path.
     */
    @JsonTypeName("setLocalRoot")
    record SetLocalRoot(String root) implements WorkerRequest {
        @Override
        public RequestKind kind() {
            return RequestKind.SET_LOCAL_ROOT;
        }
    }

    @JsonTypeName("syncToLocal")
    record SyncToLocal(String path) implements WorkerRequest {
        @Override
        public RequestKind kind() {
            return RequestKind.SYNC_TO_LOCAL;
        }
    }

    @JsonTypeName("wipe")
    record Wipe() implements WorkerRequest {
        @Override
        public RequestKind kind() {
            return RequestKind.WIPE;
        }
    }
}
