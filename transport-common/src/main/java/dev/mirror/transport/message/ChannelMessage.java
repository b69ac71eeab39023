package dev.mirror.transport.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.databind.JsonNode;
import dev.mirror.transport.ErrorKind;
import dev.mirror.transport.relay.RelayEnvelope;
import dev.mirror.transport.relay.RelayResult;
import java.util.Objects;

/**
 * Every frame exchanged between the controller and the worker. The {@code type} property
 * discriminates the variants; a frame with an unknown type fails to decode.
 *
 * <p>RPC traffic is {@link Ready}, {@link Request}, {@link Progress}, {@link Success} and
 * {@link Failure}. Relay escalation is {@link FetchProxy} (worker to controller) answered by
 * {@link FetchResult}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(ChannelMessage.Ready.class),
    @JsonSubTypes.Type(ChannelMessage.Request.class),
    @JsonSubTypes.Type(ChannelMessage.Progress.class),
    @JsonSubTypes.Type(ChannelMessage.Success.class),
    @JsonSubTypes.Type(ChannelMessage.Failure.class),
    @JsonSubTypes.Type(ChannelMessage.FetchProxy.class),
    @JsonSubTypes.Type(ChannelMessage.FetchResult.class)
})
public interface ChannelMessage {

    String id();

    @JsonIgnore
    default String type() {
        JsonTypeName name = getClass().getAnnotation(JsonTypeName.class);
        return name == null ? getClass().getSimpleName() : name.value();
    }

    @JsonIgnore
    default String describe() {
        return "";
    }

    /**
     * One-time signal from the worker that it accepts requests.
     */
    @JsonTypeName("ready")
    record Ready() implements ChannelMessage {
        @Override
        public String id() {
            return null;
        }
    }

    @JsonTypeName("request")
    record Request(String id, WorkerRequest request) implements ChannelMessage {
        public Request {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(request, "request");
        }

        @Override
        public String describe() {
            return "kind=" + request.kind().wireName();
        }
    }

    @JsonTypeName("progress")
    record Progress(String id, int seq, ProgressEvent event) implements ChannelMessage {
        @Override
        public String describe() {
            return "seq=" + seq + " " + event;
        }
    }

    @JsonTypeName("success")
    record Success(String id, JsonNode payload) implements ChannelMessage {
        @Override
        public String describe() {
            return payload == null ? "" : payload.toString();
        }
    }

    @JsonTypeName("error")
    record Failure(String id, ErrorKind kind, String message) implements ChannelMessage {
        @Override
        public String describe() {
            return kind + " " + message;
        }
    }

    @JsonTypeName("EXTENSION_FETCH_PROXY")
    record FetchProxy(String id, RelayEnvelope envelope) implements ChannelMessage {
        @Override
        public String describe() {
            return envelope.method() + " " + envelope.url() + " (" + envelope.bodyLength() + " bytes)";
        }
    }

    /**
     * Answer to a {@link FetchProxy}. Exactly one of {@code payload} and {@code error} is set;
     * {@code errorKind} tells the worker how the relay failed.
     */
    @JsonTypeName("EXTENSION_FETCH_RESULT")
    record FetchResult(String id, RelayResult payload, String error, ErrorKind errorKind) implements ChannelMessage {

        public static FetchResult success(String id, RelayResult payload) {
            return new FetchResult(id, payload, null, null);
        }

        public static FetchResult failure(String id, String error) {
            return failure(id, ErrorKind.NETWORK_ERROR, error);
        }

        public static FetchResult failure(String id, ErrorKind kind, String error) {
            return new FetchResult(id, null, error == null ? "Relay failed" : error,
                kind == null ? ErrorKind.NETWORK_ERROR : kind);
        }

        @Override
        public String describe() {
            return error != null ? errorKind + " " + error : "status=" + payload.statusCode();
        }
    }
}
