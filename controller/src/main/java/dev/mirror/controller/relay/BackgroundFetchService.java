package dev.mirror.controller.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mirror.transport.Messages;
import dev.mirror.transport.relay.ByteArrays;
import dev.mirror.transport.relay.NetworkFetcher;
import dev.mirror.transport.relay.RelayEnvelope;
import dev.mirror.transport.relay.RelayResult;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The extension's privileged background context. Answers {@code GIT_FETCH} runtime messages by
 * performing the network call, which page-level origin rules do not apply to, and returns the
 * response with its body as a plain numeric array.
 */
public class BackgroundFetchService {

    public static final String GIT_FETCH = "GIT_FETCH";

    private static final Logger LOGGER = LoggerFactory.getLogger(BackgroundFetchService.class);

    private final ObjectMapper mapper = Messages.mapper();
    private final NetworkFetcher fetcher;
    private final Executor executor;

    public BackgroundFetchService(NetworkFetcher fetcher, Executor executor) {
        this.fetcher = fetcher;
        this.executor = executor;
    }

    /**
     * Handles one runtime message {@code {type, payload}}. The message is copied on entry, the
     * response is a fresh tree owned by the caller.
     */
    public CompletableFuture<JsonNode> onMessage(JsonNode message) {
        JsonNode request;
        try {
            request = mapper.readTree(mapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            return CompletableFuture.completedFuture(error("Unreadable runtime message"));
        }
        if (!GIT_FETCH.equals(request.path("type").asText())) {
            return CompletableFuture.completedFuture(error("Unsupported message type " + request.path("type").asText()));
        }
        return CompletableFuture.supplyAsync(() -> fetch(request.path("payload")), executor);
    }

    private JsonNode fetch(JsonNode payload) {
        String url = payload.path("url").asText();
        String method = payload.path("method").asText("GET");
        try {
            Map<String, String> headers = new LinkedHashMap<>();
            payload.path("headers").fields().forEachRemaining(field -> headers.put(field.getKey(), field.getValue().asText()));
            byte[] body = ByteArrays.fromTransport(payload.get("body"));
            RelayResult result = fetcher.fetch(new RelayEnvelope(null, url, method, headers, body.length == 0 ? null : body));
            ObjectNode response = mapper.createObjectNode();
            response.put("ok", result.ok());
            response.put("status", result.statusCode());
            response.put("statusText", result.statusMessage());
            response.put("url", result.url());
            ObjectNode responseHeaders = response.putObject("headers");
            result.headers().forEach(responseHeaders::put);
            response.set("data", ByteArrays.toNumericArray(result.bodyBytes()));
            LOGGER.debug("Background fetch {} {} -> {}", method, url, result.statusCode());
            return response;
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Background fetch {} {} failed: {}", method, url, e.getMessage());
            return error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private ObjectNode error(String message) {
        return mapper.createObjectNode().put("error", message);
    }
}
