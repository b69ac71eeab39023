package dev.mirror.controller.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mirror.transport.CorrelationIds;
import dev.mirror.transport.ErrorKind;
import dev.mirror.transport.Messages;
import dev.mirror.transport.MirrorException;
import dev.mirror.transport.PendingCalls;
import dev.mirror.transport.relay.ByteArrays;
import dev.mirror.transport.relay.RelayEnvelope;
import dev.mirror.transport.relay.RelayResult;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Controller hop of the relay chain. Posts each envelope on the page bus for the browser
 * extension and waits for the matching answer. Every correlation id has its own timeout; a late
 * or repeated answer for an id that is no longer waiting is dropped.
 */
public class ExtensionRelayProxy implements PrivilegedNetworkProxy, Closeable {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private static final Logger LOGGER = LoggerFactory.getLogger(ExtensionRelayProxy.class);

    private final ObjectMapper mapper = Messages.mapper();
    private final PageMessageBus bus;
    private final Duration timeout;
    private final CorrelationIds ids = new CorrelationIds();
    private final PendingCalls<JsonNode> pending = new PendingCalls<>("extension");
    private final Closeable subscription;

    public ExtensionRelayProxy(PageMessageBus bus) {
        this(bus, DEFAULT_TIMEOUT);
    }

    public ExtensionRelayProxy(PageMessageBus bus, Duration timeout) {
        this.bus = bus;
        this.timeout = timeout;
        this.subscription = bus.subscribe(this::onPageMessage);
    }

    @Override
    public CompletableFuture<RelayResult> relay(RelayEnvelope envelope) {
        String id = envelope.id() != null ? envelope.id() : ids.next(CorrelationIds.Scope.EXTENSION);
        CompletableFuture<JsonNode> answer;
        try {
            answer = pending.register(id, timeout,
                () -> new MirrorException(ErrorKind.RELAY_TIMEOUT, "Extension response timeout for " + id));
        } catch (IllegalStateException e) {
            return CompletableFuture.failedFuture(new MirrorException(ErrorKind.INVALID_REQUEST, e.getMessage()));
        }

        ObjectNode data = mapper.createObjectNode();
        data.put("url", envelope.url());
        data.put("method", envelope.method());
        ObjectNode headers = data.putObject("headers");
        envelope.headers().forEach(headers::put);
        if (envelope.body() != null) {
            data.set("body", ByteArrays.toNumericArray(envelope.body()));
        }
        ObjectNode message = mapper.createObjectNode();
        message.put("source", ContentScriptBridge.INJECT_MARKER);
        message.put("id", id);
        message.put("type", BackgroundFetchService.GIT_FETCH);
        message.set("data", data);

        LOGGER.info("Proxying {} {} ({} bytes body) as {}", envelope.method(), envelope.url(), envelope.bodyLength(), id);
        bus.post(message);
        return answer.thenApply(response -> toResult(envelope, response));
    }

    private void onPageMessage(JsonNode message) {
        if (!ContentScriptBridge.CONTENT_MARKER.equals(message.path("source").asText())) {
            return;
        }
        String id = message.path("id").asText();
        boolean delivered;
        if (message.hasNonNull("error")) {
            delivered = pending.fail(id, new MirrorException(ErrorKind.NETWORK_ERROR, message.get("error").asText()));
        } else {
            delivered = pending.complete(id, message.path("result"));
        }
        if (!delivered) {
            LOGGER.debug("Discarded late or duplicate extension answer {}", id);
        }
    }

    private RelayResult toResult(RelayEnvelope envelope, JsonNode response) {
        byte[] body;
        try {
            body = ByteArrays.fromTransport(response.get("data"));
        } catch (IOException e) {
            throw new MirrorException(ErrorKind.NETWORK_ERROR, "Unreadable response body for " + envelope.url(), e);
        }
        Map<String, String> headers = new LinkedHashMap<>();
        response.path("headers").fields().forEachRemaining(field -> headers.put(field.getKey(), field.getValue().asText()));
        String url = response.hasNonNull("url") && !response.get("url").asText().isEmpty()
            ? response.get("url").asText()
            : envelope.url();
        return new RelayResult(url, envelope.method(), response.path("status").asInt(),
            response.path("statusText").asText(""), headers, List.of(body));
    }

    @Override
    public void close() throws IOException {
        subscription.close();
        pending.failAll(() -> new MirrorException(ErrorKind.CHANNEL_CLOSED, "Extension relay closed"));
    }
}
