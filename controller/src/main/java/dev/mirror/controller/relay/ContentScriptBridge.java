package dev.mirror.controller.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mirror.transport.Messages;
import dev.mirror.transport.MirrorException;
import java.io.Closeable;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The extension's content script: forwards page messages marked {@value #INJECT_MARKER} to the
 * background context and posts each answer back to the page marked {@value #CONTENT_MARKER},
 * under the id of the originating message.
 */
public class ContentScriptBridge implements Closeable {

    public static final String INJECT_MARKER = "cors-unblock-inject";
    public static final String CONTENT_MARKER = "cors-unblock-content";

    private static final Logger LOGGER = LoggerFactory.getLogger(ContentScriptBridge.class);

    private final ObjectMapper mapper = Messages.mapper();
    private final PageMessageBus bus;
    private final BackgroundFetchService background;
    private Closeable subscription;

    public ContentScriptBridge(PageMessageBus bus, BackgroundFetchService background) {
        this.bus = bus;
        this.background = background;
    }

    public synchronized ContentScriptBridge install() {
        if (subscription == null) {
            subscription = bus.subscribe(this::onPageMessage);
        }
        return this;
    }

    private void onPageMessage(JsonNode message) {
        if (!INJECT_MARKER.equals(message.path("source").asText())) {
            return;
        }
        String id = message.path("id").asText();
        ObjectNode runtimeMessage = mapper.createObjectNode();
        runtimeMessage.put("type", message.path("type").asText());
        runtimeMessage.set("payload", message.path("data"));
        background.onMessage(runtimeMessage).whenComplete((response, error) -> {
            ObjectNode reply = mapper.createObjectNode();
            reply.put("source", CONTENT_MARKER);
            reply.put("id", id);
            if (error != null) {
                Throwable cause = MirrorException.unwrap(error);
                reply.put("error", cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
            } else if (response.hasNonNull("error")) {
                reply.put("error", response.get("error").asText());
            } else {
                reply.set("result", response);
            }
            LOGGER.debug("Content script answering {}", id);
            bus.post(reply);
        });
    }

    @Override
    public synchronized void close() throws IOException {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
    }
}
