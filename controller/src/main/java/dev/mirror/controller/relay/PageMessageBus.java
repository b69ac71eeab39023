package dev.mirror.controller.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mirror.transport.Messages;
import java.io.Closeable;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Window-level message bus shared by the controller and the extension's content script. Every
 * listener sees every message, so listeners filter by their own marker. A posted message is
 * serialized once and each listener parses its own copy, asynchronously, as with
 * {@code window.postMessage}.
 */
public class PageMessageBus {

    private static final Logger LOGGER = LoggerFactory.getLogger(PageMessageBus.class);

    private final ObjectMapper mapper = Messages.mapper();
    private final List<Consumer<JsonNode>> listeners = new CopyOnWriteArrayList<>();
    private final Executor executor;

    public PageMessageBus(Executor executor) {
        this.executor = executor;
    }

    public Closeable subscribe(Consumer<JsonNode> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void post(JsonNode message) {
        String serialized;
        try {
            serialized = mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Message cannot be posted: " + e.getOriginalMessage(), e);
        }
        for (Consumer<JsonNode> listener : listeners) {
            executor.execute(() -> deliver(listener, serialized));
        }
    }

    private void deliver(Consumer<JsonNode> listener, String serialized) {
        try {
            listener.accept(mapper.readTree(serialized));
        } catch (JsonProcessingException e) {
            LOGGER.warn("Unable to read posted message copy", e);
        } catch (RuntimeException e) {
            LOGGER.warn("Page message listener failed", e);
        }
    }
}
