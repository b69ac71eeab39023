package dev.mirror.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.mirror.transport.message.ChannelMessage;

/**
 * Shared JSON mapping for everything that crosses a context boundary.
 */
public final class Messages {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .findAndRegisterModules()
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private Messages() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String encode(ChannelMessage message) throws JsonProcessingException {
        return MAPPER.writeValueAsString(message);
    }

    public static ChannelMessage decode(String frame) throws JsonProcessingException {
        return MAPPER.readValue(frame, ChannelMessage.class);
    }
}
