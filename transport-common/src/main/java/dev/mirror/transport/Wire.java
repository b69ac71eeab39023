package dev.mirror.transport;

import dev.mirror.transport.message.ChannelMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs channel traffic in one format so that controller and worker logs line up.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private Wire() {
    }

    public static void rx(String connectionId, ChannelMessage message) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("RX conn={} type={} id={} {}", connectionId, message.type(), message.id(),
                truncate(message.describe(), 200));
        }
    }

    public static void tx(String connectionId, ChannelMessage message) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("TX conn={} type={} id={} {}", connectionId, message.type(), message.id(),
                truncate(message.describe(), 200));
        }
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
