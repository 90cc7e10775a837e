package dev.stdiobridge.transport;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple helper for logging framed traffic to and from the child process in a consistent format.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");
    private static final int PREVIEW_CHARS = 200;

    private Wire() {
    }

    public static void rx(String channel, JsonNode message) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("RX chan={} id={} method={} json={}",
                channel,
                message.path("id").isMissingNode() ? null : message.get("id"),
                message.path("method").asText(null),
                truncate(message.toString(), PREVIEW_CHARS));
        }
    }

    public static void tx(String channel, JsonNode message) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("TX chan={} id={} method={} json={}",
                channel,
                message.path("id").isMissingNode() ? null : message.get("id"),
                message.path("method").asText(null),
                truncate(message.toString(), PREVIEW_CHARS));
        }
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "…";
    }
}
