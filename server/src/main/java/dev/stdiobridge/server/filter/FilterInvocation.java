package dev.stdiobridge.server.filter;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Arguments of a single filter call. The configuration is the snapshot the whole pipeline run
 * started with.
 * @param direction direction of travel
 * @param sessionId session the message comes from or is headed to
 * @param message message as left by the previous filter; owned by this pipeline run
 * @param config configuration snapshot
 */
public record FilterInvocation(Direction direction, String sessionId, JsonNode message, FilterConfig config) {
}
