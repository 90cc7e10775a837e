package dev.stdiobridge.server.broker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * What happened to a client message.
 *
 * @param status forwarded to the child, or blocked by a filter
 * @param id the message id after id assignment, {@code null} for notifications
 * @param blockReason reason given by the blocking filter
 */
public record Submission(Status status, JsonNode id, String blockReason) {

    public enum Status {
        FORWARDED,
        BLOCKED
    }

    public boolean forwarded() {
        return status == Status.FORWARDED;
    }
}
