package dev.stdiobridge.server.session;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of waiting on a session queue: either a frame or a heartbeat after the wait timed out.
 * @param frame the dequeued frame, {@code null} for a heartbeat
 */
public record Delivery(JsonNode frame) {

	private static final Delivery HEARTBEAT = new Delivery(null);

	public static Delivery of(JsonNode frame) {
		return new Delivery(frame);
	}

	public static Delivery heartbeat() {
		return HEARTBEAT;
	}

	public boolean isHeartbeat() {
		return this.frame == null;
	}

}
