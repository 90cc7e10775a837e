package dev.stdiobridge.server.session;

import java.io.IOException;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A live stream attached to a session, such as a WebSocket. Every subscriber of a session receives
 * every frame delivered to it, in order, from a sender thread of its own; a send may block without
 * holding up other sessions.
 */
public interface Subscriber {

	/**
	 * Push one frame to the peer.
	 * @param frame frame to send
	 * @throws IOException when the peer is gone; the subscriber is then detached
	 */
	void send(JsonNode frame) throws IOException;

	/**
	 * Release the underlying stream. Called once the subscriber is detached.
	 */
	default void close() {
	}

}
