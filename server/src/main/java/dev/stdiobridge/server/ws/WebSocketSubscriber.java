package dev.stdiobridge.server.ws;

import java.io.IOException;
import java.time.Duration;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import dev.stdiobridge.server.session.Subscriber;

/**
 * Pushes session frames to one WebSocket as text messages. The socket is wrapped in a
 * {@link ConcurrentWebSocketSessionDecorator}, so concurrent sends are serialized and a peer that
 * stops reading fails its sends once the time or buffer limit is exceeded.
 */
class WebSocketSubscriber implements Subscriber {

	private static final Logger logger = LoggerFactory.getLogger(WebSocketSubscriber.class);

	private final WebSocketSession socket;

	WebSocketSubscriber(WebSocketSession socket, Duration sendTimeLimit, int sendBufferSizeLimit) {
		this.socket = new ConcurrentWebSocketSessionDecorator(socket, Math.toIntExact(sendTimeLimit.toMillis()),
				sendBufferSizeLimit);
	}

	@Override
	public void send(JsonNode frame) throws IOException {
		if (!this.socket.isOpen()) {
			throw new IOException("WebSocket " + this.socket.getId() + " is closed");
		}
		try {
			this.socket.sendMessage(new TextMessage(frame.toString()));
		}
		catch (SessionLimitExceededException ex) {
			throw new IOException("WebSocket " + this.socket.getId() + " is not keeping up: " + ex.getMessage(), ex);
		}
	}

	@Override
	public void close() {
		try {
			if (this.socket.isOpen()) {
				this.socket.close(CloseStatus.NORMAL);
			}
		}
		catch (IOException ex) {
			logger.warn("Failed to close WebSocket {}", this.socket.getId(), ex);
		}
	}

}
