package dev.stdiobridge.server.ws;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import dev.stdiobridge.server.broker.BridgeUnavailableException;
import dev.stdiobridge.server.config.BridgeProperties;
import dev.stdiobridge.server.control.BridgeControlService;
import dev.stdiobridge.server.session.SessionNotFoundException;
import dev.stdiobridge.transport.ContentLengthCodec;

/**
 * Connects WebSockets to bridge sessions. A connection either joins the session named by its
 * {@code session} query parameter or registers a new one, which it announces with a
 * {@code bridge/session} message and removes again when it disconnects. Every text message is
 * submitted as a client message; every frame delivered to the session is pushed back.
 */
@Component
public class BridgeWebSocketHandler extends TextWebSocketHandler {

	static final String SESSION_PARAMETER = "session";

	static final String SESSION_ANNOUNCEMENT = "bridge/session";

	private static final Logger logger = LoggerFactory.getLogger(BridgeWebSocketHandler.class);

	private final BridgeControlService controlService;

	private final BridgeProperties.WebSocket settings;

	private final ObjectMapper mapper = ContentLengthCodec.mapper();

	private final Map<String, Binding> bindings = new ConcurrentHashMap<>();

	public BridgeWebSocketHandler(BridgeControlService controlService, BridgeProperties properties) {
		this.controlService = controlService;
		this.settings = properties.getWebsocket();
	}

	@Override
	public void afterConnectionEstablished(WebSocketSession socket) throws IOException {
		String requested = requestedSession(socket.getUri());
		WebSocketSubscriber subscriber = new WebSocketSubscriber(socket, this.settings.getSendTimeLimit(),
				this.settings.getSendBufferSizeLimit());
		String sessionId;
		boolean owned;
		if (requested != null) {
			if (!this.controlService.sessionExists(requested)) {
				logger.warn("WebSocket {} asked for unknown session {}", socket.getId(), requested);
				socket.close(CloseStatus.POLICY_VIOLATION.withReason("Unknown session"));
				return;
			}
			sessionId = requested;
			owned = false;
		}
		else {
			sessionId = this.controlService.registerSession();
			owned = true;
			ObjectNode announcement = this.mapper.createObjectNode();
			announcement.put("type", SESSION_ANNOUNCEMENT);
			announcement.put("session", sessionId);
			subscriber.send(announcement);
		}
		this.bindings.put(socket.getId(), new Binding(sessionId, subscriber, owned));
		try {
			this.controlService.attach(sessionId, subscriber);
		}
		catch (SessionNotFoundException ex) {
			this.bindings.remove(socket.getId());
			socket.close(CloseStatus.POLICY_VIOLATION.withReason("Unknown session"));
			return;
		}
		logger.info("WebSocket {} attached to session {}", socket.getId(), sessionId);
	}

	@Override
	protected void handleTextMessage(WebSocketSession socket, TextMessage message) throws IOException {
		Binding binding = this.bindings.get(socket.getId());
		if (binding == null) {
			return;
		}
		JsonNode payload;
		try {
			payload = this.mapper.readTree(message.getPayload());
		}
		catch (JsonProcessingException ex) {
			logger.debug("Unparseable message on WebSocket {}: {}", socket.getId(), ex.getOriginalMessage());
			binding.subscriber().send(error(NullNode.getInstance(), -32700, "Parse error", ex.getOriginalMessage()));
			return;
		}
		if (payload == null || payload.isMissingNode()) {
			binding.subscriber().send(error(NullNode.getInstance(), -32700, "Parse error", "empty message"));
			return;
		}
		try {
			this.controlService.submit(binding.sessionId(), payload);
		}
		catch (SessionNotFoundException ex) {
			logger.info("Session {} of WebSocket {} is gone; closing", binding.sessionId(), socket.getId());
			this.bindings.remove(socket.getId());
			socket.close(CloseStatus.GOING_AWAY.withReason("Session expired"));
		}
		catch (BridgeUnavailableException ex) {
			JsonNode id = payload.path("id");
			binding.subscriber()
				.send(error(id.isMissingNode() ? NullNode.getInstance() : id, -32603, "Bridge unavailable",
						ex.getMessage()));
		}
	}

	@Override
	public void handleTransportError(WebSocketSession socket, Throwable exception) {
		logger.warn("Transport error on WebSocket {}", socket.getId(), exception);
		release(socket);
	}

	@Override
	public void afterConnectionClosed(WebSocketSession socket, CloseStatus status) {
		logger.info("WebSocket {} closed with status {}", socket.getId(), status);
		release(socket);
	}

	private void release(WebSocketSession socket) {
		Binding binding = this.bindings.remove(socket.getId());
		if (binding == null) {
			return;
		}
		this.controlService.detach(binding.sessionId(), binding.subscriber());
		if (binding.owned()) {
			try {
				this.controlService.terminateSession(binding.sessionId());
			}
			catch (SessionNotFoundException ex) {
				logger.debug("Session {} was already removed", binding.sessionId());
			}
		}
	}

	private ObjectNode error(JsonNode id, int code, String message, String detail) {
		ObjectNode response = this.mapper.createObjectNode();
		response.put("jsonrpc", "2.0");
		response.set("id", id);
		ObjectNode error = response.putObject("error");
		error.put("code", code);
		error.put("message", message);
		if (detail != null) {
			error.putObject("data").put("message", detail);
		}
		return response;
	}

	static String requestedSession(URI uri) {
		if (uri == null) {
			return null;
		}
		String value = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(SESSION_PARAMETER);
		return value == null || value.isBlank() ? null : value;
	}

	private record Binding(String sessionId, WebSocketSubscriber subscriber, boolean owned) {
	}

}
