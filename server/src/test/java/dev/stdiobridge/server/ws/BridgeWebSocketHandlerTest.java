package dev.stdiobridge.server.ws;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.net.URI;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import dev.stdiobridge.server.broker.BridgeUnavailableException;
import dev.stdiobridge.server.config.BridgeProperties;
import dev.stdiobridge.server.control.BridgeControlService;
import dev.stdiobridge.server.session.SessionNotFoundException;
import dev.stdiobridge.server.session.Subscriber;

class BridgeWebSocketHandlerTest {

	private final ObjectMapper mapper = new ObjectMapper();

	private BridgeControlService controlService;

	private WebSocketSession socket;

	private BridgeWebSocketHandler handler;

	@BeforeEach
	void setUp() {
		this.controlService = mock(BridgeControlService.class);
		this.socket = mock(WebSocketSession.class);
		given(this.socket.getId()).willReturn("ws-1");
		given(this.socket.isOpen()).willReturn(true);
		this.handler = new BridgeWebSocketHandler(this.controlService, new BridgeProperties());
	}

	@Test
	void newConnectionRegistersAndAnnouncesASession() throws Exception {
		given(this.socket.getUri()).willReturn(URI.create("ws://localhost/bridge"));
		given(this.controlService.registerSession()).willReturn("abc");

		this.handler.afterConnectionEstablished(this.socket);

		JsonNode announcement = this.mapper.readTree(sentPayloads()[0]);
		assertThat(announcement.get("type").asText()).isEqualTo("bridge/session");
		assertThat(announcement.get("session").asText()).isEqualTo("abc");
		verify(this.controlService).attach(eq("abc"), any(Subscriber.class));
	}

	@Test
	void connectionCanJoinAnExistingSession() throws Exception {
		given(this.socket.getUri()).willReturn(URI.create("ws://localhost/bridge?session=abc"));
		given(this.controlService.sessionExists("abc")).willReturn(true);

		this.handler.afterConnectionEstablished(this.socket);
		this.handler.afterConnectionClosed(this.socket, CloseStatus.NORMAL);

		verify(this.controlService, never()).registerSession();
		verify(this.controlService).attach(eq("abc"), any(Subscriber.class));
		verify(this.controlService).detach(eq("abc"), any(Subscriber.class));
		verify(this.controlService, never()).terminateSession("abc");
	}

	@Test
	void unknownRequestedSessionClosesTheSocket() throws Exception {
		given(this.socket.getUri()).willReturn(URI.create("ws://localhost/bridge?session=missing"));

		this.handler.afterConnectionEstablished(this.socket);

		ArgumentCaptor<CloseStatus> status = ArgumentCaptor.forClass(CloseStatus.class);
		verify(this.socket).close(status.capture());
		assertThat(status.getValue().getCode()).isEqualTo(CloseStatus.POLICY_VIOLATION.getCode());
		verify(this.controlService, never()).attach(any(), any());
	}

	@Test
	void textMessagesAreSubmittedForTheBoundSession() throws Exception {
		connectNewSession("abc");

		this.handler.handleTextMessage(this.socket,
				new TextMessage("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}"));

		ArgumentCaptor<JsonNode> submitted = ArgumentCaptor.forClass(JsonNode.class);
		verify(this.controlService).submit(eq("abc"), submitted.capture());
		assertThat(submitted.getValue().get("method").asText()).isEqualTo("tools/list");
	}

	@Test
	void invalidJsonIsAnsweredWithAParseError() throws Exception {
		connectNewSession("abc");

		this.handler.handleTextMessage(this.socket, new TextMessage("{not json"));

		String[] payloads = sentPayloads();
		JsonNode error = this.mapper.readTree(payloads[payloads.length - 1]);
		assertThat(error.get("id").isNull()).isTrue();
		assertThat(error.at("/error/code").asInt()).isEqualTo(-32700);
		verify(this.controlService, never()).submit(any(), any());
	}

	@Test
	void unavailableBridgeIsReportedWithTheRequestId() throws Exception {
		connectNewSession("abc");
		willThrow(new BridgeUnavailableException("Bridge is down: child exited")).given(this.controlService)
			.submit(eq("abc"), any());

		this.handler.handleTextMessage(this.socket, new TextMessage("{\"id\":\"r1\",\"method\":\"tools/list\"}"));

		String[] payloads = sentPayloads();
		JsonNode error = this.mapper.readTree(payloads[payloads.length - 1]);
		assertThat(error.get("id").asText()).isEqualTo("r1");
		assertThat(error.at("/error/code").asInt()).isEqualTo(-32603);
	}

	@Test
	void expiredSessionClosesTheSocket() throws Exception {
		connectNewSession("abc");
		willThrow(new SessionNotFoundException("abc")).given(this.controlService).submit(eq("abc"), any());

		this.handler.handleTextMessage(this.socket, new TextMessage("{\"method\":\"ping\"}"));

		ArgumentCaptor<CloseStatus> status = ArgumentCaptor.forClass(CloseStatus.class);
		verify(this.socket).close(status.capture());
		assertThat(status.getValue().getCode()).isEqualTo(CloseStatus.GOING_AWAY.getCode());
	}

	@Test
	void closingAnOwningConnectionTerminatesItsSession() throws Exception {
		connectNewSession("abc");

		this.handler.afterConnectionClosed(this.socket, CloseStatus.NORMAL);
		this.handler.afterConnectionClosed(this.socket, CloseStatus.NORMAL);

		verify(this.controlService).terminateSession("abc");
	}

	@Test
	void readsTheRequestedSessionFromTheQuery() {
		assertThat(BridgeWebSocketHandler.requestedSession(URI.create("ws://h/bridge?session=x1&other=2")))
			.isEqualTo("x1");
		assertThat(BridgeWebSocketHandler.requestedSession(URI.create("ws://h/bridge?session="))).isNull();
		assertThat(BridgeWebSocketHandler.requestedSession(URI.create("ws://h/bridge"))).isNull();
		assertThat(BridgeWebSocketHandler.requestedSession(null)).isNull();
	}

	private void connectNewSession(String sessionId) throws Exception {
		given(this.socket.getUri()).willReturn(URI.create("ws://localhost/bridge"));
		given(this.controlService.registerSession()).willReturn(sessionId);
		this.handler.afterConnectionEstablished(this.socket);
	}

	private String[] sentPayloads() throws Exception {
		ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
		verify(this.socket, atLeastOnce()).sendMessage(sent.capture());
		return sent.getAllValues().stream().map(TextMessage::getPayload).toArray(String[]::new);
	}

}
