package dev.stdiobridge.server.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import dev.stdiobridge.server.ws.BridgeWebSocketHandler;
import lombok.RequiredArgsConstructor;

/**
 * Registers the WebSocket delivery endpoint with the servlet container.
 */
@Configuration
@EnableWebSocket
@ConditionalOnWebApplication
@ConditionalOnProperty(prefix = "bridge.websocket", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class WebSocketTransportRegistration implements WebSocketConfigurer {

	private final BridgeWebSocketHandler handler;

	private final BridgeProperties properties;

	@Override
	public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
		registry.addHandler(this.handler, this.properties.getWebsocket().getEndpoint()).setAllowedOrigins("*");
	}

}
