package dev.stdiobridge.server.control;

import java.time.Duration;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import dev.stdiobridge.server.broker.Broker;
import dev.stdiobridge.server.config.BridgeProperties;
import dev.stdiobridge.server.session.SessionRegistry;

/**
 * Periodically removes idle sessions and forgets requests that never got a response.
 */
@Component
public class IdleSessionSweeper {

	private final SessionRegistry registry;

	private final Broker broker;

	private final Duration maxIdle;

	public IdleSessionSweeper(SessionRegistry registry, Broker broker, BridgeProperties properties) {
		this.registry = registry;
		this.broker = broker;
		this.maxIdle = properties.getSession().getMaxIdle();
	}

	@Scheduled(fixedDelayString = "${bridge.session.sweep-interval-ms:30000}",
			initialDelayString = "${bridge.session.sweep-interval-ms:30000}")
	public void sweep() {
		this.registry.sweepIdle(this.maxIdle).forEach(this.broker::removeSession);
		this.broker.expireCorrelations();
	}

}
