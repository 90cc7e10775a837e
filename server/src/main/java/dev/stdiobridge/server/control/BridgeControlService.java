package dev.stdiobridge.server.control;

import java.time.Duration;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import dev.stdiobridge.server.broker.Broker;
import dev.stdiobridge.server.broker.BridgeUnavailableException;
import dev.stdiobridge.server.broker.Submission;
import dev.stdiobridge.server.config.BridgeProperties;
import dev.stdiobridge.server.filter.FilterConfig;
import dev.stdiobridge.server.filter.FilterInfo;
import dev.stdiobridge.server.filter.FilterMetricsSnapshot;
import dev.stdiobridge.server.filter.FilterPipeline;
import dev.stdiobridge.server.filter.UnknownFilterException;
import dev.stdiobridge.server.session.Delivery;
import dev.stdiobridge.server.session.SessionInfo;
import dev.stdiobridge.server.session.SessionNotFoundException;
import dev.stdiobridge.server.session.SessionRegistry;
import dev.stdiobridge.server.session.Subscriber;

/**
 * Operations exposed to delivery adapters and operators: session lifecycle, message submission
 * and streaming, filter management and status.
 */
@Service
public class BridgeControlService {

	private static final Logger logger = LoggerFactory.getLogger(BridgeControlService.class);

	private final Broker broker;

	private final SessionRegistry registry;

	private final FilterPipeline pipeline;

	private final Duration heartbeatInterval;

	@Autowired
	public BridgeControlService(Broker broker, SessionRegistry registry, FilterPipeline pipeline,
			BridgeProperties properties) {
		this(broker, registry, pipeline, properties.getSession().getHeartbeatInterval());
	}

	BridgeControlService(Broker broker, SessionRegistry registry, FilterPipeline pipeline, Duration heartbeatInterval) {
		this.broker = broker;
		this.registry = registry;
		this.pipeline = pipeline;
		this.heartbeatInterval = heartbeatInterval;
	}

	/**
	 * Register a new client session.
	 * @return the session id
	 */
	public String registerSession() {
		return this.registry.create();
	}

	/**
	 * Submit a client message on behalf of a session.
	 * @param sessionId submitting session
	 * @param message JSON-RPC message
	 * @return whether it was forwarded or blocked
	 * @throws SessionNotFoundException when the session is unknown
	 * @throws BridgeUnavailableException when the child cannot be reached
	 */
	public Submission submit(String sessionId, JsonNode message) {
		return this.broker.submit(sessionId, message);
	}

	public List<SessionInfo> listSessions() {
		return this.registry.list();
	}

	/**
	 * Remove a session, dropping its queue and detaching its subscribers.
	 * @param sessionId session to remove
	 * @throws SessionNotFoundException when the session is unknown
	 */
	public void terminateSession(String sessionId) {
		if (!this.broker.removeSession(sessionId)) {
			throw new SessionNotFoundException(sessionId);
		}
	}

	/**
	 * Wait for the next frame of a session, or a heartbeat once the heartbeat interval passes.
	 * @param sessionId session to read from
	 * @return next delivery
	 * @throws InterruptedException when interrupted while waiting
	 */
	public Delivery nextDelivery(String sessionId) throws InterruptedException {
		return this.registry.get(sessionId).next(this.heartbeatInterval);
	}

	public void attach(String sessionId, Subscriber subscriber) {
		this.registry.get(sessionId).attach(subscriber);
	}

	public void detach(String sessionId, Subscriber subscriber) {
		this.registry.find(sessionId).ifPresent(session -> session.detach(subscriber));
	}

	public boolean sessionExists(String sessionId) {
		return this.registry.contains(sessionId);
	}

	public List<FilterInfo> listFilters() {
		return this.pipeline.listFilters();
	}

	/**
	 * Enable or disable a filter.
	 * @param name filter name
	 * @param enabled new enablement
	 * @return the configuration now in effect
	 * @throws UnknownFilterException when no filter has that name
	 */
	public FilterConfig toggleFilter(String name, boolean enabled) {
		return this.pipeline.toggle(name, enabled);
	}

	/**
	 * Replace the filter configuration wholesale.
	 * @param config new configuration
	 * @return the installed configuration, carrying its new version
	 */
	public FilterConfig replaceFilterConfig(FilterConfig config) {
		FilterConfig installed = this.pipeline.replaceConfig(config);
		logger.info("Installed filter configuration version {}", installed.version());
		return installed;
	}

	public FilterConfig filterConfig() {
		return this.pipeline.config();
	}

	public FilterMetricsSnapshot filterMetrics() {
		return this.pipeline.metrics();
	}

	public BridgeStatus status() {
		return new BridgeStatus(this.broker.status(), this.pipeline.metrics());
	}

}
