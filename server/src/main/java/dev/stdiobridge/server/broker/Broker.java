package dev.stdiobridge.server.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.stdiobridge.server.filter.Direction;
import dev.stdiobridge.server.filter.FilterPipeline;
import dev.stdiobridge.server.filter.FilterResult;
import dev.stdiobridge.server.process.ChildChannel;
import dev.stdiobridge.server.process.StdioProcess;
import dev.stdiobridge.server.session.Session;
import dev.stdiobridge.server.session.SessionRegistry;
import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes traffic between many sessions and the single child.
 * <p>
 * Client messages are filtered, correlated by id and written to the child through the in-flight
 * gate. A pump thread drains the child: responses whose id is in the correlation table go to the
 * owning session only, everything else goes to every session registered at that moment. Each
 * target session gets its own filter run.
 */
public class Broker implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Broker.class);

    public static final int BLOCKED_ERROR_CODE = -32000;
    public static final String BLOCKED_ERROR_MESSAGE = "Blocked by content policy";
    public static final String BRIDGE_ERROR_METHOD = "bridge/error";

    private static final String NOTIFICATION_PREFIX = "notifications/";

    private final ChildChannel child;
    private final SessionRegistry registry;
    private final FilterPipeline pipeline;
    private final BrokerSettings settings;
    private final Clock clock;
    private final CorrelationTable correlations = new CorrelationTable();
    private final InFlightGate gate;
    private final AtomicLong receivedFromChild = new AtomicLong();
    private final AtomicReference<String> downReason = new AtomicReference<>();

    private Thread pumpThread;
    private volatile boolean running;
    private volatile Instant startedAt;

    public Broker(ChildChannel child, SessionRegistry registry, FilterPipeline pipeline, BrokerSettings settings,
                  Clock clock) {
        this.child = child;
        this.registry = registry;
        this.pipeline = pipeline;
        this.settings = settings;
        this.clock = clock;
        this.gate = new InFlightGate(settings.maxInFlight(), settings.permitPollInterval());
    }

    public void start() {
        if (running) {
            return;
        }
        running = true;
        startedAt = clock.instant();
        pumpThread = new Thread(this::pump, "broker-pump");
        pumpThread.setDaemon(true);
        pumpThread.start();
        LOGGER.info("Broker started (max in-flight {})", settings.maxInFlight());
    }

    /**
     * Route a client message toward the child.
     *
     * @return whether the message was forwarded or blocked, with its final id
     * @throws dev.stdiobridge.server.session.SessionNotFoundException when the session is unknown
     * @throws BridgeUnavailableException when the bridge is down or the write fails
     */
    public Submission submit(String sessionId, JsonNode message) {
        Session session = registry.get(sessionId);
        session.touch();
        String down = downReason.get();
        if (down != null) {
            throw new BridgeUnavailableException("Bridge is down: " + down);
        }

        JsonNode outbound = normalize(message);
        JsonNode id = outbound.get("id");
        boolean correlated = outbound.has("method") && CorrelationTable.isCorrelatable(id);
        if (correlated) {
            correlations.register(id, sessionId, clock.instant())
                .filter(previous -> !previous.equals(sessionId))
                .ifPresent(previous -> LOGGER.debug("Request id {} reassigned from session {} to {}", id, previous,
                    sessionId));
        }

        FilterResult result = pipeline.apply(Direction.CLIENT_TO_SERVER, sessionId, outbound);
        if (result.blocked()) {
            if (correlated) {
                correlations.release(id, sessionId);
            }
            registry.deliver(sessionId, blockedError(id, result));
            return new Submission(Submission.Status.BLOCKED, id, result.blockReason());
        }

        try {
            gate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (correlated) {
                correlations.release(id, sessionId);
            }
            throw new BridgeUnavailableException("Interrupted while waiting for an in-flight permit", e);
        }
        try {
            child.send(result.message());
        } catch (IOException e) {
            if (correlated) {
                correlations.release(id, sessionId);
            }
            markDown("write to child failed: " + e.getMessage());
            throw new BridgeUnavailableException("Failed to write to child", e);
        } finally {
            gate.release();
        }
        return new Submission(Submission.Status.FORWARDED, id, null);
    }

    /**
     * Fill in {@code jsonrpc} and, for requests without one, a fresh id. Works on a copy.
     */
    static JsonNode normalize(JsonNode message) {
        if (!message.isObject()) {
            return message;
        }
        ObjectNode copy = ((ObjectNode) message).deepCopy();
        if (!copy.has("jsonrpc")) {
            copy.put("jsonrpc", "2.0");
        }
        JsonNode method = copy.get("method");
        if (!copy.has("id") && method != null && method.isTextual()
            && !method.textValue().startsWith(NOTIFICATION_PREFIX)) {
            copy.put("id", UUID.randomUUID().toString());
        }
        return copy;
    }

    static ObjectNode blockedError(JsonNode id, FilterResult result) {
        ObjectNode response = JsonNodeFactory.instance.objectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id == null ? NullNode.getInstance() : id);
        ObjectNode error = response.putObject("error");
        error.put("code", BLOCKED_ERROR_CODE);
        error.put("message", BLOCKED_ERROR_MESSAGE);
        ObjectNode data = error.putObject("data");
        data.put("reason", result.blockReason());
        data.put("filter", result.blockedBy());
        return response;
    }

    private void pump() {
        while (running) {
            JsonNode message;
            try {
                message = child.receive();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (IOException e) {
                if (running) {
                    fail(e.getMessage());
                }
                break;
            }
            receivedFromChild.incrementAndGet();
            try {
                route(message);
            } catch (RuntimeException e) {
                LOGGER.error("Failed to route message from child", e);
            }
        }
        LOGGER.debug("Broker pump stopped");
    }

    void route(JsonNode message) {
        JsonNode id = message.get("id");
        if (isResponse(message)) {
            var owner = correlations.pop(id);
            if (owner.isPresent()) {
                String sessionId = owner.get();
                if (registry.contains(sessionId)) {
                    deliverFiltered(sessionId, message);
                } else {
                    LOGGER.debug("Dropping response {} for departed session {}", id, sessionId);
                }
                return;
            }
            if (id.isTextual() && StdioProcess.HEALTH_PROBE_ID.equals(id.textValue())) {
                LOGGER.debug("Dropping late health probe response");
                return;
            }
        }
        for (String sessionId : registry.ids()) {
            deliverFiltered(sessionId, message);
        }
    }

    private static boolean isResponse(JsonNode message) {
        return message.isObject() && CorrelationTable.isCorrelatable(message.get("id")) && !message.has("method")
            && (message.has("result") || message.has("error"));
    }

    private void deliverFiltered(String sessionId, JsonNode message) {
        FilterResult result = pipeline.apply(Direction.SERVER_TO_CLIENT, sessionId, message);
        if (result.blocked()) {
            LOGGER.debug("Message for session {} blocked by {}: {}", sessionId, result.blockedBy(),
                result.blockReason());
            return;
        }
        registry.deliver(sessionId, result.message());
    }

    private void fail(String reason) {
        markDown(reason);
        LOGGER.error("Bridge is down: {}", reason);
        ObjectNode event = JsonNodeFactory.instance.objectNode();
        event.put("jsonrpc", "2.0");
        event.put("method", BRIDGE_ERROR_METHOD);
        event.putObject("params").put("error", reason);
        for (String sessionId : registry.ids()) {
            registry.deliver(sessionId, event.deepCopy());
        }
    }

    private void markDown(String reason) {
        downReason.compareAndSet(null, reason == null ? "unknown error" : reason);
    }

    /**
     * Remove a session and forget the requests it still has in flight.
     *
     * @return {@code true} when the session existed
     */
    public boolean removeSession(String sessionId) {
        boolean removed = registry.remove(sessionId);
        int forgotten = correlations.removeSession(sessionId);
        if (forgotten > 0) {
            LOGGER.debug("Forgot {} pending request(s) of session {}", forgotten, sessionId);
        }
        return removed;
    }

    /**
     * Forget requests unanswered for longer than the configured TTL.
     *
     * @return number of entries dropped
     */
    public int expireCorrelations() {
        Duration ttl = settings.correlationTtl();
        if (ttl.isZero() || ttl.isNegative()) {
            return 0;
        }
        int expired = correlations.expireOlderThan(ttl, clock.instant());
        if (expired > 0) {
            LOGGER.warn("Expired {} request(s) that got no response within {}", expired, ttl);
        }
        return expired;
    }

    public boolean isUp() {
        return running && downReason.get() == null;
    }

    public BrokerStatus status() {
        Instant started = startedAt;
        Duration uptime = started == null ? Duration.ZERO : Duration.between(started, clock.instant());
        return new BrokerStatus(isUp(), downReason.get(), started, uptime, registry.size(), receivedFromChild.get(),
            gate.inUse(), gate.maxPermits(), correlations.size());
    }

    CorrelationTable correlations() {
        return correlations;
    }

    @Override
    public void close() {
        if (!running) {
            return;
        }
        running = false;
        if (pumpThread != null) {
            pumpThread.interrupt();
            try {
                pumpThread.join(Duration.ofSeconds(1).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        LOGGER.info("Broker stopped");
    }
}
