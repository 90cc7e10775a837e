package dev.stdiobridge.server.broker;

import java.time.Duration;

/**
 * @param maxInFlight writes to the child allowed at once
 * @param permitPollInterval sleep between attempts to get an in-flight permit
 * @param correlationTtl age after which an unanswered request is forgotten; zero keeps it forever
 */
public record BrokerSettings(int maxInFlight, Duration permitPollInterval, Duration correlationTtl) {

    public static final int DEFAULT_MAX_IN_FLIGHT = 128;
    public static final Duration DEFAULT_PERMIT_POLL_INTERVAL = Duration.ofMillis(2);
    public static final Duration DEFAULT_CORRELATION_TTL = Duration.ofMinutes(10);

    public BrokerSettings {
        permitPollInterval = permitPollInterval == null ? DEFAULT_PERMIT_POLL_INTERVAL : permitPollInterval;
        correlationTtl = correlationTtl == null ? Duration.ZERO : correlationTtl;
    }

    public static BrokerSettings defaults() {
        return new BrokerSettings(DEFAULT_MAX_IN_FLIGHT, DEFAULT_PERMIT_POLL_INTERVAL, DEFAULT_CORRELATION_TTL);
    }
}
