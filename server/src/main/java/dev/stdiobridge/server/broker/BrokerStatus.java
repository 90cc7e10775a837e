package dev.stdiobridge.server.broker;

import java.time.Duration;
import java.time.Instant;

/**
 * @param running whether the pump is draining the child
 * @param downReason why the bridge went down, {@code null} while it is up
 * @param startedAt when the pump started
 * @param uptime time since start
 * @param sessions live sessions
 * @param receivedFromChild messages read from the child so far
 * @param inFlight writes to the child in progress
 * @param maxInFlight in-flight limit
 * @param pendingCorrelations requests awaiting a response
 */
public record BrokerStatus(boolean running, String downReason, Instant startedAt, Duration uptime, int sessions,
                           long receivedFromChild, int inFlight, int maxInFlight, int pendingCorrelations) {
}
