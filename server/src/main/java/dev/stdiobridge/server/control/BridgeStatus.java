package dev.stdiobridge.server.control;

import dev.stdiobridge.server.broker.BrokerStatus;
import dev.stdiobridge.server.filter.FilterMetricsSnapshot;

/**
 * Health of the whole bridge.
 * @param broker routing state
 * @param filters filter counters
 */
public record BridgeStatus(BrokerStatus broker, FilterMetricsSnapshot filters) {
}
