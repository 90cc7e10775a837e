package dev.stdiobridge.server.filter;

import java.util.Set;

/**
 * Control-surface view of a registered filter.
 * @param name unique filter name
 * @param enabled whether the current configuration snapshot enables it
 * @param description human readable summary
 * @param directions directions the filter runs for
 */
public record FilterInfo(String name, boolean enabled, String description, Set<Direction> directions) {
}
