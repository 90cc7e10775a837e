package dev.stdiobridge.server.session;

import java.time.Duration;
import java.time.Instant;

/**
 * Control-surface view of a session.
 * @param id session id
 * @param queueDepth frames waiting in the outbound queue
 * @param subscriberCount attached live subscribers
 * @param createdAt creation time
 * @param idleFor time since the last client activity
 * @param delivered frames accepted for delivery
 * @param dropped frames dropped because the queue was full
 */
public record SessionInfo(String id, int queueDepth, int subscriberCount, Instant createdAt, Duration idleFor,
		long delivered, long dropped) {
}
