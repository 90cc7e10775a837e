package dev.stdiobridge.server.broker;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps the id of every request still awaiting its response to the session that sent it. String
 * and number ids never collide: {@code "1"} and {@code 1} are different keys, and so are
 * {@code 1} and {@code 1.0}.
 */
public class CorrelationTable {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    /**
     * Whether an id can be correlated. JSON-RPC ids are strings or numbers.
     */
    public static boolean isCorrelatable(JsonNode id) {
        return id != null && (id.isTextual() || id.isNumber());
    }

    static String key(JsonNode id) {
        if (id.isTextual()) {
            return "s:" + id.textValue();
        }
        if (id.isIntegralNumber()) {
            return "n:" + id.bigIntegerValue();
        }
        // 1.0 and 1 are different ids
        return "n:" + id.toString();
    }

    /**
     * Record that {@code sessionId} owns {@code id}, replacing any stale owner.
     *
     * @return the previous owner, if there was one
     */
    public Optional<String> register(JsonNode id, String sessionId, Instant sentAt) {
        Entry previous = entries.put(key(id), new Entry(sessionId, sentAt));
        return previous == null ? Optional.empty() : Optional.of(previous.sessionId());
    }

    /**
     * Remove and return the owner of {@code id}.
     */
    public Optional<String> pop(JsonNode id) {
        if (!isCorrelatable(id)) {
            return Optional.empty();
        }
        Entry entry = entries.remove(key(id));
        return entry == null ? Optional.empty() : Optional.of(entry.sessionId());
    }

    /**
     * Remove {@code id} only while {@code sessionId} still owns it.
     */
    public boolean release(JsonNode id, String sessionId) {
        String key = key(id);
        Entry entry = entries.get(key);
        return entry != null && entry.sessionId().equals(sessionId) && entries.remove(key, entry);
    }

    public int removeSession(String sessionId) {
        int before = entries.size();
        entries.values().removeIf(entry -> entry.sessionId().equals(sessionId));
        return Math.max(0, before - entries.size());
    }

    /**
     * Drop entries whose response has been outstanding longer than {@code ttl}.
     *
     * @return number of entries dropped
     */
    public int expireOlderThan(Duration ttl, Instant now) {
        Instant cutoff = now.minus(ttl);
        int before = entries.size();
        entries.values().removeIf(entry -> entry.sentAt().isBefore(cutoff));
        return Math.max(0, before - entries.size());
    }

    public int size() {
        return entries.size();
    }

    private record Entry(String sessionId, Instant sentAt) {
    }
}
