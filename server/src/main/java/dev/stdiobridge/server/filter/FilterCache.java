package dev.stdiobridge.server.filter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Server-to-client results keyed by content hash. Every entry remembers the configuration version
 * it was computed under and is only served to runs using that same version.
 */
class FilterCache {

	private final Map<String, Entry> entries = new ConcurrentHashMap<>();

	private final Clock clock;

	FilterCache(Clock clock) {
		this.clock = clock;
	}

	FilterResult get(String key, long configVersion, Duration ttl) {
		Entry entry = this.entries.get(key);
		if (entry == null) {
			return null;
		}
		if (entry.configVersion != configVersion || entry.storedAt.plus(ttl).isBefore(this.clock.instant())) {
			this.entries.remove(key, entry);
			return null;
		}
		return entry.result;
	}

	void put(String key, FilterResult result, int maxEntries) {
		this.entries.put(key, new Entry(result, result.configVersion(), this.clock.instant()));
		if (this.entries.size() > maxEntries) {
			evictOldest(Math.max(1, maxEntries / 10));
		}
	}

	void clear() {
		this.entries.clear();
	}

	int size() {
		return this.entries.size();
	}

	private synchronized void evictOldest(int count) {
		this.entries.entrySet()
			.stream()
			.sorted(Comparator.comparing(e -> e.getValue().storedAt))
			.limit(count)
			.map(Map.Entry::getKey)
			.toList()
			.forEach(this.entries::remove);
	}

	private record Entry(FilterResult result, long configVersion, Instant storedAt) {
	}

}
