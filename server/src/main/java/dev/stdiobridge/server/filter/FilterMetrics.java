package dev.stdiobridge.server.filter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Running counters for the pipeline. Updated concurrently from every session's filter runs.
 */
public class FilterMetrics {

	private final LongAdder totalMessages = new LongAdder();

	private final LongAdder blockedMessages = new LongAdder();

	private final LongAdder piiRedactions = new LongAdder();

	private final LongAdder secretRedactions = new LongAdder();

	private final LongAdder contentSanitizations = new LongAdder();

	private final LongAdder responseSummaries = new LongAdder();

	private final LongAdder responseTruncations = new LongAdder();

	private final LongAdder filterFaults = new LongAdder();

	private final LongAdder cacheHits = new LongAdder();

	private final LongAdder cacheMisses = new LongAdder();

	private final LongAdder processingNanos = new LongAdder();

	void recordMessage(long elapsedNanos) {
		this.totalMessages.increment();
		this.processingNanos.add(elapsedNanos);
	}

	void recordBlocked() {
		this.blockedMessages.increment();
	}

	void recordFault() {
		this.filterFaults.increment();
	}

	void recordCacheHit() {
		this.cacheHits.increment();
	}

	void recordCacheMiss() {
		this.cacheMisses.increment();
	}

	void recordActions(List<FilterAction> actions, Map<String, Integer> redactions) {
		for (FilterAction action : actions) {
			switch (action) {
				case SANITIZED -> this.contentSanitizations.increment();
				case SUMMARIZED -> this.responseSummaries.increment();
				case TRUNCATED -> this.responseTruncations.increment();
				default -> {
				}
			}
		}
		redactions.forEach((category, count) -> {
			if (PiiCategories.SECRET.equals(category)) {
				this.secretRedactions.add(count);
			}
			else {
				this.piiRedactions.add(count);
			}
		});
	}

	/**
	 * Point-in-time copy of the counters.
	 * @param cacheSize current number of cached results
	 * @return snapshot
	 */
	public FilterMetricsSnapshot snapshot(int cacheSize) {
		long total = this.totalMessages.sum();
		long hits = this.cacheHits.sum();
		long misses = this.cacheMisses.sum();
		double averageMicros = total == 0 ? 0.0 : this.processingNanos.sum() / 1_000.0 / total;
		double hitRate = hits + misses == 0 ? 0.0 : (double) hits / (hits + misses);
		return new FilterMetricsSnapshot(total, this.blockedMessages.sum(), this.piiRedactions.sum(),
				this.secretRedactions.sum(), this.contentSanitizations.sum(), this.responseSummaries.sum(),
				this.responseTruncations.sum(), this.filterFaults.sum(), hits, misses, averageMicros, hitRate,
				cacheSize);
	}

}
