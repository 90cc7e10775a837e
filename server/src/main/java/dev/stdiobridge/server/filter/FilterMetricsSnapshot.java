package dev.stdiobridge.server.filter;

/**
 * Read-only view of {@link FilterMetrics}.
 * @param totalMessages messages run through the pipeline, cache hits included
 * @param blockedMessages messages blocked by a filter
 * @param piiRedactions PII items masked
 * @param secretRedactions secrets masked
 * @param contentSanitizations messages whose markup was rewritten
 * @param responseSummaries messages summarized
 * @param responseTruncations messages truncated
 * @param filterFaults filter invocations that threw and were skipped
 * @param cacheHits cache lookups that returned a result
 * @param cacheMisses cache lookups that missed
 * @param averageProcessingMicros mean time spent per message
 * @param cacheHitRate hits divided by lookups
 * @param cacheSize entries currently cached
 */
public record FilterMetricsSnapshot(long totalMessages, long blockedMessages, long piiRedactions,
		long secretRedactions, long contentSanitizations, long responseSummaries, long responseTruncations,
		long filterFaults, long cacheHits, long cacheMisses, double averageProcessingMicros, double cacheHitRate,
		int cacheSize) {
}
