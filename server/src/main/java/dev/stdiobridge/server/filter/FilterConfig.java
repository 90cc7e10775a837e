package dev.stdiobridge.server.filter;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import lombok.Builder;

/**
 * Immutable snapshot of every filter toggle, list and threshold. The pipeline swaps whole snapshots
 * atomically, so a message is always filtered against exactly one of them.
 * @param version monotonically increasing version assigned by the pipeline on every swap
 * @param filterToggles explicit per-filter enablement, overriding each filter's default
 * @param blockedDomains domains that block a client message when found anywhere in its strings
 * @param blockedKeywords keywords that block a client message, matched case-insensitively
 * @param blockedPatterns regular expressions that block a client message when found
 * @param removeScripts strip script-like elements and dangerous attributes from markup
 * @param removeTracking also strip images, which are commonly tracking pixels
 * @param removeAds also strip {@code <ins>} and {@code <aside>} ad containers
 * @param normalizeWhitespace collapse whitespace runs in sanitized markup
 * @param redactEmails mask email addresses
 * @param redactPhones mask phone numbers
 * @param redactSsns mask SSN-shaped numbers
 * @param redactCreditCards mask credit card numbers
 * @param maxResponseLength hard cap on the string content of a server message
 * @param summarizeThreshold string content above this length gets summarized
 * @param enableCaching cache server-to-client results by content hash
 * @param cacheTtl lifetime of a cached result
 * @param cacheMaxEntries cache size past which the oldest tenth is evicted
 * @param logBlockedContent log blocked messages at WARN
 * @param logPiiRedactions log PII redactions at INFO
 * @param logResponseSummaries log summarization and truncation at INFO
 */
@Builder(toBuilder = true)
public record FilterConfig(long version, Map<String, Boolean> filterToggles, List<String> blockedDomains,
		List<String> blockedKeywords, List<String> blockedPatterns, boolean removeScripts, boolean removeTracking,
		boolean removeAds, boolean normalizeWhitespace, boolean redactEmails, boolean redactPhones,
		boolean redactSsns, boolean redactCreditCards, int maxResponseLength, int summarizeThreshold,
		boolean enableCaching, Duration cacheTtl, int cacheMaxEntries, boolean logBlockedContent,
		boolean logPiiRedactions, boolean logResponseSummaries) {

	public static final int DEFAULT_MAX_RESPONSE_LENGTH = 15_000;

	public static final int DEFAULT_SUMMARIZE_THRESHOLD = 5_000;

	public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(300);

	public static final int DEFAULT_CACHE_MAX_ENTRIES = 1_000;

	public FilterConfig {
		filterToggles = filterToggles == null ? Map.of() : Map.copyOf(filterToggles);
		blockedDomains = blockedDomains == null ? List.of() : List.copyOf(blockedDomains);
		blockedKeywords = blockedKeywords == null ? List.of() : List.copyOf(blockedKeywords);
		blockedPatterns = blockedPatterns == null ? List.of() : List.copyOf(blockedPatterns);
		cacheTtl = cacheTtl == null ? DEFAULT_CACHE_TTL : cacheTtl;
		if (maxResponseLength < 0 || summarizeThreshold < 0 || cacheMaxEntries < 0) {
			throw new IllegalArgumentException("Filter thresholds must not be negative");
		}
	}

	/**
	 * Configuration with every built-in default applied.
	 * @return default configuration at version 0
	 */
	public static FilterConfig defaults() {
		return defaultBuilder().build();
	}

	/**
	 * Builder pre-populated with the defaults, for overriding a few settings.
	 * @return builder holding the defaults
	 */
	public static FilterConfigBuilder defaultBuilder() {
		return builder().removeScripts(true)
			.removeTracking(true)
			.removeAds(true)
			.normalizeWhitespace(true)
			.redactEmails(true)
			.redactPhones(true)
			.redactSsns(true)
			.redactCreditCards(true)
			.maxResponseLength(DEFAULT_MAX_RESPONSE_LENGTH)
			.summarizeThreshold(DEFAULT_SUMMARIZE_THRESHOLD)
			.enableCaching(true)
			.cacheTtl(DEFAULT_CACHE_TTL)
			.cacheMaxEntries(DEFAULT_CACHE_MAX_ENTRIES)
			.logBlockedContent(true)
			.logPiiRedactions(true)
			.logResponseSummaries(true);
	}

	/**
	 * Resolve whether a filter is enabled in this snapshot.
	 * @param filterName filter name
	 * @param defaultEnabled the filter's own default
	 * @return effective enablement
	 */
	public boolean isEnabled(String filterName, boolean defaultEnabled) {
		return this.filterToggles.getOrDefault(filterName, defaultEnabled);
	}

	/**
	 * Copy with one toggle changed. The version is left for the pipeline to assign.
	 * @param filterName filter to toggle
	 * @param enabled new enablement
	 * @return updated copy
	 */
	public FilterConfig withToggle(String filterName, boolean enabled) {
		Map<String, Boolean> toggles = new HashMap<>(this.filterToggles);
		toggles.put(Objects.requireNonNull(filterName, "filterName"), enabled);
		return toBuilder().filterToggles(toggles).build();
	}

	/**
	 * Copy stamped with the given version.
	 * @param version version to assign
	 * @return updated copy
	 */
	public FilterConfig withVersion(long version) {
		return toBuilder().version(version).build();
	}

}
