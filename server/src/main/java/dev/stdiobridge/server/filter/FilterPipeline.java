package dev.stdiobridge.server.filter;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.stdiobridge.server.filter.builtin.BlacklistFilter;
import dev.stdiobridge.server.filter.builtin.BridgeMetaFilter;
import dev.stdiobridge.server.filter.builtin.HtmlSanitizerFilter;
import dev.stdiobridge.server.filter.builtin.PiiRedactionFilter;
import dev.stdiobridge.server.filter.builtin.ResponseSizeFilter;
import dev.stdiobridge.server.filter.builtin.SecretMaskingFilter;

/**
 * Ordered chain of {@link MessageFilter}s sharing one atomically swapped {@link FilterConfig}.
 * <p>
 * Each run reads the configuration once and uses that snapshot for every filter, so a concurrent
 * swap never affects a message already in flight. Runs work on a private copy of the input, leaving
 * the caller's tree untouched; this is what allows the broker to filter one server message once
 * per target session.
 */
public class FilterPipeline {

	private static final Logger logger = LoggerFactory.getLogger(FilterPipeline.class);

	private final List<MessageFilter> filters;

	private final AtomicReference<FilterConfig> config;

	private final FilterCache cache;

	private final FilterMetrics metrics = new FilterMetrics();

	/**
	 * Create a pipeline over the given filters, in order.
	 * @param filters filters in execution order; names must be unique
	 * @param initialConfig starting configuration, whose version is kept
	 * @param clock clock used for cache expiry
	 */
	public FilterPipeline(List<MessageFilter> filters, FilterConfig initialConfig, Clock clock) {
		Set<String> names = new LinkedHashSet<>();
		for (MessageFilter filter : filters) {
			if (!names.add(filter.name())) {
				throw new IllegalArgumentException("Duplicate filter name " + filter.name());
			}
		}
		this.filters = List.copyOf(filters);
		this.config = new AtomicReference<>(Objects.requireNonNull(initialConfig, "initialConfig"));
		this.cache = new FilterCache(clock);
	}

	/**
	 * Pipeline carrying every built-in filter in their fixed order.
	 * @param initialConfig starting configuration
	 * @return new pipeline
	 */
	public static FilterPipeline withBuiltins(FilterConfig initialConfig) {
		return withBuiltins(initialConfig, Clock.systemUTC());
	}

	/**
	 * Pipeline carrying every built-in filter, with an explicit clock.
	 * @param initialConfig starting configuration
	 * @param clock clock for cache expiry and metadata stamps
	 * @return new pipeline
	 */
	public static FilterPipeline withBuiltins(FilterConfig initialConfig, Clock clock) {
		List<MessageFilter> builtins = List.of(new BlacklistFilter(), new HtmlSanitizerFilter(),
				new PiiRedactionFilter(), new ResponseSizeFilter(), new SecretMaskingFilter(),
				new BridgeMetaFilter(clock));
		return new FilterPipeline(builtins, initialConfig, clock);
	}

	/**
	 * Run a message through every enabled filter that applies to {@code direction}.
	 * @param direction direction of travel
	 * @param sessionId session the message comes from or goes to
	 * @param message message to filter; not modified
	 * @return the verdict, carrying a message the caller owns unless blocked
	 */
	public FilterResult apply(Direction direction, String sessionId, JsonNode message) {
		long started = System.nanoTime();
		FilterConfig snapshot = this.config.get();
		String cacheKey = cacheKey(direction, message, snapshot);
		if (cacheKey != null) {
			FilterResult cached = this.cache.get(cacheKey, snapshot.version(), snapshot.cacheTtl());
			if (cached != null) {
				this.metrics.recordCacheHit();
				this.metrics.recordMessage(System.nanoTime() - started);
				return cached.detached();
			}
			this.metrics.recordCacheMiss();
		}

		FilterResult result = run(direction, sessionId, message.deepCopy(), snapshot);
		this.metrics.recordActions(result.actionsTaken(), result.redactionCounts());
		if (result.blocked()) {
			this.metrics.recordBlocked();
		}
		else if (cacheKey != null) {
			this.cache.put(cacheKey, result.detached(), snapshot.cacheMaxEntries());
		}
		this.metrics.recordMessage(System.nanoTime() - started);
		return result;
	}

	private FilterResult run(Direction direction, String sessionId, JsonNode message, FilterConfig snapshot) {
		JsonNode current = message;
		List<FilterAction> actions = new ArrayList<>();
		Map<String, Integer> redactions = new LinkedHashMap<>();
		for (MessageFilter filter : this.filters) {
			if (!isActive(filter, direction, snapshot)) {
				continue;
			}
			FilterVerdict verdict;
			try {
				verdict = filter.apply(new FilterInvocation(direction, sessionId, current, snapshot));
			}
			catch (RuntimeException ex) {
				logger.warn("Filter {} failed on {} message for session {}; passing it through", filter.name(),
						direction.wireName(), sessionId, ex);
				this.metrics.recordFault();
				continue;
			}
			actions.addAll(verdict.actions());
			verdict.redactions().forEach((category, count) -> redactions.merge(category, count, Integer::sum));
			if (verdict.blocked()) {
				if (snapshot.logBlockedContent()) {
					logger.warn("Blocked {} message for session {} by {}: {}", direction.wireName(), sessionId,
							filter.name(), verdict.reason());
				}
				return FilterResult.blocked(filter.name(), verdict.reason(), actions, redactions, snapshot.version());
			}
			if (verdict.message() != null) {
				current = verdict.message();
			}
		}
		return new FilterResult(current, false, null, null, actions, redactions, snapshot.version());
	}

	private String cacheKey(Direction direction, JsonNode message, FilterConfig snapshot) {
		if (direction != Direction.SERVER_TO_CLIENT || !snapshot.enableCaching() || snapshot.cacheMaxEntries() == 0) {
			return null;
		}
		for (MessageFilter filter : this.filters) {
			if (isActive(filter, direction, snapshot) && !filter.cacheable()) {
				return null;
			}
		}
		return direction.wireName() + ':' + JsonTrees.contentHash(message);
	}

	private static boolean isActive(MessageFilter filter, Direction direction, FilterConfig snapshot) {
		return filter.appliesTo(direction) && snapshot.isEnabled(filter.name(), filter.enabledByDefault());
	}

	/**
	 * Current configuration snapshot.
	 * @return configuration in effect for new runs
	 */
	public FilterConfig config() {
		return this.config.get();
	}

	/**
	 * Replace the configuration wholesale. The new snapshot gets the next version and the result
	 * cache is cleared.
	 * @param next configuration to install; its version is ignored
	 * @return the installed snapshot
	 */
	public FilterConfig replaceConfig(FilterConfig next) {
		Objects.requireNonNull(next, "next");
		return swap(current -> next);
	}

	/**
	 * Enable or disable a filter by name.
	 * @param filterName filter to toggle
	 * @param enabled new enablement
	 * @return the installed snapshot
	 * @throws UnknownFilterException when no filter has that name
	 */
	public FilterConfig toggle(String filterName, boolean enabled) {
		if (this.filters.stream().noneMatch(filter -> filter.name().equals(filterName))) {
			throw new UnknownFilterException(filterName);
		}
		FilterConfig installed = swap(current -> current.withToggle(filterName, enabled));
		logger.info("Filter {} {} (config version {})", filterName, enabled ? "enabled" : "disabled",
				installed.version());
		return installed;
	}

	private FilterConfig swap(UnaryOperator<FilterConfig> change) {
		FilterConfig installed = this.config.updateAndGet(current -> change.apply(current).withVersion(current.version() + 1));
		this.cache.clear();
		return installed;
	}

	/**
	 * Describe every registered filter against the current snapshot.
	 * @return filters in execution order
	 */
	public List<FilterInfo> listFilters() {
		FilterConfig snapshot = this.config.get();
		List<FilterInfo> infos = new ArrayList<>(this.filters.size());
		for (MessageFilter filter : this.filters) {
			Set<Direction> directions = new LinkedHashSet<>();
			for (Direction direction : Direction.values()) {
				if (filter.appliesTo(direction)) {
					directions.add(direction);
				}
			}
			infos.add(new FilterInfo(filter.name(), snapshot.isEnabled(filter.name(), filter.enabledByDefault()),
					filter.description(), Set.copyOf(directions)));
		}
		return infos;
	}

	/**
	 * Snapshot of the running counters.
	 * @return metrics
	 */
	public FilterMetricsSnapshot metrics() {
		return this.metrics.snapshot(this.cache.size());
	}

}
