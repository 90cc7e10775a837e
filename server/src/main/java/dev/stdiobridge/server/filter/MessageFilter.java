package dev.stdiobridge.server.filter;

/**
 * A named transform applied to messages travelling in one or both directions. Implementations
 * receive a message that belongs to the current pipeline run and either pass it on, return a
 * rewritten copy, or block it. The received tree must not be modified in place, so that a fault
 * halfway through leaves it as the previous filter produced it.
 * <p>
 * A {@link RuntimeException} thrown from {@link #apply(FilterInvocation)} does not abort the
 * pipeline: the message continues unchanged by this filter. A filter that must fail closed has to
 * catch its own faults and return {@link FilterVerdict#block(String)}.
 */
public interface MessageFilter {

	/**
	 * Unique name used for toggling and reporting.
	 * @return filter name
	 */
	String name();

	/**
	 * Human readable summary shown by the control surface.
	 * @return description
	 */
	String description();

	/**
	 * Whether the filter runs for the given direction.
	 * @param direction direction of travel
	 * @return {@code true} when the filter applies
	 */
	boolean appliesTo(Direction direction);

	/**
	 * Enablement used when the configuration carries no explicit toggle for this filter.
	 * @return default enablement
	 */
	default boolean enabledByDefault() {
		return true;
	}

	/**
	 * Whether the output depends only on the message content and the configuration. Filters
	 * that look at the session, the clock or other outside state must return {@code false}, which
	 * disables result caching while they are enabled.
	 * @return {@code true} when results may be cached
	 */
	default boolean cacheable() {
		return true;
	}

	/**
	 * Apply the filter.
	 * @param invocation message, direction, session and configuration snapshot
	 * @return the verdict
	 */
	FilterVerdict apply(FilterInvocation invocation);

}
