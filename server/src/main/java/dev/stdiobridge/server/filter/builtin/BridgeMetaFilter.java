package dev.stdiobridge.server.filter.builtin;

import java.time.Clock;

import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.stdiobridge.server.filter.Direction;
import dev.stdiobridge.server.filter.FilterAction;
import dev.stdiobridge.server.filter.FilterInvocation;
import dev.stdiobridge.server.filter.FilterVerdict;
import dev.stdiobridge.server.filter.MessageFilter;

/**
 * Stamps object messages with a {@code bridge_meta} member holding the time, direction and
 * session. Off unless toggled on.
 */
public class BridgeMetaFilter implements MessageFilter {

	public static final String NAME = "bridge_meta";

	public static final String FIELD = "bridge_meta";

	private final Clock clock;

	public BridgeMetaFilter(Clock clock) {
		this.clock = clock;
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public String description() {
		return "Adds bridge_meta with timestamp, direction and session";
	}

	@Override
	public boolean appliesTo(Direction direction) {
		return true;
	}

	@Override
	public boolean enabledByDefault() {
		return false;
	}

	@Override
	public boolean cacheable() {
		return false;
	}

	@Override
	public FilterVerdict apply(FilterInvocation invocation) {
		if (!invocation.message().isObject()) {
			return FilterVerdict.pass(invocation.message());
		}
		ObjectNode stamped = ((ObjectNode) invocation.message()).deepCopy();
		ObjectNode meta = stamped.putObject(FIELD);
		meta.put("ts", this.clock.instant().toString());
		meta.put("direction", invocation.direction().wireName());
		meta.put("session", invocation.sessionId());
		return FilterVerdict.modified(stamped, FilterAction.STAMPED);
	}

}
