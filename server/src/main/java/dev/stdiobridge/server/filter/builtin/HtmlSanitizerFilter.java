package dev.stdiobridge.server.filter.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.stdiobridge.server.filter.Direction;
import dev.stdiobridge.server.filter.FilterAction;
import dev.stdiobridge.server.filter.FilterConfig;
import dev.stdiobridge.server.filter.FilterInvocation;
import dev.stdiobridge.server.filter.FilterVerdict;
import dev.stdiobridge.server.filter.JsonTrees;
import dev.stdiobridge.server.filter.MessageFilter;

/**
 * Strips active content from markup found in server messages.
 */
public class HtmlSanitizerFilter implements MessageFilter {

	public static final String NAME = "html_sanitizer";

	private static final Logger logger = LoggerFactory.getLogger(HtmlSanitizerFilter.class);

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public String description() {
		return "Removes scripts, event handlers, unsafe URLs, tracking images and ads from markup";
	}

	@Override
	public boolean appliesTo(Direction direction) {
		return direction == Direction.SERVER_TO_CLIENT;
	}

	@Override
	public FilterVerdict apply(FilterInvocation invocation) {
		FilterConfig config = invocation.config();
		HtmlSanitizer sanitizer = new HtmlSanitizer(config.removeScripts(), config.removeTracking(),
				config.removeAds(), config.normalizeWhitespace());
		JsonNode sanitized = JsonTrees.mapStrings(invocation.message(), sanitizer::sanitize);
		if (sanitized.equals(invocation.message())) {
			return FilterVerdict.pass(invocation.message());
		}
		logger.debug("Sanitized markup in message for session {}", invocation.sessionId());
		return FilterVerdict.modified(sanitized, FilterAction.SANITIZED);
	}

}
