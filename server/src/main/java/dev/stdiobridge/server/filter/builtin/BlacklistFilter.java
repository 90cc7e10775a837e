package dev.stdiobridge.server.filter.builtin;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.stdiobridge.server.filter.Direction;
import dev.stdiobridge.server.filter.FilterConfig;
import dev.stdiobridge.server.filter.FilterInvocation;
import dev.stdiobridge.server.filter.FilterVerdict;
import dev.stdiobridge.server.filter.JsonTrees;
import dev.stdiobridge.server.filter.MessageFilter;

/**
 * Blocks client messages whose string content mentions a blocked domain, keyword or pattern.
 * Domains and keywords match as case-insensitive substrings, patterns with
 * {@link java.util.regex.Matcher#find()}.
 */
public class BlacklistFilter implements MessageFilter {

	public static final String NAME = "blacklist";

	private static final Logger logger = LoggerFactory.getLogger(BlacklistFilter.class);

	private volatile CompiledPatterns compiled = new CompiledPatterns(List.of(), List.of());

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public String description() {
		return "Blocks client messages mentioning blocked domains, keywords or patterns";
	}

	@Override
	public boolean appliesTo(Direction direction) {
		return direction == Direction.CLIENT_TO_SERVER;
	}

	@Override
	public FilterVerdict apply(FilterInvocation invocation) {
		FilterConfig config = invocation.config();
		if (JsonTrees.exceedsMaxDepth(invocation.message())) {
			return FilterVerdict.block("message nested deeper than " + JsonTrees.MAX_DEPTH + " levels");
		}
		List<String> strings = JsonTrees.collectStrings(invocation.message());
		List<String> lowered = new ArrayList<>(strings.size());
		for (String value : strings) {
			lowered.add(value.toLowerCase(Locale.ROOT));
		}

		String hit = firstContained(lowered, config.blockedDomains());
		if (hit != null) {
			return FilterVerdict.block("blocked domain: " + hit);
		}
		hit = firstContained(lowered, config.blockedKeywords());
		if (hit != null) {
			return FilterVerdict.block("blocked keyword: " + hit);
		}
		for (Pattern pattern : patterns(config.blockedPatterns())) {
			for (String value : strings) {
				if (pattern.matcher(value).find()) {
					return FilterVerdict.block("blocked pattern: " + pattern.pattern());
				}
			}
		}
		return FilterVerdict.pass(invocation.message());
	}

	private static String firstContained(List<String> lowered, List<String> needles) {
		for (String needle : needles) {
			if (needle.isEmpty()) {
				continue;
			}
			String lowerNeedle = needle.toLowerCase(Locale.ROOT);
			for (String value : lowered) {
				if (value.contains(lowerNeedle)) {
					return needle;
				}
			}
		}
		return null;
	}

	private List<Pattern> patterns(List<String> sources) {
		CompiledPatterns current = this.compiled;
		if (current.sources() == sources) {
			return current.patterns();
		}
		List<Pattern> patterns = new ArrayList<>(sources.size());
		for (String source : sources) {
			try {
				patterns.add(Pattern.compile(source, Pattern.CASE_INSENSITIVE));
			}
			catch (PatternSyntaxException ex) {
				logger.warn("Ignoring invalid blocked pattern '{}': {}", source, ex.getDescription());
			}
		}
		this.compiled = new CompiledPatterns(sources, List.copyOf(patterns));
		return patterns;
	}

	private record CompiledPatterns(List<String> sources, List<Pattern> patterns) {
	}

}
