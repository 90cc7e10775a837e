package dev.stdiobridge.server.filter.builtin;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;

import dev.stdiobridge.server.filter.Direction;
import dev.stdiobridge.server.filter.FilterAction;
import dev.stdiobridge.server.filter.FilterInvocation;
import dev.stdiobridge.server.filter.FilterVerdict;
import dev.stdiobridge.server.filter.JsonTrees;
import dev.stdiobridge.server.filter.MessageFilter;
import dev.stdiobridge.server.filter.PiiCategories;

/**
 * Masks API keys, bearer tokens and {@code sk-} style secrets in both directions.
 */
public class SecretMaskingFilter implements MessageFilter {

	public static final String NAME = "redact_secrets";

	public static final String MASK = "[REDACTED]";

	private static final List<Pattern> PATTERNS = List.of(
			Pattern.compile("(?i)(?:api|secret|access|bearer)[-_ ]?(?:key|token)\\s*[:=]\\s*[A-Za-z0-9._-]{12,}"),
			Pattern.compile("(?i)sk-[A-Za-z0-9]{20,}"));

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public String description() {
		return "Masks API keys and tokens";
	}

	@Override
	public boolean appliesTo(Direction direction) {
		return true;
	}

	@Override
	public FilterVerdict apply(FilterInvocation invocation) {
		int[] count = new int[1];
		JsonNode masked = JsonTrees.mapStrings(invocation.message(), value -> {
			String result = value;
			for (Pattern pattern : PATTERNS) {
				Matcher matcher = pattern.matcher(result);
				StringBuilder out = null;
				while (matcher.find()) {
					if (out == null) {
						out = new StringBuilder(result.length());
					}
					matcher.appendReplacement(out, Matcher.quoteReplacement(MASK));
					count[0]++;
				}
				if (out != null) {
					matcher.appendTail(out);
					result = out.toString();
				}
			}
			return result;
		});
		if (count[0] == 0) {
			return FilterVerdict.pass(invocation.message());
		}
		return FilterVerdict.modified(masked, FilterAction.SECRETS_MASKED, Map.of(PiiCategories.SECRET, count[0]));
	}

}
