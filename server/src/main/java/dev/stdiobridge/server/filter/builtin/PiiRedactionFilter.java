package dev.stdiobridge.server.filter.builtin;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

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
import dev.stdiobridge.server.filter.PiiCategories;

/**
 * Masks emails, credit card numbers, SSNs and phone numbers with fixed tokens. Patterns run in
 * that order so that long digit runs are claimed by the most specific category first. The tokens
 * contain neither digits nor {@code @}, so running the filter again changes nothing.
 */
public class PiiRedactionFilter implements MessageFilter {

	public static final String NAME = "pii_redactor";

	public static final String EMAIL_TOKEN = "[EMAIL_REDACTED]";

	public static final String CREDIT_CARD_TOKEN = "[CREDIT_CARD_REDACTED]";

	public static final String SSN_TOKEN = "[SSN_REDACTED]";

	public static final String PHONE_TOKEN = "[PHONE_REDACTED]";

	private static final Logger logger = LoggerFactory.getLogger(PiiRedactionFilter.class);

	private static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");

	private static final Pattern CREDIT_CARD = Pattern
		.compile("\\b(?:4\\d{12}(?:\\d{3})?|5[1-5]\\d{14}|3[47]\\d{13}|3\\d{13}|6(?:011|5\\d{2})\\d{12})\\b"
				+ "|\\b\\d{4}([-\\s])\\d{4}\\1\\d{4}\\1\\d{4}\\b" + "|\\b3[47]\\d{2}([-\\s])\\d{6}\\2\\d{5}\\b");

	private static final Pattern SSN = Pattern
		.compile("\\b(?!000|666|9\\d{2})\\d{3}[-.\\s]?(?!00)\\d{2}[-.\\s]?(?!0000)\\d{4}\\b");

	private static final Pattern PHONE = Pattern
		.compile("(?<!\\d)(?:\\+?1[-.\\s]?)?\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}(?!\\d)");

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public String description() {
		return "Masks emails, phone numbers, SSNs and credit card numbers";
	}

	@Override
	public boolean appliesTo(Direction direction) {
		return true;
	}

	@Override
	public FilterVerdict apply(FilterInvocation invocation) {
		List<Rule> rules = rules(invocation.config());
		if (rules.isEmpty()) {
			return FilterVerdict.pass(invocation.message());
		}
		Map<String, Integer> counts = new LinkedHashMap<>();
		JsonNode redacted = JsonTrees.mapStrings(invocation.message(), value -> redact(value, rules, counts));
		if (counts.isEmpty()) {
			return FilterVerdict.pass(invocation.message());
		}
		if (invocation.config().logPiiRedactions()) {
			logger.info("Redacted PII in {} message for session {}: {}", invocation.direction().wireName(),
					invocation.sessionId(), counts);
		}
		return FilterVerdict.modified(redacted, FilterAction.PII_REDACTED, counts);
	}

	/**
	 * Redact a single string with every category enabled by default.
	 * @param value text to redact
	 * @return redacted text
	 */
	public static String redact(String value) {
		return redact(value, rules(FilterConfig.defaults()), new LinkedHashMap<>());
	}

	private static String redact(String value, List<Rule> rules, Map<String, Integer> counts) {
		String result = value;
		for (Rule rule : rules) {
			Matcher matcher = rule.pattern().matcher(result);
			StringBuilder out = null;
			while (matcher.find()) {
				if (out == null) {
					out = new StringBuilder(result.length());
				}
				matcher.appendReplacement(out, Matcher.quoteReplacement(rule.token()));
				counts.merge(rule.category(), 1, Integer::sum);
			}
			if (out != null) {
				matcher.appendTail(out);
				result = out.toString();
			}
		}
		return result;
	}

	private static List<Rule> rules(FilterConfig config) {
		List<Rule> rules = new ArrayList<>(4);
		if (config.redactEmails()) {
			rules.add(new Rule(PiiCategories.EMAIL, EMAIL, EMAIL_TOKEN));
		}
		if (config.redactCreditCards()) {
			rules.add(new Rule(PiiCategories.CREDIT_CARD, CREDIT_CARD, CREDIT_CARD_TOKEN));
		}
		if (config.redactSsns()) {
			rules.add(new Rule(PiiCategories.SSN, SSN, SSN_TOKEN));
		}
		if (config.redactPhones()) {
			rules.add(new Rule(PiiCategories.PHONE, PHONE, PHONE_TOKEN));
		}
		return rules;
	}

	private record Rule(String category, Pattern pattern, String token) {
	}

}
