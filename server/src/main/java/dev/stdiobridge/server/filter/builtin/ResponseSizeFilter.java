package dev.stdiobridge.server.filter.builtin;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

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
 * Keeps server responses within size limits. The size of a message is the summed length of its
 * string values, not counting the {@code jsonrpc}, {@code id} and {@code method} envelope members.
 * <ul>
 * <li>up to {@link FilterConfig#summarizeThreshold()}: untouched</li>
 * <li>up to {@link FilterConfig#maxResponseLength()}: long strings are reduced to their first,
 * middle and last sentence</li>
 * <li>beyond: strings are cut with a budget shared across the whole tree so the result is never
 * longer than the maximum, marker included</li>
 * </ul>
 */
public class ResponseSizeFilter implements MessageFilter {

	public static final String NAME = "response_size";

	public static final String SUMMARY_PREFIX = "[SUMMARIZED] ";

	public static final String TRUNCATION_MARKER = "[TRUNCATED]";

	static final int SUMMARIZE_MIN_LENGTH = 500;

	private static final Set<String> ENVELOPE_FIELDS = Set.of("jsonrpc", "id", "method");

	private static final String SENTENCE_SEPARATOR = ". ";

	private static final Logger logger = LoggerFactory.getLogger(ResponseSizeFilter.class);

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public String description() {
		return "Summarizes or truncates oversized server responses";
	}

	@Override
	public boolean appliesTo(Direction direction) {
		return direction == Direction.SERVER_TO_CLIENT;
	}

	@Override
	public FilterVerdict apply(FilterInvocation invocation) {
		FilterConfig config = invocation.config();
		JsonNode message = invocation.message();
		long[] total = new long[1];
		JsonTrees.forEachString(message, ENVELOPE_FIELDS, value -> total[0] += value.length());
		if (total[0] <= config.summarizeThreshold()) {
			return FilterVerdict.pass(message);
		}
		if (total[0] > config.maxResponseLength()) {
			Budget budget = new Budget(config.maxResponseLength());
			JsonNode truncated = JsonTrees.mapStrings(message, ENVELOPE_FIELDS, budget::take);
			if (config.logResponseSummaries()) {
				logger.info("Truncated response for session {} from {} to at most {} characters",
						invocation.sessionId(), total[0], config.maxResponseLength());
			}
			return FilterVerdict.modified(truncated, FilterAction.TRUNCATED);
		}
		JsonNode summarized = JsonTrees.mapStrings(message, ENVELOPE_FIELDS, ResponseSizeFilter::summarize);
		if (summarized.equals(message)) {
			return FilterVerdict.pass(message);
		}
		if (config.logResponseSummaries()) {
			logger.info("Summarized response for session {} from {} characters", invocation.sessionId(), total[0]);
		}
		return FilterVerdict.modified(summarized, FilterAction.SUMMARIZED);
	}

	/**
	 * Reduce a long multi-sentence string to its first, middle and last sentence.
	 * @param value text to summarize
	 * @return summary, or {@code value} when it is short or has at most three sentences
	 */
	static String summarize(String value) {
		if (value.length() <= SUMMARIZE_MIN_LENGTH) {
			return value;
		}
		List<String> sentences = splitSentences(value);
		if (sentences.size() <= 3) {
			return value;
		}
		StringBuilder summary = new StringBuilder(SUMMARY_PREFIX);
		String[] parts = { sentences.get(0), sentences.get(sentences.size() / 2),
				sentences.get(sentences.size() - 1) };
		boolean first = true;
		for (String part : parts) {
			if (part.isEmpty()) {
				continue;
			}
			if (!first) {
				summary.append(SENTENCE_SEPARATOR);
			}
			summary.append(part);
			first = false;
		}
		return summary.toString();
	}

	private static List<String> splitSentences(String value) {
		List<String> sentences = new ArrayList<>();
		int start = 0;
		int next;
		while ((next = value.indexOf(SENTENCE_SEPARATOR, start)) >= 0) {
			sentences.add(value.substring(start, next));
			start = next + SENTENCE_SEPARATOR.length();
		}
		sentences.add(value.substring(start));
		return sentences;
	}

	/**
	 * Character budget consumed by strings in document order.
	 */
	static final class Budget {

		private final String marker;

		private int remaining;

		private boolean exhausted;

		Budget(int maxLength) {
			this.marker = maxLength >= TRUNCATION_MARKER.length() ? TRUNCATION_MARKER : "";
			this.remaining = maxLength - this.marker.length();
		}

		String take(String value) {
			if (this.exhausted) {
				return "";
			}
			if (value.length() <= this.remaining) {
				this.remaining -= value.length();
				return value;
			}
			int cut = this.remaining;
			if (cut > 0 && Character.isHighSurrogate(value.charAt(cut - 1))) {
				cut--;
			}
			this.exhausted = true;
			this.remaining = 0;
			return value.substring(0, cut) + this.marker;
		}

	}

}
