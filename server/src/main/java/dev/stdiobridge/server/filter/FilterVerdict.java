package dev.stdiobridge.server.filter;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of a single filter: the message to hand to the next filter, or a block.
 * @param message resulting message, {@code null} when blocked
 * @param blocked whether the message must not travel further
 * @param reason block reason, {@code null} unless blocked
 * @param actions modifications made by the filter
 * @param redactions redaction counts by category
 */
public record FilterVerdict(JsonNode message, boolean blocked, String reason, List<FilterAction> actions,
		Map<String, Integer> redactions) {

	public FilterVerdict {
		actions = List.copyOf(actions);
		redactions = Map.copyOf(redactions);
	}

	public static FilterVerdict pass(JsonNode message) {
		return new FilterVerdict(message, false, null, List.of(), Map.of());
	}

	public static FilterVerdict modified(JsonNode message, FilterAction action) {
		return new FilterVerdict(message, false, null, List.of(action), Map.of());
	}

	public static FilterVerdict modified(JsonNode message, FilterAction action, Map<String, Integer> redactions) {
		return new FilterVerdict(message, false, null, List.of(action), redactions);
	}

	public static FilterVerdict block(String reason) {
		return new FilterVerdict(null, true, reason, List.of(), Map.of());
	}

}
