package dev.stdiobridge.server.filter;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of a full pipeline run for one message.
 * @param message filtered message, {@code null} when blocked
 * @param blocked whether the message was blocked
 * @param blockReason why it was blocked
 * @param blockedBy name of the blocking filter
 * @param actionsTaken modifications made, in pipeline order
 * @param redactionCounts redactions by category, summed over all filters
 * @param configVersion version of the configuration snapshot used
 */
public record FilterResult(JsonNode message, boolean blocked, String blockReason, String blockedBy,
		List<FilterAction> actionsTaken, Map<String, Integer> redactionCounts, long configVersion) {

	public FilterResult {
		actionsTaken = List.copyOf(actionsTaken);
		redactionCounts = Map.copyOf(redactionCounts);
	}

	static FilterResult blocked(String filterName, String reason, List<FilterAction> actionsTaken,
			Map<String, Integer> redactionCounts, long configVersion) {
		return new FilterResult(null, true, reason, filterName, actionsTaken, redactionCounts, configVersion);
	}

	/**
	 * Copy of this result whose message can be handed out without sharing the cached tree.
	 * @return detached copy
	 */
	FilterResult detached() {
		return new FilterResult(this.message == null ? null : this.message.deepCopy(), this.blocked,
				this.blockReason, this.blockedBy, this.actionsTaken, this.redactionCounts, this.configVersion);
	}

}
