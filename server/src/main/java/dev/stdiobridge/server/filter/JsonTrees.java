package dev.stdiobridge.server.filter;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Depth-bounded traversals over Jackson trees. Containers nested deeper than {@link #MAX_DEPTH} are
 * neither visited nor rewritten.
 */
public final class JsonTrees {

	public static final int MAX_DEPTH = 64;

	private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

	private JsonTrees() {
	}

	/**
	 * Rebuild the tree with every string value passed through {@code fn}. Object keys are kept.
	 * @param root tree to rewrite
	 * @param fn string transform
	 * @return rewritten tree; unchanged subtrees are shared with {@code root}
	 */
	public static JsonNode mapStrings(JsonNode root, UnaryOperator<String> fn) {
		return mapStrings(root, Set.of(), fn);
	}

	/**
	 * Like {@link #mapStrings(JsonNode, UnaryOperator)} but leaves the listed top-level fields of an
	 * object root untouched.
	 * @param root tree to rewrite
	 * @param skippedTopLevelFields top-level fields to leave as they are
	 * @param fn string transform
	 * @return rewritten tree
	 */
	public static JsonNode mapStrings(JsonNode root, Set<String> skippedTopLevelFields, UnaryOperator<String> fn) {
		if (root.isObject() && !skippedTopLevelFields.isEmpty()) {
			ObjectNode copy = NODES.objectNode();
			Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
			while (fields.hasNext()) {
				Map.Entry<String, JsonNode> field = fields.next();
				copy.set(field.getKey(), skippedTopLevelFields.contains(field.getKey()) ? field.getValue()
						: map(field.getValue(), fn, 1));
			}
			return copy;
		}
		return map(root, fn, 0);
	}

	/**
	 * Visit every string value in document order.
	 * @param root tree to walk
	 * @param skippedTopLevelFields top-level fields of an object root to skip
	 * @param visitor receives each string
	 */
	public static void forEachString(JsonNode root, Set<String> skippedTopLevelFields, Consumer<String> visitor) {
		if (root.isObject() && !skippedTopLevelFields.isEmpty()) {
			Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
			while (fields.hasNext()) {
				Map.Entry<String, JsonNode> field = fields.next();
				if (!skippedTopLevelFields.contains(field.getKey())) {
					visit(field.getValue(), visitor, 1);
				}
			}
			return;
		}
		visit(root, visitor, 0);
	}

	/**
	 * Flatten the tree to its string values.
	 * @param root tree to walk
	 * @return strings in document order
	 */
	public static List<String> collectStrings(JsonNode root) {
		List<String> strings = new ArrayList<>();
		forEachString(root, Set.of(), strings::add);
		return strings;
	}

	/**
	 * Whether the tree nests containers deeper than {@link #MAX_DEPTH}.
	 * @param root tree to inspect
	 * @return {@code true} when some part of the tree would not be visited
	 */
	public static boolean exceedsMaxDepth(JsonNode root) {
		return depthExceeds(root, 0);
	}

	/**
	 * Stable digest of the tree content: object fields are hashed in key order, so two messages
	 * differing only in field order share a digest.
	 * @param root tree to hash
	 * @return lowercase hex SHA-256
	 */
	public static String contentHash(JsonNode root) {
		StringBuilder canonical = new StringBuilder();
		appendCanonical(root, canonical);
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
		}
		catch (NoSuchAlgorithmException ex) {
			throw new IllegalStateException("SHA-256 not available", ex);
		}
	}

	private static JsonNode map(JsonNode node, UnaryOperator<String> fn, int depth) {
		if (node.isTextual()) {
			String value = node.textValue();
			String mapped = fn.apply(value);
			return mapped.equals(value) ? node : TextNode.valueOf(mapped);
		}
		if (depth >= MAX_DEPTH) {
			return node;
		}
		if (node.isArray()) {
			ArrayNode copy = NODES.arrayNode(node.size());
			for (JsonNode element : node) {
				copy.add(map(element, fn, depth + 1));
			}
			return copy;
		}
		if (node.isObject()) {
			ObjectNode copy = NODES.objectNode();
			Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
			while (fields.hasNext()) {
				Map.Entry<String, JsonNode> field = fields.next();
				copy.set(field.getKey(), map(field.getValue(), fn, depth + 1));
			}
			return copy;
		}
		return node;
	}

	private static void visit(JsonNode node, Consumer<String> visitor, int depth) {
		if (node.isTextual()) {
			visitor.accept(node.textValue());
			return;
		}
		if (depth >= MAX_DEPTH || !node.isContainerNode()) {
			return;
		}
		for (JsonNode child : node) {
			visit(child, visitor, depth + 1);
		}
	}

	private static boolean depthExceeds(JsonNode node, int depth) {
		if (!node.isContainerNode()) {
			return false;
		}
		if (depth >= MAX_DEPTH) {
			return true;
		}
		for (JsonNode child : node) {
			if (depthExceeds(child, depth + 1)) {
				return true;
			}
		}
		return false;
	}

	private static void appendCanonical(JsonNode node, StringBuilder out) {
		if (node.isObject()) {
			TreeMap<String, JsonNode> sorted = new TreeMap<>();
			node.fields().forEachRemaining(field -> sorted.put(field.getKey(), field.getValue()));
			out.append('{');
			boolean first = true;
			for (Map.Entry<String, JsonNode> field : sorted.entrySet()) {
				if (!first) {
					out.append(',');
				}
				first = false;
				out.append(TextNode.valueOf(field.getKey())).append(':');
				appendCanonical(field.getValue(), out);
			}
			out.append('}');
		}
		else if (node.isArray()) {
			out.append('[');
			for (int i = 0; i < node.size(); i++) {
				if (i > 0) {
					out.append(',');
				}
				appendCanonical(node.get(i), out);
			}
			out.append(']');
		}
		else {
			out.append(node);
		}
	}

}
