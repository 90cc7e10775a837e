package dev.stdiobridge.server.filter.builtin;

import java.util.Locale;
import java.util.Set;

/**
 * Single-pass markup scrubber. Every character is examined a bounded number of times, so hostile
 * input cannot trigger the backtracking a regular-expression based sanitizer is prone to.
 * <p>
 * Text outside tags is copied as is. Tags that survive are re-emitted from their parsed name and
 * attributes, which normalizes quoting and drops anything the parser did not understand.
 */
final class HtmlSanitizer {

	private static final Set<String> SCRIPT_TAGS = Set.of("script", "style", "iframe", "object", "embed");

	private static final Set<String> RAW_TEXT_TAGS = Set.of("script", "style");

	private static final Set<String> VOID_TAGS = Set.of("embed", "img");

	private static final Set<String> AD_TAGS = Set.of("ins", "aside");

	private static final Set<String> URL_ATTRIBUTES = Set.of("href", "src", "action", "formaction", "xlink:href",
			"data", "background", "poster", "srcset", "cite");

	private static final String[] UNSAFE_SCHEMES = { "javascript:", "data:", "vbscript:" };

	private final boolean removeScripts;

	private final boolean removeTracking;

	private final boolean removeAds;

	private final boolean normalizeWhitespace;

	HtmlSanitizer(boolean removeScripts, boolean removeTracking, boolean removeAds, boolean normalizeWhitespace) {
		this.removeScripts = removeScripts;
		this.removeTracking = removeTracking;
		this.removeAds = removeAds;
		this.normalizeWhitespace = normalizeWhitespace;
	}

	/**
	 * Sanitize a string. Strings without {@code <} are not markup and come back unchanged.
	 * @param input text to sanitize
	 * @return sanitized text
	 */
	String sanitize(String input) {
		if (input.indexOf('<') < 0) {
			return input;
		}
		String scrubbed = scrub(input);
		return this.normalizeWhitespace ? collapseWhitespace(scrubbed) : scrubbed;
	}

	private String scrub(String in) {
		int n = in.length();
		StringBuilder out = new StringBuilder(n);
		int i = 0;
		while (i < n) {
			char c = in.charAt(i);
			if (c != '<') {
				out.append(c);
				i++;
				continue;
			}
			if (in.startsWith("<!--", i)) {
				int end = in.indexOf("-->", i + 4);
				i = end < 0 ? n : end + 3;
				continue;
			}
			if (in.startsWith("<!", i) || in.startsWith("<?", i)) {
				int end = in.indexOf('>', i);
				i = end < 0 ? n : end + 1;
				continue;
			}
			int nameStart = i + 1;
			boolean closing = nameStart < n && in.charAt(nameStart) == '/';
			if (closing) {
				nameStart++;
			}
			int nameEnd = nameStart;
			while (nameEnd < n && isNameChar(in.charAt(nameEnd))) {
				nameEnd++;
			}
			if (nameEnd == nameStart || !Character.isLetter(in.charAt(nameStart))) {
				out.append(c);
				i++;
				continue;
			}
			int tagEnd = findTagEnd(in, nameEnd);
			if (tagEnd < 0) {
				// unterminated tag: nothing after it can be trusted
				break;
			}
			String name = in.substring(nameStart, nameEnd);
			String lower = name.toLowerCase(Locale.ROOT);
			boolean selfClosing = tagEnd > nameEnd && in.charAt(tagEnd - 1) == '/';

			if (removesWithContent(lower)) {
				if (closing || selfClosing || VOID_TAGS.contains(lower)) {
					i = tagEnd + 1;
				}
				else {
					i = findBlockEnd(in, tagEnd + 1, lower);
				}
				continue;
			}
			if (this.removeTracking && "img".equals(lower)) {
				i = tagEnd + 1;
				continue;
			}
			if (closing) {
				out.append("</").append(name).append('>');
			}
			else {
				out.append('<').append(name);
				appendAttributes(in, nameEnd, selfClosing ? tagEnd - 1 : tagEnd, out);
				out.append(selfClosing ? "/>" : ">");
			}
			i = tagEnd + 1;
		}
		return out.toString();
	}

	private boolean removesWithContent(String tag) {
		return (this.removeScripts && SCRIPT_TAGS.contains(tag)) || (this.removeAds && AD_TAGS.contains(tag));
	}

	private void appendAttributes(String in, int from, int to, StringBuilder out) {
		int i = from;
		while (i < to) {
			char c = in.charAt(i);
			if (Character.isWhitespace(c) || c == '/') {
				i++;
				continue;
			}
			int nameStart = i;
			while (i < to && !Character.isWhitespace(in.charAt(i)) && in.charAt(i) != '=' && in.charAt(i) != '/') {
				i++;
			}
			String name = in.substring(nameStart, i);
			while (i < to && Character.isWhitespace(in.charAt(i))) {
				i++;
			}
			String value = null;
			if (i < to && in.charAt(i) == '=') {
				i++;
				while (i < to && Character.isWhitespace(in.charAt(i))) {
					i++;
				}
				if (i < to && (in.charAt(i) == '"' || in.charAt(i) == '\'')) {
					char quote = in.charAt(i);
					int close = in.indexOf(quote, i + 1);
					if (close < 0 || close > to) {
						close = to;
					}
					value = in.substring(i + 1, close);
					i = Math.min(close + 1, to);
				}
				else {
					int valueStart = i;
					while (i < to && !Character.isWhitespace(in.charAt(i))) {
						i++;
					}
					value = in.substring(valueStart, i);
				}
			}
			if (!isAttributeName(name) || !keepAttribute(name.toLowerCase(Locale.ROOT), value)) {
				continue;
			}
			out.append(' ').append(name);
			if (value != null) {
				out.append("=\"").append(escapeAttribute(value)).append('"');
			}
		}
	}

	private boolean keepAttribute(String name, String value) {
		if (!this.removeScripts) {
			return true;
		}
		if (name.startsWith("on") || "style".equals(name)) {
			return false;
		}
		return value == null || !URL_ATTRIBUTES.contains(name) || isSafeUrl(value);
	}

	static boolean isSafeUrl(String value) {
		StringBuilder normalized = new StringBuilder(value.length());
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (c > ' ' && c != 0x7f) {
				normalized.append(Character.toLowerCase(c));
			}
		}
		String url = normalized.toString();
		if (url.contains("&#")) {
			return false;
		}
		for (String scheme : UNSAFE_SCHEMES) {
			if (url.startsWith(scheme)) {
				return false;
			}
		}
		return true;
	}

	private static int findTagEnd(String in, int from) {
		char quote = 0;
		for (int i = from; i < in.length(); i++) {
			char c = in.charAt(i);
			if (quote != 0) {
				if (c == quote) {
					quote = 0;
				}
			}
			else if (c == '"' || c == '\'') {
				quote = c;
			}
			else if (c == '>') {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Position just past the element closing the one opened before {@code from}, or the end of the
	 * input when it is never closed.
	 */
	private static int findBlockEnd(String in, int from, String tag) {
		boolean rawText = RAW_TEXT_TAGS.contains(tag);
		int depth = 1;
		int i = from;
		while (i < in.length()) {
			int lt = in.indexOf('<', i);
			if (lt < 0) {
				return in.length();
			}
			if (in.startsWith("/", lt + 1) && matchesTag(in, lt + 2, tag)) {
				depth--;
				if (depth == 0) {
					int end = in.indexOf('>', lt);
					return end < 0 ? in.length() : end + 1;
				}
			}
			else if (!rawText && matchesTag(in, lt + 1, tag)) {
				depth++;
			}
			i = lt + 1;
		}
		return in.length();
	}

	private static boolean matchesTag(String in, int at, String tag) {
		if (!in.regionMatches(true, at, tag, 0, tag.length())) {
			return false;
		}
		int after = at + tag.length();
		return after >= in.length() || !isNameChar(in.charAt(after));
	}

	private static boolean isAttributeName(String name) {
		if (name.isEmpty()) {
			return false;
		}
		for (int i = 0; i < name.length(); i++) {
			if (!isNameChar(name.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	private static boolean isNameChar(char c) {
		return Character.isLetterOrDigit(c) || c == '-' || c == ':' || c == '_';
	}

	private static String escapeAttribute(String value) {
		StringBuilder escaped = new StringBuilder(value.length());
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
				case '"' -> escaped.append("&quot;");
				case '<' -> escaped.append("&lt;");
				case '>' -> escaped.append("&gt;");
				default -> escaped.append(c);
			}
		}
		return escaped.toString();
	}

	private static String collapseWhitespace(String value) {
		StringBuilder out = new StringBuilder(value.length());
		boolean pendingSpace = false;
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			if (Character.isWhitespace(c)) {
				pendingSpace = out.length() > 0;
				continue;
			}
			if (pendingSpace) {
				out.append(' ');
				pendingSpace = false;
			}
			out.append(c);
		}
		return out.toString();
	}

}
