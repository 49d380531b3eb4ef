package works.arbor.markdown;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The kind of block a {@link works.arbor.NodeKind#CONTENT CONTENT} node holds,
 * as recorded in its {@link MarkdownHandler#CONTENT_TYPE} metadata.
 */
public enum ContentType {
	CODE,
	BLOCKQUOTE,
	LIST,
	PARAGRAPH;

	private static final Pattern LIST_ITEM = Pattern.compile("^\\s*([-*+]|\\d+\\.)\\s");

	public String wireName() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * A fence anywhere makes it code; otherwise a quoted line makes it a blockquote,
	 * and a list item makes it a list.
	 */
	public static ContentType classify(String text) {
		if (text.contains(MarkdownHandler.FENCE)) {
			return CODE;
		}
		String[] lines = text.split("\n");
		for (String line : lines) {
			if (line.trim().startsWith(">")) {
				return BLOCKQUOTE;
			}
		}
		for (String line : lines) {
			if (LIST_ITEM.matcher(line).find()) {
				return LIST;
			}
		}
		return PARAGRAPH;
	}

	/**
	 * @return the type named by <code>wireName</code>, or {@link #PARAGRAPH} if it names none
	 */
	public static ContentType fromWireName(Object wireName) {
		for (ContentType type : values()) {
			if (type.wireName().equals(wireName)) {
				return type;
			}
		}
		return PARAGRAPH;
	}
}
