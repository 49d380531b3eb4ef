package works.arbor.markdown;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.arbor.AbstractFormatHandler;
import works.arbor.EditableFields;
import works.arbor.HandlerSettings;
import works.arbor.Node;
import works.arbor.NodeKind;
import works.arbor.SerializeOptions;
import works.arbor.TraversalGuard;
import works.arbor.exceptions.DocumentSerializationException;

import static java.util.Objects.requireNonNull;

/**
 * Sections a Markdown document by its headings.
 * <p>
 * The root is a {@link NodeKind#DOCUMENT DOCUMENT}. Each heading becomes a
 * {@link NodeKind#HEADING HEADING} node holding everything up to the next heading
 * of the same or a shallower level, and the text between headings becomes
 * {@link NodeKind#CONTENT CONTENT} nodes named <code>content-1</code>,
 * <code>content-2</code> and so on in document order.
 * Inline markup is not interpreted.
 * <p>
 * Any text parses; this handler never throws {@link works.arbor.exceptions.DocumentParseException}.
 */
public final class MarkdownHandler extends AbstractFormatHandler {
	public static final String FORMAT = "markdown";

	/**
	 * Metadata key holding the {@link ContentType#wireName() wire name} of a content node's type.
	 */
	public static final String CONTENT_TYPE = "contentType";

	/**
	 * Metadata key holding the info string of a code block, <code>text</code> if it has none.
	 */
	public static final String LANGUAGE = "language";

	/**
	 * Metadata flag set when a content node's value is the block exactly as written,
	 * fences and quote markers included.
	 */
	public static final String VERBATIM = "verbatim";

	public static final String CONTENT_PREFIX = "content-";
	static final String FENCE = "```";
	static final String DEFAULT_LANGUAGE = "text";

	private static final Pattern ATX_HEADING = Pattern.compile("^(#{1,6})\\s+(.+)$");
	private static final Pattern CLOSING_HASHES = Pattern.compile("(^|\\s+)#+$");
	private static final Pattern SETEXT_LEVEL_1 = Pattern.compile("=+");
	private static final Pattern SETEXT_LEVEL_2 = Pattern.compile("-+");

	private static final Pattern DETECT_HEADING = Pattern.compile("^#{1,6}\\s+.+");
	private static final Pattern DETECT_LIST = Pattern.compile("^\\s*([-*+]|\\d+\\.)\\s");
	private static final Pattern DETECT_QUOTE = Pattern.compile("^\\s*>\\s");
	private static final Pattern DETECT_EMPHASIS = Pattern.compile("[*_]{1,2}[^*_]+[*_]{1,2}");
	private static final Pattern DETECT_LINK = Pattern.compile("\\[.+]\\(.+\\)");
	private static final Pattern DETECT_INLINE_CODE = Pattern.compile("`.+`");

	public MarkdownHandler(HandlerSettings settings) {
		super(settings);
	}

	public MarkdownHandler() {
		this(HandlerSettings.defaults());
	}

	@Override
	public String formatName() {
		return FORMAT;
	}

	/**
	 * Headings are named by their text, so the key isn't separately editable,
	 * and the kinds follow from the syntax.
	 */
	@Override
	public EditableFields editableFields() {
		return new EditableFields(false, true, false, true);
	}

	private record Section(int level, String text) {
		static final int CONTENT = 0;

		boolean isHeading() {
			return level != CONTENT;
		}
	}

	@Override
	public Node parse(String text) {
		requireNonNull(text);
		List<Section> sections = split(text.split("\n", -1));
		Node document = Node.document("");
		if (sections.stream().noneMatch(Section::isHeading)) {
			if (!sections.isEmpty()) {
				StringBuilder all = new StringBuilder();
				for (Section section : sections) {
					if (all.length() > 0) {
						all.append("\n\n");
					}
					all.append(section.text());
				}
				document.appendChild(contentNode(CONTENT_PREFIX + 1, all.toString()));
			}
			return document;
		}

		Deque<Node> stack = new ArrayDeque<>();
		int contentCount = 0;
		for (Section section : sections) {
			if (section.isHeading()) {
				while (!stack.isEmpty() && stack.peek().headingLevel() >= section.level()) {
					stack.pop();
				}
				checkParseDepth(stack.size() + 1);
				Node heading = Node.heading(section.text(), section.level());
				(stack.isEmpty() ? document : stack.peek()).appendChild(heading);
				stack.push(heading);
			} else {
				contentCount++;
				Node content = contentNode(CONTENT_PREFIX + contentCount, section.text());
				(stack.isEmpty() ? document : stack.peek()).appendChild(content);
			}
		}
		LOGGER.trace("Parsed {} sections of Markdown", sections.size());
		return document;
	}

	/**
	 * Splits the lines into headings and the non-blank runs of text between them.
	 * Lines inside a code fence are never headings.
	 */
	private static List<Section> split(String[] lines) {
		List<Section> sections = new ArrayList<>();
		List<String> pending = new ArrayList<>();
		boolean inFence = false;
		for (int i = 0; i < lines.length; i++) {
			String line = stripCarriageReturn(lines[i]);
			if (line.trim().startsWith(FENCE)) {
				inFence = !inFence;
				pending.add(line);
				continue;
			}
			if (inFence) {
				pending.add(line);
				continue;
			}
			Matcher atx = ATX_HEADING.matcher(line);
			if (atx.matches()) {
				flush(pending, sections);
				String headingText = CLOSING_HASHES.matcher(atx.group(2).trim()).replaceFirst("");
				sections.add(new Section(atx.group(1).length(), headingText));
				continue;
			}
			int setextLevel = (i + 1 < lines.length) ? setextLevel(line, stripCarriageReturn(lines[i + 1])) : 0;
			if (setextLevel > 0) {
				flush(pending, sections);
				sections.add(new Section(setextLevel, line.trim()));
				i++;
				continue;
			}
			pending.add(line);
		}
		flush(pending, sections);
		return sections;
	}

	/**
	 * @return 1 or 2 if <code>underline</code> turns <code>line</code> into a heading; otherwise 0
	 */
	private static int setextLevel(String line, String underline) {
		String text = line.trim();
		String marker = underline.trim();
		if (text.isEmpty() || marker.length() < text.length()) {
			return 0;
		}
		if (SETEXT_LEVEL_1.matcher(marker).matches()) {
			return 1;
		} else if (SETEXT_LEVEL_2.matcher(marker).matches()) {
			return 2;
		} else {
			return 0;
		}
	}

	private static void flush(List<String> pending, List<Section> sections) {
		String text = String.join("\n", pending).strip();
		if (!text.isEmpty()) {
			sections.add(new Section(Section.CONTENT, text));
		}
		pending.clear();
	}

	private static String stripCarriageReturn(String line) {
		return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
	}

	/**
	 * A block that is one complete fence keeps just the code, and a block that is
	 * entirely quoted keeps just the quoted text. Anything else keeps the text
	 * as written and is flagged {@link #VERBATIM}.
	 */
	private static Node contentNode(String name, String text) {
		ContentType type = ContentType.classify(text);
		String[] lines = text.split("\n", -1);
		String value = text;
		boolean verbatim = false;
		String language = null;
		switch (type) {
			case CODE:
				language = fenceLanguage(lines);
				if (isSingleFence(lines)) {
					value = String.join("\n", List.of(lines).subList(1, lines.length - 1));
				} else {
					verbatim = true;
				}
				break;
			case BLOCKQUOTE:
				if (isFullyQuoted(lines)) {
					List<String> unquoted = new ArrayList<>();
					for (String line : lines) {
						unquoted.add(unquote(line));
					}
					value = String.join("\n", unquoted);
				} else {
					verbatim = true;
				}
				break;
			default:
				break;
		}
		Node result = Node.content(name, value);
		result.putMetadata(CONTENT_TYPE, type.wireName());
		result.putMetadata(LANGUAGE, language);
		if (verbatim) {
			result.putMetadata(VERBATIM, true);
		}
		return result;
	}

	private static String fenceLanguage(String[] lines) {
		for (String line : lines) {
			String trimmed = line.trim();
			if (trimmed.startsWith(FENCE)) {
				String info = trimmed.substring(FENCE.length()).trim();
				return info.isEmpty() ? DEFAULT_LANGUAGE : info;
			}
		}
		return DEFAULT_LANGUAGE;
	}

	private static boolean isSingleFence(String[] lines) {
		if (lines.length < 2
			|| !lines[0].trim().startsWith(FENCE)
			|| !lines[lines.length - 1].trim().equals(FENCE)) {
			return false;
		}
		for (int i = 1; i < lines.length - 1; i++) {
			if (lines[i].trim().startsWith(FENCE)) {
				return false;
			}
		}
		return true;
	}

	private static boolean isFullyQuoted(String[] lines) {
		for (String line : lines) {
			if (!line.trim().startsWith(">")) {
				return false;
			}
		}
		return true;
	}

	private static String unquote(String line) {
		String rest = line.trim().substring(1);
		return rest.startsWith(" ") ? rest.substring(1) : rest;
	}

	/**
	 * Writes ATX headings, whatever style they were read in, with levels clamped to 1..6.
	 * Siblings are separated by a blank line, and the result ends with exactly one newline
	 * unless it is empty.
	 * <p>
	 * {@link SerializeOptions} has no effect.
	 */
	@Override
	public String serialize(Node root, SerializeOptions options) {
		TraversalGuard guard = newGuard();
		String body;
		if (root.kind() == NodeKind.DOCUMENT) {
			guard.enter(root);
			body = renderChildren(root, guard);
			guard.exit(root);
		} else {
			body = render(root, guard);
		}
		return body.isEmpty() ? "" : body.replaceAll("\n+$", "") + "\n";
	}

	private String render(Node node, TraversalGuard guard) {
		guard.enter(node);
		String result;
		switch (node.kind()) {
			case HEADING:
				int level = Math.min(Math.max(node.headingLevel(), 1), 6);
				String line = "#".repeat(level) + " " + node.name();
				String children = renderChildren(node, guard);
				result = children.isEmpty() ? line : line + "\n\n" + children;
				break;
			case CONTENT:
				result = renderContent(node);
				break;
			default:
				throw DocumentSerializationException.unsupportedKind(FORMAT, node.kind());
		}
		guard.exit(node);
		return result;
	}

	private String renderChildren(Node parent, TraversalGuard guard) {
		List<String> blocks = new ArrayList<>();
		for (Node child : parent.children()) {
			String block = render(child, guard);
			if (!block.isEmpty()) {
				blocks.add(block);
			}
		}
		return String.join("\n\n", blocks);
	}

	private static String renderContent(Node node) {
		Object value = node.value();
		if (value == null || value.toString().isEmpty()) {
			return "";
		}
		String text = value.toString();
		if (node.metadataFlag(VERBATIM)) {
			return text;
		}
		switch (ContentType.fromWireName(node.metadata(CONTENT_TYPE))) {
			case CODE:
				Object language = node.metadata(LANGUAGE);
				String info = (language == null || DEFAULT_LANGUAGE.equals(language)) ? "" : language.toString();
				return FENCE + info + "\n" + text + "\n" + FENCE;
			case BLOCKQUOTE:
				List<String> quoted = new ArrayList<>();
				for (String line : text.split("\n", -1)) {
					quoted.add(line.isEmpty() ? ">" : "> " + line);
				}
				return String.join("\n", quoted);
			default:
				return text;
		}
	}

	/**
	 * Scores Markdown features. In the first twenty lines, headings and fences count two
	 * and list items, quotes, emphasis, links and inline code count one.
	 * Setext underlines count two anywhere in the text. Any score at all means Markdown.
	 */
	@Override
	public boolean detect(String text) {
		if (text == null || text.isBlank()) {
			return false;
		}
		String[] lines = text.trim().split("\n");
		int score = 0;
		for (int i = 0; i < Math.min(20, lines.length); i++) {
			String line = lines[i];
			String trimmed = line.trim();
			if (DETECT_HEADING.matcher(trimmed).find()) {
				score += 2;
			}
			if (DETECT_LIST.matcher(line).find()) {
				score++;
			}
			if (DETECT_QUOTE.matcher(line).find()) {
				score++;
			}
			if (trimmed.startsWith(FENCE)) {
				score += 2;
			}
			if (DETECT_EMPHASIS.matcher(trimmed).find()) {
				score++;
			}
			if (DETECT_LINK.matcher(trimmed).find()) {
				score++;
			}
			if (DETECT_INLINE_CODE.matcher(trimmed).find()) {
				score++;
			}
		}
		for (int i = 0; i + 1 < lines.length; i++) {
			String next = lines[i + 1].trim();
			if (!lines[i].trim().isEmpty() && (SETEXT_LEVEL_1.matcher(next).matches() || SETEXT_LEVEL_2.matcher(next).matches())) {
				score += 2;
			}
		}
		LOGGER.trace("Markdown score {}", score);
		return score >= 1;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MarkdownHandler.class);
}
