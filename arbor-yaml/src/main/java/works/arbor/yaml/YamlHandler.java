package works.arbor.yaml;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
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
import works.arbor.exceptions.DocumentParseException;
import works.arbor.exceptions.DocumentSerializationException;

import static java.util.Objects.requireNonNull;

/**
 * Reads and writes a practical subset of YAML without a YAML library.
 * <p>
 * Supported: block mappings and sequences (including sequences at the same
 * indentation as their key, <code>- key: value</code> items and <code>- - x</code>
 * nested items), single-line flow collections without nesting, plain and quoted
 * scalars, <code>#</code> comments, and <code>---</code>/<code>...</code> markers.
 * Not supported: anchors and aliases (read as plain strings), tags,
 * block scalars (<code>|</code> and <code>&gt;</code>), multi-line plain scalars,
 * complex keys, and multiple documents.
 * <p>
 * The tree uses {@link NodeKind#OBJECT OBJECT}, {@link NodeKind#ARRAY ARRAY} and
 * {@link NodeKind#SCALAR SCALAR} nodes, the same kinds JSON uses,
 * so documents convert freely between the two.
 * The root records the document's indentation style in {@link #INDENT_CHAR} and
 * {@link #INDENT_SIZE}, which serialization reuses.
 */
public final class YamlHandler extends AbstractFormatHandler {
	public static final String FORMAT = "yaml";
	public static final String ROOT_NAME = "root";

	public static final String INDENT_CHAR = "indentChar";
	public static final String INDENT_SIZE = "indentSize";

	/**
	 * Metadata key for the collection style; the only recognized value is {@link #FLOW}.
	 */
	public static final String YAML_STYLE = "yamlStyle";
	public static final String FLOW = "flow";

	private static final Pattern KEY_LINE = Pattern.compile("^\\s*[\\w-]+:\\s");
	private static final Pattern ITEM_LINE = Pattern.compile("^\\s*-\\s");
	private static final Pattern INDENTED_LINE = Pattern.compile("^\\s{2,}");

	public YamlHandler(HandlerSettings settings) {
		super(settings);
	}

	public YamlHandler() {
		this(HandlerSettings.defaults());
	}

	@Override
	public String formatName() {
		return FORMAT;
	}

	@Override
	public EditableFields editableFields() {
		return EditableFields.ALL;
	}

	/**
	 * Empty or comment-only text yields an empty {@link NodeKind#OBJECT OBJECT} root.
	 *
	 * @throws DocumentParseException naming the offending line
	 */
	@Override
	public Node parse(String text) {
		requireNonNull(text);
		List<String> contentLines = new ArrayList<>();
		List<Line> lines = new ArrayList<>();
		String[] rawLines = text.split("\n", -1);
		for (int i = 0; i < rawLines.length; i++) {
			String raw = rawLines[i];
			if (raw.endsWith("\r")) {
				raw = raw.substring(0, raw.length() - 1);
			}
			String cleaned = stripComment(raw).stripTrailing();
			int indent = leadingWhitespace(cleaned);
			String content = cleaned.substring(indent);
			if (content.isEmpty() || content.equals("---") || content.equals("...")) {
				continue;
			}
			contentLines.add(cleaned);
			lines.add(new Line(i + 1, indent, content));
		}
		Node root = new Parser(lines).parseDocument();
		recordIndentation(root, contentLines);
		LOGGER.trace("Parsed {} lines of YAML", lines.size());
		return root;
	}

	private record Line(int number, int indent, String content) { }

	/**
	 * Recursive descent over the non-blank lines, driven by their indentation.
	 */
	private final class Parser {
		private final List<Line> lines;
		private int pos = 0;

		Parser(List<Line> lines) {
			this.lines = lines;
		}

		Node parseDocument() {
			if (lines.isEmpty()) {
				return Node.object(ROOT_NAME);
			}
			Node root = parseBlock(ROOT_NAME, lines.get(0).indent(), 0);
			if (pos < lines.size()) {
				throw unexpected(lines.get(pos));
			}
			return root;
		}

		/**
		 * Parses the block whose first line is at {@link #pos} and is indented by <code>indent</code>.
		 */
		private Node parseBlock(String name, int indent, int depth) {
			Line line = lines.get(pos);
			if (isSequenceItem(line.content())) {
				return parseSequence(name, indent, depth);
			} else if (mappingColon(line.content()) > 0) {
				return parseMapping(name, indent, depth);
			} else {
				pos++;
				return inlineValue(name, line.content(), line, depth);
			}
		}

		private Node parseMapping(String name, int indent, int depth) {
			checkParseDepth(depth);
			Node result = Node.object(name);
			while (pos < lines.size()) {
				Line line = lines.get(pos);
				if (line.indent() < indent) {
					break;
				}
				if (line.indent() > indent) {
					throw unexpected(line);
				}
				if (isSequenceItem(line.content())) {
					throw DocumentParseException.atLine(line.number(), "Sequence item where a mapping key was expected");
				}
				int colon = mappingColon(line.content());
				if (colon <= 0) {
					throw DocumentParseException.atLine(line.number(), "Expected \"key: value\" but found \"" + line.content() + "\"");
				}
				String key = key(line.content().substring(0, colon).trim(), line);
				if (result.childNamed(key) != null) {
					throw DocumentParseException.atLine(line.number(), "Duplicate key \"" + key + "\"");
				}
				pos++;
				String rest = line.content().substring(colon + 1).trim();
				result.appendChild(mappingValue(key, rest, line, indent, depth + 1));
			}
			return result;
		}

		private Node mappingValue(String key, String rest, Line line, int indent, int depth) {
			if (!rest.isEmpty()) {
				return inlineValue(key, rest, line, depth);
			}
			if (pos < lines.size()) {
				Line next = lines.get(pos);
				if (next.indent() > indent) {
					return parseBlock(key, next.indent(), depth);
				}
				if (next.indent() == indent && isSequenceItem(next.content())) {
					return parseSequence(key, indent, depth);
				}
			}
			return Node.scalar(key, null);
		}

		private Node parseSequence(String name, int indent, int depth) {
			checkParseDepth(depth);
			Node result = Node.array(name);
			while (pos < lines.size()) {
				Line line = lines.get(pos);
				if (line.indent() < indent || (line.indent() == indent && !isSequenceItem(line.content()))) {
					break;
				}
				if (line.indent() > indent) {
					throw unexpected(line);
				}
				String itemName = String.valueOf(result.childCount());
				String content = line.content();
				int offset = 1;
				while (offset < content.length() && content.charAt(offset) == ' ') {
					offset++;
				}
				if (offset == content.length()) {
					pos++;
					if (pos < lines.size() && lines.get(pos).indent() > indent) {
						result.appendChild(parseBlock(itemName, lines.get(pos).indent(), depth + 1));
					} else {
						result.appendChild(Node.scalar(itemName, null));
					}
				} else {
					// The rest of the line starts a block of its own at its own column,
					// so continuation lines of a "- key: value" item line up with "key"
					int column = indent + offset;
					lines.set(pos, new Line(line.number(), column, content.substring(offset)));
					result.appendChild(parseBlock(itemName, column, depth + 1));
				}
			}
			return result;
		}

		private Node inlineValue(String name, String text, Line line, int depth) {
			checkParseDepth(depth);
			if (text.startsWith("[") || text.startsWith("{")) {
				return flowCollection(name, text, line);
			}
			if (text.equals("|") || text.equals(">") || text.startsWith("|-") || text.startsWith(">-")
				|| text.startsWith("|+") || text.startsWith(">+")) {
				throw DocumentParseException.atLine(line.number(), "Block scalars are not supported");
			}
			return Node.scalar(name, scalar(text, line));
		}

		private Node flowCollection(String name, String text, Line line) {
			boolean isArray = text.charAt(0) == '[';
			char close = isArray ? ']' : '}';
			if (text.length() < 2 || text.charAt(text.length() - 1) != close) {
				throw DocumentParseException.atLine(line.number(), "Unterminated flow collection \"" + text + "\"");
			}
			Node result = isArray ? Node.array(name) : Node.object(name);
			result.putMetadata(YAML_STYLE, FLOW);
			for (String item : splitFlow(text.substring(1, text.length() - 1), line)) {
				if (isArray) {
					result.appendChild(Node.scalar(String.valueOf(result.childCount()), flowScalar(item, line)));
				} else {
					int colon = indexOfUnquoted(item, ':', 0);
					if (colon <= 0) {
						throw DocumentParseException.atLine(line.number(), "Expected \"key: value\" in flow mapping but found \"" + item + "\"");
					}
					String key = key(item.substring(0, colon).trim(), line);
					if (result.childNamed(key) != null) {
						throw DocumentParseException.atLine(line.number(), "Duplicate key \"" + key + "\"");
					}
					result.appendChild(Node.scalar(key, flowScalar(item.substring(colon + 1).trim(), line)));
				}
			}
			return result;
		}

		private Object flowScalar(String text, Line line) {
			if (text.startsWith("[") || text.startsWith("{")) {
				throw DocumentParseException.atLine(line.number(), "Nested flow collections are not supported");
			}
			return scalar(text, line);
		}

		private Object scalar(String text, Line line) {
			if (text.startsWith("\"") || text.startsWith("'")) {
				int close = YamlScalars.closingQuote(text, 0);
				if (close < 0) {
					throw DocumentParseException.atLine(line.number(), "Unterminated quoted scalar");
				}
				if (close != text.length() - 1) {
					throw DocumentParseException.atLine(line.number(), "Unexpected text after quoted scalar: \"" + text.substring(close + 1) + "\"");
				}
			}
			return YamlScalars.coerce(text);
		}

		private String key(String text, Line line) {
			if (text.startsWith("\"") || text.startsWith("'")) {
				if (YamlScalars.closingQuote(text, 0) != text.length() - 1) {
					throw DocumentParseException.atLine(line.number(), "Malformed quoted key " + text);
				}
				return YamlScalars.unquote(text);
			}
			return text;
		}

		private DocumentParseException unexpected(Line line) {
			return DocumentParseException.atLine(line.number(), "Unexpected indentation or content \"" + line.content() + "\"");
		}
	}

	private static boolean isSequenceItem(String content) {
		return content.equals("-") || content.startsWith("- ");
	}

	/**
	 * @return the index of the colon that ends a block mapping key, or -1 if
	 * <code>content</code> is not a mapping entry. The colon must be outside quotes
	 * and followed by whitespace or the end of the line.
	 */
	private static int mappingColon(String content) {
		if (content.startsWith("[") || content.startsWith("{")) {
			return -1;
		}
		int i = -1;
		while ((i = indexOfUnquoted(content, ':', i + 1)) >= 0) {
			if (i + 1 == content.length() || Character.isWhitespace(content.charAt(i + 1))) {
				return i;
			}
		}
		return -1;
	}

	private static String stripComment(String line) {
		int i = -1;
		while ((i = indexOfUnquoted(line, '#', i + 1)) >= 0) {
			if (i == 0 || Character.isWhitespace(line.charAt(i - 1))) {
				return line.substring(0, i);
			}
		}
		return line;
	}

	/**
	 * @return the first index of <code>target</code> at or after <code>from</code> that is
	 * outside any quoted scalar, or -1. An unterminated quote hides the rest of the text.
	 */
	private static int indexOfUnquoted(String s, char target, int from) {
		for (int i = from; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c == target) {
				return i;
			}
			if ((c == '"' || c == '\'') && opensQuote(s, i)) {
				int close = YamlScalars.closingQuote(s, i);
				if (close < 0) {
					return -1;
				}
				i = close;
			}
		}
		return -1;
	}

	/**
	 * A quote starts a quoted scalar only where a scalar can start;
	 * elsewhere, as in <code>it's</code>, it's an ordinary character.
	 */
	private static boolean opensQuote(String s, int i) {
		if (i == 0) {
			return true;
		}
		char previous = s.charAt(i - 1);
		return Character.isWhitespace(previous) || "[{,:".indexOf(previous) >= 0;
	}

	private static List<String> splitFlow(String inner, Line line) {
		List<String> result = new ArrayList<>();
		if (inner.isBlank()) {
			return result;
		}
		int start = 0;
		int comma;
		while ((comma = indexOfUnquoted(inner, ',', start)) >= 0) {
			result.add(inner.substring(start, comma).trim());
			start = comma + 1;
		}
		String last = inner.substring(start).trim();
		if (!last.isEmpty()) {
			result.add(last);
		}
		LOGGER.trace("Line {}: flow collection has {} items", line.number(), result.size());
		return result;
	}

	private static int leadingWhitespace(String line) {
		int i = 0;
		while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
			i++;
		}
		return i;
	}

	/**
	 * Tabs win if more lines are indented with tabs than with spaces.
	 * Otherwise the width is the most frequent increase in indentation
	 * from one line to the next, preferring the smaller on a tie.
	 */
	private void recordIndentation(Node root, List<String> contentLines) {
		int tabLines = 0;
		int spaceLines = 0;
		Map<Integer, Integer> stepCounts = new TreeMap<>();
		int previous = 0;
		for (String line : contentLines) {
			int width = leadingWhitespace(line);
			if (width > 0) {
				if (line.substring(0, width).indexOf('\t') >= 0) {
					tabLines++;
				} else {
					spaceLines++;
				}
			}
			if (width > previous) {
				stepCounts.merge(width - previous, 1, Integer::sum);
			}
			previous = width;
		}
		if (tabLines > spaceLines) {
			root.putMetadata(INDENT_CHAR, "\t");
			root.putMetadata(INDENT_SIZE, 1);
			return;
		}
		int size = settings.indentSize();
		int bestCount = 0;
		for (Map.Entry<Integer, Integer> entry : stepCounts.entrySet()) {
			if (entry.getValue() > bestCount) {
				size = entry.getKey();
				bestCount = entry.getValue();
			}
		}
		root.putMetadata(INDENT_CHAR, " ");
		root.putMetadata(INDENT_SIZE, size);
	}

	/**
	 * The root's own name is not written: an object root becomes the top-level
	 * mapping, an array root the top-level sequence, and a scalar root a lone scalar.
	 *
	 * @param options {@link SerializeOptions#indent()} replaces the indentation recorded
	 * on the root, which in turn replaces {@link HandlerSettings#indentSize()} spaces.
	 * {@link SerializeOptions#compact()} is ignored.
	 */
	@Override
	public String serialize(Node root, SerializeOptions options) {
		String indent = indentUnit(root, options);
		List<String> out = new ArrayList<>();
		TraversalGuard guard = newGuard();
		guard.enter(root);
		switch (root.kind()) {
			case OBJECT:
				if (root.hasChildren()) {
					writeEntries(root.children(), "", indent, out, guard);
				} else {
					out.add("{}");
				}
				break;
			case ARRAY:
				if (root.hasChildren()) {
					writeItems(root.children(), "", indent, out, guard);
				} else {
					out.add("[]");
				}
				break;
			case SCALAR:
				out.add(YamlScalars.format(root.value()));
				break;
			default:
				throw DocumentSerializationException.unsupportedKind(FORMAT, root.kind());
		}
		guard.exit(root);
		return String.join("\n", out);
	}

	private String indentUnit(Node root, SerializeOptions options) {
		if (options.indent() != null && !options.indent().isEmpty()) {
			return options.indent();
		}
		Object indentChar = root.metadata(INDENT_CHAR);
		Object indentSize = root.metadata(INDENT_SIZE);
		if (indentChar instanceof String && indentSize instanceof Integer && (Integer) indentSize > 0) {
			return ((String) indentChar).repeat((Integer) indentSize);
		}
		return " ".repeat(settings.indentSize());
	}

	private void writeEntries(List<Node> entries, String pad, String indent, List<String> out, TraversalGuard guard) {
		for (Node entry : entries) {
			guard.enter(entry);
			String prefix = pad + YamlScalars.formatKey(entry.name()) + ":";
			switch (entry.kind()) {
				case SCALAR:
					out.add(prefix + " " + YamlScalars.format(entry.value()));
					break;
				case OBJECT:
				case ARRAY:
					String inline = inlineForm(entry);
					if (inline != null) {
						out.add(prefix + " " + inline);
					} else {
						out.add(prefix);
						writeBlock(entry, pad + indent, indent, out, guard);
					}
					break;
				default:
					throw DocumentSerializationException.unsupportedKind(FORMAT, entry.kind());
			}
			guard.exit(entry);
		}
	}

	private void writeItems(List<Node> items, String pad, String indent, List<String> out, TraversalGuard guard) {
		List<Node> sorted = new ArrayList<>(items);
		sorted.sort(Comparator.comparingLong(YamlHandler::arrayIndex));
		for (Node item : sorted) {
			guard.enter(item);
			switch (item.kind()) {
				case SCALAR:
					out.add(pad + "- " + YamlScalars.format(item.value()));
					break;
				case OBJECT:
				case ARRAY:
					String inline = inlineForm(item);
					if (inline != null) {
						out.add(pad + "- " + inline);
					} else if (item.kind() == NodeKind.OBJECT) {
						// Compact form: the first entry shares the "- " line and
						// the rest line up under it
						String entryPad = pad + "  ";
						int first = out.size();
						writeEntries(item.children(), entryPad, indent, out, guard);
						out.set(first, pad + "- " + out.get(first).substring(entryPad.length()));
					} else {
						out.add(pad + "-");
						writeItems(item.children(), pad + indent, indent, out, guard);
					}
					break;
				default:
					throw DocumentSerializationException.unsupportedKind(FORMAT, item.kind());
			}
			guard.exit(item);
		}
	}

	private void writeBlock(Node container, String pad, String indent, List<String> out, TraversalGuard guard) {
		if (container.kind() == NodeKind.OBJECT) {
			writeEntries(container.children(), pad, indent, out, guard);
		} else {
			writeItems(container.children(), pad, indent, out, guard);
		}
	}

	/**
	 * @return the single-line form of an empty or flow-styled collection, or null if it needs a block
	 */
	private static String inlineForm(Node container) {
		boolean isArray = container.kind() == NodeKind.ARRAY;
		if (!container.hasChildren()) {
			return isArray ? "[]" : "{}";
		}
		if (!FLOW.equals(container.metadata(YAML_STYLE))) {
			return null;
		}
		List<String> parts = new ArrayList<>();
		List<Node> children = new ArrayList<>(container.children());
		if (isArray) {
			children.sort(Comparator.comparingLong(YamlHandler::arrayIndex));
		}
		for (Node child : children) {
			if (child.kind() != NodeKind.SCALAR) {
				return null;
			}
			String value = YamlScalars.format(child.value());
			parts.add(isArray ? value : YamlScalars.formatKey(child.name()) + ": " + value);
		}
		return isArray
			? "[" + String.join(", ", parts) + "]"
			: "{" + String.join(", ", parts) + "}";
	}

	/**
	 * Non-numeric names sort last, keeping their relative order.
	 */
	private static long arrayIndex(Node child) {
		try {
			return Long.parseLong(child.name());
		} catch (NumberFormatException e) {
			return Long.MAX_VALUE;
		}
	}

	/**
	 * True for text with a <code>---</code> document marker, or with a key, list item
	 * or indented line among its first ten non-comment lines.
	 */
	@Override
	public boolean detect(String text) {
		if (text == null || text.isBlank()) {
			return false;
		}
		String trimmed = text.trim();
		if (trimmed.startsWith("---") || trimmed.contains("\n---")) {
			return true;
		}
		String[] lines = trimmed.split("\n");
		for (int i = 0; i < Math.min(10, lines.length); i++) {
			String line = lines[i];
			String stripped = line.trim();
			if (stripped.isEmpty() || stripped.startsWith("#")) {
				continue;
			}
			if (KEY_LINE.matcher(line).find() || ITEM_LINE.matcher(line).find() || INDENTED_LINE.matcher(line).find()) {
				return true;
			}
		}
		return false;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(YamlHandler.class);
}
