package works.arbor.jackson;

import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.PrettyPrinter;
import tools.jackson.core.util.DefaultIndenter;
import tools.jackson.core.util.DefaultPrettyPrinter;
import tools.jackson.core.util.Separators;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.ObjectWriter;
import tools.jackson.databind.json.JsonMapper;
import works.arbor.AbstractFormatHandler;
import works.arbor.EditableFields;
import works.arbor.HandlerSettings;
import works.arbor.Node;
import works.arbor.SerializeOptions;
import works.arbor.TraversalGuard;
import works.arbor.exceptions.DocumentParseException;
import works.arbor.exceptions.DocumentSerializationException;

/**
 * Reads JSON with Jackson and writes it back through a Jackson {@link JsonGenerator}
 * in the layout produced by JavaScript's <code>JSON.stringify(value, null, 2)</code>.
 * <p>
 * Objects become {@link works.arbor.NodeKind#OBJECT OBJECT} nodes,
 * arrays become {@link works.arbor.NodeKind#ARRAY ARRAY} nodes whose children are named by index,
 * and everything else becomes a {@link works.arbor.NodeKind#SCALAR SCALAR}.
 * Integers are read as {@link Long}, or {@link BigInteger} if they don't fit;
 * other numbers as {@link Double}.
 */
public final class JsonHandler extends AbstractFormatHandler {
	public static final String FORMAT = "json";
	public static final String ROOT_NAME = "root";

	private final ObjectMapper mapper;

	public JsonHandler(HandlerSettings settings) {
		super(settings);
		this.mapper = JsonMapper.builder()
			.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
			.build();
	}

	public JsonHandler() {
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

	@Override
	public Node parse(String text) {
		if (text == null || text.isBlank()) {
			throw new DocumentParseException("JSON content must be a non-empty string");
		}
		Object value;
		try {
			value = mapper.readValue(text, Object.class);
		} catch (JacksonException e) {
			throw new DocumentParseException("Invalid JSON: " + e.getOriginalMessage(), e);
		}
		return toNode(value, ROOT_NAME, 0);
	}

	private Node toNode(Object value, String name, int depth) {
		checkParseDepth(depth);
		if (value instanceof Map) {
			Node result = Node.object(name);
			for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
				result.appendChild(toNode(entry.getValue(), String.valueOf(entry.getKey()), depth + 1));
			}
			return result;
		} else if (value instanceof List) {
			Node result = Node.array(name);
			List<?> items = (List<?>) value;
			for (int i = 0; i < items.size(); i++) {
				result.appendChild(toNode(items.get(i), String.valueOf(i), depth + 1));
			}
			return result;
		} else {
			return Node.scalar(name, scalarValue(value));
		}
	}

	private static Object scalarValue(Object value) {
		if (value instanceof Integer) {
			return ((Integer) value).longValue();
		} else if (value instanceof BigInteger && ((BigInteger) value).bitLength() < 64) {
			return ((BigInteger) value).longValue();
		} else if (value instanceof Float) {
			return ((Float) value).doubleValue();
		} else {
			return value;
		}
	}

	/**
	 * @param options {@link SerializeOptions#indent()} replaces the default of
	 * {@link HandlerSettings#indentSize()} spaces; {@link SerializeOptions#compact()}
	 * writes everything on one line.
	 */
	@Override
	public String serialize(Node root, SerializeOptions options) {
		String indent;
		if (options.compact()) {
			indent = "";
		} else if (options.indent() != null) {
			indent = options.indent();
		} else {
			indent = " ".repeat(settings.indentSize());
		}
		ObjectWriter writer = indent.isEmpty()
			? mapper.writer()
			: mapper.writer().with(stringifyLayout(indent));
		StringWriter out = new StringWriter();
		try (JsonGenerator generator = writer.createGenerator(out)) {
			write(root, generator, newGuard());
		} catch (JacksonException e) {
			throw new DocumentSerializationException("Unable to write JSON: " + e.getOriginalMessage());
		}
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Serialized {} characters of JSON", out.getBuffer().length());
		}
		return out.toString();
	}

	/**
	 * One entry per line, <code>"name": value</code>, and <code>{}</code>/<code>[]</code> for empties.
	 */
	private static PrettyPrinter stringifyLayout(String indent) {
		Separators separators = Separators.createDefaultInstance()
			.withObjectNameValueSpacing(Separators.Spacing.AFTER)
			.withObjectEmptySeparator("")
			.withArrayEmptySeparator("");
		DefaultIndenter indenter = new DefaultIndenter(indent, "\n");
		return new DefaultPrettyPrinter(separators)
			.withObjectIndenter(indenter)
			.withArrayIndenter(indenter);
	}

	private void write(Node node, JsonGenerator generator, TraversalGuard guard) {
		guard.enter(node);
		switch (node.kind()) {
			case OBJECT:
				generator.writeStartObject();
				for (Node child : node.children()) {
					generator.writeName(child.name());
					write(child, generator, guard);
				}
				generator.writeEndObject();
				break;
			case ARRAY:
				List<Node> items = new ArrayList<>(node.children());
				items.sort(Comparator.comparingLong(JsonHandler::arrayIndex));
				generator.writeStartArray();
				for (Node item : items) {
					write(item, generator, guard);
				}
				generator.writeEndArray();
				break;
			case SCALAR:
				writeScalar(node.value(), generator);
				break;
			default:
				throw DocumentSerializationException.unsupportedKind(FORMAT, node.kind());
		}
		guard.exit(node);
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

	private static void writeScalar(Object value, JsonGenerator generator) {
		if (value == null) {
			generator.writeNull();
		} else if (value instanceof String) {
			generator.writeString((String) value);
		} else if (value instanceof Boolean) {
			generator.writeBoolean((Boolean) value);
		} else if (value instanceof Double) {
			double d = (Double) value;
			if (Double.isFinite(d)) {
				generator.writeNumber(numberText(d));
			} else {
				generator.writeNull();
			}
		} else if (value instanceof Long) {
			generator.writeNumber((Long) value);
		} else if (value instanceof BigInteger) {
			generator.writeNumber((BigInteger) value);
		} else if (value instanceof BigDecimal) {
			generator.writeNumber((BigDecimal) value);
		} else {
			// Integer and other boxed numbers
			generator.writeNumber(value.toString());
		}
	}

	/**
	 * Matches JavaScript's number formatting for the cases JSON can express:
	 * whole numbers have no fraction, and non-finite values become null.
	 */
	static String numberText(double d) {
		if (Double.isNaN(d) || Double.isInfinite(d)) {
			return "null";
		}
		if (d == Math.rint(d) && Math.abs(d) < 1e21) {
			if (d == 0) {
				return "0";
			}
			return new BigDecimal(d).toPlainString();
		}
		String text = Double.toString(d);
		int e = text.indexOf('E');
		if (e < 0) {
			return text;
		}
		String mantissa = text.substring(0, e);
		if (mantissa.endsWith(".0")) {
			mantissa = mantissa.substring(0, mantissa.length() - 2);
		}
		String exponent = text.substring(e + 1);
		return mantissa + "e" + (exponent.startsWith("-") ? exponent : "+" + exponent);
	}

	/**
	 * True if <code>text</code> is bracketed by <code>{}</code> or <code>[]</code> and parses.
	 */
	@Override
	public boolean detect(String text) {
		if (text == null) {
			return false;
		}
		String trimmed = text.trim();
		boolean bracketed = (trimmed.startsWith("{") && trimmed.endsWith("}"))
			|| (trimmed.startsWith("[") && trimmed.endsWith("]"));
		if (!bracketed) {
			return false;
		}
		try {
			mapper.readTree(trimmed);
			return true;
		} catch (JacksonException e) {
			LOGGER.trace("Not JSON", e);
			return false;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonHandler.class);
}
