package works.arbor.xml;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.NodeList;
import org.w3c.dom.ProcessingInstruction;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import works.arbor.AbstractFormatHandler;
import works.arbor.EditableFields;
import works.arbor.HandlerSettings;
import works.arbor.Node;
import works.arbor.NodeKind;
import works.arbor.SerializeOptions;
import works.arbor.TraversalGuard;
import works.arbor.exceptions.DocumentParseException;
import works.arbor.exceptions.DocumentSerializationException;

import static works.arbor.xml.XmlEscaping.escapeAttribute;
import static works.arbor.xml.XmlEscaping.escapeText;

/**
 * Reads XML with the JDK's DOM parser and writes it back by hand.
 * <p>
 * Only the document element and its content are kept; the XML declaration,
 * doctype, and anything outside the document element are dropped.
 * Whitespace-only text is kept as {@link NodeKind#TEXT TEXT} nodes with metadata
 * {@link #IS_WHITESPACE_ONLY} and {@link #IS_SIGNIFICANT}, so that
 * unindented output reproduces the input layout.
 * <p>
 * Nodes from other formats are written as elements: objects and arrays become
 * elements with their children, scalars become elements containing their value,
 * and children of arrays are named {@code item}.
 */
public final class XmlHandler extends AbstractFormatHandler {
	public static final String FORMAT = "xml";

	public static final String IS_WHITESPACE_ONLY = "isWhitespaceOnly";
	public static final String IS_SIGNIFICANT = "isSignificant";
	public static final String NAMESPACE = "namespace";

	static final Pattern ELEMENT_NAME = Pattern.compile("^[a-zA-Z_:][-a-zA-Z0-9_:.]*$");
	private static final Pattern FIRST_TAG = Pattern.compile("<(\\w+)");
	private static final Set<String> PRESERVE_WHITESPACE_ELEMENTS = Set.of("pre", "code", "script", "style");
	private static final Set<String> HTML_ELEMENTS = Set.of("html", "head", "body", "div", "span", "p", "a", "img");

	public XmlHandler(HandlerSettings settings) {
		super(settings);
	}

	public XmlHandler() {
		this(HandlerSettings.defaults());
	}

	@Override
	public String formatName() {
		return FORMAT;
	}

	@Override
	public EditableFields editableFields() {
		return new EditableFields(true, true, false, true);
	}

	@Override
	public Node parse(String text) {
		if (text == null || text.isBlank()) {
			throw new DocumentParseException("Failed to parse XML: no content");
		}
		Document document;
		try {
			document = newDocumentBuilder().parse(new InputSource(new StringReader(text)));
		} catch (SAXParseException e) {
			throw new DocumentParseException("Failed to parse XML: line " + e.getLineNumber() + ", column " + e.getColumnNumber() + ": " + e.getMessage(), e);
		} catch (SAXException | IOException e) {
			throw new DocumentParseException("Failed to parse XML: " + e.getMessage(), e);
		}
		Element rootElement = document.getDocumentElement();
		if (rootElement == null) {
			throw new DocumentParseException("Failed to parse XML: no root element");
		}
		return convertElement(rootElement, 0);
	}

	private static DocumentBuilder newDocumentBuilder() {
		DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
		factory.setNamespaceAware(true);
		factory.setCoalescing(false);
		factory.setIgnoringComments(false);
		factory.setXIncludeAware(false);
		try {
			factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
			factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
			factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
			factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
			DocumentBuilder builder = factory.newDocumentBuilder();
			builder.setErrorHandler(THROWING_ERROR_HANDLER);
			return builder;
		} catch (ParserConfigurationException e) {
			throw new IllegalStateException("Unable to configure XML parser", e);
		}
	}

	private Node convertElement(Element element, int depth) {
		checkParseDepth(depth);
		Node result = Node.element(element.getNodeName());
		if (element.getNamespaceURI() != null) {
			result.putMetadata(NAMESPACE, element.getNamespaceURI());
		}
		NamedNodeMap attributes = element.getAttributes();
		for (int i = 0; i < attributes.getLength(); i++) {
			Attr attr = (Attr) attributes.item(i);
			result.setAttribute(attr.getName(), attr.getValue());
		}
		NodeList childNodes = element.getChildNodes();
		for (int i = 0; i < childNodes.getLength(); i++) {
			Node child = convertChild(childNodes.item(i), depth + 1);
			if (child != null) {
				result.appendChild(child);
			}
		}
		return result;
	}

	private Node convertChild(org.w3c.dom.Node domNode, int depth) {
		switch (domNode.getNodeType()) {
			case org.w3c.dom.Node.ELEMENT_NODE:
				return convertElement((Element) domNode, depth);
			case org.w3c.dom.Node.TEXT_NODE:
				String text = domNode.getNodeValue();
				Node textNode = Node.text(text);
				textNode.putMetadata(IS_WHITESPACE_ONLY, text.isBlank());
				textNode.putMetadata(IS_SIGNIFICANT, isSignificantWhitespace(domNode));
				return textNode;
			case org.w3c.dom.Node.CDATA_SECTION_NODE:
				return Node.cdata(domNode.getNodeValue());
			case org.w3c.dom.Node.COMMENT_NODE:
				return Node.comment(domNode.getNodeValue());
			case org.w3c.dom.Node.PROCESSING_INSTRUCTION_NODE:
				ProcessingInstruction pi = (ProcessingInstruction) domNode;
				return Node.processingInstruction(pi.getTarget(), pi.getData());
			default:
				LOGGER.debug("Skipping DOM node type {}", domNode.getNodeType());
				return null;
		}
	}

	/**
	 * Whitespace matters inside {@code pre}, {@code code}, {@code script} and {@code style} elements,
	 * and wherever the nearest enclosing <code>xml:space</code> attribute says <code>preserve</code>.
	 */
	private static boolean isSignificantWhitespace(org.w3c.dom.Node textNode) {
		boolean xmlSpaceDecided = false;
		for (org.w3c.dom.Node ancestor = textNode.getParentNode(); ancestor instanceof Element; ancestor = ancestor.getParentNode()) {
			Element element = (Element) ancestor;
			String localName = (element.getLocalName() != null) ? element.getLocalName() : element.getNodeName();
			if (PRESERVE_WHITESPACE_ELEMENTS.contains(localName.toLowerCase(Locale.ROOT))) {
				return true;
			}
			if (!xmlSpaceDecided && element.hasAttributeNS(XMLConstants.XML_NS_URI, "space")) {
				if ("preserve".equals(element.getAttributeNS(XMLConstants.XML_NS_URI, "space"))) {
					return true;
				}
				xmlSpaceDecided = true;
			}
		}
		return false;
	}

	/**
	 * @param options with no {@link SerializeOptions#indent() indent}, output is written without
	 * added whitespace. With an indent, child elements start on new indented lines and
	 * insignificant whitespace-only text is dropped. {@link SerializeOptions#compact()} overrides the indent.
	 */
	@Override
	public String serialize(Node root, SerializeOptions options) {
		String indent = (options.compact() || options.indent() == null) ? "" : options.indent();
		StringBuilder out = new StringBuilder();
		writeNode(root, false, 0, indent, out, newGuard());
		return out.toString();
	}

	private void writeNode(Node node, boolean inArray, int depth, String indent, StringBuilder out, TraversalGuard guard) {
		guard.enter(node);
		switch (node.kind()) {
			case ELEMENT:
			case OBJECT:
			case ARRAY:
			case SCALAR:
				writeElement(node, elementName(node, inArray), depth, indent, out, guard);
				break;
			case TEXT:
				out.append(escapeText(stringValue(node)));
				break;
			case CDATA:
				out.append("<![CDATA[").append(stringValue(node).replace("]]>", "]]]]><![CDATA[>")).append("]]>");
				break;
			case COMMENT:
				String comment = stringValue(node);
				if (comment.contains("--") || comment.endsWith("-")) {
					throw new DocumentSerializationException("Comment can't contain \"--\" or end with \"-\": " + comment);
				}
				out.append("<!--").append(comment).append("-->");
				break;
			case PROCESSING_INSTRUCTION:
				String data = stringValue(node);
				if (data.contains("?>")) {
					throw new DocumentSerializationException("Processing instruction data can't contain \"?>\": " + data);
				}
				out.append("<?").append(node.name()).append(data.isEmpty() ? "" : " " + data).append("?>");
				break;
			default:
				throw DocumentSerializationException.unsupportedKind(FORMAT, node.kind());
		}
		guard.exit(node);
	}

	private void writeElement(Node node, String name, int depth, String indent, StringBuilder out, TraversalGuard guard) {
		if (!ELEMENT_NAME.matcher(name).matches()) {
			throw new DocumentSerializationException("Invalid element name: " + name);
		}
		out.append('<').append(name);
		for (Map.Entry<String, String> attribute : new TreeMap<>(node.attributes()).entrySet()) {
			out.append(' ').append(attribute.getKey()).append("=\"").append(escapeAttribute(attribute.getValue())).append('"');
		}

		boolean pretty = !indent.isEmpty();
		List<Node> children = pretty
			? node.children().stream().filter(c -> !isIgnorableWhitespace(c)).toList()
			: node.children();
		if (children.isEmpty()) {
			if (node.kind() == NodeKind.SCALAR && node.value() != null) {
				out.append('>').append(escapeText(node.value().toString())).append("</").append(name).append('>');
			} else {
				out.append(" />");
			}
			return;
		}

		out.append('>');
		boolean blockLayout = pretty && children.stream().anyMatch(XmlHandler::isElementLike);
		boolean childrenAreArrayItems = node.kind() == NodeKind.ARRAY;
		for (Node child : children) {
			if (blockLayout && isElementLike(child)) {
				out.append('\n').append(indent.repeat(depth + 1));
			}
			writeNode(child, childrenAreArrayItems, depth + 1, indent, out, guard);
		}
		if (blockLayout) {
			out.append('\n').append(indent.repeat(depth));
		}
		out.append("</").append(name).append('>');
	}

	private static String elementName(Node node, boolean inArray) {
		if (node.kind() == NodeKind.ELEMENT) {
			return node.name();
		}
		if (inArray) {
			return "item";
		}
		if (node.name().isEmpty()) {
			switch (node.kind()) {
				case OBJECT: return "object";
				case ARRAY: return "array";
				default: return "value";
			}
		}
		return node.name();
	}

	private static boolean isElementLike(Node node) {
		switch (node.kind()) {
			case ELEMENT:
			case OBJECT:
			case ARRAY:
			case SCALAR:
				return true;
			default:
				return false;
		}
	}

	private static boolean isIgnorableWhitespace(Node node) {
		return node.kind() == NodeKind.TEXT
			&& stringValue(node).isBlank()
			&& !node.metadataFlag(IS_SIGNIFICANT);
	}

	private static String stringValue(Node node) {
		return (node.value() == null) ? "" : node.value().toString();
	}

	/**
	 * True for text with an XML declaration, or that starts with a tag
	 * that isn't one of a few common HTML tags.
	 */
	@Override
	public boolean detect(String text) {
		if (text == null) {
			return false;
		}
		String trimmed = text.trim();
		if (trimmed.startsWith("<?xml")) {
			return true;
		}
		if (trimmed.startsWith("<") && trimmed.contains(">")) {
			Matcher firstTag = FIRST_TAG.matcher(trimmed);
			if (firstTag.find()) {
				return !HTML_ELEMENTS.contains(firstTag.group(1).toLowerCase(Locale.ROOT));
			}
		}
		return false;
	}

	private static final ErrorHandler THROWING_ERROR_HANDLER = new ErrorHandler() {
		@Override
		public void warning(SAXParseException exception) {
			LOGGER.debug("XML parser warning at line {}: {}", exception.getLineNumber(), exception.getMessage());
		}

		@Override
		public void error(SAXParseException exception) throws SAXException {
			throw exception;
		}

		@Override
		public void fatalError(SAXParseException exception) throws SAXException {
			throw exception;
		}
	};

	private static final Logger LOGGER = LoggerFactory.getLogger(XmlHandler.class);
}
