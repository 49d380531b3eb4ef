package works.arbor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * One entry in the unified tree that every {@link FormatHandler} produces and consumes.
 * <p>
 * A node owns its children. The link back to the parent is held only as a
 * {@link NodeId}; resolving it is the job of whoever indexes the tree,
 * normally {@link DocumentModel}.
 * <p>
 * Which fields are meaningful depends on {@link #kind()}:
 * only {@link NodeKind#isContainer() containers} have children,
 * only {@link NodeKind#carriesValue() value carriers} have a value,
 * and only {@link NodeKind#ELEMENT elements} have attributes.
 * Violations throw {@link IllegalStateException}.
 */
public final class Node {
	public static final String TEXT_NAME = "#text";
	public static final String CDATA_NAME = "#cdata-section";
	public static final String COMMENT_NAME = "#comment";

	/**
	 * Metadata key holding a heading's level, 1 to 6.
	 */
	public static final String LEVEL = "level";

	@NotNull private final NodeId id;
	@NotNull private final NodeKind kind;
	@NotNull private String name;
	private Object value;
	private final Map<String, String> attributes;
	private final List<Node> children;
	private final Map<String, Object> metadata = new LinkedHashMap<>();
	@Nullable private NodeId parentId;

	public Node(NodeId id, NodeKind kind, String name) {
		this.id = requireNonNull(id);
		this.kind = requireNonNull(kind);
		this.name = requireNonNull(name);
		this.attributes = (kind == NodeKind.ELEMENT) ? new LinkedHashMap<>() : null;
		this.children = kind.isContainer() ? new ArrayList<>() : null;
	}

	public static Node of(NodeKind kind, String name) {
		return new Node(NodeId.unique(kind.wireName()), kind, name);
	}

	public static Node object(String name) {
		return of(NodeKind.OBJECT, name);
	}

	public static Node array(String name) {
		return of(NodeKind.ARRAY, name);
	}

	public static Node scalar(String name, Object value) {
		Node result = of(NodeKind.SCALAR, name);
		result.setValue(value);
		return result;
	}

	public static Node element(String tagName) {
		return of(NodeKind.ELEMENT, tagName);
	}

	public static Node text(String text) {
		Node result = of(NodeKind.TEXT, TEXT_NAME);
		result.setValue(text);
		return result;
	}

	public static Node cdata(String text) {
		Node result = of(NodeKind.CDATA, CDATA_NAME);
		result.setValue(text);
		return result;
	}

	public static Node comment(String text) {
		Node result = of(NodeKind.COMMENT, COMMENT_NAME);
		result.setValue(text);
		return result;
	}

	public static Node processingInstruction(String target, String data) {
		Node result = of(NodeKind.PROCESSING_INSTRUCTION, target);
		result.setValue(data);
		return result;
	}

	public static Node heading(String text, int level) {
		if (level < 1) {
			throw new IllegalArgumentException("Heading level must be positive: " + level);
		}
		Node result = of(NodeKind.HEADING, text);
		result.putMetadata(LEVEL, level);
		return result;
	}

	public static Node content(String name, String text) {
		Node result = of(NodeKind.CONTENT, name);
		result.setValue(text);
		return result;
	}

	public static Node document(String name) {
		return of(NodeKind.DOCUMENT, name);
	}

	public NodeId id() {
		return id;
	}

	public NodeKind kind() {
		return kind;
	}

	public String name() {
		return name;
	}

	public void setName(String name) {
		this.name = requireNonNull(name);
	}

	public Object value() {
		return value;
	}

	public void setValue(Object value) {
		if (!kind.carriesValue()) {
			throw new IllegalStateException("A " + kind.wireName() + " node has no value");
		}
		if (!isScalarValue(value)) {
			throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
		}
		this.value = value;
	}

	/**
	 * @return true if <code>value</code> is one of the types a node may carry
	 */
	public static boolean isScalarValue(Object value) {
		return value == null
			|| value instanceof String
			|| value instanceof Boolean
			|| value instanceof Long
			|| value instanceof Integer
			|| value instanceof Double
			|| value instanceof BigInteger
			|| value instanceof BigDecimal;
	}

	public Map<String, String> attributes() {
		return (attributes == null) ? Map.of() : Collections.unmodifiableMap(attributes);
	}

	public void setAttribute(String key, String value) {
		if (attributes == null) {
			throw new IllegalStateException("A " + kind.wireName() + " node has no attributes");
		}
		attributes.put(requireNonNull(key), requireNonNull(value));
	}

	public List<Node> children() {
		return (children == null) ? List.of() : Collections.unmodifiableList(children);
	}

	public boolean hasChildren() {
		return children != null && !children.isEmpty();
	}

	public int childCount() {
		return (children == null) ? 0 : children.size();
	}

	public Node child(int index) {
		return requireChildren().get(index);
	}

	public void appendChild(Node child) {
		insertChild(childCount(), child);
	}

	/**
	 * @param index position among the children; clamped to the end of the list
	 */
	public void insertChild(int index, Node child) {
		List<Node> list = requireChildren();
		if (child.parentId != null) {
			throw new IllegalStateException("Node " + child.id + " is already attached to " + child.parentId);
		}
		if (child == this) {
			throw new IllegalArgumentException("Node can't contain itself");
		}
		int position = (index < 0 || index > list.size()) ? list.size() : index;
		list.add(position, child);
		child.parentId = this.id;
	}

	/**
	 * @return the index the child occupied
	 */
	public int removeChild(Node child) {
		List<Node> list = requireChildren();
		for (int i = 0; i < list.size(); i++) {
			if (list.get(i) == child) {
				list.remove(i);
				child.parentId = null;
				return i;
			}
		}
		throw new IllegalArgumentException("Node " + child.id + " is not a child of " + id);
	}

	public int indexOf(Node child) {
		if (children == null) {
			return -1;
		}
		for (int i = 0; i < children.size(); i++) {
			if (children.get(i) == child) {
				return i;
			}
		}
		return -1;
	}

	public Node childNamed(String childName) {
		if (children != null) {
			for (Node child : children) {
				if (child.name.equals(childName)) {
					return child;
				}
			}
		}
		return null;
	}

	/**
	 * Renames the children of an {@link NodeKind#ARRAY array} to their positions.
	 * Other kinds are left alone.
	 */
	public void renumberChildren() {
		if (kind == NodeKind.ARRAY) {
			for (int i = 0; i < children.size(); i++) {
				children.get(i).name = String.valueOf(i);
			}
		}
	}

	public Map<String, Object> metadata() {
		return Collections.unmodifiableMap(metadata);
	}

	public Object metadata(String key) {
		return metadata.get(key);
	}

	public void putMetadata(String key, Object value) {
		if (value == null) {
			metadata.remove(key);
		} else {
			metadata.put(key, value);
		}
	}

	public boolean metadataFlag(String key) {
		return Boolean.TRUE.equals(metadata.get(key));
	}

	/**
	 * @return the heading level from metadata, or 1 if absent
	 */
	public int headingLevel() {
		Object level = metadata.get(LEVEL);
		return (level instanceof Number) ? ((Number) level).intValue() : 1;
	}

	@Nullable
	public NodeId parentId() {
		return parentId;
	}

	/**
	 * The name used for this node in a {@link NodePath}: its name, or its id when
	 * the name is empty or contains a dot, which a path can't express.
	 */
	public String pathSegment() {
		return (name.isEmpty() || name.indexOf('.') >= 0) ? id.toString() : name;
	}

	/**
	 * A detached deep copy of this subtree in which every node has a fresh id.
	 * Names, values, attributes and metadata are copied; the copy has no parent.
	 */
	public Node copy() {
		Node result = new Node(NodeId.unique(kind.wireName()), kind, name);
		result.value = value;
		if (attributes != null) {
			result.attributes.putAll(attributes);
		}
		result.metadata.putAll(metadata);
		if (children != null) {
			for (Node child : children) {
				result.appendChild(child.copy());
			}
		}
		return result;
	}

	private List<Node> requireChildren() {
		if (children == null) {
			throw new IllegalStateException("A " + kind.wireName() + " node can't have children");
		}
		return children;
	}

	@Override
	public String toString() {
		return kind.wireName() + "(" + name + ")#" + id;
	}
}
