package works.arbor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.arbor.exceptions.CircularMoveException;
import works.arbor.exceptions.DocumentParseException;
import works.arbor.exceptions.DocumentSerializationException;
import works.arbor.exceptions.NoDocumentLoadedException;
import works.arbor.exceptions.NodeNotFoundException;
import works.arbor.exceptions.UnknownFormatException;

import static java.util.Objects.requireNonNull;
import static works.arbor.logging.MappedDiagnosticContext.MDCScope;
import static works.arbor.logging.MappedDiagnosticContext.setupMDC;

/**
 * Owns one document: its {@link Node} tree, the format it came from,
 * and the text that the tree currently serializes to.
 * <p>
 * Every node is indexed by {@link NodeId}; the parent of a node is found
 * through that index rather than by a direct reference.
 * Mutations are checked before anything changes, and undone if the current
 * format can't write the result, so a rejected mutation leaves the tree as it was. A successful one marks the model
 * {@link #isDirty() dirty} and regenerates {@link #sourceText()}.
 * <p>
 * Not thread-safe.
 */
public final class DocumentModel {
	private final String name;
	private final String instanceID = UUID.randomUUID().toString();
	private final HandlerRegistry registry;
	private final List<DocumentListener> listeners = new ArrayList<>();
	private final Map<NodeId, Node> nodesById = new HashMap<>();

	private Node root;
	private String format;
	private String sourceText = "";
	private boolean dirty;

	public DocumentModel(String name, HandlerRegistry registry) {
		this.name = requireNonNull(name);
		this.registry = requireNonNull(registry);
	}

	public String name() {
		return name;
	}

	public String instanceID() {
		return instanceID;
	}

	public HandlerRegistry registry() {
		return registry;
	}

	public boolean isLoaded() {
		return root != null;
	}

	/**
	 * @throws NoDocumentLoadedException if nothing has been loaded
	 */
	public Node root() {
		requireLoaded("root");
		return root;
	}

	/**
	 * @return the current format name, or null if nothing is loaded
	 */
	@Nullable
	public String format() {
		return format;
	}

	public String sourceText() {
		return sourceText;
	}

	public boolean isDirty() {
		return dirty;
	}

	public void addListener(DocumentListener listener) {
		listeners.add(requireNonNull(listener));
	}

	public void removeListener(DocumentListener listener) {
		listeners.remove(listener);
	}

	/**
	 * Loads <code>text</code> in the format chosen by {@link #detectFormat}.
	 */
	public void load(String text) {
		load(text, detectFormat(text));
	}

	/**
	 * Replaces the current document. If parsing fails, the previous document is kept.
	 *
	 * @throws UnknownFormatException if <code>format</code> is not registered
	 * @throws DocumentParseException if <code>text</code> is not valid in that format
	 */
	public void load(String text, String format) {
		try (MDCScope ignored = setupMDC(name, instanceID, "load")) {
			FormatHandler handler = registry.resolve(format);
			Node newRoot = handler.parse(text);
			Map<NodeId, Node> newIndex = new HashMap<>();
			indexSubtree(newRoot, newIndex);

			this.root = newRoot;
			this.format = handler.formatName();
			this.sourceText = text;
			this.dirty = false;
			nodesById.clear();
			nodesById.putAll(newIndex);
			LOGGER.debug("Loaded {} document with {} nodes", this.format, nodesById.size());
			notifyListeners(l -> l.loaded(newRoot, this.format));
		}
	}

	/**
	 * Adopts an already-built tree, regenerating the source text in <code>format</code>.
	 */
	public void setRoot(Node newRoot, String format) {
		try (MDCScope ignored = setupMDC(name, instanceID, "setRoot")) {
			FormatHandler handler = registry.resolve(format);
			if (newRoot.parentId() != null) {
				throw new IllegalArgumentException("Root node must not have a parent: " + newRoot);
			}
			Map<NodeId, Node> newIndex = new HashMap<>();
			indexSubtree(newRoot, newIndex);
			String newText = handler.serialize(newRoot);

			this.root = newRoot;
			this.format = handler.formatName();
			this.sourceText = newText;
			this.dirty = true;
			nodesById.clear();
			nodesById.putAll(newIndex);
			LOGGER.debug("Root replaced; {} nodes", nodesById.size());
			notifyListeners(l -> l.loaded(newRoot, this.format));
			notifyListeners(l -> l.sourceUpdated(newText));
		}
	}

	/**
	 * Guesses the format of <code>text</code>. Checks, in order:
	 * <ol>
	 *     <li>bracketed text that the JSON handler accepts: {@code json}</li>
	 *     <li>text between angle brackets: {@code xml}</li>
	 *     <li>text with a colon and neither {@code <} nor <code>{</code>: {@code yaml}</li>
	 *     <li>text with a {@code #}: {@code markdown}</li>
	 * </ol>
	 * and falls back to {@code json}.
	 */
	public String detectFormat(String text) {
		if (text == null) {
			return JSON;
		}
		String trimmed = text.trim();
		boolean bracketed = (trimmed.startsWith("{") && trimmed.endsWith("}"))
			|| (trimmed.startsWith("[") && trimmed.endsWith("]"));
		if (bracketed && registry.isRegistered(JSON) && registry.resolve(JSON).detect(trimmed)) {
			return JSON;
		}
		if (trimmed.startsWith("<") && trimmed.endsWith(">")) {
			return "xml";
		}
		if (trimmed.contains(":") && !trimmed.contains("<") && !trimmed.contains("{")) {
			return "yaml";
		}
		if (trimmed.contains("#")) {
			return "markdown";
		}
		return JSON;
	}

	/**
	 * Looks up a node by id, and failing that, by {@link NodePath path}.
	 *
	 * @return empty if there is no such node or nothing is loaded
	 */
	public Optional<Node> find(String idOrPath) {
		if (root == null) {
			return Optional.empty();
		}
		if (!idOrPath.isEmpty()) {
			Node byId = nodesById.get(NodeId.from(idOrPath));
			if (byId != null) {
				return Optional.of(byId);
			}
		}
		return NodePath.tryParse(idOrPath).flatMap(this::findByPath);
	}

	public Optional<Node> findById(NodeId id) {
		return Optional.ofNullable(nodesById.get(id));
	}

	/**
	 * Each segment selects the child with that name, or failing that,
	 * the child with that id (see {@link Node#pathSegment()}), or the child
	 * at that position if the segment is a number.
	 */
	public Optional<Node> findByPath(NodePath path) {
		if (root == null) {
			return Optional.empty();
		}
		Node current = root;
		for (String segment : path.segments()) {
			Node next = current.childNamed(segment);
			if (next == null) {
				next = childWithId(current, segment);
			}
			if (next == null) {
				next = childAtIndex(current, segment);
			}
			if (next == null) {
				return Optional.empty();
			}
			current = next;
		}
		return Optional.of(current);
	}

	private static Node childWithId(Node parent, String segment) {
		for (Node child : parent.children()) {
			if (child.id().toString().equals(segment)) {
				return child;
			}
		}
		return null;
	}

	private static Node childAtIndex(Node parent, String segment) {
		if (!segment.chars().allMatch(Character::isDigit) || segment.length() > 9) {
			return null;
		}
		int index = Integer.parseInt(segment);
		return (index < parent.childCount()) ? parent.child(index) : null;
	}

	/**
	 * @return the path from the root to the given node
	 * @throws NodeNotFoundException if the node is not in this document
	 */
	public NodePath pathOf(NodeId id) {
		Node node = nodesById.get(id);
		if (node == null) {
			throw new NodeNotFoundException(id.toString());
		}
		Deque<String> segments = new ArrayDeque<>();
		while (node != root) {
			segments.addFirst(node.pathSegment());
			node = nodesById.get(node.parentId());
		}
		return NodePath.of(segments.toArray(new String[0]));
	}

	public Optional<Node> parentOf(Node node) {
		NodeId parentId = node.parentId();
		return (parentId == null) ? Optional.empty() : findById(parentId);
	}

	/**
	 * @return every node in the document in depth-first pre-order, or an empty list if nothing is loaded
	 */
	public List<Node> nodes() {
		List<Node> result = new ArrayList<>(nodesById.size());
		if (root == null) {
			return result;
		}
		Deque<Node> stack = new ArrayDeque<>();
		stack.push(root);
		while (!stack.isEmpty()) {
			Node node = stack.pop();
			result.add(node);
			List<Node> children = node.children();
			for (int i = children.size() - 1; i >= 0; i--) {
				stack.push(children.get(i));
			}
		}
		return result;
	}

	public int nodeCount() {
		return nodesById.size();
	}

	/**
	 * @throws NodeNotFoundException if there is no such node
	 * @throws IllegalArgumentException if the node can't hold a value, or the value type is unsupported
	 */
	public void updateValue(String idOrPath, Object newValue) {
		try (MDCScope ignored = setupMDC(name, instanceID, "updateValue")) {
			Node node = require(idOrPath);
			if (!node.kind().carriesValue()) {
				throw new IllegalArgumentException("Can't set a value on " + node.kind().wireName() + " node " + node.id());
			}
			if (!Node.isScalarValue(newValue)) {
				throw new IllegalArgumentException("Unsupported value type: " + newValue.getClass().getName());
			}
			Object oldValue = node.value();
			node.setValue(newValue);
			commit(() -> node.setValue(oldValue));
			LOGGER.debug("Updated value of {}", node.id());
			notifyListeners(l -> l.valueUpdated(node, oldValue));
		}
	}

	/**
	 * Changes a node's name. Array children are named by position and can't be renamed.
	 *
	 * @throws IllegalArgumentException if the new name would collide with a sibling in an object,
	 * or the node is an array element
	 */
	public void rename(String idOrPath, String newName) {
		try (MDCScope ignored = setupMDC(name, instanceID, "rename")) {
			Node node = require(idOrPath);
			Node parent = parentOf(node).orElse(null);
			if (parent != null) {
				if (parent.kind() == NodeKind.ARRAY) {
					throw new IllegalArgumentException("Array elements are named by position: " + node.id());
				}
				Node existing = parent.childNamed(newName);
				if (parent.kind() == NodeKind.OBJECT && existing != null && existing != node) {
					throw new IllegalArgumentException("Duplicate key \"" + newName + "\" in " + parent.id());
				}
			}
			String oldName = node.name();
			node.setName(newName);
			commit(() -> node.setName(oldName));
			LOGGER.debug("Renamed {} from \"{}\" to \"{}\"", node.id(), oldName, newName);
			notifyListeners(l -> l.renamed(node, oldName));
		}
	}

	public void addChild(String parentIdOrPath, Node child) {
		addChild(parentIdOrPath, child, -1);
	}

	/**
	 * Attaches <code>child</code>, with its whole subtree, under the given parent.
	 *
	 * @param index position among the parent's children; -1 or past the end appends
	 * @throws NodeNotFoundException if there is no such parent
	 * @throws IllegalArgumentException if the parent can't have children, the child is already attached,
	 * an id in the subtree is already in use, or the name would duplicate a key in an object
	 */
	public void addChild(String parentIdOrPath, Node child, int index) {
		try (MDCScope ignored = setupMDC(name, instanceID, "addChild")) {
			Node parent = require(parentIdOrPath);
			if (!parent.kind().isContainer()) {
				throw new IllegalArgumentException("A " + parent.kind().wireName() + " node can't have children: " + parent.id());
			}
			if (child.parentId() != null) {
				throw new IllegalArgumentException("Node is already attached: " + child.id());
			}
			if (parent.kind() == NodeKind.OBJECT && parent.childNamed(child.name()) != null) {
				throw new IllegalArgumentException("Duplicate key \"" + child.name() + "\" in " + parent.id());
			}
			Map<NodeId, Node> additions = new HashMap<>();
			indexSubtree(child, additions);
			for (NodeId id : additions.keySet()) {
				if (nodesById.containsKey(id)) {
					throw new IllegalArgumentException("Node id already in use: " + id);
				}
			}

			String childName = child.name();
			parent.insertChild(index, child);
			parent.renumberChildren();
			nodesById.putAll(additions);
			commit(() -> {
				parent.removeChild(child);
				parent.renumberChildren();
				child.setName(childName);
				nodesById.keySet().removeAll(additions.keySet());
			});
			LOGGER.debug("Added {} under {}", child.id(), parent.id());
			notifyListeners(l -> l.childAdded(parent, child));
		}
	}

	/**
	 * Detaches a node and its subtree. Remaining array elements are renumbered.
	 *
	 * @return the detached node
	 * @throws IllegalArgumentException if asked to remove the root
	 */
	public Node remove(String idOrPath) {
		try (MDCScope ignored = setupMDC(name, instanceID, "remove")) {
			Node node = require(idOrPath);
			if (node == root) {
				throw new IllegalArgumentException("Can't remove the root node");
			}
			Node parent = nodesById.get(node.parentId());
			String oldName = node.name();
			int index = parent.removeChild(node);
			parent.renumberChildren();
			unindexSubtree(node);
			commit(() -> {
				parent.insertChild(index, node);
				parent.renumberChildren();
				node.setName(oldName);
				indexSubtree(node, nodesById);
			});
			LOGGER.debug("Removed {} from {}", node.id(), parent.id());
			notifyListeners(l -> l.childRemoved(parent, node, index));
			return node;
		}
	}

	/**
	 * Moves a node to a new parent, at <code>index</code> among that parent's children
	 * after the node has been detached from its old position.
	 * Array elements of both parents are renumbered.
	 *
	 * @param index -1 or past the end appends
	 * @throws CircularMoveException if the new parent is the node itself or one of its descendants
	 * @throws IllegalArgumentException if the node is the root, the new parent can't have children,
	 * or the name would duplicate a key in an object
	 */
	public void move(String idOrPath, String newParentIdOrPath, int index) {
		try (MDCScope ignored = setupMDC(name, instanceID, "move")) {
			Node node = require(idOrPath);
			Node newParent = require(newParentIdOrPath);
			if (node == root) {
				throw new IllegalArgumentException("Can't move the root node");
			}
			if (isSameOrAncestor(node, newParent)) {
				throw new CircularMoveException(node.id(), newParent.id());
			}
			if (!newParent.kind().isContainer()) {
				throw new IllegalArgumentException("A " + newParent.kind().wireName() + " node can't have children: " + newParent.id());
			}
			Node oldParent = nodesById.get(node.parentId());
			if (newParent.kind() == NodeKind.OBJECT) {
				Node existing = newParent.childNamed(node.name());
				if (existing != null && existing != node) {
					throw new IllegalArgumentException("Duplicate key \"" + node.name() + "\" in " + newParent.id());
				}
			}

			String oldName = node.name();
			int oldIndex = oldParent.removeChild(node);
			newParent.insertChild(index, node);
			oldParent.renumberChildren();
			newParent.renumberChildren();
			commit(() -> {
				newParent.removeChild(node);
				newParent.renumberChildren();
				oldParent.insertChild(oldIndex, node);
				oldParent.renumberChildren();
				node.setName(oldName);
			});
			LOGGER.debug("Moved {} from {} to {}", node.id(), oldParent.id(), newParent.id());
			notifyListeners(l -> l.moved(node, oldParent, newParent, index));
		}
	}

	private boolean isSameOrAncestor(Node candidate, Node node) {
		Node current = node;
		while (current != null) {
			if (current == candidate) {
				return true;
			}
			NodeId parentId = current.parentId();
			current = (parentId == null) ? null : nodesById.get(parentId);
		}
		return false;
	}

	/**
	 * Re-parses {@link #sourceText()} in the current format without changing anything.
	 * Never throws.
	 */
	public ValidationResult validate() {
		if (format == null || !registry.isRegistered(format)) {
			return ValidationResult.failed("No handler for current format");
		}
		return registry.resolve(format).validate(sourceText);
	}

	/**
	 * Rewrites the document in another format and reloads it from that text.
	 * Node ids are not preserved.
	 *
	 * @return the new source text
	 * @throws UnknownFormatException if <code>targetFormat</code> is not registered
	 */
	public String convertTo(String targetFormat) {
		requireLoaded("convertTo");
		String converted;
		try (MDCScope ignored = setupMDC(name, instanceID, "convertTo")) {
			FormatHandler target = registry.resolve(targetFormat);
			converted = target.serialize(root);
			LOGGER.debug("Converting from {} to {}", format, target.formatName());
		}
		load(converted, targetFormat);
		return converted;
	}

	public void clear() {
		root = null;
		format = null;
		sourceText = "";
		dirty = false;
		nodesById.clear();
		notifyListeners(DocumentListener::cleared);
	}

	private Node require(String idOrPath) {
		requireLoaded(idOrPath);
		return find(idOrPath).orElseThrow(() -> new NodeNotFoundException(idOrPath));
	}

	private void requireLoaded(String what) {
		if (root == null) {
			throw new NoDocumentLoadedException("No document loaded in \"" + name + "\" for: " + what);
		}
	}

	/**
	 * Regenerates the source text after an in-place change to the tree.
	 * If the current format can't express the changed tree, <code>undo</code>
	 * puts it back and the exception propagates with nothing else changed.
	 */
	private void commit(Runnable undo) {
		String text;
		try {
			text = registry.resolve(format).serialize(root);
		} catch (DocumentSerializationException e) {
			undo.run();
			LOGGER.debug("Reverted change that can't be written as {}", format);
			throw e;
		}
		dirty = true;
		sourceText = text;
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Source is now:\n{}", sourceText);
		}
		notifyListeners(l -> l.sourceUpdated(text));
	}

	private void notifyListeners(Consumer<DocumentListener> action) {
		for (DocumentListener listener : List.copyOf(listeners)) {
			try {
				action.accept(listener);
			} catch (RuntimeException e) {
				LOGGER.error("Document listener {} failed", listener, e);
			}
		}
	}

	private static void indexSubtree(Node subtreeRoot, Map<NodeId, Node> index) {
		Deque<Node> stack = new ArrayDeque<>();
		stack.push(subtreeRoot);
		while (!stack.isEmpty()) {
			Node node = stack.pop();
			if (index.put(node.id(), node) != null) {
				throw new IllegalArgumentException("Node id appears twice in tree: " + node.id());
			}
			for (Node child : node.children()) {
				stack.push(child);
			}
		}
	}

	private void unindexSubtree(Node subtreeRoot) {
		Deque<Node> stack = new ArrayDeque<>();
		stack.push(subtreeRoot);
		while (!stack.isEmpty()) {
			Node node = stack.pop();
			nodesById.remove(node.id());
			for (Node child : node.children()) {
				stack.push(child);
			}
		}
	}

	@Override
	public String toString() {
		return "DocumentModel(\"" + name + "\", " + format + ")";
	}

	private static final String JSON = "json";
	private static final Logger LOGGER = LoggerFactory.getLogger(DocumentModel.class);
}
