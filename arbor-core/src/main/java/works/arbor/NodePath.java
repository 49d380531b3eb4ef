package works.arbor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import works.arbor.exceptions.MalformedPathException;

import static java.util.Collections.unmodifiableList;

/**
 * A dot-separated sequence of segments locating a node from the root,
 * like <code>servers.0.host</code>.
 * The empty path denotes the root itself.
 * <p>
 * Each segment is a node's name, or for array children, its index.
 * A name that itself contains a dot can't be expressed as a path.
 */
public final class NodePath {
	public static final NodePath ROOT = new NodePath(List.of());

	private final List<String> segments;

	private NodePath(List<String> segments) {
		this.segments = segments;
	}

	/**
	 * @param path dot-separated segments; <code>""</code> and <code>"."</code> both mean the root
	 * @throws MalformedPathException if any segment is empty
	 */
	public static NodePath parse(String path) {
		return tryParse(path).orElseThrow(() ->
			new MalformedPathException("Path has an empty segment: \"" + path + "\""));
	}

	/**
	 * Like {@link #parse}, but a malformed path yields empty instead of an exception.
	 */
	public static Optional<NodePath> tryParse(String path) {
		if (path.isEmpty() || path.equals(".")) {
			return Optional.of(ROOT);
		}
		String[] parts = path.split("\\.", -1);
		for (String part : parts) {
			if (part.isEmpty()) {
				return Optional.empty();
			}
		}
		return Optional.of(new NodePath(unmodifiableList(Arrays.asList(parts))));
	}

	public static NodePath of(String... segments) {
		NodePath result = ROOT;
		for (String segment : segments) {
			result = result.then(segment);
		}
		return result;
	}

	public NodePath then(String segment) {
		if (segment.isEmpty() || segment.contains(".")) {
			throw new MalformedPathException("Invalid path segment: \"" + segment + "\"");
		}
		List<String> newSegments = new ArrayList<>(segments.size() + 1);
		newSegments.addAll(segments);
		newSegments.add(segment);
		return new NodePath(unmodifiableList(newSegments));
	}

	public List<String> segments() {
		return segments;
	}

	public int length() {
		return segments.size();
	}

	public boolean isRoot() {
		return segments.isEmpty();
	}

	public NodePath parent() {
		if (isRoot()) {
			throw new IllegalStateException("Root path has no parent");
		}
		return new NodePath(segments.subList(0, segments.size() - 1));
	}

	public String lastSegment() {
		if (isRoot()) {
			throw new IllegalStateException("Root path has no segments");
		}
		return segments.get(segments.size() - 1);
	}

	/**
	 * @return the non-root prefixes of this path, shortest first, ending with this path
	 */
	public List<NodePath> prefixes() {
		List<NodePath> result = new ArrayList<>(segments.size());
		for (int i = 1; i <= segments.size(); i++) {
			result.add(new NodePath(segments.subList(0, i)));
		}
		return result;
	}

	/**
	 * @return true if <code>other</code> is this path or lies underneath it
	 */
	public boolean isPrefixOf(NodePath other) {
		return other.segments.size() >= segments.size()
			&& other.segments.subList(0, segments.size()).equals(segments);
	}

	/**
	 * String form, accepted by {@link #parse}.
	 * The root is the empty string.
	 */
	public String asString() {
		return String.join(".", segments);
	}

	@Override
	public String toString() {
		return asString();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof NodePath)) {
			return false;
		}
		return segments.equals(((NodePath) o).segments);
	}

	@Override
	public int hashCode() {
		return segments.hashCode();
	}
}
