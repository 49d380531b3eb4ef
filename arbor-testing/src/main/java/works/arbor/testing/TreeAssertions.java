package works.arbor.testing;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import works.arbor.Node;
import works.arbor.NodeId;
import works.arbor.NodeKind;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Assertions over whole {@link Node} trees.
 */
public final class TreeAssertions {
	private TreeAssertions() {}

	/**
	 * Compares kind, name, value, attributes and children recursively.
	 * Ids and metadata are ignored. Numbers compare by numeric value
	 * regardless of their Java type.
	 */
	public static void assertSameStructure(Node expected, Node actual) {
		assertSameStructure(expected, actual, "(root)");
	}

	private static void assertSameStructure(Node expected, Node actual, String where) {
		assertEquals(expected.kind(), actual.kind(), "kind at " + where);
		assertEquals(expected.name(), actual.name(), "name at " + where);
		assertEquals(normalize(expected.value()), normalize(actual.value()), "value at " + where);
		assertEquals(expected.attributes(), actual.attributes(), "attributes at " + where);
		List<Node> expectedChildren = expected.children();
		List<Node> actualChildren = actual.children();
		assertEquals(childNames(expectedChildren), childNames(actualChildren), "children at " + where);
		for (int i = 0; i < expectedChildren.size(); i++) {
			assertSameStructure(expectedChildren.get(i), actualChildren.get(i), where + "/" + expectedChildren.get(i).name());
		}
	}

	private static Object normalize(Object value) {
		if (value instanceof Double && !Double.isFinite((Double) value)) {
			return value;
		} else if (value instanceof Number) {
			return new BigDecimal(value.toString()).stripTrailingZeros();
		} else {
			return value;
		}
	}

	private static List<String> childNames(List<Node> children) {
		return children.stream().map(c -> c.kind().wireName() + ":" + c.name()).toList();
	}

	/**
	 * Checks the invariants every parsed tree must satisfy:
	 * unique ids, parent ids matching the actual parent,
	 * array children named by position, and unique keys within objects.
	 */
	public static void assertWellFormed(Node root) {
		assertNull(root.parentId(), "root must have no parent");
		checkWellFormed(root, new HashSet<>(), 0);
	}

	private static void checkWellFormed(Node node, Set<NodeId> seen, int depth) {
		if (depth > 10_000) {
			fail("Tree is implausibly deep at " + node);
		}
		assertTrue(seen.add(node.id()), () -> "Duplicate id " + node.id());
		Set<String> keys = new HashSet<>();
		List<Node> children = node.children();
		for (int i = 0; i < children.size(); i++) {
			Node child = children.get(i);
			assertEquals(node.id(), child.parentId(), () -> "Wrong parent on " + child);
			if (node.kind() == NodeKind.ARRAY) {
				assertEquals(String.valueOf(i), child.name(), "array child name");
			}
			if (node.kind() == NodeKind.OBJECT) {
				assertTrue(keys.add(child.name()), () -> "Duplicate key \"" + child.name() + "\" in " + node);
			}
			checkWellFormed(child, seen, depth + 1);
		}
	}
}
