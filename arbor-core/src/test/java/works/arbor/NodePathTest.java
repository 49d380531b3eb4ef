package works.arbor;

import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import works.arbor.exceptions.MalformedPathException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodePathTest {

	@Test
	void emptyAndDot_areRoot() {
		assertSame(NodePath.ROOT, NodePath.parse(""));
		assertSame(NodePath.ROOT, NodePath.parse("."));
		assertEquals("", NodePath.ROOT.toString());
	}

	@Test
	void parse_splitsOnDots() {
		NodePath path = NodePath.parse("a.b.2");
		assertEquals(List.of("a", "b", "2"), path.segments());
		assertEquals(3, path.length());
		assertEquals("2", path.lastSegment());
		assertEquals(NodePath.of("a", "b"), path.parent());
	}

	@ParameterizedTest
	@MethodSource("malformedPaths")
	void malformedPath_throws(String path) {
		assertThrows(MalformedPathException.class, () -> NodePath.parse(path));
		assertTrue(NodePath.tryParse(path).isEmpty());
	}

	static Stream<String> malformedPaths() {
		return Stream.of("a..b", ".a", "a.", "..");
	}

	@Test
	void prefixes_shortestFirst() {
		assertEquals(
			List.of(NodePath.of("a"), NodePath.of("a", "b"), NodePath.of("a", "b", "c")),
			NodePath.parse("a.b.c").prefixes());
		assertTrue(NodePath.ROOT.prefixes().isEmpty());
	}

	@Test
	void isPrefixOf_matchesWholeSegments() {
		assertTrue(NodePath.parse("a").isPrefixOf(NodePath.parse("a.b")));
		assertTrue(NodePath.parse("a.b").isPrefixOf(NodePath.parse("a.b")));
		assertFalse(NodePath.parse("a").isPrefixOf(NodePath.parse("ab.c")));
		assertTrue(NodePath.ROOT.isPrefixOf(NodePath.parse("x")));
	}

	@Test
	void then_rejectsDots() {
		assertThrows(MalformedPathException.class, () -> NodePath.ROOT.then("a.b"));
	}

	@Test
	void root_hasNoParent() {
		assertThrows(IllegalStateException.class, NodePath.ROOT::parent);
	}
}
