package works.arbor;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NodeIdTest {

	@Test
	void validString_survivesRoundTrip() {
		assertEquals("node-1", NodeId.from("node-1").toString());
	}

	@Test
	void emptyString_throws() {
		assertThrows(IllegalArgumentException.class, () -> NodeId.from(""));
	}

	@Test
	void sameValue_equal() {
		assertEquals(NodeId.from("x"), NodeId.from("x"));
		assertEquals(NodeId.from("x").hashCode(), NodeId.from("x").hashCode());
	}

	@Test
	void unique_neverRepeats() {
		assertNotEquals(NodeId.unique("n"), NodeId.unique("n"));
	}
}
