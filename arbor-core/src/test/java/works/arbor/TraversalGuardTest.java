package works.arbor;

import org.junit.jupiter.api.Test;
import works.arbor.exceptions.DocumentSerializationException;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TraversalGuardTest {

	@Test
	void revisit_throws() {
		TraversalGuard guard = new TraversalGuard(10);
		Node node = Node.object("a");
		guard.enter(node);
		DocumentSerializationException e = assertThrows(DocumentSerializationException.class, () -> guard.enter(node));
		assertThat(e.getMessage(), containsString("Circular"));
	}

	@Test
	void exit_allowsSiblingRevisit() {
		TraversalGuard guard = new TraversalGuard(10);
		Node node = Node.object("a");
		guard.enter(node);
		guard.exit(node);
		guard.enter(node);
		assertEquals(1, guard.depth());
	}

	@Test
	void tooDeep_throws() {
		TraversalGuard guard = new TraversalGuard(2);
		guard.enter(Node.object("1"));
		guard.enter(Node.object("2"));
		assertThrows(DocumentSerializationException.class, () -> guard.enter(Node.object("3")));
		assertEquals(2, guard.depth());
	}
}
