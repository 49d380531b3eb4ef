package works.arbor.expansion;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.arbor.Node;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.arbor.expansion.ExpansionChange.Action.COLLAPSE;
import static works.arbor.expansion.ExpansionChange.Action.EXPAND;

class ExpansionStateTest {
	Node root;

	/**
	 * <pre>
	 * (root)
	 *   a
	 *     b
	 *       c = 1
	 *     leaf = 2
	 *   list
	 *     0 = x
	 *   empty
	 * </pre>
	 */
	@BeforeEach
	void buildTree() {
		root = Node.object("");
		Node a = Node.object("a");
		Node b = Node.object("b");
		b.appendChild(Node.scalar("c", 1L));
		a.appendChild(b);
		a.appendChild(Node.scalar("leaf", 2L));
		Node list = Node.array("list");
		list.appendChild(Node.scalar("0", "x"));
		root.appendChild(a);
		root.appendChild(list);
		root.appendChild(Node.object("empty"));
	}

	@Test
	void unknownPath_followsBaseline() {
		assertTrue(new ExpansionState().isExpanded("anything"));
		ExpansionState collapsedByDefault = new ExpansionState(ExpansionSettings.builder().defaultExpanded(false).build());
		assertFalse(collapsedByDefault.isExpanded("anything"));
		assertFalse(collapsedByDefault.isExpanded(""));
	}

	@Test
	void collapseThenExpandAll_expandsAgain() {
		ExpansionState state = new ExpansionState();
		state.collapse("a");
		assertFalse(state.isExpanded("a"));
		state.expandAll(root);
		assertTrue(state.isExpanded("a"));
	}

	@Test
	void collapseAllThenExpandAll_expandsEveryPathWithChildren() {
		ExpansionState state = new ExpansionState();
		state.collapseAll();
		assertFalse(state.isExpanded("a"));
		state.expandAll(root);
		for (String path : List.of("a", "a.b", "list")) {
			assertTrue(state.isExpanded(path), path);
		}
		assertFalse(state.isExpanded("empty"));
		assertFalse(state.isExpanded("a.leaf"));
		assertEquals(List.of("a", "a.b", "list"), state.expandedPaths());
	}

	@Test
	void expandAll_dottedName_doesNotCollideWithNesting() {
		Node dotted = Node.object("a.b");
		Node inner = Node.object("c");
		inner.appendChild(Node.scalar("d", 3L));
		dotted.appendChild(inner);
		root.appendChild(dotted);

		ExpansionState state = new ExpansionState();
		state.collapseAll();
		state.expandAll(root);

		assertTrue(state.isExpanded(dotted.id() + ".c"));
		assertFalse(state.isExpanded("a.b.c"));
	}

	@Test
	void expandAll_respectsMaxDepth() {
		ExpansionState state = new ExpansionState(ExpansionSettings.builder().defaultExpanded(false).maxDepth(2).build());
		state.expandAll(root);
		assertTrue(state.isExpanded("a"));
		assertFalse(state.isExpanded("a.b"));
	}

	@Test
	void collapse_forgetsExpandedDescendants() {
		ExpansionState state = new ExpansionState(ExpansionSettings.builder().defaultExpanded(false).build());
		state.expandPath("a.b");
		assertTrue(state.isExpanded("a"));
		assertTrue(state.isExpanded("a.b"));
		state.collapse("a");
		state.expand("a");
		assertFalse(state.isExpanded("a.b"));
	}

	@Test
	void expandPath_expandsAncestors() {
		ExpansionState state = new ExpansionState();
		state.collapseAll();
		state.expandPath("a.b.c");
		assertEquals(List.of("a", "a.b", "a.b.c"), state.expandedPaths());
	}

	@Test
	void expandToDepth_expandsShallowNodesOnly() {
		ExpansionState state = new ExpansionState();
		state.expandToDepth(root, 1);
		assertTrue(state.isExpanded("a"));
		assertTrue(state.isExpanded("list"));
		assertFalse(state.isExpanded("a.b"));
		assertFalse(state.isDefaultExpanded());
	}

	@Test
	void expandToDepth_zero_collapsesEverything() {
		ExpansionState state = new ExpansionState();
		state.expandToDepth(root, 0);
		assertTrue(state.expandedPaths().isEmpty());
		assertFalse(state.isExpanded("a"));
	}

	@Test
	void expandAndCollapse_areIdempotent() {
		List<ExpansionChange> changes = new ArrayList<>();
		List<String> direct = new ArrayList<>();
		ExpansionState state = new ExpansionState(ExpansionSettings.builder().defaultExpanded(false).build());
		state.addListener(new ExpansionListener() {
			@Override
			public void expanded(String path) {
				direct.add("+" + path);
			}

			@Override
			public void collapsed(String path) {
				direct.add("-" + path);
			}

			@Override
			public void changed(ExpansionChange change) {
				changes.add(change);
			}
		});
		state.expand("a");
		state.expand("a");
		state.collapse("a");
		state.collapse("a");
		assertEquals(List.of("+a", "-a"), direct);
		assertEquals(List.of(ExpansionChange.of(EXPAND, "a"), ExpansionChange.of(COLLAPSE, "a")), changes);
	}

	@Test
	void toggle_flips() {
		ExpansionState state = new ExpansionState();
		assertFalse(state.toggle("a"));
		assertFalse(state.isExpanded("a"));
		assertTrue(state.toggle("a"));
		assertTrue(state.isExpanded("a"));
	}

	@Test
	void failingListener_doesNotStopOthers() {
		List<String> seen = new ArrayList<>();
		ExpansionState state = new ExpansionState(ExpansionSettings.builder().defaultExpanded(false).build());
		state.addListener(new ExpansionListener() {
			@Override
			public void expanded(String path) {
				throw new IllegalStateException("listener failure is only logged");
			}
		});
		state.addListener(new ExpansionListener() {
			@Override
			public void expanded(String path) {
				seen.add(path);
			}
		});
		state.expand("a");
		assertEquals(List.of("a"), seen);
	}

	@Test
	void saveAndRestore_roundTrip() {
		ExpansionState original = new ExpansionState();
		original.expand("a");
		original.collapse("list");
		ExpansionSnapshot snapshot = original.saveState();

		ExpansionState restored = new ExpansionState(ExpansionSettings.builder().defaultExpanded(false).maxDepth(5).build());
		restored.restoreState(snapshot);
		assertTrue(restored.isExpanded("a"));
		assertFalse(restored.isExpanded("list"));
		assertTrue(restored.isExpanded("unmentioned"));
		assertEquals(1000, restored.maxDepth());
	}

	@Test
	void restore_nullFieldsKeepCurrentValues() {
		ExpansionState state = new ExpansionState(ExpansionSettings.builder().maxDepth(7).build());
		state.collapse("x");
		state.restoreState(ExpansionSnapshot.ofExpanded(List.of("a")));
		assertEquals(7, state.maxDepth());
		assertTrue(state.isDefaultExpanded());
		assertFalse(state.isExpanded("x"));
		assertEquals(List.of("a"), state.expandedPaths());
	}

	@Test
	void reset_returnsToSettings() {
		ExpansionState state = new ExpansionState(ExpansionSettings.builder().initialExpanded(List.of("a")).build());
		state.collapseAll();
		state.reset();
		assertTrue(state.isDefaultExpanded());
		assertEquals(List.of("a"), state.expandedPaths());
	}

	@Test
	void persistKey_savesAndRestoresThroughStore() {
		InMemoryExpansionStore store = new InMemoryExpansionStore();
		ExpansionSettings settings = ExpansionSettings.builder()
			.defaultExpanded(false)
			.persistKey("doc")
			.store(store)
			.build();
		ExpansionState first = new ExpansionState(settings);
		first.expand("a");
		assertTrue(first.stats().hasPersistence());

		ExpansionState second = new ExpansionState(settings);
		assertTrue(second.isExpanded("a"));

		second.clearPersistedState();
		assertTrue(store.load("doc").isEmpty());
	}

	@Test
	void storeFailure_isLoggedNotThrown() {
		ExpansionStore brokenStore = new ExpansionStore() {
			@Override
			public Optional<ExpansionSnapshot> load(String key) throws IOException {
				throw new IOException("store failure is only logged");
			}

			@Override
			public void save(String key, ExpansionSnapshot snapshot) throws IOException {
				throw new IOException("store failure is only logged");
			}

			@Override
			public void clear(String key) throws IOException {
				throw new IOException("store failure is only logged");
			}
		};
		ExpansionState state = new ExpansionState(ExpansionSettings.builder()
			.persistKey("doc")
			.store(brokenStore)
			.build());
		state.collapse("a");
		assertFalse(state.isExpanded("a"));
	}
}
