package works.arbor.expansion;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.arbor.Node;
import works.arbor.NodePath;
import works.arbor.expansion.ExpansionChange.Action;

import static java.util.Objects.requireNonNull;
import static works.arbor.expansion.ExpansionChange.Action.COLLAPSE;
import static works.arbor.expansion.ExpansionChange.Action.COLLAPSE_ALL;
import static works.arbor.expansion.ExpansionChange.Action.EXPAND;
import static works.arbor.expansion.ExpansionChange.Action.EXPAND_ALL;
import static works.arbor.expansion.ExpansionChange.Action.EXPAND_PATH;
import static works.arbor.expansion.ExpansionChange.Action.RESET;
import static works.arbor.expansion.ExpansionChange.Action.RESTORE;
import static works.arbor.expansion.ExpansionChange.Action.SET_PATHS;

/**
 * Remembers which nodes of a tree are expanded, keyed by {@link NodePath} strings
 * rather than by node, so the state survives reloading the document.
 * <p>
 * A path is expanded if it was explicitly expanded, collapsed if it was
 * explicitly collapsed, and otherwise follows the baseline
 * {@link ExpansionSettings#defaultExpanded()}. The root (empty path)
 * always follows the baseline.
 * <p>
 * Not thread-safe.
 */
public final class ExpansionState {
	private final ExpansionSettings settings;
	private final Set<String> expanded = new LinkedHashSet<>();
	private final Set<String> collapsed = new LinkedHashSet<>();
	private final List<ExpansionListener> listeners = new ArrayList<>();
	private boolean defaultExpanded;
	private int maxDepth;

	public ExpansionState(ExpansionSettings settings) {
		this.settings = requireNonNull(settings);
		this.defaultExpanded = settings.defaultExpanded();
		this.maxDepth = settings.maxDepth();
		this.expanded.addAll(settings.initialExpanded());
		if (hasPersistence()) {
			loadPersistedState();
		}
	}

	public ExpansionState() {
		this(ExpansionSettings.defaults());
	}

	public boolean isExpanded(String path) {
		if (path.isEmpty()) {
			return defaultExpanded;
		} else if (expanded.contains(path)) {
			return true;
		} else if (collapsed.contains(path)) {
			return false;
		} else {
			return defaultExpanded;
		}
	}

	public boolean isDefaultExpanded() {
		return defaultExpanded;
	}

	public int maxDepth() {
		return maxDepth;
	}

	public void expand(String path) {
		if (path.isEmpty()) {
			return;
		}
		boolean changed = expanded.add(path) | collapsed.remove(path);
		if (changed) {
			LOGGER.trace("Expanded \"{}\"", path);
			notifyListeners(l -> l.expanded(path));
			notifyListeners(l -> l.changed(ExpansionChange.of(EXPAND, path)));
			persistState();
		}
	}

	/**
	 * Collapses <code>path</code> and forgets any explicit expansion of its descendants.
	 */
	public void collapse(String path) {
		if (path.isEmpty()) {
			return;
		}
		boolean changed = expanded.remove(path);
		if (defaultExpanded) {
			changed |= collapsed.add(path);
		}
		String prefix = path + ".";
		changed |= expanded.removeIf(p -> p.startsWith(prefix));
		if (changed) {
			LOGGER.trace("Collapsed \"{}\"", path);
			notifyListeners(l -> l.collapsed(path));
			notifyListeners(l -> l.changed(ExpansionChange.of(COLLAPSE, path)));
			persistState();
		}
	}

	/**
	 * @return the new state of <code>path</code>
	 */
	public boolean toggle(String path) {
		if (isExpanded(path)) {
			collapse(path);
			return false;
		} else {
			expand(path);
			return true;
		}
	}

	/**
	 * Expands every node under <code>root</code> that has children,
	 * down to {@link #maxDepth()} levels below the root.
	 */
	public void expandAll(Node root) {
		List<String> paths = new ArrayList<>();
		collectPaths(root, "", 0, maxDepth, paths);
		for (String path : paths) {
			expanded.add(path);
			collapsed.remove(path);
		}
		LOGGER.debug("Expanded {} paths", paths.size());
		notifyListeners(l -> l.changed(ExpansionChange.of(EXPAND_ALL)));
		persistState();
	}

	/**
	 * Forgets every explicit expansion and collapse, and makes collapsed the baseline.
	 */
	public void collapseAll() {
		clearToCollapsed();
		notifyListeners(l -> l.changed(ExpansionChange.of(COLLAPSE_ALL)));
		persistState();
	}

	private void clearToCollapsed() {
		expanded.clear();
		collapsed.clear();
		defaultExpanded = false;
	}

	/**
	 * Expands <code>path</code> and each of its ancestors, so that the node it names is visible.
	 */
	public void expandPath(String path) {
		if (path.isEmpty()) {
			return;
		}
		for (NodePath prefix : NodePath.parse(path).prefixes()) {
			String p = prefix.toString();
			expanded.add(p);
			collapsed.remove(p);
		}
		notifyListeners(l -> l.changed(ExpansionChange.of(EXPAND_PATH, path)));
		persistState();
	}

	/**
	 * Collapses everything, then expands each node with children whose path
	 * has at most <code>depth</code> segments. A negative depth does nothing.
	 */
	public void expandToDepth(Node root, int depth) {
		if (depth < 0) {
			return;
		}
		clearToCollapsed();
		List<String> paths = new ArrayList<>();
		collectPaths(root, "", 0, Math.min(depth + 1, maxDepth), paths);
		expanded.addAll(paths);
		notifyListeners(l -> l.changed(new ExpansionChange(Action.EXPAND_TO_DEPTH, null, depth)));
		persistState();
	}

	private static void collectPaths(Node node, String nodePath, int depth, int depthLimit, List<String> out) {
		if (depth >= depthLimit || !node.hasChildren()) {
			return;
		}
		if (depth > 0) {
			out.add(nodePath);
		}
		for (Node child : node.children()) {
			String childPath = nodePath.isEmpty()
				? child.pathSegment()
				: nodePath + "." + child.pathSegment();
			collectPaths(child, childPath, depth + 1, depthLimit, out);
		}
	}

	/**
	 * @return explicitly expanded paths, in the order they were expanded
	 */
	public List<String> expandedPaths() {
		return List.copyOf(expanded);
	}

	public void setExpandedPaths(Collection<String> paths) {
		expanded.clear();
		expanded.addAll(paths);
		collapsed.removeAll(expanded);
		notifyListeners(l -> l.changed(ExpansionChange.of(SET_PATHS)));
		persistState();
	}

	public ExpansionSnapshot saveState() {
		return new ExpansionSnapshot(
			List.copyOf(expanded),
			List.copyOf(collapsed),
			defaultExpanded,
			maxDepth);
	}

	/**
	 * Replaces the current state with the non-null fields of <code>snapshot</code>.
	 */
	public void restoreState(ExpansionSnapshot snapshot) {
		if (snapshot.expanded() != null) {
			expanded.clear();
			expanded.addAll(snapshot.expanded());
		}
		if (snapshot.collapsed() != null) {
			collapsed.clear();
			collapsed.addAll(snapshot.collapsed());
		}
		if (snapshot.defaultExpanded() != null) {
			defaultExpanded = snapshot.defaultExpanded();
		}
		if (snapshot.maxDepth() != null) {
			maxDepth = snapshot.maxDepth();
		}
		notifyListeners(l -> l.changed(ExpansionChange.of(RESTORE)));
	}

	/**
	 * Returns to the state described by the settings this was created with.
	 */
	public void reset() {
		expanded.clear();
		collapsed.clear();
		expanded.addAll(settings.initialExpanded());
		defaultExpanded = settings.defaultExpanded();
		maxDepth = settings.maxDepth();
		notifyListeners(l -> l.changed(ExpansionChange.of(RESET)));
		persistState();
	}

	public ExpansionStats stats() {
		return new ExpansionStats(expanded.size(), expandedPaths(), defaultExpanded, maxDepth, hasPersistence());
	}

	public void addListener(ExpansionListener listener) {
		listeners.add(requireNonNull(listener));
	}

	public void removeListener(ExpansionListener listener) {
		listeners.remove(listener);
	}

	private void notifyListeners(Consumer<ExpansionListener> action) {
		for (ExpansionListener listener : List.copyOf(listeners)) {
			try {
				action.accept(listener);
			} catch (RuntimeException e) {
				LOGGER.error("Expansion listener {} failed", listener, e);
			}
		}
	}

	private boolean hasPersistence() {
		return settings.persistKey() != null && settings.store() != null;
	}

	private void persistState() {
		if (!hasPersistence()) {
			return;
		}
		try {
			settings.store().save(settings.persistKey(), saveState());
		} catch (IOException e) {
			LOGGER.warn("Failed to persist expansion state under \"{}\"", settings.persistKey(), e);
		}
	}

	private void loadPersistedState() {
		Optional<ExpansionSnapshot> stored;
		try {
			stored = settings.store().load(settings.persistKey());
		} catch (IOException e) {
			LOGGER.warn("Failed to load expansion state from \"{}\"", settings.persistKey(), e);
			return;
		}
		stored.ifPresent(this::restoreState);
	}

	public void clearPersistedState() {
		if (!hasPersistence()) {
			return;
		}
		try {
			settings.store().clear(settings.persistKey());
		} catch (IOException e) {
			LOGGER.warn("Failed to clear expansion state under \"{}\"", settings.persistKey(), e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ExpansionState.class);
}
