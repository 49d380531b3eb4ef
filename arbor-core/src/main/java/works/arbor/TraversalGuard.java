package works.arbor;

import java.util.HashSet;
import java.util.Set;
import works.arbor.exceptions.DocumentSerializationException;

/**
 * Tracks the nodes on the current recursion stack of one serialization pass.
 * <p>
 * Each recursive step calls {@link #enter} before descending into a node
 * and {@link #exit} afterward. Seeing a node that is already on the stack
 * means the tree has a cycle.
 */
public final class TraversalGuard {
	private final Set<NodeId> onStack = new HashSet<>();
	private final int maxDepth;

	public TraversalGuard(int maxDepth) {
		this.maxDepth = maxDepth;
	}

	/**
	 * @throws DocumentSerializationException if <code>node</code> is already being visited,
	 * or if the stack is already at the maximum depth
	 */
	public void enter(Node node) {
		if (!onStack.add(node.id())) {
			throw DocumentSerializationException.cycle(node.id());
		}
		if (onStack.size() > maxDepth) {
			onStack.remove(node.id());
			throw new DocumentSerializationException("Maximum depth " + maxDepth + " exceeded at node " + node.id());
		}
	}

	public void exit(Node node) {
		onStack.remove(node.id());
	}

	public int depth() {
		return onStack.size();
	}
}
