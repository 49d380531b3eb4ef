package works.arbor.exceptions;

import works.arbor.NodeId;

/**
 * Thrown when a node would be moved underneath itself.
 */
public final class CircularMoveException extends ArborException {
	private final NodeId movingId;
	private final NodeId targetParentId;

	public CircularMoveException(NodeId movingId, NodeId targetParentId) {
		super("Cannot move node " + movingId + " into its own descendant " + targetParentId);
		this.movingId = movingId;
		this.targetParentId = targetParentId;
	}

	public NodeId movingId() {
		return movingId;
	}

	public NodeId targetParentId() {
		return targetParentId;
	}
}
