package works.arbor;

/**
 * Receives change notifications from a {@link DocumentModel}.
 * Every method has an empty default so implementations override only what they need.
 * <p>
 * Listeners run synchronously after the change is applied and after
 * {@link DocumentModel#sourceText()} has been regenerated.
 * An exception from a listener is logged and does not undo the change.
 */
public interface DocumentListener {
	default void loaded(Node root, String format) {}

	default void valueUpdated(Node node, Object oldValue) {}

	default void renamed(Node node, String oldName) {}

	default void childAdded(Node parent, Node child) {}

	default void childRemoved(Node parent, Node child, int index) {}

	default void moved(Node node, Node oldParent, Node newParent, int index) {}

	default void sourceUpdated(String sourceText) {}

	default void cleared() {}
}
