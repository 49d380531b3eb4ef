package works.arbor;

import works.arbor.exceptions.DocumentParseException;
import works.arbor.exceptions.DocumentSerializationException;

/**
 * Converts between one textual format and the {@link Node} tree.
 * <p>
 * Handlers are not thread-safe and are cheap to create;
 * {@link HandlerRegistry#resolve} returns a new one on each call.
 */
public interface FormatHandler {
	/**
	 * @return the lowercase name under which this handler is normally registered
	 */
	String formatName();

	/**
	 * @return the root of a new tree; array children are named by their index
	 * @throws DocumentParseException if <code>text</code> is not valid for this format
	 */
	Node parse(String text);

	/**
	 * @throws DocumentSerializationException if the tree contains a cycle,
	 * a kind this format can't express, or is nested too deeply
	 */
	String serialize(Node root, SerializeOptions options);

	default String serialize(Node root) {
		return serialize(root, SerializeOptions.defaults());
	}

	/**
	 * A cheap heuristic. False positives are possible; a true result
	 * does not guarantee that {@link #parse} will succeed.
	 */
	boolean detect(String text);

	EditableFields editableFields();

	/**
	 * Like {@link #parse}, but reports problems instead of throwing.
	 */
	default ValidationResult validate(String text) {
		try {
			parse(text);
			return ValidationResult.ok();
		} catch (DocumentParseException e) {
			return ValidationResult.failed(e.getMessage());
		}
	}
}
