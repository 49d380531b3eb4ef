package works.arbor.exceptions;

import works.arbor.NodeId;
import works.arbor.NodeKind;

/**
 * A tree could not be written out. This always indicates a broken tree
 * (a cycle, an unsupported kind, or nesting past the configured limit)
 * rather than a problem with user input.
 */
public final class DocumentSerializationException extends ArborException {
	public DocumentSerializationException(String message) {
		super(message);
	}

	public static DocumentSerializationException cycle(NodeId id) {
		return new DocumentSerializationException("Circular reference detected at node " + id);
	}

	public static DocumentSerializationException unsupportedKind(String format, NodeKind kind) {
		return new DocumentSerializationException("Cannot serialize " + kind.wireName() + " node as " + format);
	}
}
