package works.arbor.exceptions;

/**
 * Base of the exceptions thrown by handlers and the document model.
 */
public abstract sealed class ArborException extends RuntimeException permits
	CircularMoveException,
	DocumentParseException,
	DocumentSerializationException,
	MalformedPathException,
	NodeNotFoundException,
	UnknownFormatException
{
	ArborException(String message) {
		super(message);
	}

	ArborException(String message, Throwable cause) {
		super(message, cause);
	}
}
