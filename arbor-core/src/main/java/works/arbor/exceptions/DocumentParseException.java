package works.arbor.exceptions;

/**
 * The text is not well-formed for the format that was asked to read it.
 * Callers may retry with different text or a different format.
 */
public final class DocumentParseException extends ArborException {
	public DocumentParseException(String message) {
		super(message);
	}

	public DocumentParseException(String message, Throwable cause) {
		super(message, cause);
	}

	public static DocumentParseException atLine(int lineNumber, String message) {
		return new DocumentParseException("Line " + lineNumber + ": " + message);
	}
}
