package works.arbor.exceptions;

public final class MalformedPathException extends ArborException {
	public MalformedPathException(String message) {
		super(message);
	}
}
