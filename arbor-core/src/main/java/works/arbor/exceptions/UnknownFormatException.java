package works.arbor.exceptions;

public final class UnknownFormatException extends ArborException {
	private final String format;

	public UnknownFormatException(String format) {
		super("No handler registered for format: " + format);
		this.format = format;
	}

	public String format() {
		return format;
	}
}
