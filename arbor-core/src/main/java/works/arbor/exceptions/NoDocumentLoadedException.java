package works.arbor.exceptions;

public class NoDocumentLoadedException extends IllegalStateException {
	public NoDocumentLoadedException(String s) {
		super(s);
	}
}
