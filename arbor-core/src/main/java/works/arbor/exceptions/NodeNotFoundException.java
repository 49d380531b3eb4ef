package works.arbor.exceptions;

public final class NodeNotFoundException extends ArborException {
	private final String idOrPath;

	public NodeNotFoundException(String idOrPath) {
		super("Node not found: \"" + idOrPath + "\"");
		this.idOrPath = idOrPath;
	}

	public String idOrPath() {
		return idOrPath;
	}
}
