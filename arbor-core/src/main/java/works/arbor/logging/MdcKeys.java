package works.arbor.logging;

public final class MdcKeys {
	public static final String DOCUMENT_NAME = "arbor.document.name";
	public static final String DOCUMENT_INSTANCE_ID = "arbor.document.instanceID";
	public static final String OPERATION = "arbor.operation";

	private MdcKeys() {}
}
