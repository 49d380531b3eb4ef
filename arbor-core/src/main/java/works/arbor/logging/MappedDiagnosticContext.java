package works.arbor.logging;

import org.slf4j.MDC;

import static works.arbor.logging.MdcKeys.DOCUMENT_INSTANCE_ID;
import static works.arbor.logging.MdcKeys.DOCUMENT_NAME;
import static works.arbor.logging.MdcKeys.OPERATION;

/**
 * Sets and restores the MDC entries that tie a log line to one document.
 * <p>
 * Usage:
 * <pre>
 * try (MDCScope ignored = setupMDC(name, instanceID, "move")) {
 *     ...
 * }
 * </pre>
 * Scopes nest: closing one restores whatever the enclosing scope had set.
 */
public final class MappedDiagnosticContext {
	private MappedDiagnosticContext() {}

	public static MDCScope setupMDC(String documentName, String instanceID) {
		return setupMDC(documentName, instanceID, null);
	}

	public static MDCScope setupMDC(String documentName, String instanceID, String operation) {
		MDCScope result = new MDCScope();
		put(DOCUMENT_NAME, documentName);
		put(DOCUMENT_INSTANCE_ID, instanceID);
		put(OPERATION, operation);
		return result;
	}

	private static void put(String key, String value) {
		if (value == null) {
			MDC.remove(key);
		} else {
			MDC.put(key, value);
		}
	}

	public static final class MDCScope implements AutoCloseable {
		private final String oldName = MDC.get(DOCUMENT_NAME);
		private final String oldInstanceID = MDC.get(DOCUMENT_INSTANCE_ID);
		private final String oldOperation = MDC.get(OPERATION);

		private MDCScope() {}

		@Override
		public void close() {
			put(DOCUMENT_NAME, oldName);
			put(DOCUMENT_INSTANCE_ID, oldInstanceID);
			put(OPERATION, oldOperation);
		}
	}
}
