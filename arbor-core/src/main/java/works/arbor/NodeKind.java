package works.arbor;

import java.util.Locale;

/**
 * The closed set of node shapes shared by every format.
 * <p>
 * Containers own ordered children; value carriers hold a single scalar
 * value. No kind is both.
 */
public enum NodeKind {
	OBJECT(true, false),
	ARRAY(true, false),
	SCALAR(false, true),
	ELEMENT(true, false),
	TEXT(false, true),
	CDATA(false, true),
	COMMENT(false, true),
	PROCESSING_INSTRUCTION(false, true),
	HEADING(true, false),
	CONTENT(false, true),
	DOCUMENT(true, false),
	;

	private final boolean container;
	private final boolean valueCarrier;

	NodeKind(boolean container, boolean valueCarrier) {
		this.container = container;
		this.valueCarrier = valueCarrier;
	}

	public boolean isContainer() {
		return container;
	}

	public boolean carriesValue() {
		return valueCarrier;
	}

	/**
	 * @return the lowercase name used in messages and exported trees, e.g. {@code processing_instruction}
	 */
	public String wireName() {
		return name().toLowerCase(Locale.ROOT);
	}
}
