package works.arbor.expansion;

public interface ExpansionListener {
	default void expanded(String path) {}

	default void collapsed(String path) {}

	/**
	 * Called for every change, including bulk operations,
	 * after any {@link #expanded}/{@link #collapsed} call for the same change.
	 */
	default void changed(ExpansionChange change) {}
}
