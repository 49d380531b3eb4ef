package works.arbor;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class HandlerSettings {
	/**
	 * Parsing and serialization fail once the tree nests deeper than this.
	 * Every traversal is recursive, so this also bounds stack usage.
	 */
	@Default int maxDepth = 1000;

	/**
	 * Indent width in spaces for handlers whose output is indented by default
	 * and which have no better information from the document itself.
	 */
	@Default int indentSize = 2;

	public static HandlerSettings defaults() {
		return DEFAULTS;
	}

	private static final HandlerSettings DEFAULTS = HandlerSettings.builder().build();
}
