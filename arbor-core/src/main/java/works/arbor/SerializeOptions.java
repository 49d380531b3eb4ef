package works.arbor;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

@Value
@Builder(toBuilder = true)
public class SerializeOptions {
	/**
	 * The string used for one level of indentation.
	 * When null, each handler picks its own default.
	 */
	@Nullable String indent;

	/**
	 * Suppresses all layout whitespace, for handlers that support it.
	 */
	@Default boolean compact = false;

	public static SerializeOptions defaults() {
		return DEFAULTS;
	}

	public static SerializeOptions withIndent(String indent) {
		return SerializeOptions.builder().indent(indent).build();
	}

	private static final SerializeOptions DEFAULTS = SerializeOptions.builder().build();
}
