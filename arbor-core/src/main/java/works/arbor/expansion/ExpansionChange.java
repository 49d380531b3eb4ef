package works.arbor.expansion;

import org.jetbrains.annotations.Nullable;

/**
 * Describes one change reported to {@link ExpansionListener#changed}.
 *
 * @param path the affected path, or null for bulk actions
 * @param depth only meaningful for {@link Action#EXPAND_TO_DEPTH}
 */
public record ExpansionChange(Action action, @Nullable String path, int depth) {
	public enum Action {
		EXPAND,
		COLLAPSE,
		EXPAND_ALL,
		COLLAPSE_ALL,
		EXPAND_PATH,
		EXPAND_TO_DEPTH,
		SET_PATHS,
		RESTORE,
		RESET,
	}

	public static ExpansionChange of(Action action) {
		return new ExpansionChange(action, null, -1);
	}

	public static ExpansionChange of(Action action, String path) {
		return new ExpansionChange(action, path, -1);
	}
}
