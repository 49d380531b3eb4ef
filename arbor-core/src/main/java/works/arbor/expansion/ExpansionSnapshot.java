package works.arbor.expansion;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A serializable copy of an {@link ExpansionState}.
 * <p>
 * When restoring, a null field leaves the corresponding setting unchanged,
 * so a snapshot written by an older version, or by hand, can omit fields.
 */
public record ExpansionSnapshot(
	@Nullable List<String> expanded,
	@Nullable List<String> collapsed,
	@Nullable Boolean defaultExpanded,
	@Nullable Integer maxDepth
) {
	public ExpansionSnapshot {
		expanded = (expanded == null) ? null : List.copyOf(expanded);
		collapsed = (collapsed == null) ? null : List.copyOf(collapsed);
	}

	public static ExpansionSnapshot ofExpanded(List<String> expanded) {
		return new ExpansionSnapshot(expanded, null, null, null);
	}
}
