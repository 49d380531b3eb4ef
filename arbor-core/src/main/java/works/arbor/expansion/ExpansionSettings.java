package works.arbor.expansion;

import java.util.List;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

@Value
@Builder(toBuilder = true)
public class ExpansionSettings {
	/**
	 * Whether a path that has never been expanded or collapsed counts as expanded.
	 */
	@Default boolean defaultExpanded = true;

	/**
	 * How deep {@link ExpansionState#expandAll} descends, counting the root as depth zero.
	 */
	@Default int maxDepth = 1000;

	@Default List<String> initialExpanded = List.of();

	/**
	 * When set along with {@link #store}, every change is saved under this key,
	 * and construction restores whatever was saved there.
	 */
	@Nullable String persistKey;

	@Nullable ExpansionStore store;

	public static ExpansionSettings defaults() {
		return ExpansionSettings.builder().build();
	}
}
