package works.arbor.expansion;

import java.util.List;

public record ExpansionStats(
	int totalExpanded,
	List<String> expandedPaths,
	boolean defaultExpanded,
	int maxDepth,
	boolean hasPersistence
) { }
