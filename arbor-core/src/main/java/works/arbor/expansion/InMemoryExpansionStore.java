package works.arbor.expansion;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryExpansionStore implements ExpansionStore {
	private final Map<String, ExpansionSnapshot> snapshots = new ConcurrentHashMap<>();

	@Override
	public Optional<ExpansionSnapshot> load(String key) {
		return Optional.ofNullable(snapshots.get(key));
	}

	@Override
	public void save(String key, ExpansionSnapshot snapshot) {
		snapshots.put(key, snapshot);
	}

	@Override
	public void clear(String key) {
		snapshots.remove(key);
	}
}
