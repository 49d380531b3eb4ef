package works.arbor.expansion;

import java.io.IOException;
import java.util.Optional;

/**
 * Somewhere to keep {@link ExpansionSnapshot snapshots} between sessions, keyed by a caller-chosen string.
 */
public interface ExpansionStore {
	Optional<ExpansionSnapshot> load(String key) throws IOException;

	void save(String key, ExpansionSnapshot snapshot) throws IOException;

	void clear(String key) throws IOException;
}
