package works.arbor.jackson;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.arbor.expansion.ExpansionSnapshot;
import works.arbor.expansion.ExpansionStore;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Keeps each {@link ExpansionSnapshot} as a JSON file named after its key
 * in a single directory.
 * <p>
 * Characters in the key other than letters, digits, <code>.</code>, <code>_</code>
 * and <code>-</code> are replaced by <code>_</code> in the file name,
 * so distinct keys may share a file if they differ only in such characters.
 */
public final class JsonFileExpansionStore implements ExpansionStore {
	private final Path directory;
	private final ObjectMapper mapper;

	public JsonFileExpansionStore(Path directory) {
		this.directory = requireNonNull(directory);
		this.mapper = JsonMapper.builder().build();
	}

	@Override
	public Optional<ExpansionSnapshot> load(String key) throws IOException {
		Path file = fileFor(key);
		String json;
		try {
			json = Files.readString(file, UTF_8);
		} catch (NoSuchFileException e) {
			LOGGER.debug("No saved expansion state at {}", file);
			return Optional.empty();
		}
		try {
			return Optional.of(mapper.readValue(json, ExpansionSnapshot.class));
		} catch (JacksonException e) {
			throw new IOException("Corrupt expansion state in " + file + ": " + e.getOriginalMessage(), e);
		}
	}

	@Override
	public void save(String key, ExpansionSnapshot snapshot) throws IOException {
		String json;
		try {
			json = mapper.writeValueAsString(snapshot);
		} catch (JacksonException e) {
			throw new IOException("Unable to encode expansion state for \"" + key + "\"", e);
		}
		Files.createDirectories(directory);
		Files.writeString(fileFor(key), json, UTF_8);
	}

	@Override
	public void clear(String key) throws IOException {
		Files.deleteIfExists(fileFor(key));
	}

	Path fileFor(String key) {
		if (key.isEmpty()) {
			throw new IllegalArgumentException("Key can't be empty");
		}
		return directory.resolve(key.replaceAll("[^A-Za-z0-9._-]", "_") + ".json");
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileExpansionStore.class);
}
