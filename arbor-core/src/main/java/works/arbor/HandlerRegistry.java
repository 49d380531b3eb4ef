package works.arbor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.arbor.exceptions.UnknownFormatException;

import static java.util.Objects.requireNonNull;

/**
 * Maps format names to {@link FormatHandler} factories.
 * <p>
 * There is no global instance. Build one at startup and pass it to each
 * {@link DocumentModel}. Names are case-insensitive.
 */
public final class HandlerRegistry {
	private final Map<String, Supplier<? extends FormatHandler>> factories = new LinkedHashMap<>();

	/**
	 * Registering the same name again replaces the earlier factory,
	 * keeping its original position in {@link #supportedFormats()}.
	 */
	public HandlerRegistry register(String format, Supplier<? extends FormatHandler> factory) {
		String key = normalize(format);
		if (key.isEmpty()) {
			throw new IllegalArgumentException("Format name can't be empty");
		}
		Supplier<? extends FormatHandler> old = factories.put(key, requireNonNull(factory));
		if (old != null) {
			LOGGER.debug("Replaced handler factory for format \"{}\"", key);
		}
		return this;
	}

	/**
	 * @return a new handler for <code>format</code>
	 * @throws UnknownFormatException if nothing is registered under that name
	 */
	public FormatHandler resolve(String format) {
		Supplier<? extends FormatHandler> factory = factories.get(normalize(format));
		if (factory == null) {
			throw new UnknownFormatException(format);
		}
		return factory.get();
	}

	public boolean isRegistered(String format) {
		return factories.containsKey(normalize(format));
	}

	/**
	 * @return registered names, in registration order
	 */
	public List<String> supportedFormats() {
		return List.copyOf(new ArrayList<>(factories.keySet()));
	}

	private static String normalize(String format) {
		return requireNonNull(format).trim().toLowerCase(Locale.ROOT);
	}

	@Override
	public String toString() {
		return "HandlerRegistry" + factories.keySet();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(HandlerRegistry.class);
}
