package works.arbor;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.arbor.exceptions.UnknownFormatException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HandlerRegistryTest {

	@Test
	void resolve_isCaseInsensitive() {
		HandlerRegistry registry = new HandlerRegistry().register("kv", KeyValueHandler::new);
		assertInstanceOf(KeyValueHandler.class, registry.resolve("KV"));
		assertTrue(registry.isRegistered(" Kv "));
	}

	@Test
	void resolve_returnsNewInstanceEachTime() {
		HandlerRegistry registry = new HandlerRegistry().register("kv", KeyValueHandler::new);
		assertNotSame(registry.resolve("kv"), registry.resolve("kv"));
	}

	@Test
	void unknownFormat_throws() {
		HandlerRegistry registry = new HandlerRegistry();
		UnknownFormatException e = assertThrows(UnknownFormatException.class, () -> registry.resolve("toml"));
		assertEquals("toml", e.format());
		assertFalse(registry.isRegistered("toml"));
	}

	@Test
	void supportedFormats_inRegistrationOrder() {
		HandlerRegistry registry = new HandlerRegistry()
			.register("b", KeyValueHandler::new)
			.register("a", KeyValueHandler::new)
			.register("B", KeyValueHandler::new);
		assertEquals(List.of("b", "a"), registry.supportedFormats());
	}

	@Test
	void emptyName_throws() {
		assertThrows(IllegalArgumentException.class, () -> new HandlerRegistry().register(" ", KeyValueHandler::new));
	}
}
