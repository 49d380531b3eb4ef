package works.arbor.bundle;

import works.arbor.HandlerRegistry;
import works.arbor.HandlerSettings;
import works.arbor.jackson.JsonHandler;
import works.arbor.markdown.MarkdownHandler;
import works.arbor.xml.XmlHandler;
import works.arbor.yaml.YamlHandler;

/**
 * Builds a {@link HandlerRegistry} holding the four formats shipped with arbor.
 * <p>
 * Formats are registered in the order json, xml, yaml, markdown,
 * which is the order {@link HandlerRegistry#supportedFormats()} reports them.
 */
public final class StandardFormats {
	private StandardFormats() {}

	public static HandlerRegistry newRegistry(HandlerSettings settings) {
		return new HandlerRegistry()
			.register(JsonHandler.FORMAT, () -> new JsonHandler(settings))
			.register(XmlHandler.FORMAT, () -> new XmlHandler(settings))
			.register(YamlHandler.FORMAT, () -> new YamlHandler(settings))
			.register(MarkdownHandler.FORMAT, () -> new MarkdownHandler(settings));
	}

	public static HandlerRegistry newRegistry() {
		return newRegistry(HandlerSettings.defaults());
	}
}
