package works.arbor.jackson;

import java.util.stream.Stream;
import works.arbor.FormatHandler;
import works.arbor.HandlerSettings;
import works.arbor.Node;
import works.arbor.testing.FormatHandlerConformanceTest;

class JsonHandlerConformanceTest extends FormatHandlerConformanceTest {
	@Override
	protected FormatHandler newHandler(HandlerSettings settings) {
		return new JsonHandler(settings);
	}

	@Override
	protected Stream<String> sampleDocuments() {
		return Stream.of(
			"{}",
			"[]",
			"42",
			"\"just a string\"",
			"null",
			"{\"a\":1,\"b\":[1,2,3]}",
			"{\"nested\": {\"deeper\": {\"deepest\": [true, false, null]}}}",
			"[{\"name\": \"x\", \"tags\": []}, {\"name\": \"y\", \"tags\": [\"t\"]}]",
			"{\"unicode\": \"caf\\u00e9 \\ud83c\\udf33\", \"escapes\": \"tab\\tquote\\\"slash\\\\\"}",
			"{\"numbers\": [0, -1, 1.5, 1e-7, 2.5e300, 12345678901234567890123]}",
			"{\"whole\": 3.0}"
		);
	}

	@Override
	protected Stream<String> malformedDocuments() {
		return Stream.of(
			"",
			"   ",
			"{",
			"{\"a\": }",
			"[1, 2,]",
			"{\"a\": 1} trailing",
			"{'single': 1}"
		);
	}

	@Override
	protected Node container(String name) {
		return Node.object(name);
	}
}
