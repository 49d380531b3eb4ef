package works.arbor.markdown;

import java.util.stream.Stream;
import works.arbor.FormatHandler;
import works.arbor.HandlerSettings;
import works.arbor.Node;
import works.arbor.testing.FormatHandlerConformanceTest;

class MarkdownHandlerConformanceTest extends FormatHandlerConformanceTest {
	@Override
	protected FormatHandler newHandler(HandlerSettings settings) {
		return new MarkdownHandler(settings);
	}

	@Override
	protected Stream<String> sampleDocuments() {
		return Stream.of(
			"",
			"# T\ncontent\n## S\nmore",
			"plain paragraph only\nsecond line",
			"# A\n## B\n### C\n## D\n# E",
			"Title\n=====\n\nintro\n\nSub\n---\n\n- one\n- two",
			"# Code\n```java\nint x = 1;\n# not a heading\n```",
			"# Quote\n> quoted line\n>\n> after a gap",
			"## Starts deep\ntext\n# Shallower",
			"# Closing hashes ##\nbody",
			"# Mixed\nSome text\n```\ncode\n```\nmore text",
			"####### seven hashes is text\n1. first\n2. second",
			"# Windows\r\nline endings\r\n"
		);
	}

	@Override
	protected Stream<String> malformedDocuments() {
		return Stream.empty();
	}

	@Override
	protected Node container(String name) {
		return Node.heading(name, 1);
	}
}
