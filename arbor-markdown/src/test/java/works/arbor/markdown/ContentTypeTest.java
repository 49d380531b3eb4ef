package works.arbor.markdown;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ContentTypeTest {

	@Test
	void classify_prefersCodeThenQuoteThenList() {
		assertEquals(ContentType.CODE, ContentType.classify("> quoted\n```\ncode\n```"));
		assertEquals(ContentType.BLOCKQUOTE, ContentType.classify("- item\n> quoted"));
		assertEquals(ContentType.LIST, ContentType.classify("intro\n- item"));
		assertEquals(ContentType.LIST, ContentType.classify("  12. numbered"));
		assertEquals(ContentType.PARAGRAPH, ContentType.classify("just words -not a list"));
	}

	@Test
	void fromWireName_defaultsToParagraph() {
		assertEquals(ContentType.CODE, ContentType.fromWireName("code"));
		assertEquals(ContentType.PARAGRAPH, ContentType.fromWireName("unknown"));
		assertEquals(ContentType.PARAGRAPH, ContentType.fromWireName(null));
	}
}
