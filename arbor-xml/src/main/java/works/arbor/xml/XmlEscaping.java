package works.arbor.xml;

/**
 * Character escaping for XML text and attribute values.
 */
public final class XmlEscaping {
	private XmlEscaping() {}

	public static String escapeText(String text) {
		StringBuilder sb = new StringBuilder(text.length() + 16);
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
				case '&': sb.append("&amp;"); break;
				case '<': sb.append("&lt;"); break;
				case '>': sb.append("&gt;"); break;
				default: sb.append(c);
			}
		}
		return sb.toString();
	}

	/**
	 * Escapes quotes as well as markup characters. Tabs and line breaks are written
	 * as character references, since a parser would otherwise normalize them to spaces.
	 */
	public static String escapeAttribute(String value) {
		StringBuilder sb = new StringBuilder(value.length() + 16);
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
				case '&': sb.append("&amp;"); break;
				case '<': sb.append("&lt;"); break;
				case '>': sb.append("&gt;"); break;
				case '"': sb.append("&quot;"); break;
				case '\'': sb.append("&apos;"); break;
				case '\t': sb.append("&#9;"); break;
				case '\n': sb.append("&#10;"); break;
				case '\r': sb.append("&#13;"); break;
				default: sb.append(c);
			}
		}
		return sb.toString();
	}

	/**
	 * Replaces the five predefined entities and decimal or hexadecimal character references.
	 * Anything else starting with <code>&amp;</code> is left as it is.
	 */
	public static String unescape(String text) {
		int amp = text.indexOf('&');
		if (amp < 0) {
			return text;
		}
		StringBuilder sb = new StringBuilder(text.length());
		int i = 0;
		while (amp >= 0) {
			sb.append(text, i, amp);
			int semi = text.indexOf(';', amp);
			String replacement = (semi < 0) ? null : decode(text.substring(amp + 1, semi));
			if (replacement == null) {
				sb.append('&');
				i = amp + 1;
			} else {
				sb.append(replacement);
				i = semi + 1;
			}
			amp = text.indexOf('&', i);
		}
		sb.append(text, i, text.length());
		return sb.toString();
	}

	private static String decode(String entity) {
		switch (entity) {
			case "amp": return "&";
			case "lt": return "<";
			case "gt": return ">";
			case "quot": return "\"";
			case "apos": return "'";
		}
		if (entity.length() < 2 || entity.charAt(0) != '#') {
			return null;
		}
		boolean hex = entity.charAt(1) == 'x' || entity.charAt(1) == 'X';
		String digits = entity.substring(hex ? 2 : 1);
		if (digits.isEmpty() || digits.length() > 8) {
			return null;
		}
		int codePoint;
		try {
			codePoint = Integer.parseInt(digits, hex ? 16 : 10);
		} catch (NumberFormatException e) {
			return null;
		}
		if (!Character.isValidCodePoint(codePoint)) {
			return null;
		}
		return new String(Character.toChars(codePoint));
	}
}
