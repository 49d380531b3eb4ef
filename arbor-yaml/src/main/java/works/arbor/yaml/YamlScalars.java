package works.arbor.yaml;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Conversion between YAML scalar text and the values held by
 * {@link works.arbor.NodeKind#SCALAR SCALAR} nodes.
 * <p>
 * {@link #format} only writes text that {@link #coerce} reads back as an equal value.
 */
public final class YamlScalars {
	private YamlScalars() {}

	private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "on");
	private static final Set<String> FALSE_WORDS = Set.of("false", "no", "off");
	private static final Set<String> RESERVED_WORDS = Set.of("true", "false", "yes", "no", "on", "off", "null", "~");

	private static final Pattern INTEGER = Pattern.compile("-?\\d+");
	private static final Pattern DECIMAL = Pattern.compile("-?\\d*\\.\\d+");
	private static final Pattern SCIENTIFIC = Pattern.compile("-?\\d+\\.?\\d*[eE][+-]?\\d+");
	private static final Pattern OCTAL = Pattern.compile("0[oO][0-7]+");
	private static final Pattern HEX = Pattern.compile("0[xX][0-9a-fA-F]+");
	private static final Pattern HEX_DIGITS = Pattern.compile("[0-9a-fA-F]{4}");
	private static final Pattern SPECIAL_CHARACTERS = Pattern.compile("[:\\[\\]{},#&*!|>'\"%@`]");

	/**
	 * Interprets one plain or quoted scalar.
	 * The checks run in this order: null, boolean, quoted string,
	 * integer, decimal, infinity and NaN, octal, hexadecimal, and finally plain string.
	 *
	 * @param text already trimmed; a quoted scalar must be complete
	 * (see {@link #closingQuote})
	 */
	public static Object coerce(String text) {
		if (text.isEmpty() || text.equals("null") || text.equals("~")) {
			return null;
		}
		if (TRUE_WORDS.contains(text)) {
			return Boolean.TRUE;
		}
		if (FALSE_WORDS.contains(text)) {
			return Boolean.FALSE;
		}
		if (isQuoted(text)) {
			return unquote(text);
		}
		if (INTEGER.matcher(text).matches()) {
			return integer(text, 10);
		}
		if (DECIMAL.matcher(text).matches() || SCIENTIFIC.matcher(text).matches()) {
			return Double.parseDouble(text);
		}
		Double special = specialDouble(text);
		if (special != null) {
			return special;
		}
		if (OCTAL.matcher(text).matches()) {
			return integer(text.substring(2), 8);
		}
		if (HEX.matcher(text).matches()) {
			return integer(text.substring(2), 16);
		}
		return text;
	}

	private static Object integer(String digits, int radix) {
		BigInteger big = new BigInteger(digits, radix);
		if (big.bitLength() < 64) {
			return big.longValue();
		} else {
			return big;
		}
	}

	private static Double specialDouble(String text) {
		switch (text) {
			case ".inf": case ".Inf": case ".INF":
			case "+.inf": case "+.Inf": case "+.INF":
				return Double.POSITIVE_INFINITY;
			case "-.inf": case "-.Inf": case "-.INF":
				return Double.NEGATIVE_INFINITY;
			case ".nan": case ".NaN": case ".NAN":
				return Double.NaN;
			default:
				return null;
		}
	}

	private static boolean isQuoted(String text) {
		return text.length() >= 2 && closingQuote(text, 0) == text.length() - 1;
	}

	/**
	 * @return the index of the quote that closes the quoted scalar starting at <code>start</code>,
	 * or -1 if it is never closed.
	 * Double-quoted scalars honour backslash escapes; single-quoted ones treat <code>''</code> as a quote.
	 */
	public static int closingQuote(String text, int start) {
		char quote = text.charAt(start);
		for (int i = start + 1; i < text.length(); i++) {
			char c = text.charAt(i);
			if (quote == '"' && c == '\\') {
				i++;
			} else if (c == quote) {
				if (quote == '\'' && i + 1 < text.length() && text.charAt(i + 1) == '\'') {
					i++;
				} else {
					return i;
				}
			}
		}
		return -1;
	}

	/**
	 * @param text a complete single- or double-quoted scalar, quotes included
	 */
	public static String unquote(String text) {
		String body = text.substring(1, text.length() - 1);
		if (text.charAt(0) == '\'') {
			return body.replace("''", "'");
		}
		StringBuilder sb = new StringBuilder(body.length());
		for (int i = 0; i < body.length(); i++) {
			char c = body.charAt(i);
			if (c != '\\' || i + 1 == body.length()) {
				sb.append(c);
				continue;
			}
			char escaped = body.charAt(++i);
			switch (escaped) {
				case 'n': sb.append('\n'); break;
				case 't': sb.append('\t'); break;
				case 'r': sb.append('\r'); break;
				case '0': sb.append('\0'); break;
				case 'u':
					if (i + 4 < body.length() && HEX_DIGITS.matcher(body.substring(i + 1, i + 5)).matches()) {
						sb.append((char) Integer.parseInt(body.substring(i + 1, i + 5), 16));
						i += 4;
					} else {
						sb.append("\\u");
					}
					break;
				default:
					// Covers \\ \" and \/, and leaves unknown escapes as the bare character
					sb.append(escaped);
			}
		}
		return sb.toString();
	}

	public static String format(Object value) {
		if (value == null) {
			return "null";
		} else if (value instanceof String) {
			String s = (String) value;
			return needsQuoting(s) ? quote(s) : s;
		} else if (value instanceof Double) {
			return formatDouble((Double) value);
		} else if (value instanceof BigDecimal) {
			return formatDouble(((BigDecimal) value).doubleValue());
		} else {
			// Boolean, Long, Integer, BigInteger
			return value.toString();
		}
	}

	private static String formatDouble(double d) {
		if (Double.isNaN(d)) {
			return ".nan";
		} else if (d == Double.POSITIVE_INFINITY) {
			return ".inf";
		} else if (d == Double.NEGATIVE_INFINITY) {
			return "-.inf";
		} else {
			// Always has a '.' or an exponent, so it reads back as a Double
			return Double.toString(d);
		}
	}

	public static String formatKey(String key) {
		if (needsQuoting(key) || (!key.isEmpty() && Character.isDigit(key.charAt(0)))) {
			return quote(key);
		}
		return key;
	}

	/**
	 * True if <code>s</code> written unquoted would not read back as the same string,
	 * or would be mistaken for structure.
	 */
	public static boolean needsQuoting(String s) {
		if (s.isEmpty()) {
			return true;
		}
		if (Character.isWhitespace(s.charAt(0)) || Character.isWhitespace(s.charAt(s.length() - 1))) {
			return true;
		}
		if (SPECIAL_CHARACTERS.matcher(s).find()) {
			return true;
		}
		for (int i = 0; i < s.length(); i++) {
			if (Character.isISOControl(s.charAt(i))) {
				return true;
			}
		}
		if (s.equals("-") || s.startsWith("- ") || s.equals("---") || s.equals("...")) {
			return true;
		}
		if (RESERVED_WORDS.contains(s.toLowerCase(Locale.ROOT))) {
			return true;
		}
		return !(coerce(s) instanceof String);
	}

	public static String quote(String s) {
		StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '"': sb.append("\\\""); break;
				case '\\': sb.append("\\\\"); break;
				case '\n': sb.append("\\n"); break;
				case '\t': sb.append("\\t"); break;
				case '\r': sb.append("\\r"); break;
				default:
					if (Character.isISOControl(c)) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
			}
		}
		return sb.append('"').toString();
	}
}
