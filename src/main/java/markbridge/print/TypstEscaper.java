package markbridge.print;

/**
 * Escapes plain text for Typst markup.
 */
public final class TypstEscaper {
	private static final String SPECIAL = "\\*_`$#@<[]~";

	private TypstEscaper() {
	}

	/**
	 * @param lineStart whether the text begins a line, where {@code = - + /}
	 *                  followed by a space would start a block
	 */
	public static String markup(String text, boolean lineStart) {
		StringBuilder sb = new StringBuilder(text.length() + 8);
		for (int i = 0; i < text.length(); i++) {
			char ch = text.charAt(i);
			char next = i + 1 < text.length() ? text.charAt(i + 1) : 0;
			if (SPECIAL.indexOf(ch) >= 0) {
				sb.append('\\').append(ch);
			} else if (ch == '/' && (next == '/' || next == '*')) {
				sb.append("\\/");
			} else if (ch == '\u00A0') {
				sb.append('~');
			} else if (i == 0 && lineStart && isBlockMarker(text)) {
				sb.append('\\').append(ch);
			} else {
				sb.append(ch);
			}
		}
		return sb.toString();
	}

	private static boolean isBlockMarker(String text) {
		char first = text.charAt(0);
		if (first == '=') {
			int i = 0;
			while (i < text.length() && text.charAt(i) == '=') {
				i++;
			}
			return i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t');
		}
		return (first == '-' || first == '+' || first == '/') && text.length() > 1
				&& (text.charAt(1) == ' ' || text.charAt(1) == '\t');
	}

	/** A Typst string literal. */
	public static String string(String text) {
		return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
	}
}
