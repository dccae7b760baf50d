package markbridge.print;

/**
 * Escapes plain text for LaTeX text mode.
 */
public final class LatexEscaper {
	private LatexEscaper() {
	}

	public static String text(String text) {
		StringBuilder sb = new StringBuilder(text.length() + 8);
		for (int i = 0; i < text.length(); i++) {
			char ch = text.charAt(i);
			switch (ch) {
				case '\\' -> sb.append("\\textbackslash{}");
				case '{', '}', '$', '&', '#', '_', '%' -> sb.append('\\').append(ch);
				case '^' -> sb.append("\\^{}");
				case '~' -> sb.append("\\textasciitilde{}");
				case '\u00A0' -> sb.append('~');
				case '“' -> sb.append("``");
				case '”' -> sb.append("''");
				default -> sb.append(ch);
			}
		}
		return sb.toString();
	}

	/** Argument of <code>&#92;url</code> or <code>&#92;href</code>: only the characters hyperref cannot take raw. */
	public static String url(String url) {
		return url.replace("\\", "\\\\").replace("%", "\\%").replace("#", "\\#");
	}
}
