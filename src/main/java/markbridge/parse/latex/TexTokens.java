package markbridge.parse.latex;

import java.util.List;

/**
 * Token list helpers.
 */
public final class TexTokens {
	private TexTokens() {
	}

	/** Source text for a token list, normalised the way TeX would print it back. */
	public static String detokenize(List<TexToken> tokens) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < tokens.size(); i++) {
			TexToken token = tokens.get(i);
			switch (token.type()) {
				case CONTROL_SEQ -> {
					sb.append('\\').append(token.text());
					if (isWord(token.text()) && i + 1 < tokens.size() && startsWithLetter(tokens.get(i + 1))) {
						sb.append(' ');
					}
				}
				case PARAM -> sb.append('#').append(token.text());
				case PAR -> sb.append("\n\n");
				case SPACE -> sb.append(' ');
				case COMMENT -> sb.append("% ").append(token.text()).append('\n');
				case VERBATIM -> {
					String header = token.environment();
					String name = environmentName(header);
					sb.append("\\begin{").append(name).append('}').append(header.substring(name.length()))
							.append('\n').append(token.text()).append("\\end{").append(name).append('}');
				}
				default -> sb.append(token.text());
			}
		}
		return sb.toString();
	}

	/** Name part of a VERBATIM header such as {@code lstlisting[language=C]}. */
	public static String environmentName(String header) {
		int cut = header.length();
		int bracket = header.indexOf('[');
		int brace = header.indexOf('{');
		if (bracket >= 0) {
			cut = bracket;
		}
		if (brace >= 0 && brace < cut) {
			cut = brace;
		}
		return header.substring(0, cut);
	}

	public static boolean sameToken(TexToken a, TexToken b) {
		return a.type() == b.type() && a.text().equals(b.text());
	}

	/** Trims leading and trailing SPACE/PAR tokens. */
	public static List<TexToken> trim(List<TexToken> tokens) {
		int from = 0;
		int to = tokens.size();
		while (from < to && isBlank(tokens.get(from))) {
			from++;
		}
		while (to > from && isBlank(tokens.get(to - 1))) {
			to--;
		}
		return tokens.subList(from, to);
	}

	public static boolean isBlank(TexToken token) {
		return token.type() == TexTokenType.SPACE || token.type() == TexTokenType.PAR;
	}

	static boolean isWord(String name) {
		return !name.isEmpty() && Character.isLetter(name.charAt(0));
	}

	private static boolean startsWithLetter(TexToken token) {
		return token.type() == TexTokenType.CHAR && Character.isLetter(token.text().charAt(0));
	}
}
