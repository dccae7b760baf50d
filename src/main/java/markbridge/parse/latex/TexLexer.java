package markbridge.parse.latex;

import markbridge.ast.SourceSpan;
import markbridge.ast.doc.LossMarker;
import markbridge.parse.ParseDiagnostic;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Tokenizer for LaTeX source.
 *
 * Notes:
 * - Whitespace runs collapse to one SPACE token; a blank line becomes PAR.
 * - Spaces after a control word are skipped.
 * - Comments are dropped, except loss marker comments which become COMMENT tokens.
 * - Verbatim-like environments and {@code tikzpicture} are captured whole as one
 * VERBATIM token so that macro expansion never touches their body.
 */
public final class TexLexer {
	private final List<ParseDiagnostic> errors = new ArrayList<>();

	private static final Set<String> RAW_ENVIRONMENTS = Set.of("verbatim", "verbatim*", "lstlisting", "minted",
			"tikzpicture", "comment");

	public List<TexToken> lex(String input) {
		errors.clear();
		List<TexToken> tokens = new ArrayList<>();
		int i = 0;
		while (i < input.length()) {
			char c = input.charAt(i);

			if (c == '%') {
				int start = i;
				int end = lineEnd(input, i);
				String comment = input.substring(i + 1, end).trim();
				if (comment.startsWith(LossMarker.PREFIX)) {
					tokens.add(new TexToken(TexTokenType.COMMENT, comment, new SourceSpan(start, end)));
				}
				// a comment also eats the newline and the next line's indentation, unless that line is blank
				int next = skipInlineWhitespace(input, end < input.length() ? end + 1 : end);
				i = next < input.length() && (input.charAt(next) == '\n' || input.charAt(next) == '\r') ? end : next;
				continue;
			}

			if (Character.isWhitespace(c)) {
				int start = i;
				int newlines = 0;
				while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
					if (input.charAt(i) == '\n') {
						newlines++;
					}
					i++;
				}
				TexTokenType type = newlines >= 2 ? TexTokenType.PAR : TexTokenType.SPACE;
				tokens.add(new TexToken(type, type == TexTokenType.PAR ? "\n\n" : " ", new SourceSpan(start, i)));
				continue;
			}

			if (c == '\\') {
				int start = i;
				i++;
				if (i >= input.length()) {
					tokens.add(new TexToken(TexTokenType.CHAR, "\\", new SourceSpan(start, i)));
					break;
				}
				String name;
				if (Character.isLetter(input.charAt(i)) || input.charAt(i) == '@') {
					int nameStart = i;
					while (i < input.length() && (Character.isLetter(input.charAt(i)) || input.charAt(i) == '@')) {
						i++;
					}
					if (i < input.length() && input.charAt(i) == '*' && allowsStar(input.substring(nameStart, i))) {
						i++;
					}
					name = input.substring(nameStart, i);
					i = skipControlWordSpace(input, i);
				} else {
					name = String.valueOf(input.charAt(i));
					i++;
				}
				SourceSpan span = new SourceSpan(start, i);
				if (name.equals("begin")) {
					int captured = captureRawEnvironment(input, i, start, tokens, errors);
					if (captured >= 0) {
						i = captured;
						continue;
					}
				}
				tokens.add(new TexToken(TexTokenType.CONTROL_SEQ, name, span));
				continue;
			}

			if (c == '#') {
				int start = i;
				int hashes = 0;
				while (i < input.length() && input.charAt(i) == '#') {
					hashes++;
					i++;
				}
				if (i < input.length() && Character.isDigit(input.charAt(i))) {
					String digit = String.valueOf(input.charAt(i));
					i++;
					String text = hashes >= 2 ? "#".repeat(hashes - 1) + digit : digit;
					tokens.add(new TexToken(TexTokenType.PARAM, text, new SourceSpan(start, i)));
				} else {
					tokens.add(new TexToken(TexTokenType.CHAR, "#".repeat(hashes), new SourceSpan(start, i)));
				}
				continue;
			}

			TexTokenType type = switch (c) {
				case '{' -> TexTokenType.BEGIN_GROUP;
				case '}' -> TexTokenType.END_GROUP;
				case '$' -> TexTokenType.MATH_SHIFT;
				case '&' -> TexTokenType.ALIGN_TAB;
				case '^' -> TexTokenType.SUPERSCRIPT;
				case '_' -> TexTokenType.SUBSCRIPT;
				case '~' -> TexTokenType.ACTIVE;
				default -> TexTokenType.CHAR;
			};
			tokens.add(new TexToken(type, String.valueOf(c), new SourceSpan(i, i + 1)));
			i++;
		}
		return tokens;
	}

	/** Structural errors of the last {@link #lex} call. */
	public List<ParseDiagnostic> errors() {
		return List.copyOf(errors);
	}

	private static boolean allowsStar(String name) {
		// \newcommand* and friends, starred sections and environments names like align* come through \begin{...}
		return !name.equals("begin") && !name.equals("end");
	}

	/**
	 * When {@code \begin{env}} at {@code afterBegin} opens a raw environment, emits
	 * one VERBATIM token and returns the index after {@code \end{env}}; otherwise -1.
	 */
	private static int captureRawEnvironment(String input, int afterBegin, int start, List<TexToken> tokens,
			List<ParseDiagnostic> errors) {
		int i = afterBegin;
		if (i >= input.length() || input.charAt(i) != '{') {
			return -1;
		}
		int close = input.indexOf('}', i);
		if (close < 0) {
			return -1;
		}
		String env = input.substring(i + 1, close).trim();
		if (!RAW_ENVIRONMENTS.contains(env)) {
			return -1;
		}
		int bodyStart = close + 1;
		StringBuilder header = new StringBuilder(env);
		// options such as [language=Java] or {python} for minted stay with the environment name
		while (bodyStart < input.length() && (input.charAt(bodyStart) == '[' || (env.equals("minted") && input.charAt(bodyStart) == '{'))) {
			char closer = input.charAt(bodyStart) == '[' ? ']' : '}';
			int end = input.indexOf(closer, bodyStart);
			if (end < 0) {
				break;
			}
			header.append(input, bodyStart, end + 1);
			bodyStart = end + 1;
		}
		String terminator = "\\end{" + env + "}";
		int end = input.indexOf(terminator, bodyStart);
		int bodyEnd = end < 0 ? input.length() : end;
		int after = end < 0 ? input.length() : end + terminator.length();
		String body = input.substring(bodyStart, bodyEnd);
		if (body.startsWith("\r\n")) {
			body = body.substring(2);
		} else if (body.startsWith("\n")) {
			body = body.substring(1);
		}
		tokens.add(new TexToken(TexTokenType.VERBATIM, body, new SourceSpan(start, after), null, header.toString()));
		if (end < 0) {
			errors.add(new ParseDiagnostic("unclosed environment '" + env + "'", new SourceSpan(start, bodyStart)));
		}
		return after;
	}

	private static int lineEnd(String input, int from) {
		int end = input.indexOf('\n', from);
		return end < 0 ? input.length() : end;
	}

	private static int skipInlineWhitespace(String input, int from) {
		int i = from;
		while (i < input.length() && (input.charAt(i) == ' ' || input.charAt(i) == '\t')) {
			i++;
		}
		return i;
	}

	private static int skipControlWordSpace(String input, int from) {
		int i = from;
		boolean newline = false;
		while (i < input.length()) {
			char ch = input.charAt(i);
			if (ch == ' ' || ch == '\t' || ch == '\r') {
				i++;
			} else if (ch == '\n' && !newline) {
				newline = true;
				i++;
			} else {
				break;
			}
		}
		// a blank line after a control word is still a paragraph break
		if (newline && i < input.length() && input.charAt(i) == '\n') {
			int back = i - 1;
			while (back > from && input.charAt(back) != '\n') {
				back--;
			}
			return back;
		}
		return i;
	}
}
