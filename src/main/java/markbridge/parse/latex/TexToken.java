package markbridge.parse.latex;

import markbridge.ast.SourceSpan;

/**
 * LaTeX token.
 *
 * {@code text} is the control sequence name without backslash, the character, the
 * parameter number ("1", or "#1" for a deferred {@code ##1}), the verbatim body or
 * the comment text. {@code environment} names the environment of a VERBATIM token.
 * {@code lossId} marks a control sequence already reported as unknown.
 */
public record TexToken(TexTokenType type, String text, SourceSpan span, String lossId, String environment) {
	public static final TexToken SPACE = new TexToken(TexTokenType.SPACE, " ", SourceSpan.NONE, null, null);

	public TexToken(TexTokenType type, String text, SourceSpan span) {
		this(type, text, span, null, null);
	}

	public static TexToken cs(String name) {
		return new TexToken(TexTokenType.CONTROL_SEQ, name, SourceSpan.NONE);
	}

	public static TexToken ch(char c) {
		return new TexToken(TexTokenType.CHAR, String.valueOf(c), SourceSpan.NONE);
	}

	public static TexToken begin() {
		return new TexToken(TexTokenType.BEGIN_GROUP, "{", SourceSpan.NONE);
	}

	public static TexToken end() {
		return new TexToken(TexTokenType.END_GROUP, "}", SourceSpan.NONE);
	}

	public boolean isCs(String name) {
		return type == TexTokenType.CONTROL_SEQ && text.equals(name);
	}

	public boolean isChar(char c) {
		return type == TexTokenType.CHAR && text.length() == 1 && text.charAt(0) == c;
	}

	public boolean isSpace() {
		return type == TexTokenType.SPACE;
	}

	public TexToken withLossId(String id) {
		return new TexToken(type, text, span, id, environment);
	}
}
