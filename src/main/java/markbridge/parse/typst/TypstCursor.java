package markbridge.parse.typst;

/**
 * Character cursor over Typst source shared by the markup, code and math parsers.
 */
final class TypstCursor {
	final String src;
	int pos;

	TypstCursor(String src) {
		this.src = src;
	}

	boolean atEnd() {
		return pos >= src.length();
	}

	char peek() {
		return pos < src.length() ? src.charAt(pos) : '\0';
	}

	char peek(int ahead) {
		int i = pos + ahead;
		return i < src.length() ? src.charAt(i) : '\0';
	}

	char next() {
		return src.charAt(pos++);
	}

	boolean startsWith(String text) {
		return src.startsWith(text, pos);
	}

	boolean eat(char c) {
		if (peek() == c && !atEnd()) {
			pos++;
			return true;
		}
		return false;
	}

	boolean eat(String text) {
		if (src.startsWith(text, pos)) {
			pos += text.length();
			return true;
		}
		return false;
	}

	/** Keyword followed by a non-identifier character. */
	boolean eatKeyword(String keyword) {
		if (src.startsWith(keyword, pos) && !isIdentPart(peek(keyword.length()))) {
			pos += keyword.length();
			return true;
		}
		return false;
	}

	/** Skips spaces and tabs on the current line. */
	void skipInlineSpace() {
		while (!atEnd() && (peek() == ' ' || peek() == '\t')) {
			pos++;
		}
	}

	/** Skips whitespace and comments in code mode. */
	void skipTrivia() {
		while (!atEnd()) {
			char c = peek();
			if (Character.isWhitespace(c)) {
				pos++;
			} else if (startsWith("//")) {
				while (!atEnd() && peek() != '\n') {
					pos++;
				}
			} else if (startsWith("/*")) {
				int end = src.indexOf("*/", pos + 2);
				pos = end < 0 ? src.length() : end + 2;
			} else {
				return;
			}
		}
	}

	String identifier() {
		int start = pos;
		if (!isIdentStart(peek()) || atEnd()) {
			return null;
		}
		pos++;
		while (!atEnd() && isIdentPart(peek())) {
			// a trailing hyphen or a hyphen before a digit-free end is not part of the name in markup
			if (peek() == '-' && !isIdentPart(peek(1))) {
				break;
			}
			pos++;
		}
		return src.substring(start, pos);
	}

	static boolean isIdentStart(char c) {
		return Character.isLetter(c) || c == '_';
	}

	static boolean isIdentPart(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '-';
	}

	/** Index just past the bracket matching the opener at {@code pos}, or -1. */
	int matching(char open, char close) {
		int depth = 0;
		int i = pos;
		boolean string = false;
		while (i < src.length()) {
			char c = src.charAt(i);
			if (string) {
				if (c == '\\') {
					i++;
				} else if (c == '"') {
					string = false;
				}
			} else if (c == '\\') {
				i++;
			} else if (c == '"' && open != '[') {
				string = true;
			} else if (c == open) {
				depth++;
			} else if (c == close) {
				depth--;
				if (depth == 0) {
					return i + 1;
				}
			}
			i++;
		}
		return -1;
	}

	int line() {
		int line = 1;
		for (int i = 0; i < pos && i < src.length(); i++) {
			if (src.charAt(i) == '\n') {
				line++;
			}
		}
		return line;
	}
}
