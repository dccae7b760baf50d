package markbridge.parse.latex;

import java.util.ArrayList;
import java.util.List;

/**
 * Read position over a token list with the argument-reading rules of TeX.
 *
 * Reads never throw. A group that runs to the end of the input is returned as far
 * as it goes and sets {@link #unbalanced()}.
 */
public final class TexCursor {
	private final List<TexToken> tokens;
	private int pos;
	private boolean unbalanced;

	public TexCursor(List<TexToken> tokens) {
		this.tokens = tokens;
	}

	public boolean atEnd() {
		return pos >= tokens.size();
	}

	public TexToken peek() {
		return peek(0);
	}

	public TexToken peek(int ahead) {
		int i = pos + ahead;
		return i < tokens.size() ? tokens.get(i) : null;
	}

	public TexToken next() {
		return tokens.get(pos++);
	}

	public int position() {
		return pos;
	}

	public void reset(int position) {
		this.pos = position;
	}

	public boolean unbalanced() {
		return unbalanced;
	}

	public List<TexToken> slice(int from, int to) {
		return new ArrayList<>(tokens.subList(from, to));
	}

	public List<TexToken> rest() {
		List<TexToken> out = slice(pos, tokens.size());
		pos = tokens.size();
		return out;
	}

	public void skipSpaces() {
		while (!atEnd() && tokens.get(pos).type() == TexTokenType.SPACE) {
			pos++;
		}
	}

	public void skipBlank() {
		while (!atEnd() && TexTokens.isBlank(tokens.get(pos))) {
			pos++;
		}
	}

	public boolean nextIs(TexTokenType type) {
		return !atEnd() && tokens.get(pos).type() == type;
	}

	/** Consumes a star after spaces, e.g. for {@code \section *}. */
	public boolean readStar() {
		int save = pos;
		skipSpaces();
		if (!atEnd() && tokens.get(pos).isChar('*')) {
			pos++;
			return true;
		}
		pos = save;
		return false;
	}

	/**
	 * Reads a balanced group; the cursor must be on its BEGIN_GROUP. Returns the
	 * inner tokens.
	 */
	public List<TexToken> readGroup() {
		pos++;
		int depth = 1;
		int start = pos;
		while (pos < tokens.size()) {
			TexToken token = tokens.get(pos);
			if (token.type() == TexTokenType.BEGIN_GROUP) {
				depth++;
			} else if (token.type() == TexTokenType.END_GROUP) {
				depth--;
				if (depth == 0) {
					List<TexToken> inner = slice(start, pos);
					pos++;
					return inner;
				}
			}
			pos++;
		}
		unbalanced = true;
		return slice(start, pos);
	}

	/**
	 * Reads a bracketed optional argument after spaces, or returns null and leaves
	 * the cursor unchanged.
	 */
	public List<TexToken> readOptional() {
		int save = pos;
		skipSpaces();
		if (atEnd() || !tokens.get(pos).isChar('[')) {
			pos = save;
			return null;
		}
		pos++;
		int start = pos;
		int depth = 0;
		while (pos < tokens.size()) {
			TexToken token = tokens.get(pos);
			if (token.type() == TexTokenType.BEGIN_GROUP) {
				depth++;
			} else if (token.type() == TexTokenType.END_GROUP) {
				depth--;
			} else if (depth == 0 && token.isChar(']')) {
				List<TexToken> inner = slice(start, pos);
				pos++;
				return inner;
			}
			pos++;
		}
		pos = save;
		return null;
	}

	/**
	 * Reads an undelimited argument: a group's content or a single token. Returns
	 * null when no argument is available (end of input, a closing brace or a
	 * paragraph break).
	 */
	public List<TexToken> readArgument() {
		skipSpaces();
		if (atEnd()) {
			return null;
		}
		TexToken token = tokens.get(pos);
		if (token.type() == TexTokenType.BEGIN_GROUP) {
			return readGroup();
		}
		if (token.type() == TexTokenType.END_GROUP || token.type() == TexTokenType.PAR) {
			return null;
		}
		pos++;
		List<TexToken> single = new ArrayList<>();
		single.add(token);
		return single;
	}

	/** Argument as plain text, or null. */
	public String readText() {
		List<TexToken> arg = readArgument();
		return arg == null ? null : TexTokens.detokenize(arg).trim();
	}

	/** Optional argument as plain text, or null. */
	public String readOptionalText() {
		List<TexToken> arg = readOptional();
		return arg == null ? null : TexTokens.detokenize(arg).trim();
	}
}
