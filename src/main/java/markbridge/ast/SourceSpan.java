package markbridge.ast;

/**
 * Source span for diagnostics.
 *
 * Offsets are 0-based character indices into the original source text.
 */
public record SourceSpan(int startOffset, int endOffset) {
	public static final SourceSpan NONE = new SourceSpan(-1, -1);

	public boolean isKnown() {
		return startOffset >= 0;
	}

	public String slice(String source) {
		if (!isKnown() || source == null) {
			return "";
		}
		int end = Math.min(endOffset, source.length());
		int start = Math.min(startOffset, end);
		return source.substring(start, end);
	}

	/** 1-based line of the start offset. */
	public int line(String source) {
		int line = 1;
		for (int i = 0; i < startOffset && i < source.length(); i++) {
			if (source.charAt(i) == '\n') {
				line++;
			}
		}
		return line;
	}

	/** 1-based column of the start offset. */
	public int column(String source) {
		int col = 1;
		for (int i = 0; i < startOffset && i < source.length(); i++) {
			col = source.charAt(i) == '\n' ? 1 : col + 1;
		}
		return col;
	}
}
