package markbridge.print;

import markbridge.ast.doc.LossMarker;

/**
 * Spelling of loss markers as comments in either language.
 */
public final class LossComments {
	private LossComments() {
	}

	/** {@code /* mb:loss:L0001 snippet *&#47;}; a {@code *&#47;} inside the snippet is broken up. */
	public static String typst(String lossId, String snippet) {
		StringBuilder sb = new StringBuilder("/* ").append(LossMarker.PREFIX).append(lossId);
		String text = snippet == null ? "" : snippet.strip().replace("*/", "* /").replace("/*", "/ *");
		if (!text.isEmpty()) {
			sb.append(' ').append(text);
		}
		return sb.append(" */").toString();
	}

	/**
	 * {@code % mb:loss:L0001 snippet} followed by a newline. Further lines of a
	 * multi-line snippet get their own {@code %}.
	 */
	public static String latex(String lossId, String snippet) {
		StringBuilder sb = new StringBuilder("% ").append(LossMarker.PREFIX).append(lossId);
		String text = snippet == null ? "" : snippet.strip();
		if (!text.isEmpty()) {
			String[] lines = text.split("\r?\n", -1);
			sb.append(' ').append(lines[0]);
			for (int i = 1; i < lines.length; i++) {
				sb.append("\n% ").append(lines[i]);
			}
		}
		return sb.append('\n').toString();
	}
}
