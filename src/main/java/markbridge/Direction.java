package markbridge;

import markbridge.ast.Language;

/**
 * Conversion direction; selects the pre-resolution pass and the parser/printer pair.
 */
public enum Direction {
	LATEX_TO_TYPST(Language.LATEX, Language.TYPST),
	TYPST_TO_LATEX(Language.TYPST, Language.LATEX);

	private final Language source;
	private final Language target;

	Direction(Language source, Language target) {
		this.source = source;
		this.target = target;
	}

	public Language source() {
		return source;
	}

	public Language target() {
		return target;
	}

	/** Direction for a file extension ({@code .tex} or {@code .typ}), or null. */
	public static Direction forExtension(String fileName) {
		if (fileName.endsWith(".tex")) {
			return LATEX_TO_TYPST;
		}
		if (fileName.endsWith(".typ")) {
			return TYPST_TO_LATEX;
		}
		return null;
	}
}
