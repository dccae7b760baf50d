package markbridge.parse.latex;

import java.util.Set;

/**
 * Environment names with a fixed meaning for the parser and the macro engine.
 */
public final class LatexEnvironments {
	private LatexEnvironments() {
	}

	/** Display math environments, in text mode. */
	public static final Set<String> DISPLAY_MATH = Set.of("equation", "equation*", "align", "align*", "gather",
			"gather*", "multline", "multline*", "flalign", "flalign*", "eqnarray", "eqnarray*", "displaymath", "math");

	/** Matrix-like environments nested in math. */
	public static final Set<String> MATRICES = Set.of("matrix", "pmatrix", "bmatrix", "Bmatrix", "vmatrix",
			"Vmatrix", "smallmatrix", "cases", "array");

	/** Alignment environments nested in math, kept as rows with alignment points. */
	public static final Set<String> ALIGNED = Set.of("aligned", "alignedat", "split", "gathered");

	public static final Set<String> LISTS = Set.of("itemize", "enumerate", "description");

	public static final Set<String> TABULARS = Set.of("tabular", "tabular*", "tabularx", "longtable");

	public static final Set<String> FLOATS = Set.of("figure", "figure*", "table", "table*");

	/** Environments whose content is kept and whose wrapper is dropped. */
	public static final Set<String> TRANSPARENT = Set.of("document", "center", "flushleft", "flushright",
			"abstract", "minipage", "small", "footnotesize", "quote*");

	/** Theorem-like environments rendered as a bold title followed by the body. */
	public static final Set<String> THEOREMS = Set.of("theorem", "lemma", "proposition", "corollary", "definition",
			"remark", "example", "proof");

	public static boolean isNumbered(String env) {
		return !env.endsWith("*") && !env.equals("displaymath") && !env.equals("math");
	}
}
