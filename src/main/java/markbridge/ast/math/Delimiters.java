package markbridge.ast.math;

import java.util.Map;

/**
 * Delimiters of {@link MathDelimited} are stored as the displayed character ("(",
 * "⟨", "‖") with "." standing for an invisible one. This class maps them to each
 * language's spelling.
 */
public final class Delimiters {
	private static final Map<String, String> LATEX_COMMANDS = Map.ofEntries(Map.entry("{", "{"),
			Map.entry("}", "}"), Map.entry("lbrace", "{"), Map.entry("rbrace", "}"), Map.entry("langle", "⟨"),
			Map.entry("rangle", "⟩"), Map.entry("lfloor", "⌊"), Map.entry("rfloor", "⌋"), Map.entry("lceil", "⌈"),
			Map.entry("rceil", "⌉"), Map.entry("|", "‖"), Map.entry("Vert", "‖"), Map.entry("lVert", "‖"),
			Map.entry("rVert", "‖"), Map.entry("vert", "|"), Map.entry("lvert", "|"), Map.entry("rvert", "|"));

	private static final Map<String, String> TO_LATEX = Map.of("{", "\\{", "}", "\\}", "⟨", "\\langle", "⟩",
			"\\rangle", "⌊", "\\lfloor", "⌋", "\\rfloor", "⌈", "\\lceil", "⌉", "\\rceil", "‖", "\\|");

	private static final Map<String, String> TO_TYPST = Map.of("⟨", "angle.l", "⟩", "angle.r", "⌊", "floor.l",
			"⌋", "floor.r", "⌈", "ceil.l", "⌉", "ceil.r", "‖", "bar.v.double", "{", "{", "}", "}");

	private static final Map<String, String> FROM_TYPST = Map.of("angle.l", "⟨", "angle.r", "⟩", "floor.l", "⌊",
			"floor.r", "⌋", "ceil.l", "⌈", "ceil.r", "⌉", "bar.v.double", "‖", "bar.v", "|", "brace.l", "{",
			"brace.r", "}");

	private Delimiters() {
	}

	/** Delimiter for a LaTeX control sequence name, or null when it is not one. */
	public static String fromLatexCommand(String name) {
		return LATEX_COMMANDS.get(name);
	}

	/** Delimiter for a Typst symbol name, or null when it is not one. */
	public static String fromTypstName(String name) {
		return FROM_TYPST.get(name);
	}

	public static boolean isOpening(String text) {
		return text.equals("(") || text.equals("[") || text.equals("{") || text.equals("⟨") || text.equals("⌊")
				|| text.equals("⌈");
	}

	public static String toLatex(String delimiter) {
		return TO_LATEX.getOrDefault(delimiter, delimiter);
	}

	/** Typst spelling; empty for the invisible delimiter. */
	public static String toTypst(String delimiter) {
		if (delimiter.equals(".")) {
			return "";
		}
		return TO_TYPST.getOrDefault(delimiter, delimiter);
	}
}
