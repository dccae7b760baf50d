package markbridge.print;

import markbridge.ast.math.MathAccent;
import markbridge.ast.math.MathAtom;
import markbridge.ast.math.MathCall;
import markbridge.ast.math.MathIdent;
import markbridge.ast.math.MathNode;
import markbridge.ast.math.MathOperatorName;
import markbridge.ast.math.MathRoot;
import markbridge.ast.math.MathText;

/**
 * Spacing decisions shared by both math printers.
 */
final class MathSpacing {
	private MathSpacing() {
	}

	/** Whether {@code next} is written directly after {@code prev}, without a space. */
	static boolean tight(MathNode prev, MathNode next) {
		if (prev instanceof MathAtom a && isOpening(a.text())) {
			return true;
		}
		if (next instanceof MathAtom b) {
			String t = b.text();
			if (isClosing(t) || t.equals(",") || t.equals(";") || t.equals("'") || t.equals("!")) {
				return true;
			}
			if (isOpening(t)) {
				return prev instanceof MathIdent || prev instanceof MathAtom p && isWord(p.text());
			}
		}
		return false;
	}

	/** Nodes that read as one unit after {@code ^}, {@code _} or around {@code /}. */
	static boolean singleToken(MathNode node) {
		if (node instanceof MathAtom atom) {
			return isWord(atom.text()) || atom.text().length() == 1;
		}
		return node instanceof MathIdent || node instanceof MathCall || node instanceof MathText
				|| node instanceof MathAccent || node instanceof MathRoot || node instanceof MathOperatorName;
	}

	static boolean isWord(String text) {
		return !text.isEmpty() && text.chars().allMatch(ch -> Character.isLetterOrDigit(ch) || ch == '.');
	}

	private static boolean isOpening(String text) {
		return text.equals("(") || text.equals("[") || text.equals("{");
	}

	private static boolean isClosing(String text) {
		return text.equals(")") || text.equals("]") || text.equals("}");
	}
}
