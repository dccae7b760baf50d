package markbridge.ast.math;

/**
 * Literal letter, number or operator character sequence.
 */
public record MathAtom(String text) implements MathNode {
	public boolean isLetter() {
		return text.length() == 1 && Character.isLetter(text.charAt(0));
	}

	public boolean isNumber() {
		return !text.isEmpty() && Character.isDigit(text.charAt(0));
	}
}
