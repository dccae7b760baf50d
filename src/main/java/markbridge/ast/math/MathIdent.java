package markbridge.ast.math;

/**
 * Named symbol without arguments ({@code \alpha}, {@code alpha}, {@code arrow.r}).
 * {@code lossId} is set when an earlier stage already reported the name as unknown.
 */
public record MathIdent(String name, String lossId) implements MathNode {
	public MathIdent(String name) {
		this(name, null);
	}
}
