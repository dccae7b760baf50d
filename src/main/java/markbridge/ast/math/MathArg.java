package markbridge.ast.math;

/**
 * Argument of a {@link MathCall}. {@code name} is null for positional arguments.
 */
public record MathArg(String name, MathNode value) {
	public static MathArg positional(MathNode value) {
		return new MathArg(null, value);
	}

	public boolean isNamed() {
		return name != null;
	}
}
