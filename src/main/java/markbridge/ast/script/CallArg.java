package markbridge.ast.script;

/**
 * Call argument or dictionary entry. {@code name} is null for positional values.
 */
public record CallArg(String name, Expr value) {
	public static CallArg positional(Expr value) {
		return new CallArg(null, value);
	}

	public boolean isNamed() {
		return name != null;
	}
}
