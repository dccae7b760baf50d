package markbridge.eval;

import markbridge.ast.script.Expr;

import java.util.List;

/**
 * User function from {@code #let f(a, b) = ..} or a closure. {@code scope} is the
 * environment the function was defined in.
 */
public record FunctionValue(String name, List<String> params, Expr body, Environment scope) implements Value {
	@Override
	public String typeName() {
		return "function";
	}

	// the scope may contain this function, so identity stands in for structural equality
	@Override
	public boolean equals(Object other) {
		return this == other;
	}

	@Override
	public int hashCode() {
		return System.identityHashCode(this);
	}

	@Override
	public String toString() {
		return "FunctionValue[" + name + "(" + String.join(", ", params) + ")]";
	}
}
