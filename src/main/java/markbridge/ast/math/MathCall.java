package markbridge.ast.math;

import java.util.List;

/**
 * Command or function applied to arguments: {@code \frac{a}{b}}, {@code frac(a, b)}.
 * {@code optional} holds a LaTeX bracket argument or is null.
 */
public record MathCall(String name, MathNode optional, List<MathArg> args, String lossId) implements MathNode {
	public MathCall(String name, List<MathArg> args) {
		this(name, null, args, null);
	}

	public List<MathNode> positional() {
		return args.stream().filter(a -> !a.isNamed()).map(MathArg::value).toList();
	}

	public MathNode named(String argName) {
		for (MathArg arg : args) {
			if (argName.equals(arg.name())) {
				return arg.value();
			}
		}
		return null;
	}
}
