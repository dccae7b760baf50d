package markbridge.ast.script;

import java.util.List;

/**
 * Function or method call. Trailing content blocks are appended to {@code args}
 * as positional arguments.
 */
public record CallExpr(Expr callee, List<CallArg> args) implements Expr {
	/** Dotted name of the callee ({@code table.cell}, {@code xs.map}) or null. */
	public String calleeName() {
		return ExprNames.dotted(callee);
	}
}
