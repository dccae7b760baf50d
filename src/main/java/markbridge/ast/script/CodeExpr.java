package markbridge.ast.script;

import java.util.List;

/**
 * Code block {@code { ... }} used as an expression. Only a block holding a single
 * expression is evaluated.
 */
public record CodeExpr(List<Expr> statements, String source) implements Expr {
}
