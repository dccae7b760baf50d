package markbridge.ast.script;

/**
 * Conditional in expression position; {@code otherwise} may be null.
 */
public record IfExpr(Expr condition, Expr then, Expr otherwise) implements Expr {
}
