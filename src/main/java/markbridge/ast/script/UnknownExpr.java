package markbridge.ast.script;

/**
 * Syntax the parser skipped over; never evaluated.
 */
public record UnknownExpr(String source) implements Expr {
}
