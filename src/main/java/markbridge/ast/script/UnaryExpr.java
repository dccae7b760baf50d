package markbridge.ast.script;

public record UnaryExpr(String op, Expr operand) implements Expr {
}
