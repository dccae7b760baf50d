package markbridge.ast.script;

public record BinaryExpr(String op, Expr left, Expr right) implements Expr {
}
