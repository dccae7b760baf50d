package markbridge.ast.script;

public record LabelExpr(String label) implements Expr {
}
