package markbridge.ast.script;

public record SpreadExpr(Expr inner) implements Expr {
}
