package markbridge.ast.script;

public record FieldExpr(Expr target, String field) implements Expr {
	public String dottedName() {
		return ExprNames.dotted(this);
	}
}
