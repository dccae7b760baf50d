package markbridge.ast.script;

final class ExprNames {
	private ExprNames() {
	}

	static String dotted(Expr expr) {
		if (expr instanceof Ident id) {
			return id.name();
		}
		if (expr instanceof FieldExpr field) {
			String target = dotted(field.target());
			return target == null ? null : target + "." + field.field();
		}
		return null;
	}
}
