package markbridge.ast.script;

/**
 * Expression of the Typst scripting language, as far as the parser understands it.
 */
public sealed interface Expr permits NoneLit, BoolLit, NumberLit, LengthLit, StrLit, Ident, ArrayExpr, DictExpr,
		UnaryExpr, BinaryExpr, CallExpr, FieldExpr, ContentExpr, ClosureExpr, MathExpr, SpreadExpr, LabelExpr,
		CodeExpr, IfExpr, UnknownExpr {
}
