package markbridge.ast.script;

public record BoolLit(boolean value) implements Expr {
}
