package markbridge.ast.script;

public record StrLit(String value) implements Expr {
}
