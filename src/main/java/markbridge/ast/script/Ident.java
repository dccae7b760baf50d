package markbridge.ast.script;

public record Ident(String name) implements Expr {
}
