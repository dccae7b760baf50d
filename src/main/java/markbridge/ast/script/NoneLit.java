package markbridge.ast.script;

public record NoneLit() implements Expr {
}
