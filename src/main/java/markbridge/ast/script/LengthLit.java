package markbridge.ast.script;

/**
 * Number with a unit ({@code 1pt}, {@code 2.5cm}, {@code 50%}, {@code 1fr}).
 */
public record LengthLit(String text) implements Expr {
}
