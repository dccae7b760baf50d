package markbridge.ast.math;

public record MathText(String text) implements MathNode {
}
