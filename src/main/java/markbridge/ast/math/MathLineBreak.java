package markbridge.ast.math;

public record MathLineBreak() implements MathNode {
}
