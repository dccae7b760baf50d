package markbridge.ast.math;

/**
 * Square root when {@code index} is null, n-th root otherwise.
 */
public record MathRoot(MathNode index, MathNode radicand) implements MathNode {
}
