package markbridge.ast.math;

public record MathFrac(MathNode numerator, MathNode denominator) implements MathNode {
}
