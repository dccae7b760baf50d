package markbridge.ast.math;

/**
 * Untranslatable construct: a marker for {@code lossId} followed by the best-effort
 * {@code approximation} (possibly an empty row).
 */
public record MathPassthrough(String lossId, String snippet, MathNode approximation) implements MathNode {
}
