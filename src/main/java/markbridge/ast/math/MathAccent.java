package markbridge.ast.math;

/**
 * Accent over a body, carrying the accent's name in both languages.
 */
public record MathAccent(String latexName, String typstName, MathNode body) implements MathNode {
}
