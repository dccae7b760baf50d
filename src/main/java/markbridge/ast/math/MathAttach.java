package markbridge.ast.math;

/**
 * Base with optional subscript and superscript.
 */
public record MathAttach(MathNode base, MathNode sub, MathNode sup) implements MathNode {
}
