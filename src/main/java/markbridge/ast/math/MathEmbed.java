package markbridge.ast.math;

import markbridge.ast.script.Expr;

/**
 * Typst {@code #expr} inside math; resolved by the evaluator.
 */
public record MathEmbed(Expr expr, String source) implements MathNode {
}
