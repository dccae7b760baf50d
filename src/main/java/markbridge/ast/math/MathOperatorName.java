package markbridge.ast.math;

/**
 * Upright operator name such as {@code \operatorname{argmax}}; {@code limits}
 * places attachments above and below.
 */
public record MathOperatorName(String name, boolean limits) implements MathNode {
}
