package markbridge.ast.math;

/**
 * Body between delimiters. {@code sized} marks {@code \left..\right} / {@code lr(..)}.
 * Delimiters are plain characters; "." stands for an invisible delimiter.
 */
public record MathDelimited(String open, MathNode body, String close, boolean sized) implements MathNode {
}
