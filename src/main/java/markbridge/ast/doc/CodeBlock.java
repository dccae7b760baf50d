package markbridge.ast.doc;

/**
 * Verbatim block. {@code language} may be empty.
 */
public record CodeBlock(String language, String code) implements DocNode {
}
