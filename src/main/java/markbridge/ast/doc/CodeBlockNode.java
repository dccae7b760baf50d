package markbridge.ast.doc;

/**
 * Procedural {@code #{ ... }} block, kept as source text.
 */
public record CodeBlockNode(String source) implements DocNode {
}
