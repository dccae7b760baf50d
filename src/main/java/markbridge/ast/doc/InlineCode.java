package markbridge.ast.doc;

public record InlineCode(String code) implements DocNode {
}
