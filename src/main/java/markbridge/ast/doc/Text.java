package markbridge.ast.doc;

public record Text(String text) implements DocNode {
}
