package markbridge.ast.doc;

public record TableNode(TableGrid grid) implements DocNode {
}
