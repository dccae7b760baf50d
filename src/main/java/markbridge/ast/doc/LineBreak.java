package markbridge.ast.doc;

public record LineBreak() implements DocNode {
}
