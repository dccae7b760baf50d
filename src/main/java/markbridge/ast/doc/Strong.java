package markbridge.ast.doc;

import java.util.List;

public record Strong(List<DocNode> content) implements DocNode {
}
