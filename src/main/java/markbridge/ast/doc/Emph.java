package markbridge.ast.doc;

import java.util.List;

public record Emph(List<DocNode> content) implements DocNode {
}
