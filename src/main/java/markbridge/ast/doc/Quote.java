package markbridge.ast.doc;

import java.util.List;

public record Quote(List<DocNode> content) implements DocNode {
}
