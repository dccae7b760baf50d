package markbridge.ast.doc;

import java.util.List;

public record ListItem(List<DocNode> content) implements DocNode {
}
