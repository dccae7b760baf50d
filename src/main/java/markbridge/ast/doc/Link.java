package markbridge.ast.doc;

import java.util.List;

public record Link(String url, List<DocNode> content) implements DocNode {
}
