package markbridge.ast.doc;

import java.util.List;

public record BibEntry(String key, List<DocNode> content) implements DocNode {
}
