package markbridge.ast.doc;

import java.util.List;

public record Document(List<DocNode> children) implements DocNode {
}
