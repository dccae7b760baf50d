package markbridge.ast.doc;

import java.util.List;

public record Paragraph(List<DocNode> content) implements DocNode {
}
