package markbridge.ast.doc;

import java.util.List;

public record ListBlock(boolean ordered, List<ListItem> items) implements DocNode {
}
