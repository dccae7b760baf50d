package markbridge.ast.doc;

import java.util.List;

/**
 * Floating figure or table wrapper. {@code body} holds the image, table or
 * arbitrary content; {@code caption} may be empty.
 */
public record Figure(List<DocNode> body, List<DocNode> caption, String label, boolean isTable) implements DocNode {
	public Figure withLabel(String newLabel) {
		return new Figure(body, caption, newLabel, isTable);
	}
}
