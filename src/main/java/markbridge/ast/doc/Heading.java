package markbridge.ast.doc;

import java.util.List;

/**
 * Section heading. Level 1 is a top-level section.
 */
public record Heading(int level, List<DocNode> content, String label, boolean numbered) implements DocNode {
	public Heading withLabel(String newLabel) {
		return new Heading(level, content, newLabel, numbered);
	}
}
