package markbridge.eval;

import markbridge.ast.doc.DocNode;

import java.util.List;

/**
 * Evaluated markup. Content made of a single paragraph is stored as its inline
 * nodes.
 */
public record ContentValue(List<DocNode> nodes) implements Value {
	public static final ContentValue EMPTY = new ContentValue(List.of());

	@Override
	public String typeName() {
		return "content";
	}
}
