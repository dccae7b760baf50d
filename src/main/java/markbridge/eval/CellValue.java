package markbridge.eval;

import markbridge.ast.doc.CellAlign;
import markbridge.ast.doc.DocNode;

import java.util.List;

/**
 * Result of {@code table.cell(..)}.
 */
public record CellValue(List<DocNode> content, int colspan, int rowspan, CellAlign align, String fill)
		implements Value {
	@Override
	public String typeName() {
		return "content";
	}
}
