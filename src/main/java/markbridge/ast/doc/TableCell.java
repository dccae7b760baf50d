package markbridge.ast.doc;

import java.util.List;

/**
 * One table cell. {@code align} and {@code fill} are null when the cell uses the
 * column/table defaults.
 */
public record TableCell(List<DocNode> content, int colspan, int rowspan, CellAlign align, String fill) {
	public static TableCell plain(List<DocNode> content) {
		return new TableCell(content, 1, 1, null, null);
	}

	public boolean isSpanning() {
		return colspan > 1 || rowspan > 1;
	}

	public TableCell withContent(List<DocNode> newContent) {
		return new TableCell(newContent, colspan, rowspan, align, fill);
	}
}
