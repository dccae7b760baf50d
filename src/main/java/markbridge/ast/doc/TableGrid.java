package markbridge.ast.doc;

import java.util.List;

/**
 * Table geometry independent of source syntax.
 *
 * Rows list only the cells that start in that row: positions covered by a
 * rowspan from an earlier row are not repeated. {@code rules} are horizontal
 * rules placed before a row index ({@code rows.size()} means after the last row).
 */
public record TableGrid(int columns, List<CellAlign> alignments, List<TableRow> rows, BorderStyle border,
		List<TableRule> rules, boolean verticalLines) {

	public int cellCount() {
		return rows.stream().mapToInt(r -> r.cells().size()).sum();
	}
}
