package markbridge.print;

import markbridge.ast.doc.BorderStyle;
import markbridge.ast.doc.CellAlign;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.TableCell;
import markbridge.ast.doc.TableGrid;
import markbridge.ast.doc.TableRow;
import markbridge.ast.doc.TableRule;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Writes a {@link TableGrid} as a {@code tabular} environment.
 *
 * Ruled tables use booktabs commands, grid tables get {@code |} columns and an
 * {@code \hline} at every row boundary. Positions covered by a rowspan from an
 * earlier row are written as empty cells, as {@code multirow} expects.
 */
final class LatexTablePrinter {
	private final Function<List<DocNode>, String> inline;

	LatexTablePrinter(Function<List<DocNode>, String> inline) {
		this.inline = inline;
	}

	String print(TableGrid grid) {
		boolean bars = grid.border() == BorderStyle.GRID
				|| grid.border() == BorderStyle.CUSTOM && grid.verticalLines();
		StringBuilder spec = new StringBuilder();
		for (int k = 0; k < grid.columns(); k++) {
			if (bars) {
				spec.append('|');
			}
			spec.append(letter(k < grid.alignments().size() ? grid.alignments().get(k) : CellAlign.LEFT));
		}
		if (bars) {
			spec.append('|');
		}
		List<String> lines = new ArrayList<>();
		lines.add("\\begin{tabular}{" + spec + "}");
		int[] coveredUntil = new int[grid.columns()];
		CellAlign[] coveredAlign = new CellAlign[grid.columns()];
		int[] coveredWidth = new int[grid.columns()];
		int rowCount = grid.rows().size();
		for (int r = 0; r < rowCount; r++) {
			rules(grid, r, lines);
			lines.add(row(grid, grid.rows().get(r), r, coveredUntil, coveredWidth, coveredAlign, bars) + " \\\\");
		}
		rules(grid, rowCount, lines);
		lines.add("\\end{tabular}");
		return String.join("\n", lines);
	}

	private String row(TableGrid grid, TableRow row, int r, int[] coveredUntil, int[] coveredWidth,
			CellAlign[] coveredAlign, boolean bars) {
		List<String> cells = new ArrayList<>();
		int col = 0;
		int next = 0;
		List<TableCell> pending = row.cells();
		while (col < grid.columns() || next < pending.size()) {
			if (col < grid.columns() && coveredUntil[col] > r) {
				int width = coveredWidth[col];
				cells.add(width > 1 ? "\\multicolumn{" + width + "}{" + column(coveredAlign[col], bars, col == 0)
						+ "}{}" : "");
				col += width;
				continue;
			}
			if (next >= pending.size()) {
				break;
			}
			TableCell cell = pending.get(next++);
			if (cell.rowspan() > 1 && col < grid.columns()) {
				coveredUntil[col] = r + cell.rowspan();
				coveredWidth[col] = cell.colspan();
				coveredAlign[col] = alignOf(grid, cell, col);
			}
			cells.add(cell(grid, cell, col, bars));
			col += cell.colspan();
		}
		return String.join(" & ", cells);
	}

	private String cell(TableGrid grid, TableCell cell, int col, boolean bars) {
		String body = inline.apply(cell.content());
		if (cell.fill() != null) {
			String color = cell.fill().startsWith("[") ? cell.fill() : "{" + cell.fill() + "}";
			body = "\\cellcolor" + color + (body.isEmpty() ? "" : " " + body);
		}
		if (cell.rowspan() > 1) {
			body = "\\multirow{" + cell.rowspan() + "}{*}{" + body + "}";
		}
		CellAlign columnAlign = col < grid.alignments().size() ? grid.alignments().get(col) : CellAlign.LEFT;
		if (cell.colspan() > 1 || cell.align() != null && cell.align() != columnAlign) {
			body = "\\multicolumn{" + cell.colspan() + "}{" + column(alignOf(grid, cell, col), bars, col == 0) + "}{"
					+ body + "}";
		}
		return body;
	}

	private static CellAlign alignOf(TableGrid grid, TableCell cell, int col) {
		if (cell.align() != null) {
			return cell.align();
		}
		return col < grid.alignments().size() ? grid.alignments().get(col) : CellAlign.LEFT;
	}

	private static String column(CellAlign align, boolean bars, boolean first) {
		String letter = String.valueOf(letter(align));
		if (!bars) {
			return letter;
		}
		return (first ? "|" : "") + letter + "|";
	}

	private static char letter(CellAlign align) {
		switch (align) {
			case CENTER:
				return 'c';
			case RIGHT:
				return 'r';
			default:
				return 'l';
		}
	}

	private static void rules(TableGrid grid, int beforeRow, List<String> lines) {
		if (grid.border() == BorderStyle.GRID) {
			lines.add("\\hline");
			return;
		}
		for (TableRule rule : grid.rules()) {
			if (rule.beforeRow() != beforeRow) {
				continue;
			}
			lines.add(rule(rule));
		}
	}

	private static String rule(TableRule rule) {
		String range = rule.isPartial() ? "{" + (rule.fromColumn() + 1) + "-" + (rule.toColumn() + 1) + "}" : "";
		switch (rule.kind()) {
			case TOP:
				return "\\toprule";
			case BOTTOM:
				return "\\bottomrule";
			case MID:
				return rule.isPartial() ? "\\cmidrule" + range : "\\midrule";
			default:
				return rule.isPartial() ? "\\cline" + range : "\\hline";
		}
	}
}
