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
import java.util.Locale;
import java.util.function.Function;

/**
 * Writes a {@link TableGrid} as a Typst {@code table(..)} call in code form.
 *
 * Rows shorter than the grid are padded with empty cells so that Typst's
 * automatic placement reproduces the same geometry.
 */
final class TypstTablePrinter {
	private final Function<List<DocNode>, String> inline;

	TypstTablePrinter(Function<List<DocNode>, String> inline) {
		this.inline = inline;
	}

	String print(TableGrid grid) {
		List<String> lines = new ArrayList<>();
		lines.add("columns: " + grid.columns() + ",");
		if (grid.alignments().stream().anyMatch(a -> a != CellAlign.LEFT)) {
			List<String> names = new ArrayList<>();
			grid.alignments().forEach(a -> names.add(align(a)));
			lines.add("align: (" + String.join(", ", names) + "),");
		}
		boolean rules = grid.border() != BorderStyle.GRID;
		if (rules) {
			lines.add("stroke: none,");
		}
		if (grid.border() == BorderStyle.CUSTOM && grid.verticalLines()) {
			for (int x = 0; x <= grid.columns(); x++) {
				lines.add("table.vline(x: " + x + "),");
			}
		}
		boolean[][] occupied = new boolean[grid.rows().size() + maxRowspan(grid)][grid.columns()];
		for (int r = 0; r < grid.rows().size(); r++) {
			if (rules) {
				addRules(grid, r, lines);
			}
			List<String> cells = new ArrayList<>();
			int col = 0;
			for (TableCell cell : grid.rows().get(r).cells()) {
				while (col < grid.columns() && occupied[r][col]) {
					col++;
				}
				for (int rr = r; rr < Math.min(occupied.length, r + cell.rowspan()); rr++) {
					for (int k = col; k < Math.min(grid.columns(), col + cell.colspan()); k++) {
						occupied[rr][k] = true;
					}
				}
				col += cell.colspan();
				cells.add(cell(cell));
			}
			for (int k = 0; k < grid.columns(); k++) {
				if (!occupied[r][k]) {
					occupied[r][k] = true;
					cells.add("[]");
				}
			}
			lines.add(String.join(", ", cells) + ",");
		}
		if (rules) {
			addRules(grid, grid.rows().size(), lines);
		}
		return "table(\n" + Blocks.indent(String.join("\n", lines), "  ") + "\n)";
	}

	private static int maxRowspan(TableGrid grid) {
		int max = 1;
		for (TableRow row : grid.rows()) {
			for (TableCell cell : row.cells()) {
				max = Math.max(max, cell.rowspan());
			}
		}
		return max;
	}

	private static void addRules(TableGrid grid, int beforeRow, List<String> lines) {
		for (TableRule rule : grid.rules()) {
			if (rule.beforeRow() != beforeRow) {
				continue;
			}
			if (rule.isPartial()) {
				lines.add("table.hline(start: " + rule.fromColumn() + ", end: " + (rule.toColumn() + 1) + "),");
			} else {
				lines.add("table.hline(),");
			}
		}
	}

	private String cell(TableCell cell) {
		String body = "[" + inline.apply(cell.content()) + "]";
		List<String> args = new ArrayList<>();
		if (cell.colspan() > 1) {
			args.add("colspan: " + cell.colspan());
		}
		if (cell.rowspan() > 1) {
			args.add("rowspan: " + cell.rowspan());
		}
		if (cell.align() != null) {
			args.add("align: " + align(cell.align()));
		}
		if (cell.fill() != null) {
			args.add("fill: " + cell.fill());
		}
		return args.isEmpty() ? body : "table.cell(" + String.join(", ", args) + ")" + body;
	}

	private static String align(CellAlign align) {
		return align.name().toLowerCase(Locale.ROOT);
	}
}
