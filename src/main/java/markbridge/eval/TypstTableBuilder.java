package markbridge.eval;

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
 * Lays out the arguments of a Typst {@code table(..)} call on a grid.
 *
 * Cells fill the grid row by row, skipping positions already covered by an
 * earlier cell's span, the way Typst places them.
 */
final class TypstTableBuilder {
	private final Function<Value, List<DocNode>> content;

	private final List<List<TableCell>> rows = new ArrayList<>();
	private final List<boolean[]> occupied = new ArrayList<>();
	private final List<TableRule> rules = new ArrayList<>();
	private final List<RuleValue> pendingRules = new ArrayList<>();
	private final List<Integer> pendingRows = new ArrayList<>();
	private boolean verticalLines;
	private int columns;
	private int row;
	private int col;

	TypstTableBuilder(Function<Value, List<DocNode>> content) {
		this.content = content;
	}

	TableGrid build(Arguments args) {
		columns = columnCount(args.named("columns"));
		List<CellAlign> alignments = alignments(args.named("align"), columns);
		String tableFill = args.named("fill") instanceof ColorValue color ? color.source() : null;
		for (Value item : args.positional()) {
			if (item instanceof HeaderValue header) {
				for (Value part : header.items()) {
					add(part, tableFill);
				}
			} else {
				add(item, tableFill);
			}
		}
		int rowCount = rows.size();
		for (int i = 0; i < pendingRules.size(); i++) {
			RuleValue rule = pendingRules.get(i);
			int before = rule.position() != null ? rule.position() : pendingRows.get(i);
			placeRule(rule, Math.min(before, rowCount));
		}
		List<TableRow> tableRows = new ArrayList<>();
		for (List<TableCell> cells : rows) {
			tableRows.add(new TableRow(List.copyOf(cells)));
		}
		Value stroke = args.has("stroke") ? args.named("stroke") : null;
		BorderStyle border = borderStyle(stroke, args.has("stroke"));
		List<TableRule> finalRules = border == BorderStyle.RULED ? booktabs(rowCount) : List.copyOf(rules);
		return new TableGrid(columns, alignments, tableRows, border, finalRules, verticalLines);
	}

	private void add(Value item, String tableFill) {
		if (item instanceof RuleValue rule) {
			if (rule.vertical()) {
				verticalLines = true;
				return;
			}
			pendingRules.add(rule);
			pendingRows.add(col == 0 ? row : row + 1);
			return;
		}
		TableCell cell;
		if (item instanceof CellValue c) {
			cell = new TableCell(c.content(), Math.max(1, Math.min(c.colspan(), columns)), Math.max(1, c.rowspan()),
					c.align(), c.fill() != null ? c.fill() : tableFill);
		} else {
			cell = new TableCell(content.apply(item), 1, 1, null, tableFill);
		}
		place(cell);
	}

	private void place(TableCell cell) {
		while (isOccupied(row, col)) {
			advance(1);
		}
		int span = Math.min(cell.colspan(), columns - col);
		for (int r = row; r < row + cell.rowspan(); r++) {
			for (int k = col; k < col + span; k++) {
				occupiedRow(r)[k] = true;
			}
		}
		while (rows.size() <= row) {
			rows.add(new ArrayList<>());
		}
		rows.get(row).add(span == cell.colspan() ? cell
				: new TableCell(cell.content(), span, cell.rowspan(), cell.align(), cell.fill()));
		advance(span);
	}

	private void advance(int by) {
		col += by;
		if (col >= columns) {
			row++;
			col = 0;
		}
	}

	private boolean isOccupied(int r, int k) {
		return r < occupied.size() && occupied.get(r)[k];
	}

	private boolean[] occupiedRow(int r) {
		while (occupied.size() <= r) {
			occupied.add(new boolean[columns]);
		}
		return occupied.get(r);
	}

	private void placeRule(RuleValue rule, int before) {
		if (rule.start() != null || rule.end() != null) {
			int from = rule.start() == null ? 0 : rule.start();
			int to = rule.end() == null ? columns - 1 : rule.end() - 1;
			rules.add(new TableRule(before, TableRule.Kind.PLAIN, from, Math.max(from, to)));
		} else {
			rules.add(TableRule.full(before, TableRule.Kind.PLAIN));
		}
	}

	private BorderStyle borderStyle(Value stroke, boolean given) {
		if (!given) {
			return BorderStyle.GRID;
		}
		if (stroke instanceof NoneValue) {
			if (rules.isEmpty() && !verticalLines) {
				return BorderStyle.NONE;
			}
			return verticalLines ? BorderStyle.CUSTOM : BorderStyle.RULED;
		}
		if (stroke instanceof LengthValue || stroke instanceof ColorValue || stroke instanceof AutoValue) {
			return BorderStyle.GRID;
		}
		return BorderStyle.CUSTOM;
	}

	/** Horizontal-only rules on a stroke-less table read as booktabs rules. */
	private List<TableRule> booktabs(int rowCount) {
		List<TableRule> out = new ArrayList<>();
		for (TableRule rule : rules) {
			TableRule.Kind kind;
			if (rule.beforeRow() == 0 && !rule.isPartial()) {
				kind = TableRule.Kind.TOP;
			} else if (rule.beforeRow() == rowCount && !rule.isPartial()) {
				kind = TableRule.Kind.BOTTOM;
			} else {
				kind = TableRule.Kind.MID;
			}
			out.add(new TableRule(rule.beforeRow(), kind, rule.fromColumn(), rule.toColumn()));
		}
		return out;
	}

	private static int columnCount(Value columns) {
		if (columns instanceof NumberValue n) {
			return Math.max(1, (int) n.asLong());
		}
		if (columns instanceof ArrayValue a) {
			return Math.max(1, a.items().size());
		}
		if (columns instanceof RangeValue r) {
			return (int) Math.max(1, r.size());
		}
		return 1;
	}

	private static List<CellAlign> alignments(Value align, int columns) {
		List<CellAlign> out = new ArrayList<>();
		for (int i = 0; i < columns; i++) {
			CellAlign a = CellAlign.LEFT;
			if (align instanceof AlignValue single) {
				a = toCellAlign(single);
			} else if (align instanceof ArrayValue array && i < array.items().size()
					&& array.items().get(i) instanceof AlignValue item) {
				a = toCellAlign(item);
			}
			out.add(a == null ? CellAlign.LEFT : a);
		}
		return out;
	}

	static CellAlign toCellAlign(AlignValue align) {
		if (align.horizontal() == null) {
			return null;
		}
		return switch (align.horizontal()) {
			case "center" -> CellAlign.CENTER;
			case "right", "end" -> CellAlign.RIGHT;
			default -> CellAlign.LEFT;
		};
	}
}
