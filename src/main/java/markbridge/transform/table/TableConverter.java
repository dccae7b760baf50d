package markbridge.transform.table;

import markbridge.Direction;
import markbridge.ast.doc.BorderStyle;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.LossMarker;
import markbridge.ast.doc.TableCell;
import markbridge.ast.doc.TableGrid;
import markbridge.ast.doc.TableNode;
import markbridge.ast.doc.TableRow;
import markbridge.ast.doc.TableRule;
import markbridge.loss.LossKind;
import markbridge.loss.LossRecord;
import markbridge.loss.LossTracker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Converts table geometry and styling between the two languages.
 *
 * Span geometry, alignments and rules carry over unchanged; fills are rewritten
 * through {@link ColorMapper}. Every idiom met is counted in the coverage record,
 * and an idiom that only survives approximately also gets a
 * {@code table-approximation} loss whose marker goes into the cell or before the
 * table.
 */
public final class TableConverter {
	private static final Logger log = LoggerFactory.getLogger(TableConverter.class);

	private final Direction direction;
	private final LossTracker tracker;
	private final TableCoverage coverage;
	private final UnaryOperator<List<DocNode>> content;

	/**
	 * @param content converts the inline content of a cell
	 */
	public TableConverter(Direction direction, LossTracker tracker, TableCoverage coverage,
			UnaryOperator<List<DocNode>> content) {
		this.direction = direction;
		this.tracker = tracker;
		this.coverage = coverage;
		this.content = content;
	}

	/** The converted table, preceded by the markers of table-wide approximations. */
	public List<DocNode> convert(TableNode table) {
		TableGrid grid = table.grid();
		List<DocNode> out = new ArrayList<>();
		BorderStyle border = border(grid, out);
		for (TableRule rule : grid.rules()) {
			if (rule.isPartial()) {
				coverage.mapped(TableIdiom.PARTIAL_RULE);
			}
		}
		List<TableRow> rows = new ArrayList<>();
		for (TableRow row : grid.rows()) {
			List<TableCell> cells = new ArrayList<>();
			for (TableCell cell : row.cells()) {
				cells.add(cell(cell));
			}
			rows.add(new TableRow(cells));
		}
		out.add(new TableNode(new TableGrid(grid.columns(), grid.alignments(), rows, border, grid.rules(),
				grid.verticalLines())));
		log.debug("table {}x{} converted, border {}", rows.size(), grid.columns(), border);
		return out;
	}

	private BorderStyle border(TableGrid grid, List<DocNode> markers) {
		switch (grid.border()) {
			case RULED -> coverage.mapped(TableIdiom.RULED_BORDER);
			case GRID -> coverage.mapped(TableIdiom.GRID_BORDER);
			case CUSTOM -> {
				if (!grid.rules().isEmpty() || grid.verticalLines()) {
					coverage.mapped(TableIdiom.CELL_STROKE);
					return BorderStyle.CUSTOM;
				}
				// a stroke given as a dictionary or function: the closest is a full grid
				coverage.approximated(TableIdiom.CELL_STROKE);
				LossRecord loss = tracker.record(LossKind.TABLE_APPROXIMATION, "stroke",
						"custom table stroke approximated as a full grid", "", "table");
				markers.add(new LossMarker(loss.id(), "stroke"));
				return BorderStyle.GRID;
			}
			default -> {
			}
		}
		return grid.border();
	}

	private TableCell cell(TableCell cell) {
		if (cell.isSpanning()) {
			coverage.mapped(TableIdiom.SPAN);
		}
		List<DocNode> converted = content.apply(cell.content());
		String fill = null;
		if (cell.fill() != null) {
			fill = direction == Direction.LATEX_TO_TYPST ? ColorMapper.toTypst(cell.fill())
					: ColorMapper.toLatex(cell.fill());
			if (fill != null) {
				coverage.mapped(TableIdiom.FILL);
			} else {
				coverage.approximated(TableIdiom.FILL);
				LossRecord loss = tracker.record(LossKind.TABLE_APPROXIMATION, "fill",
						"cell fill " + cell.fill() + " has no counterpart and was dropped", cell.fill(), "table");
				List<DocNode> marked = new ArrayList<>();
				marked.add(new LossMarker(loss.id(), cell.fill()));
				marked.addAll(converted);
				converted = marked;
			}
		}
		return new TableCell(converted, cell.colspan(), cell.rowspan(), cell.align(), fill);
	}
}
