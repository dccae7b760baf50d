package markbridge.parse.latex;

import markbridge.ast.doc.BorderStyle;
import markbridge.ast.doc.CellAlign;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.TableCell;
import markbridge.ast.doc.TableGrid;
import markbridge.ast.doc.TableRow;
import markbridge.ast.doc.TableRule;
import markbridge.ast.doc.Text;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Reads a {@code tabular} body into a {@link TableGrid}.
 *
 * Positions covered by a {@code \multirow} from an earlier row are written as
 * empty cells in LaTeX; they are dropped here so that rows only list the cells
 * that start in them.
 */
final class TableReader {
	private final Function<List<TexToken>, List<DocNode>> inline;

	TableReader(Function<List<TexToken>, List<DocNode>> inline) {
		this.inline = inline;
	}

	TableGrid read(String columnSpec, List<TexToken> body) {
		List<CellAlign> alignments = new ArrayList<>();
		boolean verticalLines = parseColumnSpec(columnSpec, alignments);

		List<List<List<TexToken>>> rawRows = new ArrayList<>();
		List<TableRule> rules = new ArrayList<>();
		List<String> rowFills = new ArrayList<>();
		splitRows(body, rawRows, rules, rowFills);

		int columns = alignments.size();
		for (List<List<TexToken>> raw : rawRows) {
			int width = 0;
			for (List<TexToken> cell : raw) {
				width += spanOf(cell);
			}
			columns = Math.max(columns, width);
		}
		while (alignments.size() < columns) {
			alignments.add(CellAlign.LEFT);
		}

		List<TableRow> rows = new ArrayList<>();
		int[] pending = new int[columns];
		for (int r = 0; r < rawRows.size(); r++) {
			int[] covered = pending.clone();
			int[] next = new int[columns];
			for (int k = 0; k < columns; k++) {
				next[k] = Math.max(0, covered[k] - 1);
			}
			List<TableCell> cells = new ArrayList<>();
			int col = 0;
			for (List<TexToken> raw : rawRows.get(r)) {
				TableCell cell = parseCell(raw, alignments, col, rowFills.get(r));
				if (col < columns && covered[col] > 0 && cell.content().isEmpty()) {
					col += cell.colspan();
					continue;
				}
				cells.add(cell);
				if (cell.rowspan() > 1) {
					for (int k = col; k < Math.min(columns, col + cell.colspan()); k++) {
						next[k] = cell.rowspan() - 1;
					}
				}
				col += cell.colspan();
			}
			pending = next;
			rows.add(new TableRow(cells));
		}
		return new TableGrid(columns, List.copyOf(alignments), rows, borderStyle(rules, verticalLines, rows.size()),
				rules, verticalLines);
	}

	/** Fills alignments and returns whether the column spec draws vertical lines. */
	static boolean parseColumnSpec(String spec, List<CellAlign> alignments) {
		boolean vertical = false;
		int i = 0;
		while (i < spec.length()) {
			char ch = spec.charAt(i);
			switch (ch) {
				case 'l' -> alignments.add(CellAlign.LEFT);
				case 'c' -> alignments.add(CellAlign.CENTER);
				case 'r' -> alignments.add(CellAlign.RIGHT);
				case 'X' -> alignments.add(CellAlign.LEFT);
				case '|' -> vertical = true;
				case 'p', 'm', 'b' -> {
					alignments.add(CellAlign.LEFT);
					i = skipBraced(spec, i + 1) - 1;
				}
				case '@', '!', '>', '<' -> i = skipBraced(spec, i + 1) - 1;
				case '*' -> {
					int countEnd = skipBraced(spec, i + 1);
					int repeatEnd = skipBraced(spec, countEnd);
					String count = inner(spec, i + 1, countEnd);
					String repeated = inner(spec, countEnd, repeatEnd);
					int n;
					try {
						n = Integer.parseInt(count.trim());
					} catch (NumberFormatException e) {
						n = 1;
					}
					for (int k = 0; k < n; k++) {
						vertical |= parseColumnSpec(repeated, alignments);
					}
					i = repeatEnd - 1;
				}
				default -> {
				}
			}
			i++;
		}
		return vertical;
	}

	private static int skipBraced(String spec, int from) {
		int i = from;
		while (i < spec.length() && spec.charAt(i) == ' ') {
			i++;
		}
		if (i >= spec.length() || spec.charAt(i) != '{') {
			return i;
		}
		int depth = 0;
		while (i < spec.length()) {
			char ch = spec.charAt(i);
			if (ch == '{') {
				depth++;
			} else if (ch == '}') {
				depth--;
				if (depth == 0) {
					return i + 1;
				}
			}
			i++;
		}
		return i;
	}

	private static String inner(String spec, int from, int to) {
		String part = spec.substring(from, to).trim();
		if (part.startsWith("{") && part.endsWith("}")) {
			return part.substring(1, part.length() - 1);
		}
		return part;
	}

	private static void splitRows(List<TexToken> body, List<List<List<TexToken>>> rows, List<TableRule> rules,
			List<String> rowFills) {
		TexCursor c = new TexCursor(body);
		List<List<TexToken>> cells = new ArrayList<>();
		List<TexToken> cell = new ArrayList<>();
		String rowFill = null;
		while (!c.atEnd()) {
			TexToken t = c.next();
			if (t.type() == TexTokenType.BEGIN_GROUP) {
				int start = c.position() - 1;
				c.reset(start);
				c.readGroup();
				cell.addAll(c.slice(start, c.position()));
				continue;
			}
			boolean rowStart = cells.isEmpty() && TexTokens.trim(cell).isEmpty();
			if (t.type() == TexTokenType.ALIGN_TAB) {
				cells.add(cell);
				cell = new ArrayList<>();
			} else if (t.isCs("\\") || t.isCs("tabularnewline")) {
				c.readStar();
				c.readOptional();
				cells.add(cell);
				rows.add(cells);
				rowFills.add(rowFill);
				cells = new ArrayList<>();
				cell = new ArrayList<>();
				rowFill = null;
			} else if (rowStart && t.type() == TexTokenType.CONTROL_SEQ && isRule(t.text())) {
				rules.add(readRule(t.text(), c, rows.size()));
			} else if (rowStart && t.isCs("rowcolor")) {
				c.readOptional();
				rowFill = c.readText();
			} else if (rowStart && (t.isCs("endhead") || t.isCs("endfirsthead") || t.isCs("endfoot")
					|| t.isCs("endlastfoot"))) {
				continue;
			} else {
				cell.add(t);
			}
		}
		if (!cells.isEmpty() || !TexTokens.trim(cell).isEmpty()) {
			cells.add(cell);
			rows.add(cells);
			rowFills.add(rowFill);
		}
	}

	private static boolean isRule(String name) {
		return name.equals("hline") || name.equals("toprule") || name.equals("midrule") || name.equals("bottomrule")
				|| name.equals("cline") || name.equals("cmidrule");
	}

	private static TableRule readRule(String name, TexCursor c, int beforeRow) {
		return switch (name) {
			case "toprule" -> {
				c.readOptional();
				yield TableRule.full(beforeRow, TableRule.Kind.TOP);
			}
			case "midrule" -> {
				c.readOptional();
				yield TableRule.full(beforeRow, TableRule.Kind.MID);
			}
			case "bottomrule" -> {
				c.readOptional();
				yield TableRule.full(beforeRow, TableRule.Kind.BOTTOM);
			}
			case "cline" -> partialRule(c.readText(), beforeRow, TableRule.Kind.PLAIN);
			case "cmidrule" -> {
				c.readOptional();
				c.skipSpaces();
				if (!c.atEnd() && c.peek().isChar('(')) {
					while (!c.atEnd() && !c.next().isChar(')')) {
						// trim spec such as (lr)
					}
				}
				yield partialRule(c.readText(), beforeRow, TableRule.Kind.MID);
			}
			default -> TableRule.full(beforeRow, TableRule.Kind.PLAIN);
		};
	}

	private static TableRule partialRule(String range, int beforeRow, TableRule.Kind kind) {
		if (range == null) {
			return TableRule.full(beforeRow, kind);
		}
		String[] parts = range.split("-");
		try {
			int from = Integer.parseInt(parts[0].trim()) - 1;
			int to = parts.length > 1 ? Integer.parseInt(parts[1].trim()) - 1 : from;
			return new TableRule(beforeRow, kind, from, to);
		} catch (NumberFormatException e) {
			return TableRule.full(beforeRow, kind);
		}
	}

	private static int spanOf(List<TexToken> raw) {
		TexCursor c = new TexCursor(TexTokens.trim(raw));
		c.skipBlank();
		if (!c.atEnd() && c.peek().isCs("multicolumn")) {
			c.next();
			String n = c.readText();
			try {
				return Math.max(1, Integer.parseInt(n == null ? "1" : n.trim()));
			} catch (NumberFormatException e) {
				return 1;
			}
		}
		return 1;
	}

	private TableCell parseCell(List<TexToken> raw, List<CellAlign> alignments, int column, String rowFill) {
		int colspan = 1;
		int rowspan = 1;
		CellAlign align = null;
		String fill = rowFill;
		List<TexToken> content = new ArrayList<>(TexTokens.trim(raw));
		boolean changed = true;
		while (changed) {
			changed = false;
			TexCursor c = new TexCursor(content);
			c.skipBlank();
			if (c.atEnd() || c.peek().type() != TexTokenType.CONTROL_SEQ) {
				break;
			}
			String name = c.next().text();
			if (name.equals("multicolumn")) {
				colspan = parseInt(c.readText(), 1);
				List<CellAlign> spec = new ArrayList<>();
				String specText = c.readText();
				parseColumnSpec(specText == null ? "" : specText, spec);
				CellAlign spanAlign = spec.isEmpty() ? null : spec.get(0);
				CellAlign columnAlign = column < alignments.size() ? alignments.get(column) : null;
				align = spanAlign == columnAlign ? align : spanAlign;
				List<TexToken> inner = c.readArgument();
				content = new ArrayList<>(TexTokens.trim(inner == null ? List.of() : inner));
				changed = true;
			} else if (name.equals("multirow")) {
				c.readOptional();
				rowspan = parseInt(c.readText(), 1);
				c.readOptional();
				c.readArgument();
				c.readOptional();
				List<TexToken> inner = c.readArgument();
				content = new ArrayList<>(TexTokens.trim(inner == null ? List.of() : inner));
				changed = true;
			} else if (name.equals("cellcolor")) {
				c.readOptional();
				fill = c.readText();
				content = new ArrayList<>(TexTokens.trim(c.rest()));
				changed = true;
			}
		}
		List<DocNode> nodes = inline.apply(content);
		if (nodes.size() == 1 && nodes.get(0) instanceof Text text && text.text().isBlank()) {
			nodes = List.of();
		}
		return new TableCell(nodes, Math.max(1, colspan), Math.max(1, rowspan), align, fill);
	}

	private static int parseInt(String text, int fallback) {
		if (text == null) {
			return fallback;
		}
		try {
			return Integer.parseInt(text.trim());
		} catch (NumberFormatException e) {
			return fallback;
		}
	}

	static BorderStyle borderStyle(List<TableRule> rules, boolean verticalLines, int rowCount) {
		boolean booktabs = rules.stream().anyMatch(r -> r.kind() != TableRule.Kind.PLAIN);
		if (booktabs) {
			return verticalLines ? BorderStyle.CUSTOM : BorderStyle.RULED;
		}
		if (rules.isEmpty() && !verticalLines) {
			return BorderStyle.NONE;
		}
		if (verticalLines) {
			boolean[] ruled = new boolean[rowCount + 1];
			for (TableRule rule : rules) {
				if (!rule.isPartial() && rule.beforeRow() <= rowCount) {
					ruled[rule.beforeRow()] = true;
				}
			}
			boolean all = true;
			for (boolean b : ruled) {
				all &= b;
			}
			if (all) {
				return BorderStyle.GRID;
			}
		}
		return BorderStyle.CUSTOM;
	}
}
