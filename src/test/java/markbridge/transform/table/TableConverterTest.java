package markbridge.transform.table;

import markbridge.ConversionOptions;
import markbridge.ConversionResult;
import markbridge.Converter;
import markbridge.Direction;
import markbridge.ast.doc.BorderStyle;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.DocNodes;
import markbridge.ast.doc.Document;
import markbridge.ast.doc.TableCell;
import markbridge.ast.doc.TableGrid;
import markbridge.ast.doc.TableNode;
import markbridge.eval.MiniEvaluator;
import markbridge.loss.LossKind;
import markbridge.loss.LossTracker;
import markbridge.parse.ParseResult;
import markbridge.parse.typst.TypstParser;
import markbridge.transform.SymbolTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TableConverterTest {
	private static final String BOOKTABS = """
			\\begin{tabular}{lll}
			\\toprule
			\\multicolumn{2}{c}{AB} & C \\\\
			\\midrule
			1 & 2 & 3 \\\\
			4 & 5 & 6 \\\\
			\\bottomrule
			\\end{tabular}
			""";

	private final Converter converter = new Converter();

	@Test
	void spanningCellAndRuledBordersSurviveIntoTypst() {
		ConversionResult result = converter.convert(BOOKTABS, Direction.LATEX_TO_TYPST, ConversionOptions.defaults());

		assertTrue(result.outputText().contains("table.cell(colspan: 2, align: center)[AB]"), result.outputText());
		assertTrue(result.outputText().contains("stroke: none"), result.outputText());
		assertEquals(new TableCoverage.Counts(1, 0), result.tableCoverage().get(TableIdiom.SPAN));
		assertEquals(new TableCoverage.Counts(1, 0), result.tableCoverage().get(TableIdiom.RULED_BORDER));
		assertTrue(result.lossReport().losses().isEmpty(), result.lossReport().toString());

		TableGrid grid = reparseTypst(result.outputText());
		assertEquals(3, grid.columns());
		assertEquals(3, grid.rows().size());
		assertEquals(BorderStyle.RULED, grid.border());
		List<TableCell> first = grid.rows().get(0).cells();
		assertEquals(2, first.size());
		assertEquals(2, first.get(0).colspan());
		assertEquals("AB", DocNodes.plainText(first.get(0).content()).strip());
		assertEquals(3, grid.rows().get(2).cells().size());
	}

	@Test
	void typstRulesBecomeBooktabsRules() {
		String source = "#table(columns: 3, stroke: none, table.hline(), table.cell(colspan: 2)[AB], [C],"
				+ " table.hline(), [1], [2], [3], table.hline())\n";
		ConversionResult result = converter.convert(source, Direction.TYPST_TO_LATEX, ConversionOptions.defaults());

		String out = result.outputText();
		assertTrue(out.contains("\\toprule"), out);
		assertTrue(out.contains("\\midrule"), out);
		assertTrue(out.contains("\\bottomrule"), out);
		assertTrue(out.contains("\\multicolumn{2}{l}{AB} & C \\\\"), out);
		assertEquals(new TableCoverage.Counts(1, 0), result.tableCoverage().get(TableIdiom.SPAN));
		assertEquals(new TableCoverage.Counts(1, 0), result.tableCoverage().get(TableIdiom.RULED_BORDER));
	}

	@Test
	void namedFillMapsToCellColor() {
		String source = "#table(columns: 2, table.cell(fill: aqua)[a], [b])\n";
		ConversionResult result = converter.convert(source, Direction.TYPST_TO_LATEX, ConversionOptions.defaults());

		assertTrue(result.outputText().contains("\\cellcolor{cyan} a"), result.outputText());
		assertEquals(new TableCoverage.Counts(1, 0), result.tableCoverage().get(TableIdiom.FILL));
		assertEquals(new TableCoverage.Counts(1, 0), result.tableCoverage().get(TableIdiom.GRID_BORDER));
		assertTrue(result.lossReport().losses().isEmpty(), result.lossReport().toString());
	}

	@Test
	void unmappableFillIsDroppedWithApproximationLoss() {
		String source = "\\begin{tabular}{|l|l|}\n\\hline\n\\cellcolor{red!50!blue} a & b \\\\\n\\hline\n"
				+ "\\end{tabular}\n";
		ConversionResult result = converter.convert(source, Direction.LATEX_TO_TYPST, ConversionOptions.defaults());

		assertEquals(1, result.lossReport().count(LossKind.TABLE_APPROXIMATION));
		assertEquals(new TableCoverage.Counts(0, 1), result.tableCoverage().get(TableIdiom.FILL));
		assertFalse(result.outputText().contains("fill:"), result.outputText());
		assertTrue(result.outputText().contains("mb:loss:L0001 red!50!blue"), result.outputText());
	}

	private static TableGrid reparseTypst(String text) {
		ParseResult parsed = new TypstParser(SymbolTable.standard()).parse(text);
		assertFalse(parsed.hasErrors(), parsed.errors().toString());
		Document evaluated = new MiniEvaluator(new LossTracker(), 1000, 64).evaluate(parsed.document());
		TableNode table = findTable(evaluated.children());
		assertNotNull(table, "no table in " + evaluated);
		return table.grid();
	}

	private static TableNode findTable(List<DocNode> nodes) {
		for (DocNode node : nodes) {
			if (node instanceof TableNode t) {
				return t;
			}
			TableNode nested = findTable(DocNodes.children(node));
			if (nested != null) {
				return nested;
			}
		}
		return null;
	}
}
