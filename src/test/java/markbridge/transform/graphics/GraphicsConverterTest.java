package markbridge.transform.graphics;

import markbridge.ConversionOptions;
import markbridge.ConversionResult;
import markbridge.Converter;
import markbridge.Direction;
import markbridge.ast.Language;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.Graphic;
import markbridge.ast.doc.LossMarker;
import markbridge.loss.LossKind;
import markbridge.loss.LossTracker;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GraphicsConverterTest {
	private final LossTracker tracker = new LossTracker();
	private final GraphicsConverter graphics = new GraphicsConverter(tracker);

	@Test
	void straightTikzLineBecomesCetzLine() {
		List<DocNode> out = graphics.convert(new Graphic("\\draw (0,0) -- (1,1);", Language.LATEX, null),
				Direction.LATEX_TO_TYPST);

		assertEquals(1, out.size());
		Graphic converted = assertInstanceOf(Graphic.class, out.get(0));
		assertEquals(Language.TYPST, converted.language());
		assertTrue(converted.source().contains("line((0, 0), (1, 1))"), converted.source());
		assertTrue(tracker.losses().isEmpty());
	}

	@Test
	void unknownTikzStatementIsSkippedWithOneLoss() {
		List<DocNode> out = graphics.convert(
				new Graphic("\\draw (0,0) -- (2,0);\n\\shade (0,0) circle (1);", Language.LATEX, null),
				Direction.LATEX_TO_TYPST);

		assertEquals(1, tracker.losses().size());
		assertEquals(LossKind.UNSUPPORTED_GRAPHICS, tracker.losses().get(0).kind());
		assertInstanceOf(LossMarker.class, out.get(0));
		Graphic converted = assertInstanceOf(Graphic.class, out.get(out.size() - 1));
		assertTrue(converted.source().contains("line((0, 0), (2, 0))"), converted.source());
	}

	@Test
	void cetzLineBecomesTikzDraw() {
		List<DocNode> out = graphics.convert(
				new Graphic("import cetz.draw: *\nline((0, 0), (1, 1))", Language.TYPST, null),
				Direction.TYPST_TO_LATEX);

		Graphic converted = assertInstanceOf(Graphic.class, out.get(out.size() - 1));
		assertEquals(Language.LATEX, converted.language());
		assertTrue(converted.source().contains("\\draw (0,0) -- (1,1);"), converted.source());
		assertTrue(tracker.losses().isEmpty());
	}

	@Test
	void tikzPictureInDocumentImportsCetz() {
		String source = "\\begin{tikzpicture}\n\\draw (0,0) -- (1,1);\n\\end{tikzpicture}\n";
		ConversionResult result = new Converter().convert(source, Direction.LATEX_TO_TYPST,
				ConversionOptions.defaults());

		String out = result.outputText();
		assertTrue(out.startsWith("#import \"@preview/cetz:0.2.2\""), out);
		assertTrue(out.contains("#cetz.canvas({"), out);
		assertTrue(out.contains("line((0, 0), (1, 1))"), out);
		assertTrue(result.lossReport().losses().isEmpty(), result.lossReport().toString());
	}
}
