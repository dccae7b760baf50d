package markbridge.parse.typst;

import markbridge.ast.doc.BlockMath;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.DocNodes;
import markbridge.ast.doc.Document;
import markbridge.ast.doc.Figure;
import markbridge.ast.doc.Heading;
import markbridge.ast.doc.Image;
import markbridge.ast.doc.ListBlock;
import markbridge.ast.doc.LossMarker;
import markbridge.ast.doc.Paragraph;
import markbridge.ast.doc.Reference;
import markbridge.eval.MiniEvaluator;
import markbridge.loss.LossTracker;
import markbridge.parse.ParseResult;
import markbridge.transform.SymbolTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TypstParserTest {
	private final LossTracker tracker = new LossTracker();

	private Document parse(String source) {
		ParseResult result = new TypstParser(SymbolTable.standard()).parse(source);
		assertFalse(result.hasErrors(), result.errors().toString());
		return new MiniEvaluator(tracker, 1000, 64).evaluate(result.document());
	}

	@Test
	void headingTakesFollowingLabel() {
		Heading h = assertInstanceOf(Heading.class, parse("== Methods <sec:m>\n").children().get(0));

		assertEquals(2, h.level());
		assertEquals("sec:m", h.label());
		assertEquals("Methods", DocNodes.plainText(h.content()));
	}

	@Test
	void displayMathTakesFollowingLabel() {
		BlockMath m = assertInstanceOf(BlockMath.class, parse("$ a + b $ <eq:sum>\n").children().get(0));

		assertEquals("eq:sum", m.label());
		assertTrue(m.numbered());
	}

	@Test
	void figureCallBecomesFigureNode() {
		Document doc = parse("#figure(image(\"cat.png\", width: 50%), caption: [A cat]) <fig:cat>\n");

		Figure figure = assertInstanceOf(Figure.class, doc.children().get(0));
		assertEquals("fig:cat", figure.label());
		assertEquals("A cat", DocNodes.plainText(figure.caption()));
		assertEquals(List.of(new Image("cat.png", "50%")), figure.body());
	}

	@Test
	void referenceWithoutLabelIsCitationWhenBibliographyExists() {
		Document doc = parse("= Intro <intro>\n\nSee @intro and @knuth.\n\n#bibliography(\"refs.bib\")\n");

		Paragraph p = assertInstanceOf(Paragraph.class, doc.children().get(1));
		List<Reference> refs = p.content().stream().filter(n -> n instanceof Reference).map(n -> (Reference) n)
				.toList();
		assertEquals(2, refs.size());
		assertEquals(Reference.Kind.REF, refs.get(0).kind());
		assertEquals(Reference.Kind.CITE, refs.get(1).kind());
		assertEquals("knuth", refs.get(1).key());
	}

	@Test
	void adjacentListItemsFormOneList() {
		ListBlock list = assertInstanceOf(ListBlock.class, parse("+ one\n+ two\n+ three\n").children().get(0));

		assertTrue(list.ordered());
		assertEquals(3, list.items().size());
	}

	@Test
	void rereadsLossMarkerComments() {
		Document doc = parse("Text /* mb:loss:L0004 \\weird{x} */ more\n");

		LossMarker marker = (LossMarker) find(doc.children());
		assertEquals("L0004", marker.lossId());
		assertEquals("\\weird{x}", marker.snippet());
		assertTrue(tracker.losses().isEmpty());
	}

	@Test
	void unclosedContentBlockIsAnError() {
		ParseResult result = new TypstParser(SymbolTable.standard()).parse("#strong[never closed\n");

		assertTrue(result.hasErrors());
	}

	private static DocNode find(List<DocNode> nodes) {
		for (DocNode node : nodes) {
			if (node instanceof LossMarker) {
				return node;
			}
			DocNode nested = find(DocNodes.children(node));
			if (nested != null) {
				return nested;
			}
		}
		return null;
	}
}
