package markbridge.parse.latex;

import markbridge.ast.doc.Bibliography;
import markbridge.ast.doc.BlockMath;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.DocNodes;
import markbridge.ast.doc.Document;
import markbridge.ast.doc.Figure;
import markbridge.ast.doc.Heading;
import markbridge.ast.doc.Image;
import markbridge.ast.doc.LossMarker;
import markbridge.ast.doc.Paragraph;
import markbridge.ast.doc.Reference;
import markbridge.ast.doc.Strong;
import markbridge.loss.LossKind;
import markbridge.loss.LossTracker;
import markbridge.parse.ParseResult;
import markbridge.transform.SymbolTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LatexParserTest {
	private final LossTracker tracker = new LossTracker();

	private Document parse(String source) {
		ParseResult result = new LatexParser(SymbolTable.standard(), tracker).parse(source);
		assertFalse(result.hasErrors(), result.errors().toString());
		return result.document();
	}

	@Test
	void readsFigureWithImageCaptionAndLabel() {
		Document doc = parse("\\begin{figure}[h]\n\\centering\n\\includegraphics[width=0.5\\textwidth]{cat.png}\n"
				+ "\\caption{A cat}\\label{fig:cat}\n\\end{figure}\n");

		Figure figure = assertInstanceOf(Figure.class, doc.children().get(0));
		assertEquals("fig:cat", figure.label());
		assertFalse(figure.isTable());
		assertEquals("A cat", DocNodes.plainText(figure.caption()));
		assertEquals(List.of(new Image("cat.png", "50%")), figure.body());
	}

	@Test
	void equationEnvironmentsCarryLabelAndNumbering() {
		Document doc = parse("\\begin{equation}\\label{eq:e}\nE = mc^2\n\\end{equation}\n\n"
				+ "\\begin{equation*}\nx\n\\end{equation*}\n");

		BlockMath numbered = assertInstanceOf(BlockMath.class, doc.children().get(0));
		assertEquals("eq:e", numbered.label());
		assertTrue(numbered.numbered());
		BlockMath plain = assertInstanceOf(BlockMath.class, doc.children().get(1));
		assertNull(plain.label());
		assertFalse(plain.numbered());
	}

	@Test
	void splitsCitationKeys() {
		Paragraph p = assertInstanceOf(Paragraph.class, parse("See \\cite[p.~3]{knuth, lamport}.").children().get(0));

		Reference cite = (Reference) p.content().stream().filter(n -> n instanceof Reference).findFirst().orElseThrow();
		assertEquals(Reference.Kind.CITE, cite.kind());
		assertEquals(List.of("knuth", "lamport"), cite.keys());
	}

	@Test
	void bibliographyTakesPrecedingStyle() {
		Document doc = parse("\\bibliographystyle{plain}\n\\bibliography{refs}\n");

		Bibliography bib = (Bibliography) find(doc.children(), Bibliography.class);
		assertEquals("refs", bib.source());
		assertEquals("plain", bib.style());
	}

	@Test
	void sectionStarIsUnnumbered() {
		Heading h = assertInstanceOf(Heading.class, parse("\\subsection*{Notes}").children().get(0));

		assertEquals(2, h.level());
		assertFalse(h.numbered());
		assertEquals("Notes", DocNodes.plainText(h.content()));
	}

	@Test
	void theoremBecomesBoldLeadIn() {
		Paragraph p = assertInstanceOf(Paragraph.class,
				parse("\\begin{theorem}[Euclid]\nThere are infinitely many primes.\n\\end{theorem}\n").children()
						.get(0));

		Strong lead = assertInstanceOf(Strong.class, p.content().get(0));
		assertEquals("Theorem (Euclid).", DocNodes.plainText(lead.content()));
		assertTrue(DocNodes.plainText(p.content()).contains("infinitely many primes"));
	}

	@Test
	void unknownEnvironmentKeepsBodyBehindMarker() {
		Document doc = parse("\\begin{mybox}\nInside.\n\\end{mybox}\n");

		assertEquals(1, tracker.losses().size());
		assertEquals(LossKind.UNKNOWN_ENVIRONMENT, tracker.losses().get(0).kind());
		LossMarker marker = (LossMarker) find(doc.children(), LossMarker.class);
		assertEquals("\\begin{mybox}", marker.snippet());
		assertTrue(DocNodes.plainText(doc.children()).contains("Inside."));
	}

	@Test
	void rereadsLossMarkerComments() {
		Document doc = parse("Text % mb:loss:L0003 \\weird{x}\nmore\n");

		LossMarker marker = (LossMarker) find(doc.children(), LossMarker.class);
		assertEquals("L0003", marker.lossId());
		assertEquals("\\weird{x}", marker.snippet());
	}

	@Test
	void unbalancedBraceIsReported() {
		ParseResult result = new LatexParser(SymbolTable.standard(), tracker).parse("a { b\n");

		assertTrue(result.hasErrors());
	}

	private static DocNode find(List<DocNode> nodes, Class<?> type) {
		for (DocNode node : nodes) {
			if (type.isInstance(node)) {
				return node;
			}
			DocNode nested = find(DocNodes.children(node), type);
			if (nested != null) {
				return nested;
			}
		}
		return null;
	}
}
