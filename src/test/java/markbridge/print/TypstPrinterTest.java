package markbridge.print;

import markbridge.ast.doc.BlockMath;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.Document;
import markbridge.ast.doc.Heading;
import markbridge.ast.doc.Link;
import markbridge.ast.doc.ListBlock;
import markbridge.ast.doc.ListItem;
import markbridge.ast.doc.LossMarker;
import markbridge.ast.doc.Paragraph;
import markbridge.ast.doc.Reference;
import markbridge.ast.doc.Strong;
import markbridge.ast.doc.Text;
import markbridge.ast.math.MathAtom;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TypstPrinterTest {
	private static Document doc(DocNode... blocks) {
		return new Document(List.of(blocks));
	}

	private static Paragraph para(DocNode... inline) {
		return new Paragraph(List.of(inline));
	}

	@Test
	void emptyDocumentPrintsNothing() {
		assertEquals("", new TypstPrinter(true).print(doc()));
	}

	@Test
	void numberedHeadingAddsSetRuleAndUnnumberedOneOptsOut() {
		Document document = doc(
				new Heading(1, List.of(new Text("Intro")), "sec:intro", true),
				new Heading(2, List.of(new Text("Aside")), null, false));

		assertEquals("#set heading(numbering: \"1.\")\n\n= Intro <sec:intro>\n\n"
				+ "#heading(level: 2, numbering: none)[Aside]\n", new TypstPrinter(true).print(document));
	}

	@Test
	void strongInsideWordUsesFunctionForm() {
		Document document = doc(para(new Text("un"), new Strong(List.of(new Text("bold"))), new Text("ly and "),
				new Strong(List.of(new Text("apart")))));

		assertEquals("un#strong[bold]ly and *apart*\n", new TypstPrinter(true).print(document));
	}

	@Test
	void escapesMarkupCharactersInText() {
		Document document = doc(para(new Text("a*b_c #d $e")), para(new Text("= not a heading")));

		assertEquals("a\\*b\\_c \\#d \\$e\n\n\\= not a heading\n", new TypstPrinter(true).print(document));
	}

	@Test
	void referenceBeforeLabelCharacterUsesRefFunction() {
		Document document = doc(para(new Text("See "), new Reference(Reference.Kind.REF, List.of("fig")),
				new Text(". And "), new Reference(Reference.Kind.REF, List.of("tab")), new Text(" too "),
				new Reference(Reference.Kind.CITE, List.of("knuth"))));

		assertEquals("See #ref(<fig>). And @tab too #cite(<knuth>)\n", new TypstPrinter(true).print(document));
	}

	@Test
	void printsNestedListsAndLinks() {
		ListBlock inner = new ListBlock(true, List.of(new ListItem(List.of(new Text("deep")))));
		ListBlock outer = new ListBlock(false, List.of(
				new ListItem(List.of(new Link("https://typst.app", List.of(new Text("https://typst.app"))))),
				new ListItem(List.of(para(new Text("with child")), inner))));

		assertEquals("- https://typst.app\n- with child\n  + deep\n", new TypstPrinter(true).print(doc(outer)));
	}

	@Test
	void lossMarkersAreCommentsUnlessSwitchedOff() {
		Document document = doc(para(new Text("a "), new LossMarker("L0001", "\\foo */ bar"), new Text(" b")));

		assertEquals("a /* mb:loss:L0001 \\foo * / bar */ b\n", new TypstPrinter(true).print(document));
		assertEquals("a  b\n", new TypstPrinter(false).print(document));
	}

	@Test
	void labelledEquationTurnsOnEquationNumbering() {
		Document document = doc(new BlockMath(new MathAtom("x"), "eq:x", true));

		assertEquals("#set math.equation(numbering: \"(1)\")\n\n$ x $ <eq:x>\n", new TypstPrinter(true).print(document));
	}
}
