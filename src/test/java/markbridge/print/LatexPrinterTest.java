package markbridge.print;

import markbridge.ast.Language;
import markbridge.ast.doc.BibEntry;
import markbridge.ast.doc.BlockMath;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.Document;
import markbridge.ast.doc.Emph;
import markbridge.ast.doc.Figure;
import markbridge.ast.doc.Heading;
import markbridge.ast.doc.Image;
import markbridge.ast.doc.Link;
import markbridge.ast.doc.ListBlock;
import markbridge.ast.doc.ListItem;
import markbridge.ast.doc.LossMarker;
import markbridge.ast.doc.Paragraph;
import markbridge.ast.doc.Raw;
import markbridge.ast.doc.Reference;
import markbridge.ast.doc.Text;
import markbridge.ast.math.MathAtom;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LatexPrinterTest {
	private static Document doc(DocNode... blocks) {
		return new Document(List.of(blocks));
	}

	private static Paragraph para(DocNode... inline) {
		return new Paragraph(List.of(inline));
	}

	@Test
	void printsHeadingsListsAndInlineMarkup() {
		Document document = doc(
				new Heading(1, List.of(new Text("Intro")), "sec:intro", true),
				new Heading(2, List.of(new Text("Aside")), null, false),
				para(new Text("Some "), new Emph(List.of(new Text("stress"))), new Text(" and 50% & more_")),
				new ListBlock(true, List.of(new ListItem(List.of(new Text("one"))),
						new ListItem(List.of(new Text("two"))))));

		assertEquals("\\section{Intro}\\label{sec:intro}\n\n\\subsection*{Aside}\n\n"
				+ "Some \\emph{stress} and 50\\% \\& more\\_\n\n"
				+ "\\begin{enumerate}\n  \\item one\n  \\item two\n\\end{enumerate}\n",
				new LatexPrinter(true, false).print(document));
	}

	@Test
	void separatesControlWordFromFollowingLetter() {
		Document document = doc(para(new Raw("\\LaTeX", Language.LATEX), new Text("rocks")));

		assertEquals("\\LaTeX{}rocks\n", new LatexPrinter(true, false).print(document));
	}

	@Test
	void lossMarkerIsALineComment() {
		Document document = doc(para(new Text("a "), new LossMarker("L0001", "#foo()\nbar"), new Text("b")));

		assertEquals("a % mb:loss:L0001 #foo()\n% bar\nb\n", new LatexPrinter(true, false).print(document));
		assertEquals("a b\n", new LatexPrinter(false, false).print(document));
	}

	@Test
	void numberedOrLabelledMathUsesEquation() {
		assertEquals("\\begin{equation}\\label{eq:a}\nx\n\\end{equation}\n",
				new LatexPrinter(true, false).print(doc(new BlockMath(new MathAtom("x"), "eq:a", true))));
		assertEquals("\\[\nx\n\\]\n",
				new LatexPrinter(true, false).print(doc(new BlockMath(new MathAtom("x"), null, false))));
	}

	@Test
	void printsFigureWithRelativeWidth() {
		Figure figure = new Figure(List.of(new Image("plot.png", "80%")), List.of(new Text("A plot")), "fig:plot",
				false);

		assertEquals("\\begin{figure}[h]\n\\centering\n\\includegraphics[width=0.8\\textwidth]{plot.png}\n"
				+ "\\caption{A plot}\n\\label{fig:plot}\n\\end{figure}\n",
				new LatexPrinter(true, false).print(doc(figure)));
	}

	@Test
	void printsLinksAndReferences() {
		Document document = doc(para(new Link("https://x.org/a#b", List.of(new Text("https://x.org/a#b"))),
				new Text(" "), new Link("https://y.org", List.of(new Text("site"))), new Text(" "),
				new Reference(Reference.Kind.CITE, List.of("a", "b")), new Text(" "),
				new Reference(Reference.Kind.REF, List.of("fig:plot"))));

		assertEquals("\\url{https://x.org/a\\#b} \\href{https://y.org}{site} \\cite{a,b} \\ref{fig:plot}\n",
				new LatexPrinter(true, false).print(document));
	}

	@Test
	void bibliographyEntriesFormOneEnvironment() {
		Document document = doc(new BibEntry("knuth", List.of(new Text("The Art."))),
				new BibEntry("lamport", List.of(new Text("LaTeX."))));

		String out = new LatexPrinter(true, false).print(document);
		assertEquals("\\begin{thebibliography}{2}\n\\bibitem{knuth} The Art.\n\\bibitem{lamport} LaTeX.\n"
				+ "\\end{thebibliography}\n", out);
	}

	@Test
	void wrapperLoadsPackagesTheOutputUses() {
		String out = new LatexPrinter(true, true).print(doc(para(new Text("x"))));

		assertTrue(out.contains("\\usepackage{booktabs}"), out);
		assertTrue(out.contains("\\usepackage[table]{xcolor}"), out);
		assertTrue(out.contains("\\begin{document}\n\nx\n\n\\end{document}\n"), out);
	}
}
