package markbridge;

import markbridge.loss.LossKind;
import markbridge.loss.LossRecord;
import markbridge.parse.SourceParseException;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConverterTest {
	private final Converter converter = new Converter();

	@Test
	void convertsFractionAndGreekLetterInMathOnlyMode() {
		ConversionOptions options = ConversionOptions.builder().mathOnly(true).build();
		ConversionResult result = converter.convert("\\frac{1}{2} + \\alpha", Direction.LATEX_TO_TYPST, options);

		assertEquals("1/2 + alpha", result.outputText().strip());
		assertTrue(result.lossReport().losses().isEmpty());
	}

	@Test
	void unrollsLoopOverLetBoundRangeIntoListItems() {
		String source = "#let n = 3\n#for i in range(n) [- Item #i]\n";
		ConversionResult result = converter.convert(source, Direction.TYPST_TO_LATEX, ConversionOptions.defaults());

		String out = result.outputText();
		assertTrue(out.contains("\\begin{itemize}"), out);
		assertTrue(out.contains("\\item Item 0"), out);
		assertTrue(out.contains("\\item Item 1"), out);
		assertTrue(out.contains("\\item Item 2"), out);
		assertFalse(out.contains("Item 3"), out);
		assertEquals(1, out.split("\\\\begin\\{itemize\\}", -1).length - 1, out);
		assertTrue(result.lossReport().losses().isEmpty(), result.lossReport().toString());
		assertEquals(3, result.metrics().listItems());
	}

	@Test
	void keepsUnknownMathCommandAsPassthroughWithOneLoss() {
		ConversionResult result = converter.convert("Value $\\unknowncmd{a}$ here.", Direction.LATEX_TO_TYPST,
				ConversionOptions.defaults());

		assertEquals(1, result.lossReport().losses().size());
		LossRecord loss = result.lossReport().losses().get(0);
		assertEquals(LossKind.UNKNOWN_COMMAND, loss.kind());
		assertEquals("L0001", loss.id());
		assertTrue(result.outputText().contains("mb:loss:L0001"), result.outputText());
		assertEquals(1, result.metrics().lossMarkers());
	}

	@Test
	void keepsProceduralCodeBlockAsCommentWithOneCodeBlockLoss() {
		String source = "Before.\n\n#{ let xs = (1, 2, 3).map(x => x * 2) }\n\nAfter.\n";
		ConversionResult result = converter.convert(source, Direction.TYPST_TO_LATEX, ConversionOptions.defaults());

		assertEquals(1, result.lossReport().losses().size());
		assertEquals(LossKind.CODE_BLOCK, result.lossReport().losses().get(0).kind());
		String out = result.outputText();
		assertTrue(out.contains("% mb:loss:L0001 #{ let xs = (1, 2, 3).map(x => x * 2) }"), out);
		assertTrue(out.indexOf("Before.") < out.indexOf("mb:loss") && out.indexOf("mb:loss") < out.indexOf("After."),
				out);
	}

	@Test
	void sameInputGivesSameOutput() {
		String source = "\\section{A}\\newcommand{\\x}{y}\\x $\\frac{a}{b}$ \\foo\n";
		ConversionResult first = converter.convert(source, Direction.LATEX_TO_TYPST, ConversionOptions.defaults());
		ConversionResult second = converter.convert(source, Direction.LATEX_TO_TYPST, ConversionOptions.defaults());

		assertEquals(first.outputText(), second.outputText());
		assertEquals(first.lossReport(), second.lossReport());
		assertEquals(first.metrics(), second.metrics());
	}

	@Test
	void lossCommentsCanBeSwitchedOff() {
		ConversionOptions options = ConversionOptions.builder().lossComments(false).build();
		ConversionResult result = converter.convert("Text \\foo here.", Direction.LATEX_TO_TYPST, options);

		assertFalse(result.outputText().contains("mb:loss"), result.outputText());
		assertEquals(1, result.lossReport().count(LossKind.UNKNOWN_COMMAND));
	}

	@Test
	void disabledTablesBecomeUnsupportedFeatureMarkers() {
		String source = "\\begin{tabular}{ll}\na & b \\\\\n\\end{tabular}\n";
		ConversionOptions options = ConversionOptions.builder()
				.features(EnumSet.of(Feature.GRAPHICS, Feature.REFERENCES))
				.build();
		ConversionResult result = converter.convert(source, Direction.LATEX_TO_TYPST, options);

		assertEquals(1, result.lossReport().count(LossKind.UNSUPPORTED_FEATURE));
		assertFalse(result.outputText().contains("table("), result.outputText());
		assertTrue(result.tableCoverage().isEmpty());
	}

	@Test
	void disabledReferencesKeepTheirSourceInTheMarker() {
		ConversionOptions options = ConversionOptions.builder()
				.features(EnumSet.of(Feature.TABLES, Feature.GRAPHICS))
				.build();
		ConversionResult result = converter.convert("See \\ref{sec:a}.", Direction.LATEX_TO_TYPST, options);

		assertEquals(1, result.lossReport().count(LossKind.UNSUPPORTED_FEATURE));
		assertTrue(result.outputText().contains("\\ref{sec:a}"), result.outputText());
		assertFalse(result.outputText().contains("@sec:a"), result.outputText());
	}

	@Test
	void wrapsLatexOutputInDocumentWhenAsked() {
		ConversionOptions options = ConversionOptions.builder().documentWrapper(true).build();
		ConversionResult result = converter.convert("= Title\n\nBody text.\n", Direction.TYPST_TO_LATEX, options);

		String out = result.outputText();
		assertTrue(out.startsWith("\\documentclass{article}"), out);
		assertTrue(out.contains("\\begin{document}"), out);
		assertTrue(out.contains("\\section*{Title}"), out);
		assertTrue(out.strip().endsWith("\\end{document}"), out);
	}

	@Test
	void numberedTypstHeadingsBecomeNumberedSections() {
		String source = "#set heading(numbering: \"1.\")\n= Intro <intro>\n\nSee @intro.\n";
		ConversionResult result = converter.convert(source, Direction.TYPST_TO_LATEX, ConversionOptions.defaults());

		String out = result.outputText();
		assertTrue(out.contains("\\section{Intro}\\label{intro}") || out.contains("\\section{Intro}\n\\label{intro}"),
				out);
		assertTrue(out.contains("\\ref{intro}"), out);
		assertTrue(result.lossReport().losses().isEmpty(), result.lossReport().toString());
		assertEquals(1, result.metrics().headings());
		assertEquals(1, result.metrics().refs());
	}

	@Test
	void unclosedEnvironmentIsAParseError() {
		SourceParseException ex = assertThrows(SourceParseException.class,
				() -> converter.convert("\\begin{itemize}\n\\item a\n", Direction.LATEX_TO_TYPST,
						ConversionOptions.defaults()));
		assertTrue(ex.line() >= 1);
	}

	@Test
	void measureCountsStructureOfTypstText() {
		String text = "= A\n\n== B <b>\n\n- one\n- two\n\n$ x $\n";
		var metrics = converter.measure(text, markbridge.ast.Language.TYPST, ConversionOptions.defaults());

		assertEquals(2, metrics.headings());
		assertEquals(2, metrics.listItems());
		assertEquals(1, metrics.equations());
		assertEquals(1, metrics.labels());
		assertEquals(0, metrics.parseErrors());
	}

	@Test
	void typstPageAndTextSettingsBecomeClassOptionsGeometryAndFont() {
		String source = "#set page(paper: \"a4\", margin: 3cm)\n#set text(font: \"Times\", size: 12pt)\n\nHello.\n";
		ConversionOptions options = ConversionOptions.builder().documentWrapper(true).build();
		ConversionResult result = converter.convert(source, Direction.TYPST_TO_LATEX, options);

		String out = result.outputText();
		assertTrue(out.startsWith("\\documentclass[12pt,a4paper]{article}"), out);
		assertTrue(out.contains("\\usepackage[margin=3cm]{geometry}"), out);
		assertTrue(out.contains("\\setmainfont{Times}"), out);
		assertTrue(out.contains("Hello."), out);
		assertTrue(result.lossReport().isEmpty(), result.lossReport().toString());
	}

	@Test
	void pageSettingsWithoutDocumentWrapperAreReportedAsDropped() {
		String source = "#set page(paper: \"a4\", margin: 3cm)\n\nHello.\n";
		ConversionResult result = converter.convert(source, Direction.TYPST_TO_LATEX, ConversionOptions.defaults());

		assertEquals("Hello.", result.outputText().strip());
		assertTrue(result.lossReport().losses().isEmpty());
		assertEquals(1, result.lossReport().warnings().size(), result.lossReport().toString());
		assertTrue(result.lossReport().warnings().get(0).contains("paper a4"), result.lossReport().toString());
	}

	@Test
	void latexClassOptionsAndGeometryBecomeTypstSetRules() {
		String source = "\\documentclass[12pt,a4paper]{article}\n\\usepackage[margin=3cm]{geometry}\n"
				+ "\\begin{document}\nHello.\n\\end{document}\n";
		ConversionResult result = converter.convert(source, Direction.LATEX_TO_TYPST, ConversionOptions.defaults());

		String out = result.outputText();
		assertTrue(out.contains("#set page(paper: \"a4\", margin: 3cm)"), out);
		assertTrue(out.contains("#set text(size: 12pt)"), out);
		assertTrue(out.strip().endsWith("Hello."), out);
		assertTrue(result.lossReport().isEmpty(), result.lossReport().toString());
	}

	@Test
	void unknownPageKeysAreWarnedAbout() {
		String source = "#set page(flipped: true)\n\nHello.\n";
		ConversionResult result = converter.convert(source, Direction.TYPST_TO_LATEX, ConversionOptions.defaults());

		assertEquals("Hello.", result.outputText().strip());
		assertFalse(result.lossReport().warnings().isEmpty());
	}

	@Test
	void macroArgumentMismatchLeavesAMarkerInTheOutput() {
		String source = "\\newcommand{\\p}[2]{(#1,#2)}\nPair \\p{a} end.\n";
		ConversionResult result = converter.convert(source, Direction.LATEX_TO_TYPST, ConversionOptions.defaults());

		assertEquals(1, result.lossReport().count(LossKind.MACRO_ARGUMENT_MISMATCH));
		String out = result.outputText();
		assertTrue(out.contains("mb:loss:L0001"), out);
		assertTrue(out.contains("(a,)"), out);
		assertEquals(1, result.metrics().lossMarkers());
	}
}
