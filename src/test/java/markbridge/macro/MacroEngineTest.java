package markbridge.macro;

import markbridge.loss.LossKind;
import markbridge.loss.LossTracker;
import markbridge.parse.latex.TexLexer;
import markbridge.parse.latex.TexToken;
import markbridge.parse.latex.TexTokens;
import markbridge.transform.SymbolTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MacroEngineTest {
	private final LossTracker tracker = new LossTracker();

	private String expand(String source, int maxDepth) {
		List<TexToken> tokens = new TexLexer().lex(source);
		MacroEngine engine = new MacroEngine(new CommandCatalog(SymbolTable.standard()), tracker, maxDepth);
		return TexTokens.detokenize(engine.expand(tokens));
	}

	private String expand(String source) {
		return expand(source, 64);
	}

	@Test
	void expandsParameterizedDefinitionAndDropsIt() {
		assertEquals("<a|b>", expand("\\newcommand{\\pair}[2]{<#1|#2>}\\pair{a}{b}"));
		assertTrue(tracker.losses().isEmpty());
	}

	@Test
	void laterDefinitionWins() {
		assertEquals("one two", expand("\\newcommand{\\x}{one}\\x\\renewcommand{\\x}{two} \\x"));
	}

	@Test
	void inFlightExpansionKeepsDefinitionItStartedWith() {
		assertEquals("oldnew", expand("\\newcommand{\\x}{\\renewcommand{\\x}{new}old}\\x\\x"));
		assertTrue(tracker.losses().isEmpty());
	}

	@Test
	void usesOptionalArgumentDefault() {
		assertEquals("[d:x][o:x]", expand("\\newcommand{\\opt}[2][d]{[#1:#2]}\\opt{x}\\opt[o]{x}"));
	}

	@Test
	void selfRecursiveMacroStopsWithOneLoss() {
		String out = expand("\\newcommand{\\rec}{a\\rec}\\rec", 8);

		assertEquals(1, tracker.losses().size());
		assertEquals(LossKind.MACRO_RECURSION_LIMIT, tracker.losses().get(0).kind());
		assertEquals("\\rec", out.strip());
	}

	@Test
	void resolvesIfmmodeFromSurroundingMode() {
		assertEquals("$M$ T", expand("\\newcommand{\\m}{\\ifmmode M\\else T\\fi}$\\m$ \\m"));
	}

	@Test
	void missingArgumentsAreBoundEmptyBehindAMarker() {
		assertEquals("% mb:loss:L0001 \\p\n(a,)", expand("\\newcommand{\\p}[2]{(#1,#2)}\\p{a}"));
		assertEquals(1, tracker.losses().size());
		assertEquals(LossKind.MACRO_ARGUMENT_MISMATCH, tracker.losses().get(0).kind());
	}

	@Test
	void unknownCommandIsRecordedOnceAndKeptInPlace() {
		List<TexToken> out = new MacroEngine(new CommandCatalog(SymbolTable.standard()), tracker, 64)
				.expand(new TexLexer().lex("a \\foo{b} c"));

		assertEquals(1, tracker.losses().size());
		assertEquals(LossKind.UNKNOWN_COMMAND, tracker.losses().get(0).kind());
		assertEquals("\\foo", tracker.losses().get(0).name());
		TexToken foo = out.stream().filter(t -> t.isCs("foo")).findFirst().orElse(null);
		assertNotNull(foo);
		assertEquals("L0001", foo.lossId());
	}

	@Test
	void knownCommandsAreNotReported() {
		expand("\\section{A} \\textbf{b} \\emph{c} $\\alpha + \\frac{1}{2}$");
		assertTrue(tracker.losses().isEmpty(), tracker.losses().toString());
	}
}
