package markbridge.eval;

import markbridge.ast.doc.DocNodes;
import markbridge.ast.doc.Document;
import markbridge.ast.doc.Opaque;
import markbridge.loss.LossKind;
import markbridge.loss.LossTracker;
import markbridge.parse.typst.TypstParser;
import markbridge.transform.SymbolTable;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MiniEvaluatorTest {
	private final LossTracker tracker = new LossTracker();

	private Document evaluate(String source, int maxLoopIterations, int maxCallDepth) {
		Document raw = new TypstParser(SymbolTable.standard()).parse(source).orThrow(source);
		return new MiniEvaluator(tracker, maxLoopIterations, maxCallDepth).evaluate(raw);
	}

	private Document evaluate(String source) {
		return evaluate(source, 1000, 64);
	}

	private static String text(Document document) {
		return DocNodes.plainText(document.children());
	}

	@Test
	void loopPastIterationLimitIsTruncatedWithOneLoss() {
		Document doc = evaluate("#for i in range(1000) [x]\n", 100, 64);

		long xs = text(doc).chars().filter(ch -> ch == 'x').count();
		assertEquals(100, xs);
		assertEquals(1, tracker.losses().size());
		assertEquals(LossKind.LOOP_BOUND_EXCEEDED, tracker.losses().get(0).kind());
	}

	@Test
	void callsUserFunctionWithArgument() {
		Document doc = evaluate("#let greet(name) = [Hello #name!]\n#greet(\"World\")\n");

		assertEquals("Hello World!", text(doc).strip());
		assertTrue(tracker.losses().isEmpty());
	}

	@Test
	void takesBranchOfResolvableConditional() {
		Document doc = evaluate("#let x = 2\n#if x > 1 [big] else [small]\n");

		assertEquals("big", text(doc).strip());
		assertTrue(tracker.losses().isEmpty());
	}

	@Test
	void unresolvableConditionStaysOpaque() {
		Document doc = evaluate("#if mystery() [a] else [b]\n");

		assertEquals(1, tracker.losses().size());
		assertEquals(LossKind.UNRESOLVED_CONDITIONAL, tracker.losses().get(0).kind());
		Opaque opaque = (Opaque) doc.children().stream().filter(n -> n instanceof Opaque).findFirst().orElse(null);
		assertNotNull(opaque);
		assertEquals(tracker.losses().get(0).id(), opaque.lossId());
		assertTrue(opaque.source().startsWith("#if mystery()"), opaque.source());
	}

	@Test
	void runawayRecursionStopsAtCallDepth() {
		evaluate("#let f(n) = f(n + 1)\n#f(0)\n", 1000, 8);

		assertEquals(1, tracker.losses().size());
		assertEquals(LossKind.UNSUPPORTED_EXPRESSION, tracker.losses().get(0).kind());
	}

	@Test
	void stringBuiltinsAndArithmeticResolve() {
		Document doc = evaluate("#let n = 2 * 3 + 1\n#upper(\"ab\") #str(n)\n");

		assertEquals("AB 7", text(doc).strip());
	}

	@Test
	void lossIdsFollowDocumentOrder() {
		evaluate("#{ 1 }\n\n#if nope() [a]\n");

		assertEquals(2, tracker.losses().size());
		assertEquals("L0001", tracker.losses().get(0).id());
		assertEquals(LossKind.CODE_BLOCK, tracker.losses().get(0).kind());
		assertEquals("L0002", tracker.losses().get(1).id());
	}

	@Test
	void spaceBetweenEmbedsIsKept() {
		Document doc = evaluate("#let a = \"x\"\n#let b = \"y\"\n#a #b\n");

		assertEquals("x y", squash(doc));
	}

	@Test
	void dictionaryFieldsAndAtKeepTheirSeparators() {
		Document doc = evaluate("#let d = (a: 1, b: \"x\")\n#d.a #d.b #d.at(\"b\")\n");

		assertEquals("1 x x", squash(doc));
		assertTrue(tracker.losses().isEmpty());
	}

	@Test
	void letInsideContentBlockShadowsOnlyWithinTheBlock() {
		Document doc = evaluate("#let x = 1\n#[#let x = 2\n#x]\n#x\n");

		assertEquals("2 1", squash(doc));
		assertTrue(tracker.losses().isEmpty());
	}

	@Test
	void letInsideConditionalBranchDoesNotLeak() {
		Document doc = evaluate("#let x = 1\n#if true [#let x = 2\nin #x]\nout #x\n");

		assertEquals("in 2 out 1", squash(doc));
		assertTrue(tracker.losses().isEmpty());
	}

	@Test
	void integerOverflowIsAnUnsupportedValueLoss() {
		Document doc = evaluate("#let x = 9223372036854775807 + 1\nA #x B\n");

		assertEquals(1, tracker.losses().size());
		assertEquals(LossKind.UNSUPPORTED_VALUE, tracker.losses().get(0).kind());
		assertFalse(text(doc).contains("9223372036854775808"), text(doc));
	}

	@Test
	void largeIntegersPrintExactly() {
		Document doc = evaluate("#let n = 9007199254740993\n#n #str(n + 1)\n");

		assertEquals("9007199254740993 9007199254740994", squash(doc));
	}

	private static String squash(Document document) {
		return text(document).replaceAll("\\s+", " ").strip();
	}
}
