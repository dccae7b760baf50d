package markbridge.repair;

import markbridge.ConversionOptions;
import markbridge.ConversionResult;
import markbridge.Converter;
import markbridge.Direction;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RepairLoopTest {
	private static final String INPUT = "\\section{Intro}\n\nText \\foo here.\n";
	private static final String REPAIRED = "#set heading(numbering: \"1.\")\n\n= Intro\n\nText foo here.\n";

	private final Converter converter = new Converter();
	private final ConversionOptions options = ConversionOptions.defaults();

	private ConversionResult convert(String input) {
		return converter.convert(input, Direction.LATEX_TO_TYPST, options);
	}

	@Test
	void acceptsCandidateThatRemovesTheMarker() {
		ConversionResult result = convert(INPUT);
		List<RepairRequest> seen = new ArrayList<>();
		RepairOutcome outcome = new RepairLoop(converter, request -> {
			seen.add(request);
			return REPAIRED;
		}, options).repair(INPUT, Direction.LATEX_TO_TYPST, result);

		assertTrue(outcome.accepted(), outcome.reason());
		assertEquals(REPAIRED, outcome.output());
		assertEquals(0, outcome.metrics().lossMarkers());
		assertNull(outcome.reason());
		assertEquals(1, seen.size());
		assertEquals(INPUT, seen.get(0).input());
		assertEquals(result.outputText(), seen.get(0).output());
		assertEquals(1, seen.get(0).metrics().lossMarkers());
		assertEquals(1, seen.get(0).report().losses().size());
	}

	@Test
	void rejectsCandidateThatDropsAHeading() {
		ConversionResult result = convert(INPUT);
		RepairOutcome outcome = new RepairLoop(converter, request -> "Text foo here.\n", options)
				.repair(INPUT, Direction.LATEX_TO_TYPST, result);

		assertFalse(outcome.accepted());
		assertEquals(result.outputText(), outcome.output());
		assertTrue(outcome.reason().contains("headings"), outcome.reason());
	}

	@Test
	void rejectsCandidateThatDoesNotParse() {
		ConversionResult result = convert(INPUT);
		RepairOutcome outcome = new RepairLoop(converter, request -> "= Intro\n\n#{ unclosed\n", options)
				.repair(INPUT, Direction.LATEX_TO_TYPST, result);

		assertFalse(outcome.accepted());
		assertTrue(outcome.reason().contains("parse errors"), outcome.reason());
	}

	@Test
	void rejectsUnchangedOutput() {
		ConversionResult result = convert(INPUT);
		RepairOutcome outcome = new RepairLoop(converter, request -> request.output(), options)
				.repair(INPUT, Direction.LATEX_TO_TYPST, result);

		assertFalse(outcome.accepted());
		assertTrue(outcome.reason().contains("removes no loss markers"), outcome.reason());
	}

	@Test
	void processFailureKeepsOriginalOutput() {
		ConversionResult result = convert(INPUT);
		RepairOutcome outcome = new RepairLoop(converter, request -> {
			throw new IOException("boom");
		}, options).repair(INPUT, Direction.LATEX_TO_TYPST, result);

		assertFalse(outcome.accepted());
		assertEquals(result.outputText(), outcome.output());
		assertTrue(outcome.reason().contains("boom"), outcome.reason());
	}

	@Test
	void outputWithoutMarkersIsNotOffered() {
		String input = "\\section{Intro}\n\nPlain text.\n";
		AtomicInteger calls = new AtomicInteger();
		RepairOutcome outcome = new RepairLoop(converter, request -> {
			calls.incrementAndGet();
			return request.output();
		}, options).repair(input, Direction.LATEX_TO_TYPST, convert(input));

		assertEquals(0, calls.get());
		assertFalse(outcome.accepted());
		assertEquals("no loss markers to repair", outcome.reason());
	}

	@Test
	void roundCountMustBePositive() {
		assertThrows(IllegalArgumentException.class,
				() -> new RepairLoop(converter, request -> request.output(), options, 0));
	}

	@Test
	void laterRoundsSeeOnlyTheLossesStillMarked() {
		String input = "Text \\foo and \\bar here.\n";
		List<RepairRequest> seen = new ArrayList<>();
		RepairOutcome outcome = new RepairLoop(converter, request -> {
			seen.add(request);
			String id = request.report().losses().get(0).id();
			return request.output().replaceFirst("/\\* mb:loss:" + id + "[^*]*\\*/", "fixed");
		}, options, 2).repair(input, Direction.LATEX_TO_TYPST, convert(input));

		assertTrue(outcome.accepted(), outcome.reason());
		assertEquals(2, seen.size());
		assertEquals(2, seen.get(0).report().losses().size());
		assertEquals(1, seen.get(1).report().losses().size());
		assertEquals("L0002", seen.get(1).report().losses().get(0).id());
		assertEquals(0, outcome.metrics().lossMarkers());
	}
}
