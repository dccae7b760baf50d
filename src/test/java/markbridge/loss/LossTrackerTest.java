package markbridge.loss;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LossTrackerTest {
	@Test
	void assignsSequentialIds() {
		LossTracker tracker = new LossTracker();
		tracker.record(LossKind.UNKNOWN_COMMAND, "\\a", "unknown command", "\\a", null);
		LossRecord second = tracker.record(LossKind.CODE_BLOCK, null, "code block", "#{}", null);

		assertEquals("L0002", second.id());
		assertEquals(2, tracker.size());
	}

	@Test
	void rollbackDropsRecordsAndReusesTheirIds() {
		LossTracker tracker = new LossTracker();
		tracker.record(LossKind.UNKNOWN_COMMAND, "\\a", "unknown command", "\\a", null);
		int mark = tracker.checkpoint();
		tracker.record(LossKind.UNKNOWN_COMMAND, "\\b", "unknown command", "\\b", null);
		tracker.rollback(mark);
		LossRecord next = tracker.record(LossKind.UNKNOWN_COMMAND, "\\c", "unknown command", "\\c", null);

		assertEquals("L0002", next.id());
		assertEquals("\\c", tracker.losses().get(1).name());
	}

	@Test
	void truncatesLongSnippets() {
		LossTracker tracker = new LossTracker();
		LossRecord loss = tracker.record(LossKind.OTHER, null, "long", "x".repeat(250), null);

		assertEquals(203, loss.snippet().length());
		assertTrue(loss.snippet().endsWith("..."));
	}

	@Test
	void reportKeepsWarningsOnceInOrder() {
		LossTracker tracker = new LossTracker();
		tracker.warn("style dropped");
		tracker.warn("style dropped");
		tracker.warn("second");
		LossReport report = tracker.report("latex", "typst");

		assertEquals(2, report.warnings().size());
		assertEquals("second", report.warnings().get(1));
		assertTrue(report.losses().isEmpty());
		assertFalse(report.isEmpty());
	}
}
