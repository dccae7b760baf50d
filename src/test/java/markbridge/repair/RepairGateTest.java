package markbridge.repair;

import markbridge.loss.ConversionMetrics;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RepairGateTest {
	private static ConversionMetrics metrics(int headings, int refs, int lossMarkers, int parseErrors) {
		return new ConversionMetrics(headings, 0, 0, 0, 0, refs, 0, 0, lossMarkers, parseErrors);
	}

	@Test
	void acceptsCandidateThatRemovesMarkersAndKeepsStructure() {
		assertNull(new RepairGate(false).check(metrics(2, 1, 3, 0), metrics(2, 1, 1, 0)));
	}

	@Test
	void rejectsCandidateWithParseErrors() {
		String reason = new RepairGate(false).check(metrics(2, 1, 3, 0), metrics(2, 1, 0, 1));
		assertTrue(reason.contains("parse errors"), reason);
	}

	@Test
	void rejectsCandidateThatLosesStructure() {
		String reason = new RepairGate(false).check(metrics(2, 1, 3, 0), metrics(1, 0, 0, 0));
		assertTrue(reason.contains("headings"), reason);
		assertTrue(reason.contains("refs"), reason);
	}

	@Test
	void rejectsCandidateThatAddsMarkers() {
		String reason = new RepairGate(true).check(metrics(1, 0, 1, 0), metrics(1, 0, 2, 0));
		assertTrue(reason.contains("adds loss markers"), reason);
	}

	@Test
	void noGainIsRejectedUnlessAllowed() {
		String reason = new RepairGate(false).check(metrics(1, 0, 1, 0), metrics(1, 0, 1, 0));
		assertTrue(reason.contains("removes no loss markers"), reason);
		assertNull(new RepairGate(true).check(metrics(1, 0, 1, 0), metrics(1, 0, 1, 0)));
	}

	@Test
	void moreStructureIsFine() {
		assertNull(new RepairGate(false).check(metrics(1, 0, 2, 0), metrics(3, 2, 0, 0)));
	}
}
