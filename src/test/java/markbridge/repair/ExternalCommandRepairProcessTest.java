package markbridge.repair;

import markbridge.loss.ConversionMetrics;
import markbridge.loss.LossReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnabledOnOs({ OS.LINUX, OS.MAC })
public class ExternalCommandRepairProcessTest {
	private static final RepairRequest REQUEST = new RepairRequest("\\foo", "/* mb:loss:L0001 \\foo */",
			new LossReport("latex", "typst", List.of(), List.of()),
			new ConversionMetrics(0, 0, 0, 0, 0, 0, 0, 0, 1, 0));

	@Test
	void returnsWhatTheCommandPrints() throws IOException {
		RepairProcess process = new ExternalCommandRepairProcess("cat > /dev/null; printf 'fixed'",
				Duration.ofSeconds(10));

		assertEquals("fixed", process.repair(REQUEST));
	}

	@Test
	void sendsRequestAsJsonOnStdin() throws IOException {
		RepairProcess process = new ExternalCommandRepairProcess("cat", Duration.ofSeconds(10));

		String echoed = process.repair(REQUEST);
		assertTrue(echoed.startsWith("{"), echoed);
		assertTrue(echoed.contains("\"input\""), echoed);
		assertTrue(echoed.contains("\"loss_markers\":1"), echoed);
		assertTrue(echoed.contains("\"source_lang\":\"latex\""), echoed);
	}

	@Test
	void nonZeroExitIsAnError() {
		RepairProcess process = new ExternalCommandRepairProcess("echo broken >&2; exit 3", Duration.ofSeconds(10));

		IOException ex = assertThrows(IOException.class, () -> process.repair(REQUEST));
		assertTrue(ex.getMessage().contains("code 3"), ex.getMessage());
	}

	@Test
	void slowCommandTimesOut() {
		RepairProcess process = new ExternalCommandRepairProcess("sleep 5", Duration.ofMillis(200));

		IOException ex = assertThrows(IOException.class, () -> process.repair(REQUEST));
		assertTrue(ex.getMessage().contains("timed out"), ex.getMessage());
	}

	@Test
	void blankCommandIsRejected() {
		assertThrows(IllegalArgumentException.class, () -> new ExternalCommandRepairProcess(" ", Duration.ofSeconds(1)));
	}
}
