package markbridge.repair;

import markbridge.ConversionOptions;
import markbridge.ConversionResult;
import markbridge.Converter;
import markbridge.Direction;
import markbridge.ast.doc.LossMarker;
import markbridge.loss.ConversionMetrics;
import markbridge.loss.LossRecord;
import markbridge.loss.LossReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Offers a conversion output to a {@link RepairProcess} and keeps the candidate
 * only when {@link RepairGate} accepts it.
 *
 * Both the current output and the candidate are measured by re-parsing the text,
 * so the comparison does not depend on how either was produced. Accepted
 * candidates become the baseline of the next round, and the report sent with
 * them keeps only the losses whose markers the candidate still carries.
 */
public final class RepairLoop {
	private static final Logger log = LoggerFactory.getLogger(RepairLoop.class);

	private final Converter converter;
	private final RepairProcess process;
	private final ConversionOptions options;
	private final int maxRounds;

	public RepairLoop(Converter converter, RepairProcess process, ConversionOptions options, int maxRounds) {
		if (maxRounds < 1) {
			throw new IllegalArgumentException("maxRounds must be positive: " + maxRounds);
		}
		this.converter = converter;
		this.process = process;
		this.options = options;
		this.maxRounds = maxRounds;
	}

	public RepairLoop(Converter converter, RepairProcess process, ConversionOptions options) {
		this(converter, process, options, 1);
	}

	public RepairOutcome repair(String input, Direction direction, ConversionResult result) {
		RepairGate gate = new RepairGate(options.allowNoGain());
		String output = result.outputText();
		LossReport report = result.lossReport();
		ConversionMetrics baseline = converter.measure(output, direction.target(), options);
		boolean accepted = false;
		String reason = null;
		for (int round = 1; round <= maxRounds; round++) {
			if (baseline.lossMarkers() == 0 && !options.allowNoGain()) {
				reason = accepted ? null : "no loss markers to repair";
				break;
			}
			RepairRequest request = new RepairRequest(input, output, report, baseline);
			String candidate;
			try {
				candidate = process.repair(request);
			} catch (IOException e) {
				log.warn("repair round {} failed: {}", round, e.getMessage());
				reason = "repair process failed: " + e.getMessage();
				break;
			}
			ConversionMetrics measured = converter.measure(candidate, direction.target(), options);
			String rejection = gate.check(baseline, measured);
			if (rejection != null) {
				log.warn("repair round {} rejected: {}", round, rejection);
				reason = rejection;
				break;
			}
			log.info("repair round {} accepted: loss markers {} -> {}", round, baseline.lossMarkers(),
					measured.lossMarkers());
			output = candidate;
			baseline = measured;
			report = outstanding(report, candidate);
			accepted = true;
			reason = null;
		}
		return accepted ? new RepairOutcome(true, output, baseline, reason)
				: RepairOutcome.rejected(output, baseline, reason);
	}

	/** Losses of {@code report} whose marker is still in {@code output}. */
	static LossReport outstanding(LossReport report, String output) {
		List<LossRecord> left = report.losses().stream()
				.filter(loss -> Pattern.compile(Pattern.quote(LossMarker.PREFIX + loss.id()) + "(?!\\d)")
						.matcher(output).find())
				.toList();
		return new LossReport(report.sourceLang(), report.targetLang(), left, report.warnings());
	}
}
