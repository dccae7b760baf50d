package markbridge.repair;

import markbridge.loss.ConversionMetrics;

import java.util.List;

/**
 * Accepts a repair candidate only if it parses, keeps every structural count and
 * removes at least one loss marker.
 */
public final class RepairGate {
	private final boolean allowNoGain;

	public RepairGate(boolean allowNoGain) {
		this.allowNoGain = allowNoGain;
	}

	/** Null when the candidate is acceptable, otherwise the reason for rejecting it. */
	public String check(ConversionMetrics baseline, ConversionMetrics candidate) {
		if (candidate.parseErrors() > 0) {
			return "candidate has " + candidate.parseErrors() + " parse errors";
		}
		List<String> decreased = candidate.decreasesFrom(baseline);
		if (!decreased.isEmpty()) {
			return "candidate loses structure: " + String.join(", ", decreased);
		}
		if (candidate.lossMarkers() > baseline.lossMarkers()) {
			return "candidate adds loss markers (" + baseline.lossMarkers() + " -> " + candidate.lossMarkers() + ")";
		}
		if (!allowNoGain && candidate.lossMarkers() == baseline.lossMarkers()) {
			return "candidate removes no loss markers";
		}
		return null;
	}
}
