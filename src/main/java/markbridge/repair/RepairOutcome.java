package markbridge.repair;

import markbridge.loss.ConversionMetrics;

/**
 * Result of a repair attempt. {@code output} is the last accepted candidate, or
 * the original output when {@code accepted} is false; {@code reason} says why the
 * loop stopped short and is null when nothing was rejected.
 */
public record RepairOutcome(boolean accepted, String output, ConversionMetrics metrics, String reason) {
	static RepairOutcome rejected(String output, ConversionMetrics metrics, String reason) {
		return new RepairOutcome(false, output, metrics, reason);
	}
}
