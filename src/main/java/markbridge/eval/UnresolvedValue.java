package markbridge.eval;

import markbridge.loss.LossKind;

/**
 * Binding whose value could not be computed. Reported only when the value is
 * used in emitted output.
 */
public record UnresolvedValue(String source, LossKind kind, String reason) implements Value {
	@Override
	public String typeName() {
		return "unresolved";
	}
}
