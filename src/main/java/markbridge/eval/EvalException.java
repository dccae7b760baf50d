package markbridge.eval;

import markbridge.loss.LossKind;

/**
 * Construct the evaluator does not resolve; turned into an opaque node by the
 * caller that embeds it.
 */
final class EvalException extends RuntimeException {
	private final LossKind kind;

	EvalException(LossKind kind, String message) {
		super(message);
		this.kind = kind;
	}

	LossKind kind() {
		return kind;
	}
}
