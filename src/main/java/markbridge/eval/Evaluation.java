package markbridge.eval;

import markbridge.loss.LossKind;

/**
 * Outcome of evaluating one expression.
 */
public sealed interface Evaluation {
	record Resolved(Value value) implements Evaluation {
	}

	record Unresolved(LossKind kind, String reason) implements Evaluation {
	}

	default boolean isResolved() {
		return this instanceof Resolved;
	}
}
