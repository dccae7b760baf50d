package markbridge.eval;

import markbridge.loss.LossKind;

import java.util.List;
import java.util.Map;

/**
 * Evaluated call arguments.
 */
record Arguments(List<Value> positional, Map<String, Value> named) {
	Value at(int index) {
		return index < positional.size() ? positional.get(index) : null;
	}

	Value named(String name) {
		return named.get(name);
	}

	boolean has(String name) {
		return named.containsKey(name);
	}

	Value required(int index, String function) {
		Value v = at(index);
		if (v == null) {
			throw new EvalException(LossKind.UNSUPPORTED_EXPRESSION, function + " is missing argument " + (index + 1));
		}
		return v;
	}

	/** Last positional argument, where Typst puts a trailing content block. */
	Value body() {
		return positional.isEmpty() ? null : positional.get(positional.size() - 1);
	}
}
