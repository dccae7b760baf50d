package markbridge.loss;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Taxonomy of loss records.
 */
public enum LossKind {
	UNKNOWN_COMMAND("unknown-command"),
	UNKNOWN_ENVIRONMENT("unknown-environment"),
	MACRO_RECURSION_LIMIT("macro-recursion-limit"),
	MACRO_ARGUMENT_MISMATCH("macro-argument-mismatch"),
	LOOP_BOUND_EXCEEDED("loop-bound-exceeded"),
	UNRESOLVED_CONDITIONAL("unresolved-conditional"),
	UNSUPPORTED_VALUE("unsupported-value"),
	UNSUPPORTED_EXPRESSION("unsupported-expression"),
	CODE_BLOCK("code-block"),
	UNSUPPORTED_FEATURE("unsupported-feature"),
	UNSUPPORTED_GRAPHICS("unsupported-graphics"),
	TABLE_APPROXIMATION("table-approximation"),
	PARSE_ERROR("parse-error"),
	OTHER("other");

	private final String id;

	LossKind(String id) {
		this.id = id;
	}

	@JsonValue
	public String id() {
		return id;
	}
}
