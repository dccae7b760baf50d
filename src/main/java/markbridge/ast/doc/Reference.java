package markbridge.ast.doc;

import java.util.List;

/**
 * Cross reference, citation or label anchor.
 */
public record Reference(Kind kind, List<String> keys) implements DocNode {
	public enum Kind {
		REF,
		CITE,
		LABEL
	}

	public String key() {
		return keys.isEmpty() ? "" : keys.get(0);
	}
}
