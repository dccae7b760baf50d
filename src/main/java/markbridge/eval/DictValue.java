package markbridge.eval;

import java.util.Map;

/**
 * Dictionary; {@code entries} keeps insertion order.
 */
public record DictValue(Map<String, Value> entries) implements Value {
	@Override
	public String typeName() {
		return "dictionary";
	}
}
