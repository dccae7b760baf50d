package markbridge.eval;

import java.util.List;

public record ArrayValue(List<Value> items) implements Value {
	@Override
	public String typeName() {
		return "array";
	}
}
