package markbridge.eval;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of {@code range(..)}. Kept lazy so that a huge range only materializes
 * the iterations that are unrolled.
 */
public record RangeValue(long start, long end, long step) implements Value {
	public RangeValue {
		if (step == 0) {
			throw new IllegalArgumentException("range step must not be zero");
		}
	}

	@Override
	public String typeName() {
		return "array";
	}

	public long size() {
		if (step > 0) {
			return end <= start ? 0 : (end - start + step - 1) / step;
		}
		return end >= start ? 0 : (start - end - step - 1) / -step;
	}

	public NumberValue get(long index) {
		return NumberValue.of(start + index * step);
	}

	public ArrayValue materialize() {
		List<Value> items = new ArrayList<>();
		for (long i = 0; i < size(); i++) {
			items.add(get(i));
		}
		return new ArrayValue(items);
	}
}
