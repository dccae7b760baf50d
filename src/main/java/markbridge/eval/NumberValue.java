package markbridge.eval;

import java.math.BigDecimal;

/**
 * Integer or float; {@code integral} follows Typst's int/float distinction.
 * Integers are held exactly in {@code integer}, floats in {@code real}.
 */
public record NumberValue(long integer, double real, boolean integral) implements Value {
	public static NumberValue of(long value) {
		return new NumberValue(value, 0, true);
	}

	public static NumberValue ofFloat(double value) {
		return new NumberValue(0, value, false);
	}

	@Override
	public String typeName() {
		return integral ? "int" : "float";
	}

	/** The value as a double; integers beyond 2^53 are rounded. */
	public double value() {
		return integral ? integer : real;
	}

	public long asLong() {
		return integral ? integer : (long) real;
	}

	/** Typst's display form: {@code 3}, {@code 0.5}. */
	public String display() {
		if (integral) {
			return Long.toString(integer);
		}
		if (Double.isNaN(real) || Double.isInfinite(real)) {
			return Double.toString(real);
		}
		String plain = BigDecimal.valueOf(real).stripTrailingZeros().toPlainString();
		return plain.contains(".") ? plain : plain + ".0";
	}
}
