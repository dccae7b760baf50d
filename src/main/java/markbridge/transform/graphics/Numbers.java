package markbridge.transform.graphics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Number syntax shared by both picture languages. Lengths are in centimetres,
 * angles in degrees.
 */
final class Numbers {
	private Numbers() {
	}

	static String format(double value) {
		if (value == Math.rint(value) && Math.abs(value) < 1e15) {
			return Long.toString((long) value);
		}
		BigDecimal rounded = BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP);
		return rounded.stripTrailingZeros().toPlainString();
	}

	/** Parses a number with an optional unit; null when the text is not one. */
	static Double parse(String text) {
		String t = text.trim().toLowerCase(Locale.ROOT);
		double factor = 1;
		if (t.endsWith("cm") || t.endsWith("deg")) {
			t = t.substring(0, t.length() - (t.endsWith("cm") ? 2 : 3));
		} else if (t.endsWith("mm")) {
			t = t.substring(0, t.length() - 2);
			factor = 0.1;
		} else if (t.endsWith("pt")) {
			t = t.substring(0, t.length() - 2);
			factor = 2.54 / 72.27;
		} else if (t.endsWith("in")) {
			t = t.substring(0, t.length() - 2);
			factor = 2.54;
		}
		try {
			return Double.parseDouble(t.trim()) * factor;
		} catch (NumberFormatException e) {
			return null;
		}
	}
}
