package markbridge.transform.graphics;

import markbridge.ast.graphics.DrawStyle;

/**
 * Accumulates drawing options before the command decides which of stroke and
 * fill they apply to.
 */
final class StyleBuilder {
	String color;
	String draw;
	String fill;
	boolean drawFlag;
	boolean dashed;
	boolean thick;
	boolean arrowStart;
	boolean arrowEnd;

	DrawStyle stroked() {
		return new DrawStyle(first(draw, color, "black"), fill, dashed, arrowStart, arrowEnd, thick);
	}

	DrawStyle filled() {
		String stroke = drawFlag || draw != null ? first(draw, "black") : null;
		return new DrawStyle(stroke, first(fill, color, "black"), dashed, arrowStart, arrowEnd, thick);
	}

	DrawStyle fillDrawn() {
		return new DrawStyle(first(draw, color, "black"), first(fill, color, "black"), dashed, arrowStart, arrowEnd,
				thick);
	}

	DrawStyle invisible() {
		String stroke = drawFlag || draw != null ? first(draw, color, "black") : null;
		return new DrawStyle(stroke, fill, dashed, arrowStart, arrowEnd, thick);
	}

	private static String first(String... values) {
		for (String v : values) {
			if (v != null) {
				return v;
			}
		}
		return null;
	}
}
