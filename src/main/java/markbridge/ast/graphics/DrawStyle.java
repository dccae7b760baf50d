package markbridge.ast.graphics;

/**
 * Stroke/fill styling. Colors are plain names ("red", "black"); null means unset.
 */
public record DrawStyle(String stroke, String fill, boolean dashed, boolean arrowStart, boolean arrowEnd,
		boolean thick) {
	public static final DrawStyle STROKE = new DrawStyle("black", null, false, false, false, false);

	public DrawStyle withStroke(String color) {
		return new DrawStyle(color, fill, dashed, arrowStart, arrowEnd, thick);
	}

	public DrawStyle withFill(String color) {
		return new DrawStyle(stroke, color, dashed, arrowStart, arrowEnd, thick);
	}

	public DrawStyle withDashed() {
		return new DrawStyle(stroke, fill, true, arrowStart, arrowEnd, thick);
	}

	public DrawStyle withArrows(boolean start, boolean end) {
		return new DrawStyle(stroke, fill, dashed, start, end, thick);
	}

	public DrawStyle withThick() {
		return new DrawStyle(stroke, fill, dashed, arrowStart, arrowEnd, true);
	}
}
