package markbridge.ast.graphics;

/**
 * Coordinate in the picture's path language.
 */
public sealed interface Point permits Point.Absolute, Point.Relative, Point.Anchor, Point.Polar {

	record Absolute(double x, double y) implements Point {
	}

	/**
	 * Offset from the current point; {@code moves} is true for TikZ {@code ++}.
	 */
	record Relative(double dx, double dy, boolean moves) implements Point {
	}

	/**
	 * Named coordinate or node, optionally with an anchor such as "north".
	 */
	record Anchor(String name, String anchor) implements Point {
	}

	record Polar(double angle, double radius) implements Point {
	}
}
