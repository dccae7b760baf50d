package markbridge.ast.graphics;

/**
 * Path operator applied at the current point.
 */
public sealed interface PathSegment permits PathSegment.MoveTo, PathSegment.LineTo, PathSegment.CurveTo,
		PathSegment.Arc, PathSegment.Circle, PathSegment.Rectangle, PathSegment.Close {

	record MoveTo(Point to) implements PathSegment {
	}

	record LineTo(Point to) implements PathSegment {
	}

	/** Cubic Bezier; {@code control2} may equal {@code control1}. */
	record CurveTo(Point control1, Point control2, Point to) implements PathSegment {
	}

	/** Arc starting at the current point, angles in degrees. */
	record Arc(double startAngle, double endAngle, double radius) implements PathSegment {
	}

	/** Circle centred on the current point. */
	record Circle(double radius) implements PathSegment {
	}

	/** Rectangle from the current point to {@code corner}. */
	record Rectangle(Point corner) implements PathSegment {
	}

	record Close() implements PathSegment {
	}
}
