package markbridge.transform.graphics;

import markbridge.ast.graphics.DrawStyle;
import markbridge.ast.graphics.LabelElement;
import markbridge.ast.graphics.NamedCoordinate;
import markbridge.ast.graphics.PathElement;
import markbridge.ast.graphics.PathSegment;
import markbridge.ast.graphics.PictureElement;
import markbridge.ast.graphics.Point;
import markbridge.ast.graphics.VectorPicture;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes a {@link VectorPicture} as the body of a {@code cetz.canvas} block.
 * Colors must already be Typst color names.
 */
final class CetzWriter {
	/** CeTZ's previous position. */
	private static final Point PREVIOUS = new Point.Relative(0, 0, true);

	String write(VectorPicture picture) {
		List<String> lines = new ArrayList<>();
		lines.add("import cetz.draw: *");
		for (PictureElement element : picture.elements()) {
			if (element instanceof PathElement path) {
				path(path, lines);
			} else if (element instanceof NamedCoordinate named) {
				lines.add("content(" + point(named.at()) + ", [], name: \"" + named.name() + "\")");
			} else if (element instanceof LabelElement label) {
				String name = label.name() == null ? "" : ", name: \"" + label.name() + "\"";
				lines.add("content(" + point(label.at()) + ", [" + label.text() + "]" + name + ")");
			}
		}
		return String.join("\n", lines);
	}

	private static void path(PathElement path, List<String> lines) {
		String style = style(path.style());
		List<Point> polyline = new ArrayList<>();
		Point start = null;
		Point current = null;
		for (PathSegment segment : path.segments()) {
			if (segment instanceof PathSegment.MoveTo move) {
				flush(polyline, false, style, lines);
				start = move.to();
				current = move.to();
				polyline.add(current);
			} else if (segment instanceof PathSegment.LineTo line) {
				if (polyline.isEmpty()) {
					polyline.add(current);
				}
				polyline.add(line.to());
				current = line.to();
			} else if (segment instanceof PathSegment.Close) {
				flush(polyline, true, style, lines);
				current = start;
				polyline.add(current);
			} else if (segment instanceof PathSegment.CurveTo curve) {
				flush(polyline, false, style, lines);
				lines.add("bezier(" + point(current) + ", " + point(curve.to()) + ", " + point(curve.control1()) + ", "
						+ point(curve.control2()) + style + ")");
				current = curve.to();
				polyline.add(current);
			} else if (segment instanceof PathSegment.Arc arc) {
				flush(polyline, false, style, lines);
				lines.add("arc(" + point(current) + ", start: " + Numbers.format(arc.startAngle()) + "deg, stop: "
						+ Numbers.format(arc.endAngle()) + "deg, radius: " + Numbers.format(arc.radius()) + style + ")");
				current = PREVIOUS;
				polyline.add(current);
			} else if (segment instanceof PathSegment.Circle circle) {
				flush(polyline, false, style, lines);
				lines.add("circle(" + point(current) + ", radius: " + Numbers.format(circle.radius()) + style + ")");
				polyline.add(current);
			} else if (segment instanceof PathSegment.Rectangle rect) {
				flush(polyline, false, style, lines);
				lines.add("rect(" + point(current) + ", " + point(rect.corner()) + style + ")");
				current = rect.corner();
				polyline.add(current);
			}
		}
		flush(polyline, false, style, lines);
	}

	/** Emits the pending straight segments as one {@code line} call. */
	private static void flush(List<Point> polyline, boolean close, String style, List<String> lines) {
		if (polyline.size() > 1) {
			List<String> points = new ArrayList<>();
			polyline.forEach(p -> points.add(point(p)));
			lines.add("line(" + String.join(", ", points) + (close ? ", close: true" : "") + style + ")");
		}
		polyline.clear();
	}

	static String point(Point p) {
		if (p instanceof Point.Absolute a) {
			return "(" + Numbers.format(a.x()) + ", " + Numbers.format(a.y()) + ")";
		}
		if (p instanceof Point.Relative r) {
			if (r.dx() == 0 && r.dy() == 0 && r.moves()) {
				return "()";
			}
			String update = r.moves() ? "" : ", update: false";
			return "(rel: (" + Numbers.format(r.dx()) + ", " + Numbers.format(r.dy()) + ")" + update + ")";
		}
		if (p instanceof Point.Anchor a) {
			return "\"" + a.name() + (a.anchor() == null ? "" : "." + a.anchor()) + "\"";
		}
		Point.Polar polar = (Point.Polar) p;
		return "(angle: " + Numbers.format(polar.angle()) + "deg, radius: " + Numbers.format(polar.radius()) + ")";
	}

	/** Named style arguments, each preceded by a comma; empty for the default black stroke. */
	private static String style(DrawStyle style) {
		StringBuilder sb = new StringBuilder();
		if (style.stroke() == null) {
			sb.append(", stroke: none");
		} else if (style.dashed() || style.thick()) {
			List<String> parts = new ArrayList<>();
			parts.add("paint: " + style.stroke());
			if (style.thick()) {
				parts.add("thickness: 0.8pt");
			}
			if (style.dashed()) {
				parts.add("dash: \"dashed\"");
			}
			sb.append(", stroke: (").append(String.join(", ", parts)).append(')');
		} else if (!style.stroke().equals("black")) {
			sb.append(", stroke: ").append(style.stroke());
		}
		if (style.fill() != null) {
			sb.append(", fill: ").append(style.fill());
		}
		if (style.arrowStart() || style.arrowEnd()) {
			List<String> marks = new ArrayList<>();
			if (style.arrowStart()) {
				marks.add("start: \">\"");
			}
			if (style.arrowEnd()) {
				marks.add("end: \">\"");
			}
			sb.append(", mark: (").append(String.join(", ", marks)).append(')');
		}
		return sb.toString();
	}
}
