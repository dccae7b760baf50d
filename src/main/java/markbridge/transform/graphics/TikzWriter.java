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
 * Writes a {@link VectorPicture} as the body of a {@code tikzpicture}. Colors must
 * already be xcolor names.
 */
final class TikzWriter {
	String write(VectorPicture picture) {
		List<String> lines = new ArrayList<>();
		for (PictureElement element : picture.elements()) {
			if (element instanceof PathElement path) {
				lines.add(path(path));
			} else if (element instanceof NamedCoordinate named) {
				lines.add("\\coordinate (" + named.name() + ") at " + point(named.at()) + ";");
			} else if (element instanceof LabelElement label) {
				String name = label.name() == null ? "" : " (" + label.name() + ")";
				lines.add("\\node" + name + " at " + point(label.at()) + " {" + label.text() + "};");
			}
		}
		return String.join("\n", lines);
	}

	private static String path(PathElement path) {
		StringBuilder sb = new StringBuilder(command(path.style()));
		for (PathSegment segment : path.segments()) {
			sb.append(' ');
			if (segment instanceof PathSegment.MoveTo move) {
				sb.append(point(move.to()));
			} else if (segment instanceof PathSegment.LineTo line) {
				sb.append("-- ").append(point(line.to()));
			} else if (segment instanceof PathSegment.CurveTo curve) {
				sb.append(".. controls ").append(point(curve.control1()));
				if (!curve.control2().equals(curve.control1())) {
					sb.append(" and ").append(point(curve.control2()));
				}
				sb.append(" .. ").append(point(curve.to()));
			} else if (segment instanceof PathSegment.Arc arc) {
				sb.append("arc[start angle=").append(Numbers.format(arc.startAngle())).append(", end angle=")
						.append(Numbers.format(arc.endAngle())).append(", radius=").append(Numbers.format(arc.radius()))
						.append(']');
			} else if (segment instanceof PathSegment.Circle circle) {
				sb.append("circle[radius=").append(Numbers.format(circle.radius())).append(']');
			} else if (segment instanceof PathSegment.Rectangle rect) {
				sb.append("rectangle ").append(point(rect.corner()));
			} else if (segment instanceof PathSegment.Close) {
				sb.append("-- cycle");
			}
		}
		return sb.append(';').toString();
	}

	/** The drawing command with its options, chosen from which of stroke and fill are set. */
	private static String command(DrawStyle style) {
		List<String> options = new ArrayList<>();
		String command;
		if (style.fill() != null && style.stroke() != null) {
			command = "\\filldraw";
			if (!style.stroke().equals("black")) {
				options.add("draw=" + style.stroke());
			}
			options.add("fill=" + style.fill());
		} else if (style.fill() != null) {
			command = "\\fill";
			if (!style.fill().equals("black")) {
				options.add(style.fill());
			}
		} else if (style.stroke() != null) {
			command = "\\draw";
			if (!style.stroke().equals("black")) {
				options.add(style.stroke());
			}
		} else {
			command = "\\path";
		}
		if (style.dashed()) {
			options.add("dashed");
		}
		if (style.thick()) {
			options.add("thick");
		}
		if (style.arrowStart() && style.arrowEnd()) {
			options.add("<->");
		} else if (style.arrowStart()) {
			options.add("<-");
		} else if (style.arrowEnd()) {
			options.add("->");
		}
		return options.isEmpty() ? command : command + "[" + String.join(", ", options) + "]";
	}

	static String point(Point p) {
		if (p instanceof Point.Absolute a) {
			return "(" + Numbers.format(a.x()) + "," + Numbers.format(a.y()) + ")";
		}
		if (p instanceof Point.Relative r) {
			return (r.moves() ? "++" : "+") + "(" + Numbers.format(r.dx()) + "," + Numbers.format(r.dy()) + ")";
		}
		if (p instanceof Point.Anchor a) {
			return "(" + a.name() + (a.anchor() == null ? "" : "." + a.anchor()) + ")";
		}
		Point.Polar polar = (Point.Polar) p;
		return "(" + Numbers.format(polar.angle()) + ":" + Numbers.format(polar.radius()) + ")";
	}
}
