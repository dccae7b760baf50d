package markbridge.transform.graphics;

import markbridge.ast.graphics.DrawStyle;
import markbridge.ast.graphics.LabelElement;
import markbridge.ast.graphics.NamedCoordinate;
import markbridge.ast.graphics.PathElement;
import markbridge.ast.graphics.PathSegment;
import markbridge.ast.graphics.PictureElement;
import markbridge.ast.graphics.Point;
import markbridge.ast.graphics.VectorPicture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the body of a {@code cetz.canvas} block into a {@link VectorPicture}.
 *
 * Supported draw calls are {@code line}, {@code bezier}, {@code arc},
 * {@code circle}, {@code rect} and {@code content}; {@code import} lines are
 * ignored. Any other statement is skipped and reported.
 */
final class CetzReader {
	private static final Logger log = LoggerFactory.getLogger(CetzReader.class);

	/** A string literal, as opposed to an identifier. */
	private record Quoted(String text) {
	}

	/** A {@code [..]} content block, kept as source. */
	private record Content(String text) {
	}

	/** Arguments of one call. */
	private record Call(String name, List<Object> positional, Map<String, Object> named, String source) {
	}

	private final List<PictureElement> elements = new ArrayList<>();
	private final List<PictureReading.Skipped> skipped = new ArrayList<>();
	private String s;
	private int pos;

	PictureReading read(String source) {
		s = source;
		pos = 0;
		while (true) {
			skipBlank();
			if (pos >= s.length()) {
				break;
			}
			int start = pos;
			String name = identifier();
			if (name.isEmpty()) {
				skipped.add(new PictureReading.Skipped(String.valueOf(s.charAt(pos)), restOfLine(start)));
				continue;
			}
			if (name.equals("import")) {
				restOfLine(start);
				continue;
			}
			if (pos < s.length() && s.charAt(pos) == '(') {
				Call call = call(name, start);
				statement(call);
				continue;
			}
			skipped.add(new PictureReading.Skipped(name, restOfLine(start)));
		}
		log.debug("read {} picture elements, skipped {}", elements.size(), skipped.size());
		return new PictureReading(new VectorPicture(List.copyOf(elements)), List.copyOf(skipped));
	}

	private void statement(Call call) {
		switch (call.name()) {
			case "line" -> line(call);
			case "bezier" -> bezier(call);
			case "arc" -> arc(call);
			case "circle" -> circle(call);
			case "rect" -> rect(call);
			case "content" -> content(call);
			default -> skip(call);
		}
	}

	private void line(Call call) {
		List<PathSegment> segments = new ArrayList<>();
		for (Object arg : call.positional()) {
			Point p = point(arg);
			if (p == null) {
				skip(call);
				return;
			}
			segments.add(segments.isEmpty() ? new PathSegment.MoveTo(p) : new PathSegment.LineTo(p));
		}
		if (segments.size() < 2) {
			skip(call);
			return;
		}
		if (Boolean.TRUE.equals(call.named().get("close"))) {
			segments.add(new PathSegment.Close());
		}
		elements.add(new PathElement(List.copyOf(segments), style(call)));
	}

	private void bezier(Call call) {
		List<Point> points = points(call);
		if (points == null || points.size() < 3) {
			skip(call);
			return;
		}
		Point c2 = points.size() > 3 ? points.get(3) : points.get(2);
		elements.add(new PathElement(List.of(new PathSegment.MoveTo(points.get(0)),
				new PathSegment.CurveTo(points.get(2), c2, points.get(1))), style(call)));
	}

	private void arc(Call call) {
		List<Point> points = points(call);
		Double start = number(call.named().get("start"));
		Double stop = number(call.named().get("stop"));
		Double delta = number(call.named().get("delta"));
		Double radius = call.named().containsKey("radius") ? number(call.named().get("radius")) : Double.valueOf(1);
		if (stop == null && start != null && delta != null) {
			stop = start + delta;
		}
		if (points == null || points.size() != 1 || start == null || stop == null || radius == null) {
			skip(call);
			return;
		}
		elements.add(new PathElement(List.of(new PathSegment.MoveTo(points.get(0)),
				new PathSegment.Arc(start, stop, radius)), style(call)));
	}

	private void circle(Call call) {
		List<Point> points = points(call);
		Double radius = call.named().containsKey("radius") ? number(call.named().get("radius")) : Double.valueOf(1);
		if (points == null || points.size() != 1 || radius == null) {
			skip(call);
			return;
		}
		elements.add(new PathElement(List.of(new PathSegment.MoveTo(points.get(0)), new PathSegment.Circle(radius)),
				style(call)));
	}

	private void rect(Call call) {
		List<Point> points = points(call);
		if (points == null || points.size() != 2) {
			skip(call);
			return;
		}
		elements.add(new PathElement(List.of(new PathSegment.MoveTo(points.get(0)),
				new PathSegment.Rectangle(points.get(1))), style(call)));
	}

	private void content(Call call) {
		if (call.positional().isEmpty()) {
			skip(call);
			return;
		}
		Point at = point(call.positional().get(0));
		String text = "";
		if (call.positional().size() > 1) {
			Object body = call.positional().get(1);
			if (body instanceof Content c) {
				text = c.text().strip();
			} else if (body instanceof Quoted q) {
				text = q.text();
			} else {
				at = null;
			}
		}
		String name = call.named().get("name") instanceof Quoted q ? q.text() : null;
		if (at == null) {
			skip(call);
			return;
		}
		if (text.isEmpty() && name != null) {
			elements.add(new NamedCoordinate(name, at));
		} else {
			elements.add(new LabelElement(at, text, name));
		}
	}

	private List<Point> points(Call call) {
		List<Point> out = new ArrayList<>();
		for (Object arg : call.positional()) {
			Point p = point(arg);
			if (p == null) {
				return null;
			}
			out.add(p);
		}
		return out;
	}

	private static Point point(Object value) {
		if (value instanceof List<?> list && list.isEmpty()) {
			return new Point.Relative(0, 0, true);
		}
		if (value instanceof List<?> list && list.size() == 2) {
			Double x = number(list.get(0));
			Double y = number(list.get(1));
			return x == null || y == null ? null : new Point.Absolute(x, y);
		}
		if (value instanceof Quoted q) {
			int dot = q.text().indexOf('.');
			return dot < 0 ? new Point.Anchor(q.text(), null)
					: new Point.Anchor(q.text().substring(0, dot), q.text().substring(dot + 1));
		}
		if (value instanceof Map<?, ?> map) {
			if (map.get("rel") instanceof List<?> rel && rel.size() == 2) {
				Double dx = number(rel.get(0));
				Double dy = number(rel.get(1));
				boolean moves = !Boolean.FALSE.equals(map.get("update"));
				return dx == null || dy == null ? null : new Point.Relative(dx, dy, moves);
			}
			Double angle = number(map.get("angle"));
			Double radius = number(map.get("radius"));
			if (angle != null && radius != null) {
				return new Point.Polar(angle, radius);
			}
		}
		return null;
	}

	private static Double number(Object value) {
		return value instanceof Double d ? d : null;
	}

	private static DrawStyle style(Call call) {
		Map<String, Object> named = call.named();
		String stroke = "black";
		boolean dashed = false;
		boolean thick = false;
		Object strokeValue = named.get("stroke");
		if (strokeValue instanceof String color) {
			stroke = color.equals("none") ? null : color;
		} else if (strokeValue instanceof Map<?, ?> map) {
			if (map.get("paint") instanceof String paint) {
				stroke = paint;
			}
			dashed = map.containsKey("dash");
			thick = map.containsKey("thickness");
		} else if (strokeValue instanceof Double) {
			thick = true;
		}
		String fill = named.get("fill") instanceof String color && !color.equals("none") ? color : null;
		boolean start = false;
		boolean end = false;
		if (named.get("mark") instanceof Map<?, ?> mark) {
			start = mark.containsKey("start");
			end = mark.containsKey("end");
		}
		return new DrawStyle(stroke, fill, dashed, start, end, thick);
	}

	private void skip(Call call) {
		skipped.add(new PictureReading.Skipped(call.name(), call.source()));
	}

	// ---- values ----

	private Call call(String name, int start) {
		List<Object> positional = new ArrayList<>();
		Map<String, Object> named = new LinkedHashMap<>();
		pos++;
		items(positional, named, ')');
		while (pos < s.length() && s.charAt(pos) == '[') {
			positional.add(content());
		}
		return new Call(name, positional, named, s.substring(start, pos).strip());
	}

	/** Reads comma separated items up to {@code close}, which is consumed. */
	private void items(List<Object> positional, Map<String, Object> named, char close) {
		while (true) {
			skipBlank();
			if (pos >= s.length()) {
				return;
			}
			if (s.charAt(pos) == close) {
				pos++;
				return;
			}
			if (s.charAt(pos) == ',') {
				pos++;
				continue;
			}
			int save = pos;
			String key = identifier();
			skipSpaces();
			if (!key.isEmpty() && pos < s.length() && s.charAt(pos) == ':') {
				pos++;
				named.put(key, value());
				continue;
			}
			pos = save;
			positional.add(value());
		}
	}

	private Object value() {
		skipBlank();
		if (pos >= s.length()) {
			return null;
		}
		char ch = s.charAt(pos);
		if (ch == '(') {
			pos++;
			List<Object> positional = new ArrayList<>();
			Map<String, Object> named = new LinkedHashMap<>();
			items(positional, named, ')');
			if (!named.isEmpty()) {
				return named;
			}
			return positional;
		}
		if (ch == '"') {
			int end = pos + 1;
			StringBuilder sb = new StringBuilder();
			while (end < s.length() && s.charAt(end) != '"') {
				if (s.charAt(end) == '\\' && end + 1 < s.length()) {
					end++;
				}
				sb.append(s.charAt(end));
				end++;
			}
			pos = Math.min(s.length(), end + 1);
			return new Quoted(sb.toString());
		}
		if (ch == '[') {
			return content();
		}
		if (ch == '-' || ch == '.' || Character.isDigit(ch)) {
			int start = pos;
			pos++;
			while (pos < s.length() && (Character.isLetterOrDigit(s.charAt(pos)) || s.charAt(pos) == '.'
					|| s.charAt(pos) == '%')) {
				pos++;
			}
			Double number = Numbers.parse(s.substring(start, pos));
			return number == null ? s.substring(start, pos) : number;
		}
		String ident = identifier();
		if (ident.isEmpty()) {
			int start = pos;
			skipExpression();
			return s.substring(start, pos);
		}
		if (ident.equals("true") || ident.equals("false")) {
			return Boolean.valueOf(ident);
		}
		if (pos < s.length() && s.charAt(pos) == '(') {
			// a call such as red.lighten(20%) stays as its source text
			int start = pos;
			pos = TikzReader.closing(s, pos, '(', ')') + 1;
			return ident + s.substring(start, pos);
		}
		return ident;
	}

	private Content content() {
		int end = TikzReader.closing(s, pos, '[', ']');
		Content c = new Content(s.substring(pos + 1, Math.max(pos + 1, end)));
		pos = end + 1;
		return c;
	}

	private void skipExpression() {
		int depth = 0;
		while (pos < s.length()) {
			char ch = s.charAt(pos);
			if (depth == 0 && (ch == ',' || ch == ')')) {
				return;
			}
			if (ch == '(' || ch == '[' || ch == '{') {
				depth++;
			} else if (ch == ')' || ch == ']' || ch == '}') {
				depth--;
			}
			pos++;
		}
	}

	private String identifier() {
		int start = pos;
		while (pos < s.length()) {
			char ch = s.charAt(pos);
			if (Character.isLetterOrDigit(ch) || ch == '_' || ch == '.' && pos > start
					|| ch == '-' && pos > start && pos + 1 < s.length() && Character.isLetter(s.charAt(pos + 1))) {
				pos++;
			} else {
				break;
			}
		}
		if (pos > start && Character.isDigit(s.charAt(start))) {
			pos = start;
			return "";
		}
		return s.substring(start, pos);
	}

	/** Skips to the end of the statement starting at {@code start} and returns its text. */
	private String restOfLine(int start) {
		int depth = 0;
		while (pos < s.length()) {
			char ch = s.charAt(pos);
			if (depth == 0 && (ch == '\n' || ch == ';')) {
				break;
			}
			if (ch == '(' || ch == '[' || ch == '{') {
				depth++;
			} else if (ch == ')' || ch == ']' || ch == '}') {
				depth--;
			}
			pos++;
		}
		return s.substring(start, pos).strip();
	}

	private void skipSpaces() {
		while (pos < s.length() && (s.charAt(pos) == ' ' || s.charAt(pos) == '\t')) {
			pos++;
		}
	}

	private void skipBlank() {
		while (pos < s.length()) {
			char ch = s.charAt(pos);
			if (Character.isWhitespace(ch) || ch == ';') {
				pos++;
			} else if (s.startsWith("//", pos)) {
				while (pos < s.length() && s.charAt(pos) != '\n') {
					pos++;
				}
			} else if (s.startsWith("/*", pos)) {
				int end = s.indexOf("*/", pos + 2);
				pos = end < 0 ? s.length() : end + 2;
			} else {
				break;
			}
		}
	}
}
