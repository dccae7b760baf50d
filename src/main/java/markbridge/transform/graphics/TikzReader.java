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
import java.util.List;
import java.util.Set;

/**
 * Reads the body of a {@code tikzpicture} into a {@link VectorPicture}.
 *
 * Understands {@code \draw}, {@code \fill}, {@code \filldraw}, {@code \path},
 * {@code \node} and {@code \coordinate} with absolute, relative, polar and named
 * points and the {@code --}, {@code .. controls ..}, {@code arc}, {@code circle},
 * {@code rectangle}, {@code node} and {@code cycle} operators. Any other statement
 * or path operator is skipped and reported.
 */
final class TikzReader {
	private static final Logger log = LoggerFactory.getLogger(TikzReader.class);

	private static final Set<String> COLORS = Set.of("black", "white", "gray", "red", "green", "blue", "yellow",
			"orange", "purple", "teal", "olive", "lime", "cyan", "magenta", "lightgray", "darkgray", "brown", "pink",
			"violet");

	private final List<PictureElement> elements = new ArrayList<>();
	private final List<PictureReading.Skipped> skipped = new ArrayList<>();

	PictureReading read(String source) {
		String body = stripComments(source).strip();
		if (body.startsWith("[")) {
			body = body.substring(closing(body, 0, '[', ']') + 1);
		}
		for (String statement : statements(body)) {
			statement(statement.strip());
		}
		log.debug("read {} picture elements, skipped {}", elements.size(), skipped.size());
		return new PictureReading(new VectorPicture(List.copyOf(elements)), List.copyOf(skipped));
	}

	private void statement(String text) {
		String s = text;
		while (s.startsWith("\\begin{") || s.startsWith("\\end{")) {
			int close = s.indexOf('}');
			if (close < 0) {
				break;
			}
			String head = s.substring(0, close + 1);
			int end = close + 1;
			if (head.startsWith("\\begin{")) {
				String rest = s.substring(end).stripLeading();
				if (rest.startsWith("[")) {
					end = s.length() - rest.length() + closing(rest, 0, '[', ']') + 1;
				}
				skip(head.substring(1), s.substring(0, end));
			}
			s = s.substring(end).strip();
		}
		if (s.isEmpty()) {
			return;
		}
		Scanner sc = new Scanner(s);
		String command = sc.command();
		if (command == null) {
			skip(firstWord(s), s);
			return;
		}
		switch (command) {
			case "draw", "fill", "filldraw", "path" -> path(command, sc, s);
			case "node" -> node(sc, s);
			case "coordinate" -> coordinate(sc, s);
			default -> skip("\\" + command, s);
		}
	}

	private void path(String command, Scanner sc, String text) {
		StyleBuilder style = options(sc.bracket());
		DrawStyle drawStyle = switch (command) {
			case "fill" -> style.filled();
			case "filldraw" -> style.fillDrawn();
			case "path" -> style.invisible();
			default -> style.stroked();
		};
		List<PathSegment> segments = new ArrayList<>();
		Point current = null;
		while (true) {
			sc.skipSpace();
			if (sc.atEnd()) {
				break;
			}
			if (sc.peekPoint()) {
				Point p = point(sc, text);
				if (p == null) {
					break;
				}
				segments.add(new PathSegment.MoveTo(p));
				current = p;
				continue;
			}
			if (sc.eat("--") || sc.eat("-|") || sc.eat("|-")) {
				String op = sc.last();
				if (!op.equals("--")) {
					skip(op, text);
				}
				sc.skipSpace();
				if (sc.eatWord("cycle")) {
					segments.add(new PathSegment.Close());
					continue;
				}
				Point p = point(sc, text);
				if (p == null) {
					break;
				}
				segments.add(new PathSegment.LineTo(p));
				current = p;
				continue;
			}
			if (sc.eat("..")) {
				sc.skipSpace();
				if (!sc.eatWord("controls")) {
					skip("..", text);
					break;
				}
				Point c1 = point(sc, text);
				sc.skipSpace();
				Point c2 = sc.eatWord("and") ? point(sc, text) : c1;
				sc.skipSpace();
				Point to = sc.eat("..") ? point(sc, text) : null;
				if (c1 == null || c2 == null || to == null) {
					break;
				}
				segments.add(new PathSegment.CurveTo(c1, c2, to));
				current = to;
				continue;
			}
			if (sc.eatWord("arc")) {
				PathSegment.Arc arc = arc(sc);
				if (arc == null) {
					skip("arc", text);
					break;
				}
				segments.add(arc);
				continue;
			}
			if (sc.eatWord("circle")) {
				Double radius = radius(sc);
				if (radius == null) {
					skip("circle", text);
					break;
				}
				segments.add(new PathSegment.Circle(radius));
				continue;
			}
			if (sc.eatWord("rectangle")) {
				Point p = point(sc, text);
				if (p == null) {
					break;
				}
				segments.add(new PathSegment.Rectangle(p));
				current = p;
				continue;
			}
			if (sc.eatWord("node")) {
				sc.bracket();
				String name = sc.parenthesized();
				String label = sc.braced();
				elements.add(new LabelElement(current == null ? new Point.Absolute(0, 0) : current,
						label == null ? "" : label, name));
				continue;
			}
			if (sc.eatWord("coordinate")) {
				String name = sc.parenthesized();
				if (name != null) {
					elements.add(new NamedCoordinate(name, current == null ? new Point.Absolute(0, 0) : current));
				}
				continue;
			}
			if (sc.eatWord("cycle")) {
				segments.add(new PathSegment.Close());
				continue;
			}
			skip(sc.word(), text);
			break;
		}
		if (!segments.isEmpty() && segments.get(0) instanceof PathSegment.MoveTo) {
			elements.add(new PathElement(List.copyOf(segments), drawStyle));
		}
	}

	private void node(Scanner sc, String text) {
		sc.bracket();
		sc.skipSpace();
		String name = sc.parenthesized();
		sc.skipSpace();
		Point at = new Point.Absolute(0, 0);
		if (sc.eatWord("at")) {
			at = point(sc, text);
			if (at == null) {
				return;
			}
		}
		sc.skipSpace();
		String label = sc.braced();
		elements.add(new LabelElement(at, label == null ? "" : label.strip(), name));
	}

	private void coordinate(Scanner sc, String text) {
		sc.bracket();
		sc.skipSpace();
		String name = sc.parenthesized();
		sc.skipSpace();
		if (name == null || !sc.eatWord("at")) {
			skip("\\coordinate", text);
			return;
		}
		Point at = point(sc, text);
		if (at != null) {
			elements.add(new NamedCoordinate(name.strip(), at));
		}
	}

	/** A point at the scanner, or null after reporting it as skipped. */
	private Point point(Scanner sc, String text) {
		sc.skipSpace();
		boolean moves = false;
		boolean relative = false;
		if (sc.eat("++")) {
			relative = true;
			moves = true;
		} else if (sc.eat("+")) {
			relative = true;
		}
		String inner = sc.parenthesized();
		if (inner == null) {
			skip("point", text);
			return null;
		}
		Point p = parsePoint(inner.strip());
		if (p == null) {
			skip("(" + inner + ")", text);
			return null;
		}
		if (relative) {
			if (p instanceof Point.Absolute a) {
				return new Point.Relative(a.x(), a.y(), moves);
			}
			skip("(" + inner + ")", text);
			return null;
		}
		return p;
	}

	static Point parsePoint(String inner) {
		if (inner.startsWith("$")) {
			return null;
		}
		int comma = inner.indexOf(',');
		if (comma >= 0) {
			Double x = Numbers.parse(inner.substring(0, comma));
			Double y = Numbers.parse(inner.substring(comma + 1));
			return x == null || y == null ? null : new Point.Absolute(x, y);
		}
		int colon = inner.indexOf(':');
		if (colon >= 0) {
			Double angle = Numbers.parse(inner.substring(0, colon));
			Double radius = Numbers.parse(inner.substring(colon + 1));
			return angle == null || radius == null ? null : new Point.Polar(angle, radius);
		}
		if (inner.isEmpty() || inner.contains(" ") && !inner.contains(".")) {
			return null;
		}
		int dot = inner.indexOf('.');
		return dot < 0 ? new Point.Anchor(inner, null)
				: new Point.Anchor(inner.substring(0, dot).strip(), inner.substring(dot + 1).strip());
	}

	/** {@code arc (a:b:r)} or {@code arc[start angle=a, end angle=b, radius=r]}. */
	private static PathSegment.Arc arc(Scanner sc) {
		sc.skipSpace();
		String paren = sc.parenthesized();
		if (paren != null) {
			String[] parts = paren.split(":");
			if (parts.length != 3) {
				return null;
			}
			Double a = Numbers.parse(parts[0]);
			Double b = Numbers.parse(parts[1]);
			Double r = Numbers.parse(parts[2]);
			return a == null || b == null || r == null ? null : new PathSegment.Arc(a, b, r);
		}
		String options = sc.bracket();
		if (options == null) {
			return null;
		}
		Double a = null;
		Double b = null;
		Double r = null;
		Double delta = null;
		for (String option : splitTopLevel(options)) {
			String[] kv = option.split("=", 2);
			if (kv.length != 2) {
				continue;
			}
			Double v = Numbers.parse(kv[1]);
			switch (kv[0].strip()) {
				case "start angle" -> a = v;
				case "end angle" -> b = v;
				case "delta angle" -> delta = v;
				case "radius" -> r = v;
				default -> {
				}
			}
		}
		if (b == null && a != null && delta != null) {
			b = a + delta;
		}
		return a == null || b == null || r == null ? null : new PathSegment.Arc(a, b, r);
	}

	/** {@code circle (r)} or {@code circle[radius=r]}. */
	private static Double radius(Scanner sc) {
		sc.skipSpace();
		String paren = sc.parenthesized();
		if (paren != null) {
			return Numbers.parse(paren);
		}
		String options = sc.bracket();
		if (options == null) {
			return null;
		}
		for (String option : splitTopLevel(options)) {
			String[] kv = option.split("=", 2);
			if (kv.length == 2 && kv[0].strip().equals("radius")) {
				return Numbers.parse(kv[1]);
			}
		}
		return null;
	}

	static StyleBuilder options(String options) {
		StyleBuilder style = new StyleBuilder();
		if (options == null) {
			return style;
		}
		for (String raw : splitTopLevel(options)) {
			String option = raw.strip();
			String[] kv = option.split("=", 2);
			String key = kv[0].strip();
			String value = kv.length == 2 ? kv[1].strip() : null;
			if (value != null) {
				switch (key) {
					case "draw" -> style.draw = value;
					case "fill" -> style.fill = value;
					case "color" -> style.color = value;
					default -> log.debug("ignoring picture option {}", option);
				}
				continue;
			}
			switch (key) {
				case "draw" -> style.drawFlag = true;
				case "dashed", "densely dashed", "loosely dashed", "dotted" -> style.dashed = true;
				case "thick", "very thick", "ultra thick" -> style.thick = true;
				case "->", "-stealth", "-latex", "-Latex", "-Stealth" -> style.arrowEnd = true;
				case "<-", "stealth-", "latex-" -> style.arrowStart = true;
				case "<->", "stealth-stealth", "latex-latex" -> {
					style.arrowStart = true;
					style.arrowEnd = true;
				}
				default -> {
					if (COLORS.contains(key) || key.contains("!")) {
						style.color = key;
					} else {
						log.debug("ignoring picture option {}", option);
					}
				}
			}
		}
		return style;
	}

	private void skip(String name, String snippet) {
		skipped.add(new PictureReading.Skipped(name, snippet));
	}

	private static String firstWord(String s) {
		int end = 0;
		while (end < s.length() && !Character.isWhitespace(s.charAt(end)) && s.charAt(end) != '['
				&& s.charAt(end) != '{' && s.charAt(end) != '(') {
			end++;
		}
		return end == 0 ? s : s.substring(0, end);
	}

	static String stripComments(String source) {
		StringBuilder sb = new StringBuilder();
		for (String line : source.split("\n", -1)) {
			int cut = -1;
			for (int i = 0; i < line.length(); i++) {
				if (line.charAt(i) == '%' && (i == 0 || line.charAt(i - 1) != '\\')) {
					cut = i;
					break;
				}
			}
			sb.append(cut < 0 ? line : line.substring(0, cut)).append('\n');
		}
		return sb.toString();
	}

	/** Splits at semicolons outside braces, brackets and parentheses. */
	static List<String> statements(String body) {
		List<String> out = new ArrayList<>();
		int depth = 0;
		int start = 0;
		for (int i = 0; i < body.length(); i++) {
			char ch = body.charAt(i);
			if (ch == '{' || ch == '[' || ch == '(') {
				depth++;
			} else if (ch == '}' || ch == ']' || ch == ')') {
				depth = Math.max(0, depth - 1);
			} else if (ch == ';' && depth == 0) {
				out.add(body.substring(start, i));
				start = i + 1;
			}
		}
		if (!body.substring(start).isBlank()) {
			out.add(body.substring(start));
		}
		return out;
	}

	static List<String> splitTopLevel(String text) {
		List<String> out = new ArrayList<>();
		int depth = 0;
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			char ch = text.charAt(i);
			if (ch == '{' || ch == '(' || ch == '[') {
				depth++;
			} else if (ch == '}' || ch == ')' || ch == ']') {
				depth--;
			} else if (ch == ',' && depth == 0) {
				out.add(text.substring(start, i));
				start = i + 1;
			}
		}
		out.add(text.substring(start));
		return out;
	}

	/** Index of the bracket closing the one at {@code open}, or the last index. */
	static int closing(String s, int open, char opener, char closer) {
		int depth = 0;
		for (int i = open; i < s.length(); i++) {
			char ch = s.charAt(i);
			if (ch == opener) {
				depth++;
			} else if (ch == closer && --depth == 0) {
				return i;
			}
		}
		return s.length() - 1;
	}

	/** Character scanner over one statement. */
	private static final class Scanner {
		private final String s;
		private int pos;
		private String last;

		Scanner(String s) {
			this.s = s;
		}

		boolean atEnd() {
			return pos >= s.length();
		}

		void skipSpace() {
			while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) {
				pos++;
			}
		}

		String last() {
			return last;
		}

		/** Name of the control word at the start, without the backslash. */
		String command() {
			skipSpace();
			if (pos >= s.length() || s.charAt(pos) != '\\') {
				return null;
			}
			int start = ++pos;
			while (pos < s.length() && Character.isLetter(s.charAt(pos))) {
				pos++;
			}
			return s.substring(start, pos);
		}

		boolean eat(String token) {
			if (s.startsWith(token, pos)) {
				pos += token.length();
				last = token;
				return true;
			}
			return false;
		}

		boolean eatWord(String word) {
			skipSpace();
			if (s.startsWith(word, pos)
					&& (pos + word.length() >= s.length() || !Character.isLetter(s.charAt(pos + word.length())))) {
				pos += word.length();
				return true;
			}
			return false;
		}

		String word() {
			int start = pos;
			while (pos < s.length() && !Character.isWhitespace(s.charAt(pos))) {
				pos++;
			}
			return s.substring(start, pos);
		}

		boolean peekPoint() {
			return s.startsWith("(", pos) || s.startsWith("+", pos);
		}

		String bracket() {
			return group('[', ']');
		}

		String parenthesized() {
			return group('(', ')');
		}

		String braced() {
			return group('{', '}');
		}

		private String group(char open, char close) {
			skipSpace();
			if (pos >= s.length() || s.charAt(pos) != open) {
				return null;
			}
			int end = closing(s, pos, open, close);
			String inner = s.substring(pos + 1, Math.max(pos + 1, end));
			pos = end + 1;
			return inner;
		}
	}
}
