package markbridge.parse.typst;

import markbridge.ast.SourceSpan;
import markbridge.ast.doc.LossMarker;
import markbridge.ast.math.MathArg;
import markbridge.ast.math.MathAtom;
import markbridge.ast.math.MathAttach;
import markbridge.ast.math.MathCall;
import markbridge.ast.math.MathDelimited;
import markbridge.ast.math.MathEmbed;
import markbridge.ast.math.MathFrac;
import markbridge.ast.math.MathIdent;
import markbridge.ast.math.MathLineBreak;
import markbridge.ast.math.MathMatrix;
import markbridge.ast.math.MathNode;
import markbridge.ast.math.MathPassthrough;
import markbridge.ast.math.MathRow;
import markbridge.ast.math.MathText;
import markbridge.ast.script.Expr;
import markbridge.parse.ParseDiagnostic;
import markbridge.transform.SymbolEntry;
import markbridge.transform.SymbolTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Parses Typst math between {@code $} delimiters into a syntactic math tree.
 */
final class TypstMathParser {
	/** Longest shorthands first. */
	private static final String[][] SHORTHANDS = {
			{ "<==>", "arrow.l.r.double.long" },
			{ "==>", "arrow.r.double.long" },
			{ "<==", "arrow.l.double.long" },
			{ "-->", "arrow.r.long" },
			{ "<--", "arrow.l.long" },
			{ "|->", "arrow.r.bar" },
			{ "<=>", "arrow.l.r.double" },
			{ "<->", "arrow.l.r" },
			{ "...", "dots.h" },
			{ "->", "arrow.r" },
			{ "<-", "arrow.l" },
			{ "=>", "arrow.r.double" },
			{ "<=", "lt.eq" },
			{ ">=", "gt.eq" },
			{ "!=", "eq.not" },
			{ "<<", "lt.double" },
			{ ">>", "gt.double" },
			{ ":=", "colon.eq" },
			{ "||", "bar.v.double" },
	};
	/** Functions that take parenthesized arguments even though they are not symbols. */
	private static final Set<String> FUNCTIONS = Set.of("mat", "cases", "vec", "lr", "abs", "norm", "floor", "ceil",
			"attach", "op", "display", "inline", "limits", "scripts", "class", "stretch", "accent", "root");
	private static final Map<String, String[]> FENCES = Map.of(
			"abs", new String[] { "|", "|" },
			"norm", new String[] { "‖", "‖" },
			"floor", new String[] { "⌊", "⌋" },
			"ceil", new String[] { "⌈", "⌉" });
	private static final Map<String, String> MATRIX_DELIMS = Map.of(
			"(", "pmatrix",
			"[", "bmatrix",
			"{", "Bmatrix",
			"|", "vmatrix",
			"‖", "Vmatrix",
			"||", "Vmatrix");

	private final TypstCursor c;
	private final SymbolTable symbols;
	private final Supplier<Expr> embed;
	private final List<ParseDiagnostic> errors;

	TypstMathParser(TypstCursor c, SymbolTable symbols, Supplier<Expr> embed, List<ParseDiagnostic> errors) {
		this.c = c;
		this.symbols = symbols;
		this.embed = embed;
		this.errors = errors;
	}

	record Result(MathNode math, boolean block) {
	}

	/** Cursor on the opening {@code $}; consumes through the closing one. */
	Result equation() {
		int start = c.pos;
		c.pos++;
		boolean leadingSpace = Character.isWhitespace(c.peek());
		MathRow row = row("$");
		boolean trailingSpace = c.pos > start + 1 && Character.isWhitespace(c.src.charAt(c.pos - 1));
		if (!c.eat('$')) {
			errors.add(new ParseDiagnostic("unclosed equation", new SourceSpan(start, c.pos)));
		}
		return new Result(unwrap(row), leadingSpace && trailingSpace);
	}

	/** Parses a whole string as math content. */
	MathNode content() {
		return unwrap(row(""));
	}

	private MathRow row(String terminators) {
		List<MathNode> items = new ArrayList<>();
		while (!c.atEnd()) {
			char ch = c.peek();
			if (Character.isWhitespace(ch)) {
				c.pos++;
				continue;
			}
			if (terminators.indexOf(ch) >= 0) {
				break;
			}
			if (ch == '/' && c.peek(1) != '/' && c.peek(1) != '*') {
				c.pos++;
				MathNode numerator = items.isEmpty() ? MathRow.of() : stripParens(items.remove(items.size() - 1));
				skipSpace();
				MathNode denominator = c.atEnd() || terminators.indexOf(c.peek()) >= 0 ? MathRow.of()
						: stripParens(scripted(terminators));
				items.add(new MathFrac(numerator, denominator));
				continue;
			}
			if (ch == '^' || ch == '_') {
				c.pos++;
				attach(items, scriptArgument(terminators), ch == '^');
				continue;
			}
			MathNode node = primary(terminators);
			if (node != null) {
				items.add(node);
			}
		}
		return new MathRow(items);
	}

	private void skipSpace() {
		while (!c.atEnd() && Character.isWhitespace(c.peek())) {
			c.pos++;
		}
	}

	/** Primary with any scripts that follow it directly. */
	private MathNode scripted(String terminators) {
		List<MathNode> items = new ArrayList<>();
		MathNode node = primary(terminators);
		items.add(node == null ? MathRow.of() : node);
		while (c.peek() == '^' || c.peek() == '_') {
			char op = c.next();
			attach(items, scriptArgument(terminators), op == '^');
		}
		return items.get(0);
	}

	private MathNode scriptArgument(String terminators) {
		if (c.atEnd() || terminators.indexOf(c.peek()) >= 0) {
			return MathRow.of();
		}
		MathNode node = primary(terminators);
		return node == null ? MathRow.of() : stripParens(node);
	}

	private static void attach(List<MathNode> items, MathNode script, boolean sup) {
		MathNode base = items.isEmpty() ? MathRow.of() : items.remove(items.size() - 1);
		if (base instanceof MathAttach a && (sup ? a.sup() == null : a.sub() == null)) {
			items.add(sup ? new MathAttach(a.base(), a.sub(), script) : new MathAttach(a.base(), script, a.sup()));
			return;
		}
		items.add(sup ? new MathAttach(base, null, script) : new MathAttach(base, script, null));
	}

	private MathNode primary(String terminators) {
		char ch = c.peek();
		if (ch == '"') {
			return new MathText(string());
		}
		if (ch == '#') {
			int start = c.pos;
			c.pos++;
			Expr expr = embed.get();
			return new MathEmbed(expr, c.src.substring(start, c.pos));
		}
		if (ch == '\\') {
			c.pos++;
			if (c.atEnd() || Character.isWhitespace(c.peek())) {
				return new MathLineBreak();
			}
			return new MathAtom(String.valueOf(c.next()));
		}
		if (c.startsWith("//")) {
			while (!c.atEnd() && c.peek() != '\n') {
				c.pos++;
			}
			return null;
		}
		if (c.startsWith("/*")) {
			return comment();
		}
		if (Character.isDigit(ch)) {
			return number();
		}
		if (Character.isLetter(ch)) {
			return identifier();
		}
		for (String[] shorthand : SHORTHANDS) {
			if (c.startsWith(shorthand[0])) {
				c.pos += shorthand[0].length();
				return new MathIdent(shorthand[1]);
			}
		}
		if (ch == '(' || ch == '[' || ch == '{') {
			char close = ch == '(' ? ')' : ch == '[' ? ']' : '}';
			int start = c.pos;
			c.pos++;
			MathRow body = row(close + "$");
			if (!c.eat(close)) {
				errors.add(new ParseDiagnostic("unclosed " + ch + " in math", new SourceSpan(start, c.pos)));
			}
			return new MathDelimited(String.valueOf(ch), unwrap(body), String.valueOf(close), false);
		}
		c.pos++;
		return new MathAtom(String.valueOf(ch));
	}

	private MathNode comment() {
		int end = c.src.indexOf("*/", c.pos + 2);
		String text = c.src.substring(c.pos + 2, end < 0 ? c.src.length() : end).trim();
		c.pos = end < 0 ? c.src.length() : end + 2;
		if (!text.startsWith(LossMarker.PREFIX)) {
			return null;
		}
		String rest = text.substring(LossMarker.PREFIX.length()).trim();
		int space = rest.indexOf(' ');
		String id = space < 0 ? rest : rest.substring(0, space);
		String snippet = space < 0 ? "" : rest.substring(space + 1).trim();
		return new MathPassthrough(id, snippet, MathRow.of());
	}

	private String string() {
		int start = c.pos;
		c.pos++;
		StringBuilder sb = new StringBuilder();
		while (!c.atEnd() && c.peek() != '"') {
			char ch = c.next();
			if (ch == '\\' && !c.atEnd()) {
				char escaped = c.next();
				sb.append(escaped == 'n' ? '\n' : escaped == 't' ? '\t' : escaped);
			} else {
				sb.append(ch);
			}
		}
		if (!c.eat('"')) {
			errors.add(new ParseDiagnostic("unclosed string", new SourceSpan(start, c.pos)));
		}
		return sb.toString();
	}

	private MathNode number() {
		int start = c.pos;
		while (Character.isDigit(c.peek())) {
			c.pos++;
		}
		if (c.peek() == '.' && Character.isDigit(c.peek(1))) {
			c.pos++;
			while (Character.isDigit(c.peek())) {
				c.pos++;
			}
		}
		return new MathAtom(c.src.substring(start, c.pos));
	}

	private MathNode identifier() {
		int start = c.pos;
		while (Character.isLetter(c.peek())) {
			c.pos++;
		}
		if (c.pos - start == 1 && c.peek() != '.') {
			return new MathAtom(c.src.substring(start, c.pos));
		}
		while (c.peek() == '.' && Character.isLetter(c.peek(1))) {
			c.pos++;
			while (Character.isLetter(c.peek())) {
				c.pos++;
			}
		}
		String name = c.src.substring(start, c.pos);
		if (c.peek() == '(' && isFunction(name)) {
			return call(name);
		}
		return new MathIdent(name);
	}

	private boolean isFunction(String name) {
		if (name.length() < 2) {
			return false;
		}
		if (FUNCTIONS.contains(name)) {
			return true;
		}
		SymbolEntry entry = symbols.byTypst(name);
		return entry == null ? name.indexOf('.') < 0 : entry.arity() > 0;
	}

	private MathNode call(String name) {
		int start = c.pos;
		c.pos++;
		List<List<MathArg>> rows = new ArrayList<>();
		List<MathArg> args = new ArrayList<>();
		boolean semicolons = false;
		while (!c.atEnd()) {
			skipSpace();
			if (c.peek() == ')') {
				break;
			}
			String argName = argumentName();
			MathNode value = unwrap(row(",;)$"));
			args.add(new MathArg(argName, value));
			if (c.peek() == ',') {
				c.pos++;
			} else if (c.peek() == ';') {
				c.pos++;
				semicolons = true;
				rows.add(args);
				args = new ArrayList<>();
			} else {
				break;
			}
		}
		if (!c.eat(')')) {
			errors.add(new ParseDiagnostic("unclosed call to " + name, new SourceSpan(start, c.pos)));
		}
		if (semicolons) {
			if (!args.isEmpty()) {
				rows.add(args);
			}
		}
		if (name.equals("mat")) {
			if (!semicolons) {
				rows.add(args);
			}
			return matrix(rows);
		}
		if (name.equals("cases")) {
			return cases(args);
		}
		if (name.equals("vec")) {
			List<List<MathNode>> cells = new ArrayList<>();
			for (MathArg arg : args) {
				if (!arg.isNamed()) {
					cells.add(List.of(arg.value()));
				}
			}
			return new MathMatrix("pmatrix", cells);
		}
		if (name.equals("lr") && args.size() == 1) {
			return fenced(args.get(0).value());
		}
		String[] fence = FENCES.get(name);
		if (fence != null && args.size() == 1) {
			return new MathDelimited(fence[0], args.get(0).value(), fence[1], true);
		}
		if (semicolons) {
			List<MathArg> flat = new ArrayList<>();
			rows.forEach(flat::addAll);
			args = flat;
		}
		return new MathCall(name, null, args, null);
	}

	/** {@code name:} before an argument, or null. */
	private String argumentName() {
		int save = c.pos;
		if (Character.isLetter(c.peek())) {
			while (Character.isLetter(c.peek()) || c.peek() == '-') {
				c.pos++;
			}
			String name = c.src.substring(save, c.pos);
			skipSpace();
			if (c.peek() == ':' && c.peek(1) != '=') {
				c.pos++;
				return name;
			}
		}
		c.pos = save;
		return null;
	}

	private static MathNode matrix(List<List<MathArg>> rows) {
		String kind = "pmatrix";
		List<List<MathNode>> cells = new ArrayList<>();
		for (List<MathArg> row : rows) {
			List<MathNode> out = new ArrayList<>();
			for (MathArg arg : row) {
				if (arg.isNamed()) {
					if (arg.name().equals("delim")) {
						kind = matrixKind(arg.value());
					}
				} else {
					out.add(arg.value());
				}
			}
			if (!out.isEmpty()) {
				cells.add(out);
			}
		}
		return new MathMatrix(kind, cells);
	}

	private static String matrixKind(MathNode delim) {
		if (delim instanceof MathText text) {
			return MATRIX_DELIMS.getOrDefault(text.text(), "pmatrix");
		}
		if (delim instanceof MathEmbed || delim instanceof MathIdent ident && ident.name().equals("none")) {
			return "matrix";
		}
		return "pmatrix";
	}

	private static MathNode cases(List<MathArg> args) {
		List<List<MathNode>> rows = new ArrayList<>();
		for (MathArg arg : args) {
			if (arg.isNamed()) {
				continue;
			}
			List<MathNode> cells = new ArrayList<>();
			List<MathNode> cell = new ArrayList<>();
			List<MathNode> items = arg.value() instanceof MathRow row ? row.items() : List.of(arg.value());
			for (MathNode item : items) {
				if (item instanceof MathAtom atom && atom.text().equals("&")) {
					cells.add(unwrap(new MathRow(cell)));
					cell = new ArrayList<>();
				} else {
					cell.add(item);
				}
			}
			cells.add(unwrap(new MathRow(cell)));
			rows.add(cells);
		}
		return new MathMatrix("cases", rows);
	}

	private static MathNode fenced(MathNode body) {
		if (body instanceof MathDelimited d) {
			return new MathDelimited(d.open(), d.body(), d.close(), true);
		}
		if (body instanceof MathRow row && row.items().size() >= 2) {
			List<MathNode> items = row.items();
			String open = delimiterText(items.get(0));
			String close = delimiterText(items.get(items.size() - 1));
			if (open != null && close != null) {
				return new MathDelimited(open, unwrap(new MathRow(items.subList(1, items.size() - 1))), close, true);
			}
		}
		return new MathDelimited(".", body, ".", true);
	}

	private static String delimiterText(MathNode node) {
		return node instanceof MathAtom atom && atom.text().length() == 1 ? atom.text() : null;
	}

	private static MathNode stripParens(MathNode node) {
		if (node instanceof MathDelimited d && !d.sized() && d.open().equals("(") && d.close().equals(")")) {
			return d.body();
		}
		return node;
	}

	static MathNode unwrap(MathRow row) {
		return row.items().size() == 1 ? row.items().get(0) : row;
	}
}
