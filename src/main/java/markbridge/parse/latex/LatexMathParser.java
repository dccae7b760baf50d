package markbridge.parse.latex;

import markbridge.ast.math.Delimiters;
import markbridge.ast.math.MathArg;
import markbridge.ast.math.MathAtom;
import markbridge.ast.math.MathAttach;
import markbridge.ast.math.MathCall;
import markbridge.ast.math.MathDelimited;
import markbridge.ast.math.MathIdent;
import markbridge.ast.math.MathLineBreak;
import markbridge.ast.math.MathMatrix;
import markbridge.ast.math.MathNode;
import markbridge.ast.math.MathPassthrough;
import markbridge.ast.math.MathRow;
import markbridge.ast.math.MathText;
import markbridge.ast.doc.LossMarker;
import markbridge.loss.LossKind;
import markbridge.loss.LossRecord;
import markbridge.loss.LossTracker;
import markbridge.transform.Strategy;
import markbridge.transform.SymbolEntry;
import markbridge.transform.SymbolTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds syntactic math trees from LaTeX tokens. Names are kept as written; the
 * converter resolves them through the symbol table. The table is consulted here
 * only for the number of arguments a command takes.
 */
public final class LatexMathParser {
	private static final Set<String> IGNORED = Set.of("displaystyle", "textstyle", "scriptstyle",
			"scriptscriptstyle", "limits", "nolimits", "nonumber", "notag", "!", "/", "-", "relax", "protect");
	private static final Set<String> SIZED = Set.of("big", "Big", "bigg", "Bigg", "bigl", "bigr", "Bigl", "Bigr",
			"biggl", "biggr", "Biggl", "Biggr", "bigm", "Bigm", "middle");
	private static final Set<String> TEXT_LIKE = Set.of("textbf", "textit", "texttt", "emph", "textsf", "textsl",
			"operatorname", "operatorname*");

	private final SymbolTable symbols;
	private final LossTracker tracker;

	/**
	 * @param tracker receives unknown-environment losses; may be null when only the
	 *                structure matters
	 */
	public LatexMathParser(SymbolTable symbols, LossTracker tracker) {
		this.symbols = symbols;
		this.tracker = tracker;
	}

	public MathNode parse(List<TexToken> tokens) {
		return unwrap(row(new TexCursor(tokens)));
	}

	private MathRow row(TexCursor c) {
		List<MathNode> items = new ArrayList<>();
		while (!c.atEnd()) {
			TexToken t = c.peek();
			switch (t.type()) {
				case SPACE, PAR, ACTIVE, MATH_SHIFT, VERBATIM, END_GROUP -> c.next();
				case BEGIN_GROUP -> items.add(group(c.readGroup()));
				case SUPERSCRIPT, SUBSCRIPT -> {
					c.next();
					MathNode script = argument(c);
					attach(items, script, t.type() == TexTokenType.SUPERSCRIPT);
				}
				case ALIGN_TAB -> {
					c.next();
					items.add(new MathAtom("&"));
				}
				case CHAR -> items.add(atom(c));
				case PARAM -> {
					c.next();
					items.add(new MathAtom("#" + t.text()));
				}
				case COMMENT -> {
					c.next();
					items.add(passthroughMarker(t.text()));
				}
				case CONTROL_SEQ -> {
					MathNode node = command(c);
					if (node != null) {
						items.add(node);
					}
				}
			}
		}
		return new MathRow(items);
	}

	private static void attach(List<MathNode> items, MathNode script, boolean sup) {
		MathNode base = items.isEmpty() ? MathRow.of() : items.remove(items.size() - 1);
		if (base instanceof MathAttach a && (sup ? a.sup() == null : a.sub() == null)) {
			items.add(sup ? new MathAttach(a.base(), a.sub(), script) : new MathAttach(a.base(), script, a.sup()));
			return;
		}
		items.add(sup ? new MathAttach(base, null, script) : new MathAttach(base, script, null));
	}

	private static MathNode atom(TexCursor c) {
		TexToken t = c.next();
		char ch = t.text().charAt(0);
		if (Character.isDigit(ch)) {
			StringBuilder number = new StringBuilder(t.text());
			while (!c.atEnd()) {
				TexToken next = c.peek();
				if (next.type() != TexTokenType.CHAR) {
					break;
				}
				char n = next.text().charAt(0);
				boolean decimalPoint = n == '.' && c.peek(1) != null && c.peek(1).type() == TexTokenType.CHAR
						&& Character.isDigit(c.peek(1).text().charAt(0));
				if (!Character.isDigit(n) && !decimalPoint) {
					break;
				}
				number.append(n);
				c.next();
			}
			return new MathAtom(number.toString());
		}
		return new MathAtom(t.text());
	}

	/** Single argument of a script or command: a group, a command or one character. */
	private MathNode argument(TexCursor c) {
		c.skipSpaces();
		if (c.atEnd()) {
			return MathRow.of();
		}
		TexToken t = c.peek();
		if (t.type() == TexTokenType.BEGIN_GROUP) {
			return unwrap(row(new TexCursor(c.readGroup())));
		}
		if (t.type() == TexTokenType.CONTROL_SEQ) {
			MathNode node = command(c);
			return node == null ? MathRow.of() : node;
		}
		if (t.type() == TexTokenType.CHAR) {
			c.next();
			return new MathAtom(t.text());
		}
		c.next();
		return MathRow.of();
	}

	private MathNode group(List<TexToken> tokens) {
		MathRow inner = row(new TexCursor(tokens));
		return inner.items().size() == 1 ? inner.items().get(0) : inner;
	}

	private MathNode command(TexCursor c) {
		TexToken t = c.next();
		String name = t.text();
		if (IGNORED.contains(name)) {
			return null;
		}
		if (name.equals("label")) {
			c.readArgument();
			return null;
		}
		if (name.equals("left")) {
			return delimited(c);
		}
		if (SIZED.contains(name)) {
			String delimiter = delimiter(c);
			return delimiter.equals(".") ? null : new MathAtom(delimiter);
		}
		if (name.equals("begin")) {
			return environment(c);
		}
		if (name.equals("\\")) {
			c.readStar();
			c.readOptional();
			return new MathLineBreak();
		}
		if (name.equals("{") || name.equals("}") || name.equals("%") || name.equals("&") || name.equals("$")
				|| name.equals("#") || name.equals("_")) {
			return new MathAtom(name);
		}
		if (TEXT_LIKE.contains(name)) {
			String text = c.readText();
			return new MathCall(name, List.of(MathArg.positional(new MathText(text == null ? "" : text))));
		}
		SymbolEntry entry = t.lossId() == null ? symbols.byLatex(name) : null;
		if (entry != null) {
			if (entry.strategy() == Strategy.TEXT) {
				String text = c.readText();
				return new MathCall(name, List.of(MathArg.positional(new MathText(text == null ? "" : text))));
			}
			if (entry.arity() == 0 || entry.strategy() == Strategy.INFIX) {
				return new MathIdent(name);
			}
			MathNode optional = null;
			if (entry.optional()) {
				List<TexToken> opt = c.readOptional();
				optional = opt == null ? null : unwrap(row(new TexCursor(opt)));
			}
			List<MathArg> args = new ArrayList<>();
			for (int i = 0; i < entry.arity(); i++) {
				args.add(MathArg.positional(argument(c)));
			}
			return new MathCall(name, optional, args, null);
		}
		// unknown or structural: take the braced groups that follow directly
		List<MathArg> args = new ArrayList<>();
		while (!c.atEnd() && c.peek().type() == TexTokenType.BEGIN_GROUP) {
			args.add(MathArg.positional(unwrap(row(new TexCursor(c.readGroup())))));
		}
		if (args.isEmpty()) {
			return new MathIdent(name, t.lossId());
		}
		return new MathCall(name, null, args, t.lossId());
	}

	private MathNode delimited(TexCursor c) {
		String open = delimiter(c);
		List<TexToken> inner = new ArrayList<>();
		int nesting = 0;
		while (!c.atEnd()) {
			TexToken t = c.next();
			if (t.isCs("left")) {
				nesting++;
			} else if (t.isCs("right")) {
				if (nesting == 0) {
					String close = delimiter(c);
					return new MathDelimited(open, unwrap(row(new TexCursor(inner))), close, true);
				}
				nesting--;
			}
			inner.add(t);
		}
		return new MathDelimited(open, unwrap(row(new TexCursor(inner))), ".", true);
	}

	private static String delimiter(TexCursor c) {
		c.skipSpaces();
		if (c.atEnd()) {
			return ".";
		}
		TexToken t = c.next();
		if (t.type() == TexTokenType.CONTROL_SEQ) {
			String mapped = Delimiters.fromLatexCommand(t.text());
			return mapped == null ? "." : mapped;
		}
		return t.text();
	}

	private MathNode environment(TexCursor c) {
		String env = c.readText();
		if (env == null) {
			return null;
		}
		List<TexToken> body = new ArrayList<>();
		int nesting = 0;
		while (!c.atEnd()) {
			int position = c.position();
			TexToken t = c.next();
			if (t.isCs("begin") || t.isCs("end")) {
				String name = c.readText();
				if (env.equals(name)) {
					if (t.isCs("begin")) {
						nesting++;
					} else if (nesting-- == 0) {
						break;
					}
				}
				body.addAll(c.slice(position, c.position()));
				continue;
			}
			body.add(t);
		}
		TexCursor inner = new TexCursor(body);
		if (LatexEnvironments.MATRICES.contains(env)) {
			if (env.equals("array")) {
				inner.readArgument();
			}
			String kind = env.equals("smallmatrix") || env.equals("array") ? "matrix" : env;
			return new MathMatrix(kind, matrixRows(inner.rest()));
		}
		if (LatexEnvironments.ALIGNED.contains(env)) {
			if (env.equals("alignedat")) {
				inner.readArgument();
			}
			return row(inner);
		}
		MathRow content = row(inner);
		if (tracker == null) {
			return content;
		}
		LossRecord loss = tracker.record(LossKind.UNKNOWN_ENVIRONMENT, env, "unknown math environment " + env,
				"\\begin{" + env + "}", "math");
		return new MathPassthrough(loss.id(), "\\begin{" + env + "}", content);
	}

	private List<List<MathNode>> matrixRows(List<TexToken> body) {
		List<List<MathNode>> rows = new ArrayList<>();
		List<MathNode> cells = new ArrayList<>();
		List<TexToken> cell = new ArrayList<>();
		TexCursor c = new TexCursor(body);
		while (!c.atEnd()) {
			TexToken t = c.next();
			if (t.type() == TexTokenType.BEGIN_GROUP) {
				cell.add(t);
				int start = c.position();
				c.reset(start - 1);
				c.readGroup();
				cell.addAll(c.slice(start, c.position()));
				continue;
			}
			if (t.type() == TexTokenType.ALIGN_TAB) {
				cells.add(parse(cell));
				cell = new ArrayList<>();
			} else if (t.isCs("\\")) {
				c.readOptional();
				cells.add(parse(cell));
				rows.add(cells);
				cells = new ArrayList<>();
				cell = new ArrayList<>();
			} else if (!t.isCs("hline")) {
				cell.add(t);
			}
		}
		if (!TexTokens.trim(cell).isEmpty() || !cells.isEmpty()) {
			cells.add(parse(cell));
			rows.add(cells);
		}
		return rows;
	}

	private static MathNode passthroughMarker(String comment) {
		String rest = comment.substring(LossMarker.PREFIX.length()).trim();
		int space = rest.indexOf(' ');
		String id = space < 0 ? rest : rest.substring(0, space);
		String snippet = space < 0 ? "" : rest.substring(space + 1).trim();
		return new MathPassthrough(id, snippet, MathRow.of());
	}

	private static MathNode unwrap(MathRow row) {
		return row.items().size() == 1 ? row.items().get(0) : row;
	}
}
