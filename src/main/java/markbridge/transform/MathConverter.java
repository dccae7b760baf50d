package markbridge.transform;

import markbridge.ast.math.Delimiters;
import markbridge.ast.math.MathAccent;
import markbridge.ast.math.MathArg;
import markbridge.ast.math.MathAtom;
import markbridge.ast.math.MathAttach;
import markbridge.ast.math.MathCall;
import markbridge.ast.math.MathEmbed;
import markbridge.ast.math.MathFrac;
import markbridge.ast.math.MathIdent;
import markbridge.ast.math.MathNode;
import markbridge.ast.math.MathNodes;
import markbridge.ast.math.MathOperatorName;
import markbridge.ast.math.MathPassthrough;
import markbridge.ast.math.MathRoot;
import markbridge.ast.math.MathRow;
import markbridge.ast.math.MathText;
import markbridge.loss.LossKind;
import markbridge.loss.LossRecord;
import markbridge.loss.LossTracker;
import markbridge.print.LatexMathPrinter;
import markbridge.print.TypstMathPrinter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rewrites math trees between LaTeX and Typst spelling, dispatching on the symbol
 * table's strategy for every command or function.
 *
 * Names the table does not know become {@link MathPassthrough} nodes. A name that
 * arrives with a loss id keeps it; otherwise an {@code unknown-command} loss is
 * recorded here.
 */
public final class MathConverter {
	private static final Logger log = LoggerFactory.getLogger(MathConverter.class);

	private static final Map<String, String> TEXT_STYLES = Map.of("textbf", "bold", "textit", "italic", "emph",
			"italic", "textsl", "italic", "texttt", "mono", "textsf", "sans");
	private static final Set<String> GREEK = Set.of("alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta",
			"theta", "iota", "kappa", "lambda", "mu", "nu", "xi", "omicron", "pi", "rho", "sigma", "tau", "upsilon",
			"phi", "chi", "psi", "omega", "Gamma", "Delta", "Theta", "Lambda", "Xi", "Pi", "Sigma", "Upsilon", "Phi",
			"Psi", "Omega");
	private static final Pattern SHORT_TERM = Pattern.compile("[A-Za-z0-9]{1,3}");
	private static final Pattern DOUBLE_STRUCK = Pattern.compile("([A-Z])\\1");

	private final SymbolTable symbols;
	private final LossTracker tracker;
	private final LatexMathPrinter latexSource = new LatexMathPrinter(false);
	private final TypstMathPrinter typstSource = new TypstMathPrinter(false);

	public MathConverter(SymbolTable symbols, LossTracker tracker) {
		this.symbols = symbols;
		this.tracker = tracker;
	}

	// ---------------------------------------------------------------- LaTeX -> Typst

	public MathNode toTypst(MathNode node) {
		if (node instanceof MathRow row) {
			return new MathRow(typstRow(row.items()));
		}
		if (node instanceof MathIdent ident) {
			return typstIdent(ident);
		}
		if (node instanceof MathCall call) {
			return typstCall(call);
		}
		if (node instanceof MathEmbed embed) {
			return lost(LossKind.UNSUPPORTED_EXPRESSION, "embed", embed.source(), MathRow.of(),
					"embedded code in math is not converted");
		}
		return MathNodes.rebuild(node, this::toTypst);
	}

	private List<MathNode> typstRow(List<MathNode> items) {
		int split = infixPosition(items);
		if (split >= 0) {
			SymbolEntry entry = symbols.byLatex(((MathIdent) items.get(split)).name());
			MathNode left = toTypst(unwrap(items.subList(0, split)));
			MathNode right = toTypst(unwrap(items.subList(split + 1, items.size())));
			MathNode combined = entry.typst().equals("frac")
					? fraction(left, right)
					: new MathCall(entry.typst(), List.of(MathArg.positional(left), MathArg.positional(right)));
			return List.of(combined);
		}
		List<MathNode> out = new ArrayList<>();
		for (MathNode item : items) {
			out.add(toTypst(item));
		}
		return out;
	}

	/** Index of the infix command that splits the row, honoring its associativity; -1 if none. */
	private int infixPosition(List<MathNode> items) {
		int found = -1;
		for (int i = 0; i < items.size(); i++) {
			if (items.get(i) instanceof MathIdent ident && ident.lossId() == null) {
				SymbolEntry entry = symbols.byLatex(ident.name());
				if (entry != null && entry.strategy() == Strategy.INFIX) {
					if (entry.associativity() == Associativity.RIGHT) {
						return i;
					}
					found = i;
				}
			}
		}
		return found;
	}

	private MathNode typstIdent(MathIdent ident) {
		if (ident.lossId() != null) {
			return new MathPassthrough(ident.lossId(), "\\" + ident.name(), MathRow.of());
		}
		SymbolEntry entry = symbols.byLatex(ident.name());
		if (entry == null) {
			return lost(LossKind.UNKNOWN_COMMAND, ident.name(), "\\" + ident.name(), MathRow.of(),
					"unknown command \\" + ident.name());
		}
		return new MathIdent(entry.typst());
	}

	private MathNode typstCall(MathCall call) {
		List<MathNode> args = new ArrayList<>();
		for (MathNode arg : call.positional()) {
			args.add(toTypst(arg));
		}
		if (call.lossId() != null) {
			return new MathPassthrough(call.lossId(), latexSource.print(call), new MathRow(args));
		}
		String style = TEXT_STYLES.get(call.name());
		if (style != null) {
			return new MathCall(style, List.of(MathArg.positional(first(args))));
		}
		SymbolEntry entry = symbols.byLatex(call.name());
		if (entry == null) {
			return lost(LossKind.UNKNOWN_COMMAND, call.name(), latexSource.print(call), new MathRow(args),
					"unknown command \\" + call.name());
		}
		while (args.size() < entry.arity()) {
			args.add(MathRow.of());
		}
		switch (entry.strategy()) {
			case FRACTION -> {
				return fraction(args.get(0), args.get(1));
			}
			case ROOT -> {
				return new MathRoot(call.optional() == null ? null : toTypst(call.optional()), args.get(0));
			}
			case ACCENT -> {
				return new MathAccent(entry.latex(), entry.typst(), args.get(0));
			}
			case OPERATOR -> {
				return new MathOperatorName(plainText(args.get(0)), entry.limits());
			}
			case TEXT -> {
				return first(args);
			}
			case REORDER -> {
				List<MathArg> reordered = new ArrayList<>();
				for (int i = 0; i < entry.arity(); i++) {
					reordered.add(new MathArg(entry.argumentNames().get(i), args.get(entry.order().get(i))));
				}
				return new MathCall(entry.typst(), reordered);
			}
			default -> {
				List<MathArg> out = new ArrayList<>();
				for (MathNode arg : args) {
					out.add(MathArg.positional(arg));
				}
				return new MathCall(entry.typst(), out);
			}
		}
	}

	/** Slash form for short operands, {@code frac(a, b)} otherwise. */
	MathNode fraction(MathNode numerator, MathNode denominator) {
		if (isSimple(numerator) && isSimple(denominator)) {
			return new MathFrac(numerator, denominator);
		}
		return new MathCall("frac", List.of(MathArg.positional(numerator), MathArg.positional(denominator)));
	}

	static boolean isSimple(MathNode node) {
		if (node instanceof MathAtom atom) {
			return SHORT_TERM.matcher(atom.text()).matches();
		}
		if (node instanceof MathIdent ident) {
			int dot = ident.name().indexOf('.');
			return GREEK.contains(dot < 0 ? ident.name() : ident.name().substring(0, dot));
		}
		if (node instanceof MathRow row && !row.isEmpty() && row.items().size() <= 3) {
			StringBuilder sb = new StringBuilder();
			for (MathNode item : row.items()) {
				if (!(item instanceof MathAtom atom)) {
					return false;
				}
				sb.append(atom.text());
			}
			return SHORT_TERM.matcher(sb).matches();
		}
		return false;
	}

	// ---------------------------------------------------------------- Typst -> LaTeX

	public MathNode toLatex(MathNode node) {
		if (node instanceof MathIdent ident) {
			return latexIdent(ident);
		}
		if (node instanceof MathCall call) {
			return latexCall(call);
		}
		if (node instanceof MathFrac frac) {
			return new MathCall("frac", List.of(MathArg.positional(toLatex(frac.numerator())),
					MathArg.positional(toLatex(frac.denominator()))));
		}
		if (node instanceof MathEmbed embed) {
			return lost(LossKind.UNSUPPORTED_EXPRESSION, "embed", embed.source(), MathRow.of(),
					"embedded code in math is not converted");
		}
		return MathNodes.rebuild(node, this::toLatex);
	}

	private MathNode latexIdent(MathIdent ident) {
		String name = ident.name();
		if (ident.lossId() != null) {
			return new MathPassthrough(ident.lossId(), name, MathRow.of());
		}
		SymbolEntry entry = symbols.byTypst(name);
		if (entry != null && entry.arity() == 0) {
			return new MathIdent(entry.latex());
		}
		String delimiter = Delimiters.fromTypstName(name);
		if (delimiter != null) {
			String latex = Delimiters.toLatex(delimiter);
			return latex.startsWith("\\") && Character.isLetter(latex.charAt(1))
					? new MathIdent(latex.substring(1))
					: new MathAtom(delimiter);
		}
		if (DOUBLE_STRUCK.matcher(name).matches()) {
			return style("mathbb", new MathAtom(name.substring(0, 1)));
		}
		if (name.equals("dif")) {
			return style("mathrm", new MathAtom("d"));
		}
		return lost(LossKind.UNKNOWN_COMMAND, name, name, new MathText(name), "unknown symbol " + name);
	}

	private MathNode latexCall(MathCall call) {
		List<MathNode> args = new ArrayList<>();
		for (MathNode arg : call.positional()) {
			args.add(toLatex(arg));
		}
		switch (call.name()) {
			case "frac" -> {
				if (args.size() == 2) {
					return new MathCall("frac",
							List.of(MathArg.positional(args.get(0)), MathArg.positional(args.get(1))));
				}
			}
			case "sqrt" -> {
				if (args.size() == 1) {
					return new MathRoot(null, args.get(0));
				}
			}
			case "root" -> {
				if (args.size() == 2) {
					return new MathRoot(args.get(0), args.get(1));
				}
			}
			case "op" -> {
				if (args.size() == 1) {
					return new MathOperatorName(plainText(args.get(0)), call.named("limits") != null);
				}
			}
			case "attach" -> {
				if (args.size() == 1) {
					return attach(args.get(0), call);
				}
			}
			case "display", "inline" -> {
				if (args.size() == 1) {
					return MathRow.of(new MathIdent(call.name().equals("display") ? "displaystyle" : "textstyle"),
							args.get(0));
				}
			}
			case "limits", "scripts" -> {
				if (args.size() == 1) {
					return MathRow.of(args.get(0), new MathIdent(call.name().equals("limits") ? "limits" : "nolimits"));
				}
			}
			default -> {
				// resolved through the symbol table below
			}
		}
		SymbolEntry entry = symbols.byTypst(call.name());
		if (entry != null && entry.arity() == args.size() && entry.arity() > 0) {
			if (entry.strategy() == Strategy.ACCENT) {
				return new MathAccent(entry.latex(), entry.typst(), args.get(0));
			}
			List<MathArg> out = new ArrayList<>();
			for (MathNode arg : args) {
				out.add(MathArg.positional(arg));
			}
			return new MathCall(entry.latex(), out);
		}
		return lost(LossKind.UNKNOWN_COMMAND, call.name(), typstSource.print(call), new MathRow(args),
				"unknown function " + call.name());
	}

	/** {@code attach(base, t: .., b: .., tr: .., br: ..)} as over/underset and scripts. */
	private MathNode attach(MathNode base, MathCall call) {
		MathNode result = base;
		MathNode sub = latexArg(call, "br");
		MathNode sup = latexArg(call, "tr");
		if (sub != null || sup != null) {
			result = new MathAttach(result, sub, sup);
		}
		MathNode bottom = latexArg(call, "b");
		if (bottom != null) {
			result = new MathCall("underset", List.of(MathArg.positional(bottom), MathArg.positional(result)));
		}
		MathNode top = latexArg(call, "t");
		if (top != null) {
			result = new MathCall("overset", List.of(MathArg.positional(top), MathArg.positional(result)));
		}
		MathNode leftSub = latexArg(call, "bl");
		MathNode leftSup = latexArg(call, "tl");
		if (leftSub != null || leftSup != null) {
			result = MathRow.of(new MathAttach(MathRow.of(), leftSub, leftSup), result);
		}
		return result;
	}

	private MathNode latexArg(MathCall call, String name) {
		MathNode value = call.named(name);
		return value == null ? null : toLatex(value);
	}

	private static MathNode style(String command, MathNode body) {
		return new MathCall(command, List.of(MathArg.positional(body)));
	}

	// ---------------------------------------------------------------- shared

	private MathNode lost(LossKind kind, String name, String snippet, MathNode approximation, String message) {
		LossRecord loss = tracker.record(kind, name, message, snippet, "math");
		log.debug("math passthrough for {}", name);
		return new MathPassthrough(loss.id(), snippet, approximation);
	}

	private static MathNode first(List<MathNode> args) {
		return args.isEmpty() ? MathRow.of() : args.get(0);
	}

	private static String plainText(MathNode node) {
		if (node instanceof MathText text) {
			return text.text();
		}
		if (node instanceof MathAtom atom) {
			return atom.text();
		}
		if (node instanceof MathRow row) {
			StringBuilder sb = new StringBuilder();
			row.items().forEach(item -> sb.append(plainText(item)));
			return sb.toString();
		}
		return "";
	}

	private static MathNode unwrap(List<MathNode> items) {
		return items.size() == 1 ? items.get(0) : new MathRow(List.copyOf(items));
	}
}
