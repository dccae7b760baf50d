package markbridge.print;

import markbridge.ast.math.Delimiters;
import markbridge.ast.math.MathAccent;
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
import markbridge.ast.math.MathOperatorName;
import markbridge.ast.math.MathPassthrough;
import markbridge.ast.math.MathRoot;
import markbridge.ast.math.MathRow;
import markbridge.ast.math.MathText;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Prints a Typst math tree (names already in Typst spelling) as the text between
 * the dollar signs.
 */
public final class TypstMathPrinter {
	private static final Set<String> ESCAPED = Set.of("#", "$", "\\", "\"", "_", "^", "/", "@", "{", "}");
	private static final Map<String, String> MATRIX_DELIMS = Map.of("bmatrix", "\"[\"", "Bmatrix", "\"{\"",
			"vmatrix", "\"|\"", "Vmatrix", "\"||\"", "matrix", "#none", "smallmatrix", "#none");
	private static final Map<String, String> FENCES = Map.of("|", "abs", "‖", "norm", "⌊", "floor", "⌈", "ceil");
	private static final Map<String, String> CLOSING = Map.of("|", "|", "‖", "‖", "⌊", "⌋", "⌈", "⌉");

	private final boolean lossComments;

	public TypstMathPrinter(boolean lossComments) {
		this.lossComments = lossComments;
	}

	public String print(MathNode node) {
		if (node instanceof MathRow row) {
			return row(row.items(), false);
		}
		if (node instanceof MathAtom atom) {
			return atom(atom.text(), false);
		}
		if (node instanceof MathIdent ident) {
			return ident.name();
		}
		if (node instanceof MathCall call) {
			return call(call);
		}
		if (node instanceof MathFrac frac) {
			return operand(frac.numerator()) + "/" + operand(frac.denominator());
		}
		if (node instanceof MathRoot root) {
			return root.index() == null ? "sqrt(" + argument(root.radicand()) + ")"
					: "root(" + argument(root.index()) + ", " + argument(root.radicand()) + ")";
		}
		if (node instanceof MathAttach attach) {
			return attach(attach);
		}
		if (node instanceof MathAccent accent) {
			return accent.typstName() + "(" + argument(accent.body()) + ")";
		}
		if (node instanceof MathDelimited d) {
			return delimited(d);
		}
		if (node instanceof MathMatrix m) {
			return matrix(m);
		}
		if (node instanceof MathText text) {
			return quoted(text.text());
		}
		if (node instanceof MathOperatorName op) {
			return "op(" + quoted(op.name()) + (op.limits() ? ", limits: #true)" : ")");
		}
		if (node instanceof MathLineBreak) {
			return "\\";
		}
		if (node instanceof MathPassthrough p) {
			String approximation = print(p.approximation());
			if (!lossComments || p.lossId() == null) {
				return approximation;
			}
			String marker = LossComments.typst(p.lossId(), p.snippet());
			return approximation.isEmpty() ? marker : marker + " " + approximation;
		}
		if (node instanceof MathEmbed embed) {
			return embed.source();
		}
		throw new IllegalArgumentException("unexpected math node " + node);
	}

	private String row(List<MathNode> items, boolean argument) {
		StringBuilder sb = new StringBuilder();
		MathNode prev = null;
		for (MathNode item : items) {
			String text = item instanceof MathAtom atom ? atom(atom.text(), argument) : print(item);
			if (text.isEmpty()) {
				continue;
			}
			if (prev != null && !MathSpacing.tight(prev, item)) {
				sb.append(' ');
			}
			sb.append(text);
			prev = item;
		}
		return sb.toString();
	}

	private static String atom(String text, boolean argument) {
		if (ESCAPED.contains(text)) {
			return "\\" + text;
		}
		if (argument && (text.equals(",") || text.equals(";"))) {
			return "\\" + text;
		}
		return text;
	}

	/** Value of a call argument, where a top-level comma would end the argument. */
	private String argument(MathNode node) {
		if (node instanceof MathRow row) {
			return row(row.items(), true);
		}
		if (node instanceof MathAtom atom) {
			return atom(atom.text(), true);
		}
		return print(node);
	}

	private String call(MathCall call) {
		List<String> args = new ArrayList<>();
		if (call.optional() != null) {
			args.add(argument(call.optional()));
		}
		for (MathArg arg : call.args()) {
			String value = argument(arg.value());
			args.add(arg.isNamed() ? arg.name() + ": " + value : value);
		}
		return call.name() + "(" + String.join(", ", args) + ")";
	}

	/** Operand of a slash fraction or a script; grouped unless it is one token. */
	private String operand(MathNode node) {
		String text = print(node);
		return MathSpacing.singleToken(node) ? text : "(" + text + ")";
	}

	private String attach(MathAttach attach) {
		StringBuilder sb = new StringBuilder();
		MathNode base = attach.base();
		if (base instanceof MathRow row && row.isEmpty()) {
			sb.append("\"\"");
		} else if (base instanceof MathRow || base instanceof MathFrac || base instanceof MathAttach) {
			sb.append('(').append(print(base)).append(')');
		} else {
			sb.append(print(base));
		}
		if (attach.sub() != null) {
			sb.append('_').append(operand(attach.sub()));
		}
		if (attach.sup() != null) {
			sb.append('^').append(operand(attach.sup()));
		}
		return sb.toString();
	}

	private String delimited(MathDelimited d) {
		String body = print(d.body());
		if (d.sized()) {
			String fence = FENCES.get(d.open());
			if (fence != null && d.close().equals(CLOSING.get(d.open()))) {
				return fence + "(" + argument(d.body()) + ")";
			}
			if (d.open().equals(".") && d.close().equals(".")) {
				return body;
			}
			return "lr(" + join(delimiter(d.open()), body, delimiter(d.close())) + ")";
		}
		return join(delimiter(d.open()), body, delimiter(d.close()));
	}

	private static String delimiter(String delimiter) {
		return Delimiters.toTypst(delimiter);
	}

	/** Joins delimiters and body, spacing out delimiters spelled as names. */
	private static String join(String open, String body, String close) {
		StringBuilder sb = new StringBuilder(open);
		if (!open.isEmpty() && Character.isLetter(open.charAt(open.length() - 1)) && !body.isEmpty()) {
			sb.append(' ');
		}
		sb.append(body);
		if (!close.isEmpty() && Character.isLetter(close.charAt(0)) && sb.length() > 0) {
			sb.append(' ');
		}
		return sb.append(close).toString();
	}

	private String matrix(MathMatrix m) {
		List<String> rows = new ArrayList<>();
		if (m.kind().equals("cases")) {
			for (List<MathNode> row : m.rows()) {
				List<String> cells = new ArrayList<>();
				row.forEach(cell -> cells.add(argument(cell)));
				rows.add(String.join(" & ", cells));
			}
			return "cases(" + String.join(", ", rows) + ")";
		}
		for (List<MathNode> row : m.rows()) {
			List<String> cells = new ArrayList<>();
			row.forEach(cell -> cells.add(argument(cell)));
			rows.add(String.join(", ", cells));
		}
		String delim = MATRIX_DELIMS.get(m.kind());
		String prefix = delim == null ? "" : "delim: " + delim + ", ";
		return "mat(" + prefix + String.join("; ", rows) + ")";
	}

	static String quoted(String text) {
		return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
	}
}
