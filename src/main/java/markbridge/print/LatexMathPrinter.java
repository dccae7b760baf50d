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

/**
 * Prints a LaTeX math tree (names already in LaTeX spelling) as math-mode source.
 */
public final class LatexMathPrinter {
	private static final Map<String, String> ATOMS = Map.of("#", "\\#", "$", "\\$", "%", "\\%", "{", "\\{", "}",
			"\\}", "_", "\\_", "\\", "\\backslash", "~", "\\sim");

	private final boolean lossComments;

	public LatexMathPrinter(boolean lossComments) {
		this.lossComments = lossComments;
	}

	public String print(MathNode node) {
		if (node instanceof MathRow row) {
			return row(row.items());
		}
		if (node instanceof MathAtom atom) {
			return ATOMS.getOrDefault(atom.text(), atom.text());
		}
		if (node instanceof MathIdent ident) {
			return "\\" + ident.name();
		}
		if (node instanceof MathCall call) {
			StringBuilder sb = new StringBuilder("\\").append(call.name());
			if (call.optional() != null) {
				sb.append('[').append(print(call.optional())).append(']');
			}
			for (MathArg arg : call.args()) {
				sb.append('{').append(print(arg.value())).append('}');
			}
			return sb.toString();
		}
		if (node instanceof MathFrac frac) {
			return "\\frac{" + print(frac.numerator()) + "}{" + print(frac.denominator()) + "}";
		}
		if (node instanceof MathRoot root) {
			String index = root.index() == null ? "" : "[" + print(root.index()) + "]";
			return "\\sqrt" + index + "{" + print(root.radicand()) + "}";
		}
		if (node instanceof MathAttach attach) {
			return attach(attach);
		}
		if (node instanceof MathAccent accent) {
			return "\\" + accent.latexName() + "{" + print(accent.body()) + "}";
		}
		if (node instanceof MathDelimited d) {
			String body = print(d.body());
			if (d.sized()) {
				return "\\left" + delimiter(d.open()) + " " + body + " \\right" + delimiter(d.close());
			}
			return delimiter(d.open()) + body + delimiter(d.close());
		}
		if (node instanceof MathMatrix m) {
			List<String> rows = new ArrayList<>();
			for (List<MathNode> row : m.rows()) {
				List<String> cells = new ArrayList<>();
				row.forEach(cell -> cells.add(print(cell)));
				rows.add(String.join(" & ", cells));
			}
			return "\\begin{" + m.kind() + "} " + String.join(" \\\\ ", rows) + " \\end{" + m.kind() + "}";
		}
		if (node instanceof MathText text) {
			return "\\text{" + LatexEscaper.text(text.text()) + "}";
		}
		if (node instanceof MathOperatorName op) {
			return (op.limits() ? "\\operatorname*{" : "\\operatorname{") + op.name() + "}";
		}
		if (node instanceof MathLineBreak) {
			return "\\\\";
		}
		if (node instanceof MathPassthrough p) {
			String approximation = print(p.approximation());
			if (!lossComments || p.lossId() == null) {
				return approximation;
			}
			return LossComments.latex(p.lossId(), p.snippet()) + approximation;
		}
		if (node instanceof MathEmbed embed) {
			return embed.source();
		}
		throw new IllegalArgumentException("unexpected math node " + node);
	}

	private String row(List<MathNode> items) {
		StringBuilder sb = new StringBuilder();
		MathNode prev = null;
		for (MathNode item : items) {
			String text = print(item);
			if (text.isEmpty()) {
				continue;
			}
			boolean afterComment = sb.length() > 0 && sb.charAt(sb.length() - 1) == '\n';
			if (prev != null && !afterComment && (!MathSpacing.tight(prev, item) || endsWithControlWord(sb)
					&& Character.isLetter(text.charAt(0)))) {
				sb.append(' ');
			}
			sb.append(text);
			prev = item;
		}
		return sb.toString();
	}

	private static boolean endsWithControlWord(CharSequence sb) {
		int i = sb.length() - 1;
		while (i >= 0 && Character.isLetter(sb.charAt(i))) {
			i--;
		}
		return i >= 0 && i < sb.length() - 1 && sb.charAt(i) == '\\';
	}

	private String attach(MathAttach attach) {
		StringBuilder sb = new StringBuilder();
		MathNode base = attach.base();
		if (base instanceof MathRow || base instanceof MathAttach) {
			sb.append('{').append(print(base)).append('}');
		} else {
			sb.append(print(base));
		}
		if (attach.sub() != null) {
			sb.append('_').append(script(attach.sub()));
		}
		if (attach.sup() != null) {
			sb.append('^').append(script(attach.sup()));
		}
		return sb.toString();
	}

	private String script(MathNode node) {
		String text = print(node);
		if (node instanceof MathAtom && text.length() == 1) {
			return text;
		}
		return "{" + text + "}";
	}

	private static String delimiter(String delimiter) {
		return Delimiters.toLatex(delimiter);
	}
}
