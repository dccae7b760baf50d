package markbridge.ast.math;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Helpers for rebuilding math trees.
 */
public final class MathNodes {
	private MathNodes() {
	}

	/** Rebuilds {@code node} with every direct child passed through {@code fn}. */
	public static MathNode rebuild(MathNode node, UnaryOperator<MathNode> fn) {
		if (node instanceof MathRow row) {
			List<MathNode> items = new ArrayList<>();
			for (MathNode item : row.items()) {
				items.add(fn.apply(item));
			}
			return new MathRow(items);
		}
		if (node instanceof MathCall call) {
			List<MathArg> args = new ArrayList<>();
			for (MathArg arg : call.args()) {
				args.add(new MathArg(arg.name(), fn.apply(arg.value())));
			}
			MathNode optional = call.optional() == null ? null : fn.apply(call.optional());
			return new MathCall(call.name(), optional, args, call.lossId());
		}
		if (node instanceof MathFrac f) {
			return new MathFrac(fn.apply(f.numerator()), fn.apply(f.denominator()));
		}
		if (node instanceof MathRoot r) {
			return new MathRoot(r.index() == null ? null : fn.apply(r.index()), fn.apply(r.radicand()));
		}
		if (node instanceof MathAttach a) {
			return new MathAttach(fn.apply(a.base()), a.sub() == null ? null : fn.apply(a.sub()),
					a.sup() == null ? null : fn.apply(a.sup()));
		}
		if (node instanceof MathAccent a) {
			return new MathAccent(a.latexName(), a.typstName(), fn.apply(a.body()));
		}
		if (node instanceof MathDelimited d) {
			return new MathDelimited(d.open(), fn.apply(d.body()), d.close(), d.sized());
		}
		if (node instanceof MathMatrix m) {
			List<List<MathNode>> rows = new ArrayList<>();
			for (List<MathNode> row : m.rows()) {
				List<MathNode> cells = new ArrayList<>();
				for (MathNode cell : row) {
					cells.add(fn.apply(cell));
				}
				rows.add(cells);
			}
			return new MathMatrix(m.kind(), rows);
		}
		if (node instanceof MathPassthrough p) {
			return new MathPassthrough(p.lossId(), p.snippet(), fn.apply(p.approximation()));
		}
		return node;
	}
}
