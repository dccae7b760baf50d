package markbridge.loss;

import markbridge.ast.doc.BlockMath;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.DocNodes;
import markbridge.ast.doc.Figure;
import markbridge.ast.doc.Heading;
import markbridge.ast.doc.InlineMath;
import markbridge.ast.doc.ListItem;
import markbridge.ast.doc.LossMarker;
import markbridge.ast.doc.Reference;
import markbridge.ast.doc.TableNode;
import markbridge.ast.math.MathAccent;
import markbridge.ast.math.MathArg;
import markbridge.ast.math.MathAttach;
import markbridge.ast.math.MathCall;
import markbridge.ast.math.MathDelimited;
import markbridge.ast.math.MathFrac;
import markbridge.ast.math.MathMatrix;
import markbridge.ast.math.MathNode;
import markbridge.ast.math.MathPassthrough;
import markbridge.ast.math.MathRoot;
import markbridge.ast.math.MathRow;

import java.util.List;

/**
 * Computes {@link ConversionMetrics} from a document tree.
 */
public final class MetricsCollector {
	private int headings;
	private int equations;
	private int figures;
	private int tables;
	private int cites;
	private int refs;
	private int labels;
	private int listItems;
	private int lossMarkers;

	public static ConversionMetrics measure(DocNode root, int parseErrors) {
		MetricsCollector c = new MetricsCollector();
		c.visit(root);
		return new ConversionMetrics(c.headings, c.equations, c.figures, c.tables, c.cites, c.refs, c.labels,
				c.listItems, c.lossMarkers, parseErrors);
	}

	private void visit(DocNode node) {
		if (node instanceof Heading h) {
			headings++;
			countLabel(h.label());
		} else if (node instanceof BlockMath m) {
			equations++;
			countLabel(m.label());
			visitMath(m.math());
		} else if (node instanceof InlineMath m) {
			visitMath(m.math());
		} else if (node instanceof Figure f) {
			if (!f.isTable()) {
				figures++;
			}
			countLabel(f.label());
		} else if (node instanceof TableNode) {
			tables++;
		} else if (node instanceof ListItem) {
			listItems++;
		} else if (node instanceof LossMarker) {
			lossMarkers++;
		} else if (node instanceof Reference r) {
			switch (r.kind()) {
				case CITE -> cites++;
				case REF -> refs++;
				case LABEL -> labels++;
			}
		}
		for (DocNode child : DocNodes.children(node)) {
			visit(child);
		}
	}

	private void countLabel(String label) {
		if (label != null && !label.isEmpty()) {
			labels++;
		}
	}

	private void visitMath(MathNode node) {
		if (node == null) {
			return;
		}
		if (node instanceof MathPassthrough p) {
			lossMarkers++;
			visitMath(p.approximation());
		} else if (node instanceof MathRow row) {
			row.items().forEach(this::visitMath);
		} else if (node instanceof MathCall call) {
			visitMath(call.optional());
			for (MathArg arg : call.args()) {
				visitMath(arg.value());
			}
		} else if (node instanceof MathFrac f) {
			visitMath(f.numerator());
			visitMath(f.denominator());
		} else if (node instanceof MathRoot r) {
			visitMath(r.index());
			visitMath(r.radicand());
		} else if (node instanceof MathAttach a) {
			visitMath(a.base());
			visitMath(a.sub());
			visitMath(a.sup());
		} else if (node instanceof MathAccent a) {
			visitMath(a.body());
		} else if (node instanceof MathDelimited d) {
			visitMath(d.body());
		} else if (node instanceof MathMatrix m) {
			for (List<MathNode> row : m.rows()) {
				row.forEach(this::visitMath);
			}
		}
	}
}
