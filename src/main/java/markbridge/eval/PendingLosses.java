package markbridge.eval;

import markbridge.ast.Language;
import markbridge.ast.doc.BlockMath;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.DocNodes;
import markbridge.ast.doc.InlineMath;
import markbridge.ast.doc.Opaque;
import markbridge.ast.math.MathNode;
import markbridge.ast.math.MathNodes;
import markbridge.ast.math.MathPassthrough;
import markbridge.ast.math.MathRow;
import markbridge.loss.LossKind;
import markbridge.loss.LossRecord;
import markbridge.loss.LossTracker;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Losses of unresolved constructs, held back until the node that stands for them
 * is known to reach the output. Ids are then assigned in document order.
 */
final class PendingLosses {
	private record Pending(LossKind kind, String name, String message, String context) {
	}

	private final Map<Object, Pending> pending = new IdentityHashMap<>();

	Opaque opaque(String source, LossKind kind, String name, String message) {
		Opaque node = new Opaque(source, Language.TYPST, null);
		pending.put(node, new Pending(kind, name, message, "text"));
		return node;
	}

	MathPassthrough passthrough(String source, LossKind kind, String name, String message) {
		MathPassthrough node = new MathPassthrough(null, source, MathRow.of());
		pending.put(node, new Pending(kind, name, message, "math"));
		return node;
	}

	/** Records the losses of every pending node in {@code root} and returns the tree with ids filled in. */
	DocNode assign(DocNode root, LossTracker tracker) {
		return assignNode(root, tracker);
	}

	private DocNode assignNode(DocNode node, LossTracker tracker) {
		if (node instanceof Opaque o && o.lossId() == null) {
			Pending p = pending.get(o);
			if (p == null) {
				return o;
			}
			LossRecord loss = tracker.record(p.kind(), p.name(), p.message(), o.source(), p.context());
			return new Opaque(o.source(), o.language(), loss.id());
		}
		if (node instanceof InlineMath m) {
			return new InlineMath(assignMath(m.math(), tracker));
		}
		if (node instanceof BlockMath m) {
			return new BlockMath(assignMath(m.math(), tracker), m.label(), m.numbered());
		}
		return DocNodes.rebuild(node, children -> assignAll(children, tracker));
	}

	private List<DocNode> assignAll(List<DocNode> nodes, LossTracker tracker) {
		return nodes.stream().map(n -> assignNode(n, tracker)).toList();
	}

	private MathNode assignMath(MathNode node, LossTracker tracker) {
		if (node instanceof MathPassthrough p && p.lossId() == null) {
			Pending pend = pending.get(p);
			if (pend != null) {
				LossRecord loss = tracker.record(pend.kind(), pend.name(), pend.message(), p.snippet(),
						pend.context());
				return new MathPassthrough(loss.id(), p.snippet(), assignMath(p.approximation(), tracker));
			}
		}
		return MathNodes.rebuild(node, child -> assignMath(child, tracker));
	}
}
