package markbridge.eval;

import markbridge.ast.doc.BibEntry;
import markbridge.ast.doc.Bibliography;
import markbridge.ast.doc.BlockMath;
import markbridge.ast.doc.CodeBlock;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.DocNodes;
import markbridge.ast.doc.Figure;
import markbridge.ast.doc.Graphic;
import markbridge.ast.doc.Heading;
import markbridge.ast.doc.ListBlock;
import markbridge.ast.doc.ListItem;
import markbridge.ast.doc.LossMarker;
import markbridge.ast.doc.Opaque;
import markbridge.ast.doc.PageSetup;
import markbridge.ast.doc.Paragraph;
import markbridge.ast.doc.Quote;
import markbridge.ast.doc.Reference;
import markbridge.ast.doc.TableNode;
import markbridge.ast.doc.Text;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Regroups evaluated nodes into blocks: inline runs become paragraphs, block
 * nodes produced inside a paragraph are lifted out, a label right after a
 * heading, figure or equation is attached to it, and adjacent lists of the same
 * kind are merged.
 */
final class BlockFlow {
	private BlockFlow() {
	}

	static List<DocNode> normalize(List<DocNode> nodes) {
		List<DocNode> out = new ArrayList<>();
		List<DocNode> run = new ArrayList<>();
		for (DocNode node : nodes) {
			if (node instanceof Paragraph p) {
				flush(run, out);
				for (DocNode child : p.content()) {
					place(child, run, out);
				}
				flush(run, out);
			} else {
				place(node, run, out);
			}
		}
		flush(run, out);
		return mergeLists(out);
	}

	/**
	 * Inline view of evaluated content: a single paragraph is unwrapped, anything
	 * else is returned as blocks.
	 */
	static List<DocNode> content(List<DocNode> nodes) {
		List<DocNode> blocks = normalize(nodes);
		if (blocks.size() == 1 && blocks.get(0) instanceof Paragraph p) {
			return p.content();
		}
		return blocks;
	}

	private static void place(DocNode node, List<DocNode> run, List<DocNode> out) {
		if (isBlock(node)) {
			flush(run, out);
			out.add(node);
			return;
		}
		if (node instanceof Reference r && r.kind() == Reference.Kind.LABEL && isBlank(run) && !out.isEmpty()) {
			DocNode last = out.get(out.size() - 1);
			DocNode labelled = withLabel(last, r.key());
			if (labelled != null) {
				out.set(out.size() - 1, labelled);
				run.clear();
				return;
			}
		}
		run.add(node);
	}

	private static DocNode withLabel(DocNode node, String label) {
		if (node instanceof Heading h && h.label() == null) {
			return h.withLabel(label);
		}
		if (node instanceof Figure f && f.label() == null) {
			return f.withLabel(label);
		}
		if (node instanceof BlockMath m && m.label() == null) {
			return new BlockMath(m.math(), label, true);
		}
		return null;
	}

	private static void flush(List<DocNode> run, List<DocNode> out) {
		List<DocNode> trimmed = trim(run);
		run.clear();
		if (trimmed.isEmpty()) {
			return;
		}
		boolean standalone = true;
		for (DocNode node : trimmed) {
			if (!(node instanceof Opaque || node instanceof LossMarker
					|| node instanceof Text t && t.text().isBlank())) {
				standalone = false;
				break;
			}
		}
		if (standalone) {
			for (DocNode node : trimmed) {
				if (!(node instanceof Text)) {
					out.add(node);
				}
			}
			return;
		}
		out.add(new Paragraph(mergeText(trimmed)));
	}

	static boolean isBlock(DocNode node) {
		return node instanceof Heading || node instanceof ListBlock || node instanceof ListItem
				|| node instanceof Quote || node instanceof CodeBlock || node instanceof BlockMath
				|| node instanceof TableNode || node instanceof Figure || node instanceof Bibliography
				|| node instanceof BibEntry || node instanceof Graphic || node instanceof PageSetup;
	}

	private static boolean isBlank(List<DocNode> run) {
		for (DocNode node : run) {
			if (!(node instanceof Text t) || !t.text().isBlank()) {
				return false;
			}
		}
		return true;
	}

	static List<DocNode> trim(List<DocNode> nodes) {
		int from = 0;
		int to = nodes.size();
		while (from < to && nodes.get(from) instanceof Text t && t.text().isBlank()) {
			from++;
		}
		while (to > from && nodes.get(to - 1) instanceof Text t && t.text().isBlank()) {
			to--;
		}
		List<DocNode> out = new ArrayList<>(nodes.subList(from, to));
		if (!out.isEmpty() && out.get(0) instanceof Text t) {
			out.set(0, new Text(t.text().stripLeading()));
		}
		if (!out.isEmpty() && out.get(out.size() - 1) instanceof Text t) {
			out.set(out.size() - 1, new Text(t.text().stripTrailing()));
		}
		return out;
	}

	static List<DocNode> mergeText(List<DocNode> nodes) {
		List<DocNode> out = new ArrayList<>();
		for (DocNode node : nodes) {
			if (node instanceof Text t && !out.isEmpty() && out.get(out.size() - 1) instanceof Text prev) {
				out.set(out.size() - 1, new Text((prev.text() + t.text()).replaceAll(" {2,}", " ")));
			} else {
				out.add(node);
			}
		}
		return out;
	}

	private static List<DocNode> mergeLists(List<DocNode> blocks) {
		List<DocNode> out = new ArrayList<>();
		for (DocNode block : blocks) {
			if (block instanceof ListBlock list && !out.isEmpty() && out.get(out.size() - 1) instanceof ListBlock prev
					&& prev.ordered() == list.ordered()) {
				List<ListItem> items = new ArrayList<>(prev.items());
				items.addAll(list.items());
				out.set(out.size() - 1, new ListBlock(list.ordered(), items));
			} else if (block instanceof ListItem item) {
				// a bare item from a content function joins the list before it
				if (!out.isEmpty() && out.get(out.size() - 1) instanceof ListBlock prev) {
					List<ListItem> items = new ArrayList<>(prev.items());
					items.add(item);
					out.set(out.size() - 1, new ListBlock(prev.ordered(), items));
				} else {
					out.add(new ListBlock(false, List.of(item)));
				}
			} else {
				out.add(block);
			}
		}
		return out;
	}

	/**
	 * Typst writes references and citations both as {@code @key}. A key that names
	 * no label becomes a citation when the document has a bibliography.
	 */
	static List<DocNode> resolveReferences(List<DocNode> blocks) {
		Set<String> labels = new HashSet<>();
		boolean[] bibliography = new boolean[1];
		for (DocNode block : blocks) {
			collect(block, labels, bibliography);
		}
		if (!bibliography[0]) {
			return blocks;
		}
		List<DocNode> out = new ArrayList<>();
		for (DocNode block : blocks) {
			out.add(retarget(block, labels));
		}
		return out;
	}

	private static void collect(DocNode node, Set<String> labels, boolean[] bibliography) {
		if (node instanceof Heading h && h.label() != null) {
			labels.add(h.label());
		} else if (node instanceof Figure f && f.label() != null) {
			labels.add(f.label());
		} else if (node instanceof BlockMath m && m.label() != null) {
			labels.add(m.label());
		} else if (node instanceof Reference r && r.kind() == Reference.Kind.LABEL) {
			labels.addAll(r.keys());
		} else if (node instanceof Bibliography || node instanceof BibEntry) {
			bibliography[0] = true;
		}
		for (DocNode child : DocNodes.children(node)) {
			collect(child, labels, bibliography);
		}
	}

	private static DocNode retarget(DocNode node, Set<String> labels) {
		if (node instanceof Reference r && r.kind() == Reference.Kind.REF && !labels.contains(r.key())) {
			return new Reference(Reference.Kind.CITE, r.keys());
		}
		return DocNodes.rebuild(node, children -> children.stream().map(c -> retarget(c, labels)).toList());
	}
}
