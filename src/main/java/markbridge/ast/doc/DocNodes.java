package markbridge.ast.doc;

import markbridge.ast.script.ContentExpr;
import markbridge.ast.script.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Helpers for walking document trees.
 */
public final class DocNodes {
	private DocNodes() {
	}

	/**
	 * Direct children of a node in document order. Script nodes report the content
	 * blocks they hold so that raw trees can be measured too.
	 */
	public static List<DocNode> children(DocNode node) {
		if (node instanceof Document d) {
			return d.children();
		}
		if (node instanceof Heading h) {
			return h.content();
		}
		if (node instanceof Paragraph p) {
			return p.content();
		}
		if (node instanceof ListBlock l) {
			return List.copyOf(l.items());
		}
		if (node instanceof ListItem i) {
			return i.content();
		}
		if (node instanceof Quote q) {
			return q.content();
		}
		if (node instanceof TableNode t) {
			List<DocNode> out = new ArrayList<>();
			for (TableRow row : t.grid().rows()) {
				for (TableCell cell : row.cells()) {
					out.addAll(cell.content());
				}
			}
			return out;
		}
		if (node instanceof Figure f) {
			List<DocNode> out = new ArrayList<>(f.body());
			out.addAll(f.caption());
			return out;
		}
		if (node instanceof BibEntry b) {
			return b.content();
		}
		if (node instanceof Strong s) {
			return s.content();
		}
		if (node instanceof Emph e) {
			return e.content();
		}
		if (node instanceof Link l) {
			return l.content();
		}
		if (node instanceof ForLoop loop) {
			return contentOf(loop.body());
		}
		if (node instanceof Conditional c) {
			List<DocNode> out = new ArrayList<>(contentOf(c.then()));
			out.addAll(contentOf(c.otherwise()));
			return out;
		}
		return List.of();
	}

	/**
	 * Rebuilds a container with each of its child lists passed through
	 * {@code children}. Leaves and script nodes are returned unchanged. The
	 * function must map list items to list items.
	 */
	public static DocNode rebuild(DocNode node, UnaryOperator<List<DocNode>> children) {
		if (node instanceof Document d) {
			return new Document(children.apply(d.children()));
		}
		if (node instanceof Heading h) {
			return new Heading(h.level(), children.apply(h.content()), h.label(), h.numbered());
		}
		if (node instanceof Paragraph p) {
			return new Paragraph(children.apply(p.content()));
		}
		if (node instanceof ListBlock l) {
			List<ListItem> items = new ArrayList<>();
			for (DocNode item : children.apply(List.copyOf(l.items()))) {
				items.add((ListItem) item);
			}
			return new ListBlock(l.ordered(), items);
		}
		if (node instanceof ListItem i) {
			return new ListItem(children.apply(i.content()));
		}
		if (node instanceof Quote q) {
			return new Quote(children.apply(q.content()));
		}
		if (node instanceof TableNode t) {
			List<TableRow> rows = new ArrayList<>();
			for (TableRow row : t.grid().rows()) {
				List<TableCell> cells = new ArrayList<>();
				for (TableCell cell : row.cells()) {
					cells.add(cell.withContent(children.apply(cell.content())));
				}
				rows.add(new TableRow(cells));
			}
			TableGrid g = t.grid();
			return new TableNode(new TableGrid(g.columns(), g.alignments(), rows, g.border(), g.rules(),
					g.verticalLines()));
		}
		if (node instanceof Figure f) {
			return new Figure(children.apply(f.body()), children.apply(f.caption()), f.label(), f.isTable());
		}
		if (node instanceof BibEntry b) {
			return new BibEntry(b.key(), children.apply(b.content()));
		}
		if (node instanceof Strong s) {
			return new Strong(children.apply(s.content()));
		}
		if (node instanceof Emph e) {
			return new Emph(children.apply(e.content()));
		}
		if (node instanceof Link l) {
			return new Link(l.url(), children.apply(l.content()));
		}
		return node;
	}

	private static List<DocNode> contentOf(Expr expr) {
		if (expr instanceof ContentExpr content) {
			return content.body();
		}
		return List.of();
	}

	/** Concatenated plain text of a node list, ignoring markup. */
	public static String plainText(List<DocNode> nodes) {
		StringBuilder sb = new StringBuilder();
		for (DocNode node : nodes) {
			appendPlain(node, sb);
		}
		return sb.toString();
	}

	private static void appendPlain(DocNode node, StringBuilder sb) {
		if (node instanceof Text t) {
			sb.append(t.text());
			return;
		}
		if (node instanceof InlineCode c) {
			sb.append(c.code());
			return;
		}
		if (node instanceof LineBreak) {
			sb.append(' ');
			return;
		}
		for (DocNode child : children(node)) {
			appendPlain(child, sb);
		}
	}
}
