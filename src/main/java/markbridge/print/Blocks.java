package markbridge.print;

import markbridge.ast.doc.BibEntry;
import markbridge.ast.doc.Bibliography;
import markbridge.ast.doc.BlockMath;
import markbridge.ast.doc.CodeBlock;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.Figure;
import markbridge.ast.doc.Graphic;
import markbridge.ast.doc.Heading;
import markbridge.ast.doc.ListBlock;
import markbridge.ast.doc.PageSetup;
import markbridge.ast.doc.Paragraph;
import markbridge.ast.doc.Quote;
import markbridge.ast.doc.TableNode;
import markbridge.ast.doc.Text;

import java.util.ArrayList;
import java.util.List;

/**
 * Block/inline classification used by both printers.
 */
final class Blocks {
	private Blocks() {
	}

	static boolean isBlock(DocNode node) {
		return node instanceof Heading || node instanceof Paragraph || node instanceof ListBlock
				|| node instanceof Quote || node instanceof CodeBlock || node instanceof BlockMath
				|| node instanceof TableNode || node instanceof Figure || node instanceof Graphic
				|| node instanceof Bibliography || node instanceof BibEntry || node instanceof PageSetup;
	}

	static boolean allInline(List<DocNode> nodes) {
		return nodes.stream().noneMatch(Blocks::isBlock);
	}

	/** Block list with runs of inline nodes wrapped in paragraphs; blank runs are dropped. */
	static List<DocNode> group(List<DocNode> nodes) {
		List<DocNode> out = new ArrayList<>();
		List<DocNode> run = new ArrayList<>();
		for (DocNode node : nodes) {
			if (isBlock(node)) {
				flush(run, out);
				out.add(node);
			} else {
				run.add(node);
			}
		}
		flush(run, out);
		return out;
	}

	private static void flush(List<DocNode> run, List<DocNode> out) {
		boolean blank = run.stream().allMatch(n -> n instanceof Text t && t.text().isBlank());
		if (!blank) {
			out.add(new Paragraph(List.copyOf(run)));
		}
		run.clear();
	}

	static String indent(String text, String prefix) {
		StringBuilder sb = new StringBuilder();
		String[] lines = text.split("\n", -1);
		for (int i = 0; i < lines.length; i++) {
			if (i > 0) {
				sb.append('\n');
			}
			if (!lines[i].isEmpty()) {
				sb.append(prefix).append(lines[i]);
			}
		}
		return sb.toString();
	}
}
