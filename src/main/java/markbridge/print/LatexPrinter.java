package markbridge.print;

import markbridge.ast.Language;
import markbridge.ast.doc.BibEntry;
import markbridge.ast.doc.Bibliography;
import markbridge.ast.doc.BlockMath;
import markbridge.ast.doc.CodeBlock;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.DocNodes;
import markbridge.ast.doc.Document;
import markbridge.ast.doc.Emph;
import markbridge.ast.doc.Figure;
import markbridge.ast.doc.Graphic;
import markbridge.ast.doc.Heading;
import markbridge.ast.doc.Image;
import markbridge.ast.doc.InlineCode;
import markbridge.ast.doc.InlineMath;
import markbridge.ast.doc.LineBreak;
import markbridge.ast.doc.Link;
import markbridge.ast.doc.ListBlock;
import markbridge.ast.doc.ListItem;
import markbridge.ast.doc.LossMarker;
import markbridge.ast.doc.Opaque;
import markbridge.ast.doc.PageSetup;
import markbridge.ast.doc.Paragraph;
import markbridge.ast.doc.Quote;
import markbridge.ast.doc.Raw;
import markbridge.ast.doc.Reference;
import markbridge.ast.doc.Strong;
import markbridge.ast.doc.TableNode;
import markbridge.ast.doc.Text;
import markbridge.ast.math.MathAtom;
import markbridge.ast.math.MathLineBreak;
import markbridge.ast.math.MathNode;
import markbridge.ast.math.MathRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prints a document tree as LaTeX source.
 *
 * With the document wrapper enabled the body is placed in an {@code article}
 * with the packages the printed constructs need.
 */
public final class LatexPrinter {
	private static final String[] SECTIONS = { "section", "subsection", "subsubsection", "paragraph",
			"subparagraph" };
	private static final String[] PACKAGES = { "amsmath", "amssymb", "graphicx", "listings", "[table]{xcolor}",
			"booktabs", "multirow", "tikz", "hyperref" };
	private static final Pattern PERCENT = Pattern.compile("(\\d+(?:\\.\\d+)?)%");

	private final boolean lossComments;
	private final boolean documentWrapper;
	private final LatexMathPrinter math;
	private final LatexTablePrinter tables = new LatexTablePrinter(this::inline);

	public LatexPrinter(boolean lossComments, boolean documentWrapper) {
		this.lossComments = lossComments;
		this.documentWrapper = documentWrapper;
		this.math = new LatexMathPrinter(lossComments);
	}

	public String print(Document document) {
		String body = blocks(document.children());
		if (!documentWrapper) {
			return body.isEmpty() ? "" : body + "\n";
		}
		PageSetup setup = PageSetup.collect(document.children());
		List<String> classOptions = new ArrayList<>();
		if (setup.fontSize() != null) {
			classOptions.add(setup.fontSize());
		}
		if (setup.paper() != null) {
			classOptions.add(PageSetup.latexPaper(setup.paper()));
		}
		if (setup.columns() != null && setup.columns() == 2) {
			classOptions.add("twocolumn");
		}
		StringBuilder sb = new StringBuilder("\\documentclass");
		if (!classOptions.isEmpty()) {
			sb.append('[').append(String.join(",", classOptions)).append(']');
		}
		sb.append("{article}\n");
		for (String pkg : PACKAGES) {
			String name = pkg.startsWith("[") ? pkg : "{" + pkg + "}";
			sb.append("\\usepackage").append(name).append('\n');
		}
		if (!setup.margins().isEmpty()) {
			List<String> geometry = new ArrayList<>();
			for (Map.Entry<String, String> e : setup.orderedMargins()) {
				geometry.add((e.getKey().equals("all") ? "margin" : e.getKey()) + "=" + e.getValue());
			}
			sb.append("\\usepackage[").append(String.join(",", geometry)).append("]{geometry}\n");
		}
		if (setup.font() != null) {
			sb.append("\\usepackage{fontspec}\n\\setmainfont{").append(LatexEscaper.text(setup.font())).append("}\n");
		}
		if (Boolean.FALSE.equals(setup.justify())) {
			sb.append("\\AtBeginDocument{\\raggedright}\n");
		}
		sb.append("\n\\begin{document}\n\n");
		if (!body.isEmpty()) {
			sb.append(body).append("\n\n");
		}
		return sb.append("\\end{document}\n").toString();
	}

	public String printMath(MathNode node) {
		return math.print(node);
	}

	// ---- blocks ----

	String blocks(List<DocNode> nodes) {
		List<String> out = new ArrayList<>();
		List<BibEntry> bibliography = new ArrayList<>();
		for (DocNode block : Blocks.group(nodes)) {
			if (block instanceof BibEntry entry) {
				bibliography.add(entry);
				continue;
			}
			if (!bibliography.isEmpty()) {
				out.add(bibliography(bibliography));
				bibliography.clear();
			}
			String text = block(block);
			if (!text.isEmpty()) {
				out.add(text);
			}
		}
		if (!bibliography.isEmpty()) {
			out.add(bibliography(bibliography));
		}
		return String.join("\n\n", out);
	}

	private String block(DocNode node) {
		if (node instanceof Paragraph p) {
			return stripTrailingNewline(inline(p.content()));
		}
		if (node instanceof Heading h) {
			String command = SECTIONS[Math.min(h.level(), SECTIONS.length) - 1] + (h.numbered() ? "" : "*");
			String label = h.label() == null ? "" : "\\label{" + h.label() + "}";
			return "\\" + command + "{" + inline(h.content()) + "}" + label;
		}
		if (node instanceof ListBlock l) {
			return list(l);
		}
		if (node instanceof Quote q) {
			return "\\begin{quote}\n" + blocks(q.content()) + "\n\\end{quote}";
		}
		if (node instanceof CodeBlock c) {
			if (c.language() == null || c.language().isEmpty()) {
				return "\\begin{verbatim}\n" + c.code() + "\n\\end{verbatim}";
			}
			return "\\begin{lstlisting}[language=" + c.language() + "]\n" + c.code() + "\n\\end{lstlisting}";
		}
		if (node instanceof BlockMath m) {
			return displayMath(m);
		}
		if (node instanceof TableNode t) {
			return tables.print(t.grid());
		}
		if (node instanceof Figure f) {
			return figure(f);
		}
		if (node instanceof Graphic g) {
			return "\\begin{tikzpicture}\n" + Blocks.indent(g.source(), "  ") + "\n\\end{tikzpicture}";
		}
		if (node instanceof Bibliography b) {
			String style = b.style() == null ? "plain" : b.style();
			return "\\bibliographystyle{" + style + "}\n\\bibliography{" + b.source() + "}";
		}
		if (node instanceof PageSetup) {
			// printed in the preamble
			return "";
		}
		throw new IllegalArgumentException("unexpected block " + node);
	}

	private String list(ListBlock list) {
		String env = list.ordered() ? "enumerate" : "itemize";
		List<String> lines = new ArrayList<>();
		lines.add("\\begin{" + env + "}");
		for (ListItem item : list.items()) {
			String body = Blocks.allInline(item.content()) ? inline(item.content()) : blocks(item.content());
			lines.add(Blocks.indent("\\item " + stripTrailingNewline(body), "  "));
		}
		lines.add("\\end{" + env + "}");
		return String.join("\n", lines);
	}

	/**
	 * {@code equation} when the formula is numbered or labelled, {@code \[..\]}
	 * otherwise; multi-line formulas use {@code align} or {@code gather}.
	 */
	private String displayMath(BlockMath m) {
		String body = math.print(m.math());
		boolean numbered = m.numbered() || m.label() != null;
		String label = m.label() == null ? "" : "\\label{" + m.label() + "}";
		List<MathNode> top = m.math() instanceof MathRow row ? row.items() : List.of(m.math());
		boolean aligned = top.stream().anyMatch(n -> n instanceof MathAtom a && a.text().equals("&"));
		boolean lines = top.stream().anyMatch(n -> n instanceof MathLineBreak);
		String env = aligned ? "align" : lines ? "gather" : numbered ? "equation" : null;
		if (env == null) {
			return "\\[\n" + body + "\n\\]";
		}
		String name = numbered ? env : env + "*";
		return "\\begin{" + name + "}" + label + "\n" + body + "\n\\end{" + name + "}";
	}

	private String figure(Figure f) {
		String env = f.isTable() ? "table" : "figure";
		List<String> lines = new ArrayList<>();
		lines.add("\\begin{" + env + "}[h]");
		lines.add("\\centering");
		if (f.body().size() == 1 && f.body().get(0) instanceof Image image) {
			lines.add(image(image));
		} else {
			lines.add(blocks(f.body()));
		}
		if (!f.caption().isEmpty()) {
			lines.add("\\caption{" + inline(f.caption()) + "}");
		}
		if (f.label() != null) {
			lines.add("\\label{" + f.label() + "}");
		}
		lines.add("\\end{" + env + "}");
		return String.join("\n", lines);
	}

	private String bibliography(List<BibEntry> entries) {
		List<String> lines = new ArrayList<>();
		lines.add("\\begin{thebibliography}{" + entries.size() + "}");
		for (BibEntry entry : entries) {
			lines.add("\\bibitem{" + entry.key() + "} " + inline(entry.content()));
		}
		lines.add("\\end{thebibliography}");
		return String.join("\n", lines);
	}

	private static String image(Image image) {
		String width = width(image.width());
		String options = width == null ? "" : "[width=" + width + "]";
		return "\\includegraphics" + options + "{" + image.path() + "}";
	}

	/** "80%" becomes {@code 0.8\textwidth}; absolute lengths pass through. */
	static String width(String width) {
		if (width == null || width.isEmpty()) {
			return null;
		}
		Matcher m = PERCENT.matcher(width);
		if (m.matches()) {
			double factor = Double.parseDouble(m.group(1)) / 100;
			String number = factor == Math.rint(factor) ? String.valueOf((long) factor)
					: String.valueOf(factor).replaceAll("0+$", "");
			return number + "\\textwidth";
		}
		return width;
	}

	private static String stripTrailingNewline(String text) {
		return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
	}

	// ---- inline ----

	String inline(List<DocNode> nodes) {
		StringBuilder sb = new StringBuilder();
		for (DocNode node : nodes) {
			String text = inline(node);
			if (needsSeparator(sb, text)) {
				sb.append("{}");
			}
			sb.append(text);
		}
		return sb.toString();
	}

	/** A control word directly followed by a letter would swallow it. */
	private static boolean needsSeparator(CharSequence before, String next) {
		if (next.isEmpty() || !Character.isLetter(next.charAt(0))) {
			return false;
		}
		int i = before.length() - 1;
		while (i >= 0 && Character.isLetter(before.charAt(i))) {
			i--;
		}
		return i >= 0 && i < before.length() - 1 && before.charAt(i) == '\\';
	}

	private String inline(DocNode node) {
		if (node instanceof Text t) {
			return LatexEscaper.text(t.text());
		}
		if (node instanceof Strong s) {
			return "\\textbf{" + inline(s.content()) + "}";
		}
		if (node instanceof Emph e) {
			return "\\emph{" + inline(e.content()) + "}";
		}
		if (node instanceof InlineCode c) {
			return "\\texttt{" + LatexEscaper.text(c.code()) + "}";
		}
		if (node instanceof InlineMath m) {
			return "$" + math.print(m.math()) + "$";
		}
		if (node instanceof LineBreak) {
			return "\\\\\n";
		}
		if (node instanceof Link l) {
			if (DocNodes.plainText(l.content()).equals(l.url())) {
				return "\\url{" + LatexEscaper.url(l.url()) + "}";
			}
			return "\\href{" + LatexEscaper.url(l.url()) + "}{" + inline(l.content()) + "}";
		}
		if (node instanceof Reference r) {
			String keys = String.join(",", r.keys());
			switch (r.kind()) {
				case CITE:
					return "\\cite{" + keys + "}";
				case LABEL:
					return "\\label{" + keys + "}";
				default:
					return "\\ref{" + keys + "}";
			}
		}
		if (node instanceof Image image) {
			return image(image);
		}
		if (node instanceof LossMarker m) {
			return lossComments ? LossComments.latex(m.lossId(), m.snippet()) : "";
		}
		if (node instanceof Raw raw) {
			return raw.language() == Language.LATEX ? raw.text() : LatexEscaper.text(raw.text());
		}
		if (node instanceof Opaque o) {
			return o.language() == Language.LATEX ? o.source() : "";
		}
		if (Blocks.isBlock(node)) {
			return "\n" + block(node) + "\n";
		}
		throw new IllegalArgumentException("unexpected inline node " + node);
	}
}
