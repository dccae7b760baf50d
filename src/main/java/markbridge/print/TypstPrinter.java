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
import markbridge.ast.math.MathNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Prints a document tree as Typst markup.
 *
 * Set rules for heading and equation numbering and the CeTZ import are emitted
 * at the top when the document needs them.
 */
public final class TypstPrinter {
	public static final String CETZ_IMPORT = "#import \"@preview/cetz:0.2.2\"";

	private static final Pattern LENGTH = Pattern.compile("-?\\d+(\\.\\d+)?(%|cm|mm|pt|in|em|fr)");

	private final boolean lossComments;
	private final TypstMathPrinter math;
	private final TypstTablePrinter tables = new TypstTablePrinter(this::inline);
	private boolean headingNumbering;

	public TypstPrinter(boolean lossComments) {
		this.lossComments = lossComments;
		this.math = new TypstMathPrinter(lossComments);
	}

	public String print(Document document) {
		headingNumbering = false;
		boolean equationNumbering = false;
		boolean graphics = false;
		for (DocNode node : flatten(document)) {
			if (node instanceof Heading h && h.numbered()) {
				headingNumbering = true;
			} else if (node instanceof BlockMath m && (m.numbered() || m.label() != null)) {
				equationNumbering = true;
			} else if (node instanceof Graphic g && g.language() == Language.TYPST) {
				graphics = true;
			}
		}
		List<String> preamble = new ArrayList<>();
		if (graphics) {
			preamble.add(CETZ_IMPORT);
		}
		preamble.addAll(pageRules(PageSetup.collect(document.children())));
		if (headingNumbering) {
			preamble.add("#set heading(numbering: \"1.\")");
		}
		if (equationNumbering) {
			preamble.add("#set math.equation(numbering: \"(1)\")");
		}
		String body = blocks(document.children());
		if (preamble.isEmpty()) {
			return body.isEmpty() ? "" : body + "\n";
		}
		return String.join("\n", preamble) + "\n\n" + body + "\n";
	}

	private static List<String> pageRules(PageSetup setup) {
		List<String> rules = new ArrayList<>();
		List<String> page = new ArrayList<>();
		if (setup.paper() != null) {
			page.add("paper: " + TypstEscaper.string(setup.paper()));
		}
		List<Map.Entry<String, String>> margins = setup.orderedMargins();
		if (margins.size() == 1 && margins.get(0).getKey().equals("all")) {
			page.add("margin: " + margins.get(0).getValue());
		} else if (!margins.isEmpty()) {
			page.add("margin: (" + margins.stream()
					.map(e -> (e.getKey().equals("all") ? "rest" : e.getKey()) + ": " + e.getValue())
					.collect(Collectors.joining(", ")) + ")");
		}
		if (setup.columns() != null) {
			page.add("columns: " + setup.columns());
		}
		if (!page.isEmpty()) {
			rules.add("#set page(" + String.join(", ", page) + ")");
		}
		List<String> text = new ArrayList<>();
		if (setup.font() != null) {
			text.add("font: " + TypstEscaper.string(setup.font()));
		}
		if (setup.fontSize() != null) {
			text.add("size: " + setup.fontSize());
		}
		if (!text.isEmpty()) {
			rules.add("#set text(" + String.join(", ", text) + ")");
		}
		if (setup.justify() != null) {
			rules.add("#set par(justify: " + setup.justify() + ")");
		}
		return rules;
	}

	public String printMath(MathNode node) {
		return math.print(node);
	}

	private static List<DocNode> flatten(DocNode root) {
		List<DocNode> out = new ArrayList<>();
		List<DocNode> stack = new ArrayList<>(List.of(root));
		while (!stack.isEmpty()) {
			DocNode node = stack.remove(stack.size() - 1);
			out.add(node);
			stack.addAll(DocNodes.children(node));
		}
		return out;
	}

	// ---- blocks ----

	String blocks(List<DocNode> nodes) {
		List<String> out = new ArrayList<>();
		for (DocNode block : Blocks.group(nodes)) {
			String text = block(block);
			if (!text.isEmpty()) {
				out.add(text);
			}
		}
		return String.join("\n\n", out);
	}

	private String block(DocNode node) {
		if (node instanceof Paragraph p) {
			return inline(p.content());
		}
		if (node instanceof Heading h) {
			return heading(h);
		}
		if (node instanceof ListBlock l) {
			return list(l);
		}
		if (node instanceof Quote q) {
			return "#quote(block: true)[\n" + Blocks.indent(blocks(q.content()), "  ") + "\n]";
		}
		if (node instanceof CodeBlock c) {
			String fence = fence(c.code());
			return fence + (c.language() == null ? "" : c.language()) + "\n" + c.code() + "\n" + fence;
		}
		if (node instanceof BlockMath m) {
			String label = m.label() == null ? "" : " <" + m.label() + ">";
			return "$ " + math.print(m.math()) + " $" + label;
		}
		if (node instanceof TableNode t) {
			return "#" + tables.print(t.grid());
		}
		if (node instanceof Figure f) {
			return figure(f);
		}
		if (node instanceof Graphic g) {
			return "#" + graphic(g);
		}
		if (node instanceof Bibliography b) {
			String style = b.style() == null ? "" : ", style: " + TypstEscaper.string(b.style());
			return "#bibliography(" + TypstEscaper.string(b.source()) + style + ")";
		}
		if (node instanceof BibEntry e) {
			return "- " + inline(e.content()) + " <" + e.key() + ">";
		}
		if (node instanceof PageSetup) {
			// printed with the set rules at the top
			return "";
		}
		throw new IllegalArgumentException("unexpected block " + node);
	}

	private String heading(Heading h) {
		String label = h.label() == null ? "" : " <" + h.label() + ">";
		if (headingNumbering && !h.numbered()) {
			return "#heading(level: " + h.level() + ", numbering: none)[" + inline(h.content()) + "]" + label;
		}
		return "=".repeat(h.level()) + " " + inline(h.content()) + label;
	}

	private String list(ListBlock list) {
		List<String> items = new ArrayList<>();
		String marker = list.ordered() ? "+ " : "- ";
		for (ListItem item : list.items()) {
			String body;
			if (Blocks.allInline(item.content())) {
				body = inline(item.content());
			} else {
				List<String> parts = new ArrayList<>();
				for (DocNode block : Blocks.group(item.content())) {
					parts.add(block(block));
				}
				body = String.join("\n", parts);
			}
			items.add(marker + Blocks.indent(body, "  ").stripLeading());
		}
		return String.join("\n", items);
	}

	private String figure(Figure f) {
		List<String> args = new ArrayList<>();
		List<DocNode> body = f.body();
		boolean tableBody = body.size() == 1 && body.get(0) instanceof TableNode;
		if (body.size() == 1 && body.get(0) instanceof Image image) {
			args.add(image(image));
		} else if (tableBody) {
			args.add(tables.print(((TableNode) body.get(0)).grid()));
		} else {
			args.add("[\n" + Blocks.indent(blocks(body), "  ") + "\n]");
		}
		if (!f.caption().isEmpty()) {
			args.add("caption: [" + inline(f.caption()) + "]");
		}
		if (f.isTable() && !tableBody) {
			args.add("kind: \"table\"");
		}
		String label = f.label() == null ? "" : " <" + f.label() + ">";
		return "#figure(\n" + Blocks.indent(String.join(",\n", args), "  ") + ",\n)" + label;
	}

	private static String graphic(Graphic g) {
		return "cetz.canvas({\n" + Blocks.indent(g.source(), "  ") + "\n})";
	}

	private static String image(Image image) {
		String width = image.width() != null && LENGTH.matcher(image.width()).matches()
				? ", width: " + image.width() : "";
		return "image(" + TypstEscaper.string(image.path()) + width + ")";
	}

	private static String fence(String code) {
		int longest = 0;
		int run = 0;
		for (char ch : code.toCharArray()) {
			run = ch == '`' ? run + 1 : 0;
			longest = Math.max(longest, run);
		}
		return "`".repeat(Math.max(3, longest + 1));
	}

	// ---- inline ----

	String inline(List<DocNode> nodes) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < nodes.size(); i++) {
			DocNode node = nodes.get(i);
			DocNode next = i + 1 < nodes.size() ? nodes.get(i + 1) : null;
			boolean lineStart = sb.length() == 0 || sb.charAt(sb.length() - 1) == '\n';
			sb.append(inline(node, sb, next, lineStart));
		}
		return sb.toString();
	}

	private String inline(DocNode node, CharSequence before, DocNode next, boolean lineStart) {
		if (node instanceof Text t) {
			return TypstEscaper.markup(t.text(), lineStart);
		}
		if (node instanceof Strong s) {
			return wrapped("strong", '*', s.content(), before, next);
		}
		if (node instanceof Emph e) {
			return wrapped("emph", '_', e.content(), before, next);
		}
		if (node instanceof InlineCode c) {
			if (c.code().indexOf('`') >= 0 || c.code().isEmpty()) {
				return "#raw(" + TypstEscaper.string(c.code()) + ")";
			}
			return "`" + c.code() + "`";
		}
		if (node instanceof InlineMath m) {
			return "$" + math.print(m.math()) + "$";
		}
		if (node instanceof LineBreak) {
			return "\\\n";
		}
		if (node instanceof Link l) {
			String text = DocNodes.plainText(l.content());
			if (text.equals(l.url()) && (l.url().startsWith("http://") || l.url().startsWith("https://"))) {
				return l.url();
			}
			return "#link(" + TypstEscaper.string(l.url()) + ")[" + inline(l.content()) + "]";
		}
		if (node instanceof Reference r) {
			return reference(r, next);
		}
		if (node instanceof Image image) {
			return "#" + image(image);
		}
		if (node instanceof LossMarker m) {
			return lossComments ? LossComments.typst(m.lossId(), m.snippet()) : "";
		}
		if (node instanceof Raw raw) {
			return raw.language() == Language.TYPST ? raw.text() : TypstEscaper.markup(raw.text(), lineStart);
		}
		if (node instanceof Opaque o) {
			return o.language() == Language.TYPST ? o.source() : "";
		}
		if (Blocks.isBlock(node)) {
			return block(node);
		}
		throw new IllegalArgumentException("unexpected inline node " + node);
	}

	/** {@code *x*} / {@code _x_}, or the function form where the delimiter would touch a word. */
	private String wrapped(String function, char delimiter, List<DocNode> content, CharSequence before,
			DocNode next) {
		String inner = inline(content);
		if (inner.isEmpty()) {
			return "";
		}
		boolean wordBefore = before.length() > 0 && Character.isLetterOrDigit(before.charAt(before.length() - 1));
		boolean wordAfter = next instanceof Text t && !t.text().isEmpty()
				&& Character.isLetterOrDigit(t.text().charAt(0));
		if (wordBefore || wordAfter || Character.isWhitespace(inner.charAt(0))
				|| Character.isWhitespace(inner.charAt(inner.length() - 1))) {
			return "#" + function + "[" + inner + "]";
		}
		return delimiter + inner + delimiter;
	}

	private static String reference(Reference r, DocNode next) {
		List<String> out = new ArrayList<>();
		boolean labelCharAfter = next instanceof Text t && !t.text().isEmpty() && isLabelChar(t.text().charAt(0));
		for (String key : r.keys()) {
			switch (r.kind()) {
				case CITE -> out.add("#cite(<" + key + ">)");
				case LABEL -> out.add("<" + key + ">");
				case REF -> out.add(labelCharAfter ? "#ref(<" + key + ">)" : "@" + key);
			}
		}
		return String.join(" ", out);
	}

	private static boolean isLabelChar(char ch) {
		return Character.isLetterOrDigit(ch) || ch == '_' || ch == '-' || ch == ':' || ch == '.';
	}
}
