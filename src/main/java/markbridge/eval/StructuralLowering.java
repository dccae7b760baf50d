package markbridge.eval;

import markbridge.ast.doc.Bibliography;
import markbridge.ast.doc.CellAlign;
import markbridge.ast.doc.CodeBlock;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.Emph;
import markbridge.ast.doc.Figure;
import markbridge.ast.doc.Heading;
import markbridge.ast.doc.Image;
import markbridge.ast.doc.InlineCode;
import markbridge.ast.doc.LineBreak;
import markbridge.ast.doc.Link;
import markbridge.ast.doc.Paragraph;
import markbridge.ast.doc.Quote;
import markbridge.ast.doc.Reference;
import markbridge.ast.doc.Strong;
import markbridge.ast.doc.TableNode;
import markbridge.ast.doc.Text;
import markbridge.loss.LossKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lowers calls of Typst's structural functions to document nodes.
 */
final class StructuralLowering {
	static final Set<String> FUNCTIONS = Set.of("heading", "strong", "emph", "link", "figure", "table", "table.cell",
			"table.hline", "table.vline", "table.header", "table.footer", "image", "cite", "ref", "quote",
			"bibliography", "raw", "align", "block", "box", "pagebreak", "v", "h", "linebreak", "parbreak");

	boolean handles(String name) {
		return FUNCTIONS.contains(name);
	}

	Value lower(String name, Arguments args, boolean headingNumbering) {
		return switch (name) {
			case "heading" -> heading(args, headingNumbering);
			case "strong" -> single(new Strong(content(args.body())));
			case "emph" -> single(new Emph(content(args.body())));
			case "link" -> link(args);
			case "figure" -> figure(args);
			case "table" -> single(new TableNode(new TypstTableBuilder(StructuralLowering::content).build(args)));
			case "table.cell" -> cell(args);
			case "table.hline", "table.vline" -> rule(name.endsWith("vline"), args);
			case "table.header", "table.footer" -> new HeaderValue(name.endsWith("footer"), args.positional());
			case "image" -> image(args);
			case "cite" -> single(new Reference(Reference.Kind.CITE, List.of(labelOf(args.required(0, name)))));
			case "ref" -> single(new Reference(Reference.Kind.REF, List.of(labelOf(args.required(0, name)))));
			case "quote" -> single(new Quote(BlockFlow.normalize(content(args.body()))));
			case "bibliography" -> bibliography(args);
			case "raw" -> raw(args);
			case "align" -> new ContentValue(content(args.body()));
			case "block", "box" -> args.body() == null ? ContentValue.EMPTY : new ContentValue(content(args.body()));
			case "linebreak" -> single(new LineBreak());
			case "pagebreak", "v", "h", "parbreak" -> ContentValue.EMPTY;
			default -> throw new IllegalArgumentException("not a structural function: " + name);
		};
	}

	private static ContentValue single(DocNode node) {
		return new ContentValue(List.of(node));
	}

	/** Markup view of a value used as content. */
	static List<DocNode> content(Value value) {
		if (value == null || value instanceof NoneValue) {
			return List.of();
		}
		if (value instanceof ContentValue c) {
			return c.nodes();
		}
		if (value instanceof StrValue s) {
			return List.of(new Text(s.value()));
		}
		if (value instanceof NumberValue n) {
			return List.of(new Text(n.display()));
		}
		if (value instanceof CellValue c) {
			return c.content();
		}
		throw new EvalException(LossKind.UNSUPPORTED_VALUE, "a " + value.typeName() + " cannot be used as content");
	}

	private static Value heading(Arguments args, boolean headingNumbering) {
		int level = args.named("level") instanceof NumberValue n ? (int) Math.max(1, n.asLong()) : 1;
		boolean numbered = headingNumbering;
		if (args.has("numbering")) {
			numbered = !(args.named("numbering") instanceof NoneValue);
		}
		return single(new Heading(level, content(args.body()), null, numbered));
	}

	private static Value link(Arguments args) {
		Value dest = args.required(0, "link");
		if (dest instanceof LabelValue label) {
			return single(new Reference(Reference.Kind.REF, List.of(label.name())));
		}
		if (!(dest instanceof StrValue url)) {
			throw new EvalException(LossKind.UNSUPPORTED_VALUE, "link destination is a " + dest.typeName());
		}
		List<DocNode> body = args.positional().size() > 1 ? content(args.body()) : List.of(new Text(url.value()));
		return single(new Link(url.value(), body));
	}

	private static Value figure(Arguments args) {
		List<DocNode> body = BlockFlow.normalize(new ArrayList<>(content(args.required(0, "figure"))));
		List<DocNode> caption = content(args.named("caption"));
		boolean isTable = body.stream().anyMatch(n -> n instanceof TableNode);
		Value kind = args.named("kind");
		if (kind instanceof StrValue s) {
			isTable = s.value().equals("table");
		}
		// an image figure keeps the image itself as its body
		if (body.size() == 1 && body.get(0) instanceof Paragraph p && p.content().size() == 1
				&& p.content().get(0) instanceof Image) {
			body = p.content();
		}
		return single(new Figure(body, caption, null, isTable));
	}

	private static Value cell(Arguments args) {
		int colspan = args.named("colspan") instanceof NumberValue n ? (int) n.asLong() : 1;
		int rowspan = args.named("rowspan") instanceof NumberValue n ? (int) n.asLong() : 1;
		CellAlign align = args.named("align") instanceof AlignValue a ? TypstTableBuilder.toCellAlign(a) : null;
		String fill = args.named("fill") instanceof ColorValue c ? c.source() : null;
		return new CellValue(content(args.body()), colspan, rowspan, align, fill);
	}

	private static Value rule(boolean vertical, Arguments args) {
		Integer position = intOrNull(args.named(vertical ? "x" : "y"));
		if (position == null) {
			position = intOrNull(args.at(0));
		}
		String stroke = args.named("stroke") instanceof LengthValue l ? l.text() : null;
		return new RuleValue(vertical, position, intOrNull(args.named("start")), intOrNull(args.named("end")), stroke);
	}

	private static Integer intOrNull(Value v) {
		return v instanceof NumberValue n ? (int) n.asLong() : null;
	}

	private static Value image(Arguments args) {
		Value path = args.required(0, "image");
		if (!(path instanceof StrValue s)) {
			throw new EvalException(LossKind.UNSUPPORTED_VALUE, "image path is a " + path.typeName());
		}
		String width = args.named("width") instanceof LengthValue l ? l.text() : null;
		return single(new Image(s.value(), width));
	}

	private static String labelOf(Value v) {
		if (v instanceof LabelValue l) {
			return l.name();
		}
		if (v instanceof StrValue s) {
			return s.value();
		}
		throw new EvalException(LossKind.UNSUPPORTED_VALUE, "expected a label, found a " + v.typeName());
	}

	private static Value bibliography(Arguments args) {
		Value source = args.required(0, "bibliography");
		String path;
		if (source instanceof StrValue s) {
			path = s.value();
		} else if (source instanceof ArrayValue a && !a.items().isEmpty() && a.items().get(0) instanceof StrValue s) {
			path = s.value();
		} else {
			throw new EvalException(LossKind.UNSUPPORTED_VALUE, "bibliography source is a " + source.typeName());
		}
		String style = args.named("style") instanceof StrValue s ? s.value() : null;
		return single(new Bibliography(path, style));
	}

	private static Value raw(Arguments args) {
		Value text = args.required(0, "raw");
		if (!(text instanceof StrValue s)) {
			throw new EvalException(LossKind.UNSUPPORTED_VALUE, "raw text is a " + text.typeName());
		}
		String lang = args.named("lang") instanceof StrValue l ? l.value() : "";
		boolean block = args.named("block") instanceof BoolValue b && b.value();
		return single(block ? new CodeBlock(lang, s.value()) : new InlineCode(s.value()));
	}
}
