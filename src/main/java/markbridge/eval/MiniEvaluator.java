package markbridge.eval;

import markbridge.ast.Language;
import markbridge.ast.doc.BlockMath;
import markbridge.ast.doc.CodeBlockNode;
import markbridge.ast.doc.Conditional;
import markbridge.ast.doc.Directive;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.Document;
import markbridge.ast.doc.Embed;
import markbridge.ast.doc.Emph;
import markbridge.ast.doc.ForLoop;
import markbridge.ast.doc.Graphic;
import markbridge.ast.doc.Heading;
import markbridge.ast.doc.InlineMath;
import markbridge.ast.doc.LetBinding;
import markbridge.ast.doc.Link;
import markbridge.ast.doc.ListBlock;
import markbridge.ast.doc.ListItem;
import markbridge.ast.doc.PageSetup;
import markbridge.ast.doc.Paragraph;
import markbridge.ast.doc.Quote;
import markbridge.ast.doc.Reference;
import markbridge.ast.doc.Strong;
import markbridge.ast.doc.Text;
import markbridge.ast.math.MathAtom;
import markbridge.ast.math.MathEmbed;
import markbridge.ast.math.MathNode;
import markbridge.ast.math.MathNodes;
import markbridge.ast.math.MathRow;
import markbridge.ast.math.MathText;
import markbridge.ast.script.ArrayExpr;
import markbridge.ast.script.BinaryExpr;
import markbridge.ast.script.BoolLit;
import markbridge.ast.script.CallArg;
import markbridge.ast.script.CallExpr;
import markbridge.ast.script.ClosureExpr;
import markbridge.ast.script.CodeExpr;
import markbridge.ast.script.ContentExpr;
import markbridge.ast.script.DictExpr;
import markbridge.ast.script.Expr;
import markbridge.ast.script.FieldExpr;
import markbridge.ast.script.Ident;
import markbridge.ast.script.IfExpr;
import markbridge.ast.script.LabelExpr;
import markbridge.ast.script.LengthLit;
import markbridge.ast.script.MathExpr;
import markbridge.ast.script.NoneLit;
import markbridge.ast.script.NumberLit;
import markbridge.ast.script.SpreadExpr;
import markbridge.ast.script.StrLit;
import markbridge.ast.script.UnaryExpr;
import markbridge.loss.LossKind;
import markbridge.loss.LossTracker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Statically evaluates the scripting subset of a raw Typst tree.
 *
 * Bindings, loops over arrays and ranges, decidable conditionals, embedded
 * expressions and content functions are resolved; structural function calls
 * are lowered to document nodes. Everything else becomes an {@code Opaque} node
 * whose loss is recorded only if the node reaches the returned document.
 */
public final class MiniEvaluator {
	private static final Logger log = LoggerFactory.getLogger(MiniEvaluator.class);

	private static final Set<String> CANVAS = Set.of("cetz.canvas", "canvas");
	private static final Set<String> BUILTINS = Set.of("range", "str", "upper", "lower", "int", "float", "label",
			"rgb", "luma");
	private static final Set<String> UNSUPPORTED_FUNCTIONS = Set.of("counter", "state", "place", "locate", "query",
			"context", "eval", "numbering", "lorem", "measure", "layout", "here");
	private static final Set<String> PAGE_TARGETS = Set.of("page", "text", "par");
	private static final Set<String> HARMLESS_SET = Set.of("document", "heading",
			"math.equation", "list", "enum", "figure", "table", "image", "block", "box", "align", "cite",
			"bibliography", "raw", "footnote", "outline", "link", "quote", "terms", "strong", "emph", "grid");
	private static final Map<String, AlignValue> ALIGNMENTS = Map.of(
			"left", new AlignValue("left", null),
			"center", new AlignValue("center", null),
			"right", new AlignValue("right", null),
			"start", new AlignValue("start", null),
			"end", new AlignValue("end", null),
			"top", new AlignValue(null, "top"),
			"horizon", new AlignValue(null, "horizon"),
			"bottom", new AlignValue(null, "bottom"));
	private static final Set<String> COLORS = Set.of("black", "gray", "silver", "white", "navy", "blue", "aqua",
			"teal", "eastern", "purple", "fuchsia", "maroon", "red", "orange", "yellow", "olive", "green", "lime");

	private final LossTracker tracker;
	private final int maxLoopIterations;
	private final int maxCallDepth;
	private final PendingLosses pending = new PendingLosses();
	private final StructuralLowering lowering = new StructuralLowering();
	private Environment env = new Environment();
	private int callDepth;
	private boolean headingNumbering;
	private boolean equationNumbering;

	public MiniEvaluator(LossTracker tracker, int maxLoopIterations, int maxCallDepth) {
		this.tracker = tracker;
		this.maxLoopIterations = maxLoopIterations;
		this.maxCallDepth = maxCallDepth;
	}

	public Document evaluate(Document raw) {
		int before = tracker.size();
		List<DocNode> blocks = BlockFlow.normalize(evalNodes(raw.children()));
		blocks = BlockFlow.resolveReferences(blocks);
		Document result = (Document) pending.assign(new Document(blocks), tracker);
		log.debug("evaluated {} top-level nodes into {} blocks, {} losses", raw.children().size(), blocks.size(),
				tracker.size() - before);
		return result;
	}

	/** Evaluates one expression in the current environment. */
	public Evaluation evaluate(Expr expr) {
		try {
			return new Evaluation.Resolved(eval(expr));
		} catch (EvalException e) {
			return new Evaluation.Unresolved(e.kind(), e.getMessage());
		}
	}

	public Environment environment() {
		return env;
	}

	// ---------------------------------------------------------------- markup

	private List<DocNode> evalNodes(List<DocNode> nodes) {
		List<DocNode> out = new ArrayList<>();
		for (DocNode node : nodes) {
			out.addAll(evalNode(node));
		}
		return out;
	}

	private List<DocNode> evalNode(DocNode node) {
		if (node instanceof LetBinding let) {
			bind(let);
			return List.of();
		}
		if (node instanceof Directive directive) {
			return directive(directive);
		}
		if (node instanceof ForLoop loop) {
			return loop(loop);
		}
		if (node instanceof Conditional conditional) {
			return conditional(conditional);
		}
		if (node instanceof Embed embed) {
			return embed(embed);
		}
		if (node instanceof CodeBlockNode code) {
			return List.of(pending.opaque(code.source(), LossKind.CODE_BLOCK, "code-block",
					"procedural code block is not evaluated"));
		}
		if (node instanceof Heading h) {
			return List.of(new Heading(h.level(), inline(h.content()), h.label(), h.numbered() || headingNumbering));
		}
		if (node instanceof Paragraph p) {
			return List.of(new Paragraph(evalNodes(p.content())));
		}
		if (node instanceof ListBlock list) {
			List<ListItem> items = new ArrayList<>();
			for (ListItem item : list.items()) {
				items.add(new ListItem(BlockFlow.content(evalNodes(item.content()))));
			}
			return List.of(new ListBlock(list.ordered(), items));
		}
		if (node instanceof Quote q) {
			return List.of(new Quote(BlockFlow.normalize(evalNodes(q.content()))));
		}
		if (node instanceof Strong s) {
			return List.of(new Strong(inline(s.content())));
		}
		if (node instanceof Emph e) {
			return List.of(new Emph(inline(e.content())));
		}
		if (node instanceof Link l) {
			return List.of(new Link(l.url(), inline(l.content())));
		}
		if (node instanceof InlineMath m) {
			return List.of(new InlineMath(evalMath(m.math())));
		}
		if (node instanceof BlockMath m) {
			return List.of(new BlockMath(evalMath(m.math()), m.label(), m.numbered() || equationNumbering));
		}
		return List.of(node);
	}

	/** Evaluates a content block in its own scope. */
	private List<DocNode> scoped(List<DocNode> body) {
		Environment scope = env;
		scope.push();
		try {
			return evalNodes(body);
		} finally {
			scope.pop();
		}
	}

	private List<DocNode> inline(List<DocNode> nodes) {
		return BlockFlow.mergeText(evalNodes(nodes));
	}

	private void bind(LetBinding let) {
		if (let.params() != null) {
			env.define(let.name(), new FunctionValue(let.name(), let.params(), let.value(), env.capture()));
			return;
		}
		try {
			env.define(let.name(), eval(let.value()));
		} catch (EvalException e) {
			// reported where the binding is used, if it ever is
			env.define(let.name(), new UnresolvedValue(let.source(), e.kind(), e.getMessage()));
		}
	}

	private List<DocNode> directive(Directive d) {
		switch (d.keyword()) {
			case "set" -> {
				if (PAGE_TARGETS.contains(d.target())) {
					return pageSetup(d);
				}
				if (d.source().contains("numbering")) {
					boolean on = !d.source().matches("(?s).*numbering\\s*:\\s*none.*");
					if (d.target().equals("heading")) {
						headingNumbering = on;
					} else if (d.target().equals("math.equation")) {
						equationNumbering = on;
					}
				}
				if (HARMLESS_SET.contains(d.target())) {
					log.debug("dropping set rule for {}", d.target());
					boolean numberingOnly = d.args().stream().allMatch(a -> a.isNamed() && a.name().equals("numbering"));
					if (!numberingOnly) {
						tracker.warn("set rule dropped: " + d.source().strip());
					}
					return List.of();
				}
				return List.of(pending.opaque(d.source(), LossKind.UNSUPPORTED_EXPRESSION, "set",
						"set rule for " + d.target() + " is not evaluated"));
			}
			case "import" -> {
				if (d.target().contains("@preview/cetz")) {
					return List.of();
				}
				return List.of(pending.opaque(d.source(), LossKind.UNSUPPORTED_EXPRESSION, "import",
						"import of " + d.target() + " is not resolved"));
			}
			default -> {
				return List.of(pending.opaque(d.source(), LossKind.UNSUPPORTED_EXPRESSION, d.keyword(),
						d.keyword() + " rule is not evaluated"));
			}
		}
	}

	/** Page, text and paragraph settings; keys with no counterpart are warned about. */
	private List<DocNode> pageSetup(Directive d) {
		Arguments args;
		try {
			args = arguments(d.args());
		} catch (EvalException e) {
			return List.of(pending.opaque(d.source(), e.kind(), "set", e.getMessage()));
		}
		PageSetup setup = PageSetup.NONE;
		for (Map.Entry<String, Value> arg : args.named().entrySet()) {
			Value v = arg.getValue();
			PageSetup next = switch (d.target() + "." + arg.getKey()) {
				case "page.paper" -> v instanceof StrValue s ? setup.withPaper(s.value()) : null;
				case "page.margin" -> margins(setup, v);
				case "page.columns" -> v instanceof NumberValue n && n.integral() && n.integer() >= 1
						&& n.integer() <= 16 ? setup.withColumns((int) n.integer()) : null;
				case "text.size" -> v instanceof LengthValue l ? setup.withFontSize(l.text()) : null;
				case "text.font" -> font(setup, v);
				case "par.justify" -> v instanceof BoolValue b ? setup.withJustify(b.value()) : null;
				default -> null;
			};
			if (next == null) {
				tracker.warn("set " + d.target() + "(" + arg.getKey() + ": ..) is not carried across languages");
			} else {
				setup = next;
			}
		}
		if (!args.positional().isEmpty()) {
			tracker.warn("positional arguments of set " + d.target() + " are not carried across languages");
		}
		return setup.isEmpty() ? List.of() : List.of(setup);
	}

	private static PageSetup margins(PageSetup setup, Value v) {
		if (v instanceof LengthValue l) {
			return setup.withMargin("all", l.text());
		}
		if (!(v instanceof DictValue dict)) {
			return null;
		}
		PageSetup out = setup;
		for (Map.Entry<String, Value> side : dict.entries().entrySet()) {
			if (!(side.getValue() instanceof LengthValue l)) {
				return null;
			}
			switch (side.getKey()) {
				case "x" -> out = out.withMargin("left", l.text()).withMargin("right", l.text());
				case "y" -> out = out.withMargin("top", l.text()).withMargin("bottom", l.text());
				case "left", "right", "top", "bottom" -> out = out.withMargin(side.getKey(), l.text());
				default -> {
					return null;
				}
			}
		}
		return out;
	}

	/** First family of a font or font fallback list. */
	private static PageSetup font(PageSetup setup, Value v) {
		if (v instanceof StrValue s) {
			return setup.withFont(s.value());
		}
		if (v instanceof ArrayValue a && !a.items().isEmpty() && a.items().get(0) instanceof StrValue s) {
			return setup.withFont(s.value());
		}
		return null;
	}

	private List<DocNode> loop(ForLoop loop) {
		Value iterable;
		try {
			iterable = eval(loop.iterable());
		} catch (EvalException e) {
			return List.of(pending.opaque(loop.source(), e.kind(), "for", e.getMessage()));
		}
		List<Value> items = null;
		long size;
		if (iterable instanceof RangeValue range) {
			size = range.size();
		} else if (iterable instanceof ArrayValue array) {
			items = array.items();
			size = items.size();
		} else if (iterable instanceof StrValue s) {
			items = new ArrayList<>();
			for (int cp : s.value().codePoints().toArray()) {
				items.add(new StrValue(new String(Character.toChars(cp))));
			}
			size = items.size();
		} else {
			return List.of(pending.opaque(loop.source(), LossKind.UNSUPPORTED_VALUE, "for",
					"cannot iterate over a " + iterable.typeName()));
		}
		long limit = Math.min(size, maxLoopIterations);
		List<DocNode> out = new ArrayList<>();
		for (long i = 0; i < limit; i++) {
			Value element = items != null ? items.get((int) i) : ((RangeValue) iterable).get(i);
			env.push();
			try {
				env.define(loop.variable(), element);
				out.addAll(iteration(loop.body()));
			} catch (EvalException e) {
				return List.of(pending.opaque(loop.source(), e.kind(), "for", e.getMessage()));
			} finally {
				env.pop();
			}
		}
		if (size > limit) {
			log.debug("loop over {} items stopped after {}", size, limit);
			out.add(pending.opaque(loop.source(), LossKind.LOOP_BOUND_EXCEEDED, "for",
					"loop stopped after " + limit + " of " + size + " iterations"));
		}
		return out;
	}

	private List<DocNode> iteration(Expr body) {
		if (body instanceof ContentExpr content) {
			return BlockFlow.content(evalNodes(content.body()));
		}
		return StructuralLowering.content(eval(body));
	}

	private List<DocNode> conditional(Conditional c) {
		boolean taken;
		try {
			taken = condition(c.condition());
		} catch (EvalException e) {
			return List.of(pending.opaque(c.source(), LossKind.UNRESOLVED_CONDITIONAL, "if", e.getMessage()));
		}
		Expr branch = taken ? c.then() : c.otherwise();
		if (branch == null) {
			return List.of();
		}
		try {
			if (branch instanceof ContentExpr content) {
				return scoped(content.body());
			}
			return StructuralLowering.content(eval(branch));
		} catch (EvalException e) {
			return List.of(pending.opaque(c.source(), e.kind(), "if", e.getMessage()));
		}
	}

	private boolean condition(Expr expr) {
		Value v = eval(expr);
		if (v instanceof BoolValue b) {
			return b.value();
		}
		throw new EvalException(LossKind.UNRESOLVED_CONDITIONAL, "condition is a " + v.typeName() + ", not a bool");
	}

	private List<DocNode> embed(Embed embed) {
		try {
			return display(eval(embed.expr()), embed.source());
		} catch (EvalException e) {
			return List.of(pending.opaque(embed.source(), e.kind(), describe(embed.expr()), e.getMessage()));
		}
	}

	private List<DocNode> display(Value v, String source) {
		if (v instanceof NoneValue || v instanceof AutoValue) {
			return List.of();
		}
		if (v instanceof BoolValue b) {
			return List.of(new Text(Boolean.toString(b.value())));
		}
		if (v instanceof LengthValue l) {
			return List.of(new Text(l.text()));
		}
		if (v instanceof LabelValue l) {
			return List.of(new Reference(Reference.Kind.LABEL, List.of(l.name())));
		}
		if (v instanceof ContentValue || v instanceof StrValue || v instanceof NumberValue || v instanceof CellValue) {
			return StructuralLowering.content(v);
		}
		return List.of(pending.opaque(source, LossKind.UNSUPPORTED_VALUE, v.typeName(),
				"a " + v.typeName() + " value cannot be displayed"));
	}

	private static String describe(Expr expr) {
		if (expr instanceof CallExpr call && call.calleeName() != null) {
			return call.calleeName();
		}
		if (expr instanceof Ident id) {
			return id.name();
		}
		if (expr instanceof FieldExpr field && field.dottedName() != null) {
			return field.dottedName();
		}
		return "expression";
	}

	// ---------------------------------------------------------------- math

	private MathNode evalMath(MathNode node) {
		if (node instanceof MathEmbed embed) {
			return mathEmbed(embed);
		}
		return MathNodes.rebuild(node, this::evalMath);
	}

	private MathNode mathEmbed(MathEmbed embed) {
		String name = describe(embed.expr());
		try {
			Value v = eval(embed.expr());
			if (v instanceof NumberValue n) {
				return new MathAtom(n.display());
			}
			if (v instanceof StrValue s) {
				return new MathText(s.value());
			}
			if (v instanceof NoneValue) {
				return MathRow.of();
			}
			if (v instanceof ContentValue content) {
				List<DocNode> nodes = content.nodes();
				if (nodes.size() == 1 && nodes.get(0) instanceof InlineMath m) {
					return m.math();
				}
				if (nodes.stream().allMatch(n -> n instanceof Text)) {
					StringBuilder sb = new StringBuilder();
					nodes.forEach(n -> sb.append(((Text) n).text()));
					return new MathText(sb.toString());
				}
			}
			return pending.passthrough(embed.source(), LossKind.UNSUPPORTED_VALUE, name,
					"a " + v.typeName() + " value cannot be used in math");
		} catch (EvalException e) {
			return pending.passthrough(embed.source(), e.kind(), name, e.getMessage());
		}
	}

	// ---------------------------------------------------------------- expressions

	private Value eval(Expr expr) {
		if (expr instanceof NoneLit) {
			return NoneValue.NONE;
		}
		if (expr instanceof BoolLit b) {
			return new BoolValue(b.value());
		}
		if (expr instanceof NumberLit n) {
			return number(n.text(), n.integral());
		}
		if (expr instanceof LengthLit l) {
			return new LengthValue(l.text());
		}
		if (expr instanceof StrLit s) {
			return new StrValue(s.value());
		}
		if (expr instanceof LabelExpr l) {
			return new LabelValue(l.label());
		}
		if (expr instanceof Ident id) {
			return lookup(id.name());
		}
		if (expr instanceof ArrayExpr array) {
			List<Value> items = new ArrayList<>();
			for (Expr item : array.items()) {
				items.add(eval(item));
			}
			return new ArrayValue(items);
		}
		if (expr instanceof DictExpr dict) {
			Map<String, Value> entries = new LinkedHashMap<>();
			for (CallArg entry : dict.entries()) {
				if (!entry.isNamed()) {
					throw new EvalException(LossKind.UNSUPPORTED_EXPRESSION, "dictionary spreading is not evaluated");
				}
				entries.put(entry.name(), eval(entry.value()));
			}
			return new DictValue(entries);
		}
		if (expr instanceof UnaryExpr u) {
			return unary(u.op(), eval(u.operand()));
		}
		if (expr instanceof BinaryExpr b) {
			return binary(b);
		}
		if (expr instanceof FieldExpr f) {
			return field(f);
		}
		if (expr instanceof CallExpr call) {
			return call(call);
		}
		if (expr instanceof ContentExpr content) {
			return new ContentValue(BlockFlow.content(scoped(content.body())));
		}
		if (expr instanceof ClosureExpr closure) {
			return new FunctionValue("closure", closure.params(), closure.body(), env.capture());
		}
		if (expr instanceof MathExpr math) {
			MathNode node = evalMath(math.math());
			DocNode out = math.block() ? new BlockMath(node, null, equationNumbering) : new InlineMath(node);
			return new ContentValue(List.of(out));
		}
		if (expr instanceof CodeExpr) {
			throw new EvalException(LossKind.CODE_BLOCK, "code block is not evaluated");
		}
		if (expr instanceof IfExpr i) {
			Expr branch = condition(i.condition()) ? i.then() : i.otherwise();
			return branch == null ? NoneValue.NONE : eval(branch);
		}
		if (expr instanceof SpreadExpr) {
			throw new EvalException(LossKind.UNSUPPORTED_EXPRESSION, "argument spreading is not evaluated");
		}
		throw new EvalException(LossKind.UNSUPPORTED_EXPRESSION, "unsupported syntax");
	}

	private Value lookup(String name) {
		Value v = env.lookup(name);
		if (v instanceof UnresolvedValue u) {
			throw new EvalException(u.kind(), u.reason());
		}
		if (v != null) {
			return v;
		}
		AlignValue align = ALIGNMENTS.get(name);
		if (align != null) {
			return align;
		}
		if (name.equals("auto")) {
			return new AutoValue();
		}
		if (COLORS.contains(name)) {
			return new ColorValue(name);
		}
		if (lowering.handles(name)) {
			// element functions used as values, e.g. figure(kind: table)
			return new StrValue(name);
		}
		throw new EvalException(LossKind.UNSUPPORTED_EXPRESSION, "unknown variable " + name);
	}

	private static Value unary(String op, Value v) {
		if (op.equals("not") && v instanceof BoolValue b) {
			return new BoolValue(!b.value());
		}
		if (v instanceof NumberValue n) {
			if (op.equals("-")) {
				if (!n.integral()) {
					return NumberValue.ofFloat(-n.real());
				}
				try {
					return NumberValue.of(Math.negateExact(n.integer()));
				} catch (ArithmeticException e) {
					throw new EvalException(LossKind.UNSUPPORTED_VALUE, "integer overflow in -" + n.display());
				}
			}
			if (op.equals("+")) {
				return n;
			}
		}
		throw new EvalException(LossKind.UNSUPPORTED_VALUE, "cannot apply '" + op + "' to a " + v.typeName());
	}

	private Value binary(BinaryExpr b) {
		String op = b.op();
		if (op.equals("and") || op.equals("or")) {
			boolean left = condition(b.left());
			if (op.equals("and") ? !left : left) {
				return new BoolValue(left);
			}
			return new BoolValue(condition(b.right()));
		}
		Value l = eval(b.left());
		Value r = eval(b.right());
		return switch (op) {
			case "==" -> new BoolValue(equal(l, r));
			case "!=" -> new BoolValue(!equal(l, r));
			case "<", "<=", ">", ">=" -> new BoolValue(compare(op, l, r));
			case "+" -> add(l, r);
			case "-", "*", "/" -> arithmetic(op, l, r);
			case "in" -> new BoolValue(contains(r, l));
			case "not in" -> new BoolValue(!contains(r, l));
			default -> throw new EvalException(LossKind.UNSUPPORTED_EXPRESSION, "operator " + op + " is not evaluated");
		};
	}

	static boolean equal(Value a, Value b) {
		if (a instanceof NumberValue x && b instanceof NumberValue y) {
			return x.integral() && y.integral() ? x.integer() == y.integer() : x.value() == y.value();
		}
		Value left = a instanceof RangeValue ra ? ra.materialize() : a;
		Value right = b instanceof RangeValue rb ? rb.materialize() : b;
		if (left instanceof ArrayValue x && right instanceof ArrayValue y) {
			if (x.items().size() != y.items().size()) {
				return false;
			}
			for (int i = 0; i < x.items().size(); i++) {
				if (!equal(x.items().get(i), y.items().get(i))) {
					return false;
				}
			}
			return true;
		}
		return left.equals(right);
	}

	private static boolean compare(String op, Value l, Value r) {
		int cmp;
		if (l instanceof NumberValue x && r instanceof NumberValue y) {
			cmp = x.integral() && y.integral() ? Long.compare(x.integer(), y.integer())
					: Double.compare(x.value(), y.value());
		} else if (l instanceof StrValue x && r instanceof StrValue y) {
			cmp = x.value().compareTo(y.value());
		} else {
			throw new EvalException(LossKind.UNSUPPORTED_VALUE,
					"cannot compare a " + l.typeName() + " with a " + r.typeName());
		}
		return switch (op) {
			case "<" -> cmp < 0;
			case "<=" -> cmp <= 0;
			case ">" -> cmp > 0;
			default -> cmp >= 0;
		};
	}

	private static Value add(Value l, Value r) {
		if (l instanceof NumberValue x && r instanceof NumberValue y) {
			return numeric("+", x, y);
		}
		if (l instanceof StrValue x && r instanceof StrValue y) {
			return new StrValue(x.value() + y.value());
		}
		if (isArray(l) && isArray(r)) {
			List<Value> items = new ArrayList<>(asArray(l).items());
			items.addAll(asArray(r).items());
			return new ArrayValue(items);
		}
		if (isContentLike(l) && isContentLike(r)) {
			List<DocNode> nodes = new ArrayList<>(StructuralLowering.content(l));
			nodes.addAll(StructuralLowering.content(r));
			return new ContentValue(BlockFlow.mergeText(nodes));
		}
		if (l instanceof NoneValue) {
			return r;
		}
		if (r instanceof NoneValue) {
			return l;
		}
		throw new EvalException(LossKind.UNSUPPORTED_VALUE, "cannot add a " + l.typeName() + " and a " + r.typeName());
	}

	/** Integer arithmetic is exact; overflow is an evaluation error instead of a wrapped value. */
	private static NumberValue numeric(String op, NumberValue x, NumberValue y) {
		if (x.integral() && y.integral()) {
			try {
				return NumberValue.of(switch (op) {
					case "+" -> Math.addExact(x.integer(), y.integer());
					case "-" -> Math.subtractExact(x.integer(), y.integer());
					default -> Math.multiplyExact(x.integer(), y.integer());
				});
			} catch (ArithmeticException e) {
				throw new EvalException(LossKind.UNSUPPORTED_VALUE,
						"integer overflow in " + x.display() + " " + op + " " + y.display());
			}
		}
		double a = x.value();
		double b = y.value();
		return NumberValue.ofFloat(switch (op) {
			case "+" -> a + b;
			case "-" -> a - b;
			default -> a * b;
		});
	}

	private static NumberValue number(String text, boolean integral) {
		try {
			return integral ? NumberValue.of(Long.parseLong(text)) : NumberValue.ofFloat(Double.parseDouble(text));
		} catch (NumberFormatException e) {
			throw new EvalException(LossKind.UNSUPPORTED_VALUE, "number " + text + " is out of range");
		}
	}

	private static boolean isContentLike(Value v) {
		return v instanceof ContentValue || v instanceof StrValue;
	}

	private static Value arithmetic(String op, Value l, Value r) {
		if (l instanceof NumberValue x && r instanceof NumberValue y) {
			return switch (op) {
				case "-", "*" -> numeric(op, x, y);
				default -> {
					if (y.value() == 0) {
						throw new EvalException(LossKind.UNSUPPORTED_VALUE, "division by zero");
					}
					yield NumberValue.ofFloat(x.value() / y.value());
				}
			};
		}
		if (op.equals("*")) {
			Value seq = l instanceof NumberValue ? r : l;
			Value times = l instanceof NumberValue ? l : r;
			if (times instanceof NumberValue n && n.integral() && n.value() >= 0) {
				if (seq instanceof StrValue s) {
					return new StrValue(s.value().repeat((int) n.asLong()));
				}
				if (isArray(seq)) {
					List<Value> items = new ArrayList<>();
					for (long i = 0; i < n.asLong(); i++) {
						items.addAll(asArray(seq).items());
					}
					return new ArrayValue(items);
				}
			}
		}
		throw new EvalException(LossKind.UNSUPPORTED_VALUE,
				"cannot apply '" + op + "' to a " + l.typeName() + " and a " + r.typeName());
	}

	private static boolean contains(Value container, Value item) {
		if (container instanceof StrValue s && item instanceof StrValue sub) {
			return s.value().contains(sub.value());
		}
		if (container instanceof DictValue d && item instanceof StrValue key) {
			return d.entries().containsKey(key.value());
		}
		if (container instanceof RangeValue range && item instanceof NumberValue n) {
			for (long i = 0; i < range.size(); i++) {
				if (equal(range.get(i), n)) {
					return true;
				}
			}
			return false;
		}
		if (container instanceof ArrayValue array) {
			return array.items().stream().anyMatch(v -> equal(v, item));
		}
		throw new EvalException(LossKind.UNSUPPORTED_VALUE, "cannot search in a " + container.typeName());
	}

	private static boolean isArray(Value v) {
		return v instanceof ArrayValue || v instanceof RangeValue;
	}

	private static ArrayValue asArray(Value v) {
		return v instanceof RangeValue range ? range.materialize() : (ArrayValue) v;
	}

	private Value field(FieldExpr f) {
		String dotted = f.dottedName();
		if (dotted != null && dotted.startsWith("calc.")) {
			throw new EvalException(LossKind.UNSUPPORTED_EXPRESSION, dotted + " is not evaluated");
		}
		Value target = eval(f.target());
		if (target instanceof DictValue dict) {
			Value v = dict.entries().get(f.field());
			if (v == null) {
				throw new EvalException(LossKind.UNSUPPORTED_VALUE, "dictionary has no key " + f.field());
			}
			return v;
		}
		throw new EvalException(LossKind.UNSUPPORTED_EXPRESSION,
				"field " + f.field() + " of a " + target.typeName() + " is not evaluated");
	}

	// ---------------------------------------------------------------- calls

	private Value call(CallExpr call) {
		String name = call.calleeName();
		if (name != null && CANVAS.contains(name)) {
			return canvas(call);
		}
		if (name != null && (name.startsWith("calc.") || UNSUPPORTED_FUNCTIONS.contains(name))) {
			throw new EvalException(LossKind.UNSUPPORTED_EXPRESSION, name + " is not evaluated");
		}
		if (call.callee() instanceof FieldExpr method && !lowering.handles(name == null ? "" : name)) {
			Value target = eval(method.target());
			return method(target, method.field(), arguments(call.args()));
		}
		if (call.callee() instanceof Ident id) {
			Value bound = env.lookup(id.name());
			if (bound instanceof FunctionValue function) {
				return apply(function, arguments(call.args()));
			}
			if (bound instanceof UnresolvedValue u) {
				throw new EvalException(u.kind(), u.reason());
			}
			if (bound == null && BUILTINS.contains(id.name())) {
				return builtin(id.name(), arguments(call.args()));
			}
			if (bound == null && lowering.handles(id.name())) {
				return lowering.lower(id.name(), arguments(call.args()), headingNumbering);
			}
			if (bound == null) {
				throw new EvalException(LossKind.UNSUPPORTED_EXPRESSION, "unknown function " + id.name());
			}
			throw new EvalException(LossKind.UNSUPPORTED_VALUE, id.name() + " is a " + bound.typeName());
		}
		if (name != null && lowering.handles(name)) {
			return lowering.lower(name, arguments(call.args()), headingNumbering);
		}
		Value callee = eval(call.callee());
		if (callee instanceof FunctionValue function) {
			return apply(function, arguments(call.args()));
		}
		throw new EvalException(LossKind.UNSUPPORTED_VALUE, "a " + callee.typeName() + " is not callable");
	}

	private Arguments arguments(List<CallArg> args) {
		List<Value> positional = new ArrayList<>();
		Map<String, Value> named = new LinkedHashMap<>();
		for (CallArg arg : args) {
			if (arg.value() instanceof SpreadExpr) {
				throw new EvalException(LossKind.UNSUPPORTED_EXPRESSION, "argument spreading is not evaluated");
			}
			if (arg.isNamed()) {
				named.put(arg.name(), eval(arg.value()));
			} else {
				positional.add(eval(arg.value()));
			}
		}
		return new Arguments(positional, named);
	}

	private Value apply(FunctionValue function, Arguments args) {
		if (callDepth >= maxCallDepth) {
			throw new EvalException(LossKind.UNSUPPORTED_EXPRESSION,
					"call depth limit " + maxCallDepth + " reached in " + function.name());
		}
		if (!args.named().isEmpty()) {
			throw new EvalException(LossKind.UNSUPPORTED_EXPRESSION,
					"named arguments to " + function.name() + " are not evaluated");
		}
		Environment saved = env;
		env = function.scope().capture();
		env.push();
		for (int i = 0; i < function.params().size(); i++) {
			Value v = args.at(i);
			env.define(function.params().get(i), v == null ? NoneValue.NONE : v);
		}
		callDepth++;
		try {
			return eval(function.body());
		} finally {
			callDepth--;
			env = saved;
		}
	}

	private Value canvas(CallExpr call) {
		for (CallArg arg : call.args()) {
			if (!arg.isNamed() && arg.value() instanceof CodeExpr code) {
				String source = code.source();
				String body = source.length() >= 2 ? source.substring(1, source.length() - 1) : "";
				return new ContentValue(List.of(new Graphic(body.strip(), Language.TYPST, null)));
			}
		}
		throw new EvalException(LossKind.UNSUPPORTED_GRAPHICS, "canvas without a drawing block");
	}

	private static Value builtin(String name, Arguments args) {
		switch (name) {
			case "range" -> {
				long start = 0;
				long end;
				if (args.positional().size() >= 2) {
					start = integer(args.at(0), name);
					end = integer(args.at(1), name);
				} else {
					end = integer(args.required(0, name), name);
				}
				long step = 1;
				if (args.named("step") != null) {
					step = integer(args.named("step"), name);
				} else if (args.positional().size() >= 3) {
					step = integer(args.at(2), name);
				}
				if (step == 0) {
					throw new EvalException(LossKind.UNSUPPORTED_VALUE, "range step must not be zero");
				}
				return new RangeValue(start, end, step);
			}
			case "str" -> {
				Value v = args.required(0, name);
				if (v instanceof StrValue) {
					return v;
				}
				if (v instanceof NumberValue n) {
					return new StrValue(n.display());
				}
				if (v instanceof LabelValue l) {
					return new StrValue(l.name());
				}
				throw new EvalException(LossKind.UNSUPPORTED_VALUE, "cannot convert a " + v.typeName() + " to str");
			}
			case "upper", "lower" -> {
				Value v = args.required(0, name);
				if (v instanceof StrValue s) {
					return new StrValue(name.equals("upper") ? s.value().toUpperCase(Locale.ROOT)
							: s.value().toLowerCase(Locale.ROOT));
				}
				throw new EvalException(LossKind.UNSUPPORTED_VALUE, name + " of a " + v.typeName() + " is not evaluated");
			}
			case "int", "float" -> {
				Value v = args.required(0, name);
				NumberValue n;
				if (v instanceof NumberValue number) {
					n = number;
				} else if (v instanceof BoolValue b) {
					n = NumberValue.of(b.value() ? 1 : 0);
				} else if (v instanceof StrValue s) {
					String text = s.value().trim();
					n = number(text, text.matches("[+-]?\\d+"));
				} else {
					throw new EvalException(LossKind.UNSUPPORTED_VALUE, "cannot convert a " + v.typeName());
				}
				if (name.equals("float")) {
					return NumberValue.ofFloat(n.value());
				}
				if (n.integral()) {
					return n;
				}
				if (Double.isNaN(n.real()) || Math.abs(n.real()) >= 0x1p63) {
					throw new EvalException(LossKind.UNSUPPORTED_VALUE, "cannot convert " + n.display() + " to an int");
				}
				return NumberValue.of((long) n.real());
			}
			case "label" -> {
				Value v = args.required(0, name);
				if (v instanceof StrValue s) {
					return new LabelValue(s.value());
				}
				throw new EvalException(LossKind.UNSUPPORTED_VALUE, "label name is a " + v.typeName());
			}
			case "rgb", "luma" -> {
				List<String> parts = new ArrayList<>();
				for (Value v : args.positional()) {
					if (v instanceof StrValue s) {
						parts.add("\"" + s.value() + "\"");
					} else if (v instanceof NumberValue n) {
						parts.add(n.display());
					} else if (v instanceof LengthValue l) {
						parts.add(l.text());
					} else {
						throw new EvalException(LossKind.UNSUPPORTED_VALUE, name + " argument is a " + v.typeName());
					}
				}
				return new ColorValue(name + "(" + String.join(", ", parts) + ")");
			}
			default -> throw new IllegalArgumentException("not a builtin: " + name);
		}
	}

	private static long integer(Value v, String function) {
		if (v instanceof NumberValue n && n.integral()) {
			return n.asLong();
		}
		throw new EvalException(LossKind.UNSUPPORTED_VALUE,
				function + " expects an integer, found a " + (v == null ? "nothing" : v.typeName()));
	}

	private static Value method(Value target, String method, Arguments args) {
		switch (method) {
			case "len" -> {
				if (target instanceof StrValue s) {
					return NumberValue.of(s.value().getBytes(StandardCharsets.UTF_8).length);
				}
				if (target instanceof RangeValue r) {
					return NumberValue.of(r.size());
				}
				if (target instanceof ArrayValue a) {
					return NumberValue.of(a.items().size());
				}
				if (target instanceof DictValue d) {
					return NumberValue.of(d.entries().size());
				}
			}
			case "at" -> {
				Value index = args.required(0, "at");
				Value fallback = args.named("default");
				if (target instanceof DictValue d && index instanceof StrValue key) {
					Value v = d.entries().get(key.value());
					if (v == null && fallback == null) {
						throw new EvalException(LossKind.UNSUPPORTED_VALUE, "dictionary has no key " + key.value());
					}
					return v == null ? fallback : v;
				}
				if (isArray(target) || target instanceof StrValue) {
					List<Value> items = target instanceof StrValue s ? characters(s) : asArray(target).items();
					long i = integer(index, "at");
					if (i < 0) {
						i += items.size();
					}
					if (i < 0 || i >= items.size()) {
						if (fallback != null) {
							return fallback;
						}
						throw new EvalException(LossKind.UNSUPPORTED_VALUE, "index " + i + " is out of bounds");
					}
					return items.get((int) i);
				}
			}
			case "first", "last" -> {
				if (isArray(target) || target instanceof StrValue) {
					List<Value> items = target instanceof StrValue s ? characters(s) : asArray(target).items();
					if (items.isEmpty()) {
						throw new EvalException(LossKind.UNSUPPORTED_VALUE, method + " of an empty " + target.typeName());
					}
					return method.equals("first") ? items.get(0) : items.get(items.size() - 1);
				}
			}
			case "contains" -> {
				return new BoolValue(contains(target, args.required(0, "contains")));
			}
			case "keys", "values" -> {
				if (target instanceof DictValue d) {
					List<Value> out = new ArrayList<>();
					if (method.equals("keys")) {
						d.entries().keySet().forEach(k -> out.add(new StrValue(k)));
					} else {
						out.addAll(d.entries().values());
					}
					return new ArrayValue(out);
				}
			}
			case "lighten", "darken" -> {
				if (target instanceof ColorValue c) {
					Value amount = args.required(0, method);
					String text = amount instanceof LengthValue l ? l.text()
							: amount instanceof NumberValue n ? n.display() : null;
					if (text != null) {
						return new ColorValue(c.source() + "." + method + "(" + text + ")");
					}
				}
			}
			default -> {
				// fall through to the error below
			}
		}
		throw new EvalException(LossKind.UNSUPPORTED_EXPRESSION,
				"method " + method + " on a " + target.typeName() + " is not evaluated");
	}

	private static List<Value> characters(StrValue s) {
		List<Value> out = new ArrayList<>();
		s.value().codePoints().forEach(cp -> out.add(new StrValue(new String(Character.toChars(cp)))));
		return out;
	}
}
