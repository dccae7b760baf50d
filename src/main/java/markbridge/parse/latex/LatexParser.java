package markbridge.parse.latex;

import markbridge.ast.Language;
import markbridge.ast.SourceSpan;
import markbridge.ast.doc.BibEntry;
import markbridge.ast.doc.Bibliography;
import markbridge.ast.doc.BlockMath;
import markbridge.ast.doc.CodeBlock;
import markbridge.ast.doc.DocNode;
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
import markbridge.ast.doc.PageSetup;
import markbridge.ast.doc.Paragraph;
import markbridge.ast.doc.Quote;
import markbridge.ast.doc.Raw;
import markbridge.ast.doc.Reference;
import markbridge.ast.doc.Strong;
import markbridge.ast.doc.TableNode;
import markbridge.ast.doc.Text;
import markbridge.ast.math.MathIdent;
import markbridge.ast.math.MathNode;
import markbridge.loss.LossKind;
import markbridge.loss.LossRecord;
import markbridge.loss.LossTracker;
import markbridge.macro.CommandCatalog;
import markbridge.parse.ParseDiagnostic;
import markbridge.parse.ParseResult;
import markbridge.transform.SymbolTable;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses a macro-free LaTeX token stream into a document tree.
 *
 * Unknown constructs never stop the parser: a command that already carries a loss
 * id becomes a {@link LossMarker} followed by its arguments' content, an unknown
 * environment records a loss when a tracker is present, and anything else is kept
 * as {@link Raw}. Structural errors (unbalanced braces, unclosed environments or
 * math) are collected as diagnostics.
 */
public final class LatexParser {
	private static final Map<String, Integer> HEADING_LEVELS = Map.ofEntries(Map.entry("part", 1),
			Map.entry("chapter", 1), Map.entry("section", 1), Map.entry("subsection", 2),
			Map.entry("subsubsection", 3), Map.entry("paragraph", 4), Map.entry("subparagraph", 5));
	private static final Set<String> CITES = Set.of("cite", "citep", "citet", "citealp", "citeauthor", "citeyear",
			"parencite", "textcite", "nocite");
	private static final Set<String> PAGE_COMMANDS = Set.of("documentclass", "usepackage", "geometry", "setmainfont");
	private static final Set<String> FONT_SIZES = Set.of("10pt", "11pt", "12pt");
	private static final Set<String> REFS = Set.of("ref", "eqref", "autoref", "cref", "Cref", "pageref");
	private static final Set<String> EMPHASIS = Set.of("emph", "textit", "textsl");
	private static final Set<String> PLAIN_WRAPPERS = Set.of("textrm", "textnormal", "mbox", "textup", "textmd",
			"textsf", "textsc");
	private static final Map<String, Character> ACCENTS = Map.ofEntries(Map.entry("'", '\u0301'),
			Map.entry("`", '\u0300'), Map.entry("\"", '\u0308'), Map.entry("^", '\u0302'), Map.entry("~", '\u0303'),
			Map.entry("=", '\u0304'), Map.entry(".", '\u0307'), Map.entry("c", '\u0327'), Map.entry("v", '\u030C'),
			Map.entry("u", '\u0306'), Map.entry("H", '\u030B'));
	private static final Map<String, String> TEXT_SYMBOLS = Map.ofEntries(Map.entry("%", "%"), Map.entry("&", "&"),
			Map.entry("$", "$"), Map.entry("#", "#"), Map.entry("_", "_"), Map.entry("{", "{"), Map.entry("}", "}"),
			Map.entry(" ", " "), Map.entry(",", " "), Map.entry("-", ""), Map.entry("@", ""),
			Map.entry("/", ""), Map.entry("ldots", "…"), Map.entry("dots", "…"), Map.entry("LaTeX", "LaTeX"),
			Map.entry("TeX", "TeX"), Map.entry("textbackslash", "\\"), Map.entry("quad", " "),
			Map.entry("qquad", "  "));

	private final SymbolTable symbols;
	private final LossTracker tracker;
	private final LatexMathParser mathParser;
	private final TableReader tableReader;
	private final List<ParseDiagnostic> errors = new ArrayList<>();
	private String bibliographyStyle;

	/**
	 * @param tracker receives losses for unknown environments; null when parsing only
	 *                to measure structure
	 */
	public LatexParser(SymbolTable symbols, LossTracker tracker) {
		this.symbols = symbols;
		this.tracker = tracker;
		this.mathParser = new LatexMathParser(symbols, tracker);
		this.tableReader = new TableReader(this::inline);
	}

	/** Lexes and parses without macro expansion. */
	public ParseResult parse(String source) {
		TexLexer lexer = new TexLexer();
		List<TexToken> tokens = lexer.lex(source);
		ParseResult result = parse(tokens);
		if (lexer.errors().isEmpty()) {
			return result;
		}
		List<ParseDiagnostic> all = new ArrayList<>(lexer.errors());
		all.addAll(result.errors());
		return new ParseResult(result.document(), all);
	}

	public ParseResult parse(List<TexToken> tokens) {
		errors.clear();
		bibliographyStyle = null;
		TexCursor c = new TexCursor(tokens);
		List<DocNode> blocks = blocks(c);
		return new ParseResult(new Document(blocks), List.copyOf(errors));
	}

	/** Parses a token list that is entirely math. */
	public MathNode parseMath(List<TexToken> tokens) {
		return mathParser.parse(tokens);
	}

	// ---- blocks ----

	/** Parses until the end of the cursor, grouping inline content into paragraphs. */
	private List<DocNode> blocks(TexCursor c) {
		List<DocNode> blocks = new ArrayList<>();
		List<DocNode> paragraph = new ArrayList<>();
		while (!c.atEnd()) {
			TexToken t = c.peek();
			if (t.type() == TexTokenType.PAR || t.isCs("par")) {
				c.next();
				flush(paragraph, blocks);
				continue;
			}
			if (t.isCs("label") && paragraphIsBlank(paragraph) && attachLabel(c, blocks)) {
				continue;
			}
			for (DocNode node : item(c)) {
				if (isBlock(node)) {
					flush(paragraph, blocks);
					blocks.add(node);
				} else {
					paragraph.add(node);
				}
			}
		}
		flush(paragraph, blocks);
		return blocks;
	}

	/** Inline content of a token list; paragraph breaks become spaces. */
	private List<DocNode> inline(List<TexToken> tokens) {
		List<DocNode> out = new ArrayList<>();
		for (DocNode block : blocks(new TexCursor(tokens))) {
			if (block instanceof Paragraph p) {
				if (!out.isEmpty()) {
					out.add(new Text(" "));
				}
				out.addAll(p.content());
			} else {
				out.add(block);
			}
		}
		return mergeText(out);
	}

	private static boolean isBlock(DocNode node) {
		return node instanceof Heading || node instanceof BlockMath || node instanceof ListBlock
				|| node instanceof Quote || node instanceof CodeBlock || node instanceof TableNode
				|| node instanceof Figure || node instanceof Graphic || node instanceof Bibliography
				|| node instanceof BibEntry || node instanceof Paragraph || node instanceof PageSetup;
	}

	private static boolean paragraphIsBlank(List<DocNode> paragraph) {
		return paragraph.stream().allMatch(n -> n instanceof Text t && t.text().isBlank());
	}

	private static void flush(List<DocNode> paragraph, List<DocNode> blocks) {
		List<DocNode> merged = trimText(mergeText(paragraph));
		paragraph.clear();
		if (!merged.isEmpty()) {
			blocks.add(new Paragraph(merged));
		}
	}

	/** Attaches a {@code \label} to the preceding heading, equation or figure. */
	private boolean attachLabel(TexCursor c, List<DocNode> blocks) {
		if (blocks.isEmpty()) {
			return false;
		}
		int save = c.position();
		DocNode last = blocks.get(blocks.size() - 1);
		c.next();
		String key = c.readText();
		if (key != null) {
			if (last instanceof Heading h && h.label() == null) {
				blocks.set(blocks.size() - 1, h.withLabel(key));
				return true;
			}
			if (last instanceof BlockMath m && m.label() == null) {
				blocks.set(blocks.size() - 1, m.withLabel(key));
				return true;
			}
			if (last instanceof Figure f && f.label() == null) {
				blocks.set(blocks.size() - 1, f.withLabel(key));
				return true;
			}
		}
		c.reset(save);
		return false;
	}

	/** Parses one construct at the cursor. */
	private List<DocNode> item(TexCursor c) {
		TexToken t = c.next();
		switch (t.type()) {
			case SPACE:
				return List.of(new Text(" "));
			case ACTIVE:
				return List.of(new Text(" "));
			case CHAR:
				return List.of(new Text(typographic(t, c)));
			case BEGIN_GROUP: {
				c.reset(c.position() - 1);
				List<TexToken> group = c.readGroup();
				if (c.unbalanced()) {
					error("unbalanced '{'", t.span());
				}
				return inline(group);
			}
			case END_GROUP:
				error("unexpected '}'", t.span());
				return List.of();
			case MATH_SHIFT:
				return List.of(dollarMath(t, c));
			case ALIGN_TAB:
				return List.of(new Text("&"));
			case SUPERSCRIPT:
			case SUBSCRIPT:
			case PARAM:
				return List.of(new Text(t.text()));
			case COMMENT:
				return List.of(marker(t.text()));
			case VERBATIM:
				return verbatim(t);
			case CONTROL_SEQ:
				return command(t, c);
			default:
				return List.of();
		}
	}

	private static String typographic(TexToken t, TexCursor c) {
		if (t.isChar('`') && c.peek() != null && c.peek().isChar('`')) {
			c.next();
			return "“";
		}
		if (t.isChar('\'') && c.peek() != null && c.peek().isChar('\'')) {
			c.next();
			return "”";
		}
		return t.text();
	}

	private DocNode dollarMath(TexToken open, TexCursor c) {
		boolean display = c.nextIs(TexTokenType.MATH_SHIFT);
		if (display) {
			c.next();
		}
		List<TexToken> body = new ArrayList<>();
		while (!c.atEnd()) {
			TexToken t = c.next();
			if (t.type() == TexTokenType.MATH_SHIFT) {
				if (display && c.nextIs(TexTokenType.MATH_SHIFT)) {
					c.next();
				}
				MathNode math = mathParser.parse(body);
				return display ? new BlockMath(math, null, false) : new InlineMath(math);
			}
			body.add(t);
		}
		error("unclosed math", open.span());
		return new InlineMath(mathParser.parse(body));
	}

	private DocNode delimitedMath(TexToken open, TexCursor c, String close, boolean display) {
		List<TexToken> body = new ArrayList<>();
		while (!c.atEnd()) {
			TexToken t = c.next();
			if (t.isCs(close)) {
				MathNode math = mathParser.parse(body);
				return display ? new BlockMath(math, null, false) : new InlineMath(math);
			}
			body.add(t);
		}
		error("unclosed math \\" + open.text(), open.span());
		return new InlineMath(mathParser.parse(body));
	}

	private List<DocNode> command(TexToken t, TexCursor c) {
		String name = t.text();
		if (t.lossId() != null) {
			return lossyCommand(t, c);
		}
		if (HEADING_LEVELS.containsKey(name.replace("*", ""))) {
			return List.of(heading(name, c));
		}
		if (name.equals("(") || name.equals("[")) {
			return List.of(delimitedMath(t, c, name.equals("(") ? ")" : "]", name.equals("[")));
		}
		if (name.equals("begin")) {
			return environment(t, c);
		}
		if (name.equals("end")) {
			String env = c.readText();
			error("unexpected \\end{" + env + "}", t.span());
			return List.of();
		}
		if (name.equals("\\") || name.equals("newline")) {
			c.readStar();
			c.readOptional();
			return List.of(new LineBreak());
		}
		if (TEXT_SYMBOLS.containsKey(name)) {
			return List.of(new Text(TEXT_SYMBOLS.get(name)));
		}
		if (ACCENTS.containsKey(name)) {
			String base = c.readText();
			if (base == null || base.isEmpty()) {
				return List.of();
			}
			String composed = Normalizer.normalize(base.charAt(0) + String.valueOf(ACCENTS.get(name)),
					Normalizer.Form.NFC);
			return List.of(new Text(composed + base.substring(1)));
		}
		if (name.equals("textbf")) {
			return List.of(new Strong(argumentContent(c)));
		}
		if (EMPHASIS.contains(name)) {
			return List.of(new Emph(argumentContent(c)));
		}
		if (name.equals("texttt")) {
			String code = c.readText();
			return List.of(new InlineCode(code == null ? "" : code));
		}
		if (PLAIN_WRAPPERS.contains(name)) {
			return argumentContent(c);
		}
		if (name.equals("href")) {
			String url = c.readText();
			return List.of(new Link(url == null ? "" : url, argumentContent(c)));
		}
		if (name.equals("url")) {
			String url = c.readText();
			url = url == null ? "" : url;
			return List.of(new Link(url, List.of(new Text(url))));
		}
		if (CITES.contains(name)) {
			c.readOptional();
			c.readOptional();
			return List.of(new Reference(Reference.Kind.CITE, keys(c.readText())));
		}
		if (REFS.contains(name)) {
			return List.of(new Reference(Reference.Kind.REF, keys(c.readText())));
		}
		if (name.equals("label")) {
			return List.of(new Reference(Reference.Kind.LABEL, keys(c.readText())));
		}
		if (name.equals("includegraphics")) {
			String options = c.readOptionalText();
			String path = c.readText();
			return List.of(new Image(path == null ? "" : path, width(options)));
		}
		if (name.equals("caption")) {
			c.readOptional();
			return argumentContent(c);
		}
		if (name.equals("bibliographystyle")) {
			bibliographyStyle = c.readText();
			return List.of();
		}
		if (name.equals("bibliography")) {
			String files = c.readText();
			String first = files == null ? "" : files.split(",")[0].trim();
			return List.of(new Bibliography(first, bibliographyStyle));
		}
		if (name.equals("item")) {
			c.readOptional();
			return List.of();
		}
		if (PAGE_COMMANDS.contains(name)) {
			PageSetup setup = pageCommand(name, c);
			return setup.isEmpty() ? List.of() : List.of(setup);
		}
		Integer ignoredArity = CommandCatalog.IGNORED.get(name);
		if (ignoredArity != null) {
			skipArguments(c, ignoredArity);
			return List.of();
		}
		if (CommandCatalog.STRUCTURAL.contains(name)) {
			// table and math commands out of place carry no text content
			return List.of();
		}
		if (symbols.hasLatex(name)) {
			return List.of(new InlineMath(new MathIdent(name)));
		}
		int start = c.position() - 1;
		skipBracedArguments(c);
		return List.of(new Raw(TexTokens.detokenize(c.slice(start, c.position())), Language.LATEX));
	}

	// ---- preamble ----

	/** Class options, geometry and main font; other packages carry nothing. */
	private PageSetup pageCommand(String name, TexCursor c) {
		String options = c.readOptionalText();
		String argument = c.readText();
		PageSetup setup = PageSetup.NONE;
		if (name.equals("documentclass")) {
			for (String option : options(options)) {
				if (PageSetup.PAPERS.containsKey(option)) {
					setup = setup.withPaper(PageSetup.PAPERS.get(option));
				} else if (FONT_SIZES.contains(option)) {
					setup = setup.withFontSize(option);
				} else if (option.equals("twocolumn")) {
					setup = setup.withColumns(2);
				} else if (!option.equals("onecolumn")) {
					warn("class option " + option + " is not carried across languages");
				}
			}
		} else if (name.equals("usepackage")) {
			if (argument != null && Arrays.stream(argument.split(",")).anyMatch(p -> p.trim().equals("geometry"))) {
				setup = geometry(options(options));
			}
		} else if (name.equals("geometry")) {
			setup = geometry(options(argument));
		} else {
			if (options != null && !options.isBlank()) {
				warn("font options [" + options + "] are not carried across languages");
			}
			if (argument != null && !argument.isBlank()) {
				setup = setup.withFont(argument);
			}
		}
		return setup;
	}

	private PageSetup geometry(List<String> options) {
		PageSetup setup = PageSetup.NONE;
		for (String option : options) {
			int eq = option.indexOf('=');
			String key = eq < 0 ? option : option.substring(0, eq).trim();
			String value = eq < 0 ? "" : option.substring(eq + 1).trim();
			if (eq < 0 && PageSetup.PAPERS.containsKey(key)) {
				setup = setup.withPaper(PageSetup.PAPERS.get(key));
			} else if (key.equals("margin") && !value.isEmpty()) {
				setup = setup.withMargin("all", value);
			} else if ((key.equals("left") || key.equals("right") || key.equals("top") || key.equals("bottom"))
					&& !value.isEmpty()) {
				setup = setup.withMargin(key, value);
			} else if (key.equals("hmargin") && !value.isEmpty()) {
				setup = setup.withMargin("left", value).withMargin("right", value);
			} else if (key.equals("vmargin") && !value.isEmpty()) {
				setup = setup.withMargin("top", value).withMargin("bottom", value);
			} else {
				warn("geometry option " + option + " is not carried across languages");
			}
		}
		return setup;
	}

	private static List<String> options(String text) {
		if (text == null || text.isBlank()) {
			return List.of();
		}
		return Arrays.stream(text.split(",")).map(String::trim).filter(o -> !o.isEmpty()).toList();
	}

	private void warn(String message) {
		if (tracker != null) {
			tracker.warn(message);
		}
	}

	/** Marker for a command already reported as lost, followed by its arguments' content. */
	private List<DocNode> lossyCommand(TexToken t, TexCursor c) {
		int start = c.position() - 1;
		List<DocNode> out = new ArrayList<>();
		out.add(null);
		c.readOptional();
		while (!c.atEnd() && c.peek().type() == TexTokenType.BEGIN_GROUP) {
			if (out.size() > 1) {
				out.add(new Text(" "));
			}
			out.addAll(inline(c.readGroup()));
		}
		out.set(0, new LossMarker(t.lossId(), TexTokens.detokenize(c.slice(start, c.position()))));
		return out;
	}

	private List<DocNode> argumentContent(TexCursor c) {
		List<TexToken> arg = c.readArgument();
		return arg == null ? List.of() : inline(arg);
	}

	private static void skipArguments(TexCursor c, int arity) {
		c.readOptional();
		for (int i = 0; i < arity; i++) {
			c.readArgument();
			c.readOptional();
		}
	}

	private static void skipBracedArguments(TexCursor c) {
		while (!c.atEnd() && c.peek().type() == TexTokenType.BEGIN_GROUP) {
			c.readGroup();
		}
	}

	private Heading heading(String name, TexCursor c) {
		boolean starred = name.endsWith("*") || c.readStar();
		int level = HEADING_LEVELS.get(name.replace("*", ""));
		c.readOptional();
		return new Heading(level, trimText(argumentContent(c)), null, !starred);
	}

	private static List<String> keys(String text) {
		if (text == null) {
			return List.of();
		}
		return Arrays.stream(text.split(",")).map(String::trim).filter(k -> !k.isEmpty()).toList();
	}

	/** Typst-style width ("80%", "3cm") for an {@code \includegraphics} option list. */
	static String width(String options) {
		if (options == null) {
			return null;
		}
		for (String option : options.split(",")) {
			String[] kv = option.split("=", 2);
			if (kv.length == 2 && kv[0].trim().equals("width")) {
				String value = kv[1].trim();
				for (String unit : new String[] { "\\textwidth", "\\linewidth", "\\columnwidth" }) {
					if (value.endsWith(unit)) {
						String factor = value.substring(0, value.length() - unit.length()).trim();
						try {
							double f = factor.isEmpty() ? 1.0 : Double.parseDouble(factor);
							return Math.round(f * 100) + "%";
						} catch (NumberFormatException e) {
							return value;
						}
					}
				}
				return value;
			}
		}
		return null;
	}

	private List<DocNode> verbatim(TexToken t) {
		String header = t.environment();
		String env = TexTokens.environmentName(header);
		if (env.equals("comment")) {
			return List.of();
		}
		if (env.equals("tikzpicture")) {
			return List.of(new Graphic(t.text(), Language.LATEX, null));
		}
		return List.of(new CodeBlock(codeLanguage(header), stripTrailingNewline(t.text())));
	}

	private static String codeLanguage(String header) {
		int lang = header.indexOf("language=");
		if (lang >= 0) {
			int end = lang + "language=".length();
			while (end < header.length() && Character.isLetterOrDigit(header.charAt(end))) {
				end++;
			}
			return header.substring(lang + "language=".length(), end).toLowerCase();
		}
		int brace = header.indexOf('{');
		if (brace >= 0 && header.endsWith("}")) {
			return header.substring(brace + 1, header.length() - 1).trim().toLowerCase();
		}
		return null;
	}

	private static String stripTrailingNewline(String code) {
		return code.endsWith("\n") ? code.substring(0, code.length() - 1) : code;
	}

	private static LossMarker marker(String comment) {
		String rest = comment.substring(LossMarker.PREFIX.length()).trim();
		int space = rest.indexOf(' ');
		return space < 0 ? new LossMarker(rest, "") : new LossMarker(rest.substring(0, space), rest.substring(space + 1).trim());
	}

	// ---- environments ----

	private List<DocNode> environment(TexToken begin, TexCursor c) {
		String env = c.readText();
		if (env == null) {
			error("\\begin without an environment name", begin.span());
			return List.of();
		}
		List<TexToken> body = environmentBody(env, begin, c);
		TexCursor inner = new TexCursor(body);
		if (LatexEnvironments.TRANSPARENT.contains(env)) {
			return blocks(inner);
		}
		if (LatexEnvironments.LISTS.contains(env)) {
			return List.of(list(env, body));
		}
		if (env.equals("quote") || env.equals("quotation") || env.equals("verse")) {
			return List.of(new Quote(blocks(inner)));
		}
		if (LatexEnvironments.DISPLAY_MATH.contains(env)) {
			return List.of(displayMath(env, body));
		}
		if (LatexEnvironments.FLOATS.contains(env)) {
			inner.readOptional();
			return List.of(figure(env, inner.rest()));
		}
		if (LatexEnvironments.TABULARS.contains(env)) {
			return List.of(table(env, inner));
		}
		if (env.equals("thebibliography")) {
			inner.readArgument();
			return bibliography(inner.rest());
		}
		if (LatexEnvironments.THEOREMS.contains(env)) {
			String note = inner.readOptionalText();
			String title = Character.toUpperCase(env.charAt(0)) + env.substring(1)
					+ (note == null ? "" : " (" + note + ")") + ".";
			List<DocNode> out = new ArrayList<>();
			List<DocNode> content = blocks(inner);
			List<DocNode> first = new ArrayList<>();
			first.add(new Strong(List.of(new Text(title))));
			if (!content.isEmpty() && content.get(0) instanceof Paragraph p) {
				first.add(new Text(" "));
				first.addAll(p.content());
				content = content.subList(1, content.size());
			}
			out.add(new Paragraph(first));
			out.addAll(content);
			return out;
		}
		List<DocNode> out = new ArrayList<>();
		if (tracker != null) {
			LossRecord loss = tracker.record(LossKind.UNKNOWN_ENVIRONMENT, env, "unknown environment " + env,
					"\\begin{" + env + "}", "text");
			out.add(new LossMarker(loss.id(), "\\begin{" + env + "}"));
		}
		out.addAll(blocks(inner));
		return out;
	}

	/** Tokens up to the matching {@code \end{env}}. */
	private List<TexToken> environmentBody(String env, TexToken begin, TexCursor c) {
		List<TexToken> body = new ArrayList<>();
		int nesting = 0;
		while (!c.atEnd()) {
			int position = c.position();
			TexToken t = c.next();
			if (t.isCs("begin") || t.isCs("end")) {
				String name = c.readText();
				if (env.equals(name)) {
					if (t.isCs("begin")) {
						nesting++;
					} else if (nesting-- == 0) {
						return body;
					}
				}
				body.addAll(c.slice(position, c.position()));
				continue;
			}
			body.add(t);
		}
		error("unclosed environment '" + env + "'", begin.span());
		return body;
	}

	private ListBlock list(String env, List<TexToken> body) {
		List<List<TexToken>> itemTokens = new ArrayList<>();
		List<String> labels = new ArrayList<>();
		List<TexToken> current = null;
		int nesting = 0;
		TexCursor c = new TexCursor(body);
		while (!c.atEnd()) {
			TexToken t = c.next();
			if (t.isCs("begin")) {
				nesting++;
			} else if (t.isCs("end")) {
				nesting--;
			} else if (t.type() == TexTokenType.BEGIN_GROUP) {
				int start = c.position() - 1;
				c.reset(start);
				c.readGroup();
				if (current != null) {
					current.addAll(c.slice(start, c.position()));
				}
				continue;
			}
			if (nesting == 0 && t.isCs("item")) {
				labels.add(c.readOptionalText());
				current = new ArrayList<>();
				itemTokens.add(current);
				continue;
			}
			if (current != null) {
				current.add(t);
			}
		}
		List<ListItem> items = new ArrayList<>();
		for (int i = 0; i < itemTokens.size(); i++) {
			List<DocNode> content = blocks(new TexCursor(itemTokens.get(i)));
			if (content.size() == 1 && content.get(0) instanceof Paragraph p) {
				content = p.content();
			}
			String label = labels.get(i);
			if (label != null) {
				List<DocNode> labelled = new ArrayList<>();
				labelled.add(new Strong(List.of(new Text(label))));
				labelled.add(new Text(" "));
				labelled.addAll(content);
				content = labelled;
			}
			items.add(new ListItem(content));
		}
		return new ListBlock(env.equals("enumerate"), items);
	}

	private BlockMath displayMath(String env, List<TexToken> body) {
		String label = null;
		List<TexToken> math = new ArrayList<>();
		TexCursor c = new TexCursor(body);
		while (!c.atEnd()) {
			TexToken t = c.next();
			if (t.isCs("label")) {
				String key = c.readText();
				if (label == null) {
					label = key;
				}
				continue;
			}
			math.add(t);
		}
		return new BlockMath(mathParser.parse(math), label, LatexEnvironments.isNumbered(env));
	}

	private Figure figure(String env, List<TexToken> body) {
		List<DocNode> caption = List.of();
		String label = null;
		List<TexToken> rest = new ArrayList<>();
		int nesting = 0;
		TexCursor c = new TexCursor(body);
		while (!c.atEnd()) {
			TexToken t = c.next();
			if (t.isCs("begin")) {
				nesting++;
			} else if (t.isCs("end")) {
				nesting--;
			} else if (nesting == 0 && t.isCs("caption")) {
				c.readOptional();
				caption = argumentContent(c);
				continue;
			} else if (nesting == 0 && t.isCs("label")) {
				String key = c.readText();
				label = label == null ? key : label;
				continue;
			}
			rest.add(t);
		}
		List<DocNode> captionContent = new ArrayList<>();
		for (DocNode node : caption) {
			if (node instanceof Reference r && r.kind() == Reference.Kind.LABEL && label == null) {
				label = r.key();
			} else {
				captionContent.add(node);
			}
		}
		List<DocNode> content = new ArrayList<>();
		for (DocNode block : blocks(new TexCursor(rest))) {
			if (block instanceof Paragraph p && p.content().stream().allMatch(n -> n instanceof Image
					|| n instanceof Text text && text.text().isBlank())) {
				p.content().stream().filter(n -> n instanceof Image).forEach(content::add);
			} else {
				content.add(block);
			}
		}
		return new Figure(content, trimText(captionContent), label, env.startsWith("table"));
	}

	private DocNode table(String env, TexCursor c) {
		if (env.equals("tabular*") || env.equals("tabularx")) {
			c.readArgument();
		}
		c.readOptional();
		String spec = c.readText();
		return new TableNode(tableReader.read(spec == null ? "" : spec, c.rest()));
	}

	private List<DocNode> bibliography(List<TexToken> body) {
		List<DocNode> entries = new ArrayList<>();
		TexCursor c = new TexCursor(body);
		String key = null;
		List<TexToken> content = new ArrayList<>();
		while (!c.atEnd()) {
			TexToken t = c.next();
			if (t.isCs("bibitem")) {
				if (key != null) {
					entries.add(new BibEntry(key, trimText(inline(content))));
				}
				c.readOptional();
				key = c.readText();
				content = new ArrayList<>();
				continue;
			}
			content.add(t);
		}
		if (key != null) {
			entries.add(new BibEntry(key, trimText(inline(content))));
		}
		return entries;
	}

	// ---- text helpers ----

	static List<DocNode> mergeText(List<DocNode> nodes) {
		List<DocNode> out = new ArrayList<>();
		for (DocNode node : nodes) {
			if (node instanceof Text t && !out.isEmpty() && out.get(out.size() - 1) instanceof Text prev) {
				String joined = prev.text() + t.text();
				if (t.text().equals(" ") && prev.text().endsWith(" ")) {
					joined = prev.text();
				}
				out.set(out.size() - 1, new Text(joined));
			} else if (!(node instanceof Text t2 && t2.text().isEmpty())) {
				out.add(node);
			}
		}
		return out;
	}

	static List<DocNode> trimText(List<DocNode> nodes) {
		List<DocNode> out = new ArrayList<>(nodes);
		while (!out.isEmpty() && out.get(0) instanceof Text t && t.text().isBlank()) {
			out.remove(0);
		}
		if (!out.isEmpty() && out.get(0) instanceof Text t) {
			out.set(0, new Text(t.text().stripLeading()));
		}
		while (!out.isEmpty() && out.get(out.size() - 1) instanceof Text t && t.text().isBlank()) {
			out.remove(out.size() - 1);
		}
		if (!out.isEmpty() && out.get(out.size() - 1) instanceof Text t) {
			out.set(out.size() - 1, new Text(t.text().stripTrailing()));
		}
		return out;
	}

	private void error(String message, SourceSpan span) {
		errors.add(new ParseDiagnostic(message, span));
	}
}
