package markbridge.parse.typst;

import markbridge.ast.SourceSpan;
import markbridge.ast.doc.BlockMath;
import markbridge.ast.doc.CodeBlock;
import markbridge.ast.doc.CodeBlockNode;
import markbridge.ast.doc.Conditional;
import markbridge.ast.doc.Directive;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.Document;
import markbridge.ast.doc.Embed;
import markbridge.ast.doc.Emph;
import markbridge.ast.doc.Figure;
import markbridge.ast.doc.ForLoop;
import markbridge.ast.doc.Heading;
import markbridge.ast.doc.InlineCode;
import markbridge.ast.doc.InlineMath;
import markbridge.ast.doc.LetBinding;
import markbridge.ast.doc.LineBreak;
import markbridge.ast.doc.Link;
import markbridge.ast.doc.ListBlock;
import markbridge.ast.doc.ListItem;
import markbridge.ast.doc.LossMarker;
import markbridge.ast.doc.Paragraph;
import markbridge.ast.doc.Quote;
import markbridge.ast.doc.Reference;
import markbridge.ast.doc.Strong;
import markbridge.ast.doc.TableNode;
import markbridge.ast.doc.Text;
import markbridge.ast.math.MathNode;
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
import markbridge.ast.script.UnknownExpr;
import markbridge.parse.ParseDiagnostic;
import markbridge.parse.ParseResult;
import markbridge.transform.SymbolTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for the Typst subset: markup, embedded code expressions and math.
 *
 * Script constructs are kept as script nodes for the evaluator; the parser
 * never resolves them. A paragraph made only of script nodes is lifted to block
 * level so that loops and conditionals can expand to block content.
 */
public final class TypstParser {
	private static final String SPECIAL = "\\*_`$#<@/~\n[]";

	private final SymbolTable symbols;
	private TypstCursor c;
	private TypstMathParser math;
	private final List<ParseDiagnostic> errors = new ArrayList<>();
	/** Bracket nesting in code mode; newlines end expressions only at zero. */
	private int nesting;
	private int offset;

	public TypstParser(SymbolTable symbols) {
		this.symbols = symbols;
	}

	public ParseResult parse(String source) {
		reset(source, 0);
		List<DocNode> blocks = markup(false);
		return new ParseResult(new Document(blocks), List.copyOf(errors));
	}

	/** Parses text that is math content without the surrounding dollars. */
	public MathNode parseMath(String source) {
		reset(source, 0);
		return math.content();
	}

	public List<ParseDiagnostic> errors() {
		return List.copyOf(errors);
	}

	private void reset(String source, int baseOffset) {
		c = new TypstCursor(source);
		math = new TypstMathParser(c, symbols, this::embedExpression, errors);
		errors.clear();
		nesting = 0;
		offset = baseOffset;
	}

	private void error(String message, int start) {
		errors.add(new ParseDiagnostic(message, new SourceSpan(offset + start, offset + Math.max(start + 1, c.pos))));
	}

	// ---------------------------------------------------------------- markup

	private List<DocNode> markup(boolean inBracket) {
		List<DocNode> blocks = new ArrayList<>();
		List<DocNode> para = new ArrayList<>();
		boolean lineStart = true;
		int depth = 0;
		while (!c.atEnd()) {
			if (lineStart) {
				int lineBegin = c.pos;
				c.skipInlineSpace();
				int indent = c.pos - lineBegin;
				if (c.atEnd()) {
					break;
				}
				if (c.peek() == '\n') {
					c.pos++;
					flush(para, blocks);
					continue;
				}
				DocNode block = lineBlock(indent, inBracket);
				if (block != null) {
					flush(para, blocks);
					blocks.add(block);
					continue;
				}
				lineStart = false;
			}
			char ch = c.peek();
			if (ch == '\n') {
				c.pos++;
				lineStart = true;
				para.add(new Text(" "));
				continue;
			}
			if (ch == '[') {
				c.pos++;
				depth++;
				para.add(new Text("["));
				continue;
			}
			if (ch == ']') {
				if (depth > 0) {
					c.pos++;
					depth--;
					para.add(new Text("]"));
					continue;
				}
				if (inBracket) {
					break;
				}
				error("unexpected closing bracket", c.pos);
				c.pos++;
				continue;
			}
			element(para);
		}
		flush(para, blocks);
		return blocks;
	}

	/** Heading, list item, term or raw block at the start of a line, or null. */
	private DocNode lineBlock(int indent, boolean inBracket) {
		if (c.peek() == '=') {
			int level = 0;
			while (c.peek(level) == '=') {
				level++;
			}
			char after = c.peek(level);
			if (after == ' ' || after == '\t') {
				c.pos += level + 1;
				return heading(level);
			}
		}
		if ((c.peek() == '-' || c.peek() == '+') && (c.peek(1) == ' ' || c.peek(1) == '\t')
				&& !c.startsWith("- -")) {
			return list(c.peek(), indent, inBracket);
		}
		if (c.peek() == '/' && c.peek(1) == ' ') {
			return list('/', indent, inBracket);
		}
		return null;
	}

	private DocNode heading(int level) {
		c.skipInlineSpace();
		List<DocNode> content = new ArrayList<>();
		while (!c.atEnd() && c.peek() != '\n' && c.peek() != ']') {
			element(content);
		}
		String label = null;
		List<DocNode> trimmed = trim(content);
		if (!trimmed.isEmpty() && trimmed.get(trimmed.size() - 1) instanceof Reference r
				&& r.kind() == Reference.Kind.LABEL) {
			label = r.key();
			trimmed = trim(trimmed.subList(0, trimmed.size() - 1));
		}
		c.eat('\n');
		return new Heading(level, trimmed, label, false);
	}

	private DocNode list(char marker, int indent, boolean inBracket) {
		List<ListItem> items = new ArrayList<>();
		while (true) {
			items.add(listItem(marker, indent, inBracket));
			int save = c.pos;
			// blank lines between items keep the list open
			while (!c.atEnd()) {
				int lineBegin = c.pos;
				c.skipInlineSpace();
				if (c.peek() == '\n') {
					c.pos++;
					continue;
				}
				c.pos = lineBegin;
				break;
			}
			int lineBegin = c.pos;
			c.skipInlineSpace();
			int nextIndent = c.pos - lineBegin;
			if (nextIndent == indent && c.peek() == marker && (c.peek(1) == ' ' || c.peek(1) == '\t')) {
				continue;
			}
			c.pos = save;
			break;
		}
		return new ListBlock(marker == '+', items);
	}

	private ListItem listItem(char marker, int indent, boolean inBracket) {
		int start = c.pos;
		c.pos += 2;
		StringBuilder text = new StringBuilder();
		int end = lineEnd(inBracket);
		text.append(c.src, c.pos, end);
		c.pos = end;
		while (c.peek() == '\n') {
			int next = c.pos + 1;
			int probe = next;
			// continuation lines are indented deeper than the marker, blank lines may separate them
			while (probe < c.src.length() && c.src.charAt(probe) == '\n') {
				probe++;
			}
			int lineIndent = 0;
			while (probe + lineIndent < c.src.length()
					&& (c.src.charAt(probe + lineIndent) == ' ' || c.src.charAt(probe + lineIndent) == '\t')) {
				lineIndent++;
			}
			if (lineIndent <= indent || probe + lineIndent >= c.src.length()
					|| c.src.charAt(probe + lineIndent) == '\n') {
				break;
			}
			text.append("\n".repeat(probe - next + 1));
			int strip = Math.min(lineIndent, indent + 2);
			c.pos = probe + strip;
			end = lineEnd(inBracket);
			text.append(c.src, c.pos, end);
			c.pos = end;
		}
		if (c.peek() == '\n') {
			c.pos++;
		}
		List<DocNode> blocks = fragment(text.toString(), start + 2);
		if (marker == '/') {
			blocks = termItem(blocks);
		}
		if (blocks.size() == 1 && blocks.get(0) instanceof Paragraph p) {
			return new ListItem(p.content());
		}
		return new ListItem(blocks);
	}

	/** {@code / Term: description} becomes a strong term followed by its description. */
	private static List<DocNode> termItem(List<DocNode> blocks) {
		if (blocks.isEmpty() || !(blocks.get(0) instanceof Paragraph p)) {
			return blocks;
		}
		List<DocNode> term = new ArrayList<>();
		List<DocNode> rest = new ArrayList<>();
		boolean split = false;
		for (DocNode node : p.content()) {
			if (!split && node instanceof Text t && t.text().contains(":")) {
				int colon = t.text().indexOf(':');
				term.add(new Text(t.text().substring(0, colon)));
				String tail = t.text().substring(colon + 1).stripLeading();
				if (!tail.isEmpty()) {
					rest.add(new Text(tail));
				}
				split = true;
			} else if (split) {
				rest.add(node);
			} else {
				term.add(node);
			}
		}
		List<DocNode> content = new ArrayList<>();
		content.add(new Strong(trim(term)));
		if (!rest.isEmpty()) {
			content.add(new Text(" "));
			content.addAll(rest);
		}
		List<DocNode> out = new ArrayList<>();
		out.add(new Paragraph(content));
		out.addAll(blocks.subList(1, blocks.size()));
		return out;
	}

	/** End of the current line, stopping early at an unmatched closing bracket. */
	private int lineEnd(boolean inBracket) {
		int depth = 0;
		int i = c.pos;
		while (i < c.src.length()) {
			char ch = c.src.charAt(i);
			if (ch == '\n') {
				return i;
			}
			if (ch == '\\') {
				i += 2;
				continue;
			}
			if (ch == '[') {
				depth++;
			} else if (ch == ']') {
				if (depth == 0 && inBracket) {
					return i;
				}
				depth--;
			} else if (ch == '`') {
				int close = c.src.indexOf('`', i + 1);
				if (close > 0 && c.src.indexOf('\n', i) > close || close > 0 && c.src.indexOf('\n', i) < 0) {
					i = close;
				}
			}
			i++;
		}
		return c.src.length();
	}

	private List<DocNode> fragment(String text, int baseOffset) {
		TypstParser sub = new TypstParser(symbols);
		sub.reset(text, offset + baseOffset);
		List<DocNode> blocks = sub.markup(false);
		errors.addAll(sub.errors);
		return blocks;
	}

	/**
	 * Moves a paragraph's nodes into {@code blocks}: block-level nodes stand on
	 * their own, runs made only of script nodes are lifted, the rest are
	 * paragraphs.
	 */
	private static void flush(List<DocNode> para, List<DocNode> blocks) {
		List<DocNode> run = new ArrayList<>();
		for (DocNode node : para) {
			if (isBlock(node)) {
				emitRun(run, blocks);
				run.clear();
				blocks.add(node);
			} else {
				run.add(node);
			}
		}
		emitRun(run, blocks);
		para.clear();
	}

	private static void emitRun(List<DocNode> run, List<DocNode> blocks) {
		List<DocNode> trimmed = trim(run);
		if (trimmed.isEmpty()) {
			return;
		}
		// embeds produce inline text, so the spaces between them are kept
		boolean scriptOnly = true;
		for (DocNode node : trimmed) {
			if (node instanceof Embed || !isScript(node) && !(node instanceof Text t && t.text().isBlank())) {
				scriptOnly = false;
				break;
			}
		}
		if (scriptOnly) {
			for (DocNode node : trimmed) {
				if (isScript(node)) {
					blocks.add(node);
				}
			}
			return;
		}
		blocks.add(new Paragraph(mergeText(trimmed)));
	}

	private static boolean isBlock(DocNode node) {
		return node instanceof CodeBlock || node instanceof BlockMath || node instanceof ListBlock
				|| node instanceof Heading || node instanceof TableNode || node instanceof Figure
				|| node instanceof Quote;
	}

	private static boolean isScript(DocNode node) {
		return node instanceof LetBinding || node instanceof Directive || node instanceof ForLoop
				|| node instanceof Conditional || node instanceof CodeBlockNode || node instanceof Embed;
	}

	private static List<DocNode> trim(List<DocNode> nodes) {
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
				String joined = prev.text() + t.text();
				out.set(out.size() - 1, new Text(joined.replaceAll(" {2,}", " ")));
			} else {
				out.add(node);
			}
		}
		return out;
	}

	/** Parses one inline element into {@code out}. */
	private void element(List<DocNode> out) {
		int start = c.pos;
		char ch = c.peek();
		switch (ch) {
			case '\\' -> escape(out);
			case '*' -> {
				c.pos++;
				out.add(new Strong(delimited('*', start)));
			}
			case '_' -> {
				c.pos++;
				out.add(new Emph(delimited('_', start)));
			}
			case '`' -> out.add(raw());
			case '$' -> equation(out);
			case '#' -> hash(out);
			case '<' -> out.add(label());
			case '@' -> out.add(reference());
			case '~' -> {
				c.pos++;
				out.add(new Text("\u00A0"));
			}
			case '/' -> {
				if (c.startsWith("//")) {
					while (!c.atEnd() && c.peek() != '\n') {
						c.pos++;
					}
				} else if (c.startsWith("/*")) {
					blockComment(out);
				} else {
					c.pos++;
					out.add(new Text("/"));
				}
			}
			default -> text(out);
		}
	}

	private void text(List<DocNode> out) {
		int start = c.pos;
		if (c.startsWith("https://") || c.startsWith("http://")) {
			while (!c.atEnd() && !Character.isWhitespace(c.peek()) && c.peek() != ']' && c.peek() != ')') {
				c.pos++;
			}
			while (c.pos > start && ".,;:".indexOf(c.src.charAt(c.pos - 1)) >= 0) {
				c.pos--;
			}
			String url = c.src.substring(start, c.pos);
			out.add(new Link(url, List.of(new Text(url))));
			return;
		}
		c.pos++;
		while (!c.atEnd() && SPECIAL.indexOf(c.peek()) < 0 && !c.startsWith("http://") && !c.startsWith("https://")) {
			c.pos++;
		}
		out.add(new Text(c.src.substring(start, c.pos)));
	}

	private void escape(List<DocNode> out) {
		c.pos++;
		if (c.atEnd() || Character.isWhitespace(c.peek())) {
			if (c.peek() == ' ' || c.peek() == '\t') {
				c.pos++;
			}
			out.add(new LineBreak());
			return;
		}
		if (c.peek() == 'u' && c.peek(1) == '{') {
			int close = c.src.indexOf('}', c.pos);
			if (close > 0) {
				try {
					int code = Integer.parseInt(c.src.substring(c.pos + 2, close), 16);
					c.pos = close + 1;
					out.add(new Text(new String(Character.toChars(code))));
					return;
				} catch (IllegalArgumentException e) {
					error("invalid unicode escape", c.pos - 1);
				}
			}
		}
		out.add(new Text(String.valueOf(c.next())));
	}

	/** Content up to the closing {@code delimiter}; the opener is already consumed. */
	private List<DocNode> delimited(char delimiter, int start) {
		List<DocNode> content = new ArrayList<>();
		while (true) {
			if (c.atEnd() || c.peek() == ']') {
				error("unclosed delimiter " + delimiter, start);
				break;
			}
			char ch = c.peek();
			if (ch == delimiter) {
				c.pos++;
				break;
			}
			if (ch == '\n') {
				int probe = c.pos + 1;
				while (probe < c.src.length() && (c.src.charAt(probe) == ' ' || c.src.charAt(probe) == '\t')) {
					probe++;
				}
				if (probe >= c.src.length() || c.src.charAt(probe) == '\n') {
					error("unclosed delimiter " + delimiter, start);
					break;
				}
				c.pos++;
				content.add(new Text(" "));
				continue;
			}
			if (ch == '[') {
				c.pos++;
				content.add(new Text("["));
				continue;
			}
			element(content);
		}
		return mergeText(content);
	}

	private DocNode raw() {
		int start = c.pos;
		int ticks = 0;
		while (c.peek() == '`') {
			ticks++;
			c.pos++;
		}
		if (ticks == 2) {
			return new InlineCode("");
		}
		if (ticks < 3) {
			int close = c.src.indexOf('`', c.pos);
			if (close < 0) {
				c.pos = c.src.length();
				error("unclosed raw text", start);
				return new InlineCode(c.src.substring(start + 1));
			}
			String code = c.src.substring(c.pos, close);
			c.pos = close + 1;
			return new InlineCode(code);
		}
		String fence = "`".repeat(ticks);
		int lineEnd = c.pos;
		while (lineEnd < c.src.length() && Character.isLetterOrDigit(c.src.charAt(lineEnd))) {
			lineEnd++;
		}
		String language = c.src.substring(c.pos, lineEnd);
		c.pos = lineEnd;
		int close = c.src.indexOf(fence, c.pos);
		if (close < 0) {
			error("unclosed raw block", start);
			close = c.src.length();
		}
		String body = c.src.substring(c.pos, close);
		c.pos = Math.min(c.src.length(), close + ticks);
		if (body.indexOf('\n') < 0) {
			return new InlineCode(body.strip());
		}
		if (body.startsWith("\n")) {
			body = body.substring(1);
		} else if (body.startsWith(" ")) {
			body = body.substring(1);
		}
		return new CodeBlock(language, body.stripTrailing());
	}

	private void equation(List<DocNode> out) {
		TypstMathParser.Result result = math.equation();
		if (!result.block()) {
			out.add(new InlineMath(result.math()));
			return;
		}
		int save = c.pos;
		c.skipInlineSpace();
		String label = labelName();
		if (label == null) {
			c.pos = save;
		}
		out.add(new BlockMath(result.math(), label, label != null));
	}

	private String labelName() {
		if (c.peek() != '<') {
			return null;
		}
		int i = c.pos + 1;
		while (i < c.src.length() && isLabelChar(c.src.charAt(i))) {
			i++;
		}
		if (i == c.pos + 1 || i >= c.src.length() || c.src.charAt(i) != '>') {
			return null;
		}
		String name = c.src.substring(c.pos + 1, i);
		c.pos = i + 1;
		return name;
	}

	private static boolean isLabelChar(char ch) {
		return Character.isLetterOrDigit(ch) || ch == '_' || ch == '-' || ch == ':' || ch == '.';
	}

	private DocNode label() {
		String name = labelName();
		if (name == null) {
			c.pos++;
			return new Text("<");
		}
		return new Reference(Reference.Kind.LABEL, List.of(name));
	}

	private DocNode reference() {
		int start = ++c.pos;
		while (!c.atEnd() && isLabelChar(c.peek())) {
			c.pos++;
		}
		// trailing punctuation belongs to the sentence
		while (c.pos > start && (c.src.charAt(c.pos - 1) == '.' || c.src.charAt(c.pos - 1) == ':')) {
			c.pos--;
		}
		if (c.pos == start) {
			return new Text("@");
		}
		return new Reference(Reference.Kind.REF, List.of(c.src.substring(start, c.pos)));
	}

	private void blockComment(List<DocNode> out) {
		int start = c.pos;
		int end = c.src.indexOf("*/", c.pos + 2);
		if (end < 0) {
			c.pos = c.src.length();
			error("unclosed block comment", start);
			return;
		}
		String text = c.src.substring(c.pos + 2, end).trim();
		c.pos = end + 2;
		if (text.startsWith(LossMarker.PREFIX)) {
			String rest = text.substring(LossMarker.PREFIX.length()).trim();
			int space = rest.indexOf(' ');
			String id = space < 0 ? rest : rest.substring(0, space);
			String snippet = space < 0 ? "" : rest.substring(space + 1).trim();
			out.add(new LossMarker(id, snippet));
		}
	}

	// ---------------------------------------------------------------- hash constructs

	private void hash(List<DocNode> out) {
		int start = c.pos;
		c.pos++;
		int savedNesting = nesting;
		nesting = 0;
		try {
			DocNode node = hashConstruct(start);
			if (node != null) {
				out.add(node);
			}
			c.eat(';');
		} finally {
			nesting = savedNesting;
		}
	}

	private DocNode hashConstruct(int start) {
		char ch = c.peek();
		if (c.eatKeyword("let")) {
			return letBinding(start);
		}
		if (c.eatKeyword("set")) {
			c.skipInlineSpace();
			String target = dottedName();
			List<CallArg> args = c.peek() == '(' ? args() : List.of();
			int save = c.pos;
			c.skipInlineSpace();
			if (c.eatKeyword("if")) {
				expression();
			} else {
				c.pos = save;
			}
			return new Directive("set", target == null ? "" : target, args, source(start));
		}
		if (c.eatKeyword("show")) {
			int selectorStart = c.pos;
			scanStatement();
			String text = c.src.substring(selectorStart, c.pos);
			int colon = text.indexOf(':');
			String selector = (colon < 0 ? text : text.substring(0, colon)).trim();
			return new Directive("show", selector, List.of(), source(start));
		}
		if (c.eatKeyword("import") || c.eatKeyword("include")) {
			String keyword = c.src.startsWith("import", start + 1) ? "import" : "include";
			int targetStart = c.pos;
			scanStatement();
			String target = c.src.substring(targetStart, c.pos).trim();
			int colon = target.indexOf(':');
			return new Directive(keyword, colon < 0 ? target : target.substring(0, colon).trim(), List.of(),
					source(start));
		}
		if (c.eatKeyword("for")) {
			return forLoop(start);
		}
		if (c.eatKeyword("if")) {
			Expr condition = expression();
			Expr then = block();
			Expr otherwise = elseBranch();
			return new Conditional(condition, then, otherwise, source(start));
		}
		if (c.eatKeyword("while") || c.eatKeyword("context") || c.eatKeyword("return") || c.eatKeyword("break")
				|| c.eatKeyword("continue")) {
			scanStatement();
			return new Embed(new UnknownExpr(source(start)), source(start));
		}
		if (ch == '{') {
			int end = c.matching('{', '}');
			if (end < 0) {
				c.pos = c.src.length();
				error("unclosed code block", start);
				return new CodeBlockNode(source(start));
			}
			c.pos = end;
			return new CodeBlockNode(source(start));
		}
		if (TypstCursor.isIdentStart(ch) || ch == '(' || ch == '[' || ch == '"' || Character.isDigit(ch)) {
			Expr expr = embedExpression();
			return new Embed(expr, source(start));
		}
		return new Text("#");
	}

	private String source(int start) {
		return c.src.substring(start, c.pos);
	}

	private DocNode letBinding(int start) {
		c.skipInlineSpace();
		if (c.peek() == '(' || c.peek() == '_') {
			scanStatement();
			return new Embed(new UnknownExpr(source(start)), source(start));
		}
		String name = c.identifier();
		if (name == null) {
			error("expected identifier after let", start);
			scanStatement();
			return new Embed(new UnknownExpr(source(start)), source(start));
		}
		List<String> params = null;
		if (c.peek() == '(') {
			int paramsStart = c.pos;
			params = new ArrayList<>();
			c.pos++;
			nesting++;
			boolean simple = true;
			while (true) {
				c.skipTrivia();
				if (c.atEnd() || c.eat(')')) {
					break;
				}
				String param = c.identifier();
				if (param == null) {
					simple = false;
					c.pos = paramsStart;
					int end = c.matching('(', ')');
					c.pos = end < 0 ? c.src.length() : end;
					break;
				}
				params.add(param);
				c.skipTrivia();
				if (c.peek() == ':') {
					simple = false;
					c.pos = paramsStart;
					int end = c.matching('(', ')');
					c.pos = end < 0 ? c.src.length() : end;
					break;
				}
				c.eat(',');
			}
			nesting--;
			if (!simple) {
				scanStatement();
				return new Embed(new UnknownExpr(source(start)), source(start));
			}
		}
		int save = c.pos;
		c.skipInlineSpace();
		Expr value;
		if (c.peek() == '=' && c.peek(1) != '=' && c.peek(1) != '>') {
			c.pos++;
			value = expression();
		} else {
			c.pos = save;
			value = new NoneLit();
		}
		return new LetBinding(name, params, value, source(start));
	}

	private DocNode forLoop(int start) {
		c.skipInlineSpace();
		String variable = c.identifier();
		if (variable == null) {
			scanStatement();
			return new Embed(new UnknownExpr(source(start)), source(start));
		}
		c.skipInlineSpace();
		if (!c.eatKeyword("in")) {
			error("expected 'in' in for loop", start);
			scanStatement();
			return new Embed(new UnknownExpr(source(start)), source(start));
		}
		Expr iterable = expression();
		Expr body = block();
		return new ForLoop(variable, iterable, body, source(start));
	}

	/** Content or code block of a loop or conditional. */
	private Expr block() {
		c.skipInlineSpace();
		if (c.peek() == '[') {
			return contentBlock();
		}
		if (c.peek() == '{') {
			return codeBlock();
		}
		int start = c.pos;
		error("expected block", start);
		return new UnknownExpr("");
	}

	private Expr elseBranch() {
		int save = c.pos;
		c.skipInlineSpace();
		if (!c.eatKeyword("else")) {
			c.pos = save;
			return null;
		}
		c.skipInlineSpace();
		if (c.eatKeyword("if")) {
			Expr condition = expression();
			Expr then = block();
			return new IfExpr(condition, then, elseBranch());
		}
		return block();
	}

	/** Skips to the end of the statement: a newline outside brackets. */
	private void scanStatement() {
		int depth = 0;
		while (!c.atEnd()) {
			char ch = c.peek();
			if (ch == '\n' && depth == 0) {
				return;
			}
			if (ch == '"') {
				string();
				continue;
			}
			if (ch == '(' || ch == '[' || ch == '{') {
				depth++;
			} else if (ch == ')' || ch == ']' || ch == '}') {
				if (depth == 0) {
					return;
				}
				depth--;
			}
			c.pos++;
		}
	}

	private String dottedName() {
		String name = c.identifier();
		if (name == null) {
			return null;
		}
		StringBuilder sb = new StringBuilder(name);
		while (c.peek() == '.' && TypstCursor.isIdentStart(c.peek(1))) {
			c.pos++;
			sb.append('.').append(c.identifier());
		}
		return sb.toString();
	}

	// ---------------------------------------------------------------- code expressions

	/** Expression after {@code #} in markup or math: a primary and its postfix chain. */
	private Expr embedExpression() {
		int savedNesting = nesting;
		nesting = 0;
		try {
			Expr expr;
			char ch = c.peek();
			if (TypstCursor.isIdentStart(ch)) {
				String name = c.identifier();
				expr = keywordLiteral(name);
			} else {
				expr = primary();
			}
			return postfix(expr);
		} finally {
			nesting = savedNesting;
		}
	}

	private static Expr keywordLiteral(String name) {
		return switch (name) {
			case "none" -> new NoneLit();
			case "true" -> new BoolLit(true);
			case "false" -> new BoolLit(false);
			default -> new Ident(name);
		};
	}

	private void skip() {
		if (nesting > 0) {
			c.skipTrivia();
		} else {
			c.skipInlineSpace();
		}
	}

	Expr expression() {
		return or();
	}

	private Expr or() {
		Expr left = and();
		while (true) {
			int save = c.pos;
			skip();
			if (c.eatKeyword("or")) {
				left = new BinaryExpr("or", left, and());
			} else {
				c.pos = save;
				return left;
			}
		}
	}

	private Expr and() {
		Expr left = not();
		while (true) {
			int save = c.pos;
			skip();
			if (c.eatKeyword("and")) {
				left = new BinaryExpr("and", left, not());
			} else {
				c.pos = save;
				return left;
			}
		}
	}

	private Expr not() {
		int save = c.pos;
		skip();
		if (c.eatKeyword("not")) {
			return new UnaryExpr("not", not());
		}
		c.pos = save;
		return comparison();
	}

	private Expr comparison() {
		Expr left = additive();
		int save = c.pos;
		skip();
		String op = null;
		for (String candidate : new String[] { "==", "!=", "<=", ">=" }) {
			if (c.startsWith(candidate)) {
				op = candidate;
				break;
			}
		}
		if (op == null && (c.peek() == '<' || c.peek() == '>') && c.peek(1) != '=') {
			op = String.valueOf(c.peek());
		}
		if (op != null) {
			c.pos += op.length();
			return new BinaryExpr(op, left, additive());
		}
		if (c.eatKeyword("in")) {
			return new BinaryExpr("in", left, additive());
		}
		if (c.startsWith("not") && c.src.startsWith(" in", c.pos + 3)) {
			c.pos += 6;
			return new BinaryExpr("not in", left, additive());
		}
		c.pos = save;
		return left;
	}

	private Expr additive() {
		Expr left = multiplicative();
		while (true) {
			int save = c.pos;
			skip();
			char ch = c.peek();
			if ((ch == '+' || ch == '-') && c.peek(1) != '=' && c.peek(1) != '>') {
				c.pos++;
				left = new BinaryExpr(String.valueOf(ch), left, multiplicative());
			} else {
				c.pos = save;
				return left;
			}
		}
	}

	private Expr multiplicative() {
		Expr left = unary();
		while (true) {
			int save = c.pos;
			skip();
			char ch = c.peek();
			if ((ch == '*' || ch == '/') && c.peek(1) != '=' && c.peek(1) != '/' && c.peek(1) != '*') {
				c.pos++;
				left = new BinaryExpr(String.valueOf(ch), left, unary());
			} else {
				c.pos = save;
				return left;
			}
		}
	}

	private Expr unary() {
		skip();
		char ch = c.peek();
		if (ch == '-' || ch == '+') {
			c.pos++;
			return new UnaryExpr(String.valueOf(ch), unary());
		}
		return postfix(primary());
	}

	private Expr postfix(Expr expr) {
		while (true) {
			char ch = c.peek();
			if (ch == '.' && TypstCursor.isIdentStart(c.peek(1))) {
				c.pos++;
				expr = new FieldExpr(expr, c.identifier());
			} else if (ch == '(') {
				expr = new CallExpr(expr, args());
			} else if (ch == '[') {
				List<CallArg> args = new ArrayList<>();
				Expr callee = expr;
				if (expr instanceof CallExpr call) {
					args.addAll(call.args());
					callee = call.callee();
				}
				args.add(CallArg.positional(contentBlock()));
				expr = new CallExpr(callee, args);
			} else {
				return expr;
			}
		}
	}

	private Expr primary() {
		skip();
		int start = c.pos;
		char ch = c.peek();
		if (c.atEnd()) {
			error("expected expression", start);
			return new UnknownExpr("");
		}
		if (Character.isDigit(ch)) {
			return number();
		}
		if (ch == '"') {
			return new StrLit(string());
		}
		if (ch == '(') {
			return parenthesized();
		}
		if (ch == '[') {
			return contentBlock();
		}
		if (ch == '{') {
			return codeBlock();
		}
		if (ch == '$') {
			TypstMathParser.Result result = math.equation();
			return new MathExpr(result.math(), result.block());
		}
		if (ch == '<') {
			String label = labelName();
			if (label != null) {
				return new LabelExpr(label);
			}
		}
		if (c.startsWith("..")) {
			c.pos += 2;
			return new SpreadExpr(unary());
		}
		if (TypstCursor.isIdentStart(ch)) {
			if (c.eatKeyword("if")) {
				Expr condition = expression();
				Expr then = block();
				return new IfExpr(condition, then, elseBranch());
			}
			String name = c.identifier();
			int save = c.pos;
			skip();
			if (c.startsWith("=>")) {
				c.pos += 2;
				return new ClosureExpr(List.of(name), expression());
			}
			c.pos = save;
			return keywordLiteral(name);
		}
		c.pos++;
		error("unexpected character '" + ch + "' in expression", start);
		return new UnknownExpr(String.valueOf(ch));
	}

	private Expr number() {
		int start = c.pos;
		while (Character.isDigit(c.peek())) {
			c.pos++;
		}
		boolean integral = true;
		if (c.peek() == '.' && Character.isDigit(c.peek(1))) {
			integral = false;
			c.pos++;
			while (Character.isDigit(c.peek())) {
				c.pos++;
			}
		}
		String digits = c.src.substring(start, c.pos);
		if (c.peek() == '%') {
			c.pos++;
			return new LengthLit(c.src.substring(start, c.pos));
		}
		if (Character.isLetter(c.peek())) {
			int unitStart = c.pos;
			while (Character.isLetter(c.peek())) {
				c.pos++;
			}
			String unit = c.src.substring(unitStart, c.pos);
			if (unit.equals("e") && Character.isDigit(c.peek())) {
				c.pos = unitStart;
			} else {
				return new LengthLit(c.src.substring(start, c.pos));
			}
		}
		return new NumberLit(digits, integral);
	}

	private String string() {
		int start = c.pos;
		c.pos++;
		StringBuilder sb = new StringBuilder();
		while (!c.atEnd() && c.peek() != '"') {
			char ch = c.next();
			if (ch == '\\' && !c.atEnd()) {
				char escaped = c.next();
				switch (escaped) {
					case 'n' -> sb.append('\n');
					case 't' -> sb.append('\t');
					case 'r' -> sb.append('\r');
					case 'u' -> {
						int close = c.src.indexOf('}', c.pos);
						if (c.peek() == '{' && close > 0) {
							try {
								sb.appendCodePoint(Integer.parseInt(c.src.substring(c.pos + 1, close), 16));
							} catch (IllegalArgumentException e) {
								error("invalid unicode escape", c.pos);
							}
							c.pos = close + 1;
						} else {
							sb.append('u');
						}
					}
					default -> sb.append(escaped);
				}
			} else {
				sb.append(ch);
			}
		}
		if (!c.eat('"')) {
			error("unclosed string", start);
		}
		return sb.toString();
	}

	private Expr parenthesized() {
		int start = c.pos;
		c.pos++;
		nesting++;
		List<CallArg> items = new ArrayList<>();
		boolean trailingComma = false;
		boolean named = false;
		c.skipTrivia();
		if (c.peek() == ':' && c.peek(1) != '=') {
			c.pos++;
			c.skipTrivia();
			named = true;
		}
		while (!c.atEnd() && c.peek() != ')') {
			CallArg item = argument();
			named |= item.isNamed();
			items.add(item);
			c.skipTrivia();
			trailingComma = c.eat(',');
			c.skipTrivia();
			if (!trailingComma && c.peek() != ')') {
				break;
			}
		}
		nesting--;
		if (!c.eat(')')) {
			error("unclosed parenthesis", start);
		}
		int save = c.pos;
		skip();
		if (c.startsWith("=>") && !named) {
			c.pos += 2;
			List<String> params = new ArrayList<>();
			for (CallArg item : items) {
				if (item.value() instanceof Ident id) {
					params.add(id.name());
				}
			}
			return new ClosureExpr(params, expression());
		}
		c.pos = save;
		if (named) {
			return new DictExpr(items);
		}
		if (items.size() == 1 && !trailingComma) {
			return items.get(0).value();
		}
		List<Expr> values = new ArrayList<>();
		for (CallArg item : items) {
			values.add(item.value());
		}
		return new ArrayExpr(values);
	}

	private List<CallArg> args() {
		int start = c.pos;
		c.pos++;
		nesting++;
		List<CallArg> args = new ArrayList<>();
		c.skipTrivia();
		while (!c.atEnd() && c.peek() != ')') {
			args.add(argument());
			c.skipTrivia();
			if (!c.eat(',')) {
				break;
			}
			c.skipTrivia();
		}
		nesting--;
		if (!c.eat(')')) {
			error("unclosed argument list", start);
		}
		return args;
	}

	/** {@code name: value} or a positional value. */
	private CallArg argument() {
		int save = c.pos;
		String name = c.identifier();
		if (name != null) {
			c.skipTrivia();
			if (c.peek() == ':') {
				c.pos++;
				return new CallArg(name, expression());
			}
		} else if (c.peek() == '"') {
			// string keys in dictionaries
			String key = string();
			c.skipTrivia();
			if (c.peek() == ':') {
				c.pos++;
				return new CallArg(key, expression());
			}
		}
		c.pos = save;
		return CallArg.positional(expression());
	}

	private Expr contentBlock() {
		int start = c.pos;
		c.pos++;
		int savedNesting = nesting;
		nesting = 0;
		List<DocNode> body = markup(true);
		nesting = savedNesting;
		if (!c.eat(']')) {
			error("unclosed content block", start);
		}
		return new ContentExpr(body);
	}

	private Expr codeBlock() {
		int start = c.pos;
		int end = c.matching('{', '}');
		if (end < 0) {
			c.pos = c.src.length();
			error("unclosed code block", start);
		} else {
			c.pos = end;
		}
		return new CodeExpr(List.of(), c.src.substring(start, c.pos));
	}
}
