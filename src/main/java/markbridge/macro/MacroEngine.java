package markbridge.macro;

import markbridge.ast.SourceSpan;
import markbridge.ast.doc.LossMarker;
import markbridge.loss.LossKind;
import markbridge.loss.LossRecord;
import markbridge.loss.LossTracker;
import markbridge.parse.latex.LatexEnvironments;
import markbridge.parse.latex.TexCursor;
import markbridge.parse.latex.TexToken;
import markbridge.parse.latex.TexTokenType;
import markbridge.parse.latex.TexTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Expands user macros in a LaTeX token stream.
 *
 * Expansion is leftmost-outermost: an invocation binds its arguments, and its
 * substituted body is expanded completely before the stream continues. Each
 * nested expansion counts against {@code maxDepth}; running past it abandons the
 * whole top-level invocation, which is kept verbatim with one loss record.
 *
 * The engine tracks math mode so that {@code \ifmmode} is decided by where the
 * tokens end up, not by their spelling.
 */
public final class MacroEngine {
	private static final Logger log = LoggerFactory.getLogger(MacroEngine.class);

	/** Conditionals the engine does not resolve but must skip over when nesting. */
	private static final Set<String> PRIMITIVE_CONDITIONALS = Set.of("if", "ifx", "ifnum", "ifdim", "ifodd",
			"ifcase", "ifcat", "ifdefined", "ifcsname", "ifvmode", "ifhmode", "ifinner", "ifvoid");

	private final MacroTable table;
	private final CommandCatalog catalog;
	private final LossTracker tracker;
	private final int maxDepth;
	private final DefinitionReader definitions;
	private boolean math;

	public MacroEngine(CommandCatalog catalog, LossTracker tracker, int maxDepth) {
		this(new MacroTable(), catalog, tracker, maxDepth);
	}

	public MacroEngine(MacroTable table, CommandCatalog catalog, LossTracker tracker, int maxDepth) {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
		}
		this.table = table;
		this.catalog = catalog;
		this.tracker = tracker;
		this.maxDepth = maxDepth;
		this.definitions = new DefinitionReader(table, catalog, tracker, this::expandDetached);
	}

	/**
	 * Returns the macro-free token stream. Definitions are consumed; unknown commands
	 * are kept and carry the id of their loss record.
	 */
	public List<TexToken> expand(List<TexToken> tokens) {
		List<TexToken> out = new ArrayList<>();
		expandInto(tokens, 0, out);
		log.debug("expanded {} tokens into {} ({} definitions)", tokens.size(), out.size(), table.size());
		return out;
	}

	public MacroTable table() {
		return table;
	}

	private List<TexToken> expandDetached(List<TexToken> tokens) {
		List<TexToken> out = new ArrayList<>();
		expandInto(tokens, 0, out);
		return out;
	}

	private void expandInto(List<TexToken> input, int depth, List<TexToken> out) {
		TexCursor cursor = new TexCursor(input);
		while (!cursor.atEnd()) {
			int start = cursor.position();
			TexToken token = cursor.next();
			if (token.type() != TexTokenType.CONTROL_SEQ) {
				if (token.type() == TexTokenType.MATH_SHIFT) {
					if (cursor.nextIs(TexTokenType.MATH_SHIFT)) {
						out.add(token);
						token = cursor.next();
					}
					math = !math;
				}
				out.add(token);
				continue;
			}
			String name = token.text();
			if (DefinitionReader.isDefinitionPrimitive(name)) {
				definitions.read(name, cursor);
				continue;
			}
			Boolean condition = conditionValue(name);
			if (condition != null) {
				expandInto(selectBranch(name, condition, cursor), depth, out);
				continue;
			}
			if (table.applySwitch(name)) {
				continue;
			}
			MacroDefinition definition = table.command(name);
			if (definition != null) {
				invoke(name, definition, cursor, start, depth, out);
				continue;
			}
			if (name.equals("begin") && beginEnvironment(cursor, start, depth, out)) {
				continue;
			}
			if (name.equals("end")) {
				endEnvironment(cursor, start, out);
				continue;
			}
			if (name.equals("(") || name.equals("[")) {
				math = true;
			} else if (name.equals(")") || name.equals("]")) {
				math = false;
			}
			out.add(checkKnown(token));
		}
	}

	private TexToken checkKnown(TexToken token) {
		String name = token.text();
		if (token.lossId() != null || name.isEmpty() || !Character.isLetter(name.charAt(0)) || catalog.isKnown(name)) {
			return token;
		}
		LossRecord loss = tracker.record(LossKind.UNKNOWN_COMMAND, "\\" + name, "unknown command \\" + name,
				"\\" + name, context());
		return token.withLossId(loss.id());
	}

	private void invoke(String name, MacroDefinition definition, TexCursor cursor, int start, int depth,
			List<TexToken> out) {
		List<TexToken> body = bind(name, definition, cursor);
		if (body == null) {
			LossRecord loss = tracker.record(LossKind.MACRO_ARGUMENT_MISMATCH, "\\" + name,
					"use of \\" + name + " does not match its definition", "\\" + name, context());
			cursor.reset(start + 1);
			out.add(cursor.slice(start, start + 1).get(0).withLossId(loss.id()));
			return;
		}
		expandBody(name, body, cursor, start, depth, out);
	}

	private void expandBody(String name, List<TexToken> body, TexCursor cursor, int start, int depth,
			List<TexToken> out) {
		if (depth > 0) {
			if (depth + 1 > maxDepth) {
				throw new RecursionLimitException();
			}
			expandInto(body, depth + 1, out);
			return;
		}
		int checkpoint = tracker.checkpoint();
		boolean mathBefore = math;
		List<TexToken> expanded = new ArrayList<>();
		try {
			expandInto(body, 1, expanded);
			out.addAll(expanded);
		} catch (RecursionLimitException e) {
			tracker.rollback(checkpoint);
			math = mathBefore;
			List<TexToken> invocation = cursor.slice(start, cursor.position());
			LossRecord loss = tracker.record(LossKind.MACRO_RECURSION_LIMIT, "\\" + name,
					"expansion of \\" + name + " exceeded depth " + maxDepth, TexTokens.detokenize(invocation),
					context());
			log.debug("recursion limit in \\{}", name);
			out.add(invocation.get(0).withLossId(loss.id()));
			out.addAll(invocation.subList(1, invocation.size()));
		}
	}

	/**
	 * Substituted body, or null when the invocation does not match a delimited
	 * pattern. Missing undelimited arguments are bound to empty lists.
	 */
	private List<TexToken> bind(String name, MacroDefinition definition, TexCursor cursor) {
		List<List<TexToken>> args = new ArrayList<>();
		boolean missing = false;
		if (definition instanceof CommandMacro command) {
			int remaining = command.parameters();
			if (command.optionalDefault() != null && remaining > 0) {
				List<TexToken> optional = cursor.readOptional();
				args.add(optional != null ? optional : command.optionalDefault());
				remaining--;
			}
			for (int i = 0; i < remaining; i++) {
				List<TexToken> arg = cursor.readArgument();
				if (arg == null) {
					missing = true;
					arg = List.of();
				}
				args.add(arg);
			}
		} else if (definition instanceof DelimitedMacro delimited) {
			if (!matchPattern(delimited.pattern(), cursor, args)) {
				return null;
			}
		}
		List<TexToken> body = substitute(definition.body(), args);
		if (!missing) {
			return body;
		}
		LossRecord loss = tracker.record(LossKind.MACRO_ARGUMENT_MISMATCH, "\\" + name,
				"\\" + name + " is missing arguments; empty values used", "\\" + name, context());
		// the expansion is kept; the marker comment ahead of it carries the loss into the output
		List<TexToken> marked = new ArrayList<>();
		marked.add(new TexToken(TexTokenType.COMMENT, LossMarker.PREFIX + loss.id() + " \\" + name, SourceSpan.NONE));
		marked.addAll(body);
		return marked;
	}

	private static boolean matchPattern(List<TexToken> pattern, TexCursor cursor, List<List<TexToken>> args) {
		int i = 0;
		while (i < pattern.size()) {
			TexToken expected = pattern.get(i);
			if (expected.type() != TexTokenType.PARAM) {
				if (cursor.atEnd() || !TexTokens.sameToken(cursor.next(), expected)) {
					return false;
				}
				i++;
				continue;
			}
			int delimiterEnd = i + 1;
			while (delimiterEnd < pattern.size() && pattern.get(delimiterEnd).type() != TexTokenType.PARAM) {
				delimiterEnd++;
			}
			List<TexToken> delimiter = pattern.subList(i + 1, delimiterEnd);
			if (delimiter.isEmpty()) {
				List<TexToken> arg = cursor.readArgument();
				if (arg == null) {
					return false;
				}
				args.add(arg);
			} else {
				List<TexToken> arg = readDelimited(cursor, delimiter);
				if (arg == null) {
					return false;
				}
				args.add(arg);
			}
			i = delimiterEnd;
		}
		return true;
	}

	/** Tokens up to {@code delimiter} at brace depth 0; the delimiter is consumed. */
	private static List<TexToken> readDelimited(TexCursor cursor, List<TexToken> delimiter) {
		List<TexToken> arg = new ArrayList<>();
		int depth = 0;
		while (!cursor.atEnd()) {
			if (depth == 0 && matchesAt(cursor, delimiter)) {
				for (int k = 0; k < delimiter.size(); k++) {
					cursor.next();
				}
				return stripBraces(arg);
			}
			TexToken token = cursor.next();
			if (token.type() == TexTokenType.BEGIN_GROUP) {
				depth++;
			} else if (token.type() == TexTokenType.END_GROUP) {
				if (depth == 0) {
					return null;
				}
				depth--;
			}
			arg.add(token);
		}
		return null;
	}

	private static boolean matchesAt(TexCursor cursor, List<TexToken> delimiter) {
		for (int k = 0; k < delimiter.size(); k++) {
			TexToken actual = cursor.peek(k);
			if (actual == null || !TexTokens.sameToken(actual, delimiter.get(k))) {
				return false;
			}
		}
		return true;
	}

	/** TeX drops one pair of braces around a delimited argument that is a single group. */
	private static List<TexToken> stripBraces(List<TexToken> arg) {
		if (arg.size() >= 2 && arg.get(0).type() == TexTokenType.BEGIN_GROUP
				&& arg.get(arg.size() - 1).type() == TexTokenType.END_GROUP) {
			int depth = 0;
			for (int k = 0; k < arg.size() - 1; k++) {
				TexTokenType type = arg.get(k).type();
				if (type == TexTokenType.BEGIN_GROUP) {
					depth++;
				} else if (type == TexTokenType.END_GROUP) {
					depth--;
				}
				if (depth == 0) {
					return arg;
				}
			}
			return new ArrayList<>(arg.subList(1, arg.size() - 1));
		}
		return arg;
	}

	private static List<TexToken> substitute(List<TexToken> body, List<List<TexToken>> args) {
		List<TexToken> out = new ArrayList<>(body.size());
		for (TexToken token : body) {
			if (token.type() != TexTokenType.PARAM) {
				out.add(token);
			} else if (token.text().startsWith("#")) {
				out.add(new TexToken(TexTokenType.PARAM, token.text().substring(1), token.span()));
			} else {
				int index = token.text().charAt(0) - '1';
				if (index >= 0 && index < args.size()) {
					out.addAll(args.get(index));
				}
			}
		}
		return out;
	}

	private boolean beginEnvironment(TexCursor cursor, int start, int depth, List<TexToken> out) {
		int afterBegin = cursor.position();
		String env = cursor.readText();
		if (env == null) {
			cursor.reset(afterBegin);
			return false;
		}
		EnvironmentMacro definition = table.environment(env);
		if (definition == null) {
			if (LatexEnvironments.DISPLAY_MATH.contains(env)) {
				math = true;
			}
			out.addAll(cursor.slice(start, cursor.position()));
			return true;
		}
		List<TexToken> begin = bind(env, definition.beginMacro(), cursor);
		List<TexToken> content = readEnvironmentBody(env, cursor);
		List<TexToken> body = new ArrayList<>(begin);
		body.addAll(content);
		body.addAll(definition.end());
		expandBody(env, body, cursor, start, depth, out);
		return true;
	}

	private void endEnvironment(TexCursor cursor, int start, List<TexToken> out) {
		int afterEnd = cursor.position();
		String env = cursor.readText();
		if (env == null) {
			cursor.reset(afterEnd);
		} else if (LatexEnvironments.DISPLAY_MATH.contains(env)) {
			math = false;
		}
		out.addAll(cursor.slice(start, cursor.position()));
	}

	/** Tokens up to the matching {@code \end{env}}, which is consumed. */
	private List<TexToken> readEnvironmentBody(String env, TexCursor cursor) {
		List<TexToken> body = new ArrayList<>();
		int nesting = 0;
		while (!cursor.atEnd()) {
			int position = cursor.position();
			TexToken token = cursor.next();
			if (token.isCs("begin") || token.isCs("end")) {
				String name = cursor.readText();
				if (env.equals(name)) {
					if (token.isCs("begin")) {
						nesting++;
					} else if (nesting == 0) {
						return body;
					} else {
						nesting--;
					}
				}
				body.addAll(cursor.slice(position, cursor.position()));
				continue;
			}
			body.add(token);
		}
		tracker.warn("environment " + env + " is not closed");
		return body;
	}

	/** Value of a resolvable conditional, or null when {@code name} is not one. */
	private Boolean conditionValue(String name) {
		if (name.equals("iftrue")) {
			return Boolean.TRUE;
		}
		if (name.equals("iffalse")) {
			return Boolean.FALSE;
		}
		if (name.equals("ifmmode")) {
			return math;
		}
		return table.flag(name);
	}

	private boolean isConditional(String name) {
		return conditionValue(name) != null || PRIMITIVE_CONDITIONALS.contains(name);
	}

	/** Tokens of the chosen branch; the whole construct up to {@code \fi} is consumed. */
	private List<TexToken> selectBranch(String name, boolean condition, TexCursor cursor) {
		List<TexToken> thenBranch = new ArrayList<>();
		List<TexToken> elseBranch = new ArrayList<>();
		List<TexToken> current = thenBranch;
		int nesting = 0;
		while (!cursor.atEnd()) {
			TexToken token = cursor.next();
			if (token.type() == TexTokenType.CONTROL_SEQ) {
				if (isConditional(token.text())) {
					nesting++;
				} else if (token.text().equals("fi")) {
					if (nesting == 0) {
						return condition ? thenBranch : elseBranch;
					}
					nesting--;
				} else if (token.text().equals("else") && nesting == 0) {
					current = elseBranch;
					continue;
				}
			}
			current.add(token);
		}
		tracker.warn("\\" + name + " is not terminated by \\fi");
		return condition ? thenBranch : elseBranch;
	}

	private String context() {
		return math ? "math" : "text";
	}

	/** Unwinds a nested expansion back to its top-level invocation. */
	private static final class RecursionLimitException extends RuntimeException {
		RecursionLimitException() {
			super(null, null, false, false);
		}
	}
}
