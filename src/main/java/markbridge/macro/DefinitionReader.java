package markbridge.macro;

import markbridge.loss.LossTracker;
import markbridge.parse.latex.TexCursor;
import markbridge.parse.latex.TexToken;
import markbridge.parse.latex.TexTokenType;
import markbridge.parse.latex.TexTokens;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Reads definition primitives from the token stream into a {@link MacroTable}.
 * Malformed definitions are skipped with a warning.
 */
final class DefinitionReader {
	private static final Set<String> COMMAND_DEFINERS = Set.of("newcommand", "newcommand*", "renewcommand",
			"renewcommand*", "providecommand", "providecommand*", "DeclareRobustCommand", "DeclareRobustCommand*");
	private static final Set<String> DEF_DEFINERS = Set.of("def", "gdef", "edef", "xdef");
	private static final Set<String> ENVIRONMENT_DEFINERS = Set.of("newenvironment", "newenvironment*",
			"renewenvironment", "renewenvironment*");
	private static final Set<String> OTHER = Set.of("let", "DeclareMathOperator", "DeclareMathOperator*", "newif");

	private final MacroTable table;
	private final CommandCatalog catalog;
	private final LossTracker tracker;
	private final UnaryOperator<List<TexToken>> expander;

	DefinitionReader(MacroTable table, CommandCatalog catalog, LossTracker tracker,
			UnaryOperator<List<TexToken>> expander) {
		this.table = table;
		this.catalog = catalog;
		this.tracker = tracker;
		this.expander = expander;
	}

	static boolean isDefinitionPrimitive(String name) {
		return COMMAND_DEFINERS.contains(name) || DEF_DEFINERS.contains(name) || ENVIRONMENT_DEFINERS.contains(name)
				|| OTHER.contains(name);
	}

	void read(String primitive, TexCursor cursor) {
		if (COMMAND_DEFINERS.contains(primitive)) {
			readCommand(primitive, cursor);
		} else if (DEF_DEFINERS.contains(primitive)) {
			readDef(primitive, cursor);
		} else if (ENVIRONMENT_DEFINERS.contains(primitive)) {
			readEnvironment(cursor);
		} else if (primitive.equals("let")) {
			readLet(cursor);
		} else if (primitive.startsWith("DeclareMathOperator")) {
			readMathOperator(primitive.endsWith("*"), cursor);
		} else if (primitive.equals("newif")) {
			readNewif(cursor);
		}
	}

	private void readCommand(String primitive, TexCursor cursor) {
		String name = readDefinedName(cursor);
		if (name == null) {
			tracker.warn("\\" + primitive + " without a command name was ignored");
			return;
		}
		int parameters = readParameterCount(name, cursor);
		List<TexToken> optionalDefault = parameters > 0 ? cursor.readOptional() : null;
		List<TexToken> body = cursor.readArgument();
		if (body == null) {
			tracker.warn("\\" + primitive + "{\\" + name + "} has no body");
			body = List.of();
		}
		if (primitive.startsWith("providecommand") && (table.isDefined(name) || catalog.isKnown(name))) {
			return;
		}
		table.define(name, new CommandMacro(parameters, optionalDefault, body));
	}

	private void readDef(String primitive, TexCursor cursor) {
		cursor.skipSpaces();
		if (cursor.atEnd() || cursor.peek().type() != TexTokenType.CONTROL_SEQ) {
			tracker.warn("\\" + primitive + " without a command name was ignored");
			return;
		}
		String name = cursor.next().text();
		List<TexToken> pattern = new ArrayList<>();
		while (!cursor.atEnd() && cursor.peek().type() != TexTokenType.BEGIN_GROUP) {
			pattern.add(cursor.next());
		}
		if (cursor.atEnd()) {
			tracker.warn("\\" + primitive + "\\" + name + " has no body");
			return;
		}
		List<TexToken> body = cursor.readGroup();
		if (primitive.equals("edef") || primitive.equals("xdef")) {
			body = expander.apply(body);
		}
		int simple = simpleParameterCount(pattern);
		if (simple >= 0) {
			table.define(name, new CommandMacro(simple, null, body));
		} else {
			table.define(name, new DelimitedMacro(pattern, body));
		}
	}

	private void readEnvironment(TexCursor cursor) {
		String name = cursor.readText();
		if (name == null || name.isEmpty()) {
			tracker.warn("\\newenvironment without a name was ignored");
			return;
		}
		int parameters = readParameterCount(name, cursor);
		List<TexToken> optionalDefault = parameters > 0 ? cursor.readOptional() : null;
		List<TexToken> begin = cursor.readArgument();
		List<TexToken> end = cursor.readArgument();
		if (begin == null || end == null) {
			tracker.warn("\\newenvironment{" + name + "} is missing its begin or end code");
		}
		table.defineEnvironment(name, new EnvironmentMacro(parameters, optionalDefault,
				begin == null ? List.of() : begin, end == null ? List.of() : end));
	}

	private void readLet(TexCursor cursor) {
		cursor.skipSpaces();
		if (cursor.atEnd() || cursor.peek().type() != TexTokenType.CONTROL_SEQ) {
			tracker.warn("\\let without a command name was ignored");
			return;
		}
		String name = cursor.next().text();
		cursor.skipSpaces();
		if (!cursor.atEnd() && cursor.peek().isChar('=')) {
			cursor.next();
		}
		cursor.skipSpaces();
		if (cursor.atEnd()) {
			tracker.warn("\\let\\" + name + " has no target");
			return;
		}
		TexToken target = cursor.next();
		MacroDefinition existing = target.type() == TexTokenType.CONTROL_SEQ ? table.command(target.text()) : null;
		if (existing != null) {
			// \let copies the current meaning, later changes to the target do not propagate
			table.define(name, existing);
		} else {
			table.define(name, new CommandMacro(0, null, List.of(target)));
		}
	}

	private void readMathOperator(boolean limits, TexCursor cursor) {
		String name = readDefinedName(cursor);
		List<TexToken> text = cursor.readArgument();
		if (name == null || text == null) {
			tracker.warn("malformed \\DeclareMathOperator was ignored");
			return;
		}
		List<TexToken> body = new ArrayList<>();
		body.add(TexToken.cs(limits ? "operatorname*" : "operatorname"));
		body.add(TexToken.begin());
		body.addAll(text);
		body.add(TexToken.end());
		table.define(name, new CommandMacro(0, null, body));
	}

	private void readNewif(TexCursor cursor) {
		cursor.skipSpaces();
		if (cursor.atEnd() || cursor.peek().type() != TexTokenType.CONTROL_SEQ || !cursor.peek().text().startsWith("if")) {
			tracker.warn("\\newif without an \\if name was ignored");
			return;
		}
		table.declareFlag(cursor.next().text().substring(2));
	}

	/** Name given as {@code \name} or {@code {\name}}. */
	private static String readDefinedName(TexCursor cursor) {
		List<TexToken> arg = cursor.readArgument();
		if (arg == null) {
			return null;
		}
		for (TexToken token : arg) {
			if (token.type() == TexTokenType.CONTROL_SEQ) {
				return token.text();
			}
		}
		return null;
	}

	private int readParameterCount(String name, TexCursor cursor) {
		String count = cursor.readOptionalText();
		if (count == null) {
			return 0;
		}
		try {
			int n = Integer.parseInt(count.trim());
			if (n < 0 || n > 9) {
				tracker.warn("parameter count " + n + " of " + name + " is out of range");
				return Math.max(0, Math.min(9, n));
			}
			return n;
		} catch (NumberFormatException e) {
			tracker.warn("parameter count '" + count + "' of " + name + " is not a number");
			return 0;
		}
	}

	/** n when the parameter text is exactly #1..#n, otherwise -1. */
	private static int simpleParameterCount(List<TexToken> pattern) {
		List<TexToken> trimmed = TexTokens.trim(pattern);
		for (int i = 0; i < trimmed.size(); i++) {
			TexToken token = trimmed.get(i);
			if (token.type() != TexTokenType.PARAM || !token.text().equals(String.valueOf(i + 1))) {
				return -1;
			}
		}
		return trimmed.size();
	}
}
