package markbridge.macro;

import markbridge.parse.latex.TexToken;

import java.util.List;

/**
 * {@code \newcommand}-style macro with {@code parameters} undelimited arguments.
 * When {@code optionalDefault} is non-null the first argument is a bracketed
 * optional one with that default.
 */
public record CommandMacro(int parameters, List<TexToken> optionalDefault, List<TexToken> body)
		implements MacroDefinition {
	public CommandMacro {
		if (parameters < 0 || parameters > 9) {
			throw new IllegalArgumentException("macro parameter count must be 0..9: " + parameters);
		}
		optionalDefault = optionalDefault == null ? null : List.copyOf(optionalDefault);
		body = List.copyOf(body);
	}
}
