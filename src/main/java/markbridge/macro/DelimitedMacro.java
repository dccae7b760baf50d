package markbridge.macro;

import markbridge.parse.latex.TexToken;

import java.util.List;

/**
 * {@code \def} macro with a parameter text mixing PARAM tokens and literal
 * delimiters, as in {@code \def\pair(#1,#2){...}}.
 */
public record DelimitedMacro(List<TexToken> pattern, List<TexToken> body) implements MacroDefinition {
	public DelimitedMacro {
		pattern = List.copyOf(pattern);
		body = List.copyOf(body);
	}
}
