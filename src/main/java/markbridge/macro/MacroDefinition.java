package markbridge.macro;

import markbridge.parse.latex.TexToken;

import java.util.List;

/**
 * User command definition. Bodies keep PARAM tokens as positional placeholders.
 */
public sealed interface MacroDefinition permits CommandMacro, DelimitedMacro {
	List<TexToken> body();
}
