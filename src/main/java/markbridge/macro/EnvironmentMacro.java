package markbridge.macro;

import markbridge.parse.latex.TexToken;

import java.util.List;

/**
 * {@code \newenvironment} definition. Only the begin code sees the arguments.
 */
public record EnvironmentMacro(int parameters, List<TexToken> optionalDefault, List<TexToken> begin,
		List<TexToken> end) {
	public EnvironmentMacro {
		optionalDefault = optionalDefault == null ? null : List.copyOf(optionalDefault);
		begin = List.copyOf(begin);
		end = List.copyOf(end);
	}

	CommandMacro beginMacro() {
		return new CommandMacro(parameters, optionalDefault, begin);
	}
}
