package markbridge.macro;

import java.util.HashMap;
import java.util.Map;

/**
 * Definitions of one conversion. Flat scoping: the last definition of a name wins.
 */
public final class MacroTable {
	private final Map<String, MacroDefinition> commands = new HashMap<>();
	private final Map<String, EnvironmentMacro> environments = new HashMap<>();
	private final Map<String, Boolean> flags = new HashMap<>();

	public MacroDefinition command(String name) {
		return commands.get(name);
	}

	public void define(String name, MacroDefinition definition) {
		commands.put(name, definition);
	}

	public boolean isDefined(String name) {
		return commands.containsKey(name);
	}

	public EnvironmentMacro environment(String name) {
		return environments.get(name);
	}

	public void defineEnvironment(String name, EnvironmentMacro definition) {
		environments.put(name, definition);
	}

	/** Declares {@code \ifNAME} with its {@code \NAMEtrue}/{@code \NAMEfalse} switches. */
	public void declareFlag(String name) {
		flags.put(name, Boolean.FALSE);
	}

	/** Value of the flag tested by {@code \ifNAME}, or null when {@code condition} is not one. */
	public Boolean flag(String condition) {
		if (!condition.startsWith("if")) {
			return null;
		}
		return flags.get(condition.substring(2));
	}

	/** Applies {@code \NAMEtrue}/{@code \NAMEfalse}; false when {@code name} is not a switch. */
	public boolean applySwitch(String name) {
		for (String suffix : new String[] { "true", "false" }) {
			if (name.endsWith(suffix)) {
				String flag = name.substring(0, name.length() - suffix.length());
				if (flags.containsKey(flag)) {
					flags.put(flag, suffix.equals("true"));
					return true;
				}
			}
		}
		return false;
	}

	public int size() {
		return commands.size() + environments.size() + flags.size();
	}
}
