package markbridge;

import java.util.Locale;

/**
 * Optional conversion features that can be switched off.
 */
public enum Feature {
	TABLES,
	GRAPHICS,
	REFERENCES;

	public static Feature parse(String name) {
		try {
			return valueOf(name.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			throw new IllegalArgumentException("unknown feature: " + name, ex);
		}
	}
}
