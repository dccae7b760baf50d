package markbridge.eval;

/**
 * Color kept as Typst source ({@code red}, {@code rgb("#eeeeee")},
 * {@code gray.lighten(60%)}).
 */
public record ColorValue(String source) implements Value {
	@Override
	public String typeName() {
		return "color";
	}
}
