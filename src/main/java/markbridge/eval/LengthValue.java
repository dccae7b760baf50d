package markbridge.eval;

/**
 * Length, ratio or fraction in source form ({@code 2cm}, {@code 80%}, {@code 1fr}).
 */
public record LengthValue(String text) implements Value {
	@Override
	public String typeName() {
		return text.endsWith("%") ? "ratio" : text.endsWith("fr") ? "fraction" : "length";
	}
}
