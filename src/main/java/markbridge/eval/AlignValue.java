package markbridge.eval;

/**
 * Alignment; {@code horizontal} is left, center, right or null.
 */
public record AlignValue(String horizontal, String vertical) implements Value {
	@Override
	public String typeName() {
		return "alignment";
	}

	public AlignValue combine(AlignValue other) {
		return new AlignValue(horizontal != null ? horizontal : other.horizontal,
				vertical != null ? vertical : other.vertical);
	}
}
