package markbridge.eval;

public record NoneValue() implements Value {
	public static final NoneValue NONE = new NoneValue();

	@Override
	public String typeName() {
		return "none";
	}
}
