package markbridge.eval;

public record AutoValue() implements Value {
	@Override
	public String typeName() {
		return "auto";
	}
}
