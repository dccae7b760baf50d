package markbridge.eval;

public record StrValue(String value) implements Value {
	@Override
	public String typeName() {
		return "str";
	}
}
