package markbridge.eval;

public record BoolValue(boolean value) implements Value {
	@Override
	public String typeName() {
		return "bool";
	}
}
