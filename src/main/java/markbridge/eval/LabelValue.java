package markbridge.eval;

public record LabelValue(String name) implements Value {
	@Override
	public String typeName() {
		return "label";
	}
}
