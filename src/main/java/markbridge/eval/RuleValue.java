package markbridge.eval;

/**
 * Result of {@code table.hline(..)} or {@code table.vline(..)}. Unset positions are
 * null; {@code end} is exclusive. {@code stroke} is the stroke argument's source
 * or null.
 */
public record RuleValue(boolean vertical, Integer position, Integer start, Integer end, String stroke)
		implements Value {
	@Override
	public String typeName() {
		return "content";
	}
}
