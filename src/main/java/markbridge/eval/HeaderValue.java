package markbridge.eval;

import java.util.List;

/**
 * Result of {@code table.header(..)} or {@code table.footer(..)}: cells and rules
 * in order.
 */
public record HeaderValue(boolean footer, List<Value> items) implements Value {
	@Override
	public String typeName() {
		return "content";
	}
}
