package markbridge.ast.doc;

/**
 * Horizontal rule before row {@code beforeRow}. A partial rule covers columns
 * {@code fromColumn..toColumn} (0-based, inclusive); a full rule has both set to -1.
 */
public record TableRule(int beforeRow, Kind kind, int fromColumn, int toColumn) {
	public enum Kind {
		TOP,
		MID,
		BOTTOM,
		PLAIN
	}

	public static TableRule full(int beforeRow, Kind kind) {
		return new TableRule(beforeRow, kind, -1, -1);
	}

	public boolean isPartial() {
		return fromColumn >= 0;
	}
}
