package markbridge.transform.table;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Table features whose translation is tracked in {@link TableCoverage}.
 */
public enum TableIdiom {
	SPAN("span"),
	FILL("fill"),
	RULED_BORDER("ruled-border"),
	GRID_BORDER("grid-border"),
	PARTIAL_RULE("partial-rule"),
	CELL_STROKE("cell-stroke");

	private final String id;

	TableIdiom(String id) {
		this.id = id;
	}

	@JsonValue
	public String id() {
		return id;
	}
}
