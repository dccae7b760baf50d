package markbridge.loss;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural counters of a converted document.
 */
@JsonPropertyOrder({ "headings", "equations", "figures", "tables", "cites", "refs", "labels", "list_items",
		"loss_markers", "parse_errors" })
public record ConversionMetrics(
		@JsonProperty("headings") int headings,
		@JsonProperty("equations") int equations,
		@JsonProperty("figures") int figures,
		@JsonProperty("tables") int tables,
		@JsonProperty("cites") int cites,
		@JsonProperty("refs") int refs,
		@JsonProperty("labels") int labels,
		@JsonProperty("list_items") int listItems,
		@JsonProperty("loss_markers") int lossMarkers,
		@JsonProperty("parse_errors") int parseErrors) {

	/**
	 * Names of the structural counters that are lower here than in {@code baseline}.
	 * Loss markers and parse errors are not structural.
	 */
	public List<String> decreasesFrom(ConversionMetrics baseline) {
		List<String> out = new ArrayList<>();
		check(out, "headings", headings, baseline.headings);
		check(out, "equations", equations, baseline.equations);
		check(out, "figures", figures, baseline.figures);
		check(out, "tables", tables, baseline.tables);
		check(out, "cites", cites, baseline.cites);
		check(out, "refs", refs, baseline.refs);
		check(out, "labels", labels, baseline.labels);
		check(out, "list_items", listItems, baseline.listItems);
		return out;
	}

	public boolean atLeast(ConversionMetrics baseline) {
		return decreasesFrom(baseline).isEmpty();
	}

	public ConversionMetrics withParseErrors(int count) {
		return new ConversionMetrics(headings, equations, figures, tables, cites, refs, labels, listItems,
				lossMarkers, count);
	}

	private static void check(List<String> out, String name, int value, int base) {
		if (value < base) {
			out.add(name);
		}
	}
}
