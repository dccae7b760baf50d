package markbridge.transform.table;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-idiom counts of table features that were mapped faithfully or approximated
 * during one conversion.
 */
public final class TableCoverage {
	@JsonPropertyOrder({ "mapped", "approximated" })
	public record Counts(@JsonProperty("mapped") int mapped, @JsonProperty("approximated") int approximated) {
	}

	private final Map<TableIdiom, int[]> counts = new EnumMap<>(TableIdiom.class);

	public void mapped(TableIdiom idiom) {
		slot(idiom)[0]++;
	}

	public void approximated(TableIdiom idiom) {
		slot(idiom)[1]++;
	}

	public Counts get(TableIdiom idiom) {
		int[] c = counts.get(idiom);
		return c == null ? new Counts(0, 0) : new Counts(c[0], c[1]);
	}

	public boolean isEmpty() {
		return counts.isEmpty();
	}

	/** Idioms seen so far, in declaration order, keyed by their report id. */
	@JsonValue
	public Map<String, Counts> asMap() {
		Map<String, Counts> out = new LinkedHashMap<>();
		for (TableIdiom idiom : counts.keySet()) {
			out.put(idiom.id(), get(idiom));
		}
		return out;
	}

	private int[] slot(TableIdiom idiom) {
		return counts.computeIfAbsent(idiom, k -> new int[2]);
	}

	@Override
	public String toString() {
		return asMap().toString();
	}
}
