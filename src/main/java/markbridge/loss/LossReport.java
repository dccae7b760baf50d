package markbridge.loss;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Ordered loss records of one conversion.
 */
@JsonPropertyOrder({ "source_lang", "target_lang", "losses", "warnings" })
public record LossReport(
		@JsonProperty("source_lang") String sourceLang,
		@JsonProperty("target_lang") String targetLang,
		@JsonProperty("losses") List<LossRecord> losses,
		@JsonProperty("warnings") List<String> warnings) {

	@JsonIgnore
	public boolean isEmpty() {
		return losses.isEmpty() && warnings.isEmpty();
	}

	public long count(LossKind kind) {
		return losses.stream().filter(l -> l.kind() == kind).count();
	}
}
