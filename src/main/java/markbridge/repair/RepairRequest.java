package markbridge.repair;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import markbridge.loss.ConversionMetrics;
import markbridge.loss.LossReport;

/**
 * What a repair process gets to see: the source, the current output, and the
 * losses and metrics of that output.
 */
@JsonPropertyOrder({ "input", "output", "report", "metrics" })
public record RepairRequest(
		@JsonProperty("input") String input,
		@JsonProperty("output") String output,
		@JsonProperty("report") LossReport report,
		@JsonProperty("metrics") ConversionMetrics metrics) {
}
