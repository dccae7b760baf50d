package markbridge;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import markbridge.loss.ConversionMetrics;
import markbridge.loss.LossReport;
import markbridge.transform.table.TableCoverage;

/**
 * JSON report written next to each converted file. Paths are relative to the
 * input and output roots.
 */
@JsonPropertyOrder({ "source", "output", "report", "metrics", "table_coverage" })
public record FileReport(
		@JsonProperty("source") String source,
		@JsonProperty("output") String output,
		@JsonProperty("report") LossReport report,
		@JsonProperty("metrics") ConversionMetrics metrics,
		@JsonProperty("table_coverage") TableCoverage tableCoverage) {
}
