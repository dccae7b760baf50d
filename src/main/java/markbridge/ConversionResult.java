package markbridge;

import markbridge.loss.ConversionMetrics;
import markbridge.loss.LossReport;
import markbridge.transform.table.TableCoverage;

/**
 * Output of one conversion. {@code outputText} is always present; anything that
 * did not survive is described by the loss report.
 */
public record ConversionResult(String outputText, LossReport lossReport, ConversionMetrics metrics,
		TableCoverage tableCoverage) {
}
