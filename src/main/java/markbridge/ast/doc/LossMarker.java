package markbridge.ast.doc;

/**
 * Visible marker for a loss record, printed as a comment in the target language.
 * {@code snippet} is the untranslated source, possibly empty.
 */
public record LossMarker(String lossId, String snippet) implements DocNode {
	public static final String PREFIX = "mb:loss:";
}
