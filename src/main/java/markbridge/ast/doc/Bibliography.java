package markbridge.ast.doc;

/**
 * Bibliography database reference ({@code \bibliography{refs}} /
 * {@code #bibliography("refs.bib")}). Style may be null.
 */
public record Bibliography(String source, String style) implements DocNode {
}
