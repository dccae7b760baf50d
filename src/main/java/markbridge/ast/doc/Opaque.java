package markbridge.ast.doc;

import markbridge.ast.Language;

/**
 * Construct the evaluator did not resolve. The original source is kept verbatim;
 * {@code lossId} points at the loss already recorded for it.
 */
public record Opaque(String source, Language language, String lossId) implements DocNode {
}
