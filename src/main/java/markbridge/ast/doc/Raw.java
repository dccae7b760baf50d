package markbridge.ast.doc;

import markbridge.ast.Language;

/**
 * Verbatim text in a given language. Printed as-is when the printer targets that
 * language.
 */
public record Raw(String text, Language language) implements DocNode {
}
