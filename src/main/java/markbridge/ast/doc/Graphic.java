package markbridge.ast.doc;

import markbridge.ast.Language;
import markbridge.ast.graphics.VectorPicture;

/**
 * Vector picture. Parsers fill {@code source}/{@code language}; the converter
 * fills {@code picture} with the normalized path form.
 */
public record Graphic(String source, Language language, VectorPicture picture) implements DocNode {
}
