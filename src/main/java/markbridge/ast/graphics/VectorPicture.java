package markbridge.ast.graphics;

import java.util.List;

/**
 * Normalized vector picture shared by the TikZ and CeTZ sides.
 */
public record VectorPicture(List<PictureElement> elements) {
}
