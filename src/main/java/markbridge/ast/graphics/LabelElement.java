package markbridge.ast.graphics;

/**
 * Text placed at a point; {@code name} may be null.
 */
public record LabelElement(Point at, String text, String name) implements PictureElement {
}
