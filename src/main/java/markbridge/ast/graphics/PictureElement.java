package markbridge.ast.graphics;

public sealed interface PictureElement permits PathElement, NamedCoordinate, LabelElement {
}
