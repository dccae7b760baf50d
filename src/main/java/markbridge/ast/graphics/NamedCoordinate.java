package markbridge.ast.graphics;

public record NamedCoordinate(String name, Point at) implements PictureElement {
}
