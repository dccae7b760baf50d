package markbridge.ast.doc;

/**
 * External image. {@code width} is kept in source syntax-free form (e.g. "80%",
 * "5cm") or null.
 */
public record Image(String path, String width) implements DocNode {
}
