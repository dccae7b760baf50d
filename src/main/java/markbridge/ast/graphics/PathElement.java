package markbridge.ast.graphics;

import java.util.List;

/**
 * A drawn path: the first segment is always a {@link PathSegment.MoveTo}.
 */
public record PathElement(List<PathSegment> segments, DrawStyle style) implements PictureElement {
}
