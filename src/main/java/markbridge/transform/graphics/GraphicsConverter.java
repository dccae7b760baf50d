package markbridge.transform.graphics;

import markbridge.Direction;
import markbridge.ast.Language;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.Graphic;
import markbridge.ast.doc.LossMarker;
import markbridge.ast.graphics.DrawStyle;
import markbridge.ast.graphics.PathElement;
import markbridge.ast.graphics.PictureElement;
import markbridge.ast.graphics.VectorPicture;
import markbridge.loss.LossKind;
import markbridge.loss.LossRecord;
import markbridge.loss.LossTracker;
import markbridge.transform.table.ColorMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts vector pictures between TikZ and CeTZ through the normalized
 * {@link VectorPicture} form.
 *
 * Each skipped primitive and each color without a counterpart records one
 * {@code unsupported-graphics} loss; their markers precede the converted picture.
 */
public final class GraphicsConverter {
	private static final Logger log = LoggerFactory.getLogger(GraphicsConverter.class);

	private final LossTracker tracker;

	public GraphicsConverter(LossTracker tracker) {
		this.tracker = tracker;
	}

	public List<DocNode> convert(Graphic graphic, Direction direction) {
		PictureReading reading = graphic.language() == Language.LATEX ? new TikzReader().read(graphic.source())
				: new CetzReader().read(graphic.source());
		List<DocNode> out = new ArrayList<>();
		for (PictureReading.Skipped skipped : reading.skipped()) {
			LossRecord loss = tracker.record(LossKind.UNSUPPORTED_GRAPHICS, skipped.name(),
					"picture primitive " + skipped.name() + " is not converted", skipped.snippet(), "graphics");
			out.add(new LossMarker(loss.id(), skipped.snippet()));
		}
		VectorPicture picture = recolor(reading.picture(), direction, out);
		String source = direction.target() == Language.TYPST ? new CetzWriter().write(picture)
				: new TikzWriter().write(picture);
		out.add(new Graphic(source, direction.target(), picture));
		log.debug("picture with {} elements converted, {} primitives skipped", picture.elements().size(),
				reading.skipped().size());
		return out;
	}

	private VectorPicture recolor(VectorPicture picture, Direction direction, List<DocNode> markers) {
		List<PictureElement> out = new ArrayList<>();
		for (PictureElement element : picture.elements()) {
			if (element instanceof PathElement path) {
				DrawStyle style = path.style();
				String stroke = color(style.stroke(), direction, markers);
				String fill = color(style.fill(), direction, markers);
				out.add(new PathElement(path.segments(), new DrawStyle(stroke, fill, style.dashed(),
						style.arrowStart(), style.arrowEnd(), style.thick())));
			} else {
				out.add(element);
			}
		}
		return new VectorPicture(List.copyOf(out));
	}

	private String color(String color, Direction direction, List<DocNode> markers) {
		if (color == null) {
			return null;
		}
		String mapped = direction == Direction.LATEX_TO_TYPST ? ColorMapper.toTypst(color)
				: ColorMapper.toLatex(color);
		if (mapped != null && !mapped.startsWith("[")) {
			return mapped;
		}
		LossRecord loss = tracker.record(LossKind.UNSUPPORTED_GRAPHICS, color,
				"picture color " + color + " approximated as black", color, "graphics");
		markers.add(new LossMarker(loss.id(), color));
		return "black";
	}
}
