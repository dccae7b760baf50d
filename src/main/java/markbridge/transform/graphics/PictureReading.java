package markbridge.transform.graphics;

import markbridge.ast.graphics.VectorPicture;

import java.util.List;

/**
 * Result of reading picture source: the supported part as a {@link VectorPicture}
 * and one entry per primitive that was skipped.
 */
record PictureReading(VectorPicture picture, List<Skipped> skipped) {
	/** A primitive outside the supported path subset; {@code snippet} is its source text. */
	record Skipped(String name, String snippet) {
	}
}
