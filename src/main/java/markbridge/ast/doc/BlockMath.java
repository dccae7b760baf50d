package markbridge.ast.doc;

import markbridge.ast.math.MathNode;

/**
 * Display equation. {@code label} is null when the equation is not referenced.
 */
public record BlockMath(MathNode math, String label, boolean numbered) implements DocNode {
	public BlockMath withLabel(String newLabel) {
		return new BlockMath(math, newLabel, numbered);
	}
}
