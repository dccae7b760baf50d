package markbridge.ast.doc;

/**
 * Table-wide border idiom.
 */
public enum BorderStyle {
	/** Booktabs-style horizontal rules only. */
	RULED,
	/** Every cell boxed. */
	GRID,
	/** No rules at all. */
	NONE,
	/** Explicit rules that are neither of the above. */
	CUSTOM
}
