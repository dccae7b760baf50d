package markbridge.transform;

/**
 * How a symbol table entry is converted.
 */
public enum Strategy {
	/** Name substitution; arguments keep their order. */
	DIRECT,
	/** Arguments are permuted and may receive Typst argument names. */
	REORDER,
	FRACTION,
	ROOT,
	ACCENT,
	/** Upright operator name such as {@code \sin} or {@code \operatorname}. */
	OPERATOR,
	/** Argument is a text run, not math. */
	TEXT,
	/** Font style wrapper such as {@code \mathbb}. */
	STYLE,
	/** Large operator taking limits through sub/superscripts. */
	BIG_OPERATOR,
	/** Infix command splitting its group, such as {@code \over}. */
	INFIX
}
