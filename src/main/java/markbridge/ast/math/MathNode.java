package markbridge.ast.math;

/**
 * Math expression tree.
 *
 * Parsers produce syntax-level nodes ({@link MathCall}, {@link MathIdent} with
 * source-language names, plus the purely syntactic attach/fraction/group forms);
 * the converter rewrites names into the target language and builds the
 * structural nodes named by the symbol table.
 */
public sealed interface MathNode permits MathRow, MathAtom, MathIdent, MathCall, MathFrac, MathRoot, MathAttach,
		MathAccent, MathDelimited, MathMatrix, MathText, MathOperatorName, MathLineBreak, MathPassthrough,
		MathEmbed {
}
