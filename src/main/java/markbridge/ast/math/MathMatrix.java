package markbridge.ast.math;

import java.util.List;

/**
 * Matrix-like layout. {@code kind} is one of matrix, pmatrix, bmatrix, Bmatrix,
 * vmatrix, Vmatrix or cases.
 */
public record MathMatrix(String kind, List<List<MathNode>> rows) implements MathNode {
}
