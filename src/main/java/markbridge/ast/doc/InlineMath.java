package markbridge.ast.doc;

import markbridge.ast.math.MathNode;

public record InlineMath(MathNode math) implements DocNode {
}
