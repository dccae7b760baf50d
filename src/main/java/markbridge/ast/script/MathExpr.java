package markbridge.ast.script;

import markbridge.ast.math.MathNode;

public record MathExpr(MathNode math, boolean block) implements Expr {
}
