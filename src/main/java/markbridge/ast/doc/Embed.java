package markbridge.ast.doc;

import markbridge.ast.script.Expr;

/**
 * Expression embedded in markup with {@code #}.
 */
public record Embed(Expr expr, String source) implements DocNode {
}
