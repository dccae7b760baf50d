package markbridge.ast.doc;

import markbridge.ast.script.Expr;

/**
 * {@code #if cond [..] else [..]}; {@code otherwise} is null without an else
 * branch and may itself be a conditional expression for {@code else if}.
 */
public record Conditional(Expr condition, Expr then, Expr otherwise, String source) implements DocNode {
}
