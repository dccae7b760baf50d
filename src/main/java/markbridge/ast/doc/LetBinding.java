package markbridge.ast.doc;

import markbridge.ast.script.Expr;

import java.util.List;

/**
 * {@code #let name = value} or {@code #let name(params) = value}. {@code params}
 * is null for plain bindings.
 */
public record LetBinding(String name, List<String> params, Expr value, String source) implements DocNode {
}
