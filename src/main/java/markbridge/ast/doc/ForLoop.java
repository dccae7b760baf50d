package markbridge.ast.doc;

import markbridge.ast.script.Expr;

public record ForLoop(String variable, Expr iterable, Expr body, String source) implements DocNode {
}
