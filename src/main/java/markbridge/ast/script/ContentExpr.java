package markbridge.ast.script;

import markbridge.ast.doc.DocNode;

import java.util.List;

/**
 * Content block {@code [ ... ]}.
 */
public record ContentExpr(List<DocNode> body) implements Expr {
}
