package markbridge.ast.script;

import java.util.List;

public record ArrayExpr(List<Expr> items) implements Expr {
}
