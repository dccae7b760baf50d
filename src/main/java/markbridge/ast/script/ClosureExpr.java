package markbridge.ast.script;

import java.util.List;

public record ClosureExpr(List<String> params, Expr body) implements Expr {
}
