package markbridge.ast.script;

import java.util.List;

public record DictExpr(List<CallArg> entries) implements Expr {
}
