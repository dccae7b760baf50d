package markbridge.ast.doc;

import java.util.List;

public record TableRow(List<TableCell> cells) {
}
