package markbridge.ast.math;

import java.util.List;

public record MathRow(List<MathNode> items) implements MathNode {
	public static MathRow of(MathNode... nodes) {
		return new MathRow(List.of(nodes));
	}

	public boolean isEmpty() {
		return items.isEmpty();
	}
}
