package markbridge.transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;

/**
 * One LaTeX command ↔ Typst function/symbol correspondence.
 *
 * {@code order.get(i)} is the LaTeX argument placed at Typst position {@code i};
 * {@code argumentNames.get(i)} names that Typst argument or is null. {@code optional}
 * marks a leading bracket argument ({@code \sqrt[n]{x}}).
 */
public record SymbolEntry(String latex, String typst, Strategy strategy, int arity, boolean optional,
		List<Integer> order, List<String> argumentNames, Associativity associativity, boolean limits) {
	public SymbolEntry {
		if (latex == null || typst == null) {
			throw new IllegalArgumentException("symbol entry needs both names");
		}
		strategy = strategy == null ? Strategy.DIRECT : strategy;
		associativity = associativity == null ? Associativity.NONE : associativity;
		order = order == null ? IntStream.range(0, arity).boxed().toList() : List.copyOf(order);
		if (order.size() != arity) {
			throw new IllegalArgumentException("order of '" + latex + "' does not match arity " + arity);
		}
		// argument names may contain nulls
		argumentNames = argumentNames == null
				? Collections.nCopies(arity, null)
				: Collections.unmodifiableList(new ArrayList<>(argumentNames));
	}

	public static SymbolEntry symbol(String latex, String typst) {
		return new SymbolEntry(latex, typst, Strategy.DIRECT, 0, false, null, null, null, false);
	}

	/** Typst position of LaTeX argument {@code latexIndex}. */
	public int typstPosition(int latexIndex) {
		return order.indexOf(latexIndex);
	}
}
