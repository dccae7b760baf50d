package markbridge.ast.doc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Page and font settings of a whole document: class options, geometry and main
 * font in LaTeX, {@code page}, {@code text} and {@code par} set rules in Typst.
 *
 * Unset fields are null. {@code paper} uses Typst's paper names; {@code margins}
 * maps one of {@link #MARGIN_SIDES} to a length.
 */
public record PageSetup(String paper, Map<String, String> margins, String fontSize, String font, Integer columns,
		Boolean justify) implements DocNode {

	public static final List<String> MARGIN_SIDES = List.of("all", "left", "right", "top", "bottom");

	/** LaTeX paper option to Typst paper name. */
	public static final Map<String, String> PAPERS = Map.of(
			"a4paper", "a4",
			"a5paper", "a5",
			"b5paper", "iso-b5",
			"letterpaper", "us-letter",
			"legalpaper", "us-legal",
			"executivepaper", "us-executive");

	public static final PageSetup NONE = new PageSetup(null, Map.of(), null, null, null, null);

	public PageSetup {
		margins = Map.copyOf(margins);
	}

	public boolean isEmpty() {
		return equals(NONE);
	}

	public PageSetup withPaper(String value) {
		return new PageSetup(value, margins, fontSize, font, columns, justify);
	}

	/** Sets one side; {@code all} replaces every side set before. */
	public PageSetup withMargin(String side, String value) {
		Map<String, String> next = new LinkedHashMap<>(side.equals("all") ? Map.of() : margins);
		next.put(side, value);
		return new PageSetup(paper, next, fontSize, font, columns, justify);
	}

	public PageSetup withFontSize(String value) {
		return new PageSetup(paper, margins, value, font, columns, justify);
	}

	public PageSetup withFont(String value) {
		return new PageSetup(paper, margins, fontSize, value, columns, justify);
	}

	public PageSetup withColumns(Integer value) {
		return new PageSetup(paper, margins, fontSize, font, value, justify);
	}

	public PageSetup withJustify(Boolean value) {
		return new PageSetup(paper, margins, fontSize, font, columns, value);
	}

	/** Settings of {@code later} override this one's where they are set. */
	public PageSetup merge(PageSetup later) {
		PageSetup out = this;
		if (later.paper != null) {
			out = out.withPaper(later.paper);
		}
		for (String side : MARGIN_SIDES) {
			if (later.margins.containsKey(side)) {
				out = out.withMargin(side, later.margins.get(side));
			}
		}
		if (later.fontSize != null) {
			out = out.withFontSize(later.fontSize);
		}
		if (later.font != null) {
			out = out.withFont(later.font);
		}
		if (later.columns != null) {
			out = out.withColumns(later.columns);
		}
		if (later.justify != null) {
			out = out.withJustify(later.justify);
		}
		return out;
	}

	/** All settings found among {@code nodes}, later ones winning. */
	public static PageSetup collect(List<DocNode> nodes) {
		PageSetup out = NONE;
		for (DocNode node : nodes) {
			if (node instanceof PageSetup setup) {
				out = out.merge(setup);
			}
		}
		return out;
	}

	/** LaTeX paper option for a Typst paper name, or null when LaTeX has none. */
	public static String latexPaper(String typstPaper) {
		for (Map.Entry<String, String> e : PAPERS.entrySet()) {
			if (e.getValue().equals(typstPaper)) {
				return e.getKey();
			}
		}
		return null;
	}

	/** Short human-readable list of the settings, for warnings. */
	public String describe() {
		List<String> parts = new ArrayList<>();
		if (paper != null) {
			parts.add("paper " + paper);
		}
		for (Map.Entry<String, String> e : orderedMargins()) {
			parts.add((e.getKey().equals("all") ? "margin " : e.getKey() + " margin ") + e.getValue());
		}
		if (fontSize != null) {
			parts.add("size " + fontSize);
		}
		if (font != null) {
			parts.add("font " + font);
		}
		if (columns != null) {
			parts.add(columns + " columns");
		}
		if (justify != null) {
			parts.add(justify ? "justified" : "ragged right");
		}
		return String.join(", ", parts);
	}

	/** Margin sides in a fixed order, for printing. */
	public List<Map.Entry<String, String>> orderedMargins() {
		return MARGIN_SIDES.stream().filter(margins::containsKey).map(s -> Map.entry(s, margins.get(s))).toList();
	}
}
