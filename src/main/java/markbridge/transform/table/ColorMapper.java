package markbridge.transform.table;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates cell fill colors between xcolor expressions and Typst color values.
 * Both directions return null for a color with no faithful counterpart.
 */
public final class ColorMapper {
	private static final Map<String, String> LATEX_NAMES = Map.ofEntries(Map.entry("black", "black"),
			Map.entry("white", "white"), Map.entry("gray", "gray"), Map.entry("red", "red"),
			Map.entry("green", "green"), Map.entry("blue", "blue"), Map.entry("yellow", "yellow"),
			Map.entry("orange", "orange"), Map.entry("purple", "purple"), Map.entry("teal", "teal"),
			Map.entry("olive", "olive"), Map.entry("lime", "lime"), Map.entry("cyan", "aqua"),
			Map.entry("magenta", "fuchsia"), Map.entry("lightgray", "silver"));
	private static final Map<String, String> TYPST_NAMES = Map.ofEntries(Map.entry("black", "black"),
			Map.entry("white", "white"), Map.entry("gray", "gray"), Map.entry("red", "red"),
			Map.entry("green", "green"), Map.entry("blue", "blue"), Map.entry("yellow", "yellow"),
			Map.entry("orange", "orange"), Map.entry("purple", "purple"), Map.entry("teal", "teal"),
			Map.entry("olive", "olive"), Map.entry("lime", "lime"), Map.entry("aqua", "cyan"),
			Map.entry("fuchsia", "magenta"), Map.entry("silver", "lightgray"));

	private static final Pattern HEX = Pattern.compile("#?([0-9A-Fa-f]{6})");
	private static final Pattern TINT = Pattern.compile("([a-z]+)!(\\d{1,3})(!black)?");
	private static final Pattern ADJUSTED = Pattern.compile("([a-z]+)\\.(lighten|darken)\\((\\d{1,3})%\\)");
	private static final Pattern RGB = Pattern.compile("rgb\\(\"#([0-9A-Fa-f]{3}|[0-9A-Fa-f]{6})\"\\)");
	private static final Pattern LUMA = Pattern.compile("luma\\((\\d{1,3})\\)");

	private ColorMapper() {
	}

	/** Typst color source for an xcolor expression. */
	public static String toTypst(String latex) {
		String color = latex.trim();
		String name = LATEX_NAMES.get(color);
		if (name != null) {
			return name;
		}
		Matcher hex = HEX.matcher(color);
		if (hex.matches()) {
			return "rgb(\"#" + hex.group(1).toLowerCase(Locale.ROOT) + "\")";
		}
		Matcher tint = TINT.matcher(color);
		if (tint.matches() && LATEX_NAMES.containsKey(tint.group(1))) {
			int percent = Integer.parseInt(tint.group(2));
			if (percent > 100) {
				return null;
			}
			String base = LATEX_NAMES.get(tint.group(1));
			String method = tint.group(3) == null ? "lighten" : "darken";
			return base + "." + method + "(" + (100 - percent) + "%)";
		}
		return null;
	}

	/**
	 * xcolor expression for a Typst color source. Values outside the named color
	 * model come back in the {@code [model]{spec}} form that {@code \cellcolor} takes.
	 */
	public static String toLatex(String typst) {
		String color = typst.trim();
		String name = TYPST_NAMES.get(color);
		if (name != null) {
			return name;
		}
		Matcher adjusted = ADJUSTED.matcher(color);
		if (adjusted.matches() && TYPST_NAMES.containsKey(adjusted.group(1))) {
			int percent = Integer.parseInt(adjusted.group(3));
			if (percent > 100) {
				return null;
			}
			String base = TYPST_NAMES.get(adjusted.group(1)) + "!" + (100 - percent);
			return adjusted.group(2).equals("lighten") ? base : base + "!black";
		}
		Matcher rgb = RGB.matcher(color);
		if (rgb.matches()) {
			String digits = rgb.group(1);
			if (digits.length() == 3) {
				StringBuilder sb = new StringBuilder();
				for (char ch : digits.toCharArray()) {
					sb.append(ch).append(ch);
				}
				digits = sb.toString();
			}
			return "[HTML]{" + digits.toUpperCase(Locale.ROOT) + "}";
		}
		Matcher luma = LUMA.matcher(color);
		if (luma.matches()) {
			int value = Math.min(255, Integer.parseInt(luma.group(1)));
			return "[gray]{" + String.format(Locale.ROOT, "%.2f", value / 255.0) + "}";
		}
		return null;
	}
}
