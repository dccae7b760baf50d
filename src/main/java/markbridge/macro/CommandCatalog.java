package markbridge.macro;

import markbridge.transform.SymbolTable;

import java.util.Map;
import java.util.Set;

/**
 * Command names the pipeline understands without a user definition: the symbol
 * table plus the structural and layout commands the LaTeX parser handles.
 */
public final class CommandCatalog {
	/** Structural commands the parser maps to document nodes. */
	public static final Set<String> STRUCTURAL = Set.of("begin", "end", "part", "chapter", "chapter*", "section",
			"section*", "subsection", "subsection*", "subsubsection", "subsubsection*", "paragraph", "paragraph*",
			"subparagraph", "label", "ref", "eqref", "autoref", "cref", "Cref", "pageref", "cite", "citep",
			"citet", "citealp", "citeauthor", "citeyear", "parencite", "textcite", "nocite", "textbf", "textit",
			"emph", "texttt", "textsl", "textsc", "textup", "textmd", "textsf", "textrm", "textnormal", "mbox",
			"href", "url", "item", "includegraphics", "caption", "bibliography", "bibliographystyle", "bibitem",
			"left", "right", "middle", "bigl", "bigr", "Bigl", "Bigr", "big", "Big", "multicolumn",
			"multirow", "hline", "toprule", "midrule", "bottomrule", "cline", "cmidrule", "cellcolor", "rowcolor",
			"newline", "par", "setmainfont", "\\", "ldots", "LaTeX", "TeX", "(", ")", "[", "]", "%", "&", "$", "#", "_",
			"{", "}", "-", "/", "@", "displaystyle", "textstyle", "scriptstyle", "limits", "nolimits", "nonumber",
			"notag", "!", "not", "and", "'", "`", "\"", "^", "~", "=", ".", "c", "v", "u", "H");

	/**
	 * Layout and preamble commands the parser drops, with the number of mandatory
	 * arguments dropped along with them. Optional bracket arguments are dropped too.
	 */
	public static final Map<String, Integer> IGNORED = Map.ofEntries(
			Map.entry("documentclass", 1), Map.entry("usepackage", 1), Map.entry("RequirePackage", 1),
			Map.entry("title", 1), Map.entry("author", 1), Map.entry("date", 1), Map.entry("maketitle", 0),
			Map.entry("tableofcontents", 0), Map.entry("listoffigures", 0), Map.entry("listoftables", 0),
			Map.entry("centering", 0), Map.entry("raggedright", 0), Map.entry("raggedleft", 0),
			Map.entry("noindent", 0), Map.entry("indent", 0), Map.entry("vfill", 0), Map.entry("hfill", 0),
			Map.entry("smallskip", 0), Map.entry("medskip", 0), Map.entry("bigskip", 0), Map.entry("newpage", 0),
			Map.entry("clearpage", 0), Map.entry("pagebreak", 0), Map.entry("linebreak", 0), Map.entry("small", 0),
			Map.entry("footnotesize", 0), Map.entry("scriptsize", 0), Map.entry("tiny", 0), Map.entry("normalsize", 0),
			Map.entry("large", 0), Map.entry("Large", 0), Map.entry("LARGE", 0), Map.entry("huge", 0),
			Map.entry("Huge", 0), Map.entry("bfseries", 0), Map.entry("itshape", 0), Map.entry("ttfamily", 0),
			Map.entry("rmfamily", 0), Map.entry("sffamily", 0), Map.entry("normalfont", 0), Map.entry("protect", 0),
			Map.entry("relax", 0), Map.entry("arraystretch", 0), Map.entry("tabcolsep", 0), Map.entry("appendix", 0),
			Map.entry("frontmatter", 0), Map.entry("mainmatter", 0), Map.entry("backmatter", 0),
			Map.entry("makeatletter", 0), Map.entry("makeatother", 0), Map.entry("strut", 0),
			Map.entry("allowbreak", 0), Map.entry("nobreak", 0), Map.entry("sloppy", 0), Map.entry("selectfont", 0),
			Map.entry("geometry", 1), Map.entry("hypersetup", 1), Map.entry("setlength", 2),
			Map.entry("addtolength", 2), Map.entry("setcounter", 2), Map.entry("addtocounter", 2),
			Map.entry("pagestyle", 1), Map.entry("thispagestyle", 1), Map.entry("vspace", 1), Map.entry("vspace*", 1),
			Map.entry("hspace", 1), Map.entry("hspace*", 1), Map.entry("graphicspath", 1), Map.entry("newtheorem", 2),
			Map.entry("usetikzlibrary", 1), Map.entry("pgfplotsset", 1), Map.entry("phantom", 1),
			Map.entry("hphantom", 1), Map.entry("vphantom", 1), Map.entry("fontsize", 2), Map.entry("color", 1),
			Map.entry("definecolor", 3), Map.entry("input", 1), Map.entry("include", 1));

	private final SymbolTable symbols;

	public CommandCatalog(SymbolTable symbols) {
		this.symbols = symbols;
	}

	public boolean isKnown(String name) {
		return STRUCTURAL.contains(name) || IGNORED.containsKey(name) || symbols.hasLatex(name)
				|| DefinitionReader.isDefinitionPrimitive(name);
	}

	public SymbolTable symbols() {
		return symbols;
	}
}
