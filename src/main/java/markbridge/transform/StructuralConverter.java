package markbridge.transform;

import markbridge.ConversionOptions;
import markbridge.Direction;
import markbridge.Feature;
import markbridge.ast.Language;
import markbridge.ast.doc.BibEntry;
import markbridge.ast.doc.Bibliography;
import markbridge.ast.doc.BlockMath;
import markbridge.ast.doc.CodeBlockNode;
import markbridge.ast.doc.Conditional;
import markbridge.ast.doc.Directive;
import markbridge.ast.doc.DocNode;
import markbridge.ast.doc.DocNodes;
import markbridge.ast.doc.Document;
import markbridge.ast.doc.Embed;
import markbridge.ast.doc.ForLoop;
import markbridge.ast.doc.Graphic;
import markbridge.ast.doc.InlineMath;
import markbridge.ast.doc.LetBinding;
import markbridge.ast.doc.LossMarker;
import markbridge.ast.doc.Opaque;
import markbridge.ast.doc.PageSetup;
import markbridge.ast.doc.Paragraph;
import markbridge.ast.doc.Raw;
import markbridge.ast.doc.Reference;
import markbridge.ast.doc.Strong;
import markbridge.ast.doc.TableNode;
import markbridge.ast.doc.Text;
import markbridge.ast.math.MathNode;
import markbridge.loss.LossKind;
import markbridge.loss.LossRecord;
import markbridge.loss.LossTracker;
import markbridge.print.LatexPrinter;
import markbridge.print.TypstPrinter;
import markbridge.transform.graphics.GraphicsConverter;
import markbridge.transform.table.TableConverter;
import markbridge.transform.table.TableCoverage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts a normalized document tree into the tree of the target language.
 *
 * Each node maps to zero or more target nodes. Nothing here fails for a single
 * construct: whatever has no counterpart becomes a {@link LossMarker} backed by a
 * loss record, so the output keeps the document order of the input.
 */
public final class StructuralConverter {
	private static final Logger log = LoggerFactory.getLogger(StructuralConverter.class);
	private static final Pattern SHARED_LENGTH = Pattern.compile("\\d+(\\.\\d+)?(cm|mm|pt|in|em)");
	private static final Set<String> CLASS_FONT_SIZES = Set.of("10pt", "11pt", "12pt");

	private final Direction direction;
	private final ConversionOptions options;
	private final LossTracker tracker;
	private final MathConverter math;
	private final TableConverter tables;
	private final GraphicsConverter graphics;

	public StructuralConverter(Direction direction, ConversionOptions options, SymbolTable symbols,
			LossTracker tracker, TableCoverage coverage) {
		this.direction = direction;
		this.options = options;
		this.tracker = tracker;
		this.math = new MathConverter(symbols, tracker);
		this.tables = new TableConverter(direction, tracker, coverage, this::convertAll);
		this.graphics = new GraphicsConverter(tracker);
	}

	public Document convert(Document document) {
		Document out = new Document(convertAll(document.children()));
		log.debug("converted {} top-level nodes into {}", document.children().size(), out.children().size());
		return out;
	}

	public MathNode convertMath(MathNode node) {
		return direction == Direction.LATEX_TO_TYPST ? math.toTypst(node) : math.toLatex(node);
	}

	private List<DocNode> convertAll(List<DocNode> nodes) {
		List<DocNode> out = new ArrayList<>();
		for (DocNode node : nodes) {
			out.addAll(convert(node));
		}
		return out;
	}

	private List<DocNode> convert(DocNode node) {
		if (node instanceof InlineMath m) {
			return List.of(new InlineMath(convertMath(m.math())));
		}
		if (node instanceof BlockMath m) {
			return List.of(new BlockMath(convertMath(m.math()), m.label(), m.numbered()));
		}
		if (node instanceof TableNode t) {
			if (!options.enabled(Feature.TABLES)) {
				return disabled(Feature.TABLES, "table", sourceText(t));
			}
			return tables.convert(t);
		}
		if (node instanceof Graphic g) {
			if (!options.enabled(Feature.GRAPHICS)) {
				return disabled(Feature.GRAPHICS, "graphic", g.source());
			}
			if (g.language() == direction.target()) {
				return List.of(g);
			}
			return graphics.convert(g, direction);
		}
		if (node instanceof Reference r) {
			if (!options.enabled(Feature.REFERENCES)) {
				return disabled(Feature.REFERENCES, r.kind().name().toLowerCase(Locale.ROOT),
						referenceSource(r));
			}
			return List.of(r);
		}
		if (node instanceof Bibliography b) {
			if (!options.enabled(Feature.REFERENCES)) {
				return disabled(Feature.REFERENCES, "bibliography", b.source());
			}
			return List.of(bibliography(b));
		}
		if (node instanceof BibEntry e) {
			return bibEntry(e);
		}
		if (node instanceof Raw raw) {
			return raw(raw);
		}
		if (node instanceof Opaque o) {
			String id = o.lossId();
			if (id == null) {
				id = tracker.record(LossKind.OTHER, null, "construct kept as source", o.source(), "text").id();
			}
			return List.of(new LossMarker(id, o.source()));
		}
		if (node instanceof LetBinding || node instanceof ForLoop || node instanceof Conditional
				|| node instanceof Embed || node instanceof CodeBlockNode || node instanceof Directive) {
			String source = scriptSource(node);
			LossRecord loss = tracker.record(LossKind.UNSUPPORTED_EXPRESSION, null,
					"unevaluated script construct", source, "text");
			return List.of(new LossMarker(loss.id(), source));
		}
		if (node instanceof PageSetup setup) {
			return pageSetup(setup);
		}
		return List.of(DocNodes.rebuild(node, this::convertAll));
	}

	/** Keeps the settings both languages express; each dropped one is a warning. */
	private List<DocNode> pageSetup(PageSetup setup) {
		if (direction == Direction.TYPST_TO_LATEX && !options.documentWrapper()) {
			tracker.warn("page setup dropped without a document wrapper: " + setup.describe());
			return List.of();
		}
		Map<String, String> margins = new LinkedHashMap<>();
		for (Map.Entry<String, String> e : setup.orderedMargins()) {
			if (SHARED_LENGTH.matcher(e.getValue()).matches()) {
				margins.put(e.getKey(), e.getValue());
			} else {
				tracker.warn("margin " + e.getValue() + " is not carried across languages");
			}
		}
		String paper = setup.paper();
		if (paper != null && direction == Direction.TYPST_TO_LATEX && PageSetup.latexPaper(paper) == null) {
			tracker.warn("paper " + paper + " has no LaTeX class option");
			paper = null;
		}
		String size = setup.fontSize();
		if (size != null && (!SHARED_LENGTH.matcher(size).matches()
				|| direction == Direction.TYPST_TO_LATEX && !CLASS_FONT_SIZES.contains(size))) {
			tracker.warn("font size " + size + " is not carried across languages");
			size = null;
		}
		Integer columns = setup.columns();
		if (columns != null && direction == Direction.TYPST_TO_LATEX && columns > 2) {
			tracker.warn(columns + " columns are not carried across languages");
			columns = null;
		}
		PageSetup out = new PageSetup(paper, margins, size, setup.font(), columns, setup.justify());
		return out.isEmpty() ? List.of() : List.of(out);
	}

	private List<DocNode> disabled(Feature feature, String name, String snippet) {
		LossRecord loss = tracker.record(LossKind.UNSUPPORTED_FEATURE, name,
				feature.name().toLowerCase(Locale.ROOT) + " conversion is disabled", snippet, "text");
		return List.of(new LossMarker(loss.id(), snippet));
	}

	/** The table as it reads in the source language, for the passthrough marker. */
	private String sourceText(TableNode table) {
		Document single = new Document(List.of(table));
		String text = direction.source() == Language.LATEX ? new LatexPrinter(false, false).print(single)
				: new TypstPrinter(false).print(single);
		return text.strip();
	}

	private String referenceSource(Reference r) {
		String keys = String.join(",", r.keys());
		if (direction.source() == Language.LATEX) {
			switch (r.kind()) {
				case CITE:
					return "\\cite{" + keys + "}";
				case LABEL:
					return "\\label{" + keys + "}";
				default:
					return "\\ref{" + keys + "}";
			}
		}
		switch (r.kind()) {
			case CITE:
				return "#cite(<" + keys + ">)";
			case LABEL:
				return "<" + keys + ">";
			default:
				return "@" + keys;
		}
	}

	/** Typst names the database file, LaTeX names it without the extension. */
	private Bibliography bibliography(Bibliography b) {
		if (b.style() != null) {
			tracker.warn("bibliography style " + b.style() + " is not carried across languages");
		}
		String source = b.source();
		if (direction == Direction.LATEX_TO_TYPST) {
			return new Bibliography(source.endsWith(".bib") ? source : source + ".bib", null);
		}
		return new Bibliography(source.endsWith(".bib") ? source.substring(0, source.length() - 4) : source,
				null);
	}

	private List<DocNode> bibEntry(BibEntry entry) {
		List<DocNode> content = convertAll(entry.content());
		if (direction == Direction.TYPST_TO_LATEX) {
			return List.of(new BibEntry(entry.key(), content));
		}
		LossRecord loss = tracker.record(LossKind.OTHER, "bibitem",
				"inline bibliography entry written as a paragraph", entry.key(), "text");
		List<DocNode> paragraph = new ArrayList<>();
		paragraph.add(new LossMarker(loss.id(), "\\bibitem{" + entry.key() + "}"));
		paragraph.add(new Strong(List.of(new Text("[" + entry.key() + "]"))));
		paragraph.add(new Text(" "));
		paragraph.addAll(content);
		return List.of(new Paragraph(paragraph));
	}

	private List<DocNode> raw(Raw raw) {
		if (raw.language() == direction.target()) {
			return List.of(raw);
		}
		if (raw.text().isBlank()) {
			return List.of(new Text(raw.text()));
		}
		String text = raw.text().strip();
		LossKind kind = text.startsWith("\\") ? LossKind.UNKNOWN_COMMAND : LossKind.OTHER;
		LossRecord loss = tracker.record(kind, null, "source construct has no counterpart", text, "text");
		return List.of(new LossMarker(loss.id(), text));
	}

	private static String scriptSource(DocNode node) {
		if (node instanceof LetBinding l) {
			return l.source();
		}
		if (node instanceof ForLoop f) {
			return f.source();
		}
		if (node instanceof Conditional c) {
			return c.source();
		}
		if (node instanceof Embed e) {
			return e.source();
		}
		if (node instanceof CodeBlockNode c) {
			return c.source();
		}
		return ((Directive) node).source();
	}
}
