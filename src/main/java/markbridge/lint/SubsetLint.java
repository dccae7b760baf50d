package markbridge.lint;

import markbridge.ConversionOptions;
import markbridge.ast.SourceSpan;
import markbridge.ast.doc.Document;
import markbridge.eval.MiniEvaluator;
import markbridge.loss.LossKind;
import markbridge.loss.LossRecord;
import markbridge.loss.LossTracker;
import markbridge.parse.ParseDiagnostic;
import markbridge.parse.ParseResult;
import markbridge.parse.typst.TypstParser;
import markbridge.transform.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reports the parts of a Typst source that fall outside the subset the converter
 * evaluates: parse errors, constructs the evaluator keeps opaque, and settings it
 * drops.
 *
 * Each issue carries the 1-based line and column of the construct. Dropped
 * settings and constructs produced by a function call have no position of their
 * own and are reported at line 0.
 */
public final class SubsetLint {
	private static final Logger log = LoggerFactory.getLogger(SubsetLint.class);
	public static final String WARNING = "warning";

	private final SymbolTable symbols;
	private final ConversionOptions options;

	public SubsetLint(SymbolTable symbols, ConversionOptions options) {
		this.symbols = symbols;
		this.options = options;
	}

	public SubsetLint() {
		this(SymbolTable.standard(), ConversionOptions.defaults());
	}

	/** One finding. {@code kind} is a loss kind id or {@link #WARNING}. */
	public record Issue(int line, int column, String kind, String message) {
		@Override
		public String toString() {
			return line == 0 ? kind + ": " + message : line + ":" + column + ": " + kind + ": " + message;
		}
	}

	public List<Issue> lint(String source) {
		List<Issue> issues = new ArrayList<>();
		ParseResult parsed = new TypstParser(symbols).parse(source);
		for (ParseDiagnostic error : parsed.errors()) {
			int line = error.span().isKnown() ? error.span().line(source) : 0;
			int column = error.span().isKnown() ? error.span().column(source) : 0;
			issues.add(new Issue(line, column, LossKind.PARSE_ERROR.id(), error.message()));
		}
		LossTracker scratch = new LossTracker();
		Document raw = parsed.document();
		new MiniEvaluator(scratch, options.maxLoopIterations(), options.maxCallDepth()).evaluate(raw);
		int from = 0;
		for (LossRecord loss : scratch.losses()) {
			int at = locate(source, loss.snippet(), from);
			if (at >= 0) {
				from = at + 1;
			}
			issues.add(at < 0
					? new Issue(0, 0, loss.kind().id(), loss.message())
					: new Issue(new SourceSpan(at, at).line(source), new SourceSpan(at, at).column(source),
							loss.kind().id(), loss.message()));
		}
		for (String warning : scratch.report("typst", "typst").warnings()) {
			issues.add(new Issue(0, 0, WARNING, warning));
		}
		log.debug("{} subset issues", issues.size());
		return issues;
	}

	/** Lints every {@code .typ} file below {@code root}; files without issues are left out. */
	public Map<Path, List<Issue>> lintTree(Path root) throws IOException {
		List<Path> files;
		try (Stream<Path> paths = Files.walk(root)) {
			files = paths
					.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().endsWith(".typ"))
					.sorted()
					.toList();
		}
		Map<Path, List<Issue>> out = new LinkedHashMap<>();
		for (Path file : files) {
			List<Issue> issues = lint(Files.readString(file));
			if (!issues.isEmpty()) {
				out.put(root.relativize(file), issues);
			}
		}
		log.info("linted {} files, {} with issues", files.size(), out.size());
		return out;
	}

	/** Offset of a loss snippet at or after {@code from}, else anywhere, else -1. */
	private static int locate(String source, String snippet, int from) {
		if (snippet == null || snippet.isBlank()) {
			return -1;
		}
		String needle = snippet.endsWith("...") ? snippet.substring(0, snippet.length() - 3) : snippet;
		needle = needle.strip();
		int at = source.indexOf(needle, from);
		return at >= 0 ? at : source.indexOf(needle);
	}
}
