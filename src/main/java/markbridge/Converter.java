package markbridge;

import markbridge.ast.Language;
import markbridge.ast.doc.Document;
import markbridge.ast.doc.InlineMath;
import markbridge.ast.math.MathNode;
import markbridge.eval.MiniEvaluator;
import markbridge.loss.ConversionMetrics;
import markbridge.loss.LossReport;
import markbridge.loss.LossTracker;
import markbridge.loss.MetricsCollector;
import markbridge.macro.CommandCatalog;
import markbridge.macro.MacroEngine;
import markbridge.parse.ParseResult;
import markbridge.parse.SourceParseException;
import markbridge.parse.latex.LatexParser;
import markbridge.parse.latex.TexLexer;
import markbridge.parse.latex.TexToken;
import markbridge.parse.typst.TypstParser;
import markbridge.print.LatexPrinter;
import markbridge.print.TypstPrinter;
import markbridge.transform.StructuralConverter;
import markbridge.transform.SymbolTable;
import markbridge.transform.table.TableCoverage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point of a single conversion: parse, pre-resolve, convert, print.
 *
 * Every call owns its macro table, evaluation environment, loss tracker and
 * coverage record, so one instance can serve any number of conversions.
 */
public final class Converter {
	private static final Logger log = LoggerFactory.getLogger(Converter.class);

	private final SymbolTable symbols;

	public Converter() {
		this(SymbolTable.standard());
	}

	public Converter(SymbolTable symbols) {
		this.symbols = symbols;
	}

	/**
	 * Converts {@code sourceText}.
	 *
	 * @throws SourceParseException if the source is structurally invalid
	 */
	public ConversionResult convert(String sourceText, Direction direction, ConversionOptions options) {
		LossTracker tracker = new LossTracker();
		TableCoverage coverage = new TableCoverage();
		StructuralConverter converter = new StructuralConverter(direction, options, symbols, tracker, coverage);
		String output;
		ConversionMetrics metrics;
		if (options.mathOnly()) {
			MathNode converted = converter.convertMath(parseMath(sourceText, direction, options, tracker));
			output = direction.target() == Language.TYPST ? new TypstPrinter(options.lossComments()).printMath(converted)
					: new LatexPrinter(options.lossComments(), false).printMath(converted);
			metrics = MetricsCollector.measure(new Document(List.of(new InlineMath(converted))), 0);
		} else {
			Document target = converter.convert(parse(sourceText, direction, options, tracker));
			output = print(target, direction.target(), options);
			metrics = MetricsCollector.measure(target, 0);
		}
		LossReport report = tracker.report(direction.source().id(), direction.target().id());
		log.info("{} -> {}: {} losses, {} warnings, {} loss markers", direction.source().id(),
				direction.target().id(), report.losses().size(), report.warnings().size(), metrics.lossMarkers());
		return new ConversionResult(output, report, metrics, coverage);
	}

	/**
	 * Structural metrics of a text in {@code language}, as the repair gate compares
	 * them. Parse errors are counted instead of thrown.
	 */
	public ConversionMetrics measure(String text, Language language, ConversionOptions options) {
		LossTracker scratch = new LossTracker();
		ParseResult result;
		if (language == Language.LATEX) {
			result = new LatexParser(symbols, null).parse(text);
		} else {
			result = new TypstParser(symbols).parse(text);
			if (!result.hasErrors()) {
				Document evaluated = new MiniEvaluator(scratch, options.maxLoopIterations(), options.maxCallDepth())
						.evaluate(result.document());
				result = new ParseResult(evaluated, result.errors());
			}
		}
		return MetricsCollector.measure(result.document(), result.errors().size());
	}

	private Document parse(String source, Direction direction, ConversionOptions options, LossTracker tracker) {
		if (direction.source() == Language.LATEX) {
			List<TexToken> expanded = expand(source, options, tracker);
			return new LatexParser(symbols, tracker).parse(expanded).orThrow(source);
		}
		Document raw = new TypstParser(symbols).parse(source).orThrow(source);
		return new MiniEvaluator(tracker, options.maxLoopIterations(), options.maxCallDepth()).evaluate(raw);
	}

	private MathNode parseMath(String source, Direction direction, ConversionOptions options, LossTracker tracker) {
		if (direction.source() == Language.LATEX) {
			List<TexToken> expanded = expand(source, options, tracker);
			return new LatexParser(symbols, tracker).parseMath(expanded);
		}
		TypstParser parser = new TypstParser(symbols);
		MathNode math = parser.parseMath(source);
		if (!parser.errors().isEmpty()) {
			throw SourceParseException.of(parser.errors().get(0), source);
		}
		return math;
	}

	/** Lexes and expands macros; lexical errors are fatal. */
	private List<TexToken> expand(String source, ConversionOptions options, LossTracker tracker) {
		TexLexer lexer = new TexLexer();
		List<TexToken> tokens = lexer.lex(source);
		if (!lexer.errors().isEmpty()) {
			throw SourceParseException.of(lexer.errors().get(0), source);
		}
		return new MacroEngine(new CommandCatalog(symbols), tracker, options.maxMacroDepth()).expand(tokens);
	}

	private static String print(Document target, Language language, ConversionOptions options) {
		if (language == Language.TYPST) {
			return new TypstPrinter(options.lossComments()).print(target);
		}
		return new LatexPrinter(options.lossComments(), options.documentWrapper()).print(target);
	}
}
