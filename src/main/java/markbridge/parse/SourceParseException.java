package markbridge.parse;

import markbridge.ast.SourceSpan;

/**
 * Input that the structural parser cannot recognise. Fatal for the document.
 */
public class SourceParseException extends RuntimeException {
	private final SourceSpan span;
	private final int line;
	private final int column;

	public SourceParseException(String message, SourceSpan span, int line, int column) {
		super(message + (line > 0 ? " at " + line + ":" + column : ""));
		this.span = span;
		this.line = line;
		this.column = column;
	}

	public static SourceParseException of(ParseDiagnostic diagnostic, String source) {
		SourceSpan span = diagnostic.span();
		if (!span.isKnown()) {
			return new SourceParseException(diagnostic.message(), span, 0, 0);
		}
		return new SourceParseException(diagnostic.message(), span, span.line(source), span.column(source));
	}

	public SourceSpan span() {
		return span;
	}

	public int line() {
		return line;
	}

	public int column() {
		return column;
	}
}
