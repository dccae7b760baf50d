package markbridge.parse;

import markbridge.ast.doc.Document;

import java.util.List;

/**
 * Parsed tree plus the structural errors met on the way. Parsers recover from
 * errors so that output text can be measured; callers converting a source treat
 * any error as fatal.
 */
public record ParseResult(Document document, List<ParseDiagnostic> errors) {
	public boolean hasErrors() {
		return !errors.isEmpty();
	}

	public Document orThrow(String source) {
		if (hasErrors()) {
			throw SourceParseException.of(errors.get(0), source);
		}
		return document;
	}
}
