package markbridge.parse;

import markbridge.ast.SourceSpan;

public record ParseDiagnostic(String message, SourceSpan span) {
}
