package com.tyron.syntaxkit.api.diagnostics;

/**
 * Severity of a diagnostic produced by a parser.
 */
public enum DiagnosticSeverity {
    ERROR,
    WARNING,
    INFO
}
