package com.tyron.syntaxkit.api.diagnostics;

/**
 * How far the reported location of a {@link DiagnosticRecord} can be trusted.
 */
public enum PositionConfidence {
    /**
     * The parser's offset, converted as is.
     */
    EXACT,
    /**
     * Moved to where the text quoted in the message actually occurs.
     */
    CORRECTED,
    /**
     * The parser's offset was outside the document and has been clamped to its bounds.
     */
    CLIPPED
}
