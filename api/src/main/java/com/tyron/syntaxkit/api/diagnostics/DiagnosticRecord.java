package com.tyron.syntaxkit.api.diagnostics;

import com.tyron.syntaxkit.api.source.SourceLocation;
import com.tyron.syntaxkit.api.source.SourceSpan;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A position-verified diagnostic, ready to be rendered.
 *
 * @param identity       identity of the diagnosed document
 * @param offendingText  full text of the node the parser blamed, trivia included
 * @param nodeLocation   start of that node's content
 * @param contextLines   lines around {@code location}, clipped to the document
 * @param contextRange   {@code "N"}, {@code "A-B"} or {@code "0-0"} when there is no context
 * @param sourceLineText text of the line {@code location} is on
 * @param caretLineText  spaces up to {@code location}'s column, then {@code ^}
 */
public record DiagnosticRecord(
        String identity,
        String message,
        DiagnosticSeverity severity,
        SourceLocation location,
        SourceSpan span,
        PositionConfidence positionConfidence,
        @Nullable String offendingText,
        @Nullable SourceLocation nodeLocation,
        List<ContextLine> contextLines,
        String contextRange,
        String sourceLineText,
        String caretLineText,
        List<FixItSuggestion> fixIts,
        List<Note> notes
) {

    public DiagnosticRecord {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(positionConfidence, "positionConfidence");
        Objects.requireNonNull(contextRange, "contextRange");
        Objects.requireNonNull(sourceLineText, "sourceLineText");
        Objects.requireNonNull(caretLineText, "caretLineText");
        contextLines = List.copyOf(contextLines);
        fixIts = List.copyOf(fixIts);
        notes = List.copyOf(notes);
    }

    public int line() {
        return location.line();
    }

    public int column() {
        return location.column();
    }

    public boolean isError() {
        return severity == DiagnosticSeverity.ERROR;
    }
}
