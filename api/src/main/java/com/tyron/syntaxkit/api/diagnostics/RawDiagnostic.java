package com.tyron.syntaxkit.api.diagnostics;

import com.tyron.syntaxkit.api.path.NodePath;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A diagnostic as reported by a parser, before positions are verified.
 *
 * @param offset 0-based offset of the reported position; may be out of bounds
 * @param node   the node the parser blamed, if any
 */
public record RawDiagnostic(
        String message,
        DiagnosticSeverity severity,
        int offset,
        @Nullable NodePath node,
        List<RawFixIt> fixIts,
        List<RawNote> notes
) {

    public RawDiagnostic {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(severity, "severity");
        fixIts = List.copyOf(fixIts);
        notes = List.copyOf(notes);
    }

    public static RawDiagnostic error(String message, int offset) {
        return new RawDiagnostic(message, DiagnosticSeverity.ERROR, offset, null, List.of(), List.of());
    }

    public RawDiagnostic withNode(@Nullable NodePath node) {
        return new RawDiagnostic(message, severity, offset, node, fixIts, notes);
    }

    public RawDiagnostic withFixIts(List<RawFixIt> fixIts) {
        return new RawDiagnostic(message, severity, offset, node, fixIts, notes);
    }

    public RawDiagnostic withNotes(List<RawNote> notes) {
        return new RawDiagnostic(message, severity, offset, node, fixIts, notes);
    }
}
