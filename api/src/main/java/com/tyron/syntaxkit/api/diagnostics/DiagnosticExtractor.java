package com.tyron.syntaxkit.api.diagnostics;

import com.tyron.syntaxkit.api.service.ServiceAccessHolder;
import com.tyron.syntaxkit.api.syntax.SyntaxTree;

import java.util.List;

/**
 * Turns raw parser diagnostics into {@link DiagnosticRecord}s.
 * <p>
 * Never fails on malformed input: out-of-bounds offsets are clamped and unresolvable node
 * references are ignored. Every raw diagnostic yields exactly one record. Records come back in
 * source order.
 */
public interface DiagnosticExtractor {

    static DiagnosticExtractor getInstance() {
        return ServiceAccessHolder.get().getApplicationService(DiagnosticExtractor.class);
    }

    List<DiagnosticRecord> extract(SyntaxTree tree, List<RawDiagnostic> diagnostics);
}
