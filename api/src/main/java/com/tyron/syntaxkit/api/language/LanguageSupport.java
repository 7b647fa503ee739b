package com.tyron.syntaxkit.api.language;

import com.tyron.syntaxkit.api.diagnostics.RawDiagnostic;
import com.tyron.syntaxkit.api.source.SourceDocument;
import com.tyron.syntaxkit.api.syntax.SyntaxTree;

import java.util.List;
import java.util.Objects;

/**
 * Extension point for parsers. Implementations are discovered through {@code META-INF/services}.
 */
public interface LanguageSupport {

    /**
     * @return true if this support handles the given document (e.g. its identity ends with ".swift")
     */
    boolean canHandle(SourceDocument document);

    /**
     * Parses the whole document. Must not throw on malformed input: errors are reported as raw
     * diagnostics and the tree still renders to the document text.
     */
    ParseResult parse(SourceDocument document);

    record ParseResult(SyntaxTree tree, List<RawDiagnostic> diagnostics) {
        public ParseResult {
            Objects.requireNonNull(tree, "tree");
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
