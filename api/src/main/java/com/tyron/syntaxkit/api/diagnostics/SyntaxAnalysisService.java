package com.tyron.syntaxkit.api.diagnostics;

import com.tyron.syntaxkit.api.language.LanguageSupport;
import com.tyron.syntaxkit.api.service.ServiceAccessHolder;
import com.tyron.syntaxkit.api.source.SourceDocument;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Application-scoped facade: parses a document with the matching {@link LanguageSupport} and
 * extracts its diagnostics.
 * <p>
 * Threading: stateless; documents may be analyzed concurrently.
 */
public interface SyntaxAnalysisService {

    static SyntaxAnalysisService getInstance() {
        return ServiceAccessHolder.get().getApplicationService(SyntaxAnalysisService.class);
    }

    /**
     * @throws IllegalStateException if no registered language support handles the document
     */
    LanguageSupport.ParseResult parse(SourceDocument document);

    List<DiagnosticRecord> getDiagnostics(SourceDocument document);

    default boolean hasSyntaxErrors(SourceDocument document) {
        return syntaxErrorCount(document) > 0;
    }

    default int syntaxErrorCount(SourceDocument document) {
        int count = 0;
        for (DiagnosticRecord record : getDiagnostics(document)) {
            if (record.isError()) count++;
        }
        return count;
    }

    default CompletableFuture<List<DiagnosticRecord>> getDiagnosticsAsync(SourceDocument document, Executor executor) {
        Objects.requireNonNull(executor, "executor");
        return CompletableFuture.supplyAsync(() -> getDiagnostics(document), executor);
    }

    default CompletableFuture<List<DiagnosticRecord>> getDiagnosticsAsync(SourceDocument document) {
        return CompletableFuture.supplyAsync(() -> getDiagnostics(document), ForkJoinPool.commonPool());
    }
}
