package com.tyron.syntaxkit.core.analysis;

import com.tyron.syntaxkit.api.diagnostics.DiagnosticExtractor;
import com.tyron.syntaxkit.api.diagnostics.DiagnosticRecord;
import com.tyron.syntaxkit.api.diagnostics.SyntaxAnalysisService;
import com.tyron.syntaxkit.api.language.LanguageSupport;
import com.tyron.syntaxkit.api.source.SourceDocument;
import com.tyron.syntaxkit.core.service.ApplicationServiceManager;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Core implementation of {@link SyntaxAnalysisService}.
 * <p>
 * Delegates parsing to the first registered {@link LanguageSupport} that handles the document and
 * extraction to the {@link DiagnosticExtractor} service.
 */
public final class SyntaxAnalysisServiceImpl implements SyntaxAnalysisService {

    private static final Logger LOG = Logger.getLogger(SyntaxAnalysisServiceImpl.class.getName());

    private final Supplier<List<LanguageSupport>> languageSupports;
    private final DiagnosticExtractor extractor;

    public SyntaxAnalysisServiceImpl() {
        this(ApplicationServiceManager::getLanguageSupports, DiagnosticExtractor.getInstance());
    }

    public SyntaxAnalysisServiceImpl(Supplier<List<LanguageSupport>> languageSupports, DiagnosticExtractor extractor) {
        this.languageSupports = Objects.requireNonNull(languageSupports, "languageSupports");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    @Override
    public LanguageSupport.ParseResult parse(SourceDocument document) {
        Objects.requireNonNull(document, "document");
        return findLanguageSupport(document).parse(document);
    }

    @Override
    public List<DiagnosticRecord> getDiagnostics(SourceDocument document) {
        LanguageSupport.ParseResult result = parse(document);
        if (result.diagnostics().isEmpty()) {
            return List.of();
        }
        return extractor.extract(result.tree(), result.diagnostics());
    }

    private LanguageSupport findLanguageSupport(SourceDocument document) {
        for (LanguageSupport support : languageSupports.get()) {
            if (support != null && support.canHandle(document)) {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Using " + support.getClass().getName() + " for " + document.getIdentity());
                }
                return support;
            }
        }

        throw new IllegalStateException("No LanguageSupport registered for document: " + document.getIdentity());
    }
}
