package com.tyron.syntaxkit.lang.swift;

import com.tyron.syntaxkit.api.diagnostics.RawDiagnostic;
import com.tyron.syntaxkit.api.language.LanguageSupport;
import com.tyron.syntaxkit.api.source.SourceDocument;
import com.tyron.syntaxkit.api.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link LanguageSupport} for {@code .swift} documents.
 */
public class SwiftLanguageSupport implements LanguageSupport {

    private static final Logger LOG = Logger.getLogger(SwiftLanguageSupport.class.getName());

    public static final String EXTENSION = ".swift";

    @Override
    public boolean canHandle(SourceDocument document) {
        return document.getIdentity().toLowerCase(Locale.ROOT).endsWith(EXTENSION);
    }

    @Override
    public ParseResult parse(SourceDocument document) {
        Objects.requireNonNull(document, "document");

        SwiftLexer.Result lexed = SwiftLexer.lex(document.getText());
        SwiftTreeBuilder.Result built = SwiftTreeBuilder.build(lexed.tokens());

        List<RawDiagnostic> diagnostics = new ArrayList<>(lexed.diagnostics().size() + built.diagnostics().size());
        diagnostics.addAll(lexed.diagnostics());
        diagnostics.addAll(built.diagnostics());
        diagnostics.sort(Comparator.comparingInt(RawDiagnostic::offset));

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Parsed " + document.getIdentity() + ": " + lexed.tokens().size() + " tokens, "
                    + diagnostics.size() + " diagnostics");
        }
        return new ParseResult(SyntaxTree.of(document, built.root()), diagnostics);
    }

    /**
     * Parses {@code text} under the identity {@code "<memory>.swift"}.
     */
    public static ParseResult parseText(String text) {
        return new SwiftLanguageSupport().parse(SourceDocument.of("<memory>" + EXTENSION, text));
    }
}
