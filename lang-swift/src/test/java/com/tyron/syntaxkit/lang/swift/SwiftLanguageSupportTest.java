package com.tyron.syntaxkit.lang.swift;

import com.tyron.syntaxkit.api.language.LanguageSupport;
import com.tyron.syntaxkit.api.source.SourceDocument;
import com.tyron.syntaxkit.core.service.ApplicationServiceManager;
import com.tyron.syntaxkit.testFramework.BaseSyntaxTest;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class SwiftLanguageSupportTest extends BaseSyntaxTest {

    @Test
    public void handlesSwiftFilesOnly() {
        SwiftLanguageSupport support = new SwiftLanguageSupport();

        Assertions.assertTrue(support.canHandle(SourceDocument.of("Sources/App/Main.swift", "")));
        Assertions.assertTrue(support.canHandle(SourceDocument.of("LEGACY.SWIFT", "")));
        Assertions.assertFalse(support.canHandle(SourceDocument.of("Main.java", "")));
        Assertions.assertFalse(support.canHandle(SourceDocument.of("swift", "")));
    }

    @Test
    public void registeredThroughServiceLoader() {
        List<LanguageSupport> supports = ApplicationServiceManager.getLanguageSupports();

        Assertions.assertTrue(supports.stream().anyMatch(s -> s instanceof SwiftLanguageSupport));
    }

    @Test
    public void parseTextUsesInMemoryIdentity() {
        LanguageSupport.ParseResult result = SwiftLanguageSupport.parseText("let a = 1");

        Assertions.assertEquals("<memory>.swift", result.tree().getIdentity());
        Assertions.assertEquals("let a = 1", result.tree().render());
    }

    @Test
    public void emptyDocumentIsJustEndOfFile() {
        LanguageSupport.ParseResult result = parse("");

        Assertions.assertEquals(1, result.tree().tokens().size());
        Assertions.assertTrue(result.diagnostics().isEmpty());
    }
}
