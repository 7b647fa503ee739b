package com.tyron.syntaxkit.core.diagnostics;

import com.tyron.syntaxkit.api.diagnostics.ContextLine;
import com.tyron.syntaxkit.api.diagnostics.DiagnosticRecord;
import com.tyron.syntaxkit.api.diagnostics.DiagnosticSeverity;
import com.tyron.syntaxkit.api.diagnostics.Note;
import com.tyron.syntaxkit.api.diagnostics.PositionConfidence;
import com.tyron.syntaxkit.api.diagnostics.RawDiagnostic;
import com.tyron.syntaxkit.api.diagnostics.RawFixIt;
import com.tyron.syntaxkit.api.diagnostics.RawFixItChange.TextChange;
import com.tyron.syntaxkit.api.diagnostics.RawNote;
import com.tyron.syntaxkit.api.path.NodePath;
import com.tyron.syntaxkit.api.source.SourceLocation;
import com.tyron.syntaxkit.api.syntax.SyntaxTree;
import com.tyron.syntaxkit.core.config.SyntaxKitSettings;
import com.tyron.syntaxkit.core.path.TreePathResolver;
import com.tyron.syntaxkit.core.test.TestTrees;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.google.common.truth.Truth.assertThat;

public class DiagnosticExtractorImplTest {

    private static final String GENERIC_FUNC = "func bad: <T>(value: T) -> T { return value }";
    private static final String UNEXPECTED = "unexpected code ': <T>(value: T) -> T' in function";

    private static final String FIVE_LINES = "let a = 1\nlet b = 2\nlet c = 3\nlet d = 4\nlet e = 5";

    private static DiagnosticExtractorImpl extractor(SyntaxKitSettings settings) {
        return new DiagnosticExtractorImpl(settings, new TreePathResolver());
    }

    private static DiagnosticRecord single(SyntaxKitSettings settings, SyntaxTree tree, RawDiagnostic raw) {
        List<DiagnosticRecord> records = extractor(settings).extract(tree, List.of(raw));
        Assertions.assertEquals(1, records.size());
        return records.get(0);
    }

    @Test
    public void unexpectedCodeIsMovedToTheQuotedText() {
        SyntaxTree tree = TestTrees.words("Bad.swift", GENERIC_FUNC);

        DiagnosticRecord record = single(SyntaxKitSettings.DEFAULTS, tree, RawDiagnostic.error(UNEXPECTED, 0));

        Assertions.assertEquals("Bad.swift", record.identity());
        Assertions.assertEquals(1, record.line());
        Assertions.assertEquals(9, record.column());
        Assertions.assertEquals(PositionConfidence.CORRECTED, record.positionConfidence());
        Assertions.assertEquals(new SourceLocation(1, 29, 28), record.span().end());
        Assertions.assertEquals(GENERIC_FUNC, record.sourceLineText());
        Assertions.assertEquals("        ^", record.caretLineText());
        Assertions.assertEquals("1", record.contextRange());
        Assertions.assertTrue(record.isError());
    }

    @Test
    public void correctionCanBeDisabled() {
        SyntaxTree tree = TestTrees.words("Bad.swift", GENERIC_FUNC);

        DiagnosticRecord record = single(SyntaxKitSettings.DEFAULTS.withPositionCorrection(false), tree,
                RawDiagnostic.error(UNEXPECTED, 0));

        Assertions.assertEquals(1, record.column());
        Assertions.assertEquals(PositionConfidence.EXACT, record.positionConfidence());
        Assertions.assertNull(record.span().end());
        Assertions.assertEquals("^", record.caretLineText());
    }

    @Test
    public void quotedTextAlreadyAtOffsetStaysExact() {
        SyntaxTree tree = TestTrees.words("Bad.swift", GENERIC_FUNC);

        DiagnosticRecord record = single(SyntaxKitSettings.DEFAULTS, tree, RawDiagnostic.error(UNEXPECTED, 8));

        Assertions.assertEquals(9, record.column());
        Assertions.assertEquals(PositionConfidence.EXACT, record.positionConfidence());
        Assertions.assertEquals(29, record.span().end().column());
    }

    @Test
    public void outOfRangeOffsetsAreClipped() {
        SyntaxTree tree = TestTrees.words("A.swift", FIVE_LINES);

        DiagnosticRecord past = single(SyntaxKitSettings.DEFAULTS, tree, RawDiagnostic.error("expected expression", 1000));
        DiagnosticRecord before = single(SyntaxKitSettings.DEFAULTS, tree, RawDiagnostic.error("expected expression", -3));

        Assertions.assertEquals(PositionConfidence.CLIPPED, past.positionConfidence());
        Assertions.assertEquals(new SourceLocation(5, 10, FIVE_LINES.length()), past.location());
        Assertions.assertEquals(PositionConfidence.CLIPPED, before.positionConfidence());
        Assertions.assertEquals(new SourceLocation(1, 1, 0), before.location());
    }

    @Test
    public void contextLinesFollowRadius() {
        SyntaxTree tree = TestTrees.words("A.swift", FIVE_LINES);
        int lineThree = FIVE_LINES.indexOf("let c");

        DiagnosticRecord middle = single(SyntaxKitSettings.DEFAULTS, tree, RawDiagnostic.error("x", lineThree));
        DiagnosticRecord wide = single(SyntaxKitSettings.DEFAULTS.withContextRadius(5), tree, RawDiagnostic.error("x", lineThree));
        DiagnosticRecord none = single(SyntaxKitSettings.DEFAULTS.withContextRadius(0), tree, RawDiagnostic.error("x", lineThree));
        DiagnosticRecord first = single(SyntaxKitSettings.DEFAULTS, tree, RawDiagnostic.error("x", 0));

        assertThat(middle.contextLines()).containsExactly(
                new ContextLine(2, "let b = 2"), new ContextLine(3, "let c = 3"), new ContextLine(4, "let d = 4")).inOrder();
        Assertions.assertEquals("2-4", middle.contextRange());
        Assertions.assertEquals("1-5", wide.contextRange());
        Assertions.assertEquals("3", none.contextRange());
        Assertions.assertEquals("1-2", first.contextRange());
    }

    @Test
    public void resolvedNodeProvidesOffendingText() {
        SyntaxTree tree = TestTrees.struct();
        int x = TestTrees.STRUCT.indexOf("x:");

        DiagnosticRecord record = single(SyntaxKitSettings.DEFAULTS, tree,
                RawDiagnostic.error("expected type annotation", x).withNode(NodePath.token("7")));

        Assertions.assertEquals("x", record.offendingText());
        Assertions.assertEquals(new SourceLocation(2, 16, x), record.nodeLocation());
        Assertions.assertEquals(new SourceLocation(2, 17, x + 1), record.span().end());
        Assertions.assertEquals("    public let x: Int", record.sourceLineText());
        Assertions.assertEquals(" ".repeat(15) + "^", record.caretLineText());
    }

    @Test
    public void unresolvedNodeIsIgnored() {
        SyntaxTree tree = TestTrees.struct();

        DiagnosticRecord record = single(SyntaxKitSettings.DEFAULTS, tree,
                RawDiagnostic.error("expected type annotation", 3).withNode(NodePath.token("999.999")));

        Assertions.assertNull(record.offendingText());
        Assertions.assertNull(record.nodeLocation());
        Assertions.assertNull(record.span().end());
    }

    @Test
    public void notesAreLocatedWhenTheyHaveAnOffset() {
        SyntaxTree tree = TestTrees.struct();
        RawDiagnostic raw = RawDiagnostic.error("expected '}' to end struct", TestTrees.STRUCT.length())
                .withNotes(List.of(
                        new RawNote("to match this opening '{'", TestTrees.STRUCT.indexOf('{')),
                        new RawNote("declared here", null),
                        new RawNote("somewhere else", 10_000)));

        List<Note> notes = single(SyntaxKitSettings.DEFAULTS, tree, raw).notes();

        Assertions.assertEquals(3, notes.size());
        Assertions.assertEquals(new SourceLocation(1, 17, 16), notes.get(0).location());
        Assertions.assertEquals("public struct S {", notes.get(0).sourceLineText());
        Assertions.assertNull(notes.get(1).location());
        Assertions.assertNull(notes.get(2).location());
        Assertions.assertNull(notes.get(2).sourceLineText());
    }

    @Test
    public void fixItsAreConsolidated() {
        SyntaxTree tree = TestTrees.struct();
        int end = TestTrees.STRUCT.length();
        RawDiagnostic raw = RawDiagnostic.error("expected '}' to end struct", end)
                .withFixIts(List.of(
                        RawFixIt.of("", TextChange.insert(end, "\n"), TextChange.insert(end, "}")),
                        RawFixIt.of("", new TextChange(end, "", ""))));

        DiagnosticRecord record = single(SyntaxKitSettings.DEFAULTS, tree, raw);

        Assertions.assertEquals(1, record.fixIts().size());
        Assertions.assertEquals("insert `\\n}`", record.fixIts().get(0).message());
    }

    @Test
    public void recordsAreSortedByPositionKeepingParserOrder() {
        SyntaxTree tree = TestTrees.words("A.swift", FIVE_LINES);
        List<RawDiagnostic> raw = Arrays.asList(
                RawDiagnostic.error("third", 30),
                new RawDiagnostic("first", DiagnosticSeverity.WARNING, 0, null, List.of(), List.of()),
                RawDiagnostic.error("second", 0));

        List<DiagnosticRecord> records = extractor(SyntaxKitSettings.DEFAULTS).extract(tree, raw);

        assertThat(records.stream().map(DiagnosticRecord::message).toList()).containsExactly("first", "second", "third").inOrder();
        Assertions.assertFalse(records.get(0).isError());
    }

    @Test
    public void emptyInputGivesNoRecords() {
        Assertions.assertTrue(extractor(SyntaxKitSettings.DEFAULTS).extract(TestTrees.struct(), List.of()).isEmpty());
    }
}
