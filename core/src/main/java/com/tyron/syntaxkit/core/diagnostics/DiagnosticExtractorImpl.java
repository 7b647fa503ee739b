package com.tyron.syntaxkit.core.diagnostics;

import com.tyron.syntaxkit.api.diagnostics.ContextLine;
import com.tyron.syntaxkit.api.diagnostics.DiagnosticExtractor;
import com.tyron.syntaxkit.api.diagnostics.DiagnosticRecord;
import com.tyron.syntaxkit.api.diagnostics.FixItSuggestion;
import com.tyron.syntaxkit.api.diagnostics.Note;
import com.tyron.syntaxkit.api.diagnostics.PositionConfidence;
import com.tyron.syntaxkit.api.diagnostics.RawDiagnostic;
import com.tyron.syntaxkit.api.diagnostics.RawFixIt;
import com.tyron.syntaxkit.api.diagnostics.RawNote;
import com.tyron.syntaxkit.api.path.PathResolver;
import com.tyron.syntaxkit.api.source.LocationConverter;
import com.tyron.syntaxkit.api.source.SourceLocation;
import com.tyron.syntaxkit.api.source.SourceSpan;
import com.tyron.syntaxkit.api.syntax.SyntaxElement;
import com.tyron.syntaxkit.api.syntax.SyntaxTree;
import com.tyron.syntaxkit.core.config.SyntaxKitSettings;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link DiagnosticExtractor}.
 * <p>
 * Holds no per-document state; one instance serves any number of trees concurrently.
 */
public final class DiagnosticExtractorImpl implements DiagnosticExtractor {

    private static final Logger LOG = Logger.getLogger(DiagnosticExtractorImpl.class.getName());

    private final SyntaxKitSettings settings;
    private final PathResolver pathResolver;

    public DiagnosticExtractorImpl() {
        this(SyntaxKitSettings.getInstance(), PathResolver.getInstance());
    }

    public DiagnosticExtractorImpl(SyntaxKitSettings settings, PathResolver pathResolver) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.pathResolver = Objects.requireNonNull(pathResolver, "pathResolver");
    }

    @Override
    public List<DiagnosticRecord> extract(SyntaxTree tree, List<RawDiagnostic> diagnostics) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(diagnostics, "diagnostics");

        List<DiagnosticRecord> records = new ArrayList<>(diagnostics.size());
        for (RawDiagnostic raw : diagnostics) {
            records.add(toRecord(tree, raw));
        }
        // Stable: diagnostics at the same position keep the parser's order.
        records.sort(Comparator.comparingInt(r -> r.location().offset()));
        return records;
    }

    private DiagnosticRecord toRecord(SyntaxTree tree, RawDiagnostic raw) {
        LocationConverter converter = tree.getLocationConverter();
        String text = tree.render();

        int offset = raw.offset();
        PositionConfidence confidence = PositionConfidence.EXACT;
        if (!converter.isValidOffset(offset)) {
            offset = converter.clamp(offset);
            confidence = PositionConfidence.CLIPPED;
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Clipped diagnostic offset " + raw.offset() + " to " + offset + " in " + tree.getIdentity());
            }
        }

        SourceLocation end = null;
        if (settings.positionCorrection()) {
            OptionalInt corrected = UnexpectedCodeLocator.locate(
                    raw.message(), converter, text, offset, settings.correctionSearchLines());
            if (corrected.isPresent()) {
                int length = UnexpectedCodeLocator.quotedText(raw.message()).map(String::length).orElse(0);
                end = converter.locate(corrected.getAsInt() + length);
                if (corrected.getAsInt() != offset) {
                    if (LOG.isLoggable(Level.FINE)) {
                        LOG.fine("Moved '" + raw.message() + "' from offset " + offset + " to " + corrected.getAsInt());
                    }
                    offset = corrected.getAsInt();
                    confidence = PositionConfidence.CORRECTED;
                }
            }
        }
        SourceLocation location = converter.locate(offset);

        String offendingText = null;
        SourceLocation nodeLocation = null;
        if (raw.node() != null) {
            Optional<SyntaxElement> node = pathResolver.find(tree, raw.node());
            if (node.isPresent()) {
                offendingText = node.get().node().render();
                nodeLocation = converter.locate(node.get().contentOffset());
                if (end == null && node.get().contentEndOffset() >= offset) {
                    end = converter.locate(node.get().contentEndOffset());
                }
            } else if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Diagnostic node " + raw.node() + " does not resolve in " + tree.getIdentity());
            }
        }

        int line = location.line();
        int radius = settings.contextRadius();
        int firstLine = Math.max(1, line - radius);
        int lastLine = Math.min(converter.getLineCount(), line + radius);
        List<ContextLine> context = new ArrayList<>();
        for (int i = firstLine; i <= lastLine; i++) {
            context.add(new ContextLine(i, converter.getLineText(i)));
        }

        List<FixItSuggestion> fixIts = new ArrayList<>();
        for (RawFixIt fixIt : raw.fixIts()) {
            FixItSuggestion suggestion = FixItConsolidator.consolidate(fixIt, converter);
            if (suggestion != null) {
                fixIts.add(suggestion);
            }
        }

        List<Note> notes = new ArrayList<>();
        for (RawNote note : raw.notes()) {
            notes.add(toNote(note, converter));
        }

        return new DiagnosticRecord(
                tree.getIdentity(),
                raw.message(),
                raw.severity(),
                location,
                new SourceSpan(location, end),
                confidence,
                offendingText,
                nodeLocation,
                context,
                contextRange(context),
                converter.getLineText(line),
                " ".repeat(location.column() - 1) + "^",
                fixIts,
                notes);
    }

    private static Note toNote(RawNote note, LocationConverter converter) {
        Integer offset = note.offset();
        if (offset == null || !converter.isValidOffset(offset)) {
            return new Note(note.message(), null, null);
        }
        SourceLocation location = converter.locate(offset);
        return new Note(note.message(), location, converter.getLineText(location.line()));
    }

    static String contextRange(List<ContextLine> context) {
        if (context.isEmpty()) {
            return "0-0";
        }
        int first = context.get(0).lineNumber();
        int last = context.get(context.size() - 1).lineNumber();
        return first == last ? Integer.toString(first) : first + "-" + last;
    }
}
