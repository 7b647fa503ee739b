package com.tyron.syntaxkit.core.diagnostics;

import com.tyron.syntaxkit.api.diagnostics.FixItChange;
import com.tyron.syntaxkit.api.diagnostics.FixItSuggestion;
import com.tyron.syntaxkit.api.diagnostics.RawFixIt;
import com.tyron.syntaxkit.api.diagnostics.RawFixItChange;
import com.tyron.syntaxkit.api.source.LocationConverter;
import com.tyron.syntaxkit.api.source.SourceSpan;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges the primitive edits of a {@link RawFixIt} into logical edits and describes them.
 * <p>
 * Two consecutive edits merge when they have the same kind and touch: insertions at the same offset,
 * removals and replacements when the second starts where the first one's original text ends.
 */
public final class FixItConsolidator {

    static final String FALLBACK_MESSAGE = "fix syntax error";

    private FixItConsolidator() {
    }

    /**
     * @return the consolidated suggestion, or {@code null} if the fix-it carries no meaningful change
     */
    public static @Nullable FixItSuggestion consolidate(RawFixIt fixIt, LocationConverter converter) {
        List<RawFixItChange> merged = merge(fixIt.changes());
        if (merged.isEmpty()) {
            return null;
        }

        List<FixItChange> changes = new ArrayList<>(merged.size());
        List<String> parts = new ArrayList<>();
        for (RawFixItChange item : merged) {
            if (item instanceof RawFixItChange.TextChange change) {
                changes.add(toChange(change, converter));
                parts.add(describe(change));
            } else if (item instanceof RawFixItChange.Opaque opaque) {
                changes.add(new FixItChange.Generic(opaque.description(), opaque.details()));
            }
        }

        String message;
        if (!parts.isEmpty()) {
            message = String.join(" and ", parts);
        } else if (!fixIt.message().isBlank()) {
            message = fixIt.message();
        } else {
            message = FALLBACK_MESSAGE;
        }
        return new FixItSuggestion(message, changes);
    }

    static List<RawFixItChange> merge(List<RawFixItChange> raw) {
        List<RawFixItChange> result = new ArrayList<>();
        RawFixItChange.TextChange pending = null;
        for (RawFixItChange change : raw) {
            if (change instanceof RawFixItChange.Opaque opaque) {
                if (pending != null) {
                    result.add(pending);
                    pending = null;
                }
                result.add(opaque);
                continue;
            }
            RawFixItChange.TextChange text = (RawFixItChange.TextChange) change;
            if (text.originalText().isEmpty() && text.replacementText().isEmpty()) {
                continue;
            }
            if (pending != null && canMerge(pending, text)) {
                pending = new RawFixItChange.TextChange(
                        pending.offset(),
                        pending.originalText() + text.originalText(),
                        pending.replacementText() + text.replacementText());
            } else {
                if (pending != null) {
                    result.add(pending);
                }
                pending = text;
            }
        }
        if (pending != null) {
            result.add(pending);
        }
        return result;
    }

    private static boolean canMerge(RawFixItChange.TextChange previous, RawFixItChange.TextChange next) {
        if (previous.isInsertion() && next.isInsertion()) {
            return previous.offset() == next.offset();
        }
        if (previous.isRemoval() && next.isRemoval()) {
            return previous.endOffset() == next.offset();
        }
        boolean previousReplace = !previous.isInsertion() && !previous.isRemoval();
        boolean nextReplace = !next.isInsertion() && !next.isRemoval();
        return previousReplace && nextReplace && previous.endOffset() == next.offset();
    }

    private static FixItChange toChange(RawFixItChange.TextChange change, LocationConverter converter) {
        if (change.isInsertion()) {
            return new FixItChange.Insert(converter.locateClamped(change.offset()), change.replacementText());
        }
        SourceSpan span = new SourceSpan(
                converter.locateClamped(change.offset()),
                converter.locateClamped(change.endOffset()));
        if (change.isRemoval()) {
            return new FixItChange.Delete(span);
        }
        return new FixItChange.Replace(span, change.replacementText());
    }

    private static String describe(RawFixItChange.TextChange change) {
        if (change.isInsertion()) {
            return "insert `" + escapeForDisplay(change.replacementText()) + "`";
        }
        if (change.isRemoval()) {
            return "remove `" + escapeForDisplay(change.originalText()) + "`";
        }
        return "replace `" + escapeForDisplay(change.originalText()) + "` with `"
                + escapeForDisplay(change.replacementText()) + "`";
    }

    /**
     * Renders control characters, backslashes, quotes and backticks as escape sequences so the text
     * fits on one line inside a backtick-quoted message.
     */
    public static String escapeForDisplay(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\u000B' -> sb.append("\\v");
                case '\f' -> sb.append("\\f");
                case '"' -> sb.append("\\\"");
                case '`' -> sb.append("\\`");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
