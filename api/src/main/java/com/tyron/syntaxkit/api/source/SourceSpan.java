package com.tyron.syntaxkit.api.source;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A start/end pair delimiting a range of source text. The end is exclusive and optional.
 */
public record SourceSpan(@NotNull SourceLocation start, @Nullable SourceLocation end) {

    public SourceSpan {
        Objects.requireNonNull(start, "start");
        if (end != null && end.offset() < start.offset()) {
            throw new IllegalArgumentException("span end " + end + " precedes start " + start);
        }
    }

    public static SourceSpan at(SourceLocation start) {
        return new SourceSpan(start, null);
    }

    public int startLine() {
        return start.line();
    }

    public int startColumn() {
        return start.column();
    }

    public @Nullable Integer endLine() {
        return end != null ? end.line() : null;
    }

    public @Nullable Integer endColumn() {
        return end != null ? end.column() : null;
    }

    @Override
    public String toString() {
        return end != null ? start + "-" + end : start.toString();
    }
}
