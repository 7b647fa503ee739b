package com.tyron.syntaxkit.api.source;

/**
 * A resolved position inside a {@link SourceDocument}.
 *
 * Lines and columns are 1-based; the offset is the 0-based character offset the location was computed from.
 */
public record SourceLocation(int line, int column, int offset) {

    public SourceLocation {
        if (line < 1) throw new IllegalArgumentException("line < 1: " + line);
        if (column < 1) throw new IllegalArgumentException("column < 1: " + column);
        if (offset < 0) throw new IllegalArgumentException("offset < 0: " + offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
