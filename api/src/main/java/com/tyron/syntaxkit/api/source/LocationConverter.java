package com.tyron.syntaxkit.api.source;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.Objects;

/**
 * Converts 0-based character offsets into 1-based (line, column) positions.
 * <p>
 * Built once per text by recording the offset at which every line starts; lookups are a binary
 * search over that table. A line terminator ({@code \n}, {@code \r\n} or a lone {@code \r}) belongs to
 * the line it terminates. The offset equal to the text length (end of file) is valid.
 * <p>
 * Instances are immutable and safe to share between threads.
 */
public final class LocationConverter {

    private final String text;
    private final int[] lineStarts;

    private LocationConverter(String text, int[] lineStarts) {
        this.text = text;
        this.lineStarts = lineStarts;
    }

    public static LocationConverter of(String text) {
        Objects.requireNonNull(text, "text");

        IntArrayList starts = new IntArrayList();
        starts.add(0);
        int len = text.length();
        for (int i = 0; i < len; i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                starts.add(i + 1);
            } else if (c == '\r') {
                if (i + 1 < len && text.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            }
        }
        return new LocationConverter(text, starts.toIntArray());
    }

    /**
     * @param offset 0-based offset in {@code [0, length]}
     * @return the 1-based location of {@code offset}
     * @throws IndexOutOfBoundsException if the offset is outside the text
     */
    public SourceLocation locate(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IndexOutOfBoundsException("offset " + offset + " is out of bounds for length=" + text.length());
        }
        int lineIndex = lineIndexOf(offset);
        return new SourceLocation(lineIndex + 1, offset - lineStarts[lineIndex] + 1, offset);
    }

    /**
     * Same as {@link #locate(int)} but clamps the offset into {@code [0, length]} first.
     */
    public SourceLocation locateClamped(int offset) {
        return locate(clamp(offset));
    }

    public int clamp(int offset) {
        if (offset < 0) return 0;
        return Math.min(offset, text.length());
    }

    public boolean isValidOffset(int offset) {
        return offset >= 0 && offset <= text.length();
    }

    /**
     * Inverse of {@link #locate(int)}. Columns past the end of the line are clamped to the line end.
     */
    public int offsetOf(int line, int column) {
        checkLine(line);
        int start = lineStarts[line - 1];
        int end = lineContentEnd(line);
        return Math.min(start + Math.max(column, 1) - 1, end);
    }

    public int getLineCount() {
        return lineStarts.length;
    }

    public int getLineStartOffset(int line) {
        checkLine(line);
        return lineStarts[line - 1];
    }

    /**
     * @return the text of a 1-based line without its terminator
     */
    public String getLineText(int line) {
        checkLine(line);
        return text.substring(lineStarts[line - 1], lineContentEnd(line));
    }

    public int getTextLength() {
        return text.length();
    }

    private int lineContentEnd(int line) {
        int end = line < lineStarts.length ? lineStarts[line] : text.length();
        while (end > lineStarts[line - 1]) {
            char c = text.charAt(end - 1);
            if (c != '\n' && c != '\r') break;
            end--;
        }
        return end;
    }

    private int lineIndexOf(int offset) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }

    private void checkLine(int line) {
        if (line < 1 || line > lineStarts.length) {
            throw new IndexOutOfBoundsException("line " + line + " is out of bounds for lineCount=" + lineStarts.length);
        }
    }
}
