package com.tyron.syntaxkit.api.path;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A dot-separated sequence of 1-based integers addressing a node inside one specific tree snapshot.
 * <p>
 * Paths are not stable across mutations: a path computed on a tree may point to a different node,
 * or to nothing, in a tree derived from it.
 * <p>
 * Malformed text (empty, non-numeric or zero segments, leading or trailing dots) is accepted by the
 * factories so callers can pass user input through; such a path simply never resolves.
 */
public final class NodePath {

    private final AddressingScheme scheme;
    private final String text;
    private final @Nullable IntList segments;

    private NodePath(AddressingScheme scheme, String text, @Nullable IntList segments) {
        this.scheme = scheme;
        this.text = text;
        this.segments = segments;
    }

    public static NodePath of(@NotNull AddressingScheme scheme, @NotNull String text) {
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(text, "text");
        return new NodePath(scheme, text, parse(text));
    }

    public static NodePath token(String text) {
        return of(AddressingScheme.TOKEN, text);
    }

    /**
     * @param index 1-based token index
     */
    public static NodePath token(int index) {
        if (index < 1) throw new IllegalArgumentException("index < 1: " + index);
        return new NodePath(AddressingScheme.TOKEN, Integer.toString(index), IntLists.singleton(index));
    }

    public static NodePath declaration(String text) {
        return of(AddressingScheme.DECLARATION, text);
    }

    public static NodePath declaration(IntList segments) {
        if (segments.isEmpty()) throw new IllegalArgumentException("segments is empty");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            int segment = segments.getInt(i);
            if (segment < 1) throw new IllegalArgumentException("segment < 1: " + segment);
            if (i > 0) sb.append('.');
            sb.append(segment);
        }
        return new NodePath(AddressingScheme.DECLARATION, sb.toString(),
                IntLists.unmodifiable(new IntArrayList(segments)));
    }

    public AddressingScheme getScheme() {
        return scheme;
    }

    public String getText() {
        return text;
    }

    public boolean isWellFormed() {
        return segments != null;
    }

    /**
     * @return the parsed 1-based segments, or {@code null} if the text is malformed
     */
    public @Nullable IntList getSegments() {
        return segments;
    }

    private static @Nullable IntList parse(String text) {
        if (text.isEmpty()) return null;
        IntArrayList result = new IntArrayList();
        int start = 0;
        while (true) {
            int dot = text.indexOf('.', start);
            int end = dot < 0 ? text.length() : dot;
            int value = parseSegment(text, start, end);
            if (value < 1) return null;
            result.add(value);
            if (dot < 0) break;
            start = dot + 1;
        }
        return IntLists.unmodifiable(result);
    }

    /**
     * @return the segment value, or -1 unless it matches {@code [1-9][0-9]*} and fits an int
     */
    private static int parseSegment(String text, int start, int end) {
        if (start >= end || text.charAt(start) == '0') return -1;
        long value = 0;
        for (int i = start; i < end; i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') return -1;
            value = value * 10 + (c - '0');
            if (value > Integer.MAX_VALUE) return -1;
        }
        return (int) value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodePath that)) return false;
        return scheme == that.scheme && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scheme, text);
    }

    @Override
    public String toString() {
        return text;
    }
}
