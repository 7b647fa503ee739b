package com.tyron.syntaxkit.api.diagnostics;

import java.util.Objects;

/**
 * A primitive edit of a {@link RawFixIt}.
 */
public sealed interface RawFixItChange {

    /**
     * Replaces {@code originalText}, found at {@code offset}, with {@code replacementText}. An empty
     * original is an insertion, an empty replacement a removal.
     */
    record TextChange(int offset, String originalText, String replacementText) implements RawFixItChange {

        public TextChange {
            Objects.requireNonNull(originalText, "originalText");
            Objects.requireNonNull(replacementText, "replacementText");
        }

        public static TextChange insert(int offset, String text) {
            return new TextChange(offset, "", text);
        }

        public static TextChange remove(int offset, String originalText) {
            return new TextChange(offset, originalText, "");
        }

        public int endOffset() {
            return offset + originalText.length();
        }

        public boolean isInsertion() {
            return originalText.isEmpty();
        }

        public boolean isRemoval() {
            return !originalText.isEmpty() && replacementText.isEmpty();
        }
    }

    /**
     * An edit the parser could only describe, e.g. one touching trivia of a synthesized node.
     */
    record Opaque(String description, String details) implements RawFixItChange {

        public Opaque {
            Objects.requireNonNull(description, "description");
            Objects.requireNonNull(details, "details");
        }
    }
}
