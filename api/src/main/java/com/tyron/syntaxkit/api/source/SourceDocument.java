package com.tyron.syntaxkit.api.source;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * The immutable text a syntax tree was parsed from, plus a stable identity used in messages
 * (usually a file name).
 *
 * Thread-safety: immutable; the {@link LocationConverter} is built lazily at most once per instance.
 */
public final class SourceDocument {

    private final String identity;
    private final String text;

    private volatile LocationConverter locationConverter;

    public SourceDocument(@NotNull String identity, @NotNull String text) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.text = Objects.requireNonNull(text, "text");
    }

    public static SourceDocument of(String identity, String text) {
        return new SourceDocument(identity, text);
    }

    public String getIdentity() {
        return identity;
    }

    public String getText() {
        return text;
    }

    public int getLength() {
        return text.length();
    }

    /**
     * Returns a document with the same identity and different text.
     */
    public SourceDocument withText(String newText) {
        return new SourceDocument(identity, newText);
    }

    public LocationConverter getLocationConverter() {
        LocationConverter converter = locationConverter;
        if (converter == null) {
            synchronized (this) {
                converter = locationConverter;
                if (converter == null) {
                    converter = LocationConverter.of(text);
                    locationConverter = converter;
                }
            }
        }
        return converter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceDocument that)) return false;
        return identity.equals(that.identity) && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, text);
    }

    @Override
    public String toString() {
        return "SourceDocument{" + identity + ", length=" + text.length() + "}";
    }
}
