package com.tyron.syntaxkit.api.diagnostics;

import com.tyron.syntaxkit.api.source.SourceLocation;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

public record Note(String message, @Nullable SourceLocation location, @Nullable String sourceLineText) {

    public Note {
        Objects.requireNonNull(message, "message");
    }
}
