package com.tyron.syntaxkit.api.diagnostics;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A secondary message of a {@link RawDiagnostic}, e.g. "to match this opening '{'".
 */
public record RawNote(String message, @Nullable Integer offset) {

    public RawNote {
        Objects.requireNonNull(message, "message");
    }
}
