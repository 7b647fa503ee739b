package com.tyron.syntaxkit.api.diagnostics;

import java.util.List;
import java.util.Objects;

public record FixItSuggestion(String message, List<FixItChange> changes) {

    public FixItSuggestion {
        Objects.requireNonNull(message, "message");
        changes = List.copyOf(changes);
    }
}
