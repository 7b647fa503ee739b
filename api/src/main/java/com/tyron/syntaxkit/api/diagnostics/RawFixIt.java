package com.tyron.syntaxkit.api.diagnostics;

import java.util.List;
import java.util.Objects;

/**
 * A fix suggested by the parser, as a sequence of primitive edits.
 */
public record RawFixIt(String message, List<RawFixItChange> changes) {

    public RawFixIt {
        Objects.requireNonNull(message, "message");
        changes = List.copyOf(changes);
    }

    public static RawFixIt of(String message, RawFixItChange... changes) {
        return new RawFixIt(message, List.of(changes));
    }
}
