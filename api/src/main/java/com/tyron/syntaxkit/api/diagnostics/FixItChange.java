package com.tyron.syntaxkit.api.diagnostics;

import com.tyron.syntaxkit.api.source.SourceLocation;
import com.tyron.syntaxkit.api.source.SourceSpan;

import java.util.Objects;

/**
 * One consolidated edit of a {@link FixItSuggestion}. Text is stored unescaped.
 */
public sealed interface FixItChange {

    record Replace(SourceSpan span, String newText) implements FixItChange {
        public Replace {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(newText, "newText");
        }
    }

    record Insert(SourceLocation position, String newText) implements FixItChange {
        public Insert {
            Objects.requireNonNull(position, "position");
            Objects.requireNonNull(newText, "newText");
        }
    }

    record Delete(SourceSpan span) implements FixItChange {
        public Delete {
            Objects.requireNonNull(span, "span");
        }
    }

    record Generic(String description, String details) implements FixItChange {
        public Generic {
            Objects.requireNonNull(description, "description");
            Objects.requireNonNull(details, "details");
        }
    }
}
