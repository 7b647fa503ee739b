package com.tyron.syntaxkit.api.syntax;

import java.util.List;
import java.util.Objects;

/**
 * A piece of non-semantic text attached to a {@link Token}.
 */
public record Trivia(TriviaKind kind, String text) {

    public Trivia {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public static Trivia spaces(int count) {
        return new Trivia(TriviaKind.WHITESPACE, " ".repeat(count));
    }

    public static Trivia whitespace(String text) {
        return new Trivia(TriviaKind.WHITESPACE, text);
    }

    public static Trivia newline() {
        return new Trivia(TriviaKind.NEWLINE, "\n");
    }

    public static Trivia lineComment(String text) {
        return new Trivia(TriviaKind.LINE_COMMENT, text);
    }

    public static Trivia docLineComment(String text) {
        return new Trivia(TriviaKind.DOC_LINE_COMMENT, text);
    }

    public static Trivia blockComment(String text) {
        return new Trivia(TriviaKind.BLOCK_COMMENT, text);
    }

    public static Trivia docBlockComment(String text) {
        return new Trivia(TriviaKind.DOC_BLOCK_COMMENT, text);
    }

    public boolean isDocumentation() {
        return kind.isDocumentation();
    }

    public boolean isComment() {
        return kind.isComment();
    }

    public static String render(List<Trivia> pieces) {
        if (pieces.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        for (Trivia t : pieces) {
            sb.append(t.text);
        }
        return sb.toString();
    }

    public static int length(List<Trivia> pieces) {
        int len = 0;
        for (Trivia t : pieces) {
            len += t.text.length();
        }
        return len;
    }
}
