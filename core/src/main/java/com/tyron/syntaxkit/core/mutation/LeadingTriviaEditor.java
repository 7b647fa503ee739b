package com.tyron.syntaxkit.core.mutation;

import com.tyron.syntaxkit.api.syntax.Token;
import com.tyron.syntaxkit.api.syntax.Trivia;
import com.tyron.syntaxkit.api.syntax.TriviaKind;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Rewrites documentation comments in a token's leading trivia.
 * <p>
 * Old comments are removed with the indentation before them and the line break after them. New
 * documentation goes at the start of the token's own line, one comment per line, indented like the
 * token.
 */
final class LeadingTriviaEditor {

    private final String docLinePrefix;

    LeadingTriviaEditor(String docLinePrefix) {
        this.docLinePrefix = docLinePrefix;
    }

    Token apply(Token token, @Nullable String newText) {
        List<Trivia> retained = removeLines(token.leadingTrivia(), Trivia::isDocumentation);
        if (newText == null || newText.isBlank()) {
            return token.withLeadingTrivia(retained);
        }

        int insertAt = 0;
        for (int i = retained.size() - 1; i >= 0; i--) {
            if (retained.get(i).kind() == TriviaKind.NEWLINE) {
                insertAt = i + 1;
                break;
            }
        }
        StringBuilder indent = new StringBuilder();
        for (int i = insertAt; i < retained.size() && retained.get(i).kind() == TriviaKind.WHITESPACE; i++) {
            indent.append(retained.get(i).text());
        }

        List<Trivia> result = new ArrayList<>(retained.subList(0, insertAt));
        for (Trivia doc : parseDocumentation(newText)) {
            if (indent.length() > 0) {
                result.add(Trivia.whitespace(indent.toString()));
            }
            result.add(doc);
            result.add(Trivia.newline());
        }
        result.addAll(retained.subList(insertAt, retained.size()));
        return token.withLeadingTrivia(result);
    }

    /**
     * Splits {@code text} into documentation pieces. A doc block comment is kept as one piece;
     * otherwise every line becomes a doc line comment, gaining the configured prefix unless it already
     * starts with {@code ///}.
     */
    List<Trivia> parseDocumentation(String text) {
        String trimmed = text.strip();
        if (trimmed.startsWith("/**") && trimmed.endsWith("*/")) {
            return List.of(Trivia.docBlockComment(trimmed));
        }

        List<Trivia> pieces = new ArrayList<>();
        for (String line : trimmed.split("\r\n|\r|\n", -1)) {
            String content = line.strip();
            if (content.startsWith("///")) {
                pieces.add(Trivia.docLineComment(content));
            } else if (content.isEmpty()) {
                pieces.add(Trivia.docLineComment("///"));
            } else {
                pieces.add(Trivia.docLineComment(docLinePrefix + content));
            }
        }
        return pieces;
    }

    /**
     * Drops every piece matching {@code comment} together with the whitespace before it on its line
     * and the line break (or spacing) after it.
     */
    static List<Trivia> removeLines(List<Trivia> trivia, Predicate<Trivia> comment) {
        List<Trivia> result = new ArrayList<>(trivia.size());
        for (int i = 0; i < trivia.size(); i++) {
            Trivia piece = trivia.get(i);
            if (!comment.test(piece)) {
                result.add(piece);
                continue;
            }
            while (!result.isEmpty() && result.get(result.size() - 1).kind() == TriviaKind.WHITESPACE) {
                result.remove(result.size() - 1);
            }
            if (i + 1 < trivia.size()) {
                TriviaKind next = trivia.get(i + 1).kind();
                if (next == TriviaKind.NEWLINE || next == TriviaKind.WHITESPACE) {
                    i++;
                }
            }
        }
        return result;
    }
}
