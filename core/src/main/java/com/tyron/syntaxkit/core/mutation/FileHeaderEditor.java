package com.tyron.syntaxkit.core.mutation;

import com.tyron.syntaxkit.api.syntax.Token;
import com.tyron.syntaxkit.api.syntax.Trivia;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces the comment block at the top of a file, i.e. the comments in the first token's leading
 * trivia. Old comments go with their line breaks; remaining blank lines and indentation stay after
 * the new header.
 */
final class FileHeaderEditor {

    private FileHeaderEditor() {
    }

    static Token apply(Token firstToken, String header) {
        List<Trivia> result = new ArrayList<>();
        String text = header.replaceFirst("(\r\n|\r|\n)\\z", "");
        if (!text.isEmpty()) {
            for (String line : text.split("\r\n|\r|\n", -1)) {
                String trimmed = line.strip();
                if (trimmed.startsWith("///")) {
                    result.add(Trivia.docLineComment(trimmed));
                } else if (trimmed.startsWith("//")) {
                    result.add(Trivia.lineComment(trimmed));
                } else if (!trimmed.isEmpty()) {
                    result.add(Trivia.lineComment("// " + trimmed));
                }
                result.add(Trivia.newline());
            }
        }
        result.addAll(LeadingTriviaEditor.removeLines(firstToken.leadingTrivia(), Trivia::isComment));
        return firstToken.withLeadingTrivia(result);
    }
}
