package com.tyron.syntaxkit.core.mutation;

import com.tyron.syntaxkit.api.syntax.NodeKind;
import com.tyron.syntaxkit.api.syntax.Token;
import com.tyron.syntaxkit.api.syntax.Trivia;
import com.tyron.syntaxkit.api.syntax.TriviaKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.google.common.truth.Truth.assertThat;

public class LeadingTriviaEditorTest {

    @Test
    public void prefixIsConfigurable() {
        LeadingTriviaEditor editor = new LeadingTriviaEditor("///");

        assertThat(editor.parseDocumentation("Compact")).containsExactly(Trivia.docLineComment("///Compact"));
    }

    @Test
    public void linesAreTrimmedAndExistingMarkersKept() {
        LeadingTriviaEditor editor = new LeadingTriviaEditor("/// ");

        assertThat(editor.parseDocumentation("  first  \r\n/// second\n")).containsExactly(
                Trivia.docLineComment("/// first"), Trivia.docLineComment("/// second")).inOrder();
    }

    @Test
    public void blockCommentsAreRemovedWithTheirLine() {
        List<Trivia> leading = List.of(
                Trivia.newline(), Trivia.spaces(2), Trivia.docBlockComment("/** old */"), Trivia.newline(), Trivia.spaces(2));

        Token token = new LeadingTriviaEditor("/// ").apply(new Token(NodeKind.KEYWORD, "func", leading, List.of()), null);

        assertThat(token.leadingTrivia()).containsExactly(Trivia.newline(), Trivia.spaces(2)).inOrder();
    }

    @Test
    public void removeLinesKeepsUnrelatedTrivia() {
        List<Trivia> trivia = List.of(
                Trivia.lineComment("// a"), Trivia.newline(),
                Trivia.newline(),
                Trivia.spaces(4), Trivia.blockComment("/* b */"), Trivia.spaces(1));

        List<Trivia> result = LeadingTriviaEditor.removeLines(trivia, Trivia::isComment);

        assertThat(result).containsExactly(Trivia.newline());
        Assertions.assertTrue(result.stream().noneMatch(t -> t.kind() == TriviaKind.LINE_COMMENT));
    }
}
