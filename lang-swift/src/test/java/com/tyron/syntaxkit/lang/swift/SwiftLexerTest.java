package com.tyron.syntaxkit.lang.swift;

import com.tyron.syntaxkit.api.diagnostics.RawDiagnostic;
import com.tyron.syntaxkit.api.diagnostics.RawFixItChange;
import com.tyron.syntaxkit.api.syntax.NodeKind;
import com.tyron.syntaxkit.api.syntax.Token;
import com.tyron.syntaxkit.api.syntax.Trivia;
import com.tyron.syntaxkit.api.syntax.TriviaKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.google.common.truth.Truth.assertThat;

public class SwiftLexerTest {

    private static List<Token> tokens(String text) {
        SwiftLexer.Result result = SwiftLexer.lex(text);
        StringBuilder rendered = new StringBuilder();
        result.tokens().forEach(t -> t.appendTo(rendered));
        Assertions.assertEquals(text, rendered.toString());
        return result.tokens();
    }

    private static List<NodeKind> kinds(String text) {
        return tokens(text).stream().map(Token::kind).toList();
    }

    private static List<String> texts(String text) {
        return tokens(text).stream().map(Token::text).toList();
    }

    @Test
    public void keywordsIdentifiersAndPunctuation() {
        assertThat(kinds("public let x: Int = 1")).containsExactly(
                NodeKind.KEYWORD, NodeKind.KEYWORD, NodeKind.IDENTIFIER, NodeKind.COLON, NodeKind.IDENTIFIER,
                NodeKind.OPERATOR, NodeKind.INTEGER_LITERAL, NodeKind.END_OF_FILE).inOrder();
    }

    @Test
    public void trailingTriviaStopsAtLineBreak() {
        List<Token> tokens = tokens("let a = 1 // one\n    /// doc\n    let b");

        Token one = tokens.get(3);
        Assertions.assertEquals(List.of(Trivia.spaces(1), Trivia.lineComment("// one")), one.trailingTrivia());

        Token secondLet = tokens.get(4);
        assertThat(secondLet.leadingTrivia()).containsExactly(
                Trivia.newline(), Trivia.spaces(4), Trivia.docLineComment("/// doc"), Trivia.newline(), Trivia.spaces(4)).inOrder();
    }

    @Test
    public void endOfFileHoldsFinalTrivia() {
        List<Token> tokens = tokens("x\n\n// end\n");

        Token eof = tokens.get(tokens.size() - 1);
        Assertions.assertEquals(NodeKind.END_OF_FILE, eof.kind());
        Assertions.assertEquals("", eof.text());
        Assertions.assertEquals("\n\n// end\n", Trivia.render(eof.leadingTrivia()));
    }

    @Test
    public void emptyTextIsJustEndOfFile() {
        assertThat(kinds("")).containsExactly(NodeKind.END_OF_FILE);
        assertThat(kinds("  \n")).containsExactly(NodeKind.END_OF_FILE);
    }

    @Test
    public void commentKinds() {
        List<Token> tokens = tokens("/** doc */ /* plain /* nested */ still */ //// not doc\nx");

        List<TriviaKind> kinds = tokens.get(0).leadingTrivia().stream().map(Trivia::kind).toList();
        assertThat(kinds).containsExactly(
                TriviaKind.DOC_BLOCK_COMMENT, TriviaKind.WHITESPACE, TriviaKind.BLOCK_COMMENT, TriviaKind.WHITESPACE,
                TriviaKind.LINE_COMMENT, TriviaKind.NEWLINE).inOrder();
        Assertions.assertEquals("/* plain /* nested */ still */", tokens.get(0).leadingTrivia().get(2).text());
    }

    @Test
    public void operatorsArrowsAndRanges() {
        assertThat(texts("a...b ..< c -> d != e?.f")).containsExactly(
                "a", "...", "b", "..<", "c", "->", "d", "!=", "e", "?", ".", "f", "").inOrder();
        Assertions.assertEquals(NodeKind.ARROW, tokens("a -> b").get(1).kind());
        Assertions.assertEquals(NodeKind.OPERATOR, tokens("a --> b").get(1).kind());
    }

    @Test
    public void operatorStopsBeforeComment() {
        assertThat(texts("a +// note\nb")).containsExactly("a", "+", "b", "").inOrder();
    }

    @Test
    public void numbers() {
        assertThat(kinds("1 1_000 0xFF 3.14 1e10 2.5e-3 1.description")).containsExactly(
                NodeKind.INTEGER_LITERAL, NodeKind.INTEGER_LITERAL, NodeKind.INTEGER_LITERAL, NodeKind.FLOAT_LITERAL,
                NodeKind.FLOAT_LITERAL, NodeKind.FLOAT_LITERAL, NodeKind.INTEGER_LITERAL, NodeKind.PERIOD,
                NodeKind.IDENTIFIER, NodeKind.END_OF_FILE).inOrder();
    }

    @Test
    public void stringsWithEscapesAndInterpolation() {
        assertThat(texts("\"a\\\"b\" \"x \\(f(\"y\")) z\" #\"raw \"q\"\"#")).containsExactly(
                "\"a\\\"b\"", "\"x \\(f(\"y\")) z\"", "#\"raw \"q\"\"#", "").inOrder();
        Assertions.assertEquals(NodeKind.STRING_LITERAL, tokens("\"\"\"\nmulti\nline\n\"\"\"").get(0).kind());
        Assertions.assertTrue(SwiftLexer.lex("\"\"\"\nmulti\n\"\"\"").diagnostics().isEmpty());
    }

    @Test
    public void attributesDirectivesAndSpecialIdentifiers() {
        List<Token> tokens = tokens("@objc #if DEBUG `class` $0");

        Assertions.assertEquals(NodeKind.ATTRIBUTE, tokens.get(0).kind());
        Assertions.assertEquals(NodeKind.POUND_DIRECTIVE, tokens.get(1).kind());
        Assertions.assertEquals(NodeKind.IDENTIFIER, tokens.get(2).kind());
        Assertions.assertEquals(NodeKind.IDENTIFIER, tokens.get(3).kind());
        Assertions.assertEquals("`class`", tokens.get(3).text());
        Assertions.assertEquals("$0", tokens.get(4).text());
    }

    @Test
    public void contextualModifiersAreIdentifiers() {
        Assertions.assertEquals(NodeKind.IDENTIFIER, tokens("final class A").get(0).kind());
        Assertions.assertEquals(NodeKind.KEYWORD, tokens("final class A").get(1).kind());
    }

    @Test
    public void invalidCharacterBecomesUnknownToken() {
        SwiftLexer.Result result = SwiftLexer.lex("let a = §");

        Assertions.assertEquals(NodeKind.UNKNOWN, result.tokens().get(3).kind());
        Assertions.assertEquals(1, result.diagnostics().size());
        RawDiagnostic diagnostic = result.diagnostics().get(0);
        Assertions.assertEquals("invalid character '§' in source file", diagnostic.message());
        Assertions.assertEquals(8, diagnostic.offset());
        Assertions.assertEquals(RawFixItChange.TextChange.remove(8, "§"), diagnostic.fixIts().get(0).changes().get(0));
    }

    @Test
    public void unterminatedStringStopsAtLineEnd() {
        SwiftLexer.Result result = SwiftLexer.lex("let s = \"abc\nlet t = 1");

        Assertions.assertEquals("\"abc", result.tokens().get(3).text());
        Assertions.assertEquals("let", result.tokens().get(4).text());
        RawDiagnostic diagnostic = result.diagnostics().get(0);
        Assertions.assertEquals("unterminated string literal", diagnostic.message());
        Assertions.assertEquals(8, diagnostic.offset());
        Assertions.assertEquals(RawFixItChange.TextChange.insert(12, "\""), diagnostic.fixIts().get(0).changes().get(0));
    }

    @Test
    public void unterminatedBlockCommentRunsToEnd() {
        String text = "let a = 1 /* open";
        SwiftLexer.Result result = SwiftLexer.lex(text);

        RawDiagnostic diagnostic = result.diagnostics().get(0);
        Assertions.assertEquals("unterminated '/*' comment", diagnostic.message());
        Assertions.assertEquals(10, diagnostic.offset());
        Assertions.assertEquals(RawFixItChange.TextChange.insert(text.length(), "*/"), diagnostic.fixIts().get(0).changes().get(0));
    }

    @Test
    public void windowsLineEndingsAreSingleNewlines() {
        List<Token> tokens = tokens("a\r\nb");

        assertThat(tokens.get(1).leadingTrivia()).containsExactly(new Trivia(TriviaKind.NEWLINE, "\r\n"));
    }
}
