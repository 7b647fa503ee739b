package com.tyron.syntaxkit.api.syntax;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An atomic leaf: literal content surrounded by leading and trailing trivia.
 */
public record Token(NodeKind kind, String text, List<Trivia> leadingTrivia, List<Trivia> trailingTrivia)
        implements SyntaxNode {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        if (!kind.isToken()) {
            throw new IllegalArgumentException(kind + " is not a token kind");
        }
        leadingTrivia = List.copyOf(leadingTrivia);
        trailingTrivia = List.copyOf(trailingTrivia);
    }

    public static Token of(NodeKind kind, String text) {
        return new Token(kind, text, List.of(), List.of());
    }

    /**
     * Creates a token of a kind with a fixed spelling, e.g. {@code Token.of(NodeKind.LEFT_BRACE)}.
     */
    public static Token of(NodeKind kind) {
        String fixed = kind.getFixedText();
        if (fixed == null) {
            throw new IllegalArgumentException(kind + " has no fixed text");
        }
        return of(kind, fixed);
    }

    public static Token keyword(String text) {
        return of(NodeKind.KEYWORD, text);
    }

    public static Token identifier(String text) {
        return of(NodeKind.IDENTIFIER, text);
    }

    public Token withText(String newText) {
        return new Token(kind, newText, leadingTrivia, trailingTrivia);
    }

    public Token withLeadingTrivia(List<Trivia> trivia) {
        return new Token(kind, text, trivia, trailingTrivia);
    }

    public Token withTrailingTrivia(List<Trivia> trivia) {
        return new Token(kind, text, leadingTrivia, trivia);
    }

    public Token withTrivia(List<Trivia> leading, List<Trivia> trailing) {
        return new Token(kind, text, leading, trailing);
    }

    @Override
    public int fullLength() {
        return Trivia.length(leadingTrivia) + text.length() + Trivia.length(trailingTrivia);
    }

    @Override
    public void appendTo(StringBuilder out) {
        for (Trivia t : leadingTrivia) {
            out.append(t.text());
        }
        out.append(text);
        for (Trivia t : trailingTrivia) {
            out.append(t.text());
        }
    }

    @Override
    public int leadingTriviaLength() {
        return Trivia.length(leadingTrivia);
    }

    @Override
    public int trailingTriviaLength() {
        return Trivia.length(trailingTrivia);
    }

    @Override
    public Optional<Token> firstToken() {
        return Optional.of(this);
    }

    @Override
    public Optional<Token> lastToken() {
        return Optional.of(this);
    }

    @Override
    public String toString() {
        return kind + "('" + text + "')";
    }
}
