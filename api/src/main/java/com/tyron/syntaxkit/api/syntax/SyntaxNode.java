package com.tyron.syntaxkit.api.syntax;

import java.util.Optional;

/**
 * An immutable node of a syntax tree: either a {@link Token} or a {@link Composite}.
 * <p>
 * Nodes carry no position and no parent pointer, so the same node value can be reused by several
 * tree snapshots. Positions are attached by {@link SyntaxElement}.
 */
public sealed interface SyntaxNode permits Token, Composite {

    NodeKind kind();

    default NodeRole role() {
        return kind().getRole();
    }

    /**
     * Length of the rendered text, trivia included.
     */
    int fullLength();

    void appendTo(StringBuilder out);

    /**
     * The node's full text: every token's leading trivia, content and trailing trivia, in order.
     */
    default String render() {
        StringBuilder sb = new StringBuilder(fullLength());
        appendTo(sb);
        return sb.toString();
    }

    /**
     * Length of the leading trivia of the first token, 0 if there is none.
     */
    int leadingTriviaLength();

    /**
     * Length of the trailing trivia of the last token, 0 if there is none.
     */
    int trailingTriviaLength();

    Optional<Token> firstToken();

    Optional<Token> lastToken();

    default boolean isToken() {
        return this instanceof Token;
    }
}
