package com.tyron.syntaxkit.api.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A non-leaf node whose text is the concatenation of its children's text.
 * <p>
 * The {@code with*} methods return new composites; untouched children are shared.
 */
public record Composite(NodeKind kind, List<SyntaxNode> children) implements SyntaxNode {

    public Composite {
        Objects.requireNonNull(kind, "kind");
        if (kind.isToken()) {
            throw new IllegalArgumentException(kind + " is a token kind");
        }
        children = List.copyOf(children);
    }

    public static Composite of(NodeKind kind, SyntaxNode... children) {
        return new Composite(kind, List.of(children));
    }

    public int childCount() {
        return children.size();
    }

    public SyntaxNode child(int index) {
        return children.get(index);
    }

    public Composite withChild(int index, SyntaxNode replacement) {
        Objects.checkIndex(index, children.size());
        List<SyntaxNode> copy = new ArrayList<>(children);
        copy.set(index, Objects.requireNonNull(replacement, "replacement"));
        return new Composite(kind, copy);
    }

    public Composite withoutChild(int index) {
        Objects.checkIndex(index, children.size());
        List<SyntaxNode> copy = new ArrayList<>(children);
        copy.remove(index);
        return new Composite(kind, copy);
    }

    /**
     * Inserts {@code nodes} so that the first of them ends up at {@code index}.
     */
    public Composite withChildrenInserted(int index, List<? extends SyntaxNode> nodes) {
        Objects.checkIndex(index, children.size() + 1);
        List<SyntaxNode> copy = new ArrayList<>(children.size() + nodes.size());
        copy.addAll(children.subList(0, index));
        copy.addAll(nodes);
        copy.addAll(children.subList(index, children.size()));
        return new Composite(kind, copy);
    }

    @Override
    public int fullLength() {
        int len = 0;
        for (SyntaxNode child : children) {
            len += child.fullLength();
        }
        return len;
    }

    @Override
    public void appendTo(StringBuilder out) {
        for (SyntaxNode child : children) {
            child.appendTo(out);
        }
    }

    @Override
    public int leadingTriviaLength() {
        return firstToken().map(Token::leadingTriviaLength).orElse(0);
    }

    @Override
    public int trailingTriviaLength() {
        return lastToken().map(Token::trailingTriviaLength).orElse(0);
    }

    @Override
    public Optional<Token> firstToken() {
        for (SyntaxNode child : children) {
            Optional<Token> token = child.firstToken();
            if (token.isPresent()) return token;
        }
        return Optional.empty();
    }

    @Override
    public Optional<Token> lastToken() {
        for (int i = children.size() - 1; i >= 0; i--) {
            Optional<Token> token = children.get(i).lastToken();
            if (token.isPresent()) return token;
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return kind + "[" + children.size() + " children]";
    }
}
