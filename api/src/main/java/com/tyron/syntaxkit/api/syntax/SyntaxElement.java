package com.tyron.syntaxkit.api.syntax;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.Objects;

/**
 * A node located inside a specific {@link SyntaxTree} snapshot.
 *
 * @param node      the node
 * @param indexPath 0-based child indices from the root to {@code node}; empty for the root
 * @param offset    absolute offset of the node's first character, leading trivia included
 */
public record SyntaxElement(SyntaxNode node, IntList indexPath, int offset) {

    public SyntaxElement {
        Objects.requireNonNull(node, "node");
        indexPath = IntLists.unmodifiable(new IntArrayList(indexPath));
        if (offset < 0) {
            throw new IllegalArgumentException("offset < 0: " + offset);
        }
    }

    /**
     * Offset just past the node's trailing trivia.
     */
    public int endOffset() {
        return offset + node.fullLength();
    }

    /**
     * Offset of the node's content, after the first token's leading trivia.
     */
    public int contentOffset() {
        return offset + node.leadingTriviaLength();
    }

    /**
     * Offset just past the node's content, before the last token's trailing trivia.
     */
    public int contentEndOffset() {
        return Math.max(contentOffset(), endOffset() - node.trailingTriviaLength());
    }

    public int depth() {
        return indexPath.size();
    }

    public boolean isRoot() {
        return indexPath.isEmpty();
    }

    /**
     * @return the index of this element among its parent's children, -1 for the root
     */
    public int indexInParent() {
        return indexPath.isEmpty() ? -1 : indexPath.getInt(indexPath.size() - 1);
    }

    public IntList parentIndexPath() {
        if (indexPath.isEmpty()) {
            throw new IllegalStateException("the root has no parent");
        }
        return indexPath.subList(0, indexPath.size() - 1);
    }

    public NodeKind kind() {
        return node.kind();
    }

    /**
     * Text of the node with the outer leading and trailing trivia removed.
     */
    public String contentText() {
        String full = node.render();
        int start = node.leadingTriviaLength();
        int end = Math.max(start, full.length() - node.trailingTriviaLength());
        return full.substring(start, end);
    }
}
