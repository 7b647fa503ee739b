package com.tyron.syntaxkit.core.mutation;

import com.tyron.syntaxkit.api.syntax.Composite;
import com.tyron.syntaxkit.api.syntax.SyntaxNode;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.function.UnaryOperator;

/**
 * Copy-on-write rebuilding of the ancestor chain of an edit. Only the composites on the path from
 * the root to the edited slot are recreated; every other subtree is reused.
 */
final class TreeRewriter {

    private TreeRewriter() {
    }

    /**
     * Replaces the node at {@code indexPath} (0-based child indices from the root).
     */
    static SyntaxNode replace(SyntaxNode root, IntList indexPath, SyntaxNode replacement) {
        if (indexPath.isEmpty()) {
            return replacement;
        }
        int last = indexPath.getInt(indexPath.size() - 1);
        return editParent(root, indexPath.subList(0, indexPath.size() - 1), parent -> parent.withChild(last, replacement));
    }

    /**
     * Applies {@code edit} to the composite at {@code parentPath} and rebuilds its ancestors.
     *
     * @throws IllegalStateException if {@code parentPath} does not lead to a composite
     */
    static SyntaxNode editParent(SyntaxNode root, IntList parentPath, UnaryOperator<Composite> edit) {
        return rebuild(root, parentPath, 0, edit);
    }

    private static SyntaxNode rebuild(SyntaxNode node, IntList parentPath, int depth, UnaryOperator<Composite> edit) {
        if (!(node instanceof Composite composite)) {
            throw new IllegalStateException("Expected a composite at depth " + depth + " but found " + node.kind());
        }
        if (depth == parentPath.size()) {
            return edit.apply(composite);
        }
        int index = parentPath.getInt(depth);
        SyntaxNode rebuilt = rebuild(composite.child(index), parentPath, depth + 1, edit);
        return composite.withChild(index, rebuilt);
    }
}
