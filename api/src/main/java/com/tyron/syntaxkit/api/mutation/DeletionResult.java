package com.tyron.syntaxkit.api.mutation;

import com.tyron.syntaxkit.api.syntax.SyntaxTree;

import java.util.Objects;

/**
 * @param removedText exact rendered text of the deleted node, its own trivia included
 * @param tree        the tree without the node
 */
public record DeletionResult(String removedText, SyntaxTree tree) {

    public DeletionResult {
        Objects.requireNonNull(removedText, "removedText");
        Objects.requireNonNull(tree, "tree");
    }
}
