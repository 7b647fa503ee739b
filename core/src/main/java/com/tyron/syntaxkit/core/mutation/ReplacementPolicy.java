package com.tyron.syntaxkit.core.mutation;

import com.tyron.syntaxkit.api.mutation.NodeOperationException;
import com.tyron.syntaxkit.api.syntax.Composite;
import com.tyron.syntaxkit.api.syntax.NodeKind;
import com.tyron.syntaxkit.api.syntax.NodeRole;
import com.tyron.syntaxkit.api.syntax.SyntaxNode;
import com.tyron.syntaxkit.api.syntax.Token;

/**
 * Decides whether a node may take the place of another.
 * <ul>
 *     <li>a token only by a token, never the end-of-file token</li>
 *     <li>a composite only by a composite of the same role; declarations and statements are
 *     interchangeable</li>
 * </ul>
 */
final class ReplacementPolicy {

    private ReplacementPolicy() {
    }

    /**
     * @return the node to store in the tree: a replacement token takes over the old token's trivia
     */
    static SyntaxNode prepare(SyntaxNode target, SyntaxNode replacement) throws NodeOperationException {
        if (target instanceof Token oldToken) {
            if (!(replacement instanceof Token newToken)) {
                throw NodeOperationException.invalidReplacementContext(
                        "replacement node is not a token (target is " + oldToken.kind() + ")");
            }
            if (oldToken.kind() == NodeKind.END_OF_FILE) {
                throw NodeOperationException.invalidReplacementContext("the end-of-file token cannot be replaced");
            }
            if (newToken.kind() == NodeKind.END_OF_FILE) {
                throw NodeOperationException.invalidReplacementContext("replacement node is an end-of-file token");
            }
            return newToken.withTrivia(oldToken.leadingTrivia(), oldToken.trailingTrivia());
        }

        Composite oldComposite = (Composite) target;
        if (!(replacement instanceof Composite newComposite)) {
            throw NodeOperationException.invalidReplacementContext(
                    "replacement node is a token but the target is a " + oldComposite.role().displayName());
        }
        if (!isCompatible(oldComposite.role(), newComposite.role())) {
            throw NodeOperationException.invalidReplacementContext(
                    "a " + newComposite.role().displayName() + " cannot replace a " + oldComposite.role().displayName());
        }
        return newComposite;
    }

    static boolean isCompatible(NodeRole target, NodeRole replacement) {
        if (target == replacement) {
            return true;
        }
        return target.isStatementLike() && replacement.isStatementLike();
    }
}
