package com.tyron.syntaxkit.core.mutation;

import com.tyron.syntaxkit.api.mutation.InsertionPosition;
import com.tyron.syntaxkit.api.mutation.NodeOperationException;
import com.tyron.syntaxkit.api.syntax.Composite;
import com.tyron.syntaxkit.api.syntax.NodeKind;
import com.tyron.syntaxkit.api.syntax.NodeRole;
import com.tyron.syntaxkit.api.syntax.SyntaxNode;

import java.util.List;

/**
 * Decides whether nodes may be spliced next to an anchor inside a given parent.
 * <p>
 * Files and blocks hold lists of declarations and statements. Declarations, statements, groups and
 * unexpected runs hold tokens and nested blocks or groups. Nothing goes outside the delimiters of a
 * block or group, or after the end-of-file token.
 */
final class InsertionPolicy {

    private InsertionPolicy() {
    }

    static void check(Composite parent, int anchorIndex, InsertionPosition position,
                      List<? extends SyntaxNode> nodes) throws NodeOperationException {
        if (nodes.isEmpty()) {
            throw NodeOperationException.invalidInsertionPoint("no nodes to insert");
        }

        SyntaxNode anchor = parent.child(anchorIndex);
        if (position == InsertionPosition.AFTER && anchor.kind() == NodeKind.END_OF_FILE) {
            throw NodeOperationException.invalidInsertionPoint("nothing can follow the end-of-file token");
        }
        if (position == InsertionPosition.BEFORE && anchorIndex == 0 && parent.child(0).kind().isOpeningDelimiter()) {
            throw NodeOperationException.invalidInsertionPoint(
                    "cannot insert before the opening delimiter of a " + parent.role().displayName());
        }
        int lastIndex = parent.childCount() - 1;
        if (position == InsertionPosition.AFTER && anchorIndex == lastIndex && parent.child(lastIndex).kind().isClosingDelimiter()) {
            throw NodeOperationException.invalidInsertionPoint(
                    "cannot insert after the closing delimiter of a " + parent.role().displayName());
        }

        boolean listParent = parent.role() == NodeRole.FILE || parent.role() == NodeRole.BLOCK;
        for (SyntaxNode node : nodes) {
            NodeRole role = node.role();
            if (role == NodeRole.FILE || node.kind() == NodeKind.END_OF_FILE) {
                throw NodeOperationException.invalidInsertionPoint("a " + describe(node) + " cannot be inserted");
            }
            if (listParent && !role.isStatementLike()) {
                throw NodeOperationException.invalidInsertionPoint(
                        "a " + parent.role().displayName() + " only accepts declarations and statements, got " + describe(node));
            }
            if (!listParent && role.isStatementLike()) {
                throw NodeOperationException.invalidInsertionPoint(
                        "a " + parent.role().displayName() + " only accepts tokens, blocks and groups, got " + describe(node));
            }
        }
    }

    private static String describe(SyntaxNode node) {
        if (node.kind() == NodeKind.END_OF_FILE) {
            return "end-of-file token";
        }
        return node.role().displayName();
    }
}
