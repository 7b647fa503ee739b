package com.tyron.syntaxkit.api.mutation;

import com.tyron.syntaxkit.api.path.NodePath;
import com.tyron.syntaxkit.api.service.ServiceAccessHolder;
import com.tyron.syntaxkit.api.syntax.SyntaxNode;
import com.tyron.syntaxkit.api.syntax.SyntaxTree;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Path-based structural edits over immutable trees.
 * <p>
 * Every operation returns a new tree and leaves its input untouched. Paths are resolved against
 * the tree passed in; to chain edits, compute the next path on the returned tree. Any path that does
 * not resolve fails with {@link NodeOperationError.Kind#NODE_NOT_FOUND}.
 * <p>
 * The {@code String} overloads take token paths.
 */
public interface SyntaxMutator {

    static SyntaxMutator getInstance() {
        return ServiceAccessHolder.get().getApplicationService(SyntaxMutator.class);
    }

    /**
     * Replaces the node at {@code path}. A token can only be replaced by a token, a composite only
     * by a composite of a compatible role.
     */
    SyntaxTree replace(SyntaxTree tree, NodePath path, SyntaxNode replacement) throws NodeOperationException;

    default SyntaxTree replace(SyntaxTree tree, String tokenPath, SyntaxNode replacement) throws NodeOperationException {
        return replace(tree, NodePath.token(tokenPath), replacement);
    }

    /**
     * Removes the node at {@code path}. Trivia of neighbouring tokens is left as is, so spacing may
     * look odd afterwards.
     */
    DeletionResult delete(SyntaxTree tree, NodePath path) throws NodeOperationException;

    default DeletionResult delete(SyntaxTree tree, String tokenPath) throws NodeOperationException {
        return delete(tree, NodePath.token(tokenPath));
    }

    /**
     * Splices {@code nodes} into the anchor's parent, immediately before or after the anchor.
     */
    SyntaxTree insert(SyntaxTree tree, List<? extends SyntaxNode> nodes, NodePath anchor, InsertionPosition position)
            throws NodeOperationException;

    default SyntaxTree insert(SyntaxTree tree, List<? extends SyntaxNode> nodes, String anchorTokenPath, InsertionPosition position)
            throws NodeOperationException {
        return insert(tree, nodes, NodePath.token(anchorTokenPath), position);
    }

    /**
     * Replaces the documentation comments in the leading trivia of the token at {@code path}.
     * Blank or {@code null} text removes them. Other trivia is kept.
     */
    SyntaxTree modifyLeadingTrivia(SyntaxTree tree, NodePath path, @Nullable String newText) throws NodeOperationException;

    default SyntaxTree modifyLeadingTrivia(SyntaxTree tree, String tokenPath, @Nullable String newText) throws NodeOperationException {
        return modifyLeadingTrivia(tree, NodePath.token(tokenPath), newText);
    }

    /**
     * Replaces the comments before the first token of the file with {@code header}.
     */
    SyntaxTree replaceFileHeader(SyntaxTree tree, String header) throws NodeOperationException;

    /**
     * Tokens whose content starts on the 1-based {@code line}, in document order.
     */
    List<LineNodeInfo> findNodesAtLine(SyntaxTree tree, int line);

    Optional<LineNodeInfo> selectNodeAtLine(SyntaxTree tree, int line, LineNodeSelection selection);

    default SyntaxTree replaceAtLine(SyntaxTree tree, int line, LineNodeSelection selection, SyntaxNode replacement)
            throws NodeOperationException {
        return replace(tree, requireNodeAtLine(tree, line, selection).path(), replacement);
    }

    default DeletionResult deleteAtLine(SyntaxTree tree, int line, LineNodeSelection selection) throws NodeOperationException {
        return delete(tree, requireNodeAtLine(tree, line, selection).path());
    }

    default SyntaxTree insertAtLine(SyntaxTree tree, List<? extends SyntaxNode> nodes, int line, LineNodeSelection selection,
                                    InsertionPosition position) throws NodeOperationException {
        return insert(tree, nodes, requireNodeAtLine(tree, line, selection).path(), position);
    }

    default SyntaxTree modifyLeadingTriviaAtLine(SyntaxTree tree, int line, LineNodeSelection selection, @Nullable String newText)
            throws NodeOperationException {
        return modifyLeadingTrivia(tree, requireNodeAtLine(tree, line, selection).path(), newText);
    }

    private LineNodeInfo requireNodeAtLine(SyntaxTree tree, int line, LineNodeSelection selection) throws NodeOperationException {
        Optional<LineNodeInfo> info = selectNodeAtLine(tree, line, selection);
        if (info.isEmpty()) {
            throw NodeOperationException.nodeNotFound("line " + line);
        }
        return info.get();
    }
}
