package com.tyron.syntaxkit.core.mutation;

import com.tyron.syntaxkit.api.mutation.DeletionResult;
import com.tyron.syntaxkit.api.mutation.InsertionPosition;
import com.tyron.syntaxkit.api.mutation.LineNodeInfo;
import com.tyron.syntaxkit.api.mutation.LineNodeSelection;
import com.tyron.syntaxkit.api.mutation.NodeOperationException;
import com.tyron.syntaxkit.api.mutation.SyntaxMutator;
import com.tyron.syntaxkit.api.path.NodePath;
import com.tyron.syntaxkit.api.path.PathResolver;
import com.tyron.syntaxkit.api.syntax.Composite;
import com.tyron.syntaxkit.api.syntax.NodeKind;
import com.tyron.syntaxkit.api.syntax.SyntaxElement;
import com.tyron.syntaxkit.api.syntax.SyntaxNode;
import com.tyron.syntaxkit.api.syntax.SyntaxTree;
import com.tyron.syntaxkit.api.syntax.Token;
import com.tyron.syntaxkit.core.config.SyntaxKitSettings;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link SyntaxMutator}.
 * <p>
 * Every operation is resolve, validate, rebuild. Validation failures surface as
 * {@link NodeOperationException}s; an unexpected failure while rebuilding is reported as
 * {@code AST_MODIFICATION_FAILED}. Nothing is cached between calls.
 */
public final class SyntaxMutationEngine implements SyntaxMutator {

    private static final Logger LOG = Logger.getLogger(SyntaxMutationEngine.class.getName());

    private final PathResolver pathResolver;
    private final LeadingTriviaEditor triviaEditor;

    public SyntaxMutationEngine() {
        this(SyntaxKitSettings.getInstance(), PathResolver.getInstance());
    }

    public SyntaxMutationEngine(SyntaxKitSettings settings, PathResolver pathResolver) {
        Objects.requireNonNull(settings, "settings");
        this.pathResolver = Objects.requireNonNull(pathResolver, "pathResolver");
        this.triviaEditor = new LeadingTriviaEditor(settings.docLinePrefix());
    }

    @Override
    public SyntaxTree replace(SyntaxTree tree, NodePath path, SyntaxNode replacement) throws NodeOperationException {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(replacement, "replacement");

        SyntaxElement target = pathResolver.resolve(tree, path);
        SyntaxNode prepared = ReplacementPolicy.prepare(target.node(), replacement);
        SyntaxTree result = rebuild("replace", tree, () -> TreeRewriter.replace(tree.getRoot(), target.indexPath(), prepared));

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Replaced " + target.kind() + " at " + path + " in " + tree.getIdentity());
        }
        return result;
    }

    @Override
    public DeletionResult delete(SyntaxTree tree, NodePath path) throws NodeOperationException {
        Objects.requireNonNull(tree, "tree");

        SyntaxElement target = pathResolver.resolve(tree, path);
        if (target.isRoot()) {
            throw NodeOperationException.invalidReplacementContext("the root node cannot be deleted");
        }
        if (target.kind() == NodeKind.END_OF_FILE) {
            throw NodeOperationException.invalidReplacementContext("the end-of-file token cannot be deleted");
        }

        String removedText = target.node().render();
        int index = target.indexInParent();
        SyntaxTree result = rebuild("delete", tree,
                () -> TreeRewriter.editParent(tree.getRoot(), target.parentIndexPath(), parent -> parent.withoutChild(index)));

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Deleted " + target.kind() + " at " + path + " (" + removedText.length() + " chars) in " + tree.getIdentity());
        }
        return new DeletionResult(removedText, result);
    }

    @Override
    public SyntaxTree insert(SyntaxTree tree, List<? extends SyntaxNode> nodes, NodePath anchor, InsertionPosition position)
            throws NodeOperationException {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(position, "position");

        SyntaxElement anchorElement = pathResolver.resolve(tree, anchor);
        if (anchorElement.isRoot()) {
            throw NodeOperationException.invalidInsertionPoint("the root node has no siblings");
        }
        Optional<SyntaxElement> parentElement = tree.elementAt(anchorElement.parentIndexPath());
        if (parentElement.isEmpty() || !(parentElement.get().node() instanceof Composite parent)) {
            throw NodeOperationException.modificationFailed("parent of " + anchor + " is not a composite", null);
        }

        int anchorIndex = anchorElement.indexInParent();
        InsertionPolicy.check(parent, anchorIndex, position, nodes);

        int insertAt = position == InsertionPosition.BEFORE ? anchorIndex : anchorIndex + 1;
        List<SyntaxNode> copy = List.copyOf(nodes);
        SyntaxTree result = rebuild("insert", tree,
                () -> TreeRewriter.editParent(tree.getRoot(), anchorElement.parentIndexPath(),
                        p -> p.withChildrenInserted(insertAt, copy)));

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Inserted " + copy.size() + " node(s) " + position + " " + anchor + " in " + tree.getIdentity());
        }
        return result;
    }

    @Override
    public SyntaxTree modifyLeadingTrivia(SyntaxTree tree, NodePath path, @Nullable String newText) throws NodeOperationException {
        Objects.requireNonNull(tree, "tree");

        SyntaxElement target = pathResolver.resolve(tree, path);
        if (!(target.node() instanceof Token token)) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Path " + path + " resolves to " + target.kind() + ", not a token");
            }
            throw NodeOperationException.nodeNotFound(path.getText());
        }

        Token updated = triviaEditor.apply(token, newText);
        SyntaxTree result = rebuild("modifyLeadingTrivia", tree,
                () -> TreeRewriter.replace(tree.getRoot(), target.indexPath(), updated));

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Rewrote documentation of token " + path + " in " + tree.getIdentity());
        }
        return result;
    }

    @Override
    public SyntaxTree replaceFileHeader(SyntaxTree tree, String header) throws NodeOperationException {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(header, "header");

        SyntaxElement first = pathResolver.resolve(tree, NodePath.token(1));
        Token updated = FileHeaderEditor.apply((Token) first.node(), header);
        return rebuild("replaceFileHeader", tree, () -> TreeRewriter.replace(tree.getRoot(), first.indexPath(), updated));
    }

    @Override
    public List<LineNodeInfo> findNodesAtLine(SyntaxTree tree, int line) {
        Objects.requireNonNull(tree, "tree");
        return LineNodeFinder.findNodesAtLine(tree, line);
    }

    @Override
    public Optional<LineNodeInfo> selectNodeAtLine(SyntaxTree tree, int line, LineNodeSelection selection) {
        Objects.requireNonNull(selection, "selection");
        return LineNodeFinder.select(findNodesAtLine(tree, line), selection);
    }

    private static SyntaxTree rebuild(String operation, SyntaxTree tree, Supplier<SyntaxNode> newRoot) throws NodeOperationException {
        try {
            return tree.withRoot(newRoot.get());
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, operation + " failed on " + tree.getIdentity(), e);
            throw NodeOperationException.modificationFailed(operation + ": " + e.getMessage(), e);
        }
    }
}
