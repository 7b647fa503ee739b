package com.tyron.syntaxkit.core.path;

import com.tyron.syntaxkit.api.mutation.NodeOperationException;
import com.tyron.syntaxkit.api.path.AddressingScheme;
import com.tyron.syntaxkit.api.path.NodePath;
import com.tyron.syntaxkit.api.path.PathResolver;
import com.tyron.syntaxkit.api.syntax.Composite;
import com.tyron.syntaxkit.api.syntax.NodeRole;
import com.tyron.syntaxkit.api.syntax.SyntaxElement;
import com.tyron.syntaxkit.api.syntax.SyntaxNode;
import com.tyron.syntaxkit.api.syntax.SyntaxTree;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link PathResolver}.
 * <p>
 * Token paths index {@link SyntaxTree#tokens()} directly. Declaration paths are produced by a
 * pre-order walk that keeps one counter per enclosing declaration; nodes between two declarations
 * (blocks, statements) do not open a new numbering level.
 */
public final class TreePathResolver implements PathResolver {

    private static final Logger LOG = Logger.getLogger(TreePathResolver.class.getName());

    @Override
    public Optional<NodePath> compute(SyntaxTree tree, SyntaxElement element, AddressingScheme scheme) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(element, "element");
        Objects.requireNonNull(scheme, "scheme");

        if (scheme == AddressingScheme.TOKEN) {
            List<SyntaxElement> tokens = tree.tokens();
            for (int i = 0; i < tokens.size(); i++) {
                if (tokens.get(i).indexPath().equals(element.indexPath())) {
                    return Optional.of(NodePath.token(i + 1));
                }
            }
            return Optional.empty();
        }

        for (PathEntry entry : enumerate(tree, scheme)) {
            if (entry.element().indexPath().equals(element.indexPath())) {
                return Optional.of(entry.path());
            }
        }
        return Optional.empty();
    }

    @Override
    public SyntaxElement resolve(SyntaxTree tree, NodePath path) throws NodeOperationException {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(path, "path");

        IntList segments = path.getSegments();
        if (segments == null) {
            throw notFound(path, "malformed");
        }

        if (path.getScheme() == AddressingScheme.TOKEN) {
            List<SyntaxElement> tokens = tree.tokens();
            if (segments.size() != 1 || segments.getInt(0) > tokens.size()) {
                throw notFound(path, "out of range, token count=" + tokens.size());
            }
            return tokens.get(segments.getInt(0) - 1);
        }

        SyntaxElement found = resolveDeclaration(tree, segments);
        if (found == null) {
            throw notFound(path, "no such declaration");
        }
        return found;
    }

    @Override
    public List<PathEntry> enumerate(SyntaxTree tree, AddressingScheme scheme) {
        Objects.requireNonNull(tree, "tree");
        List<PathEntry> result = new ArrayList<>();
        if (scheme == AddressingScheme.TOKEN) {
            List<SyntaxElement> tokens = tree.tokens();
            for (int i = 0; i < tokens.size(); i++) {
                result.add(new PathEntry(NodePath.token(i + 1), tokens.get(i)));
            }
            return result;
        }

        visit(tree.getRoot(), new IntArrayList(), 0, new IntArrayList(), new int[1], result);
        return result;
    }

    /**
     * Walks one segment at a time instead of enumerating the whole tree.
     */
    private static SyntaxElement resolveDeclaration(SyntaxTree tree, IntList segments) {
        SyntaxElement scope = tree.rootElement();
        boolean rootIsScope = scope.node().role() != NodeRole.DECLARATION;
        for (int i = 0; i < segments.size(); i++) {
            int wanted = segments.getInt(i);
            List<SyntaxElement> level = new ArrayList<>();
            if (i == 0 && !rootIsScope) {
                level.add(scope);
            } else {
                collectDirectDeclarations(scope, level);
            }
            if (wanted > level.size()) {
                return null;
            }
            scope = level.get(wanted - 1);
        }
        return scope;
    }

    private static void collectDirectDeclarations(SyntaxElement scope, List<SyntaxElement> out) {
        if (!(scope.node() instanceof Composite composite)) return;
        IntArrayList path = new IntArrayList(scope.indexPath());
        int offset = scope.offset();
        for (int i = 0; i < composite.childCount(); i++) {
            SyntaxNode child = composite.child(i);
            path.add(i);
            SyntaxElement element = new SyntaxElement(child, path, offset);
            if (child.role() == NodeRole.DECLARATION) {
                out.add(element);
            } else {
                collectDirectDeclarations(element, out);
            }
            path.removeInt(path.size() - 1);
            offset += child.fullLength();
        }
    }

    private static void visit(SyntaxNode node, IntArrayList indexPath, int offset,
                              IntArrayList prefix, int[] counter, List<PathEntry> out) {
        IntArrayList childPrefix = prefix;
        int[] childCounter = counter;

        if (node.role() == NodeRole.DECLARATION) {
            counter[0]++;
            childPrefix = new IntArrayList(prefix);
            childPrefix.add(counter[0]);
            childCounter = new int[1];
            out.add(new PathEntry(NodePath.declaration(childPrefix), new SyntaxElement(node, indexPath, offset)));
        }

        if (node instanceof Composite composite) {
            int childOffset = offset;
            for (int i = 0; i < composite.childCount(); i++) {
                SyntaxNode child = composite.child(i);
                indexPath.add(i);
                visit(child, indexPath, childOffset, childPrefix, childCounter, out);
                indexPath.removeInt(indexPath.size() - 1);
                childOffset += child.fullLength();
            }
        }
    }

    private static NodeOperationException notFound(NodePath path, String why) {
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Cannot resolve " + path.getScheme() + " path '" + path + "': " + why);
        }
        return NodeOperationException.nodeNotFound(path.getText());
    }
}
