package com.tyron.syntaxkit.api.path;

import com.tyron.syntaxkit.api.mutation.NodeOperationException;
import com.tyron.syntaxkit.api.service.ServiceAccessHolder;
import com.tyron.syntaxkit.api.syntax.SyntaxElement;
import com.tyron.syntaxkit.api.syntax.SyntaxTree;

import java.util.List;
import java.util.Optional;

/**
 * Computes and resolves {@link NodePath}s against a single tree snapshot.
 * <p>
 * Both directions are pure functions of the tree: {@code resolve(tree, compute(tree, e, s))}
 * returns an element equal to {@code e} for every element in the numbered subset of scheme
 * {@code s}.
 */
public interface PathResolver {

    static PathResolver getInstance() {
        return ServiceAccessHolder.get().getApplicationService(PathResolver.class);
    }

    /**
     * @return the path of {@code element}, or empty if the scheme does not number it
     */
    Optional<NodePath> compute(SyntaxTree tree, SyntaxElement element, AddressingScheme scheme);

    /**
     * @throws NodeOperationException with kind {@code NODE_NOT_FOUND} if the path is malformed or
     *                                any segment is out of range
     */
    SyntaxElement resolve(SyntaxTree tree, NodePath path) throws NodeOperationException;

    default Optional<SyntaxElement> find(SyntaxTree tree, NodePath path) {
        try {
            return Optional.of(resolve(tree, path));
        } catch (NodeOperationException e) {
            return Optional.empty();
        }
    }

    /**
     * Every element numbered by {@code scheme}, in pre-order, paired with its path.
     */
    List<PathEntry> enumerate(SyntaxTree tree, AddressingScheme scheme);

    record PathEntry(NodePath path, SyntaxElement element) {
    }
}
