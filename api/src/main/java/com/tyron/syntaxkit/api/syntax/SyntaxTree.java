package com.tyron.syntaxkit.api.syntax;

import com.tyron.syntaxkit.api.source.LocationConverter;
import com.tyron.syntaxkit.api.source.SourceDocument;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable syntax tree over a {@link SourceDocument}.
 * <p>
 * The root always renders to the document text exactly. Every mutation produces a new tree; the
 * old one stays valid, but paths computed against it must not be used on the new one.
 */
public final class SyntaxTree {

    private final SourceDocument document;
    private final SyntaxNode root;

    private volatile List<SyntaxElement> preorder;
    private volatile List<SyntaxElement> tokens;

    private SyntaxTree(SourceDocument document, SyntaxNode root) {
        this.document = document;
        this.root = root;
    }

    /**
     * @throws IllegalArgumentException if {@code root} does not render to the document text
     */
    public static SyntaxTree of(@NotNull SourceDocument document, @NotNull SyntaxNode root) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(root, "root");
        if (root.fullLength() != document.getLength() || !root.render().equals(document.getText())) {
            throw new IllegalArgumentException("Root of " + document.getIdentity() + " does not render to the document text");
        }
        return new SyntaxTree(document, root);
    }

    /**
     * Creates a tree whose document text is the rendering of {@code root}.
     */
    public static SyntaxTree fromRoot(@NotNull String identity, @NotNull SyntaxNode root) {
        Objects.requireNonNull(root, "root");
        return new SyntaxTree(SourceDocument.of(identity, root.render()), root);
    }

    /**
     * Returns a new tree with the same identity over {@code newRoot}.
     */
    public SyntaxTree withRoot(@NotNull SyntaxNode newRoot) {
        return fromRoot(document.getIdentity(), newRoot);
    }

    public SourceDocument getDocument() {
        return document;
    }

    public SyntaxNode getRoot() {
        return root;
    }

    public String getIdentity() {
        return document.getIdentity();
    }

    public String render() {
        return document.getText();
    }

    public LocationConverter getLocationConverter() {
        return document.getLocationConverter();
    }

    public SyntaxElement rootElement() {
        return new SyntaxElement(root, IntList.of(), 0);
    }

    /**
     * All nodes in pre-order, root first.
     */
    public List<SyntaxElement> preorder() {
        List<SyntaxElement> result = preorder;
        if (result == null) {
            List<SyntaxElement> collected = new ArrayList<>();
            collect(root, new IntArrayList(), 0, collected);
            result = Collections.unmodifiableList(collected);
            preorder = result;
        }
        return result;
    }

    /**
     * All tokens in document order, including zero-length ones.
     */
    public List<SyntaxElement> tokens() {
        List<SyntaxElement> result = tokens;
        if (result == null) {
            List<SyntaxElement> collected = new ArrayList<>();
            for (SyntaxElement element : preorder()) {
                if (element.node() instanceof Token) {
                    collected.add(element);
                }
            }
            result = Collections.unmodifiableList(collected);
            tokens = result;
        }
        return result;
    }

    /**
     * @param indexPath 0-based child indices starting at the root
     */
    public Optional<SyntaxElement> elementAt(IntList indexPath) {
        SyntaxNode current = root;
        int offset = 0;
        for (int i = 0; i < indexPath.size(); i++) {
            int index = indexPath.getInt(i);
            if (!(current instanceof Composite composite) || index < 0 || index >= composite.childCount()) {
                return Optional.empty();
            }
            for (int c = 0; c < index; c++) {
                offset += composite.child(c).fullLength();
            }
            current = composite.child(index);
        }
        return Optional.of(new SyntaxElement(current, indexPath, offset));
    }

    /**
     * Returns the token whose full text (trivia included) covers {@code offset}. The end-of-text
     * offset maps to the last token.
     */
    public Optional<SyntaxElement> tokenAt(int offset) {
        if (offset < 0 || offset > document.getLength()) {
            return Optional.empty();
        }
        List<SyntaxElement> all = tokens();
        SyntaxElement last = null;
        for (SyntaxElement token : all) {
            if (offset >= token.offset() && offset < token.endOffset()) {
                return Optional.of(token);
            }
            last = token;
        }
        return Optional.ofNullable(last);
    }

    private static void collect(SyntaxNode node, IntArrayList path, int offset, List<SyntaxElement> out) {
        out.add(new SyntaxElement(node, path, offset));
        if (node instanceof Composite composite) {
            int childOffset = offset;
            for (int i = 0; i < composite.childCount(); i++) {
                SyntaxNode child = composite.child(i);
                path.add(i);
                collect(child, path, childOffset, out);
                path.removeInt(path.size() - 1);
                childOffset += child.fullLength();
            }
        }
    }

    @Override
    public String toString() {
        return "SyntaxTree{" + document.getIdentity() + "}";
    }
}
