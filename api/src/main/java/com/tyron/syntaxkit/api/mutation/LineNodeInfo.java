package com.tyron.syntaxkit.api.mutation;

import com.tyron.syntaxkit.api.path.NodePath;
import com.tyron.syntaxkit.api.syntax.NodeKind;
import com.tyron.syntaxkit.api.syntax.SyntaxElement;

/**
 * A token whose content starts on a given line.
 *
 * @param path   token path of the node
 * @param line   1-based line
 * @param column 1-based column of the content
 * @param length content length, trivia excluded
 */
public record LineNodeInfo(NodePath path, SyntaxElement element, int line, int column, int length) {

    public NodeKind kind() {
        return element.kind();
    }

    public String text() {
        return element.contentText();
    }
}
