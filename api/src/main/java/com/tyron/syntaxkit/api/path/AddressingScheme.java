package com.tyron.syntaxkit.api.path;

/**
 * The two addressing domains of a {@link NodePath}. They number different node subsets and a path
 * of one scheme is meaningless in the other.
 */
public enum AddressingScheme {

    /**
     * Numbers every token of the tree, end-of-file included, with a single monotonic counter:
     * {@code "1"} is the first token, {@code "2"} the second.
     */
    TOKEN,

    /**
     * Numbers declaration nodes hierarchically. Numbering restarts at 1 under each declaration, so
     * {@code "2.1"} is the first declaration nested in the second top-level declaration.
     */
    DECLARATION
}
