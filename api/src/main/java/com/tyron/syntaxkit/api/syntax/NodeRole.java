package com.tyron.syntaxkit.api.syntax;

/**
 * Grammatical category of a node. Replacement and insertion rules are expressed over roles.
 */
public enum NodeRole {
    TOKEN,
    FILE,
    DECLARATION,
    STATEMENT,
    BLOCK,
    GROUP,
    UNEXPECTED;

    /**
     * Declarations and statements can stand in for each other in statement lists.
     */
    public boolean isStatementLike() {
        return this == DECLARATION || this == STATEMENT;
    }

    public String displayName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
