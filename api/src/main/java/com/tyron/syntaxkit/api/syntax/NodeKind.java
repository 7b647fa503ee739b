package com.tyron.syntaxkit.api.syntax;

import org.jetbrains.annotations.Nullable;

/**
 * Kind of a {@link SyntaxNode}. Token kinds with a fixed spelling expose it via {@link #getFixedText()}.
 */
public enum NodeKind {
    // Tokens
    KEYWORD(NodeRole.TOKEN, null),
    IDENTIFIER(NodeRole.TOKEN, null),
    ATTRIBUTE(NodeRole.TOKEN, null),
    POUND_DIRECTIVE(NodeRole.TOKEN, null),
    INTEGER_LITERAL(NodeRole.TOKEN, null),
    FLOAT_LITERAL(NodeRole.TOKEN, null),
    STRING_LITERAL(NodeRole.TOKEN, null),
    OPERATOR(NodeRole.TOKEN, null),
    LEFT_BRACE(NodeRole.TOKEN, "{"),
    RIGHT_BRACE(NodeRole.TOKEN, "}"),
    LEFT_PAREN(NodeRole.TOKEN, "("),
    RIGHT_PAREN(NodeRole.TOKEN, ")"),
    LEFT_BRACKET(NodeRole.TOKEN, "["),
    RIGHT_BRACKET(NodeRole.TOKEN, "]"),
    COLON(NodeRole.TOKEN, ":"),
    COMMA(NodeRole.TOKEN, ","),
    SEMICOLON(NodeRole.TOKEN, ";"),
    PERIOD(NodeRole.TOKEN, "."),
    ARROW(NodeRole.TOKEN, "->"),
    UNKNOWN(NodeRole.TOKEN, null),
    END_OF_FILE(NodeRole.TOKEN, ""),

    // Composites
    SOURCE_FILE(NodeRole.FILE, null),
    DECLARATION(NodeRole.DECLARATION, null),
    STATEMENT(NodeRole.STATEMENT, null),
    MEMBER_BLOCK(NodeRole.BLOCK, null),
    CODE_BLOCK(NodeRole.BLOCK, null),
    PARENTHESIZED(NodeRole.GROUP, null),
    BRACKETED(NodeRole.GROUP, null),
    UNEXPECTED(NodeRole.UNEXPECTED, null);

    private final NodeRole role;
    private final String fixedText;

    NodeKind(NodeRole role, String fixedText) {
        this.role = role;
        this.fixedText = fixedText;
    }

    public NodeRole getRole() {
        return role;
    }

    public boolean isToken() {
        return role == NodeRole.TOKEN;
    }

    public @Nullable String getFixedText() {
        return fixedText;
    }

    public boolean isOpeningDelimiter() {
        return this == LEFT_BRACE || this == LEFT_PAREN || this == LEFT_BRACKET;
    }

    public boolean isClosingDelimiter() {
        return this == RIGHT_BRACE || this == RIGHT_PAREN || this == RIGHT_BRACKET;
    }

    /**
     * @return the closing delimiter matching this opening delimiter, or {@code null}
     */
    public @Nullable NodeKind closingDelimiter() {
        return switch (this) {
            case LEFT_BRACE -> RIGHT_BRACE;
            case LEFT_PAREN -> RIGHT_PAREN;
            case LEFT_BRACKET -> RIGHT_BRACKET;
            default -> null;
        };
    }
}
