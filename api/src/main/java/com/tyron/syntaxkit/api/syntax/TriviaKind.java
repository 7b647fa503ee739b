package com.tyron.syntaxkit.api.syntax;

public enum TriviaKind {
    WHITESPACE,
    NEWLINE,
    LINE_COMMENT,
    DOC_LINE_COMMENT,
    BLOCK_COMMENT,
    DOC_BLOCK_COMMENT;

    public boolean isDocumentation() {
        return this == DOC_LINE_COMMENT || this == DOC_BLOCK_COMMENT;
    }

    public boolean isComment() {
        return this != WHITESPACE && this != NEWLINE;
    }
}
