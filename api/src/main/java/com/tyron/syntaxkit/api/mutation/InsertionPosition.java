package com.tyron.syntaxkit.api.mutation;

public enum InsertionPosition {
    BEFORE,
    AFTER
}
