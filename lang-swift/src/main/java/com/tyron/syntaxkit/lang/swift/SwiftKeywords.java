package com.tyron.syntaxkit.lang.swift;

import java.util.Set;

/**
 * Keyword tables used by the lexer and the tree builder.
 */
final class SwiftKeywords {

    static final Set<String> KEYWORDS = Set.of(
            "associatedtype", "class", "deinit", "enum", "extension", "fileprivate", "func", "import", "init",
            "inout", "internal", "let", "open", "operator", "private", "precedencegroup", "protocol", "public",
            "rethrows", "static", "struct", "subscript", "typealias", "var", "actor", "macro",
            "break", "case", "catch", "continue", "default", "defer", "do", "else", "fallthrough", "for", "guard",
            "if", "in", "repeat", "return", "throw", "switch", "where", "while",
            "Any", "as", "await", "false", "is", "nil", "self", "Self", "super", "throws", "true", "try"
    );

    /**
     * Words that only act as keywords before a declaration; elsewhere they are identifiers.
     */
    static final Set<String> CONTEXTUAL_MODIFIERS = Set.of(
            "final", "override", "mutating", "nonmutating", "lazy", "weak", "unowned", "required", "convenience",
            "dynamic", "optional", "indirect", "nonisolated", "async", "prefix", "postfix", "infix"
    );

    static final Set<String> ACCESS_AND_STORAGE_MODIFIERS = Set.of(
            "public", "private", "fileprivate", "internal", "open", "static", "class"
    );

    static final Set<String> DECLARATION_KEYWORDS = Set.of(
            "import", "struct", "class", "enum", "protocol", "extension", "actor", "func", "init", "deinit",
            "subscript", "var", "let", "typealias", "associatedtype", "operator", "precedencegroup", "macro"
    );

    static final Set<String> TYPE_KEYWORDS = Set.of(
            "struct", "class", "enum", "protocol", "extension", "actor"
    );

    static final Set<String> FUNCTION_KEYWORDS = Set.of("func", "init", "deinit", "subscript");

    static final Set<String> STATEMENT_KEYWORDS = Set.of(
            "if", "guard", "while", "for", "repeat", "switch", "do", "defer"
    );

    /**
     * Keywords that continue the previous item when they start a line.
     */
    static final Set<String> CONTINUATION_KEYWORDS = Set.of("else", "where", "catch", "throws", "rethrows", "in");

    private SwiftKeywords() {
    }

    static boolean isModifier(String word) {
        return ACCESS_AND_STORAGE_MODIFIERS.contains(word) || CONTEXTUAL_MODIFIERS.contains(word);
    }
}
