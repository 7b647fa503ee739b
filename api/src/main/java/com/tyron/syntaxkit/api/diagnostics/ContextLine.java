package com.tyron.syntaxkit.api.diagnostics;

public record ContextLine(int lineNumber, String text) {
}
