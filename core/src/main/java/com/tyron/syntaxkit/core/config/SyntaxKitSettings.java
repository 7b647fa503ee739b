package com.tyron.syntaxkit.core.config;

import com.tyron.syntaxkit.api.service.ServiceAccessHolder;

import java.util.Objects;

/**
 * Tunables of the diagnostic extractor and the mutation engine, registered as an application service.
 *
 * @param contextRadius         lines of context above and below a diagnostic's line
 * @param positionCorrection    whether "unexpected code" diagnostics are repositioned
 * @param correctionSearchLines lines searched after, then before, the reported line
 * @param docLinePrefix         prefix given to plain lines passed to {@code modifyLeadingTrivia}
 */
public record SyntaxKitSettings(
        int contextRadius,
        boolean positionCorrection,
        int correctionSearchLines,
        String docLinePrefix
) {

    public static final SyntaxKitSettings DEFAULTS = new SyntaxKitSettings(1, true, 5, "/// ");

    public SyntaxKitSettings {
        if (contextRadius < 0) throw new IllegalArgumentException("contextRadius < 0: " + contextRadius);
        if (correctionSearchLines < 0) {
            throw new IllegalArgumentException("correctionSearchLines < 0: " + correctionSearchLines);
        }
        Objects.requireNonNull(docLinePrefix, "docLinePrefix");
        // each prefixed line becomes a complete comment, so only line comments qualify
        if (!docLinePrefix.startsWith("///") || docLinePrefix.contains("\n") || docLinePrefix.contains("\r")) {
            throw new IllegalArgumentException("docLinePrefix must start a doc line comment: '" + docLinePrefix + "'");
        }
    }

    public static SyntaxKitSettings getInstance() {
        return ServiceAccessHolder.get().getApplicationService(SyntaxKitSettings.class);
    }

    public SyntaxKitSettings withContextRadius(int radius) {
        return new SyntaxKitSettings(radius, positionCorrection, correctionSearchLines, docLinePrefix);
    }

    public SyntaxKitSettings withPositionCorrection(boolean enabled) {
        return new SyntaxKitSettings(contextRadius, enabled, correctionSearchLines, docLinePrefix);
    }

    public SyntaxKitSettings withCorrectionSearchLines(int lines) {
        return new SyntaxKitSettings(contextRadius, positionCorrection, lines, docLinePrefix);
    }

    public SyntaxKitSettings withDocLinePrefix(String prefix) {
        return new SyntaxKitSettings(contextRadius, positionCorrection, correctionSearchLines, prefix);
    }
}
