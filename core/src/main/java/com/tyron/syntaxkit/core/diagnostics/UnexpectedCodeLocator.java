package com.tyron.syntaxkit.core.diagnostics;

import com.tyron.syntaxkit.api.source.LocationConverter;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Repositions diagnostics of the form {@code unexpected code 'X' ...}.
 * <p>
 * Parsers report this message class at the start of the enclosing construct rather than at
 * {@code X}. The locator looks for the literal {@code X} starting at the reported offset, up to
 * {@code searchLines} lines further down, then back up the same number of lines. Any other message
 * is left alone.
 */
public final class UnexpectedCodeLocator {

    private static final Pattern UNEXPECTED_CODE = Pattern.compile("unexpected code '(.+?)'(?=[\\s.,;:]|$)", Pattern.DOTALL);

    private UnexpectedCodeLocator() {
    }

    /**
     * @return the quoted text if {@code message} starts with {@code unexpected code '...'}
     */
    public static Optional<String> quotedText(String message) {
        Matcher matcher = UNEXPECTED_CODE.matcher(message);
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1));
    }

    /**
     * @param rawOffset the parser's offset, already clamped into the text
     * @return the offset of the quoted text, or empty if the message does not qualify or the text
     *         is not found nearby
     */
    public static OptionalInt locate(String message, LocationConverter converter, String text, int rawOffset, int searchLines) {
        Optional<String> quoted = quotedText(message);
        if (quoted.isEmpty()) {
            return OptionalInt.empty();
        }
        String code = quoted.get();
        int rawLine = converter.locate(rawOffset).line();

        int lastLine = Math.min(converter.getLineCount(), rawLine + searchLines);
        int forwardLimit = lastLine < converter.getLineCount() ? converter.getLineStartOffset(lastLine + 1) : text.length();
        int forward = text.indexOf(code, rawOffset);
        if (forward >= 0 && forward < forwardLimit) {
            return OptionalInt.of(forward);
        }

        int firstLine = Math.max(1, rawLine - searchLines);
        int backwardLimit = converter.getLineStartOffset(firstLine);
        if (rawOffset > 0) {
            int backward = text.lastIndexOf(code, rawOffset - 1);
            if (backward >= backwardLimit) {
                return OptionalInt.of(backward);
            }
        }
        return OptionalInt.empty();
    }
}
