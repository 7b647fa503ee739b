package com.tyron.syntaxkit.lang.swift;

import com.tyron.syntaxkit.api.diagnostics.RawDiagnostic;
import com.tyron.syntaxkit.api.diagnostics.RawFixIt;
import com.tyron.syntaxkit.api.diagnostics.RawFixItChange;
import com.tyron.syntaxkit.api.syntax.NodeKind;
import com.tyron.syntaxkit.api.syntax.Token;
import com.tyron.syntaxkit.api.syntax.Trivia;
import com.tyron.syntaxkit.api.syntax.TriviaKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits Swift source text into tokens with attached trivia.
 * <p>
 * Trailing trivia of a token is the whitespace and comments up to, not including, the next line
 * break. Everything else is leading trivia of the following token. The last token is always a
 * zero-length {@link NodeKind#END_OF_FILE} holding the trivia at the end of the file.
 * <p>
 * Lexing never fails: malformed input produces {@link NodeKind#UNKNOWN} tokens or truncated
 * literals and a raw diagnostic.
 */
final class SwiftLexer {

    private static final String OPERATOR_CHARS = "/=-+!*%<>&|^~?";

    record Result(List<Token> tokens, List<RawDiagnostic> diagnostics) {
    }

    private final String text;
    private final int length;
    private int pos;
    private int tokenStart;

    private final List<Token> tokens = new ArrayList<>();
    private final List<RawDiagnostic> diagnostics = new ArrayList<>();

    private SwiftLexer(String text) {
        this.text = text;
        this.length = text.length();
    }

    static Result lex(String text) {
        SwiftLexer lexer = new SwiftLexer(text);
        lexer.run();
        return new Result(List.copyOf(lexer.tokens), List.copyOf(lexer.diagnostics));
    }

    private void run() {
        List<Trivia> leading = scanTrivia(false);
        while (pos < length) {
            NodeKind kind = scanToken();
            String content = text.substring(tokenStart, pos);
            List<Trivia> trailing = scanTrivia(true);
            tokens.add(new Token(kind, content, leading, trailing));
            leading = scanTrivia(false);
        }
        tokens.add(new Token(NodeKind.END_OF_FILE, "", leading, List.of()));
    }

    private NodeKind scanToken() {
        tokenStart = pos;
        char c = text.charAt(pos);

        if (isIdentifierStart(c)) {
            scanIdentifierPart();
            String word = text.substring(tokenStart, pos);
            return SwiftKeywords.KEYWORDS.contains(word) ? NodeKind.KEYWORD : NodeKind.IDENTIFIER;
        }
        if (c == '`') {
            int close = text.indexOf('`', pos + 1);
            int lineEnd = lineEnd(pos);
            if (close > pos + 1 && close < lineEnd) {
                pos = close + 1;
                return NodeKind.IDENTIFIER;
            }
        }
        if (c == '$' && pos + 1 < length && (Character.isLetterOrDigit(text.charAt(pos + 1)) || text.charAt(pos + 1) == '_')) {
            pos++;
            scanIdentifierPart();
            return NodeKind.IDENTIFIER;
        }
        if (c == '@' && pos + 1 < length && isIdentifierStart(text.charAt(pos + 1))) {
            pos++;
            scanIdentifierPart();
            return NodeKind.ATTRIBUTE;
        }
        if (c == '#') {
            if (pos + 1 < length && (text.charAt(pos + 1) == '"' || text.charAt(pos + 1) == '#')) {
                if (scanRawString()) {
                    return NodeKind.STRING_LITERAL;
                }
            } else if (pos + 1 < length && isIdentifierStart(text.charAt(pos + 1))) {
                pos++;
                scanIdentifierPart();
                return NodeKind.POUND_DIRECTIVE;
            }
        }
        if (Character.isDigit(c)) {
            return scanNumber();
        }
        if (c == '"') {
            scanString();
            return NodeKind.STRING_LITERAL;
        }

        NodeKind punctuation = switch (c) {
            case '{' -> NodeKind.LEFT_BRACE;
            case '}' -> NodeKind.RIGHT_BRACE;
            case '(' -> NodeKind.LEFT_PAREN;
            case ')' -> NodeKind.RIGHT_PAREN;
            case '[' -> NodeKind.LEFT_BRACKET;
            case ']' -> NodeKind.RIGHT_BRACKET;
            case ':' -> NodeKind.COLON;
            case ',' -> NodeKind.COMMA;
            case ';' -> NodeKind.SEMICOLON;
            default -> null;
        };
        if (punctuation != null) {
            pos++;
            return punctuation;
        }

        if (c == '.') {
            if (pos + 1 < length && text.charAt(pos + 1) == '.') {
                while (pos < length && (text.charAt(pos) == '.' || text.charAt(pos) == '<')) {
                    pos++;
                }
                return NodeKind.OPERATOR;
            }
            pos++;
            return NodeKind.PERIOD;
        }

        if (OPERATOR_CHARS.indexOf(c) >= 0) {
            while (pos < length && OPERATOR_CHARS.indexOf(text.charAt(pos)) >= 0 && !startsComment(pos)) {
                pos++;
            }
            if (pos == tokenStart) {
                // never produce an empty token
                pos++;
            }
            return pos - tokenStart == 2 && text.startsWith("->", tokenStart) ? NodeKind.ARROW : NodeKind.OPERATOR;
        }

        pos += Character.charCount(text.codePointAt(pos));
        String bad = text.substring(tokenStart, pos);
        diagnostics.add(RawDiagnostic.error("invalid character '" + bad + "' in source file", tokenStart)
                .withFixIts(List.of(RawFixIt.of("remove invalid character",
                        RawFixItChange.TextChange.remove(tokenStart, bad)))));
        return NodeKind.UNKNOWN;
    }

    private NodeKind scanNumber() {
        boolean isFloat = false;
        if (text.startsWith("0x", pos) || text.startsWith("0b", pos) || text.startsWith("0o", pos)) {
            pos += 2;
            while (pos < length && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
                pos++;
            }
            return NodeKind.INTEGER_LITERAL;
        }
        scanDigits();
        if (pos + 1 < length && text.charAt(pos) == '.' && Character.isDigit(text.charAt(pos + 1))) {
            isFloat = true;
            pos++;
            scanDigits();
        }
        if (pos < length && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int save = pos;
            pos++;
            if (pos < length && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < length && Character.isDigit(text.charAt(pos))) {
                isFloat = true;
                scanDigits();
            } else {
                pos = save;
            }
        }
        return isFloat ? NodeKind.FLOAT_LITERAL : NodeKind.INTEGER_LITERAL;
    }

    private void scanDigits() {
        while (pos < length && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }
    }

    private void scanString() {
        int start = pos;
        if (text.startsWith("\"\"\"", pos)) {
            pos += 3;
            int close = findUnescaped("\"\"\"", pos);
            if (close < 0) {
                pos = length;
                reportUnterminatedString(start, "\"\"\"");
            } else {
                pos = close + 3;
            }
            return;
        }

        pos++;
        while (pos < length) {
            char c = text.charAt(pos);
            if (c == '\n' || c == '\r') {
                break;
            }
            if (c == '\\') {
                if (pos + 1 < length && text.charAt(pos + 1) == '(') {
                    pos = skipInterpolation(pos + 2);
                    continue;
                }
                pos = Math.min(length, pos + 2);
                continue;
            }
            pos++;
            if (c == '"') {
                return;
            }
        }
        reportUnterminatedString(start, "\"");
    }

    /**
     * Scans {@code #"..."#} style strings. Returns false, without moving, if the hashes are not
     * followed by a quote.
     */
    private boolean scanRawString() {
        int hashes = 0;
        int p = pos;
        while (p < length && text.charAt(p) == '#') {
            hashes++;
            p++;
        }
        if (p >= length || text.charAt(p) != '"') {
            return false;
        }
        int start = pos;
        boolean multiline = text.startsWith("\"\"\"", p);
        String terminator = (multiline ? "\"\"\"" : "\"") + "#".repeat(hashes);
        int bodyStart = p + (multiline ? 3 : 1);
        int close = text.indexOf(terminator, bodyStart);
        int limit = multiline ? length : lineEnd(bodyStart);
        if (close < 0 || close >= limit) {
            pos = limit;
            reportUnterminatedString(start, terminator);
        } else {
            pos = close + terminator.length();
        }
        return true;
    }

    private int skipInterpolation(int from) {
        int depth = 1;
        int p = from;
        while (p < length && depth > 0) {
            char c = text.charAt(p);
            if (c == '\n' || c == '\r') {
                return p;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == '"') {
                int close = text.indexOf('"', p + 1);
                if (close < 0 || close > lineEnd(p)) {
                    return lineEnd(p);
                }
                p = close;
            }
            p++;
        }
        return p;
    }

    private int findUnescaped(String needle, int from) {
        int p = from;
        while (p < length) {
            if (text.charAt(p) == '\\') {
                p += 2;
                continue;
            }
            if (text.startsWith(needle, p)) {
                return p;
            }
            p++;
        }
        return -1;
    }

    private void reportUnterminatedString(int start, String terminator) {
        diagnostics.add(RawDiagnostic.error("unterminated string literal", start)
                .withFixIts(List.of(RawFixIt.of("insert closing quote",
                        RawFixItChange.TextChange.insert(pos, terminator)))));
    }

    private List<Trivia> scanTrivia(boolean trailing) {
        List<Trivia> pieces = new ArrayList<>();
        while (pos < length) {
            char c = text.charAt(pos);
            int start = pos;
            if (c == '\n' || c == '\r') {
                if (trailing) {
                    break;
                }
                pos += text.startsWith("\r\n", pos) ? 2 : 1;
                pieces.add(new Trivia(TriviaKind.NEWLINE, text.substring(start, pos)));
            } else if (c == ' ' || c == '\t' || c == '\f' || c == '\u000B') {
                while (pos < length && isHorizontalSpace(text.charAt(pos))) {
                    pos++;
                }
                pieces.add(new Trivia(TriviaKind.WHITESPACE, text.substring(start, pos)));
            } else if (text.startsWith("//", pos)) {
                pos = lineEnd(pos);
                boolean doc = text.startsWith("///", start) && !text.startsWith("////", start);
                pieces.add(new Trivia(doc ? TriviaKind.DOC_LINE_COMMENT : TriviaKind.LINE_COMMENT, text.substring(start, pos)));
            } else if (text.startsWith("/*", pos)) {
                pos = blockCommentEnd(start);
                boolean doc = text.startsWith("/**", start) && !text.startsWith("/**/", start);
                pieces.add(new Trivia(doc ? TriviaKind.DOC_BLOCK_COMMENT : TriviaKind.BLOCK_COMMENT, text.substring(start, pos)));
            } else {
                break;
            }
        }
        return pieces;
    }

    /**
     * Block comments nest. An unterminated comment runs to the end of the file.
     */
    private int blockCommentEnd(int start) {
        int depth = 0;
        int p = start;
        while (p < length) {
            if (text.startsWith("/*", p)) {
                depth++;
                p += 2;
            } else if (text.startsWith("*/", p)) {
                depth--;
                p += 2;
                if (depth == 0) {
                    return p;
                }
            } else {
                p++;
            }
        }
        diagnostics.add(RawDiagnostic.error("unterminated '/*' comment", start)
                .withFixIts(List.of(RawFixIt.of("insert '*/'",
                        RawFixItChange.TextChange.insert(length, "*/".repeat(Math.max(depth, 1)))))));
        return length;
    }

    private boolean startsComment(int p) {
        return text.startsWith("//", p) || text.startsWith("/*", p);
    }

    private int lineEnd(int from) {
        int p = from;
        while (p < length && text.charAt(p) != '\n' && text.charAt(p) != '\r') {
            p++;
        }
        return p;
    }

    private void scanIdentifierPart() {
        while (pos < length && isIdentifierPart(text.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    private static boolean isHorizontalSpace(char c) {
        return c == ' ' || c == '\t' || c == '\f' || c == '\u000B';
    }
}
