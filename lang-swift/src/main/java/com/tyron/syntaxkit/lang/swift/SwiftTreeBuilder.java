package com.tyron.syntaxkit.lang.swift;

import com.tyron.syntaxkit.api.diagnostics.RawDiagnostic;
import com.tyron.syntaxkit.api.diagnostics.RawFixIt;
import com.tyron.syntaxkit.api.diagnostics.RawFixItChange;
import com.tyron.syntaxkit.api.diagnostics.RawNote;
import com.tyron.syntaxkit.api.path.NodePath;
import com.tyron.syntaxkit.api.syntax.Composite;
import com.tyron.syntaxkit.api.syntax.NodeKind;
import com.tyron.syntaxkit.api.syntax.NodeRole;
import com.tyron.syntaxkit.api.syntax.SyntaxNode;
import com.tyron.syntaxkit.api.syntax.Token;
import com.tyron.syntaxkit.api.syntax.TriviaKind;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;

/**
 * Groups a token stream into items (declarations and statements), blocks and delimited groups.
 * <p>
 * There is no expression grammar: an item is the run of tokens and groups up to a line break that
 * does not continue the item, a {@code ;}, or a closing delimiter. Every token ends up in the tree,
 * so the result always renders to the lexed text.
 */
final class SwiftTreeBuilder {

    record Result(Composite root, List<RawDiagnostic> diagnostics) {
    }

    /**
     * Where items are being parsed and how to describe it in messages.
     */
    private record Scope(@Nullable NodeKind closer, boolean memberBlock, String construct) {
        static final Scope FILE = new Scope(null, false, "source file");
    }

    /**
     * Tokens after which a line break does not end the item.
     */
    private static final EnumSet<NodeKind> CONTINUED_AFTER = EnumSet.of(
            NodeKind.OPERATOR, NodeKind.PERIOD, NodeKind.COMMA, NodeKind.COLON, NodeKind.ARROW);

    private final List<Token> tokens;
    private final int[] contentOffsets;
    private final List<RawDiagnostic> diagnostics = new ArrayList<>();
    private final Deque<NodeKind> openClosers = new ArrayDeque<>();
    private int pos;

    private SwiftTreeBuilder(List<Token> tokens) {
        this.tokens = tokens;
        this.contentOffsets = new int[tokens.size()];
        int offset = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            contentOffsets[i] = offset + token.leadingTriviaLength();
            offset += token.fullLength();
        }
    }

    static Result build(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).kind() != NodeKind.END_OF_FILE) {
            throw new IllegalArgumentException("token stream must end with END_OF_FILE");
        }
        SwiftTreeBuilder builder = new SwiftTreeBuilder(tokens);
        List<SyntaxNode> children = builder.parseItems(Scope.FILE);
        children.add(builder.tokens.get(builder.pos));
        return new Result(new Composite(NodeKind.SOURCE_FILE, children), List.copyOf(builder.diagnostics));
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private List<SyntaxNode> parseItems(Scope scope) {
        List<SyntaxNode> items = new ArrayList<>();
        while (true) {
            Token token = peek();
            if (token.kind() == NodeKind.END_OF_FILE) {
                break;
            }
            if (token.kind().isClosingDelimiter()) {
                if (token.kind() == scope.closer() || openClosers.contains(token.kind())) {
                    break;
                }
                items.add(stray(scope));
                continue;
            }
            items.add(parseItem(scope));
        }
        return items;
    }

    private SyntaxNode parseItem(Scope scope) {
        List<SyntaxNode> elements = new ArrayList<>();
        int firstIndex = pos;
        while (true) {
            Token token = peek();
            if (token.kind() == NodeKind.END_OF_FILE) {
                break;
            }
            if (!elements.isEmpty()) {
                if (token.kind().isClosingDelimiter()) {
                    break;
                }
                if (startsLine(token) && !continues(elements, token)) {
                    break;
                }
            }
            if (token.kind().isOpeningDelimiter()) {
                elements.add(parseGroup(elements, scope));
                continue;
            }
            elements.add(token);
            pos++;
            if (token.kind() == NodeKind.SEMICOLON) {
                break;
            }
            if (token.kind() == NodeKind.COLON && isCaseLabel(elements, scope)) {
                break;
            }
        }

        String introducer = introducer(elements, scope);
        boolean declaration = introducer != null
                && (SwiftKeywords.DECLARATION_KEYWORDS.contains(introducer) || introducer.equals("case"));
        if (declaration && introducer.equals("func")) {
            checkFunctionSignature(elements, firstIndex);
        }
        return new Composite(declaration ? NodeKind.DECLARATION : NodeKind.STATEMENT, elements);
    }

    private Composite parseGroup(List<SyntaxNode> itemSoFar, Scope scope) {
        int openerIndex = pos;
        Token opener = tokens.get(pos++);
        NodeKind closer = opener.kind().closingDelimiter();
        List<SyntaxNode> children = new ArrayList<>();
        children.add(opener);

        String introducer = introducer(itemSoFar, scope);
        NodeKind kind;
        String construct;
        openClosers.push(closer);
        if (opener.kind() == NodeKind.LEFT_BRACE) {
            boolean typeBody = introducer != null && SwiftKeywords.TYPE_KEYWORDS.contains(introducer)
                    && itemSoFar.stream().noneMatch(n -> n.kind() == NodeKind.MEMBER_BLOCK);
            kind = typeBody ? NodeKind.MEMBER_BLOCK : NodeKind.CODE_BLOCK;
            construct = typeBody ? introducer : blockConstruct(introducer);
            children.addAll(parseItems(new Scope(closer, typeBody, construct)));
        } else {
            kind = opener.kind() == NodeKind.LEFT_PAREN ? NodeKind.PARENTHESIZED : NodeKind.BRACKETED;
            construct = groupConstruct(opener.kind(), introducer, itemSoFar);
            while (true) {
                Token token = peek();
                if (token.kind() == NodeKind.END_OF_FILE || token.kind() == closer) {
                    break;
                }
                if (token.kind().isClosingDelimiter()) {
                    if (containsOuter(token.kind())) {
                        break;
                    }
                    children.add(stray(new Scope(closer, false, construct)));
                    continue;
                }
                if (token.kind().isOpeningDelimiter()) {
                    children.add(parseGroup(children, scope));
                    continue;
                }
                children.add(token);
                pos++;
            }
        }
        openClosers.pop();

        if (peek().kind() == closer) {
            children.add(tokens.get(pos++));
        } else {
            reportUnclosed(opener, openerIndex, closer, construct);
        }
        return new Composite(kind, children);
    }

    /**
     * True if {@code kind} closes a group opened outside the innermost one.
     */
    private boolean containsOuter(NodeKind kind) {
        boolean first = true;
        for (NodeKind open : openClosers) {
            if (!first && open == kind) {
                return true;
            }
            first = false;
        }
        return false;
    }

    private SyntaxNode stray(Scope scope) {
        int index = pos;
        Token token = tokens.get(pos++);
        String message = scope.closer() == null
                ? "extraneous '" + token.text() + "' at top level"
                : "unexpected '" + token.text() + "' in " + scope.construct();
        diagnostics.add(RawDiagnostic.error(message, contentOffsets[index])
                .withNode(NodePath.token(index + 1))
                .withFixIts(List.of(RawFixIt.of("remove '" + token.text() + "'",
                        RawFixItChange.TextChange.remove(contentOffsets[index], token.text())))));
        return new Composite(NodeKind.UNEXPECTED, List.of(token));
    }

    private void reportUnclosed(Token opener, int openerIndex, NodeKind closer, String construct) {
        int lastIndex = pos - 1;
        int offset = contentOffsets[lastIndex] + tokens.get(lastIndex).text().length();
        String closerText = closer.getFixedText();

        RawFixIt fixIt;
        if (closer == NodeKind.RIGHT_BRACE) {
            fixIt = RawFixIt.of("insert '}'",
                    RawFixItChange.TextChange.insert(offset, "\n"),
                    RawFixItChange.TextChange.insert(offset, closerText));
        } else {
            fixIt = RawFixIt.of("insert '" + closerText + "'", RawFixItChange.TextChange.insert(offset, closerText));
        }
        diagnostics.add(RawDiagnostic.error("expected '" + closerText + "' to end " + construct, offset)
                .withNode(NodePath.token(openerIndex + 1))
                .withFixIts(List.of(fixIt))
                .withNotes(List.of(new RawNote("to match this opening '" + opener.text() + "'", contentOffsets[openerIndex]))));
    }

    /**
     * Reports code between a function's name and its parameter clause. The diagnostic is placed at
     * the start of the declaration, as swift-syntax does for this message.
     */
    private void checkFunctionSignature(List<SyntaxNode> elements, int firstIndex) {
        int func = -1;
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) instanceof Token t && t.kind() == NodeKind.KEYWORD && t.text().equals("func")) {
                func = i;
                break;
            }
        }
        if (func < 0 || func + 1 >= elements.size()) {
            return;
        }
        if (!(elements.get(func + 1) instanceof Token name)
                || (name.kind() != NodeKind.IDENTIFIER && name.kind() != NodeKind.OPERATOR)) {
            return;
        }

        int j = func + 2;
        if (j < elements.size() && elements.get(j) instanceof Token lt && lt.kind() == NodeKind.OPERATOR && lt.text().equals("<")) {
            while (j < elements.size() && !(elements.get(j) instanceof Token gt && gt.kind() == NodeKind.OPERATOR && gt.text().endsWith(">"))) {
                j++;
            }
            j++;
        }
        if (j >= elements.size() || elements.get(j).kind() == NodeKind.PARENTHESIZED) {
            return;
        }

        int end = j;
        while (end < elements.size() && elements.get(end).kind() != NodeKind.CODE_BLOCK) {
            end++;
        }
        if (end == j) {
            return;
        }

        StringBuilder sb = new StringBuilder();
        for (int k = j; k < end; k++) {
            elements.get(k).appendTo(sb);
        }
        int leading = elements.get(j).leadingTriviaLength();
        int trailing = elements.get(end - 1).trailingTriviaLength();
        String unexpected = sb.substring(leading, Math.max(leading, sb.length() - trailing));

        int unexpectedIndex = tokenIndexOf(elements.get(j).firstToken().orElseThrow());
        diagnostics.add(RawDiagnostic.error("unexpected code '" + unexpected + "' in function", contentOffsets[firstIndex])
                .withNode(unexpectedIndex >= 0 ? NodePath.token(unexpectedIndex + 1) : null));
    }

    private int tokenIndexOf(Token token) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i) == token) {
                return i;
            }
        }
        return -1;
    }

    /**
     * The keyword that decides what an item is: the first keyword after attributes and modifiers.
     */
    private static @Nullable String introducer(List<SyntaxNode> elements, Scope scope) {
        for (int i = 0; i < elements.size(); i++) {
            SyntaxNode element = elements.get(i);
            if (element.kind() == NodeKind.ATTRIBUTE) {
                if (i + 1 < elements.size() && elements.get(i + 1).kind() == NodeKind.PARENTHESIZED) {
                    i++;
                }
                continue;
            }
            if (!(element instanceof Token token)) {
                return null;
            }
            String word = token.text();
            if (token.kind() == NodeKind.KEYWORD) {
                if (word.equals("class") && nextIsDeclarationKeyword(elements, i)) {
                    continue;
                }
                if (SwiftKeywords.isModifier(word) && !word.equals("class")) {
                    // private(set)
                    if (i + 1 < elements.size() && elements.get(i + 1).kind() == NodeKind.PARENTHESIZED) {
                        i++;
                    }
                    continue;
                }
                if (word.equals("case") && !scope.memberBlock()) {
                    return "switch-case";
                }
                return word;
            }
            if (token.kind() == NodeKind.IDENTIFIER && SwiftKeywords.CONTEXTUAL_MODIFIERS.contains(word)
                    && i + 1 < elements.size() && elements.get(i + 1).kind() == NodeKind.KEYWORD) {
                continue;
            }
            return null;
        }
        return null;
    }

    /**
     * {@code case x:} and {@code default:} labels of a switch end at their colon.
     */
    private static boolean isCaseLabel(List<SyntaxNode> elements, Scope scope) {
        if (scope.memberBlock() || !(elements.get(0) instanceof Token first) || first.kind() != NodeKind.KEYWORD) {
            return false;
        }
        return first.text().equals("default") || first.text().equals("case");
    }

    private static boolean nextIsDeclarationKeyword(List<SyntaxNode> elements, int index) {
        for (int i = index + 1; i < elements.size(); i++) {
            if (elements.get(i) instanceof Token token && token.kind() == NodeKind.KEYWORD) {
                if (SwiftKeywords.isModifier(token.text())) {
                    continue;
                }
                return SwiftKeywords.DECLARATION_KEYWORDS.contains(token.text());
            }
            return false;
        }
        return false;
    }

    private static String blockConstruct(@Nullable String introducer) {
        if (introducer == null) {
            return "closure";
        }
        if (SwiftKeywords.FUNCTION_KEYWORDS.contains(introducer)) {
            return "function";
        }
        if (SwiftKeywords.STATEMENT_KEYWORDS.contains(introducer)) {
            return "'" + introducer + "' statement";
        }
        if (introducer.equals("var") || introducer.equals("let")) {
            return "accessor block";
        }
        return "code block";
    }

    private static String groupConstruct(NodeKind opener, @Nullable String introducer, List<SyntaxNode> itemSoFar) {
        if (opener == NodeKind.LEFT_BRACKET) {
            return "array";
        }
        boolean signature = introducer != null && SwiftKeywords.FUNCTION_KEYWORDS.contains(introducer)
                && itemSoFar.stream().noneMatch(n -> n.kind() == NodeKind.PARENTHESIZED || n.kind() == NodeKind.CODE_BLOCK);
        return signature ? "parameter clause" : "tuple";
    }

    private static boolean startsLine(Token token) {
        return token.leadingTrivia().stream().anyMatch(t -> t.kind() == TriviaKind.NEWLINE);
    }

    /**
     * Whether {@code next}, which starts a new line, still belongs to the item built so far.
     */
    private static boolean continues(List<SyntaxNode> elements, Token next) {
        SyntaxNode last = elements.get(elements.size() - 1);
        Token previous = last.lastToken().orElse(null);
        if (previous != null && last.role() != NodeRole.BLOCK && CONTINUED_AFTER.contains(previous.kind())) {
            return true;
        }
        return switch (next.kind()) {
            case PERIOD, ARROW, COLON, COMMA -> true;
            case OPERATOR -> !next.trailingTrivia().isEmpty();
            case LEFT_BRACE -> last.kind() != NodeKind.CODE_BLOCK && last.kind() != NodeKind.MEMBER_BLOCK;
            case KEYWORD -> SwiftKeywords.CONTINUATION_KEYWORDS.contains(next.text());
            default -> false;
        };
    }
}
