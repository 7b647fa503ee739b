package com.tyron.syntaxkit.core.mutation;

import com.tyron.syntaxkit.api.mutation.LineNodeInfo;
import com.tyron.syntaxkit.api.mutation.LineNodeSelection;
import com.tyron.syntaxkit.api.path.NodePath;
import com.tyron.syntaxkit.api.source.LocationConverter;
import com.tyron.syntaxkit.api.source.SourceLocation;
import com.tyron.syntaxkit.api.syntax.SyntaxElement;
import com.tyron.syntaxkit.api.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds tokens by line. Zero-length tokens (end of file) are never reported.
 */
final class LineNodeFinder {

    private LineNodeFinder() {
    }

    static List<LineNodeInfo> findNodesAtLine(SyntaxTree tree, int line) {
        LocationConverter converter = tree.getLocationConverter();
        if (line < 1 || line > converter.getLineCount()) {
            return List.of();
        }

        List<LineNodeInfo> result = new ArrayList<>();
        List<SyntaxElement> tokens = tree.tokens();
        for (int i = 0; i < tokens.size(); i++) {
            SyntaxElement token = tokens.get(i);
            int length = token.contentEndOffset() - token.contentOffset();
            if (length == 0) {
                continue;
            }
            SourceLocation start = converter.locate(token.contentOffset());
            if (start.line() == line) {
                result.add(new LineNodeInfo(NodePath.token(i + 1), token, line, start.column(), length));
            } else if (start.line() > line) {
                break;
            }
        }
        return result;
    }

    static Optional<LineNodeInfo> select(List<LineNodeInfo> candidates, LineNodeSelection selection) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return switch (selection.strategy()) {
            case FIRST -> Optional.of(candidates.get(0));
            case LAST -> Optional.of(candidates.get(candidates.size() - 1));
            case LARGEST -> candidates.stream().max(Comparator.comparingInt(LineNodeInfo::length));
            case SMALLEST -> candidates.stream().min(Comparator.comparingInt(LineNodeInfo::length));
            case AT_COLUMN -> Optional.of(closestTo(candidates, selection.column()));
        };
    }

    private static LineNodeInfo closestTo(List<LineNodeInfo> candidates, int column) {
        LineNodeInfo best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (LineNodeInfo info : candidates) {
            if (column >= info.column() && column < info.column() + info.length()) {
                return info;
            }
            int distance = Math.abs(info.column() - column);
            if (distance < bestDistance) {
                best = info;
                bestDistance = distance;
            }
        }
        return best;
    }
}
