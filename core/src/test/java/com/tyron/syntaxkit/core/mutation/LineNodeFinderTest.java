package com.tyron.syntaxkit.core.mutation;

import com.tyron.syntaxkit.api.mutation.DeletionResult;
import com.tyron.syntaxkit.api.mutation.InsertionPosition;
import com.tyron.syntaxkit.api.mutation.LineNodeInfo;
import com.tyron.syntaxkit.api.mutation.LineNodeSelection;
import com.tyron.syntaxkit.api.mutation.NodeOperationError;
import com.tyron.syntaxkit.api.mutation.NodeOperationException;
import com.tyron.syntaxkit.api.mutation.SyntaxMutator;
import com.tyron.syntaxkit.api.path.NodePath;
import com.tyron.syntaxkit.api.syntax.SyntaxTree;
import com.tyron.syntaxkit.api.syntax.Token;
import com.tyron.syntaxkit.core.config.SyntaxKitSettings;
import com.tyron.syntaxkit.core.path.TreePathResolver;
import com.tyron.syntaxkit.core.test.TestTrees;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.google.common.truth.Truth.assertThat;

public class LineNodeFinderTest {

    private final SyntaxMutator engine = new SyntaxMutationEngine(SyntaxKitSettings.DEFAULTS, new TreePathResolver());

    private String select(int line, LineNodeSelection selection) {
        return engine.selectNodeAtLine(TestTrees.struct(), line, selection).map(LineNodeInfo::text).orElse(null);
    }

    @Test
    public void findsTokensStartingOnLine() {
        List<LineNodeInfo> nodes = engine.findNodesAtLine(TestTrees.struct(), 2);

        assertThat(nodes.stream().map(LineNodeInfo::text).toList()).containsExactly("public", "let", "x", ":", "Int").inOrder();
        assertThat(nodes.stream().map(LineNodeInfo::column).toList()).containsExactly(5, 12, 16, 17, 19).inOrder();
        Assertions.assertEquals(NodePath.token("7"), nodes.get(2).path());
        Assertions.assertEquals(6, nodes.get(0).length());
    }

    @Test
    public void zeroLengthTokensAreSkipped() {
        List<LineNodeInfo> nodes = engine.findNodesAtLine(TestTrees.struct(), 4);

        Assertions.assertEquals(1, nodes.size());
        Assertions.assertEquals("}", nodes.get(0).text());
    }

    @Test
    public void linesOutsideTextHaveNoNodes() {
        Assertions.assertTrue(engine.findNodesAtLine(TestTrees.struct(), 0).isEmpty());
        Assertions.assertTrue(engine.findNodesAtLine(TestTrees.struct(), 99).isEmpty());
        Assertions.assertTrue(engine.selectNodeAtLine(TestTrees.struct(), 99, LineNodeSelection.FIRST).isEmpty());
    }

    @Test
    public void selectionStrategies() {
        Assertions.assertEquals("public", select(2, LineNodeSelection.FIRST));
        Assertions.assertEquals("Int", select(2, LineNodeSelection.LAST));
        Assertions.assertEquals("public", select(2, LineNodeSelection.LARGEST));
        Assertions.assertEquals("x", select(2, LineNodeSelection.SMALLEST));
        Assertions.assertEquals(":", select(2, LineNodeSelection.atColumn(17)));
        Assertions.assertEquals("let", select(2, LineNodeSelection.atColumn(14)));
        Assertions.assertEquals("x", select(2, LineNodeSelection.atColumn(15)));
        Assertions.assertEquals("Int", select(2, LineNodeSelection.atColumn(80)));
    }

    @Test
    public void columnSelectionNeedsPositiveColumn() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> LineNodeSelection.atColumn(0));
    }

    @Test
    public void lineOperationsDelegateToPathOperations() throws NodeOperationException {
        SyntaxTree tree = TestTrees.struct();

        DeletionResult deleted = engine.deleteAtLine(tree, 2, LineNodeSelection.atColumn(16));
        SyntaxTree replaced = engine.replaceAtLine(tree, 3, LineNodeSelection.LAST, Token.identifier("String"));
        SyntaxTree inserted = engine.insertAtLine(tree, List.of(TestTrees.spaced(Token.keyword("final"))), 1,
                LineNodeSelection.FIRST, InsertionPosition.AFTER);
        SyntaxTree documented = engine.modifyLeadingTriviaAtLine(tree, 1, LineNodeSelection.FIRST, "Doc");

        Assertions.assertEquals("x", deleted.removedText());
        Assertions.assertTrue(replaced.render().contains("public let y: String"));
        Assertions.assertTrue(inserted.render().startsWith("public final struct"));
        Assertions.assertTrue(documented.render().startsWith("/// Doc\npublic"));
    }

    @Test
    public void lineWithoutNodesIsNodeNotFound() {
        NodeOperationException e = Assertions.assertThrows(NodeOperationException.class,
                () -> engine.deleteAtLine(TestTrees.struct(), 42, LineNodeSelection.FIRST));

        Assertions.assertEquals(NodeOperationError.Kind.NODE_NOT_FOUND, e.getKind());
        Assertions.assertEquals("Node not found at path: line 42", e.getMessage());
    }
}
