package com.tyron.syntaxkit.api.mutation;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class NodeOperationExceptionTest {

    @Test
    public void messagesNameTheFailure() {
        Assertions.assertEquals("Node not found at path: 999.999",
                NodeOperationException.nodeNotFound("999.999").getMessage());
        Assertions.assertEquals("Invalid insertion point: cannot insert after end of file",
                NodeOperationException.invalidInsertionPoint("cannot insert after end of file").getMessage());
        Assertions.assertEquals("Invalid replacement context: replacement node is not a token",
                NodeOperationException.invalidReplacementContext("replacement node is not a token").getMessage());
    }

    @Test
    public void kindFollowsTheError() {
        IllegalStateException cause = new IllegalStateException("boom");
        NodeOperationException e = NodeOperationException.modificationFailed("rebuild failed", cause);

        Assertions.assertEquals(NodeOperationError.Kind.AST_MODIFICATION_FAILED, e.getKind());
        Assertions.assertSame(cause, e.getCause());
        Assertions.assertInstanceOf(NodeOperationError.AstModificationFailed.class, e.getError());
        Assertions.assertEquals(NodeOperationError.Kind.NODE_NOT_FOUND, NodeOperationException.nodeNotFound("1").getKind());
    }
}
