package com.tyron.syntaxkit.api.mutation;

import java.util.Objects;

/**
 * Checked failure of a path resolution or tree mutation. The operation had no effect; the caller
 * may retry with a corrected path or abandon the edit.
 */
public class NodeOperationException extends Exception {

    private final NodeOperationError error;

    public NodeOperationException(NodeOperationError error) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public NodeOperationException(NodeOperationError error, Throwable cause) {
        super(Objects.requireNonNull(error, "error").message(), cause);
        this.error = error;
    }

    public static NodeOperationException nodeNotFound(String path) {
        return new NodeOperationException(new NodeOperationError.NodeNotFound(path));
    }

    public static NodeOperationException invalidInsertionPoint(String reason) {
        return new NodeOperationException(new NodeOperationError.InvalidInsertionPoint(reason));
    }

    public static NodeOperationException invalidReplacementContext(String reason) {
        return new NodeOperationException(new NodeOperationError.InvalidReplacementContext(reason));
    }

    public static NodeOperationException modificationFailed(String reason, Throwable cause) {
        return new NodeOperationException(new NodeOperationError.AstModificationFailed(reason), cause);
    }

    public NodeOperationError getError() {
        return error;
    }

    public NodeOperationError.Kind getKind() {
        return error.kind();
    }
}
