package com.tyron.syntaxkit.api.mutation;

import java.util.Objects;

/**
 * Why a path-based operation could not be applied. Every variant renders a human-readable
 * {@link #message()} meant to be shown to the caller verbatim.
 */
public sealed interface NodeOperationError {

    enum Kind {
        NODE_NOT_FOUND,
        INVALID_INSERTION_POINT,
        INVALID_REPLACEMENT_CONTEXT,
        AST_MODIFICATION_FAILED
    }

    Kind kind();

    String message();

    /**
     * The path did not resolve: malformed, out of range, or computed on another tree snapshot.
     */
    record NodeNotFound(String path) implements NodeOperationError {
        public NodeNotFound {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public Kind kind() {
            return Kind.NODE_NOT_FOUND;
        }

        @Override
        public String message() {
            return "Node not found at path: " + path;
        }
    }

    record InvalidInsertionPoint(String reason) implements NodeOperationError {
        public InvalidInsertionPoint {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public Kind kind() {
            return Kind.INVALID_INSERTION_POINT;
        }

        @Override
        public String message() {
            return "Invalid insertion point: " + reason;
        }
    }

    record InvalidReplacementContext(String reason) implements NodeOperationError {
        public InvalidReplacementContext {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public Kind kind() {
            return Kind.INVALID_REPLACEMENT_CONTEXT;
        }

        @Override
        public String message() {
            return "Invalid replacement context: " + reason;
        }
    }

    /**
     * Internal rebuild failure that is not a policy violation.
     */
    record AstModificationFailed(String reason) implements NodeOperationError {
        public AstModificationFailed {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public Kind kind() {
            return Kind.AST_MODIFICATION_FAILED;
        }

        @Override
        public String message() {
            return "AST modification failed: " + reason;
        }
    }
}
