package com.example.workflowgraph.model;

import lombok.Getter;

/**
 * Thrown by graph mutations that would break a structural invariant. The graph is left unchanged.
 */
@Getter
public class WorkflowStructureException extends WorkflowGraphException {

    public enum Reason {
        DUPLICATE_NODE,
        UNKNOWN_NODE,
        UNKNOWN_PORT,
        DUPLICATE_PORT,
        INVALID_DIRECTION,
        DUPLICATE_CONNECTION,
        UNKNOWN_CONNECTION,
        ARITY_VIOLATION,
        NODE_HAS_CONNECTIONS,
        UNKNOWN_NODE_TYPE
    }

    private final Reason reason;

    public WorkflowStructureException(Reason reason, String location, String message) {
        super(location, message);
        this.reason = reason;
    }
}
