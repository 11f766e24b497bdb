package com.example.workflowgraph.model;

import lombok.Getter;

/**
 * Base class of all errors raised by the workflow graph engine.
 * <p>
 * {@link #getLocation()} points at the offending part of the graph or document
 * (e.g. {@code nodes[llm].ports[prompt]}, {@code edges[2]}).
 * </p>
 */
@Getter
public abstract class WorkflowGraphException extends RuntimeException {

    private final String location;

    protected WorkflowGraphException(String location, String message) {
        super(message);
        this.location = location;
    }

    protected WorkflowGraphException(String location, String message, Throwable cause) {
        super(message, cause);
        this.location = location;
    }
}
