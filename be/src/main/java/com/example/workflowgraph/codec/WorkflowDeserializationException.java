package com.example.workflowgraph.codec;

import com.example.workflowgraph.model.WorkflowGraphException;

/**
 * Thrown when a document, diagram or catalogue cannot be turned into a graph. Names the first offending location.
 */
public class WorkflowDeserializationException extends WorkflowGraphException {

    public WorkflowDeserializationException(String location, String message) {
        super(location, message);
    }

    public WorkflowDeserializationException(String location, String message, Throwable cause) {
        super(location, message, cause);
    }
}
