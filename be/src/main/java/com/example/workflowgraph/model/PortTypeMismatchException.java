package com.example.workflowgraph.model;

import lombok.Getter;

/**
 * Thrown when data types do not fit: connecting incompatible ports, or assigning a value of the wrong tag.
 */
@Getter
public class PortTypeMismatchException extends WorkflowGraphException {

    private final DataType expected;
    private final DataType actual;

    public PortTypeMismatchException(String location, DataType expected, DataType actual) {
        super(location, "Type mismatch at " + location + ": expected " + expected.tag()
                + " but got " + (actual != null ? actual.tag() : "none"));
        this.expected = expected;
        this.actual = actual;
    }
}
