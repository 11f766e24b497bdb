package com.example.workflowgraph.validation;

import java.util.Objects;

/**
 * A single validation issue (locating field and message).
 */
public record ValidationError(String field, String message) {
    public ValidationError {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
    }
}
