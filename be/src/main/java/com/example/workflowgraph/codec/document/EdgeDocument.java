package com.example.workflowgraph.codec.document;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.validation.constraints.NotBlank;

/**
 * One edge of a workflow document.
 */
@JsonPropertyOrder({"sourceNodeId", "sourcePort", "targetNodeId", "targetPort"})
public record EdgeDocument(
        @NotBlank String sourceNodeId,
        @NotBlank String sourcePort,
        @NotBlank String targetNodeId,
        @NotBlank String targetPort
) {}
