package com.example.workflowgraph.codec.document;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * One node of a workflow document.
 */
@JsonPropertyOrder({"id", "type", "category", "ports", "position"})
public record NodeDocument(
        @NotBlank String id,
        @NotBlank String type,
        String category,
        @Valid List<PortDocument> ports,
        PositionDocument position
) {
    public NodeDocument {
        ports = ports != null ? List.copyOf(ports) : List.of();
    }
}
