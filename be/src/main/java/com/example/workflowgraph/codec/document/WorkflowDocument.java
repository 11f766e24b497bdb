package com.example.workflowgraph.codec.document;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.validation.Valid;

import java.util.List;

/**
 * Canonical JSON form of a workflow: nodes and edges in order, plus metadata.
 * <p>
 * Field names are the wire contract shared with the remote platform.
 * </p>
 */
@JsonPropertyOrder({"nodes", "edges", "metadata"})
public record WorkflowDocument(
        @Valid List<NodeDocument> nodes,
        @Valid List<EdgeDocument> edges,
        MetadataDocument metadata
) {
    public WorkflowDocument {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }
}
