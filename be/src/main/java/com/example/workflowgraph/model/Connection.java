package com.example.workflowgraph.model;

import java.util.Objects;

/**
 * Directed edge from an output port of one node to an input port of another.
 */
public record Connection(String sourceNodeId, String sourcePort, String targetNodeId, String targetPort) {

    public Connection {
        Objects.requireNonNull(sourceNodeId, "sourceNodeId");
        Objects.requireNonNull(sourcePort, "sourcePort");
        Objects.requireNonNull(targetNodeId, "targetNodeId");
        Objects.requireNonNull(targetPort, "targetPort");
    }

    public boolean touches(String nodeId) {
        return sourceNodeId.equals(nodeId) || targetNodeId.equals(nodeId);
    }

    @Override
    public String toString() {
        return sourceNodeId + "." + sourcePort + " -> " + targetNodeId + "." + targetPort;
    }
}
