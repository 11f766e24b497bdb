package com.example.workflowgraph.registry;

import com.example.workflowgraph.model.Node;

import java.util.List;
import java.util.Optional;

/**
 * Closed catalogue of node kinds by type tag. Used to create nodes and to look up declared defaults.
 */
public interface NodeTypeRegistry {

    Optional<NodeTypeDescriptor> findDescriptor(String type);

    /**
     * @throws com.example.workflowgraph.model.WorkflowStructureException with reason {@code UNKNOWN_NODE_TYPE}
     */
    NodeTypeDescriptor descriptor(String type);

    /**
     * Creates a node of the given type carrying copies of the declared default ports.
     */
    Node createNode(String id, String type);

    /**
     * Returns the registered type tags, sorted.
     */
    List<String> availableTypes();
}
