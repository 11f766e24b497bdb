package com.example.workflowgraph.model;

import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A typed unit of a workflow with ordered, named ports.
 * <p>
 * Nodes are normally created by {@link com.example.workflowgraph.registry.NodeTypeRegistry#createNode(String, String)}
 * with the default ports of their type. Port changes go through {@link Workflow} so graph invariants hold.
 * </p>
 */
@Getter
public class Node {

    private final String id;
    private final String type;
    private final String category;
    private final Map<String, Port> ports;
    private Position position;

    public Node(String id, String type, String category, Collection<Port> ports) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
        this.category = Objects.requireNonNull(category, "category");
        if (id.isBlank()) {
            throw new IllegalArgumentException("node id must not be blank");
        }
        this.ports = new LinkedHashMap<>();
        for (Port port : ports) {
            if (this.ports.putIfAbsent(port.name(), port) != null) {
                throw new WorkflowStructureException(WorkflowStructureException.Reason.DUPLICATE_PORT,
                        "nodes[" + id + "].ports[" + port.name() + "]",
                        "Duplicate port '" + port.name() + "' on node " + id);
            }
        }
        this.position = Position.ORIGIN;
    }

    public Map<String, Port> getPorts() {
        return Collections.unmodifiableMap(ports);
    }

    public Optional<Port> findPort(String name) {
        return Optional.ofNullable(ports.get(name));
    }

    public boolean hasPort(String name) {
        return ports.containsKey(name);
    }

    public void moveTo(Position newPosition) {
        this.position = Objects.requireNonNull(newPosition, "position");
    }

    void putPort(Port port) {
        ports.put(port.name(), port);
    }

    @Override
    public String toString() {
        return id + "(" + type + ")";
    }
}
