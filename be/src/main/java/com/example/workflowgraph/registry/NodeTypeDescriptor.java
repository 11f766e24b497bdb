package com.example.workflowgraph.registry;

import com.example.workflowgraph.model.Port;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Static description of a node kind: its category and the ports every new node of this kind starts with.
 */
public record NodeTypeDescriptor(String type, String category, List<Port> defaultPorts) {

    public NodeTypeDescriptor {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(category, "category");
        defaultPorts = defaultPorts != null ? List.copyOf(defaultPorts) : List.of();
    }

    public Optional<Port> defaultPort(String name) {
        return defaultPorts.stream().filter(p -> p.name().equals(name)).findFirst();
    }
}
