package com.example.workflowgraph.model;

import com.example.workflowgraph.model.WorkflowStructureException.Reason;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The workflow graph: nodes in insertion order, connections in insertion order, and metadata.
 * <p>
 * Every mutation validates first and changes state only when all checks pass, so a failed call leaves
 * the graph as it was. Cycles are allowed here; they are reported by
 * {@link com.example.workflowgraph.validation.WorkflowGraphValidator}.
 * </p>
 * <p>
 * Not thread-safe. A workflow is owned by a single caller.
 * </p>
 */
@Slf4j
public class Workflow {

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final List<Connection> connections = new ArrayList<>();
    private WorkflowMetadata metadata;

    public Workflow() {
        this(WorkflowMetadata.defaults());
    }

    public Workflow(WorkflowMetadata metadata) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public WorkflowMetadata metadata() {
        return metadata;
    }

    public void setMetadata(WorkflowMetadata metadata) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public Collection<Node> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public List<Connection> connections() {
        return Collections.unmodifiableList(connections);
    }

    public Optional<Node> findNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    /**
     * @throws WorkflowStructureException with {@link Reason#UNKNOWN_NODE} if absent
     */
    public Node node(String id) {
        Node node = nodes.get(id);
        if (node == null) {
            throw new WorkflowStructureException(Reason.UNKNOWN_NODE, "nodes[" + id + "]", "Unknown node: " + id);
        }
        return node;
    }

    public List<Connection> incoming(String nodeId) {
        return connections.stream().filter(c -> c.targetNodeId().equals(nodeId)).toList();
    }

    public List<Connection> outgoing(String nodeId) {
        return connections.stream().filter(c -> c.sourceNodeId().equals(nodeId)).toList();
    }

    public Node addNode(Node node) {
        Objects.requireNonNull(node, "node");
        if (nodes.containsKey(node.getId())) {
            throw new WorkflowStructureException(Reason.DUPLICATE_NODE, "nodes[" + node.getId() + "]",
                    "Duplicate node id: " + node.getId());
        }
        nodes.put(node.getId(), node);
        log.debug("Added node id={} type={}", node.getId(), node.getType());
        return node;
    }

    /**
     * Adds all nodes or none.
     */
    public void addNodes(List<Node> toAdd) {
        Set<String> seen = new HashSet<>(nodes.keySet());
        for (Node node : toAdd) {
            if (!seen.add(node.getId())) {
                throw new WorkflowStructureException(Reason.DUPLICATE_NODE, "nodes[" + node.getId() + "]",
                        "Duplicate node id: " + node.getId());
            }
        }
        toAdd.forEach(this::addNode);
    }

    public void removeNode(String id) {
        removeNode(id, false);
    }

    /**
     * Removes a node. Without {@code cascade} the node must have no connections; with it, its connections go too.
     */
    public void removeNode(String id, boolean cascade) {
        node(id);
        List<Connection> dependent = connections.stream().filter(c -> c.touches(id)).toList();
        if (!dependent.isEmpty() && !cascade) {
            throw new WorkflowStructureException(Reason.NODE_HAS_CONNECTIONS, "nodes[" + id + "]",
                    "Node " + id + " still has " + dependent.size() + " connection(s)");
        }
        connections.removeAll(dependent);
        nodes.remove(id);
        log.debug("Removed node id={} droppedConnections={}", id, dependent.size());
    }

    public void addPort(String nodeId, Port port) {
        Objects.requireNonNull(port, "port");
        Node node = node(nodeId);
        if (node.hasPort(port.name())) {
            throw new WorkflowStructureException(Reason.DUPLICATE_PORT, portLocation(nodeId, port.name()),
                    "Duplicate port '" + port.name() + "' on node " + nodeId);
        }
        node.putPort(port);
    }

    /**
     * @throws PortTypeMismatchException if the value's tag does not fit the port's data type
     */
    public void setPortValue(String nodeId, String portName, PortValue value) {
        Objects.requireNonNull(value, "value");
        Port port = port(nodeId, portName);
        if (!value.fits(port.dataType())) {
            throw new PortTypeMismatchException(portLocation(nodeId, portName), port.dataType(), value.type());
        }
        node(nodeId).putPort(port.withValue(value));
    }

    public void setPortShown(String nodeId, String portName, boolean shown) {
        Port port = port(nodeId, portName);
        node(nodeId).putPort(port.withShown(shown));
    }

    public Port port(String nodeId, String portName) {
        return node(nodeId).findPort(portName)
                .orElseThrow(() -> new WorkflowStructureException(Reason.UNKNOWN_PORT, portLocation(nodeId, portName),
                        "Unknown port '" + portName + "' on node " + nodeId));
    }

    public Connection connect(String sourceNodeId, String sourcePort, String targetNodeId, String targetPort) {
        Port source = port(sourceNodeId, sourcePort);
        Port target = port(targetNodeId, targetPort);
        if (!source.output()) {
            throw new WorkflowStructureException(Reason.INVALID_DIRECTION, portLocation(sourceNodeId, sourcePort),
                    "Source port " + sourceNodeId + "." + sourcePort + " is not an output port");
        }
        if (!target.input()) {
            throw new WorkflowStructureException(Reason.INVALID_DIRECTION, portLocation(targetNodeId, targetPort),
                    "Target port " + targetNodeId + "." + targetPort + " is not an input port");
        }
        if (!target.dataType().acceptsFrom(source.dataType())) {
            throw new PortTypeMismatchException(portLocation(targetNodeId, targetPort), target.dataType(), source.dataType());
        }
        Connection connection = new Connection(sourceNodeId, sourcePort, targetNodeId, targetPort);
        if (connections.contains(connection)) {
            throw new WorkflowStructureException(Reason.DUPLICATE_CONNECTION, portLocation(targetNodeId, targetPort),
                    "Connection already exists: " + connection);
        }
        if (!target.multiple() && incomingCount(targetNodeId, targetPort) >= 1) {
            throw new WorkflowStructureException(Reason.ARITY_VIOLATION, portLocation(targetNodeId, targetPort),
                    "Input port " + targetNodeId + "." + targetPort + " already has a connection");
        }
        connections.add(connection);
        log.debug("Connected {}", connection);
        return connection;
    }

    public void disconnect(String sourceNodeId, String sourcePort, String targetNodeId, String targetPort) {
        Connection connection = new Connection(sourceNodeId, sourcePort, targetNodeId, targetPort);
        if (!connections.remove(connection)) {
            throw new WorkflowStructureException(Reason.UNKNOWN_CONNECTION, portLocation(targetNodeId, targetPort),
                    "No such connection: " + connection);
        }
        log.debug("Disconnected {}", connection);
    }

    public long incomingCount(String nodeId, String portName) {
        return connections.stream()
                .filter(c -> c.targetNodeId().equals(nodeId) && c.targetPort().equals(portName))
                .count();
    }

    static String portLocation(String nodeId, String portName) {
        return "nodes[" + nodeId + "].ports[" + portName + "]";
    }
}
