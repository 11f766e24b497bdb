package com.example.workflowgraph.codec;

import com.example.workflowgraph.codec.document.EdgeDocument;
import com.example.workflowgraph.codec.document.MetadataDocument;
import com.example.workflowgraph.codec.document.NodeDocument;
import com.example.workflowgraph.codec.document.PortDocument;
import com.example.workflowgraph.codec.document.PortDocuments;
import com.example.workflowgraph.codec.document.PositionDocument;
import com.example.workflowgraph.codec.document.WorkflowDocument;
import com.example.workflowgraph.model.Node;
import com.example.workflowgraph.model.Port;
import com.example.workflowgraph.model.Position;
import com.example.workflowgraph.model.Workflow;
import com.example.workflowgraph.model.WorkflowGraphException;
import com.example.workflowgraph.model.WorkflowMetadata;
import com.example.workflowgraph.registry.NodeTypeDescriptor;
import com.example.workflowgraph.registry.NodeTypeRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Converts between {@link Workflow} and its canonical {@link WorkflowDocument} form.
 * <p>
 * Decoding rebuilds the graph through the registry and the public mutation API, so a decoded workflow
 * satisfies the same invariants as one built by hand. The first problem found is reported.
 * </p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowDocumentCodec {

    private final NodeTypeRegistry registry;

    public WorkflowDocument toDocument(Workflow workflow) {
        List<NodeDocument> nodes = workflow.nodes().stream()
                .map(WorkflowDocumentCodec::toNodeDocument)
                .toList();
        List<EdgeDocument> edges = workflow.connections().stream()
                .map(c -> new EdgeDocument(c.sourceNodeId(), c.sourcePort(), c.targetNodeId(), c.targetPort()))
                .toList();
        WorkflowMetadata metadata = workflow.metadata();
        return new WorkflowDocument(nodes, edges,
                new MetadataDocument(metadata.title(), metadata.brief(), metadata.language()));
    }

    /**
     * @throws WorkflowDeserializationException naming the first offending location
     */
    public Workflow fromDocument(WorkflowDocument document) {
        if (document == null) {
            throw new WorkflowDeserializationException("$", "document is required");
        }
        Workflow workflow = new Workflow(toMetadata(document.metadata()));
        List<NodeDocument> nodes = document.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            addNode(workflow, nodes.get(i), "nodes[" + i + "]");
        }
        List<EdgeDocument> edges = document.edges();
        for (int i = 0; i < edges.size(); i++) {
            addEdge(workflow, edges.get(i), "edges[" + i + "]");
        }
        log.debug("Decoded workflow title='{}' nodes={} edges={}", workflow.metadata().title(), nodes.size(), edges.size());
        return workflow;
    }

    private void addNode(Workflow workflow, NodeDocument doc, String location) {
        if (doc == null) {
            throw new WorkflowDeserializationException(location, "node entry is null");
        }
        if (isBlank(doc.id())) {
            throw new WorkflowDeserializationException(location + ".id", "node id is required");
        }
        if (isBlank(doc.type())) {
            throw new WorkflowDeserializationException(location + ".type", "node type is required");
        }
        if (workflow.containsNode(doc.id())) {
            throw new WorkflowDeserializationException(location + ".id", "duplicate node id '" + doc.id() + "'");
        }
        NodeTypeDescriptor descriptor = registry.findDescriptor(doc.type())
                .orElseThrow(() -> new WorkflowDeserializationException(location + ".type",
                        "unknown node type '" + doc.type() + "'"));

        Node node = workflow.addNode(registry.createNode(doc.id(), descriptor.type()));
        Set<String> seenPorts = new HashSet<>();
        List<PortDocument> ports = doc.ports();
        for (int j = 0; j < ports.size(); j++) {
            String portLocation = location + ".ports[" + j + "]";
            Port port = PortDocuments.toPort(ports.get(j), portLocation);
            if (!seenPorts.add(port.name())) {
                throw new WorkflowDeserializationException(portLocation + ".name", "duplicate port '" + port.name() + "'");
            }
            applyPort(workflow, node.getId(), descriptor, port, portLocation);
        }
        if (doc.position() != null) {
            node.moveTo(new Position(doc.position().x(), doc.position().y()));
        }
    }

    private static void applyPort(Workflow workflow, String nodeId, NodeTypeDescriptor descriptor, Port port,
                                  String location) {
        Optional<Port> declared = descriptor.defaultPort(port.name());
        try {
            if (declared.isEmpty()) {
                workflow.addPort(nodeId, port);
                return;
            }
            Port expected = declared.get();
            if (expected.dataType() != port.dataType()) {
                throw new WorkflowDeserializationException(location + ".dataType", "port '" + port.name()
                        + "' is declared as " + expected.dataType().tag() + " but document says " + port.dataType().tag());
            }
            if (expected.output() != port.output()) {
                throw new WorkflowDeserializationException(location + ".isOutput", "port '" + port.name()
                        + "' is declared as " + (expected.output() ? "output" : "input"));
            }
            if (expected.multiple() != port.multiple()) {
                throw new WorkflowDeserializationException(location + ".multiple", "port '" + port.name()
                        + "' is declared as " + (expected.multiple() ? "multiple" : "single") + "-input");
            }
            workflow.setPortShown(nodeId, port.name(), port.shown());
            workflow.setPortValue(nodeId, port.name(), port.value());
        } catch (WorkflowDeserializationException e) {
            throw e;
        } catch (WorkflowGraphException e) {
            throw new WorkflowDeserializationException(location, e.getMessage(), e);
        }
    }

    private static void addEdge(Workflow workflow, EdgeDocument doc, String location) {
        if (doc == null) {
            throw new WorkflowDeserializationException(location, "edge entry is null");
        }
        requireField(doc.sourceNodeId(), location + ".sourceNodeId");
        requireField(doc.sourcePort(), location + ".sourcePort");
        requireField(doc.targetNodeId(), location + ".targetNodeId");
        requireField(doc.targetPort(), location + ".targetPort");
        if (!workflow.containsNode(doc.sourceNodeId())) {
            throw new WorkflowDeserializationException(location + ".sourceNodeId",
                    "unknown node '" + doc.sourceNodeId() + "'");
        }
        if (!workflow.containsNode(doc.targetNodeId())) {
            throw new WorkflowDeserializationException(location + ".targetNodeId",
                    "unknown node '" + doc.targetNodeId() + "'");
        }
        try {
            workflow.connect(doc.sourceNodeId(), doc.sourcePort(), doc.targetNodeId(), doc.targetPort());
        } catch (WorkflowGraphException e) {
            throw new WorkflowDeserializationException(location, e.getMessage(), e);
        }
    }

    private static NodeDocument toNodeDocument(Node node) {
        List<PortDocument> ports = node.getPorts().values().stream()
                .map(PortDocuments::fromPort)
                .toList();
        Position position = node.getPosition();
        return new NodeDocument(node.getId(), node.getType(), node.getCategory(), ports,
                new PositionDocument(position.x(), position.y()));
    }

    private static WorkflowMetadata toMetadata(MetadataDocument doc) {
        if (doc == null) {
            return WorkflowMetadata.defaults();
        }
        return new WorkflowMetadata(doc.title(), doc.brief(), doc.language());
    }

    private static void requireField(String value, String location) {
        if (isBlank(value)) {
            throw new WorkflowDeserializationException(location, "field is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
