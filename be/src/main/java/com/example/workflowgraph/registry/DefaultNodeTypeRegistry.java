package com.example.workflowgraph.registry;

import com.example.workflowgraph.codec.WorkflowDeserializationException;
import com.example.workflowgraph.codec.document.PortDocument;
import com.example.workflowgraph.codec.document.PortDocuments;
import com.example.workflowgraph.model.Node;
import com.example.workflowgraph.model.Port;
import com.example.workflowgraph.model.WorkflowStructureException;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry backed by the {@code node-types.json} catalogue on the classpath.
 * <p>
 * The catalogue is read once at construction; a missing or malformed catalogue fails startup.
 * </p>
 */
@Component
@Slf4j
public class DefaultNodeTypeRegistry implements NodeTypeRegistry {

    public static final String CATALOGUE_RESOURCE = "node-types.json";

    private final Map<String, NodeTypeDescriptor> descriptors;

    @Autowired
    public DefaultNodeTypeRegistry(JsonMapper jsonMapper) {
        this(jsonMapper, new ClassPathResource(CATALOGUE_RESOURCE));
    }

    public DefaultNodeTypeRegistry(JsonMapper jsonMapper, Resource catalogue) {
        this.descriptors = load(jsonMapper, catalogue);
        log.info("Loaded {} node types from {}", descriptors.size(), catalogue.getDescription());
    }

    @Override
    public Optional<NodeTypeDescriptor> findDescriptor(String type) {
        return Optional.ofNullable(type).map(descriptors::get);
    }

    @Override
    public NodeTypeDescriptor descriptor(String type) {
        return findDescriptor(type)
                .orElseThrow(() -> new WorkflowStructureException(WorkflowStructureException.Reason.UNKNOWN_NODE_TYPE,
                        "type", "Unknown node type: " + type));
    }

    @Override
    public Node createNode(String id, String type) {
        NodeTypeDescriptor descriptor = descriptor(type);
        return new Node(id, descriptor.type(), descriptor.category(), descriptor.defaultPorts());
    }

    @Override
    public List<String> availableTypes() {
        return descriptors.keySet().stream().sorted().toList();
    }

    private static Map<String, NodeTypeDescriptor> load(JsonMapper jsonMapper, Resource catalogue) {
        if (!catalogue.exists()) {
            throw new IllegalStateException("Node type catalogue not found: " + catalogue.getDescription());
        }
        List<NodeTypeEntry> entries;
        try (InputStream in = catalogue.getInputStream()) {
            entries = jsonMapper.readValue(in, new TypeReference<List<NodeTypeEntry>>() { });
        } catch (JacksonException | IOException e) {
            throw new IllegalStateException("Failed to read node type catalogue " + catalogue.getDescription(), e);
        }
        Map<String, NodeTypeDescriptor> result = new LinkedHashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            NodeTypeDescriptor descriptor = toDescriptor(entries.get(i), "types[" + i + "]");
            if (result.putIfAbsent(descriptor.type(), descriptor) != null) {
                throw new IllegalStateException("Duplicate node type in catalogue: " + descriptor.type());
            }
        }
        return result;
    }

    private static NodeTypeDescriptor toDescriptor(NodeTypeEntry entry, String location) {
        if (entry == null || entry.type() == null || entry.type().isBlank()
                || entry.category() == null || entry.category().isBlank()) {
            throw new IllegalStateException("Catalogue entry " + location + " needs a type and a category");
        }
        List<Port> ports = new ArrayList<>();
        List<PortDocument> declared = entry.ports() != null ? entry.ports() : List.of();
        for (int i = 0; i < declared.size(); i++) {
            try {
                ports.add(PortDocuments.toPort(declared.get(i), location + ".ports[" + i + "]"));
            } catch (WorkflowDeserializationException e) {
                throw new IllegalStateException("Invalid port in catalogue at " + e.getLocation() + ": " + e.getMessage(), e);
            }
        }
        return new NodeTypeDescriptor(entry.type(), entry.category(), ports);
    }

    record NodeTypeEntry(String type, String category, List<PortDocument> ports) {
    }
}
