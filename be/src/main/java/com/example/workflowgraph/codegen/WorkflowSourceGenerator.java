package com.example.workflowgraph.codegen;

import com.example.workflowgraph.codec.WorkflowDeserializationException;
import com.example.workflowgraph.codec.WorkflowDocumentCodec;
import com.example.workflowgraph.codec.document.EdgeDocument;
import com.example.workflowgraph.codec.document.NodeDocument;
import com.example.workflowgraph.codec.document.PortDocument;
import com.example.workflowgraph.codec.document.PortDocuments;
import com.example.workflowgraph.codec.document.WorkflowDocument;
import com.example.workflowgraph.model.Port;
import com.example.workflowgraph.model.PortValue;
import com.example.workflowgraph.model.WorkflowMetadata;
import com.example.workflowgraph.registry.NodeTypeDescriptor;
import com.example.workflowgraph.registry.NodeTypeRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

import static com.example.workflowgraph.codegen.JavaLiterals.string;

/**
 * Emits a Java class whose {@code build(NodeTypeRegistry)} method reconstructs a workflow document through the
 * public builder API.
 * <p>
 * All node statements come first, then every {@code connect} in edge order. Only values and flags that differ
 * from the node type's declared defaults are written. The document is decoded once up front so the emitted code
 * cannot fail on a structural problem.
 * </p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowSourceGenerator {

    private static final String BODY = "        ";

    private final NodeTypeRegistry registry;
    private final WorkflowDocumentCodec documentCodec;

    public String generateSource(WorkflowDocument document) {
        return generateSource(document, SourceGenerationOptions.defaults());
    }

    /**
     * @throws WorkflowDeserializationException if the document does not decode (unknown type, port conflict, bad edge)
     */
    public String generateSource(WorkflowDocument document, SourceGenerationOptions options) {
        documentCodec.fromDocument(document);

        StringBuilder sb = new StringBuilder();
        if (!options.packageName().isEmpty()) {
            sb.append("package ").append(options.packageName()).append(";\n\n");
        }
        sb.append("""
                import com.example.workflowgraph.model.DataType;
                import com.example.workflowgraph.model.Port;
                import com.example.workflowgraph.model.PortValue;
                import com.example.workflowgraph.model.Workflow;
                import com.example.workflowgraph.model.WorkflowMetadata;
                import com.example.workflowgraph.registry.NodeTypeRegistry;

                import java.util.List;

                """);
        String className = options.className();
        sb.append("public final class ").append(className).append(" {\n\n")
                .append("    private ").append(className).append("() {\n    }\n\n")
                .append("    public static Workflow build(NodeTypeRegistry registry) {\n");

        WorkflowMetadata metadata = metadata(document);
        sb.append(BODY).append("Workflow workflow = new Workflow(new WorkflowMetadata(")
                .append(string(metadata.title())).append(", ")
                .append(string(metadata.brief())).append(", ")
                .append(string(metadata.language())).append("));\n");

        List<NodeDocument> nodes = document.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            sb.append('\n');
            appendNode(sb, nodes.get(i), "nodes[" + i + "]");
        }
        if (!document.edges().isEmpty()) {
            sb.append('\n');
        }
        for (EdgeDocument edge : document.edges()) {
            sb.append(BODY).append("workflow.connect(")
                    .append(string(edge.sourceNodeId())).append(", ")
                    .append(string(edge.sourcePort())).append(", ")
                    .append(string(edge.targetNodeId())).append(", ")
                    .append(string(edge.targetPort())).append(");\n");
        }
        sb.append(BODY).append("return workflow;\n")
                .append("    }\n")
                .append("}\n");
        log.debug("Generated source class={} nodes={} edges={}", className, nodes.size(), document.edges().size());
        return sb.toString();
    }

    private void appendNode(StringBuilder sb, NodeDocument node, String location) {
        NodeTypeDescriptor descriptor = registry.findDescriptor(node.type())
                .orElseThrow(() -> new WorkflowDeserializationException(location + ".type",
                        "unknown node type '" + node.type() + "'"));
        String id = string(node.id());
        sb.append(BODY).append("workflow.addNode(registry.createNode(")
                .append(id).append(", ").append(string(descriptor.type())).append("));\n");

        List<PortDocument> ports = node.ports();
        for (int j = 0; j < ports.size(); j++) {
            Port port = PortDocuments.toPort(ports.get(j), location + ".ports[" + j + "]");
            Optional<Port> declared = descriptor.defaultPort(port.name());
            String name = string(port.name());
            if (declared.isEmpty()) {
                sb.append(BODY).append("workflow.addPort(").append(id).append(", ").append(portExpression(port)).append(");\n");
                if (!port.value().isEmpty()) {
                    appendSetValue(sb, id, name, port.value());
                }
                continue;
            }
            if (declared.get().shown() != port.shown()) {
                sb.append(BODY).append("workflow.setPortShown(").append(id).append(", ").append(name)
                        .append(", ").append(port.shown()).append(");\n");
            }
            if (!declared.get().value().equals(port.value())) {
                appendSetValue(sb, id, name, port.value());
            }
        }
    }

    private static void appendSetValue(StringBuilder sb, String id, String name, PortValue value) {
        sb.append(BODY).append("workflow.setPortValue(").append(id).append(", ").append(name)
                .append(", ").append(valueExpression(value)).append(");\n");
    }

    private static String portExpression(Port port) {
        StringBuilder sb = new StringBuilder()
                .append(port.output() ? "Port.output(" : "Port.input(")
                .append(string(port.name()))
                .append(", DataType.").append(port.dataType().name()).append(')');
        if (port.multiple()) {
            sb.append(".withMultiple(true)");
        }
        if (port.shown()) {
            sb.append(".withShown(true)");
        }
        return sb.toString();
    }

    static String valueExpression(PortValue value) {
        if (value.isEmpty()) {
            return "PortValue.empty()";
        }
        Object raw = value.raw();
        return switch (value.type()) {
            case TEXT -> "PortValue.text(" + string((String) raw) + ")";
            case IMAGE -> "PortValue.image(" + string((String) raw) + ")";
            case FILE -> "PortValue.file(" + string((String) raw) + ")";
            case NUMBER -> "PortValue.number(" + JavaLiterals.number((Double) raw) + ")";
            case BOOLEAN -> "PortValue.bool(" + raw + ")";
            case LIST -> "PortValue.list(" + JavaLiterals.list((List<?>) raw) + ")";
            case ANY -> throw new IllegalStateException("port values never carry the 'any' tag");
        };
    }

    private static WorkflowMetadata metadata(WorkflowDocument document) {
        if (document.metadata() == null) {
            return WorkflowMetadata.defaults();
        }
        return new WorkflowMetadata(document.metadata().title(), document.metadata().brief(),
                document.metadata().language());
    }
}
