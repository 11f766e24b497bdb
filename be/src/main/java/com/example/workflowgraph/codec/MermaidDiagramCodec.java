package com.example.workflowgraph.codec;

import com.example.workflowgraph.layout.LayoutDirection;
import com.example.workflowgraph.model.Connection;
import com.example.workflowgraph.model.DataType;
import com.example.workflowgraph.model.Node;
import com.example.workflowgraph.model.Port;
import com.example.workflowgraph.model.Workflow;
import com.example.workflowgraph.model.WorkflowGraphException;
import com.example.workflowgraph.registry.NodeTypeRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;

/**
 * Mermaid flowchart form of a workflow: a header, one line per node in insertion order, then one line per
 * connection in connection order.
 * <pre>
 * flowchart LR
 *     n0(["input: TextInOut"])
 *     n1[["llm: OpenAI"]]
 *     n0 --&gt;|"output -&gt; prompt"| n1
 * </pre>
 * Reading a diagram back restores topology only: nodes get their type's default ports, and ports named by edges
 * but not declared by the type are added with data type {@code any}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MermaidDiagramCodec {

    private static final String INDENT = "    ";

    private static final Shape DEFAULT_SHAPE = new Shape("[", "]");
    private static final Map<String, Shape> SHAPES = Map.of(
            "basic_nodes", new Shape("([", "])"),
            "llms", new Shape("[[", "]]"),
            "text_processing", new Shape("(", ")"),
            "output", new Shape("[/", "/]"),
            "control_flows", new Shape("{", "}"),
            "vector_db", new Shape("[(", ")]"),
            "tools", new Shape("{{", "}}"),
            "file_processing", new Shape(">", "]")
    );

    private static final Pattern HEADER = Pattern.compile("^flowchart\\s+(LR|TB|TD|RL|BT)$");
    private static final Pattern NODE_LINE = Pattern.compile(
            "^n(\\d+)(\\(\\[|\\[\\[|\\[\\(|\\[/|\\{\\{|\\[|\\(|\\{|>)\"(.*)\"(\\]\\)|\\]\\]|\\)\\]|/\\]|\\}\\}|\\]|\\)|\\})$");
    private static final Pattern EDGE_LINE = Pattern.compile("^n(\\d+)\\s*-->\\|\"(.*)\"\\|\\s*n(\\d+)$");

    private static final Pattern ENTITY = Pattern.compile("#(quot|\\d{1,7});");

    private static final String LABEL_SEPARATOR = ": ";
    private static final String PORT_SEPARATOR = " -> ";

    private final NodeTypeRegistry registry;

    public String toDiagram(Workflow workflow) {
        return toDiagram(workflow, LayoutDirection.LR);
    }

    public String toDiagram(Workflow workflow, LayoutDirection direction) {
        StringBuilder sb = new StringBuilder();
        sb.append("flowchart ").append(direction.name()).append('\n');
        Map<String, Integer> index = new HashMap<>();
        int i = 0;
        for (Node node : workflow.nodes()) {
            index.put(node.getId(), i);
            Shape shape = SHAPES.getOrDefault(node.getCategory(), DEFAULT_SHAPE);
            sb.append(INDENT)
                    .append(format("n%d%s\"%s\"%s", i, shape.open(), escape(node.getId() + LABEL_SEPARATOR + node.getType()),
                            shape.close()))
                    .append('\n');
            i++;
        }
        for (Connection c : workflow.connections()) {
            sb.append(INDENT)
                    .append(format("n%d -->|\"%s\"| n%d", index.get(c.sourceNodeId()),
                            escape(c.sourcePort()) + PORT_SEPARATOR + escape(c.targetPort()), index.get(c.targetNodeId())))
                    .append('\n');
        }
        return sb.toString();
    }

    /**
     * @throws WorkflowDeserializationException naming the first line that cannot be read
     */
    public Workflow fromDiagram(String text) {
        if (text == null || text.isBlank()) {
            throw new WorkflowDeserializationException("line 1", "diagram is empty");
        }
        String[] lines = text.split("\\R", -1);
        Workflow workflow = new Workflow();
        Map<Integer, String> nodeIds = new HashMap<>();
        boolean headerSeen = false;
        int edges = 0;
        for (int n = 0; n < lines.length; n++) {
            String line = lines[n].trim();
            String location = "line " + (n + 1);
            if (line.isEmpty() || line.startsWith("%%")) {
                continue;
            }
            if (!headerSeen) {
                if (!HEADER.matcher(line).matches()) {
                    throw new WorkflowDeserializationException(location, "expected 'flowchart <direction>' header");
                }
                headerSeen = true;
                continue;
            }
            Matcher node = NODE_LINE.matcher(line);
            if (node.matches()) {
                readNode(workflow, nodeIds, node, location);
                continue;
            }
            Matcher edge = EDGE_LINE.matcher(line);
            if (edge.matches()) {
                readEdge(workflow, nodeIds, edge, location);
                edges++;
                continue;
            }
            throw new WorkflowDeserializationException(location, "unrecognised diagram line: " + line);
        }
        if (!headerSeen) {
            throw new WorkflowDeserializationException("line 1", "expected 'flowchart <direction>' header");
        }
        log.debug("Parsed diagram nodes={} edges={}", nodeIds.size(), edges);
        return workflow;
    }

    private void readNode(Workflow workflow, Map<Integer, String> nodeIds, Matcher m, String location) {
        int ref = Integer.parseInt(m.group(1));
        if (nodeIds.containsKey(ref)) {
            throw new WorkflowDeserializationException(location, "node reference n" + ref + " declared twice");
        }
        String label = unescape(m.group(3));
        int split = label.lastIndexOf(LABEL_SEPARATOR);
        if (split <= 0) {
            throw new WorkflowDeserializationException(location, "node label must read '<id>: <type>'");
        }
        String id = label.substring(0, split);
        String type = label.substring(split + LABEL_SEPARATOR.length());
        if (registry.findDescriptor(type).isEmpty()) {
            throw new WorkflowDeserializationException(location, "unknown node type '" + type + "'");
        }
        if (workflow.containsNode(id)) {
            throw new WorkflowDeserializationException(location, "duplicate node id '" + id + "'");
        }
        workflow.addNode(registry.createNode(id, type));
        nodeIds.put(ref, id);
    }

    private static void readEdge(Workflow workflow, Map<Integer, String> nodeIds, Matcher m, String location) {
        String source = resolve(nodeIds, Integer.parseInt(m.group(1)), location);
        String target = resolve(nodeIds, Integer.parseInt(m.group(3)), location);
        String label = m.group(2);
        int split = label.indexOf(PORT_SEPARATOR);
        if (split <= 0 || split + PORT_SEPARATOR.length() >= label.length()) {
            throw new WorkflowDeserializationException(location, "edge label must read '<sourcePort> -> <targetPort>'");
        }
        String sourcePort = unescape(label.substring(0, split));
        String targetPort = unescape(label.substring(split + PORT_SEPARATOR.length()));
        try {
            ensurePort(workflow, source, Port.output(sourcePort, DataType.ANY));
            ensurePort(workflow, target, Port.input(targetPort, DataType.ANY).withMultiple(true));
            workflow.connect(source, sourcePort, target, targetPort);
        } catch (WorkflowGraphException e) {
            throw new WorkflowDeserializationException(location, e.getMessage(), e);
        }
    }

    private static void ensurePort(Workflow workflow, String nodeId, Port port) {
        Optional<Port> existing = workflow.node(nodeId).findPort(port.name());
        if (existing.isEmpty()) {
            workflow.addPort(nodeId, port);
        }
    }

    private static String resolve(Map<Integer, String> nodeIds, int ref, String location) {
        String id = nodeIds.get(ref);
        if (id == null) {
            throw new WorkflowDeserializationException(location, "edge refers to undeclared node n" + ref);
        }
        return id;
    }

    /**
     * Replaces {@code #}, {@code "}, {@code >} and line breaks with Mermaid entity codes, so a label stays on one
     * line and a port name never contains the edge-label separator.
     */
    static String escape(String label) {
        StringBuilder sb = new StringBuilder(label.length());
        for (int i = 0; i < label.length(); i++) {
            char ch = label.charAt(i);
            switch (ch) {
                case '"' -> sb.append("#quot;");
                case '#', '>', '\n', '\r' -> sb.append('#').append((int) ch).append(';');
                default -> sb.append(ch);
            }
        }
        return sb.toString();
    }

    static String unescape(String label) {
        Matcher m = ENTITY.matcher(label);
        StringBuilder sb = new StringBuilder(label.length());
        while (m.find()) {
            String code = m.group(1);
            String replacement;
            if (code.equals("quot")) {
                replacement = "\"";
            } else {
                int codePoint = Integer.parseInt(code);
                replacement = Character.isValidCodePoint(codePoint) ? Character.toString(codePoint) : m.group();
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private record Shape(String open, String close) {
    }
}
