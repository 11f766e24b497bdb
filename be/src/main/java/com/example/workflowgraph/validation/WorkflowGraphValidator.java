package com.example.workflowgraph.validation;

import com.example.workflowgraph.model.Connection;
import com.example.workflowgraph.model.Node;
import com.example.workflowgraph.model.Port;
import com.example.workflowgraph.model.Workflow;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks a workflow graph: cycles, isolated nodes, dangling connections and type violations.
 * <p>
 * Pure read. Traversal follows node insertion order and connection order, so the report, including the
 * cycle witness, is the same on every run for the same graph.
 * </p>
 * <p>
 * {@link Workflow}'s mutators already refuse dangling connections, direction and type mismatches, arity overflows
 * and values that do not fit their port, so for graphs built through them {@code noDanglingConnections} and
 * {@code noTypeViolations} are always true. The checks re-derive both from the graph contents rather than trusting
 * how it was built.
 * </p>
 */
@Slf4j
public final class WorkflowGraphValidator {

    private enum Color { UNVISITED, IN_PROGRESS, DONE }

    private WorkflowGraphValidator() {
    }

    public static WorkflowCheckReport check(Workflow workflow) {
        List<ValidationError> issues = new ArrayList<>();

        List<String> witness = findCycle(workflow);
        if (!witness.isEmpty()) {
            issues.add(new ValidationError("nodes[" + witness.get(0) + "]", "cycle detected: " + String.join(" -> ", witness)));
        }

        List<String> isolated = isolatedNodes(workflow);
        for (String id : isolated) {
            issues.add(new ValidationError("nodes[" + id + "]", "node has no connections"));
        }

        boolean noDangling = true;
        boolean noTypeViolations = true;
        Map<String, Integer> incomingPerPort = new HashMap<>();
        List<Connection> connections = workflow.connections();
        for (int i = 0; i < connections.size(); i++) {
            Connection c = connections.get(i);
            String prefix = "edges[" + i + "]";
            Optional<Port> source = resolve(workflow, c.sourceNodeId(), c.sourcePort());
            Optional<Port> target = resolve(workflow, c.targetNodeId(), c.targetPort());
            if (source.isEmpty()) {
                noDangling = false;
                issues.add(new ValidationError(prefix + ".sourcePort", "unresolved source " + c.sourceNodeId() + "." + c.sourcePort()));
            }
            if (target.isEmpty()) {
                noDangling = false;
                issues.add(new ValidationError(prefix + ".targetPort", "unresolved target " + c.targetNodeId() + "." + c.targetPort()));
            }
            if (source.isEmpty() || target.isEmpty()) {
                continue;
            }
            if (!source.get().output() || !target.get().input()) {
                noTypeViolations = false;
                issues.add(new ValidationError(prefix, "connection must go from an output port to an input port"));
            }
            if (!target.get().dataType().acceptsFrom(source.get().dataType())) {
                noTypeViolations = false;
                issues.add(new ValidationError(prefix + ".targetPort", "incompatible types " + source.get().dataType().tag()
                        + " -> " + target.get().dataType().tag()));
            }
            String key = c.targetNodeId() + "." + c.targetPort();
            int count = incomingPerPort.merge(key, 1, Integer::sum);
            if (count == 2 && !target.get().multiple()) {
                noTypeViolations = false;
                issues.add(new ValidationError(prefix + ".targetPort", "input port " + key + " accepts a single connection"));
            }
        }

        for (Node node : workflow.nodes()) {
            for (Port port : node.getPorts().values()) {
                if (!port.value().fits(port.dataType())) {
                    noTypeViolations = false;
                    issues.add(new ValidationError("nodes[" + node.getId() + "].ports[" + port.name() + "]",
                            "value of type " + port.value().type().tag() + " does not fit " + port.dataType().tag()));
                }
            }
        }

        WorkflowCheckReport report = new WorkflowCheckReport(
                witness.isEmpty(),
                isolated.isEmpty(),
                noDangling,
                noTypeViolations,
                witness,
                isolated,
                issues,
                uiWarnings(workflow, incomingPerPort.keySet())
        );
        log.debug("Checked workflow nodes={} connections={} passed={} issues={}",
                workflow.nodes().size(), connections.size(), report.passed(), issues.size());
        return report;
    }

    private static Optional<Port> resolve(Workflow workflow, String nodeId, String portName) {
        return workflow.findNode(nodeId).flatMap(n -> n.findPort(portName));
    }

    private static List<String> findCycle(Workflow workflow) {
        Map<String, List<String>> successors = new LinkedHashMap<>();
        for (Node node : workflow.nodes()) {
            successors.put(node.getId(), new ArrayList<>());
        }
        for (Connection c : workflow.connections()) {
            List<String> next = successors.get(c.sourceNodeId());
            if (next != null && successors.containsKey(c.targetNodeId())) {
                next.add(c.targetNodeId());
            }
        }
        Map<String, Color> colors = new HashMap<>();
        successors.keySet().forEach(id -> colors.put(id, Color.UNVISITED));
        for (String root : successors.keySet()) {
            if (colors.get(root) == Color.UNVISITED) {
                List<String> witness = visit(root, successors, colors);
                if (!witness.isEmpty()) {
                    return witness;
                }
            }
        }
        return List.of();
    }

    /**
     * Depth-first search from {@code root} with an explicit stack of frames. The stack doubles as the current path.
     */
    private static List<String> visit(String root, Map<String, List<String>> successors, Map<String, Color> colors) {
        Deque<Frame> stack = new ArrayDeque<>();
        colors.put(root, Color.IN_PROGRESS);
        stack.push(new Frame(root));
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            List<String> next = successors.get(frame.nodeId);
            if (frame.nextIndex == next.size()) {
                colors.put(frame.nodeId, Color.DONE);
                stack.pop();
                continue;
            }
            String target = next.get(frame.nextIndex++);
            Color color = colors.get(target);
            if (color == Color.IN_PROGRESS) {
                return cycleFrom(target, stack);
            }
            if (color == Color.UNVISITED) {
                colors.put(target, Color.IN_PROGRESS);
                stack.push(new Frame(target));
            }
        }
        return List.of();
    }

    private static List<String> cycleFrom(String reentered, Deque<Frame> stack) {
        List<String> path = new ArrayList<>();
        Iterator<Frame> bottomUp = stack.descendingIterator();
        while (bottomUp.hasNext()) {
            path.add(bottomUp.next().nodeId);
        }
        return List.copyOf(path.subList(path.indexOf(reentered), path.size()));
    }

    private static final class Frame {
        private final String nodeId;
        private int nextIndex;

        private Frame(String nodeId) {
            this.nodeId = nodeId;
        }
    }

    private static List<String> isolatedNodes(Workflow workflow) {
        if (workflow.nodes().size() <= 1) {
            return List.of();
        }
        Set<String> connected = new HashSet<>();
        for (Connection c : workflow.connections()) {
            connected.add(c.sourceNodeId());
            connected.add(c.targetNodeId());
        }
        return workflow.nodes().stream()
                .map(Node::getId)
                .filter(id -> !connected.contains(id))
                .toList();
    }

    private static UiWarnings uiWarnings(Workflow workflow, Set<String> connectedInputs) {
        List<String> shownButConnected = new ArrayList<>();
        boolean hasShown = false;
        for (Node node : workflow.nodes()) {
            for (Port port : node.getPorts().values()) {
                if (port.input() && port.shown()) {
                    hasShown = true;
                    String key = node.getId() + "." + port.name();
                    if (connectedInputs.contains(key)) {
                        shownButConnected.add(key);
                    }
                }
            }
        }
        return new UiWarnings(shownButConnected, hasShown);
    }
}
