package com.example.workflowgraph.analysis;

import com.example.workflowgraph.codec.WorkflowJsonCodec;
import com.example.workflowgraph.codec.document.EdgeDocument;
import com.example.workflowgraph.codec.document.NodeDocument;
import com.example.workflowgraph.codec.document.PortDocument;
import com.example.workflowgraph.codec.document.WorkflowDocument;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import tools.jackson.databind.json.JsonMapper;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes {@link WorkflowAnalysis} from a document. Works on the document alone; edges that name unknown nodes
 * are ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowAnalyzer {

    private final JsonMapper jsonMapper;

    public WorkflowAnalysis analyse(String json, boolean connectedOnly) {
        return analyse(WorkflowJsonCodec.readDocument(jsonMapper, json), connectedOnly);
    }

    /**
     * @param connectedOnly drop isolated nodes from category counts, fan maps and node summaries
     */
    public WorkflowAnalysis analyse(WorkflowDocument document, boolean connectedOnly) {
        Map<String, NodeDocument> nodes = new LinkedHashMap<>();
        for (NodeDocument node : document.nodes()) {
            if (node != null && node.id() != null) {
                nodes.putIfAbsent(node.id(), node);
            }
        }
        List<EdgeDocument> edges = document.edges().stream()
                .filter(e -> e != null && nodes.containsKey(e.sourceNodeId()) && nodes.containsKey(e.targetNodeId()))
                .toList();

        Map<String, List<String>> successors = new HashMap<>();
        Map<String, Integer> fanIn = new LinkedHashMap<>();
        Map<String, Integer> fanOut = new LinkedHashMap<>();
        Map<String, Set<String>> connectedPorts = new HashMap<>();
        for (String id : nodes.keySet()) {
            successors.put(id, new ArrayList<>());
            fanIn.put(id, 0);
            fanOut.put(id, 0);
            connectedPorts.put(id, new HashSet<>());
        }
        for (EdgeDocument e : edges) {
            successors.get(e.sourceNodeId()).add(e.targetNodeId());
            fanOut.merge(e.sourceNodeId(), 1, Integer::sum);
            fanIn.merge(e.targetNodeId(), 1, Integer::sum);
            connectedPorts.get(e.targetNodeId()).add(e.targetPort());
        }

        List<String> isolated = new ArrayList<>();
        if (nodes.size() > 1) {
            for (String id : nodes.keySet()) {
                if (fanIn.get(id) == 0 && fanOut.get(id) == 0) {
                    isolated.add(id);
                }
            }
        }

        Map<String, Integer> depth = longestPaths(nodes.keySet(), successors, fanIn);
        int longestPath = depth.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        boolean hasCycle = depth.size() < nodes.size();
        List<String> onCycles = hasCycle ? nodesOnCycles(nodes.keySet(), depth.keySet(), successors) : List.of();

        Set<String> excluded = connectedOnly ? new HashSet<>(isolated) : Set.of();
        Map<String, Integer> byCategory = new LinkedHashMap<>();
        List<NodeSummary> summaries = new ArrayList<>();
        for (NodeDocument node : nodes.values()) {
            if (excluded.contains(node.id())) {
                fanIn.remove(node.id());
                fanOut.remove(node.id());
                continue;
            }
            byCategory.merge(node.category() != null ? node.category() : "", 1, Integer::sum);
            summaries.add(summarise(node, connectedPorts.get(node.id())));
        }

        WorkflowAnalysis analysis = new WorkflowAnalysis(nodes.size(), byCategory, edges.size(), isolated,
                longestPath, hasCycle, onCycles, fanIn, fanOut, summaries);
        log.debug("Analysed workflow nodes={} connections={} hasCycle={} isolated={}",
                nodes.size(), edges.size(), hasCycle, isolated.size());
        return analysis;
    }

    /**
     * Kahn's algorithm; returns the longest incoming path length of every node it can order. Nodes on or behind
     * a cycle are missing from the result.
     */
    private static Map<String, Integer> longestPaths(Set<String> ids, Map<String, List<String>> successors,
                                                     Map<String, Integer> fanIn) {
        Map<String, Integer> remaining = new HashMap<>(fanIn);
        Map<String, Integer> depth = new LinkedHashMap<>();
        Map<String, Integer> best = new HashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (String id : ids) {
            best.put(id, 0);
            if (remaining.get(id) == 0) {
                ready.add(id);
            }
        }
        while (!ready.isEmpty()) {
            String id = ready.poll();
            depth.put(id, best.get(id));
            for (String next : successors.get(id)) {
                best.merge(next, best.get(id) + 1, Math::max);
                if (remaining.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        return depth;
    }

    private static List<String> nodesOnCycles(Set<String> ids, Set<String> ordered, Map<String, List<String>> successors) {
        List<String> result = new ArrayList<>();
        for (String id : ids) {
            if (!ordered.contains(id) && reachesItself(id, successors)) {
                result.add(id);
            }
        }
        return result;
    }

    private static boolean reachesItself(String start, Map<String, List<String>> successors) {
        Deque<String> stack = new ArrayDeque<>(successors.get(start));
        Set<String> seen = new HashSet<>();
        while (!stack.isEmpty()) {
            String id = stack.pop();
            if (id.equals(start)) {
                return true;
            }
            if (seen.add(id)) {
                stack.addAll(successors.get(id));
            }
        }
        return false;
    }

    private static NodeSummary summarise(NodeDocument node, Set<String> connected) {
        List<String> userInputs = new ArrayList<>();
        List<String> connectedInputs = new ArrayList<>();
        List<String> outputs = new ArrayList<>();
        for (PortDocument port : node.ports()) {
            if (port == null || port.name() == null) {
                continue;
            }
            if (port.output()) {
                outputs.add(port.name());
            } else if (connected.contains(port.name())) {
                connectedInputs.add(port.name());
            } else if (port.shown()) {
                userInputs.add(port.name());
            }
        }
        return new NodeSummary(node.id(), node.type(), node.category(), userInputs, connectedInputs, outputs);
    }
}
