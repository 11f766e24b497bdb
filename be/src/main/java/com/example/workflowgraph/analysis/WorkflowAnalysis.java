package com.example.workflowgraph.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural facts about a workflow document.
 *
 * @param longestPathLength number of edges on the longest path through the acyclic part of the graph
 * @param nodesOnCycles     ids of nodes that lie on at least one cycle, in document order
 */
public record WorkflowAnalysis(
        int totalNodeCount,
        Map<String, Integer> nodeCountByCategory,
        int connectionCount,
        List<String> isolatedNodeIds,
        int longestPathLength,
        boolean hasCycle,
        List<String> nodesOnCycles,
        Map<String, Integer> fanInByNode,
        Map<String, Integer> fanOutByNode,
        List<NodeSummary> nodes
) {
    public WorkflowAnalysis {
        nodeCountByCategory = Collections.unmodifiableMap(new LinkedHashMap<>(nodeCountByCategory));
        isolatedNodeIds = List.copyOf(isolatedNodeIds);
        nodesOnCycles = List.copyOf(nodesOnCycles);
        fanInByNode = Collections.unmodifiableMap(new LinkedHashMap<>(fanInByNode));
        fanOutByNode = Collections.unmodifiableMap(new LinkedHashMap<>(fanOutByNode));
        nodes = List.copyOf(nodes);
    }
}
