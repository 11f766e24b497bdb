package com.example.workflowgraph.analysis;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a {@link WorkflowAnalysis} as compact plain text for a language-model prompt.
 * <p>
 * Sections, in order: aggregate counts, categories, notable facts, node list. A section is written whole or
 * not at all, and output stops at the first section that does not fit, so the result never exceeds the limit.
 * </p>
 */
public final class WorkflowAnalysisFormatter {

    private WorkflowAnalysisFormatter() {
    }

    public static String formatForLlm(WorkflowAnalysis analysis, int maxLength) {
        if (maxLength < 0) {
            throw new IllegalArgumentException("maxLength must not be negative: " + maxLength);
        }
        StringBuilder out = new StringBuilder();
        for (String section : sections(analysis)) {
            int needed = out.length() == 0 ? section.length() : out.length() + 1 + section.length();
            if (needed > maxLength) {
                break;
            }
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(section);
        }
        return out.toString();
    }

    private static List<String> sections(WorkflowAnalysis analysis) {
        return List.of(aggregate(analysis), categories(analysis), facts(analysis), nodes(analysis));
    }

    private static String aggregate(WorkflowAnalysis analysis) {
        return "Workflow: " + analysis.totalNodeCount() + " nodes, " + analysis.connectionCount()
                + " connections, longest path " + analysis.longestPathLength() + " edges";
    }

    private static String categories(WorkflowAnalysis analysis) {
        if (analysis.nodeCountByCategory().isEmpty()) {
            return "Categories: none";
        }
        return analysis.nodeCountByCategory().entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "Categories: ", ""));
    }

    private static String facts(WorkflowAnalysis analysis) {
        String cycles = analysis.hasCycle()
                ? "Cycles: yes, through " + String.join(", ", analysis.nodesOnCycles())
                : "Cycles: none";
        String isolated = analysis.isolatedNodeIds().isEmpty()
                ? "Isolated nodes: none"
                : "Isolated nodes: " + String.join(", ", analysis.isolatedNodeIds());
        return cycles + "\n" + isolated;
    }

    private static String nodes(WorkflowAnalysis analysis) {
        StringBuilder sb = new StringBuilder("Nodes:");
        Map<String, Integer> fanIn = analysis.fanInByNode();
        Map<String, Integer> fanOut = analysis.fanOutByNode();
        for (NodeSummary node : analysis.nodes()) {
            sb.append("\n- ").append(node.id()).append(" (").append(node.type()).append(", ").append(node.category())
                    .append(") in=").append(fanIn.getOrDefault(node.id(), 0))
                    .append(" out=").append(fanOut.getOrDefault(node.id(), 0))
                    .append("; user inputs: ").append(list(node.userInputs()))
                    .append("; connected inputs: ").append(list(node.connectedInputs()))
                    .append("; outputs: ").append(list(node.outputs()));
        }
        return sb.toString();
    }

    private static String list(List<String> names) {
        return names.isEmpty() ? "-" : String.join(", ", names);
    }
}
