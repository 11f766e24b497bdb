package com.example.workflowgraph.layout;

import com.example.workflowgraph.model.Connection;
import com.example.workflowgraph.model.Node;
import com.example.workflowgraph.model.Position;
import com.example.workflowgraph.model.Workflow;
import com.example.workflowgraph.validation.WorkflowCheckReport;
import com.example.workflowgraph.validation.WorkflowGraphValidator;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Layered auto-layout of an acyclic workflow.
 * <ol>
 *   <li>layer = longest path from any source node, via Kahn's algorithm;</li>
 *   <li>order within a layer by barycenter of neighbours, alternating forward and backward sweeps,
 *       ties broken by insertion order;</li>
 *   <li>layer index on the primary axis, order index on the cross axis, mapped by direction.</li>
 * </ol>
 * Only node positions change. Same graph and options give the same coordinates.
 */
@Slf4j
public class WorkflowLayoutEngine {

    private final LayoutOptions defaults;

    public WorkflowLayoutEngine(LayoutOptions defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    public LayoutOptions defaults() {
        return defaults;
    }

    public void layout(Workflow workflow) {
        layout(workflow, defaults);
    }

    /**
     * @throws WorkflowLayoutException if the workflow contains a cycle
     */
    public void layout(Workflow workflow, LayoutOptions options) {
        Objects.requireNonNull(workflow, "workflow");
        Objects.requireNonNull(options, "options");
        WorkflowCheckReport report = WorkflowGraphValidator.check(workflow);
        if (!report.noCycle()) {
            log.warn("Layout rejected, cycle witness={}", report.cycleWitness());
            throw new WorkflowLayoutException(report);
        }

        List<String> ids = workflow.nodes().stream().map(Node::getId).toList();
        Map<String, Integer> insertionIndex = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            insertionIndex.put(ids.get(i), i);
        }
        Map<String, List<String>> predecessors = new HashMap<>();
        Map<String, List<String>> successors = new HashMap<>();
        for (String id : ids) {
            predecessors.put(id, new ArrayList<>());
            successors.put(id, new ArrayList<>());
        }
        for (Connection c : workflow.connections()) {
            successors.get(c.sourceNodeId()).add(c.targetNodeId());
            predecessors.get(c.targetNodeId()).add(c.sourceNodeId());
        }

        Map<String, Integer> layerOf = assignLayers(ids, predecessors, successors);
        List<List<String>> layers = groupByLayer(ids, layerOf);
        reduceCrossings(layers, predecessors, successors, insertionIndex, options.iterations());
        assignPositions(workflow, layers, options);
        log.debug("Laid out nodes={} layers={} direction={}", ids.size(), layers.size(), options.direction());
    }

    private static Map<String, Integer> assignLayers(List<String> ids, Map<String, List<String>> predecessors,
                                                     Map<String, List<String>> successors) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, Integer> layerOf = new LinkedHashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (String id : ids) {
            inDegree.put(id, predecessors.get(id).size());
            layerOf.put(id, 0);
            if (predecessors.get(id).isEmpty()) {
                ready.add(id);
            }
        }
        while (!ready.isEmpty()) {
            String id = ready.poll();
            for (String next : successors.get(id)) {
                layerOf.put(next, Math.max(layerOf.get(next), layerOf.get(id) + 1));
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        return layerOf;
    }

    private static List<List<String>> groupByLayer(List<String> ids, Map<String, Integer> layerOf) {
        int depth = layerOf.values().stream().mapToInt(Integer::intValue).max().orElse(-1) + 1;
        List<List<String>> layers = new ArrayList<>();
        for (int i = 0; i < depth; i++) {
            layers.add(new ArrayList<>());
        }
        for (String id : ids) {
            layers.get(layerOf.get(id)).add(id);
        }
        return layers;
    }

    private static void reduceCrossings(List<List<String>> layers, Map<String, List<String>> predecessors,
                                        Map<String, List<String>> successors, Map<String, Integer> insertionIndex,
                                        int iterations) {
        Map<String, Integer> order = new HashMap<>();
        layers.forEach(layer -> reindex(layer, order));
        for (int pass = 0; pass < iterations; pass++) {
            boolean forward = pass % 2 == 0;
            if (forward) {
                for (int l = 1; l < layers.size(); l++) {
                    sortByBarycenter(layers.get(l), predecessors, order, insertionIndex);
                }
            } else {
                for (int l = layers.size() - 2; l >= 0; l--) {
                    sortByBarycenter(layers.get(l), successors, order, insertionIndex);
                }
            }
        }
    }

    private static void sortByBarycenter(List<String> layer, Map<String, List<String>> neighbours,
                                         Map<String, Integer> order, Map<String, Integer> insertionIndex) {
        Map<String, Double> barycenter = new HashMap<>();
        for (String id : layer) {
            Set<String> adjacent = new LinkedHashSet<>(neighbours.get(id));
            double value = adjacent.isEmpty()
                    ? order.get(id)
                    : adjacent.stream().mapToInt(order::get).average().orElse(order.get(id));
            barycenter.put(id, value);
        }
        layer.sort(Comparator.comparingDouble((String id) -> barycenter.get(id))
                .thenComparingInt(insertionIndex::get));
        reindex(layer, order);
    }

    private static void reindex(List<String> layer, Map<String, Integer> order) {
        for (int i = 0; i < layer.size(); i++) {
            order.put(layer.get(i), i);
        }
    }

    private static void assignPositions(Workflow workflow, List<List<String>> layers, LayoutOptions options) {
        LayoutDirection direction = options.direction();
        for (int l = 0; l < layers.size(); l++) {
            List<String> layer = layers.get(l);
            double primary = l * options.layerSpacing();
            if (direction.reversed() && l > 0) {
                primary = -primary;
            }
            for (int i = 0; i < layer.size(); i++) {
                double cross = i * options.nodeSpacing();
                Position position = direction.horizontal()
                        ? new Position(primary, cross)
                        : new Position(cross, primary);
                workflow.node(layer.get(i)).moveTo(position);
            }
        }
    }
}
