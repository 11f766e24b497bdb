package com.example.workflowgraph.validation;

import java.util.List;

/**
 * Advisory structural report on a workflow. Nothing here is thrown; callers decide what is fatal.
 *
 * @param cycleWitness node ids from the first node of the detected cycle to the node closing it; empty without cycle
 * @param issues       one entry per failed check, located by field
 */
public record WorkflowCheckReport(
        boolean noCycle,
        boolean noIsolatedNodes,
        boolean noDanglingConnections,
        boolean noTypeViolations,
        List<String> cycleWitness,
        List<String> isolatedNodeIds,
        List<ValidationError> issues,
        UiWarnings uiWarnings
) {
    public WorkflowCheckReport {
        cycleWitness = List.copyOf(cycleWitness);
        isolatedNodeIds = List.copyOf(isolatedNodeIds);
        issues = List.copyOf(issues);
    }

    /**
     * True when every structural check passed (UI warnings do not count).
     */
    public boolean passed() {
        return noCycle && noIsolatedNodes && noDanglingConnections && noTypeViolations;
    }
}
