package com.example.workflowgraph.layout;

import com.example.workflowgraph.model.WorkflowGraphException;
import com.example.workflowgraph.validation.WorkflowCheckReport;

import lombok.Getter;

/**
 * Thrown when a workflow cannot be laid out because it contains a cycle. Carries the check report with the witness.
 */
@Getter
public class WorkflowLayoutException extends WorkflowGraphException {

    private final WorkflowCheckReport report;

    public WorkflowLayoutException(WorkflowCheckReport report) {
        super(report.cycleWitness().isEmpty() ? "nodes" : "nodes[" + report.cycleWitness().get(0) + "]",
                "Cannot lay out a cyclic workflow: " + String.join(" -> ", report.cycleWitness()));
        this.report = report;
    }
}
