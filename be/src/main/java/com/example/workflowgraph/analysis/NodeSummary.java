package com.example.workflowgraph.analysis;

import java.util.List;

/**
 * Per-node view used in analysis output.
 *
 * @param userInputs      input ports shown to the end user and not fed by a connection
 * @param connectedInputs input ports fed by at least one connection
 * @param outputs         output ports
 */
public record NodeSummary(
        String id,
        String type,
        String category,
        List<String> userInputs,
        List<String> connectedInputs,
        List<String> outputs
) {
    public NodeSummary {
        userInputs = List.copyOf(userInputs);
        connectedInputs = List.copyOf(connectedInputs);
        outputs = List.copyOf(outputs);
    }
}
