package com.example.workflowgraph.validation;

import java.util.List;

/**
 * Hints about inputs exposed to end users on the platform UI.
 *
 * @param inputPortsShownButConnected {@code node.port} of shown inputs that also receive a connection
 * @param hasShownInputPorts          whether any node exposes an input to the user
 */
public record UiWarnings(List<String> inputPortsShownButConnected, boolean hasShownInputPorts) {

    public UiWarnings {
        inputPortsShownButConnected = List.copyOf(inputPortsShownButConnected);
    }
}
