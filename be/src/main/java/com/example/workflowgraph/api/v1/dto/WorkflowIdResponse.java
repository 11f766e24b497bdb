package com.example.workflowgraph.api.v1.dto;

/**
 * Response after saving a workflow (201): only the id.
 */
public record WorkflowIdResponse(String id) {}
