package com.example.workflowgraph.api.v1.dto;

import com.example.workflowgraph.analysis.WorkflowAnalysis;

/**
 * Structural analysis plus its bounded plain-text summary.
 */
public record AnalysisResponse(WorkflowAnalysis analysis, String summary) {}
