package com.example.workflowgraph.model;

/**
 * Descriptive metadata of a workflow as shown on the platform.
 */
public record WorkflowMetadata(String title, String brief, String language) {

    public static final String DEFAULT_TITLE = "New workflow";
    public static final String DEFAULT_LANGUAGE = "zh-CN";

    public WorkflowMetadata {
        title = title != null ? title : DEFAULT_TITLE;
        brief = brief != null ? brief : "";
        language = language != null && !language.isBlank() ? language : DEFAULT_LANGUAGE;
    }

    public static WorkflowMetadata defaults() {
        return new WorkflowMetadata(null, null, null);
    }
}
