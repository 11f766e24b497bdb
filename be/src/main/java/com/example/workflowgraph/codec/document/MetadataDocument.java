package com.example.workflowgraph.codec.document;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"title", "brief", "language"})
public record MetadataDocument(String title, String brief, String language) {}
