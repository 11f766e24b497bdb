package com.example.workflowgraph.codec.document;

public record PositionDocument(double x, double y) {}
