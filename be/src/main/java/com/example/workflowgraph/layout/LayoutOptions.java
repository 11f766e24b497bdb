package com.example.workflowgraph.layout;

import java.util.Objects;

/**
 * Layout parameters.
 *
 * @param nodeSpacing  distance between neighbours of the same layer (cross axis)
 * @param layerSpacing distance between consecutive layers (primary axis)
 * @param iterations   number of barycenter sweeps, alternating forward and backward
 */
public record LayoutOptions(LayoutDirection direction, double nodeSpacing, double layerSpacing, int iterations) {

    public static final int DEFAULT_ITERATIONS = 4;

    public LayoutOptions {
        Objects.requireNonNull(direction, "direction");
        if (nodeSpacing <= 0 || layerSpacing <= 0) {
            throw new IllegalArgumentException("spacing must be positive");
        }
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must not be negative");
        }
    }

    public LayoutOptions withDirection(LayoutDirection newDirection) {
        return new LayoutOptions(newDirection, nodeSpacing, layerSpacing, iterations);
    }
}
