package com.example.workflowgraph.layout;

import java.util.Locale;

/**
 * Flow direction of a layout: left-to-right, top-to-bottom, right-to-left or bottom-to-top.
 */
public enum LayoutDirection {
    LR,
    TB,
    RL,
    BT;

    boolean horizontal() {
        return this == LR || this == RL;
    }

    boolean reversed() {
        return this == RL || this == BT;
    }

    public static LayoutDirection parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("layout direction is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid layout direction '" + value + "'; must be one of LR, TB, RL, BT", e);
        }
    }
}
