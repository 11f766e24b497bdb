package com.example.workflowgraph.codegen;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Java source literals for strings, numbers and port-value lists.
 */
final class JavaLiterals {

    private JavaLiterals() {
    }

    static String string(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\%03o", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    static String number(double value) {
        if (Double.isNaN(value)) {
            return "Double.NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Double.POSITIVE_INFINITY" : "Double.NEGATIVE_INFINITY";
        }
        return Double.toString(value);
    }

    static String item(Object item) {
        if (item instanceof String s) {
            return string(s);
        }
        if (item instanceof Double d) {
            return number(d);
        }
        return String.valueOf(item);
    }

    static String list(List<?> items) {
        return items.stream().map(JavaLiterals::item).collect(Collectors.joining(", ", "List.of(", ")"));
    }
}
