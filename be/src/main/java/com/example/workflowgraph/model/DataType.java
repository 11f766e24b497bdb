package com.example.workflowgraph.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Data-type tag of a port. The lowercase name is the tag used in documents.
 */
public enum DataType {
    TEXT,
    NUMBER,
    BOOLEAN,
    LIST,
    IMAGE,
    FILE,
    ANY;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns whether a connection from a port of {@code source} type into a port of this type is allowed,
     * either because the tags are equal or because a coercion is declared. A list input takes single values as items.
     */
    public boolean acceptsFrom(DataType source) {
        if (this == source || this == ANY || source == ANY) {
            return true;
        }
        return switch (this) {
            case TEXT -> source == NUMBER || source == BOOLEAN;
            case FILE -> source == IMAGE;
            case LIST -> true;
            default -> false;
        };
    }

    public static Optional<DataType> fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.tag().equals(normalized))
                .findFirst();
    }
}
