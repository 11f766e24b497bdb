package com.example.workflowgraph.model;

import java.util.Objects;

/**
 * A named, typed attachment point on a node.
 *
 * @param multiple input accepts any number of incoming connections (otherwise at most one)
 * @param shown    input is exposed to the end user on the platform UI
 */
public record Port(
        String name,
        DataType dataType,
        boolean output,
        boolean multiple,
        boolean shown,
        PortValue value
) {
    public Port {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(dataType, "dataType");
        if (name.isBlank()) {
            throw new IllegalArgumentException("port name must not be blank");
        }
        value = value != null ? value : PortValue.empty();
        if (!value.fits(dataType)) {
            throw new PortTypeMismatchException("port " + name, dataType, value.type());
        }
    }

    public static Port input(String name, DataType dataType) {
        return new Port(name, dataType, false, false, false, PortValue.empty());
    }

    public static Port output(String name, DataType dataType) {
        return new Port(name, dataType, true, false, false, PortValue.empty());
    }

    public boolean input() {
        return !output;
    }

    public Port withValue(PortValue newValue) {
        return new Port(name, dataType, output, multiple, shown, newValue);
    }

    public Port withMultiple(boolean newMultiple) {
        return new Port(name, dataType, output, newMultiple, shown, value);
    }

    public Port withShown(boolean newShown) {
        return new Port(name, dataType, output, multiple, newShown, value);
    }
}
