package com.example.workflowgraph.codec.document;

import com.example.workflowgraph.codec.WorkflowDeserializationException;
import com.example.workflowgraph.model.DataType;
import com.example.workflowgraph.model.Port;
import com.example.workflowgraph.model.PortValue;

/**
 * Conversions between {@link Port} and {@link PortDocument}.
 */
public final class PortDocuments {

    private PortDocuments() {
    }

    public static PortDocument fromPort(Port port) {
        return new PortDocument(
                port.name(),
                port.dataType().tag(),
                port.output(),
                port.multiple(),
                port.shown(),
                port.value().toRaw()
        );
    }

    /**
     * @param location prefix used in error messages, e.g. {@code nodes[0].ports[2]}
     * @throws WorkflowDeserializationException on a missing name, an unknown data type or a value that does not fit
     */
    public static Port toPort(PortDocument doc, String location) {
        if (doc == null) {
            throw new WorkflowDeserializationException(location, "port entry is null");
        }
        if (doc.name() == null || doc.name().isBlank()) {
            throw new WorkflowDeserializationException(location + ".name", "port name is required");
        }
        DataType dataType = dataType(doc.dataType(), location + ".dataType");
        return new Port(doc.name(), dataType, doc.output(), doc.multiple(), doc.shown(),
                value(dataType, doc.value(), location + ".value"));
    }

    public static DataType dataType(String tag, String location) {
        return DataType.fromTag(tag)
                .orElseThrow(() -> new WorkflowDeserializationException(location, "unknown data type '" + tag + "'"));
    }

    public static PortValue value(DataType dataType, Object raw, String location) {
        try {
            return PortValue.fromRaw(dataType, raw);
        } catch (IllegalArgumentException e) {
            throw new WorkflowDeserializationException(location, "invalid " + dataType.tag() + " value: " + e.getMessage(), e);
        }
    }
}
