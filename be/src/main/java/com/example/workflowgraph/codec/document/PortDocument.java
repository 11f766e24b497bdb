package com.example.workflowgraph.codec.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * One port of a node document. {@code value} is a raw JSON value (string, number, boolean or array) or absent.
 * Integer-valued numbers are held as {@link Long} whatever width the parser produced.
 */
@JsonPropertyOrder({"name", "dataType", "isOutput", "multiple", "shown", "value"})
public record PortDocument(
        @NotBlank String name,
        @NotBlank String dataType,
        @JsonProperty("isOutput") boolean output,
        boolean multiple,
        boolean shown,
        @JsonInclude(JsonInclude.Include.NON_NULL) Object value
) {
    public PortDocument {
        value = widen(value);
    }

    private static Object widen(Object raw) {
        if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof List<?> items) {
            return items.stream().map(PortDocument::widen).toList();
        }
        return raw;
    }
}
