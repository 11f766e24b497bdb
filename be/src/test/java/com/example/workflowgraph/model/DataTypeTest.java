package com.example.workflowgraph.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DataType")
class DataTypeTest {

    @Test
    @DisplayName("equal tags and any are always compatible")
    void equalAndAny() {
        for (DataType type : DataType.values()) {
            assertTrue(type.acceptsFrom(type));
            assertTrue(type.acceptsFrom(DataType.ANY));
            assertTrue(DataType.ANY.acceptsFrom(type));
        }
    }

    @Test
    @DisplayName("declared coercions are accepted")
    void coercions() {
        assertTrue(DataType.TEXT.acceptsFrom(DataType.NUMBER));
        assertTrue(DataType.TEXT.acceptsFrom(DataType.BOOLEAN));
        assertTrue(DataType.FILE.acceptsFrom(DataType.IMAGE));
        assertTrue(DataType.LIST.acceptsFrom(DataType.TEXT));
    }

    @Test
    @DisplayName("other combinations are rejected")
    void rejections() {
        assertFalse(DataType.IMAGE.acceptsFrom(DataType.TEXT));
        assertFalse(DataType.TEXT.acceptsFrom(DataType.IMAGE));
        assertFalse(DataType.TEXT.acceptsFrom(DataType.LIST));
        assertFalse(DataType.NUMBER.acceptsFrom(DataType.TEXT));
        assertFalse(DataType.IMAGE.acceptsFrom(DataType.FILE));
    }

    @Test
    @DisplayName("parses tags case-insensitively")
    void fromTag() {
        assertEquals(Optional.of(DataType.BOOLEAN), DataType.fromTag("Boolean"));
        assertEquals("number", DataType.NUMBER.tag());
        assertTrue(DataType.fromTag("str").isEmpty());
        assertTrue(DataType.fromTag(null).isEmpty());
    }
}
