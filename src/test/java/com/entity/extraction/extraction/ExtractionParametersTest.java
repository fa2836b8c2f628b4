package com.entity.extraction.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionParametersTest {

    @Test
    @DisplayName("Empty parameters have no source id")
    void emptyParameters() {
        assertNull(ExtractionParameters.empty().getSourceId());
        assertTrue(ExtractionParameters.empty().asMap().isEmpty());
    }

    @Test
    @DisplayName("Typed accessors fall back to defaults on missing or mistyped values")
    void typedAccessors() {
        ExtractionParameters params = ExtractionParameters.builder()
                .sourceId("doc-1")
                .put("threshold", 0.75)
                .put("limit", 10)
                .put("strict", true)
                .put("label", "x")
                .build();

        assertEquals("doc-1", params.getSourceId());
        assertEquals(0.75, params.getDouble("threshold", 0.0));
        assertEquals(10, params.getInt("limit", 0));
        assertTrue(params.getBoolean("strict", false));
        assertEquals(3, params.getInt("label", 3));
        assertEquals(0.5, params.getDouble("missing", 0.5));
    }

    @Test
    @DisplayName("Parameters are a snapshot of the source map")
    void snapshot() {
        Map<String, Object> source = new HashMap<>();
        source.put(ExtractionParameters.SOURCE_ID, "doc-1");
        ExtractionParameters params = ExtractionParameters.of(source);

        source.put(ExtractionParameters.SOURCE_ID, "doc-2");

        assertEquals("doc-1", params.getSourceId());
        assertThrows(UnsupportedOperationException.class, () -> params.asMap().put("k", "v"));
    }

    @Test
    @DisplayName("A null value removes the key")
    void nullRemoves() {
        ExtractionParameters params = ExtractionParameters.builder().sourceId("doc-1").sourceId(null).build();
        assertFalse(params.contains(ExtractionParameters.SOURCE_ID));
        assertEquals(ExtractionParameters.empty(), params);
    }
}
