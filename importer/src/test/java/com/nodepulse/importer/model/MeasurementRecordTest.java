package com.nodepulse.importer.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MeasurementRecordTest {

    @Test
    @DisplayName("Later changes to the source map do not leak into the record")
    void copiesSource() {
        Map<String, Object> source = new LinkedHashMap<>();
        List<Object> values = new ArrayList<>(List.of(1, 2));
        source.put("DataId", "x");
        source.put("values", values);

        MeasurementRecord record = new MeasurementRecord(source);
        source.put("extra", true);
        values.add(3);

        assertFalse(record.has("extra"));
        assertEquals(List.of(1, 2), record.get("values"));
        assertThrows(UnsupportedOperationException.class, () -> record.fields().put("y", 1));
    }

    @Test
    @DisplayName("JSON nulls are kept as fields")
    void keepsNulls() {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("DataId", "x");
        source.put("Rtt", null);

        MeasurementRecord record = new MeasurementRecord(source);

        assertTrue(record.has("Rtt"));
        assertNull(record.get("Rtt"));
        assertEquals(2, record.size());
    }

    @Test
    @DisplayName("dataId is null when absent or not a string")
    void dataId() {
        assertNull(new MeasurementRecord(Map.of("Rtt", 1)).dataId());
        assertNull(new MeasurementRecord(Map.of("DataId", 1)).dataId());
        assertEquals("a.b", new MeasurementRecord(Map.of("DataId", "a.b")).dataId());
    }
}
