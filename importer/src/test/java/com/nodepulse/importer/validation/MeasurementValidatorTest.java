package com.nodepulse.importer.validation;

import com.nodepulse.importer.model.MeasurementRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link MeasurementValidator}.
 */
class MeasurementValidatorTest {

    private final MeasurementValidator validator = new MeasurementValidator();

    private static MeasurementRecord ping(Object sequence, Object rtt, Object bytes, Object timestamp) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("DataId", MeasurementValidator.PING);
        fields.put("SequenceNumber", sequence);
        fields.put("Rtt", rtt);
        fields.put("Bytes", bytes);
        fields.put("TimeStamp", timestamp);
        return new MeasurementRecord(fields);
    }

    @Test
    @DisplayName("Types without a check are accepted")
    void unknownType_accepted() {
        assertTrue(validator.accepts(new MeasurementRecord(Map.of("DataId", "MONROE.META.DEVICE")), 2));
    }

    @Test
    @DisplayName("Records without DataId are rejected")
    void missingDataId_rejected() {
        assertFalse(validator.accepts(new MeasurementRecord(Map.of("Rtt", 1)), 0));
    }

    @Test
    @DisplayName("Reasonable ping values are accepted, sequence number zero included")
    void validPing_accepted() {
        assertTrue(validator.accepts(ping(0, 12.3, 84, 1_465_000_000L), 0));
    }

    @Test
    @DisplayName("Non-positive or negative ping values are rejected")
    void invalidPing_rejected() {
        assertFalse(validator.accepts(ping(-1, 12.3, 84, 1L), 0));
        assertFalse(validator.accepts(ping(1, 0, 84, 1L), 0));
        assertFalse(validator.accepts(ping(1, 12.3, 0, 1L), 0));
        assertFalse(validator.accepts(ping(1, 12.3, 84, 0), 0));
    }

    @Test
    @DisplayName("Missing or non-numeric ping fields are rejected")
    void incompletePing_rejected() {
        assertFalse(validator.accepts(ping(1, null, 84, 1L), 2));
        assertFalse(validator.accepts(ping(1, "12", 84, 1L), 0));
        assertFalse(validator.accepts(new MeasurementRecord(Map.of("DataId", MeasurementValidator.PING)), 0));
    }

    @Test
    @DisplayName("Custom checks replace the defaults")
    void customChecks() {
        MeasurementValidator custom = new MeasurementValidator(
                Map.of("A", r -> r.has("required")));

        assertFalse(custom.accepts(new MeasurementRecord(Map.of("DataId", "A")), 0));
        assertTrue(custom.accepts(new MeasurementRecord(Map.of("DataId", "A", "required", 1)), 0));
        assertTrue(custom.accepts(ping(-1, 0, 0, 0), 0));
    }

    @Test
    @DisplayName("acceptAll accepts everything")
    void acceptAll() {
        assertTrue(RecordValidator.acceptAll().accepts(new MeasurementRecord(Map.of()), 0));
    }
}
