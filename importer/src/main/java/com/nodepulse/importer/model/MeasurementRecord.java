package com.nodepulse.importer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One parsed measurement object. Field order is the order in which the
 * fields appeared in the source file, and becomes the column order of the
 * resulting insert. Nested objects and arrays are frozen along with the
 * top level.
 */
public record MeasurementRecord(Map<String, Object> fields) {

    /** Field naming the record type, and through it the target table. */
    public static final String DATA_ID_FIELD = "DataId";

    public MeasurementRecord {
        Objects.requireNonNull(fields, "fields");
        fields = freezeMap(fields);
    }

    public Object get(String name) {
        return fields.get(name);
    }

    public boolean has(String name) {
        return fields.containsKey(name);
    }

    /**
     * Returns the record type, or {@code null} when the record has no
     * {@value #DATA_ID_FIELD} field or it is not a string.
     */
    public String dataId() {
        Object value = fields.get(DATA_ID_FIELD);
        return value instanceof String s ? s : null;
    }

    public int size() {
        return fields.size();
    }

    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
