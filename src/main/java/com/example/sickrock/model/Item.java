package com.example.sickrock.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A row of a dynamic table. {@code id}, {@code sr_created} and {@code sr_updated} are lifted out of
 * {@code fields}; {@code synthetic} holds read-time values that are never persisted.
 */
public record Item(
        long id,
        Instant created,
        Instant updated,
        Map<String, FieldValue> fields,
        Map<String, Long> synthetic
) {
    public static final String CREATED_RELATIVE = "createdRelative";
    public static final String UPDATED_RELATIVE = "updatedRelative";

    public Item {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        synthetic = Collections.unmodifiableMap(new LinkedHashMap<>(synthetic));
    }

    public Item(long id, Instant created, Instant updated, Map<String, FieldValue> fields) {
        this(id, created, updated, fields, Map.of());
    }

    /**
     * Raw payload of the named column, {@code null} for SQL NULL or an absent column.
     */
    public Object value(String column) {
        FieldValue field = fields.get(column);
        return field == null ? null : field.value();
    }

    public Item withSynthetic(Map<String, Long> values) {
        return new Item(id, created, updated, fields, values);
    }
}
