package com.example.sickrock.model;

import com.example.sickrock.exception.ValidationException;

/**
 * Requested shape of a new column.
 */
public record ColumnSpec(String name, SemanticType type, boolean nullable, boolean defaultToCurrentTimestamp) {
    public ColumnSpec {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name", "Column name must not be blank");
        }
        if (type == null || !type.isStorable()) {
            throw new ValidationException(name, "Column definition must include a storable type, got " + type);
        }
        if (defaultToCurrentTimestamp && type != SemanticType.TIMESTAMP) {
            throw new ValidationException(name, "Only timestamp columns can default to the current time");
        }
    }

    public static ColumnSpec nullable(String name, SemanticType type) {
        return new ColumnSpec(name, type, true, false);
    }
}
