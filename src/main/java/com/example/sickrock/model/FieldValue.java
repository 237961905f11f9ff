package com.example.sickrock.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Tagged value of a dynamic column. The payload class is fixed by the kind so values round-trip
 * without losing precision: integers are {@link Long}, decimals {@link BigDecimal}, timestamps
 * {@link Instant}.
 */
public record FieldValue(Kind kind, Object value) {

    public enum Kind {TEXT, INTEGER, DECIMAL, BOOLEAN, TIMESTAMP, NULL}

    private static final FieldValue NULL = new FieldValue(Kind.NULL, null);

    public FieldValue {
        if (kind == null) {
            throw new IllegalArgumentException("Field value kind must not be null");
        }
        Class<?> expected = switch (kind) {
            case TEXT -> String.class;
            case INTEGER -> Long.class;
            case DECIMAL -> BigDecimal.class;
            case BOOLEAN -> Boolean.class;
            case TIMESTAMP -> Instant.class;
            case NULL -> null;
        };
        if (expected == null ? value != null : !expected.isInstance(value)) {
            throw new IllegalArgumentException("Value " + value + " does not match kind " + kind);
        }
    }

    public static FieldValue text(String value) {
        return value == null ? NULL : new FieldValue(Kind.TEXT, value);
    }

    public static FieldValue integer(long value) {
        return new FieldValue(Kind.INTEGER, value);
    }

    public static FieldValue decimal(BigDecimal value) {
        return value == null ? NULL : new FieldValue(Kind.DECIMAL, value);
    }

    public static FieldValue bool(boolean value) {
        return new FieldValue(Kind.BOOLEAN, value);
    }

    public static FieldValue timestamp(Instant value) {
        return value == null ? NULL : new FieldValue(Kind.TIMESTAMP, value);
    }

    public static FieldValue nullValue() {
        return NULL;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    @Override
    public String toString() {
        return isNull() ? "null" : String.valueOf(value);
    }
}
