package com.example.sickrock.model;

import com.example.sickrock.exception.ValidationException;

import java.util.Locale;

public enum ReferentialAction {
    NO_ACTION("NO ACTION"),
    RESTRICT("RESTRICT"),
    CASCADE("CASCADE"),
    SET_NULL("SET NULL");

    private final String sql;

    ReferentialAction(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }

    public static ReferentialAction parse(String value) {
        if (value == null || value.isBlank()) {
            return NO_ACTION;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('_', ' ');
        for (ReferentialAction action : values()) {
            if (action.sql.equals(normalized)) {
                return action;
            }
        }
        throw new ValidationException("action", "Unsupported referential action: " + value);
    }
}
