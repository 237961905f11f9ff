package com.example.sickrock.model;

import com.example.sickrock.exception.ValidationException;

import java.util.Locale;

public enum ViewType {
    TABLE,
    CALENDAR;

    public String storedName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ViewType parse(String value) {
        if (value == null || value.isBlank()) {
            return TABLE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("viewType", "Unsupported view type: " + value);
        }
    }
}
