package com.example.sickrock.model;

import com.example.sickrock.exception.ValidationException;

import java.util.Locale;

public enum SortDirective {
    ASC,
    DESC;

    /**
     * Parses a stored sort directive; blank means unsorted and yields {@code null}.
     */
    public static SortDirective parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("sortOrder", "Unsupported sort order: " + value);
        }
    }
}
