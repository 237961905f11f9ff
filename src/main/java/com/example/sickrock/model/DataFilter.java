package com.example.sickrock.model;

import com.example.sickrock.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A single predicate of a list request. Only equality and LIKE are supported; a text value
 * containing {@code %} given through {@link #fromMap(Map)} becomes a LIKE pattern.
 */
public record DataFilter(String column, String operator, Object value) {
    private static final String[] SUPPORTED_OPERATORS = {"=", "LIKE"};

    public DataFilter {
        if (column == null || column.isBlank()) {
            throw new ValidationException("filter", "Filter column must not be blank");
        }
        operator = Optional.ofNullable(operator).map(String::trim).orElse("=");
        boolean allowed = false;
        for (String supportedOperator : SUPPORTED_OPERATORS) {
            if (supportedOperator.equalsIgnoreCase(operator)) {
                operator = supportedOperator;
                allowed = true;
                break;
            }
        }
        if (!allowed) {
            throw new ValidationException(column, "Unsupported operator: " + operator);
        }
    }

    public static DataFilter equalTo(String column, Object value) {
        return new DataFilter(column, "=", value);
    }

    public static List<DataFilter> fromMap(Map<String, ?> filters) {
        if (filters == null || filters.isEmpty()) {
            return List.of();
        }
        List<DataFilter> result = new ArrayList<>(filters.size());
        filters.forEach((column, value) -> {
            boolean pattern = value instanceof String text && text.contains("%");
            result.add(new DataFilter(column, pattern ? "LIKE" : "=", value));
        });
        return result;
    }

    public boolean isPattern() {
        return "LIKE".equals(operator);
    }
}
