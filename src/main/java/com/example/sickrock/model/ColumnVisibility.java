package com.example.sickrock.model;

import com.example.sickrock.exception.ValidationException;

public record ColumnVisibility(String columnName, boolean visible, int columnOrder, SortDirective sortOrder, Integer width) {
    public ColumnVisibility {
        if (columnName == null || columnName.isBlank()) {
            throw new ValidationException("columnName", "View column name must not be blank");
        }
    }

    public static ColumnVisibility visible(String columnName, int columnOrder) {
        return new ColumnVisibility(columnName, true, columnOrder, null, null);
    }

    public static ColumnVisibility hidden(String columnName, int columnOrder) {
        return new ColumnVisibility(columnName, false, columnOrder, null, null);
    }
}
