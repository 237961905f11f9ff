package com.example.sickrock.model;

import com.example.sickrock.exception.ValidationException;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public record TableView(
        Long id,
        String tableName,
        String viewName,
        ViewType viewType,
        boolean isDefault,
        List<ColumnVisibility> columns
) {
    public TableView {
        if (viewName == null || viewName.isBlank()) {
            throw new ValidationException("viewName", "View name must not be blank");
        }
        viewType = viewType == null ? ViewType.TABLE : viewType;
        columns = columns == null ? List.of() : List.copyOf(columns);
        Set<String> seen = new HashSet<>();
        for (ColumnVisibility column : columns) {
            if (!seen.add(column.columnName().toLowerCase(Locale.ROOT))) {
                throw new ValidationException(column.columnName(), "Column listed twice in view " + viewName);
            }
        }
    }

    public static TableView of(String tableName, String viewName, List<ColumnVisibility> columns) {
        return new TableView(null, tableName, viewName, ViewType.TABLE, false, columns);
    }

    public TableView withId(long newId) {
        return new TableView(newId, tableName, viewName, viewType, isDefault, columns);
    }

    public TableView asDefault(boolean value) {
        return new TableView(id, tableName, viewName, viewType, value, columns);
    }
}
