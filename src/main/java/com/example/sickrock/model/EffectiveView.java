package com.example.sickrock.model;

import java.util.List;

/**
 * Render-ready column layout of a table. {@code viewId} is {@code null} when no saved view applies.
 */
public record EffectiveView(Long viewId, String viewName, ViewType viewType, List<EffectiveColumn> columns) {
    public EffectiveView {
        columns = List.copyOf(columns);
    }

    public List<String> visibleColumnNames() {
        return columns.stream().filter(EffectiveColumn::visible).map(EffectiveColumn::name).toList();
    }

    public List<ColumnSort> sort() {
        return columns.stream()
                .filter(c -> c.sortOrder() != null)
                .map(c -> new ColumnSort(c.name(), c.sortOrder()))
                .toList();
    }
}
