package com.example.sickrock.model;

import java.util.List;
import java.util.Map;

/**
 * Filters, paging and ordering of a list request. A {@code null} page means the engine default and
 * an empty sort means newest first.
 */
public record ItemQuery(List<DataFilter> filters, Page page, List<ColumnSort> sort) {
    public ItemQuery {
        filters = filters == null ? List.of() : List.copyOf(filters);
        sort = sort == null ? List.of() : List.copyOf(sort);
    }

    public static ItemQuery all() {
        return new ItemQuery(List.of(), null, List.of());
    }

    public static ItemQuery where(Map<String, ?> equalities) {
        return new ItemQuery(DataFilter.fromMap(equalities), null, List.of());
    }

    public ItemQuery withPage(Page newPage) {
        return new ItemQuery(filters, newPage, sort);
    }

    public ItemQuery withSort(List<ColumnSort> newSort) {
        return new ItemQuery(filters, page, newSort);
    }
}
