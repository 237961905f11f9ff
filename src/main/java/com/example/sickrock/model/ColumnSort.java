package com.example.sickrock.model;

public record ColumnSort(String column, SortDirective direction) {
    public ColumnSort {
        direction = direction == null ? SortDirective.ASC : direction;
    }
}
