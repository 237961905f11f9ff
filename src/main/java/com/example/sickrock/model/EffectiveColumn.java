package com.example.sickrock.model;

public record EffectiveColumn(String name, boolean visible, SortDirective sortOrder, Integer width) {
}
