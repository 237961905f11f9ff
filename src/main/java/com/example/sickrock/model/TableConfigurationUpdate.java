package com.example.sickrock.model;

/**
 * Display attributes of a table configuration that can change without touching the physical table.
 * {@code null} leaves the stored value unchanged.
 */
public record TableConfigurationUpdate(String title, Integer ordinal, String createButtonText, String icon) {
    public static TableConfigurationUpdate retitle(String title) {
        return new TableConfigurationUpdate(title, null, null, null);
    }
}
