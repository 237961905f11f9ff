package com.example.sickrock.model;

/**
 * Logical table as known to the metadata store. {@code name} is also the physical table name.
 */
public record TableConfiguration(
        Long id,
        String name,
        String title,
        int ordinal,
        String db,
        String createButtonText,
        String icon
) {
    public static final String DEFAULT_CREATE_BUTTON_TEXT = "Insert Row";

    public static TableConfiguration of(String name, String title) {
        return new TableConfiguration(null, name, title, 0, null, null, null);
    }

    public String displayTitle() {
        return title == null || title.isBlank() ? name : title;
    }

    public String displayCreateButtonText() {
        return createButtonText == null || createButtonText.isBlank() ? DEFAULT_CREATE_BUTTON_TEXT : createButtonText;
    }

    public TableConfiguration withId(long newId) {
        return new TableConfiguration(newId, name, title, ordinal, db, createButtonText, icon);
    }

    public TableConfiguration withName(String newName) {
        return new TableConfiguration(id, newName, title, ordinal, db, createButtonText, icon);
    }
}
