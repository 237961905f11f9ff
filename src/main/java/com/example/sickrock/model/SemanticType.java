package com.example.sickrock.model;

/**
 * Engine-level column types. Physical types of either dialect are classified into one of these.
 */
public enum SemanticType {
    TEXT,
    INTEGER,
    DECIMAL,
    BOOLEAN,
    TIMESTAMP,
    FOREIGN_KEY,
    UNSUPPORTED;

    /**
     * Types a column can be created with or converted to.
     */
    public boolean isStorable() {
        return this != FOREIGN_KEY && this != UNSUPPORTED;
    }
}
