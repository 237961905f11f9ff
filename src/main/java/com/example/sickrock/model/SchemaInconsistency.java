package com.example.sickrock.model;

public record SchemaInconsistency(Kind kind, String tableName, String detail) {

    public enum Kind {
        CONFIGURATION_WITHOUT_TABLE,
        TABLE_WITHOUT_CONFIGURATION
    }
}
