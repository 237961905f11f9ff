package com.example.sickrock.model;

/**
 * A live column as reported by the database catalog.
 *
 * @param type         semantic classification; {@link SemanticType#FOREIGN_KEY} when the column references another table
 * @param valueType    classification of the physical type, used for value conversion
 * @param physicalType the declared type as the catalog reports it
 * @param defaultValue the catalog's default expression, or {@code null}
 * @param references   the foreign key this column is the source of, or {@code null}
 */
public record ColumnDescriptor(
        String name,
        SemanticType type,
        SemanticType valueType,
        String physicalType,
        boolean nullable,
        boolean primaryKey,
        boolean autoIncrement,
        String defaultValue,
        ForeignKeyDeclaration references
) {
    public boolean hasDefault() {
        return defaultValue != null || autoIncrement;
    }

    public boolean isForeignKey() {
        return references != null;
    }

    public ColumnDescriptor withReference(ForeignKeyDeclaration reference) {
        SemanticType semantic = reference == null ? valueType : SemanticType.FOREIGN_KEY;
        return new ColumnDescriptor(name, semantic, valueType, physicalType, nullable, primaryKey,
                autoIncrement, defaultValue, reference);
    }
}
