package com.example.sickrock.model;

import java.util.List;
import java.util.Optional;

/**
 * Live shape of a physical table: columns in catalog order, secondary indexes and the foreign keys
 * originating from it (physical constraints merged with declared ones).
 */
public record TableStructure(
        String tableName,
        List<ColumnDescriptor> columns,
        List<IndexDefinition> indexes,
        List<ForeignKeyDeclaration> foreignKeys
) {
    public static final String ID_COLUMN = "id";
    public static final String CREATED_COLUMN = "sr_created";
    public static final String UPDATED_COLUMN = "sr_updated";

    public TableStructure {
        columns = List.copyOf(columns);
        indexes = List.copyOf(indexes);
        foreignKeys = List.copyOf(foreignKeys);
    }

    public Optional<ColumnDescriptor> column(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return columns.stream().filter(c -> c.name().equalsIgnoreCase(name)).findFirst();
    }

    public boolean hasColumn(String name) {
        return column(name).isPresent();
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnDescriptor::name).toList();
    }

    public List<ColumnDescriptor> primaryKey() {
        return columns.stream().filter(ColumnDescriptor::primaryKey).toList();
    }

    public boolean hasCreatedColumn() {
        return hasColumn(CREATED_COLUMN);
    }
}
