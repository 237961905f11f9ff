package com.example.sickrock.model;

/**
 * A foreign key known to the metadata store. {@code enforced} is false where the dialect cannot
 * hold the constraint physically and the engine checks it at the application layer instead.
 */
public record ForeignKeyDeclaration(
        Long id,
        String tableName,
        String columnName,
        String referencedTable,
        String referencedColumn,
        String constraintName,
        ReferentialAction onDelete,
        ReferentialAction onUpdate,
        boolean enforced
) {
    private static final int MAX_NAME_LENGTH = 64;

    public ForeignKeyDeclaration {
        onDelete = onDelete == null ? ReferentialAction.NO_ACTION : onDelete;
        onUpdate = onUpdate == null ? ReferentialAction.NO_ACTION : onUpdate;
    }

    public static ForeignKeyDeclaration of(String tableName, String columnName,
                                           String referencedTable, String referencedColumn) {
        return new ForeignKeyDeclaration(null, tableName, columnName, referencedTable, referencedColumn,
                defaultConstraintName(tableName, columnName, referencedTable, referencedColumn),
                ReferentialAction.NO_ACTION, ReferentialAction.NO_ACTION, false);
    }

    public static String defaultConstraintName(String table, String column, String refTable, String refColumn) {
        return bounded("fk_" + table + "_" + column + "_" + refTable + "_" + refColumn);
    }

    /**
     * Name of the lookup index. Index names are global on SQLite, so it is derived from the
     * constraint name.
     */
    public String indexName() {
        return bounded("idx_" + constraintName);
    }

    /**
     * Names longer than the identifier limit keep a prefix and end in a hash of the full name, so
     * two long names sharing a prefix stay distinct.
     */
    static String bounded(String name) {
        if (name.length() <= MAX_NAME_LENGTH) {
            return name;
        }
        String hash = String.format("%08x", name.hashCode());
        return name.substring(0, MAX_NAME_LENGTH - hash.length() - 1) + "_" + hash;
    }

    public boolean references(String table, String column) {
        return referencedTable.equals(table) && referencedColumn.equalsIgnoreCase(column);
    }

    public boolean originatesFrom(String table, String column) {
        return tableName.equals(table) && columnName.equalsIgnoreCase(column);
    }

    public ForeignKeyDeclaration withId(long newId) {
        return new ForeignKeyDeclaration(newId, tableName, columnName, referencedTable, referencedColumn,
                constraintName, onDelete, onUpdate, enforced);
    }

    public ForeignKeyDeclaration withActions(ReferentialAction delete, ReferentialAction update) {
        return new ForeignKeyDeclaration(id, tableName, columnName, referencedTable, referencedColumn,
                constraintName, delete, update, enforced);
    }
}
