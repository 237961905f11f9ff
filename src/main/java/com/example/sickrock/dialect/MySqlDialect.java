package com.example.sickrock.dialect;

import com.example.sickrock.model.ColumnDescriptor;
import com.example.sickrock.model.ColumnSpec;
import com.example.sickrock.model.ForeignKeyDeclaration;
import com.example.sickrock.model.SemanticType;
import com.example.sickrock.model.TableStructure;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * MySQL support. DDL commits implicitly, so every schema operation is a single {@code ALTER TABLE}
 * (atomic on its own) paired with the statement that undoes it where one exists.
 */
public class MySqlDialect extends AbstractSqlDialect {

    private static final Map<String, SemanticType> TYPE_MAPPING = Map.ofEntries(
            Map.entry("VARCHAR", SemanticType.TEXT),
            Map.entry("CHAR", SemanticType.TEXT),
            Map.entry("TEXT", SemanticType.TEXT),
            Map.entry("TINYTEXT", SemanticType.TEXT),
            Map.entry("MEDIUMTEXT", SemanticType.TEXT),
            Map.entry("LONGTEXT", SemanticType.TEXT),
            Map.entry("BIGINT", SemanticType.INTEGER),
            Map.entry("INT", SemanticType.INTEGER),
            Map.entry("INTEGER", SemanticType.INTEGER),
            Map.entry("MEDIUMINT", SemanticType.INTEGER),
            Map.entry("SMALLINT", SemanticType.INTEGER),
            Map.entry("TINYINT", SemanticType.INTEGER),
            Map.entry("DECIMAL", SemanticType.DECIMAL),
            Map.entry("NUMERIC", SemanticType.DECIMAL),
            Map.entry("DOUBLE", SemanticType.DECIMAL),
            Map.entry("FLOAT", SemanticType.DECIMAL),
            Map.entry("REAL", SemanticType.DECIMAL),
            Map.entry("BOOLEAN", SemanticType.BOOLEAN),
            Map.entry("BOOL", SemanticType.BOOLEAN),
            Map.entry("DATETIME", SemanticType.TIMESTAMP),
            Map.entry("TIMESTAMP", SemanticType.TIMESTAMP),
            Map.entry("DATE", SemanticType.TIMESTAMP)
    );

    private static final Map<SemanticType, String> PHYSICAL_TYPES = new EnumMap<>(Map.of(
            SemanticType.TEXT, "TEXT",
            SemanticType.INTEGER, "BIGINT",
            SemanticType.DECIMAL, "DECIMAL(38,10)",
            SemanticType.BOOLEAN, "BOOLEAN",
            SemanticType.TIMESTAMP, "DATETIME(3)"
    ));

    private static final Set<String> TEMPORAL_TYPES = Set.of("DATETIME", "TIMESTAMP");

    private static final Set<String> TEXT_TYPES = Set.of("TEXT", "TINYTEXT", "MEDIUMTEXT", "LONGTEXT");

    private static final Set<String> SIZED_TYPES = Set.of("VARCHAR", "CHAR", "VARBINARY", "BINARY");

    @Override
    public DialectKind kind() {
        return DialectKind.MYSQL;
    }

    @Override
    protected Map<String, SemanticType> typeMapping() {
        return TYPE_MAPPING;
    }

    @Override
    protected Map<SemanticType, String> physicalTypes() {
        return PHYSICAL_TYPES;
    }

    @Override
    protected char quoteCharacter() {
        return '`';
    }

    @Override
    public boolean transactionalDdl() {
        return false;
    }

    @Override
    public boolean enforcesForeignKeys() {
        return true;
    }

    @Override
    public boolean acceptsDatabase(String db, String connectionCatalog) {
        return db == null || db.isBlank() || db.equalsIgnoreCase(connectionCatalog);
    }

    @Override
    public String declaredType(String typeName, int columnSize, int decimalDigits) {
        String normalized = normalizeTypeName(typeName);
        if (SIZED_TYPES.contains(normalized) && columnSize > 0) {
            return normalized + "(" + columnSize + ")";
        }
        if (("DECIMAL".equals(normalized) || "NUMERIC".equals(normalized)) && columnSize > 0) {
            return normalized + "(" + columnSize + "," + Math.max(decimalDigits, 0) + ")";
        }
        if (("TINYINT".equals(normalized) || "BIT".equals(normalized)) && columnSize == 1) {
            return "BOOLEAN";
        }
        if (TEMPORAL_TYPES.contains(normalized)) {
            // fractional digits show up as DECIMAL_DIGITS or as the width beyond yyyy-MM-dd HH:mm:ss
            int fraction = decimalDigits > 0 ? decimalDigits : Math.max(columnSize - 20, 0);
            return fraction > 0 ? normalized + "(" + fraction + ")" : normalized;
        }
        return typeName == null ? "" : typeName.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public SemanticType classify(String physicalType, int columnSize) {
        String normalized = normalizeTypeName(physicalType);
        if (("TINYINT".equals(normalized) || "BIT".equals(normalized)) && columnSize == 1) {
            return SemanticType.BOOLEAN;
        }
        return super.classify(physicalType, columnSize);
    }

    @Override
    public StatementPlan createTable(String table) {
        String sql = "CREATE TABLE " + quote(table) + " ("
                + quote(TableStructure.ID_COLUMN) + " BIGINT NOT NULL AUTO_INCREMENT PRIMARY KEY, "
                + quote(TableStructure.CREATED_COLUMN) + " DATETIME(3) NOT NULL DEFAULT CURRENT_TIMESTAMP(3), "
                + quote(TableStructure.UPDATED_COLUMN) + " DATETIME(3) NOT NULL DEFAULT CURRENT_TIMESTAMP(3))";
        return StatementPlan.single(sql, "DROP TABLE " + quote(table));
    }

    @Override
    public StatementPlan dropTable(String table) {
        return StatementPlan.single("DROP TABLE " + quote(table));
    }

    @Override
    public StatementPlan renameTable(TableStructure table, String newName) {
        return StatementPlan.single(
                "RENAME TABLE " + quote(table.tableName()) + " TO " + quote(newName),
                "RENAME TABLE " + quote(newName) + " TO " + quote(table.tableName()));
    }

    @Override
    public StatementPlan addColumn(TableStructure table, ColumnSpec column) {
        String physical = physicalType(column.type());
        String sql = "ALTER TABLE " + quote(table.tableName()) + " ADD COLUMN " + quote(column.name()) + " "
                + physical
                + (column.nullable() ? "" : " NOT NULL")
                + (column.defaultToCurrentTimestamp() ? " DEFAULT " + currentTimestamp(physical) : "");
        return StatementPlan.single(sql, "ALTER TABLE " + quote(table.tableName()) + " DROP COLUMN " + quote(column.name()));
    }

    @Override
    public StatementPlan dropColumn(TableStructure table, String column) {
        ColumnDescriptor dropped = requireColumn(table, column);
        return StatementPlan.single("ALTER TABLE " + quote(table.tableName()) + " DROP COLUMN " + quote(dropped.name()));
    }

    @Override
    public StatementPlan renameColumn(TableStructure table, String column, String newName) {
        ColumnDescriptor renamed = requireColumn(table, column);
        String tableName = quote(table.tableName());
        return StatementPlan.single(
                "ALTER TABLE " + tableName + " RENAME COLUMN " + quote(renamed.name()) + " TO " + quote(newName),
                "ALTER TABLE " + tableName + " RENAME COLUMN " + quote(newName) + " TO " + quote(renamed.name()));
    }

    @Override
    public StatementPlan changeColumnType(TableStructure table, String column, SemanticType newType) {
        ColumnDescriptor changed = requireColumn(table, column);
        String tableName = quote(table.tableName());
        String forward = "ALTER TABLE " + tableName + " MODIFY COLUMN "
                + columnDefinition(changed, physicalType(newType), newType);
        String backward = "ALTER TABLE " + tableName + " MODIFY COLUMN "
                + columnDefinition(changed, changed.physicalType(), changed.valueType());
        return StatementPlan.single(forward, backward);
    }

    @Override
    public StatementPlan addForeignKey(TableStructure table, ForeignKeyDeclaration foreignKey) {
        return StatementPlan.single(addConstraint(table, foreignKey), dropConstraint(table, foreignKey));
    }

    @Override
    public StatementPlan dropForeignKey(TableStructure table, ForeignKeyDeclaration foreignKey) {
        return StatementPlan.single(dropConstraint(table, foreignKey), addConstraint(table, foreignKey));
    }

    private String addConstraint(TableStructure table, ForeignKeyDeclaration foreignKey) {
        return "ALTER TABLE " + quote(table.tableName()) + " ADD CONSTRAINT " + quote(foreignKey.constraintName())
                + " FOREIGN KEY (" + quote(foreignKey.columnName()) + ") REFERENCES "
                + quote(foreignKey.referencedTable()) + " (" + quote(foreignKey.referencedColumn()) + ")"
                + " ON DELETE " + foreignKey.onDelete().sql() + " ON UPDATE " + foreignKey.onUpdate().sql();
    }

    private String dropConstraint(TableStructure table, ForeignKeyDeclaration foreignKey) {
        return "ALTER TABLE " + quote(table.tableName()) + " DROP FOREIGN KEY " + quote(foreignKey.constraintName());
    }

    /**
     * Column definition for MODIFY COLUMN. Nullability is kept; a literal default survives only
     * when the type does not change, and never on TEXT columns, which cannot carry one.
     */
    private String columnDefinition(ColumnDescriptor column, String physicalType, SemanticType type) {
        StringBuilder sql = new StringBuilder(quote(column.name())).append(' ').append(physicalType);
        sql.append(column.nullable() ? " NULL" : " NOT NULL");
        String defaultValue = column.defaultValue();
        if (defaultValue != null && !column.autoIncrement()) {
            String upper = defaultValue.trim().toUpperCase(Locale.ROOT);
            if (upper.startsWith("CURRENT_TIMESTAMP")) {
                if (type == SemanticType.TIMESTAMP) {
                    sql.append(" DEFAULT ").append(currentTimestamp(physicalType));
                }
            } else if (type == column.valueType() && !"NULL".equals(upper)
                    && !TEXT_TYPES.contains(normalizeTypeName(physicalType))) {
                sql.append(" DEFAULT '").append(defaultValue.replace("'", "''")).append('\'');
            }
        }
        return sql.toString();
    }

    /**
     * CURRENT_TIMESTAMP with the column's fractional precision, which MySQL requires to match.
     */
    private static String currentTimestamp(String physicalType) {
        int paren = physicalType.indexOf('(');
        return paren < 0 ? "CURRENT_TIMESTAMP" : "CURRENT_TIMESTAMP" + physicalType.substring(paren);
    }

    @Override
    public String lastInsertId() {
        return "SELECT LAST_INSERT_ID()";
    }

    @Override
    public String forUpdate() {
        return " FOR UPDATE";
    }

    @Override
    public Object timestampParameter(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant.truncatedTo(ChronoUnit.MILLIS), ZoneOffset.UTC);
    }
}
