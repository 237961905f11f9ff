package com.example.sickrock.dialect;

import com.example.sickrock.exception.ConflictException;
import com.example.sickrock.exception.IntegrityException;
import com.example.sickrock.exception.TransientException;
import com.example.sickrock.exception.ValidationException;
import com.example.sickrock.model.ColumnDescriptor;
import com.example.sickrock.model.ColumnSpec;
import com.example.sickrock.model.ForeignKeyDeclaration;
import com.example.sickrock.model.IndexDefinition;
import com.example.sickrock.model.SemanticType;
import com.example.sickrock.model.TableStructure;
import org.springframework.dao.DataAccessException;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * SQLite support. DDL is transactional here, so column drops, renames and type changes are done by
 * rebuilding the table: create a shadow table with the target shape, copy the rows across, drop the
 * original, rename the shadow into place and recreate the indexes. Foreign keys declared through
 * the engine are advisory and only get a lookup index.
 */
public class SqliteDialect extends AbstractSqlDialect {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    /**
     * Declared type of engine-created DECIMAL columns. The name carries TEXT affinity, so values are
     * stored as their exact decimal text instead of being coerced to an 8-byte REAL.
     */
    static final String DECIMAL_TYPE = "DECIMAL_TEXT";

    private static final Map<String, SemanticType> TYPE_MAPPING = Map.ofEntries(
            Map.entry("TEXT", SemanticType.TEXT),
            Map.entry("VARCHAR", SemanticType.TEXT),
            Map.entry("CHAR", SemanticType.TEXT),
            Map.entry("NVARCHAR", SemanticType.TEXT),
            Map.entry("NCHAR", SemanticType.TEXT),
            Map.entry("CLOB", SemanticType.TEXT),
            Map.entry("STRING", SemanticType.TEXT),
            Map.entry("INTEGER", SemanticType.INTEGER),
            Map.entry("INT", SemanticType.INTEGER),
            Map.entry("BIGINT", SemanticType.INTEGER),
            Map.entry("SMALLINT", SemanticType.INTEGER),
            Map.entry("MEDIUMINT", SemanticType.INTEGER),
            Map.entry("TINYINT", SemanticType.INTEGER),
            Map.entry(DECIMAL_TYPE, SemanticType.DECIMAL),
            Map.entry("NUMERIC", SemanticType.DECIMAL),
            Map.entry("DECIMAL", SemanticType.DECIMAL),
            Map.entry("REAL", SemanticType.DECIMAL),
            Map.entry("DOUBLE", SemanticType.DECIMAL),
            Map.entry("FLOAT", SemanticType.DECIMAL),
            Map.entry("BOOLEAN", SemanticType.BOOLEAN),
            Map.entry("BOOL", SemanticType.BOOLEAN),
            Map.entry("DATETIME", SemanticType.TIMESTAMP),
            Map.entry("TIMESTAMP", SemanticType.TIMESTAMP),
            Map.entry("DATE", SemanticType.TIMESTAMP)
    );

    private static final Map<SemanticType, String> PHYSICAL_TYPES = new EnumMap<>(Map.of(
            SemanticType.TEXT, "TEXT",
            SemanticType.INTEGER, "INTEGER",
            SemanticType.DECIMAL, DECIMAL_TYPE,
            SemanticType.BOOLEAN, "BOOLEAN",
            SemanticType.TIMESTAMP, "DATETIME"
    ));

    private static final String SHADOW_PREFIX = Identifiers.RESERVED_PREFIX + "shadow_";

    @Override
    public DialectKind kind() {
        return DialectKind.SQLITE;
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
        return '"';
    }

    @Override
    public boolean transactionalDdl() {
        return true;
    }

    @Override
    public boolean enforcesForeignKeys() {
        return false;
    }

    @Override
    public boolean acceptsDatabase(String db, String connectionCatalog) {
        return db == null || db.isBlank() || "main".equalsIgnoreCase(db);
    }

    @Override
    public StatementPlan createTable(String table) {
        String sql = "CREATE TABLE " + quote(table) + " ("
                + quote(TableStructure.ID_COLUMN) + " INTEGER PRIMARY KEY AUTOINCREMENT, "
                + quote(TableStructure.CREATED_COLUMN) + " DATETIME NOT NULL DEFAULT CURRENT_TIMESTAMP, "
                + quote(TableStructure.UPDATED_COLUMN) + " DATETIME NOT NULL DEFAULT CURRENT_TIMESTAMP)";
        return StatementPlan.single(sql, "DROP TABLE " + quote(table));
    }

    @Override
    public StatementPlan dropTable(String table) {
        return StatementPlan.single("DROP TABLE " + quote(table));
    }

    @Override
    public StatementPlan renameTable(TableStructure table, String newName) {
        return StatementPlan.single(
                "ALTER TABLE " + quote(table.tableName()) + " RENAME TO " + quote(newName),
                "ALTER TABLE " + quote(newName) + " RENAME TO " + quote(table.tableName()));
    }

    @Override
    public StatementPlan addColumn(TableStructure table, ColumnSpec column) {
        Identifiers.validate(column.name(), "column");
        if (column.nullable() && !column.defaultToCurrentTimestamp()) {
            return StatementPlan.single("ALTER TABLE " + quote(table.tableName()) + " ADD COLUMN "
                    + quote(column.name()) + " " + physicalType(column.type()));
        }
        // ALTER TABLE cannot add NOT NULL without a default, nor a non-constant default
        List<TargetColumn> targets = table.columns().stream().map(TargetColumn::keep).collect(Collectors.toCollection(ArrayList::new));
        targets.add(new TargetColumn(column.name(), physicalType(column.type()), column.nullable(),
                column.defaultToCurrentTimestamp() ? "CURRENT_TIMESTAMP" : null, false,
                column.defaultToCurrentTimestamp() ? "CURRENT_TIMESTAMP" : "NULL"));
        return rebuild(table, targets, Function.identity());
    }

    @Override
    public StatementPlan dropColumn(TableStructure table, String column) {
        ColumnDescriptor dropped = requireColumn(table, column);
        List<TargetColumn> targets = table.columns().stream()
                .filter(c -> !c.name().equals(dropped.name()))
                .map(TargetColumn::keep)
                .toList();
        return rebuild(table, targets, name -> name.equalsIgnoreCase(dropped.name()) ? null : name);
    }

    @Override
    public StatementPlan renameColumn(TableStructure table, String column, String newName) {
        ColumnDescriptor renamed = requireColumn(table, column);
        Identifiers.validate(newName, "column");
        List<TargetColumn> targets = table.columns().stream()
                .map(c -> c.name().equals(renamed.name()) ? TargetColumn.keep(c).withName(newName) : TargetColumn.keep(c))
                .toList();
        return rebuild(table, targets, name -> name.equalsIgnoreCase(renamed.name()) ? newName : name);
    }

    @Override
    public StatementPlan changeColumnType(TableStructure table, String column, SemanticType newType) {
        ColumnDescriptor changed = requireColumn(table, column);
        String physical = physicalType(newType);
        List<TargetColumn> targets = table.columns().stream()
                .map(c -> c.name().equals(changed.name())
                        ? TargetColumn.keep(c).withType(physical, conversion(quote(c.name()), newType))
                        : TargetColumn.keep(c))
                .toList();
        return rebuild(table, targets, Function.identity());
    }

    @Override
    public StatementPlan addForeignKey(TableStructure table, ForeignKeyDeclaration foreignKey) {
        String sql = "CREATE INDEX " + quote(foreignKey.indexName()) + " ON "
                + quote(table.tableName()) + " (" + quote(foreignKey.columnName()) + ")";
        return StatementPlan.single(sql, "DROP INDEX IF EXISTS " + quote(foreignKey.indexName()));
    }

    @Override
    public StatementPlan dropForeignKey(TableStructure table, ForeignKeyDeclaration foreignKey) {
        return StatementPlan.single("DROP INDEX IF EXISTS " + quote(foreignKey.indexName()));
    }

    /**
     * Expression converting a stored value to the representation of {@code target}. Values are
     * checked for representability before the rebuild runs, so the casts never have to reject.
     */
    String conversion(String source, SemanticType target) {
        return switch (target) {
            case TEXT -> "CAST(" + source + " AS TEXT)";
            case INTEGER -> "CAST(" + source + " AS INTEGER)";
            case DECIMAL -> "trim(CAST(" + source + " AS TEXT))";
            case BOOLEAN -> "CASE WHEN " + source + " IS NULL THEN NULL"
                    + " WHEN lower(trim(CAST(" + source + " AS TEXT))) IN ('1', '1.0', 'true', 'yes', 't', 'y') THEN 1 ELSE 0 END";
            case TIMESTAMP -> "CASE WHEN " + source + " IS NULL THEN NULL"
                    + " WHEN typeof(" + source + ") IN ('integer', 'real') THEN strftime('%Y-%m-%d %H:%M:%f', " + source + ", 'unixepoch')"
                    + " ELSE strftime('%Y-%m-%d %H:%M:%f', " + source + ") END";
            default -> throw new ValidationException("type", "Unsupported column type: " + target);
        };
    }

    /**
     * Copy-and-swap. {@code indexColumn} maps an existing column name to its name after the
     * rebuild, or {@code null} when the column goes away together with its indexes.
     */
    private StatementPlan rebuild(TableStructure table, List<TargetColumn> targets, Function<String, String> indexColumn) {
        String original = table.tableName();
        String shadow = SHADOW_PREFIX + original;
        List<TargetColumn> primaryKey = targets.stream().filter(TargetColumn::primaryKey).toList();
        boolean sequenced = primaryKey.size() == 1 && "INTEGER".equalsIgnoreCase(primaryKey.get(0).type());

        List<String> definitions = new ArrayList<>();
        for (TargetColumn target : targets) {
            definitions.add(target.definition(this, primaryKey.size() == 1, sequenced));
        }
        if (primaryKey.size() > 1) {
            definitions.add("PRIMARY KEY (" + primaryKey.stream().map(t -> quote(t.name())).collect(Collectors.joining(", ")) + ")");
        }
        for (ForeignKeyDeclaration foreignKey : table.foreignKeys()) {
            if (!foreignKey.enforced()) {
                continue;
            }
            String source = indexColumn.apply(foreignKey.columnName());
            if (source == null) {
                continue;
            }
            definitions.add("FOREIGN KEY (" + quote(source) + ") REFERENCES " + quote(foreignKey.referencedTable())
                    + " (" + quote(foreignKey.referencedColumn()) + ") ON DELETE " + foreignKey.onDelete().sql()
                    + " ON UPDATE " + foreignKey.onUpdate().sql());
        }

        List<String> statements = new ArrayList<>();
        statements.add("CREATE TABLE " + rawQuote(shadow) + " (" + String.join(", ", definitions) + ")");
        statements.add("INSERT INTO " + rawQuote(shadow) + " ("
                + targets.stream().map(t -> quote(t.name())).collect(Collectors.joining(", "))
                + ") SELECT " + targets.stream().map(TargetColumn::source).collect(Collectors.joining(", "))
                + " FROM " + quote(original));
        if (sequenced) {
            // keep AUTOINCREMENT from reusing ids of rows deleted before the rebuild
            statements.add("DELETE FROM sqlite_sequence WHERE name = '" + shadow + "'");
            statements.add("INSERT INTO sqlite_sequence (name, seq) SELECT '" + shadow + "', MAX(seq) FROM sqlite_sequence"
                    + " WHERE name = " + Identifiers.literal(original) + " HAVING MAX(seq) IS NOT NULL");
        }
        statements.add("DROP TABLE " + quote(original));
        statements.add("ALTER TABLE " + rawQuote(shadow) + " RENAME TO " + quote(original));
        for (IndexDefinition index : table.indexes()) {
            List<String> columns = new ArrayList<>();
            for (String column : index.columns()) {
                String mapped = indexColumn.apply(column);
                if (mapped == null) {
                    columns = null;
                    break;
                }
                columns.add(quote(mapped));
            }
            if (columns == null || columns.isEmpty()) {
                continue;
            }
            statements.add("CREATE " + (index.unique() ? "UNIQUE " : "") + "INDEX " + rawQuote(index.name())
                    + " ON " + quote(original) + " (" + String.join(", ", columns) + ")");
        }
        return StatementPlan.sequence(statements);
    }

    private static String rawQuote(String name) {
        return '"' + name.replace("\"", "\"\"") + '"';
    }

    @Override
    public String lastInsertId() {
        return "SELECT last_insert_rowid()";
    }

    @Override
    public Object timestampParameter(Instant instant) {
        return instant == null ? null : TIMESTAMP_FORMAT.format(instant);
    }

    @Override
    public Object decimalParameter(BigDecimal value) {
        return value == null ? null : value.toPlainString();
    }

    @Override
    public String sortExpression(ColumnDescriptor column) {
        String quoted = quote(column.name());
        return DECIMAL_TYPE.equals(normalizeTypeName(column.physicalType())) ? "CAST(" + quoted + " AS REAL)" : quoted;
    }

    @Override
    public RuntimeException translate(String context, DataAccessException ex) {
        String message = sqliteMessage(ex);
        if (message != null) {
            String upper = message.toUpperCase(Locale.ROOT);
            if (upper.contains("SQLITE_CONSTRAINT_UNIQUE") || upper.contains("SQLITE_CONSTRAINT_PRIMARYKEY")
                    || upper.contains("UNIQUE CONSTRAINT FAILED")) {
                return new ConflictException(context, "Duplicate value in " + context + ": " + message, ex);
            }
            if (upper.contains("SQLITE_CONSTRAINT")) {
                return new IntegrityException(context, "Integrity violation in " + context + ": " + message, ex);
            }
            if (upper.contains("SQLITE_BUSY") || upper.contains("SQLITE_LOCKED") || upper.contains("DATABASE IS LOCKED")) {
                return new TransientException("Database busy during " + context + ": " + message, ex);
            }
        }
        return super.translate(context, ex);
    }

    private static String sqliteMessage(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof SQLException && current.getMessage() != null) {
                return current.getMessage();
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return null;
    }

    private record TargetColumn(String name, String type, boolean nullable, String defaultExpression,
                                boolean primaryKey, String source) {

        static TargetColumn keep(ColumnDescriptor column) {
            return new TargetColumn(column.name(), column.physicalType() == null ? "" : column.physicalType(),
                    column.nullable(), column.defaultValue(), column.primaryKey(), '"' + column.name() + '"');
        }

        TargetColumn withName(String newName) {
            return new TargetColumn(newName, type, nullable, defaultExpression, primaryKey, source);
        }

        TargetColumn withType(String newType, String conversion) {
            return new TargetColumn(name, newType, nullable, defaultExpression, primaryKey, conversion);
        }

        String definition(SqliteDialect dialect, boolean singlePrimaryKey, boolean sequenced) {
            StringBuilder sql = new StringBuilder(dialect.quote(name));
            if (!type.isBlank()) {
                sql.append(' ').append(type);
            }
            if (primaryKey && singlePrimaryKey) {
                sql.append(" PRIMARY KEY");
                if (sequenced) {
                    sql.append(" AUTOINCREMENT");
                }
            } else if (!nullable) {
                sql.append(" NOT NULL");
            }
            if (defaultExpression != null && !defaultExpression.isBlank()) {
                sql.append(" DEFAULT (").append(defaultExpression).append(')');
            }
            return sql.toString();
        }
    }
}
