package com.example.sickrock.service;

import com.example.sickrock.dialect.Identifiers;
import com.example.sickrock.dialect.SqlDialect;
import com.example.sickrock.exception.NotFoundException;
import com.example.sickrock.model.ColumnDescriptor;
import com.example.sickrock.model.DatabaseTableInfo;
import com.example.sickrock.model.ForeignKeyDeclaration;
import com.example.sickrock.model.IndexDefinition;
import com.example.sickrock.model.ReferentialAction;
import com.example.sickrock.model.SchemaInconsistency;
import com.example.sickrock.model.SemanticType;
import com.example.sickrock.model.TableConfiguration;
import com.example.sickrock.model.TableStructure;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Reads table shapes from the live database catalog. This is the authority on which columns
 * exist, since tables can change outside the engine; declared foreign keys from the metadata store
 * are merged in because SQLite does not hold them physically.
 */
@Service
public class SchemaIntrospector {

    private static final Set<String> METADATA_TABLES = Set.of(
            "table_configurations", "table_views", "table_view_columns", "table_foreign_keys", "schema_migrations");

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final SqlDialect dialect;
    private final MetadataStore metadataStore;
    private final SqlLogService logService;

    public SchemaIntrospector(DataSource dataSource,
                              JdbcTemplate jdbcTemplate,
                              SqlDialect dialect,
                              MetadataStore metadataStore,
                              SqlLogService logService) {
        this.dataSource = dataSource;
        this.jdbcTemplate = jdbcTemplate;
        this.dialect = dialect;
        this.metadataStore = metadataStore;
        this.logService = logService;
    }

    /**
     * Live structure of a physical table.
     *
     * @throws NotFoundException when no such table exists
     */
    public TableStructure getTableStructure(String tableName) {
        return findTableStructure(tableName).orElseThrow(() -> NotFoundException.table(tableName));
    }

    public Optional<TableStructure> findTableStructure(String tableName) {
        Identifiers.validate(tableName, "table");
        Connection conn = DataSourceUtils.getConnection(dataSource);
        try {
            DatabaseMetaData metaData = conn.getMetaData();
            String catalog = conn.getCatalog();
            Map<String, ColumnDescriptor> columns = readColumns(metaData, catalog, tableName);
            if (columns.isEmpty()) {
                return Optional.empty();
            }
            markPrimaryKey(metaData, catalog, tableName, columns);
            List<ForeignKeyDeclaration> foreignKeys = mergeForeignKeys(tableName, readImportedKeys(metaData, catalog, tableName));
            for (ForeignKeyDeclaration foreignKey : foreignKeys) {
                columns.computeIfPresent(foreignKey.columnName().toLowerCase(Locale.ROOT),
                        (key, column) -> column.withReference(foreignKey));
            }
            List<IndexDefinition> indexes = readIndexes(metaData, catalog, tableName);
            return Optional.of(new TableStructure(tableName, new ArrayList<>(columns.values()), indexes, foreignKeys));
        } catch (SQLException ex) {
            logService.logError("<metadata:describe " + tableName + ">", ex.getMessage());
            throw translate("describe " + tableName, ex);
        } finally {
            DataSourceUtils.releaseConnection(conn, dataSource);
        }
    }

    public boolean tableExists(String tableName) {
        return Identifiers.isValid(tableName) && listPhysicalTables().stream().anyMatch(t -> t.equalsIgnoreCase(tableName));
    }

    /**
     * Physical user tables, without the engine's own metadata and scratch tables.
     */
    public List<String> listPhysicalTables() {
        Connection conn = DataSourceUtils.getConnection(dataSource);
        try {
            DatabaseMetaData metaData = conn.getMetaData();
            Set<String> tableNames = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
            try (ResultSet rs = metaData.getTables(conn.getCatalog(), null, "%", new String[]{"TABLE"})) {
                while (rs.next()) {
                    String name = rs.getString("TABLE_NAME");
                    if (name != null && !isInternalTable(name)) {
                        tableNames.add(name);
                    }
                }
            }
            return new ArrayList<>(tableNames);
        } catch (SQLException ex) {
            logService.logError("<metadata:listTables>", ex.getMessage());
            throw translate("list tables", ex);
        } finally {
            DataSourceUtils.releaseConnection(conn, dataSource);
        }
    }

    public List<DatabaseTableInfo> listDatabaseTables() {
        Map<String, TableConfiguration> configured = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        metadataStore.listConfigurations().forEach(c -> configured.put(c.name(), c));
        return listPhysicalTables().stream()
                .map(table -> {
                    TableConfiguration configuration = configured.get(table);
                    return new DatabaseTableInfo(table, configuration != null,
                            configuration == null ? null : configuration.name());
                })
                .toList();
    }

    /**
     * Reports drift between configurations and physical tables. Nothing is repaired.
     */
    public List<SchemaInconsistency> checkConsistency() {
        Set<String> physical = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        physical.addAll(listPhysicalTables());
        Set<String> configured = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        List<SchemaInconsistency> findings = new ArrayList<>();
        for (TableConfiguration configuration : metadataStore.listConfigurations()) {
            configured.add(configuration.name());
            if (!physical.contains(configuration.name())) {
                findings.add(new SchemaInconsistency(SchemaInconsistency.Kind.CONFIGURATION_WITHOUT_TABLE,
                        configuration.name(), "Configuration has no physical table"));
            }
        }
        for (String table : physical) {
            if (!configured.contains(table)) {
                findings.add(new SchemaInconsistency(SchemaInconsistency.Kind.TABLE_WITHOUT_CONFIGURATION,
                        table, "Physical table has no configuration"));
            }
        }
        if (!findings.isEmpty()) {
            logService.logInfo("Schema check found " + findings.size() + " inconsistencies");
        }
        return findings;
    }

    static boolean isInternalTable(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return METADATA_TABLES.contains(lower)
                || lower.startsWith("sqlite_")
                || lower.startsWith(Identifiers.RESERVED_PREFIX);
    }

    private Map<String, ColumnDescriptor> readColumns(DatabaseMetaData metaData, String catalog, String tableName) throws SQLException {
        Map<Integer, ColumnDescriptor> byPosition = new TreeMap<>();
        try (ResultSet rs = metaData.getColumns(catalog, null, tableName, "%")) {
            while (rs.next()) {
                // the table pattern treats '_' as a wildcard
                if (!tableName.equalsIgnoreCase(rs.getString("TABLE_NAME"))) {
                    continue;
                }
                String name = rs.getString("COLUMN_NAME");
                String typeName = rs.getString("TYPE_NAME");
                int size = rs.getInt("COLUMN_SIZE");
                int digits = rs.getInt("DECIMAL_DIGITS");
                boolean nullable = rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls;
                boolean autoIncrement = "YES".equalsIgnoreCase(rs.getString("IS_AUTOINCREMENT"));
                String defaultValue = rs.getString("COLUMN_DEF");
                int position = rs.getInt("ORDINAL_POSITION");
                SemanticType type = dialect.classify(typeName, size);
                byPosition.put(position == 0 ? byPosition.size() + 1 : position, new ColumnDescriptor(name, type, type,
                        dialect.declaredType(typeName, size, digits), nullable, false, autoIncrement, defaultValue, null));
            }
        }
        Map<String, ColumnDescriptor> columns = new LinkedHashMap<>();
        byPosition.values().forEach(c -> columns.put(c.name().toLowerCase(Locale.ROOT), c));
        return columns;
    }

    private void markPrimaryKey(DatabaseMetaData metaData, String catalog, String tableName,
                                Map<String, ColumnDescriptor> columns) throws SQLException {
        try (ResultSet rs = metaData.getPrimaryKeys(catalog, null, tableName)) {
            while (rs.next()) {
                String name = rs.getString("COLUMN_NAME");
                if (name == null) {
                    continue;
                }
                columns.computeIfPresent(name.toLowerCase(Locale.ROOT), (key, c) -> new ColumnDescriptor(c.name(),
                        c.type(), c.valueType(), c.physicalType(), false, true, c.autoIncrement(), c.defaultValue(), null));
            }
        }
    }

    private List<ForeignKeyDeclaration> readImportedKeys(DatabaseMetaData metaData, String catalog, String tableName) throws SQLException {
        List<ForeignKeyDeclaration> foreignKeys = new ArrayList<>();
        try (ResultSet rs = metaData.getImportedKeys(catalog, null, tableName)) {
            while (rs.next()) {
                String column = rs.getString("FKCOLUMN_NAME");
                String refTable = rs.getString("PKTABLE_NAME");
                String refColumn = rs.getString("PKCOLUMN_NAME");
                if (column == null || refTable == null || refColumn == null) {
                    continue;
                }
                String name = rs.getString("FK_NAME");
                if (name == null || name.isBlank()) {
                    name = ForeignKeyDeclaration.defaultConstraintName(tableName, column, refTable, refColumn);
                }
                foreignKeys.add(new ForeignKeyDeclaration(null, tableName, column, refTable, refColumn, name,
                        action(rs.getInt("DELETE_RULE")), action(rs.getInt("UPDATE_RULE")), true));
            }
        }
        return foreignKeys;
    }

    /**
     * Physical constraints plus declarations; a declaration replaces the physical key on the same column.
     */
    private List<ForeignKeyDeclaration> mergeForeignKeys(String tableName, List<ForeignKeyDeclaration> physical) {
        List<ForeignKeyDeclaration> declared = metadataStore.foreignKeysFrom(tableName);
        List<ForeignKeyDeclaration> merged = new ArrayList<>(declared);
        for (ForeignKeyDeclaration foreignKey : physical) {
            boolean known = declared.stream().anyMatch(d -> d.originatesFrom(tableName, foreignKey.columnName()));
            if (!known) {
                merged.add(foreignKey);
            }
        }
        return merged;
    }

    private List<IndexDefinition> readIndexes(DatabaseMetaData metaData, String catalog, String tableName) throws SQLException {
        Map<String, List<String>> columnsByIndex = new LinkedHashMap<>();
        Map<String, Boolean> uniqueByIndex = new LinkedHashMap<>();
        try (ResultSet rs = metaData.getIndexInfo(catalog, null, tableName, false, false)) {
            while (rs.next()) {
                String name = rs.getString("INDEX_NAME");
                String column = rs.getString("COLUMN_NAME");
                if (name == null || column == null || rs.getShort("TYPE") == DatabaseMetaData.tableIndexStatistic) {
                    continue;
                }
                String lower = name.toLowerCase(Locale.ROOT);
                if ("primary".equals(lower) || lower.startsWith("sqlite_autoindex")) {
                    continue;
                }
                columnsByIndex.computeIfAbsent(name, n -> new ArrayList<>()).add(column);
                uniqueByIndex.put(name, !rs.getBoolean("NON_UNIQUE"));
            }
        }
        List<IndexDefinition> indexes = new ArrayList<>();
        columnsByIndex.forEach((name, columns) -> indexes.add(new IndexDefinition(name, columns, uniqueByIndex.get(name))));
        return indexes;
    }

    private static ReferentialAction action(int rule) {
        return switch (rule) {
            case DatabaseMetaData.importedKeyCascade -> ReferentialAction.CASCADE;
            case DatabaseMetaData.importedKeySetNull -> ReferentialAction.SET_NULL;
            case DatabaseMetaData.importedKeyRestrict -> ReferentialAction.RESTRICT;
            default -> ReferentialAction.NO_ACTION;
        };
    }

    private RuntimeException translate(String task, SQLException ex) {
        DataAccessException translated = jdbcTemplate.getExceptionTranslator().translate(task, null, ex);
        return translated == null ? new IllegalStateException("Unable to " + task, ex) : dialect.translate(task, translated);
    }
}
