package com.example.sickrock.service;

import com.example.sickrock.config.EngineProperties;
import com.example.sickrock.dialect.Identifiers;
import com.example.sickrock.dialect.SqlDialect;
import com.example.sickrock.dialect.StatementPlan;
import com.example.sickrock.exception.ConflictException;
import com.example.sickrock.exception.FatalException;
import com.example.sickrock.exception.IntegrityException;
import com.example.sickrock.exception.NotFoundException;
import com.example.sickrock.exception.ValidationException;
import com.example.sickrock.model.ColumnDescriptor;
import com.example.sickrock.model.ColumnSpec;
import com.example.sickrock.model.ForeignKeyDeclaration;
import com.example.sickrock.model.ReferentialAction;
import com.example.sickrock.model.SemanticType;
import com.example.sickrock.model.TableConfiguration;
import com.example.sickrock.model.TableStructure;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Structural changes to configured tables. Each request runs VALIDATE, PLAN, EXECUTE,
 * COMMIT or ROLLBACK and RECONCILE while holding the table's exclusive lock.
 * <p>
 * Where DDL is transactional (SQLite) the statements and the metadata reconcile share one
 * transaction, so a failure anywhere leaves table and metadata as they were. Where DDL commits on
 * its own (MySQL) every plan is a single atomic statement; the reconcile follows in its own
 * transaction and a failed reconcile runs the plan's compensation.
 */
@Service
public class SchemaMutationEngine {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SqlDialect dialect;
    private final MetadataStore metadataStore;
    private final SchemaIntrospector introspector;
    private final TableStructureCache structureCache;
    private final TableLockRegistry lockRegistry;
    private final ValueConverter converter;
    private final EngineProperties properties;
    private final SqlLogService logService;

    public SchemaMutationEngine(JdbcTemplate jdbcTemplate,
                                PlatformTransactionManager transactionManager,
                                SqlDialect dialect,
                                MetadataStore metadataStore,
                                SchemaIntrospector introspector,
                                TableStructureCache structureCache,
                                TableLockRegistry lockRegistry,
                                ValueConverter converter,
                                EngineProperties properties,
                                SqlLogService logService) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.dialect = dialect;
        this.metadataStore = metadataStore;
        this.introspector = introspector;
        this.structureCache = structureCache;
        this.lockRegistry = lockRegistry;
        this.converter = converter;
        this.properties = properties;
        this.logService = logService;
    }

    // tables

    public TableConfiguration createTable(String tableName, String title) {
        return createTable(TableConfiguration.of(tableName, title));
    }

    /**
     * Creates the physical table with {@code id}, {@code sr_created} and {@code sr_updated}
     * together with its configuration.
     */
    public TableConfiguration createTable(TableConfiguration configuration) {
        String tableName = Identifiers.validate(configuration.name(), "table");
        if (SchemaIntrospector.isInternalTable(tableName)) {
            throw new ValidationException(tableName, "Table name is reserved: " + tableName);
        }
        String catalog = jdbcTemplate.execute((ConnectionCallback<String>) Connection::getCatalog);
        if (!dialect.acceptsDatabase(configuration.db(), catalog)) {
            throw new ValidationException("db", "Tables can only be created in the connected database, not " + configuration.db());
        }
        try (TableLockRegistry.Lease ignored = lockRegistry.acquireExclusive(tableName);
             TableStructureCache.Invalidation stale = structureCache.invalidateOnClose(tableName)) {
            if (metadataStore.findConfiguration(tableName).isPresent() || introspector.tableExists(tableName)) {
                throw new ConflictException(tableName, "Table already exists: " + tableName);
            }
            AtomicReference<TableConfiguration> created = new AtomicReference<>();
            execute("create table", tableName, dialect.createTable(tableName),
                    () -> created.set(metadataStore.createConfiguration(configuration)));
            return created.get();
        }
    }

    /**
     * Removes a table configuration. Whether the physical table is dropped as well is decided by
     * {@code sickrock.engine.table-deletion-policy}.
     */
    public void deleteTable(String tableName) {
        Identifiers.validate(tableName, "table");
        requireConfiguredName(tableName);
        try (TableLockRegistry.Lease ignored = lockRegistry.acquireExclusive(tableName);
             TableStructureCache.Invalidation stale = structureCache.invalidateOnClose(tableName)) {
            metadataStore.getConfiguration(tableName);
            if (properties.tableDeletionPolicy() == EngineProperties.TableDeletionPolicy.RETAIN
                    || !introspector.tableExists(tableName)) {
                metadataStore.deleteConfiguration(tableName);
                logService.logInfo("Deleted configuration of " + tableName + ", physical table retained");
                return;
            }
            List<ForeignKeyDeclaration> incoming = metadataStore.foreignKeysTo(tableName).stream()
                    .filter(fk -> !fk.tableName().equals(tableName))
                    .toList();
            if (!incoming.isEmpty()) {
                ForeignKeyDeclaration first = incoming.get(0);
                throw new IntegrityException(tableName, "Table " + tableName + " is referenced by "
                        + first.tableName() + "." + first.columnName() + "; drop that foreign key first");
            }
            execute("drop table", tableName, dialect.dropTable(tableName),
                    () -> metadataStore.deleteConfiguration(tableName));
        }
    }

    public TableConfiguration renameTable(String tableName, String newName) {
        Identifiers.validate(tableName, "table");
        Identifiers.validate(newName, "table");
        if (SchemaIntrospector.isInternalTable(newName)) {
            throw new ValidationException(newName, "Table name is reserved: " + newName);
        }
        requireConfiguredName(tableName);
        try (TableLockRegistry.Lease ignored = lockRegistry.acquireExclusive(tableName, newName);
             TableStructureCache.Invalidation stale = structureCache.invalidateOnClose(tableName, newName)) {
            metadataStore.getConfiguration(tableName);
            TableStructure structure = requireStructure(tableName);
            if (metadataStore.findConfiguration(newName).isPresent() || introspector.tableExists(newName)) {
                throw new ConflictException(newName, "Table already exists: " + newName);
            }
            execute("rename table", tableName, dialect.renameTable(structure, newName),
                    () -> metadataStore.renameTableReferences(tableName, newName));
            return metadataStore.getConfiguration(newName);
        }
    }

    // columns

    /**
     * Adds a column. Existing views are left alone; the column shows up in them only as an
     * unlisted column.
     */
    public TableStructure addColumn(String tableName, ColumnSpec column) {
        Identifiers.validate(column.name(), "column");
        requireConfiguredName(tableName);
        try (TableLockRegistry.Lease ignored = lockRegistry.acquireExclusive(tableName);
             TableStructureCache.Invalidation stale = structureCache.invalidateOnClose(tableName)) {
            TableStructure structure = requireConfiguredStructure(tableName);
            if (structure.hasColumn(column.name())) {
                throw new ValidationException(column.name(), "Column " + column.name() + " already exists in " + tableName);
            }
            if (!column.nullable() && !column.defaultToCurrentTimestamp() && rowCount(tableName) > 0) {
                throw new ValidationException(column.name(), "A NOT NULL column without default can only be added to an empty table");
            }
            dialect.physicalType(column.type());
            execute("add column", tableName, dialect.addColumn(structure, column), () -> {
            });
            return introspector.getTableStructure(tableName);
        }
    }

    /**
     * Drops a column. Refused for the primary key and for columns that take part in a foreign key;
     * such a key has to be dropped first.
     */
    public TableStructure dropColumn(String tableName, String columnName) {
        requireConfiguredName(tableName);
        try (TableLockRegistry.Lease ignored = lockRegistry.acquireExclusive(tableName);
             TableStructureCache.Invalidation stale = structureCache.invalidateOnClose(tableName)) {
            TableStructure structure = requireConfiguredStructure(tableName);
            ColumnDescriptor column = requireMutableColumn(structure, columnName, "dropped");
            requireNoForeignKeys(structure, column);
            execute("drop column", tableName, dialect.dropColumn(structure, column.name()),
                    () -> metadataStore.removeColumnReferences(tableName, column.name()));
            return introspector.getTableStructure(tableName);
        }
    }

    /**
     * Renames a column and repoints view entries and foreign key declarations in the same unit of work.
     */
    public TableStructure renameColumn(String tableName, String columnName, String newName) {
        Identifiers.validate(newName, "column");
        requireConfiguredName(tableName);
        try (TableLockRegistry.Lease ignored = lockRegistry.acquireExclusive(tableName);
             TableStructureCache.Invalidation stale = structureCache.invalidateOnClose(tableName)) {
            TableStructure structure = requireConfiguredStructure(tableName);
            ColumnDescriptor column = requireMutableColumn(structure, columnName, "renamed");
            if (structure.hasColumn(newName)) {
                throw new ValidationException(newName, "Column " + newName + " already exists in " + tableName);
            }
            execute("rename column", tableName, dialect.renameColumn(structure, column.name(), newName),
                    () -> metadataStore.renameColumnReferences(tableName, column.name(), newName));
            return introspector.getTableStructure(tableName);
        }
    }

    /**
     * Converts a column to another type. Every stored value is checked first and the request fails
     * closed, without touching the table, if any value would be lost or changed.
     */
    public TableStructure changeColumnType(String tableName, String columnName, SemanticType newType) {
        if (newType == null || !newType.isStorable()) {
            throw new ValidationException(columnName, "Unsupported target type: " + newType);
        }
        requireConfiguredName(tableName);
        try (TableLockRegistry.Lease ignored = lockRegistry.acquireExclusive(tableName);
             TableStructureCache.Invalidation stale = structureCache.invalidateOnClose(tableName)) {
            TableStructure structure = requireConfiguredStructure(tableName);
            ColumnDescriptor column = requireMutableColumn(structure, columnName, "converted");
            requireNoForeignKeys(structure, column);
            if (column.valueType() == newType) {
                logService.logInfo("Column " + tableName + "." + column.name() + " already has type " + newType);
                return structure;
            }
            requireRepresentable(tableName, column, newType);
            execute("change column type", tableName, dialect.changeColumnType(structure, column.name(), newType), () -> {
            });
            return introspector.getTableStructure(tableName);
        }
    }

    // foreign keys

    public ForeignKeyDeclaration createForeignKey(String tableName, String columnName, String referencedTable,
                                                  String referencedColumn) {
        return createForeignKey(tableName, columnName, referencedTable, referencedColumn,
                ReferentialAction.NO_ACTION, ReferentialAction.NO_ACTION);
    }

    /**
     * Declares a foreign key. The target table and column must exist and no current value may be
     * orphaned. Enforced physically where the database supports it, checked by the CRUD engine otherwise.
     */
    public ForeignKeyDeclaration createForeignKey(String tableName, String columnName, String referencedTable,
                                                  String referencedColumn, ReferentialAction onDelete,
                                                  ReferentialAction onUpdate) {
        Identifiers.validate(referencedTable, "table");
        Identifiers.validate(referencedColumn, "column");
        requireConfiguredName(tableName);
        try (TableLockRegistry.Lease ignored = lockRegistry.acquireExclusive(tableName, referencedTable);
             TableStructureCache.Invalidation stale = structureCache.invalidateOnClose(tableName)) {
            TableStructure structure = requireConfiguredStructure(tableName);
            ColumnDescriptor column = structure.column(columnName)
                    .orElseThrow(() -> new ValidationException(columnName, "Unknown column " + columnName + " in " + tableName));
            TableStructure target = introspector.findTableStructure(referencedTable)
                    .orElseThrow(() -> new IntegrityException(referencedTable, "Referenced table does not exist: " + referencedTable));
            ColumnDescriptor targetColumn = target.column(referencedColumn)
                    .orElseThrow(() -> new IntegrityException(referencedColumn, "Referenced column does not exist: "
                            + referencedTable + "." + referencedColumn));
            if (structure.foreignKeys().stream().anyMatch(fk -> fk.originatesFrom(tableName, column.name()))) {
                throw new ConflictException(column.name(), "Column " + tableName + "." + column.name() + " already has a foreign key");
            }
            if (column.valueType() != targetColumn.valueType()) {
                throw new ValidationException(column.name(), "Column " + column.name() + " (" + column.valueType()
                        + ") cannot reference " + referencedTable + "." + targetColumn.name() + " (" + targetColumn.valueType() + ")");
            }
            long orphans = orphanCount(tableName, column.name(), target.tableName(), targetColumn.name());
            if (orphans > 0) {
                throw new IntegrityException(column.name(), orphans + " value(s) of " + tableName + "." + column.name()
                        + " have no match in " + referencedTable + "." + targetColumn.name());
            }
            ForeignKeyDeclaration declaration = new ForeignKeyDeclaration(null, tableName, column.name(),
                    target.tableName(), targetColumn.name(),
                    ForeignKeyDeclaration.defaultConstraintName(tableName, column.name(), target.tableName(), targetColumn.name()),
                    onDelete, onUpdate, dialect.enforcesForeignKeys());
            AtomicReference<ForeignKeyDeclaration> saved = new AtomicReference<>();
            execute("create foreign key", tableName, dialect.addForeignKey(structure, declaration),
                    () -> saved.set(metadataStore.saveForeignKey(declaration)));
            return saved.get();
        }
    }

    public void dropForeignKey(String tableName, String columnName) {
        requireConfiguredName(tableName);
        try (TableLockRegistry.Lease ignored = lockRegistry.acquireExclusive(tableName);
             TableStructureCache.Invalidation stale = structureCache.invalidateOnClose(tableName)) {
            TableStructure structure = requireConfiguredStructure(tableName);
            ForeignKeyDeclaration foreignKey = structure.foreignKeys().stream()
                    .filter(fk -> fk.originatesFrom(tableName, columnName))
                    .findFirst()
                    .orElseThrow(() -> new NotFoundException("No foreign key on " + tableName + "." + columnName));
            execute("drop foreign key", tableName, dialect.dropForeignKey(structure, foreignKey), () -> {
                if (foreignKey.id() != null) {
                    metadataStore.deleteForeignKey(foreignKey.id());
                }
            });
        }
    }

    // execution

    private void execute(String operation, String tableName, StatementPlan plan, Runnable reconcile) {
        String label = "[" + operation + " " + tableName + "] ";
        logService.logInfo(label + "VALIDATE ok");
        logService.logInfo(label + "PLAN " + plan.statements().size() + " statement(s)");
        if (dialect.transactionalDdl()) {
            try {
                transactionTemplate.executeWithoutResult(status -> {
                    long before = plan.atomic() ? -1 : rowCount(tableName);
                    logService.logInfo(label + "EXECUTE");
                    plan.statements().forEach(sql -> runStatement(sql, tableName));
                    if (before >= 0) {
                        long after = rowCount(tableName);
                        if (after != before) {
                            throw new FatalException(tableName, "Rebuild of " + tableName + " copied " + after
                                    + " of " + before + " rows");
                        }
                    }
                    logService.logInfo(label + "RECONCILE");
                    reconcile.run();
                });
            } catch (RuntimeException ex) {
                logService.logError(label + "ROLLBACK", ex.getMessage());
                throw ex;
            }
            logService.logInfo(label + "COMMIT");
            return;
        }

        if (!plan.atomic()) {
            throw new IllegalStateException("Plan for " + operation + " is not atomic and DDL is not transactional");
        }
        logService.logInfo(label + "EXECUTE");
        try {
            plan.statements().forEach(sql -> runStatement(sql, tableName));
        } catch (RuntimeException ex) {
            logService.logError(label + "ROLLBACK", ex.getMessage());
            throw ex;
        }
        logService.logInfo(label + "COMMIT");
        logService.logInfo(label + "RECONCILE");
        try {
            transactionTemplate.executeWithoutResult(status -> reconcile.run());
        } catch (RuntimeException ex) {
            if (plan.compensation().isEmpty()) {
                logService.logError(label + "RECONCILE", ex.getMessage());
                throw new FatalException(tableName, "Schema change on " + tableName
                        + " was applied but its metadata could not be updated", ex);
            }
            logService.logError(label + "ROLLBACK by compensation", ex.getMessage());
            try {
                plan.compensation().forEach(sql -> runStatement(sql, tableName));
            } catch (RuntimeException compensationFailure) {
                ex.addSuppressed(compensationFailure);
                throw new FatalException(tableName, "Schema change on " + tableName
                        + " could neither be reconciled nor undone", ex);
            }
            throw ex;
        }
    }

    private void runStatement(String sql, String tableName) {
        logService.logOperation(sql);
        try {
            jdbcTemplate.execute(sql);
        } catch (DataAccessException ex) {
            logService.logError(sql, ex.getMessage());
            throw dialect.translate(tableName, ex);
        }
    }

    // validation helpers

    /**
     * Name and configuration check made before locking, so requests for unknown tables never
     * register a lock.
     */
    private void requireConfiguredName(String tableName) {
        Identifiers.validate(tableName, "table");
        metadataStore.getConfiguration(tableName);
    }

    private TableStructure requireConfiguredStructure(String tableName) {
        Identifiers.validate(tableName, "table");
        metadataStore.getConfiguration(tableName);
        return requireStructure(tableName);
    }

    private TableStructure requireStructure(String tableName) {
        return introspector.findTableStructure(tableName)
                .orElseThrow(() -> new FatalException(tableName, "Table " + tableName
                        + " is configured but does not exist in the database"));
    }

    private ColumnDescriptor requireMutableColumn(TableStructure structure, String columnName, String verb) {
        ColumnDescriptor column = structure.column(columnName)
                .orElseThrow(() -> new ValidationException(columnName, "Unknown column " + columnName
                        + " in table " + structure.tableName()));
        if (column.primaryKey()) {
            throw new ValidationException(column.name(), "Primary key column " + column.name() + " cannot be " + verb);
        }
        String lower = column.name().toLowerCase(Locale.ROOT);
        if (lower.equals(TableStructure.CREATED_COLUMN) || lower.equals(TableStructure.UPDATED_COLUMN)) {
            throw new ValidationException(column.name(), "System column " + column.name() + " cannot be " + verb);
        }
        return column;
    }

    private void requireNoForeignKeys(TableStructure structure, ColumnDescriptor column) {
        String tableName = structure.tableName();
        if (column.isForeignKey()) {
            throw new IntegrityException(column.name(), "Column " + tableName + "." + column.name()
                    + " has a foreign key to " + column.references().referencedTable() + "; drop it first");
        }
        metadataStore.foreignKeysTo(tableName).stream()
                .filter(fk -> fk.references(tableName, column.name()))
                .findFirst()
                .ifPresent(fk -> {
                    throw new IntegrityException(column.name(), "Column " + tableName + "." + column.name()
                            + " is referenced by " + fk.tableName() + "." + fk.columnName() + "; drop that foreign key first");
                });
    }

    private void requireRepresentable(String tableName, ColumnDescriptor column, SemanticType newType) {
        String sql = "SELECT " + dialect.quote(column.name()) + " FROM " + dialect.quote(tableName)
                + " WHERE " + dialect.quote(column.name()) + " IS NOT NULL";
        logService.logOperation(sql);
        List<Object> values;
        try {
            values = jdbcTemplate.queryForList(sql, Object.class);
        } catch (DataAccessException ex) {
            logService.logError(sql, ex.getMessage());
            throw dialect.translate(tableName, ex);
        }
        List<Object> rejected = values.stream().filter(v -> !converter.isRepresentable(v, newType)).toList();
        if (!rejected.isEmpty()) {
            throw new ValidationException(column.name(), rejected.size() + " value(s) of " + tableName + "." + column.name()
                    + " cannot be converted to " + newType + ", e.g. '" + rejected.get(0) + "'");
        }
    }

    private long rowCount(String tableName) {
        String sql = dialect.count(tableName, List.of());
        try {
            Long count = jdbcTemplate.queryForObject(sql, Long.class);
            return count == null ? 0 : count;
        } catch (DataAccessException ex) {
            logService.logError(sql, ex.getMessage());
            throw dialect.translate(tableName, ex);
        }
    }

    private long orphanCount(String tableName, String columnName, String referencedTable, String referencedColumn) {
        String sql = "SELECT COUNT(*) FROM " + dialect.quote(tableName) + " WHERE " + dialect.quote(columnName)
                + " IS NOT NULL AND " + dialect.quote(columnName) + " NOT IN (SELECT " + dialect.quote(referencedColumn)
                + " FROM " + dialect.quote(referencedTable) + " WHERE " + dialect.quote(referencedColumn) + " IS NOT NULL)";
        logService.logOperation(sql);
        try {
            Long count = jdbcTemplate.queryForObject(sql, Long.class);
            return count == null ? 0 : count;
        } catch (DataAccessException ex) {
            logService.logError(sql, ex.getMessage());
            throw dialect.translate(tableName, ex);
        }
    }
}
