package com.example.sickrock.service;

import com.example.sickrock.config.EngineProperties;
import com.example.sickrock.dialect.Identifiers;
import com.example.sickrock.dialect.SqlDialect;
import com.example.sickrock.exception.FatalException;
import com.example.sickrock.exception.IntegrityException;
import com.example.sickrock.exception.NotFoundException;
import com.example.sickrock.exception.ValidationException;
import com.example.sickrock.model.ColumnDescriptor;
import com.example.sickrock.model.ColumnSort;
import com.example.sickrock.model.DataFilter;
import com.example.sickrock.model.FieldValue;
import com.example.sickrock.model.ForeignKeyDeclaration;
import com.example.sickrock.model.Item;
import com.example.sickrock.model.ItemQuery;
import com.example.sickrock.model.Page;
import com.example.sickrock.model.ReferentialAction;
import com.example.sickrock.model.SortDirective;
import com.example.sickrock.model.TableStructure;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Type-erased CRUD over configured tables. Table and column names are checked against the
 * configuration and the live structure before they reach SQL; every value is bound as a parameter.
 */
@Service
public class ItemService {

    private final NamedParameterJdbcTemplate namedTemplate;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SqlDialect dialect;
    private final MetadataStore metadataStore;
    private final SchemaIntrospector introspector;
    private final TableStructureCache structureCache;
    private final TableLockRegistry lockRegistry;
    private final ValueConverter converter;
    private final EngineProperties properties;
    private final Clock clock;
    private final SqlLogService logService;

    public ItemService(NamedParameterJdbcTemplate namedTemplate,
                       JdbcTemplate jdbcTemplate,
                       PlatformTransactionManager transactionManager,
                       SqlDialect dialect,
                       MetadataStore metadataStore,
                       SchemaIntrospector introspector,
                       TableStructureCache structureCache,
                       TableLockRegistry lockRegistry,
                       ValueConverter converter,
                       EngineProperties properties,
                       Clock clock,
                       SqlLogService logService) {
        this.namedTemplate = namedTemplate;
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.dialect = dialect;
        this.metadataStore = metadataStore;
        this.introspector = introspector;
        this.structureCache = structureCache;
        this.lockRegistry = lockRegistry;
        this.converter = converter;
        this.properties = properties;
        this.clock = clock;
        this.logService = logService;
    }

    public List<Item> list(String tableName, ItemQuery query) {
        ItemQuery effective = query == null ? ItemQuery.all() : query;
        requireConfigured(tableName);
        try (TableLockRegistry.Lease ignored = lockRegistry.acquireShared(tableName)) {
            TableStructure structure = resolve(tableName);
            MapSqlParameterSource params = new MapSqlParameterSource();
            List<String> predicates = predicates(structure, effective.filters(), params);
            Page page = effectivePage(effective.page());
            params.addValue("limit", page.limit());
            params.addValue("offset", page.offset());
            String sql = dialect.select(structure.tableName(), structure.columnNames(), predicates,
                    orderBy(structure, effective.sort()));
            Instant now = clock.instant();
            return query(sql, params, itemMapper(structure), tableName).stream()
                    .map(item -> computeSyntheticFields(item, now))
                    .toList();
        }
    }

    public long count(String tableName, List<DataFilter> filters) {
        requireConfigured(tableName);
        try (TableLockRegistry.Lease ignored = lockRegistry.acquireShared(tableName)) {
            TableStructure structure = resolve(tableName);
            MapSqlParameterSource params = new MapSqlParameterSource();
            String sql = dialect.count(structure.tableName(), predicates(structure, filters, params));
            logService.logOperation(sql + (params.getValues().isEmpty() ? "" : " :: " + params.getValues()));
            try {
                Long count = namedTemplate.queryForObject(sql, params, Long.class);
                return count == null ? 0 : count;
            } catch (DataAccessException ex) {
                logService.logError(sql, ex.getMessage());
                throw dialect.translate(tableName, ex);
            }
        }
    }

    public Item get(String tableName, long id) {
        requireConfigured(tableName);
        try (TableLockRegistry.Lease ignored = lockRegistry.acquireShared(tableName)) {
            TableStructure structure = resolve(tableName);
            return computeSyntheticFields(fetch(structure, id), clock.instant());
        }
    }

    /**
     * Inserts a row. Unknown columns are rejected, required columns must be present, and the
     * timestamp columns are set by the engine.
     */
    public Item create(String tableName, Map<String, ?> values) {
        Map<String, ?> input = values == null ? Map.of() : values;
        requireConfigured(tableName);
        try (TableLockRegistry.Lease ignored = lockRegistry.acquireShared(tableName)) {
            TableStructure structure = resolve(tableName);
            Map<String, FieldValue> fields = convertInput(structure, input, false);
            for (ColumnDescriptor column : structure.columns()) {
                if (isSystemColumn(column.name()) || column.primaryKey() || column.nullable() || column.hasDefault()) {
                    continue;
                }
                FieldValue value = fields.get(column.name());
                if (value == null || value.isNull()) {
                    throw new ValidationException(column.name(), "Column " + column.name() + " is required");
                }
            }
            checkReferences(structure, fields);

            Instant now = clock.instant();
            MapSqlParameterSource params = new MapSqlParameterSource();
            List<String> columns = new ArrayList<>();
            fields.forEach((column, value) -> {
                columns.add(column);
                params.addValue(dialect.parameterName(column), converter.toParameter(value));
            });
            for (String system : List.of(TableStructure.CREATED_COLUMN, TableStructure.UPDATED_COLUMN)) {
                structure.column(system).ifPresent(column -> {
                    columns.add(column.name());
                    params.addValue(dialect.parameterName(column.name()), dialect.timestampParameter(now));
                });
            }
            if (columns.isEmpty()) {
                throw new ValidationException("values", "No values given for table " + tableName);
            }
            String sql = dialect.insert(structure.tableName(), columns);
            Item created = transactionTemplate.execute(status -> {
                update(sql, params, tableName);
                Long id = jdbcTemplate.queryForObject(dialect.lastInsertId(), Long.class);
                if (id == null) {
                    throw new IllegalStateException("Database did not report a generated id for " + tableName);
                }
                return fetch(structure, id);
            });
            return computeSyntheticFields(created, clock.instant());
        }
    }

    /**
     * Partial update: only the named columns change. {@code sr_updated} is always set to the
     * current time, whatever the caller passed for it.
     */
    public Item update(String tableName, long id, Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            throw new ValidationException("values", "At least one column must be updated");
        }
        requireConfigured(tableName);
        try (TableLockRegistry.Lease ignored = lockRegistry.acquireShared(tableName)) {
            TableStructure structure = resolve(tableName);
            Map<String, FieldValue> fields = convertInput(structure, values, true);
            for (Map.Entry<String, FieldValue> entry : fields.entrySet()) {
                ColumnDescriptor column = structure.column(entry.getKey()).orElseThrow();
                if (!column.nullable() && entry.getValue().isNull()) {
                    throw new ValidationException(column.name(), "Column " + column.name() + " cannot be null");
                }
            }
            checkReferences(structure, fields);

            MapSqlParameterSource params = new MapSqlParameterSource("id", id);
            List<String> columns = new ArrayList<>();
            fields.forEach((column, value) -> {
                columns.add(column);
                params.addValue(dialect.parameterName(column), converter.toParameter(value));
            });
            structure.column(TableStructure.UPDATED_COLUMN).ifPresent(column -> {
                columns.add(column.name());
                params.addValue(dialect.parameterName(column.name()), dialect.timestampParameter(clock.instant()));
            });
            String sql = dialect.update(structure.tableName(), columns);
            Item updated = transactionTemplate.execute(status -> {
                if (update(sql, params, tableName) == 0) {
                    throw NotFoundException.item(tableName, id);
                }
                return fetch(structure, id);
            });
            return computeSyntheticFields(updated, clock.instant());
        }
    }

    /**
     * Deletes a row. Advisory foreign keys pointing at the table are honoured here: restricting
     * references refuse the delete, cascading ones delete the referencing rows and SET NULL ones
     * clear them. Only direct references are followed.
     */
    public void delete(String tableName, long id) {
        requireConfigured(tableName);
        List<ForeignKeyDeclaration> incoming = metadataStore.foreignKeysTo(tableName).stream()
                .filter(fk -> !fk.enforced())
                .toList();
        Set<String> tables = new LinkedHashSet<>();
        tables.add(tableName);
        incoming.forEach(fk -> tables.add(fk.tableName()));
        try (TableLockRegistry.Lease ignored = lockRegistry.acquireShared(tables)) {
            TableStructure structure = resolve(tableName);
            transactionTemplate.executeWithoutResult(status -> {
                Item existing = fetch(structure, id);
                for (ForeignKeyDeclaration foreignKey : incoming) {
                    applyDeleteAction(foreignKey, referencedValue(structure, existing, foreignKey));
                }
                String sql = dialect.deleteById(structure.tableName());
                if (update(sql, new MapSqlParameterSource("id", id), tableName) == 0) {
                    throw NotFoundException.item(tableName, id);
                }
            });
            logService.logInfo("Deleted item " + id + " from " + tableName);
        }
    }

    /**
     * Adds {@code createdRelative} and {@code updatedRelative}: whole seconds elapsed between the
     * stored timestamps and {@code now}. Never persisted.
     */
    public Item computeSyntheticFields(Item item, Instant now) {
        Map<String, Long> synthetic = new LinkedHashMap<>();
        if (item.created() != null) {
            synthetic.put(Item.CREATED_RELATIVE, elapsedSeconds(item.created(), now));
        }
        if (item.updated() != null) {
            synthetic.put(Item.UPDATED_RELATIVE, elapsedSeconds(item.updated(), now));
        }
        return item.withSynthetic(synthetic);
    }

    private static long elapsedSeconds(Instant from, Instant now) {
        return Math.max(0, Duration.between(from, now).getSeconds());
    }

    /**
     * Allow-list check made before any lock is taken, so unknown names never reach the lock registry.
     */
    private void requireConfigured(String tableName) {
        Identifiers.validate(tableName, "table");
        metadataStore.findConfiguration(tableName).orElseThrow(() -> NotFoundException.table(tableName));
    }

    /**
     * Under the lock: the table must still be configured and physically present with an id column.
     */
    private TableStructure resolve(String tableName) {
        requireConfigured(tableName);
        TableStructure structure = structureCache.get(tableName,
                name -> introspector.findTableStructure(name).orElse(null));
        if (structure == null) {
            logService.logError("<resolve " + tableName + ">", "configured table has no physical table");
            throw new FatalException(tableName, "Table " + tableName + " is configured but does not exist in the database");
        }
        if (!structure.hasColumn(TableStructure.ID_COLUMN)) {
            throw new FatalException(tableName, "Table " + tableName + " has no " + TableStructure.ID_COLUMN + " column");
        }
        return structure;
    }

    private Map<String, FieldValue> convertInput(TableStructure structure, Map<String, ?> values, boolean updating) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String name = entry.getKey();
            ColumnDescriptor column = structure.column(name)
                    .orElseThrow(() -> new ValidationException(name, "Unknown column " + name + " in table " + structure.tableName()));
            if (column.name().equalsIgnoreCase(TableStructure.UPDATED_COLUMN)) {
                continue;
            }
            if (column.name().equalsIgnoreCase(TableStructure.ID_COLUMN) || column.primaryKey()
                    || (column.name().equalsIgnoreCase(TableStructure.CREATED_COLUMN) && updating)) {
                throw new ValidationException(column.name(), "Column " + column.name() + " is read-only");
            }
            if (column.name().equalsIgnoreCase(TableStructure.CREATED_COLUMN)) {
                continue;
            }
            fields.put(column.name(), converter.toFieldValue(column, entry.getValue()));
        }
        return fields;
    }

    private List<String> predicates(TableStructure structure, List<DataFilter> filters, MapSqlParameterSource params) {
        List<String> predicates = new ArrayList<>();
        if (filters == null) {
            return predicates;
        }
        for (int i = 0; i < filters.size(); i++) {
            DataFilter filter = filters.get(i);
            ColumnDescriptor column = structure.column(filter.column())
                    .orElseThrow(() -> new ValidationException(filter.column(),
                            "Unknown filter column " + filter.column() + " in table " + structure.tableName()));
            String quoted = dialect.quote(column.name());
            String paramName = "f" + i;
            if (filter.value() == null) {
                predicates.add(quoted + " IS NULL");
            } else if (filter.isPattern()) {
                params.addValue(paramName, String.valueOf(filter.value()));
                predicates.add(quoted + " LIKE :" + paramName);
            } else {
                params.addValue(paramName, converter.toParameter(converter.toFieldValue(column, filter.value())));
                predicates.add(quoted + " = :" + paramName);
            }
        }
        return predicates;
    }

    private List<String> orderBy(TableStructure structure, List<ColumnSort> sort) {
        List<String> orderBy = new ArrayList<>();
        boolean idIncluded = false;
        for (ColumnSort columnSort : sort) {
            ColumnDescriptor column = structure.column(columnSort.column())
                    .orElseThrow(() -> new ValidationException(columnSort.column(),
                            "Unknown sort column " + columnSort.column() + " in table " + structure.tableName()));
            orderBy.add(dialect.sortExpression(column) + " " + columnSort.direction().name());
            idIncluded |= column.name().equalsIgnoreCase(TableStructure.ID_COLUMN);
        }
        if (orderBy.isEmpty() && structure.hasCreatedColumn()) {
            orderBy.add(dialect.quote(TableStructure.CREATED_COLUMN) + " " + SortDirective.DESC.name());
        }
        if (!idIncluded) {
            orderBy.add(dialect.quote(TableStructure.ID_COLUMN) + " " + SortDirective.DESC.name());
        }
        return orderBy;
    }

    private Page effectivePage(Page requested) {
        if (requested == null) {
            return Page.first(properties.defaultPageSize());
        }
        if (requested.limit() > properties.maxPageSize()) {
            return new Page(properties.maxPageSize(), requested.offset());
        }
        return requested;
    }

    /**
     * Referenced value must exist for every advisory foreign key among the written columns.
     */
    private void checkReferences(TableStructure structure, Map<String, FieldValue> fields) {
        for (ForeignKeyDeclaration foreignKey : structure.foreignKeys()) {
            if (foreignKey.enforced()) {
                continue;
            }
            FieldValue value = fields.entrySet().stream()
                    .filter(e -> e.getKey().equalsIgnoreCase(foreignKey.columnName()))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse(null);
            if (value == null || value.isNull()) {
                continue;
            }
            String sql = dialect.count(foreignKey.referencedTable(),
                    List.of(dialect.quote(foreignKey.referencedColumn()) + " = :ref"));
            MapSqlParameterSource params = new MapSqlParameterSource("ref", converter.toParameter(value));
            Long matches = queryForLong(sql, params, structure.tableName());
            if (matches == null || matches == 0) {
                throw new IntegrityException(foreignKey.columnName(), "No row in " + foreignKey.referencedTable()
                        + " has " + foreignKey.referencedColumn() + " = " + value);
            }
        }
    }

    private Object referencedValue(TableStructure structure, Item existing, ForeignKeyDeclaration foreignKey) {
        if (foreignKey.referencedColumn().equalsIgnoreCase(TableStructure.ID_COLUMN)) {
            return existing.id();
        }
        ColumnDescriptor column = structure.column(foreignKey.referencedColumn()).orElse(null);
        FieldValue value = column == null ? null : existing.fields().get(column.name());
        return value == null ? null : converter.toParameter(value);
    }

    private void applyDeleteAction(ForeignKeyDeclaration foreignKey, Object referencedValue) {
        if (referencedValue == null) {
            return;
        }
        String source = foreignKey.tableName();
        String predicate = dialect.quote(foreignKey.columnName()) + " = :ref";
        MapSqlParameterSource params = new MapSqlParameterSource("ref", referencedValue);
        ReferentialAction action = foreignKey.onDelete();
        switch (action) {
            case CASCADE -> update("DELETE FROM " + dialect.quote(source) + " WHERE " + predicate, params, source);
            case SET_NULL -> update("UPDATE " + dialect.quote(source) + " SET " + dialect.quote(foreignKey.columnName())
                    + " = NULL WHERE " + predicate, params, source);
            default -> {
                Long references = queryForLong(dialect.count(source, List.of(predicate)), params, source);
                if (references != null && references > 0) {
                    throw new IntegrityException(foreignKey.columnName(), references + " row(s) in " + source
                            + " still reference this item through " + foreignKey.columnName());
                }
            }
        }
    }

    private Item fetch(TableStructure structure, long id) {
        String sql = dialect.selectById(structure.tableName(), structure.columnNames());
        List<Item> items = query(sql, new MapSqlParameterSource("id", id), itemMapper(structure), structure.tableName());
        if (items.isEmpty()) {
            throw NotFoundException.item(structure.tableName(), id);
        }
        return items.get(0);
    }

    private RowMapper<Item> itemMapper(TableStructure structure) {
        List<ColumnDescriptor> columns = structure.columns();
        return (rs, rowNum) -> {
            long id = 0;
            Instant created = null;
            Instant updated = null;
            Map<String, FieldValue> fields = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                ColumnDescriptor column = columns.get(i);
                Object raw = rs.getObject(i + 1);
                if (column.name().equalsIgnoreCase(TableStructure.ID_COLUMN)) {
                    id = raw instanceof Number number ? number.longValue() : Long.parseLong(String.valueOf(raw));
                } else if (column.name().equalsIgnoreCase(TableStructure.CREATED_COLUMN)) {
                    created = converter.readTimestamp(raw);
                } else if (column.name().equalsIgnoreCase(TableStructure.UPDATED_COLUMN)) {
                    updated = converter.readTimestamp(raw);
                } else {
                    fields.put(column.name(), converter.read(column, raw));
                }
            }
            return new Item(id, created, updated, fields);
        };
    }

    private static boolean isSystemColumn(String name) {
        return name.equalsIgnoreCase(TableStructure.ID_COLUMN)
                || name.equalsIgnoreCase(TableStructure.CREATED_COLUMN)
                || name.equalsIgnoreCase(TableStructure.UPDATED_COLUMN);
    }

    private <T> List<T> query(String sql, MapSqlParameterSource params, RowMapper<T> mapper, String context) {
        logService.logOperation(sql + (params.getValues().isEmpty() ? "" : " :: " + params.getValues()));
        try {
            return namedTemplate.query(sql, params, mapper);
        } catch (DataAccessException ex) {
            logService.logError(sql, ex.getMessage());
            throw dialect.translate(context, ex);
        }
    }

    private Long queryForLong(String sql, MapSqlParameterSource params, String context) {
        logService.logOperation(sql + " :: " + params.getValues());
        try {
            return namedTemplate.queryForObject(sql, params, Long.class);
        } catch (DataAccessException ex) {
            logService.logError(sql, ex.getMessage());
            throw dialect.translate(context, ex);
        }
    }

    private int update(String sql, MapSqlParameterSource params, String context) {
        logService.logOperation(sql + (params.getValues().isEmpty() ? "" : " :: " + params.getValues()));
        try {
            return namedTemplate.update(sql, params);
        } catch (DataAccessException ex) {
            logService.logError(sql, ex.getMessage());
            throw dialect.translate(context, ex);
        }
    }
}
