package com.example.sickrock.service;

import com.example.sickrock.dialect.Identifiers;
import com.example.sickrock.dialect.SqlDialect;
import com.example.sickrock.exception.ConflictException;
import com.example.sickrock.exception.NotFoundException;
import com.example.sickrock.exception.ValidationException;
import com.example.sickrock.model.ColumnVisibility;
import com.example.sickrock.model.ForeignKeyDeclaration;
import com.example.sickrock.model.ReferentialAction;
import com.example.sickrock.model.SortDirective;
import com.example.sickrock.model.TableConfiguration;
import com.example.sickrock.model.TableConfigurationUpdate;
import com.example.sickrock.model.TableView;
import com.example.sickrock.model.ViewType;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Durable record of logical tables, saved views and declared foreign keys. Every write runs in a
 * transaction that joins the caller's, so the mutation engine can reconcile metadata atomically
 * with its DDL.
 */
@Service
public class MetadataStore {

    private static final String CONFIG_COLUMNS = "id, name, title, ordinal, db, create_button_text, icon";
    private static final String VIEW_COLUMNS = "id, table_name, view_name, view_type, is_default";
    private static final String VIEW_COLUMN_COLUMNS = "column_name, is_visible, column_order, column_width, sort_order";
    private static final String FK_COLUMNS = "id, table_name, column_name, referenced_table, referenced_column, "
            + "constraint_name, on_delete, on_update, enforced";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedTemplate;
    private final TransactionTemplate transactionTemplate;
    private final SqlDialect dialect;
    private final SqlLogService logService;

    public MetadataStore(JdbcTemplate jdbcTemplate,
                         NamedParameterJdbcTemplate namedTemplate,
                         PlatformTransactionManager transactionManager,
                         SqlDialect dialect,
                         SqlLogService logService) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedTemplate = namedTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.dialect = dialect;
        this.logService = logService;
    }

    // table configurations

    public List<TableConfiguration> listConfigurations() {
        return query("SELECT " + CONFIG_COLUMNS + " FROM table_configurations ORDER BY ordinal, name",
                new MapSqlParameterSource(), this::mapConfiguration);
    }

    public Optional<TableConfiguration> findConfiguration(String name) {
        return query("SELECT " + CONFIG_COLUMNS + " FROM table_configurations WHERE name = :name",
                new MapSqlParameterSource("name", name), this::mapConfiguration).stream().findFirst();
    }

    public TableConfiguration getConfiguration(String name) {
        return findConfiguration(name).orElseThrow(() -> NotFoundException.table(name));
    }

    public TableConfiguration createConfiguration(TableConfiguration configuration) {
        Identifiers.validate(configuration.name(), "table");
        return transactionTemplate.execute(status -> {
            if (findConfiguration(configuration.name()).isPresent()) {
                throw new ConflictException(configuration.name(), "Table configuration already exists: " + configuration.name());
            }
            MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("name", configuration.name())
                    .addValue("title", configuration.title())
                    .addValue("ordinal", configuration.ordinal())
                    .addValue("db", configuration.db())
                    .addValue("createButtonText", configuration.createButtonText())
                    .addValue("icon", configuration.icon());
            update("INSERT INTO table_configurations (name, title, ordinal, db, create_button_text, icon) "
                    + "VALUES (:name, :title, :ordinal, :db, :createButtonText, :icon)", params, configuration.name());
            return configuration.withId(lastInsertId());
        });
    }

    public TableConfiguration updateConfiguration(String name, TableConfigurationUpdate changes) {
        return transactionTemplate.execute(status -> {
            TableConfiguration current = getConfiguration(name);
            TableConfiguration updated = new TableConfiguration(current.id(), current.name(),
                    changes.title() != null ? changes.title() : current.title(),
                    changes.ordinal() != null ? changes.ordinal() : current.ordinal(),
                    current.db(),
                    changes.createButtonText() != null ? changes.createButtonText() : current.createButtonText(),
                    changes.icon() != null ? changes.icon() : current.icon());
            MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("id", updated.id())
                    .addValue("title", updated.title())
                    .addValue("ordinal", updated.ordinal())
                    .addValue("createButtonText", updated.createButtonText())
                    .addValue("icon", updated.icon());
            update("UPDATE table_configurations SET title = :title, ordinal = :ordinal, "
                    + "create_button_text = :createButtonText, icon = :icon WHERE id = :id", params, name);
            return updated;
        });
    }

    /**
     * Removes a configuration together with its views, their columns and every foreign key
     * declaration from or to the table. The physical table is not touched.
     */
    public void deleteConfiguration(String name) {
        transactionTemplate.executeWithoutResult(status -> {
            getConfiguration(name);
            MapSqlParameterSource params = new MapSqlParameterSource("table", name);
            update("DELETE FROM table_view_columns WHERE view_id IN "
                    + "(SELECT id FROM table_views WHERE table_name = :table)", params, name);
            update("DELETE FROM table_views WHERE table_name = :table", params, name);
            update("DELETE FROM table_foreign_keys WHERE table_name = :table OR referenced_table = :table", params, name);
            update("DELETE FROM table_configurations WHERE name = :table", params, name);
        });
        logService.logInfo("Deleted table configuration " + name);
    }

    // views

    public List<TableView> listViews(String tableName) {
        List<TableView> views = query("SELECT " + VIEW_COLUMNS + " FROM table_views WHERE table_name = :table ORDER BY id",
                new MapSqlParameterSource("table", tableName), this::mapViewHeader);
        return views.stream().map(this::withColumns).toList();
    }

    public Optional<TableView> findView(long viewId) {
        return query("SELECT " + VIEW_COLUMNS + " FROM table_views WHERE id = :id",
                new MapSqlParameterSource("id", viewId), this::mapViewHeader)
                .stream().findFirst().map(this::withColumns);
    }

    public TableView getView(long viewId) {
        return findView(viewId).orElseThrow(() -> NotFoundException.view(viewId));
    }

    public Optional<TableView> findDefaultView(String tableName) {
        return query("SELECT " + VIEW_COLUMNS + " FROM table_views WHERE table_name = :table AND is_default = :yes ORDER BY id",
                new MapSqlParameterSource("table", tableName).addValue("yes", true), this::mapViewHeader)
                .stream().findFirst().map(this::withColumns);
    }

    /**
     * Stores a new view. When it is marked default, every other view of the table loses the flag in
     * the same transaction.
     */
    public TableView createView(TableView view) {
        validateView(view);
        return transactionTemplate.execute(status -> {
            getConfiguration(view.tableName());
            lockViews(view.tableName());
            ensureUniqueViewName(view.tableName(), view.viewName(), null);
            MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("table", view.tableName())
                    .addValue("viewName", view.viewName())
                    .addValue("viewType", view.viewType().storedName())
                    .addValue("isDefault", view.isDefault());
            update("INSERT INTO table_views (table_name, view_name, view_type, is_default) "
                    + "VALUES (:table, :viewName, :viewType, :isDefault)", params, view.tableName());
            long id = lastInsertId();
            if (view.isDefault()) {
                clearOtherDefaults(view.tableName(), id);
            }
            insertViewColumns(id, view.columns());
            return view.withId(id);
        });
    }

    /**
     * Replaces name, type, default flag and the full column list of an existing view.
     */
    public TableView updateView(TableView view) {
        if (view.id() == null) {
            throw new ValidationException("id", "View id is required for an update");
        }
        validateView(view);
        return transactionTemplate.execute(status -> {
            TableView current = getView(view.id());
            if (!current.tableName().equals(view.tableName())) {
                throw new ValidationException("tableName", "A view cannot move to another table");
            }
            lockViews(view.tableName());
            ensureUniqueViewName(view.tableName(), view.viewName(), view.id());
            MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("id", view.id())
                    .addValue("viewName", view.viewName())
                    .addValue("viewType", view.viewType().storedName())
                    .addValue("isDefault", view.isDefault());
            update("UPDATE table_views SET view_name = :viewName, view_type = :viewType, is_default = :isDefault "
                    + "WHERE id = :id", params, view.tableName());
            if (view.isDefault()) {
                clearOtherDefaults(view.tableName(), view.id());
            }
            update("DELETE FROM table_view_columns WHERE view_id = :id", new MapSqlParameterSource("id", view.id()), view.tableName());
            insertViewColumns(view.id(), view.columns());
            return view;
        });
    }

    public void setDefaultView(String tableName, long viewId) {
        transactionTemplate.executeWithoutResult(status -> {
            TableView view = getView(viewId);
            if (!view.tableName().equals(tableName)) {
                throw new ValidationException("viewId", "View " + viewId + " does not belong to table " + tableName);
            }
            lockViews(tableName);
            update("UPDATE table_views SET is_default = :yes WHERE id = :id",
                    new MapSqlParameterSource("id", viewId).addValue("yes", true), tableName);
            clearOtherDefaults(tableName, viewId);
        });
    }

    public void deleteView(long viewId) {
        transactionTemplate.executeWithoutResult(status -> {
            TableView view = getView(viewId);
            MapSqlParameterSource params = new MapSqlParameterSource("id", viewId);
            update("DELETE FROM table_view_columns WHERE view_id = :id", params, view.tableName());
            update("DELETE FROM table_views WHERE id = :id", params, view.tableName());
        });
    }

    // foreign key declarations

    public List<ForeignKeyDeclaration> foreignKeysFrom(String tableName) {
        return query("SELECT " + FK_COLUMNS + " FROM table_foreign_keys WHERE table_name = :table ORDER BY id",
                new MapSqlParameterSource("table", tableName), this::mapForeignKey);
    }

    public List<ForeignKeyDeclaration> foreignKeysTo(String tableName) {
        return query("SELECT " + FK_COLUMNS + " FROM table_foreign_keys WHERE referenced_table = :table ORDER BY id",
                new MapSqlParameterSource("table", tableName), this::mapForeignKey);
    }

    public Optional<ForeignKeyDeclaration> findForeignKey(String tableName, String columnName) {
        return foreignKeysFrom(tableName).stream()
                .filter(fk -> fk.originatesFrom(tableName, columnName))
                .findFirst();
    }

    public ForeignKeyDeclaration saveForeignKey(ForeignKeyDeclaration foreignKey) {
        return transactionTemplate.execute(status -> {
            if (findForeignKey(foreignKey.tableName(), foreignKey.columnName()).isPresent()) {
                throw new ConflictException(foreignKey.columnName(), "Column " + foreignKey.tableName() + "."
                        + foreignKey.columnName() + " already has a foreign key");
            }
            MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("table", foreignKey.tableName())
                    .addValue("column", foreignKey.columnName())
                    .addValue("refTable", foreignKey.referencedTable())
                    .addValue("refColumn", foreignKey.referencedColumn())
                    .addValue("constraint", foreignKey.constraintName())
                    .addValue("onDelete", foreignKey.onDelete().sql())
                    .addValue("onUpdate", foreignKey.onUpdate().sql())
                    .addValue("enforced", foreignKey.enforced());
            update("INSERT INTO table_foreign_keys (table_name, column_name, referenced_table, referenced_column, "
                    + "constraint_name, on_delete, on_update, enforced) "
                    + "VALUES (:table, :column, :refTable, :refColumn, :constraint, :onDelete, :onUpdate, :enforced)",
                    params, foreignKey.tableName());
            return foreignKey.withId(lastInsertId());
        });
    }

    public void deleteForeignKey(long id) {
        update("DELETE FROM table_foreign_keys WHERE id = :id", new MapSqlParameterSource("id", id), "table_foreign_keys");
    }

    // reconcile hooks for schema mutations

    /**
     * Points view entries and foreign key declarations at a renamed column. Column names match
     * case-insensitively, as they do in the databases.
     */
    public void renameColumnReferences(String tableName, String oldName, String newName) {
        transactionTemplate.executeWithoutResult(status -> {
            MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("table", tableName)
                    .addValue("oldName", oldName)
                    .addValue("newName", newName);
            update("UPDATE table_view_columns SET column_name = :newName WHERE LOWER(column_name) = LOWER(:oldName) AND view_id IN "
                    + "(SELECT id FROM table_views WHERE table_name = :table)", params, tableName);
            update("UPDATE table_foreign_keys SET column_name = :newName "
                    + "WHERE table_name = :table AND LOWER(column_name) = LOWER(:oldName)", params, tableName);
            update("UPDATE table_foreign_keys SET referenced_column = :newName "
                    + "WHERE referenced_table = :table AND LOWER(referenced_column) = LOWER(:oldName)", params, tableName);
        });
    }

    /**
     * Drops view entries and the outgoing foreign key declaration of a removed column.
     */
    public void removeColumnReferences(String tableName, String columnName) {
        transactionTemplate.executeWithoutResult(status -> {
            MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("table", tableName)
                    .addValue("column", columnName);
            update("DELETE FROM table_view_columns WHERE LOWER(column_name) = LOWER(:column) AND view_id IN "
                    + "(SELECT id FROM table_views WHERE table_name = :table)", params, tableName);
            update("DELETE FROM table_foreign_keys WHERE table_name = :table AND LOWER(column_name) = LOWER(:column)",
                    params, tableName);
        });
    }

    public void renameTableReferences(String oldName, String newName) {
        transactionTemplate.executeWithoutResult(status -> {
            if (findConfiguration(newName).isPresent()) {
                throw new ConflictException(newName, "Table configuration already exists: " + newName);
            }
            MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("oldName", oldName)
                    .addValue("newName", newName);
            update("UPDATE table_configurations SET name = :newName WHERE name = :oldName", params, oldName);
            update("UPDATE table_views SET table_name = :newName WHERE table_name = :oldName", params, oldName);
            update("UPDATE table_foreign_keys SET table_name = :newName WHERE table_name = :oldName", params, oldName);
            update("UPDATE table_foreign_keys SET referenced_table = :newName WHERE referenced_table = :oldName", params, oldName);
        });
    }

    // helpers

    private void validateView(TableView view) {
        Identifiers.validate(view.tableName(), "table");
        for (ColumnVisibility column : view.columns()) {
            if (!Identifiers.isValid(column.columnName())) {
                throw new ValidationException(column.columnName(), "Invalid column name in view: " + column.columnName());
            }
        }
    }

    private void ensureUniqueViewName(String tableName, String viewName, Long excludedId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("table", tableName)
                .addValue("viewName", viewName);
        List<Long> ids = namedTemplate.queryForList(
                "SELECT id FROM table_views WHERE table_name = :table AND view_name = :viewName", params, Long.class);
        if (ids.stream().anyMatch(id -> !id.equals(excludedId))) {
            throw new ConflictException("viewName", "View " + viewName + " already exists for table " + tableName);
        }
    }

    /**
     * Serializes concurrent default-flag changes for one table. SQLite already serializes writers.
     */
    private void lockViews(String tableName) {
        String suffix = dialect.forUpdate();
        if (!suffix.isEmpty()) {
            namedTemplate.queryForList("SELECT id FROM table_views WHERE table_name = :table" + suffix,
                    new MapSqlParameterSource("table", tableName), Long.class);
        }
    }

    private void clearOtherDefaults(String tableName, long keptViewId) {
        update("UPDATE table_views SET is_default = :no WHERE table_name = :table AND id <> :id",
                new MapSqlParameterSource("table", tableName).addValue("id", keptViewId).addValue("no", false), tableName);
    }

    private void insertViewColumns(long viewId, List<ColumnVisibility> columns) {
        for (ColumnVisibility column : columns) {
            MapSqlParameterSource params = new MapSqlParameterSource()
                    .addValue("viewId", viewId)
                    .addValue("columnName", column.columnName())
                    .addValue("visible", column.visible())
                    .addValue("columnOrder", column.columnOrder())
                    .addValue("width", column.width())
                    .addValue("sortOrder", column.sortOrder() == null ? null : column.sortOrder().name().toLowerCase(Locale.ROOT));
            update("INSERT INTO table_view_columns (view_id, column_name, is_visible, column_order, column_width, sort_order) "
                    + "VALUES (:viewId, :columnName, :visible, :columnOrder, :width, :sortOrder)", params, column.columnName());
        }
    }

    private TableView withColumns(TableView header) {
        List<ColumnVisibility> columns = query("SELECT " + VIEW_COLUMN_COLUMNS + " FROM table_view_columns "
                        + "WHERE view_id = :id ORDER BY column_order, id",
                new MapSqlParameterSource("id", header.id()), this::mapViewColumn);
        return new TableView(header.id(), header.tableName(), header.viewName(), header.viewType(), header.isDefault(), columns);
    }

    private long lastInsertId() {
        Long id = jdbcTemplate.queryForObject(dialect.lastInsertId(), Long.class);
        if (id == null) {
            throw new IllegalStateException("Database did not report a generated id");
        }
        return id;
    }

    private <T> List<T> query(String sql, MapSqlParameterSource params, RowMapper<T> mapper) {
        try {
            return namedTemplate.query(sql, params, mapper);
        } catch (DataAccessException ex) {
            logService.logError(sql, ex.getMessage());
            throw dialect.translate("metadata", ex);
        }
    }

    private int update(String sql, MapSqlParameterSource params, String context) {
        logService.logOperation(sql);
        try {
            return namedTemplate.update(sql, params);
        } catch (DataAccessException ex) {
            logService.logError(sql, ex.getMessage());
            throw dialect.translate(context, ex);
        }
    }

    private TableConfiguration mapConfiguration(ResultSet rs, int rowNum) throws SQLException {
        return new TableConfiguration(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("title"),
                rs.getInt("ordinal"),
                rs.getString("db"),
                rs.getString("create_button_text"),
                rs.getString("icon"));
    }

    private TableView mapViewHeader(ResultSet rs, int rowNum) throws SQLException {
        return new TableView(
                rs.getLong("id"),
                rs.getString("table_name"),
                rs.getString("view_name"),
                ViewType.parse(rs.getString("view_type")),
                rs.getBoolean("is_default"),
                List.of());
    }

    private ColumnVisibility mapViewColumn(ResultSet rs, int rowNum) throws SQLException {
        int width = rs.getInt("column_width");
        Integer columnWidth = rs.wasNull() ? null : width;
        return new ColumnVisibility(
                rs.getString("column_name"),
                rs.getBoolean("is_visible"),
                rs.getInt("column_order"),
                SortDirective.parse(rs.getString("sort_order")),
                columnWidth);
    }

    private ForeignKeyDeclaration mapForeignKey(ResultSet rs, int rowNum) throws SQLException {
        return new ForeignKeyDeclaration(
                rs.getLong("id"),
                rs.getString("table_name"),
                rs.getString("column_name"),
                rs.getString("referenced_table"),
                rs.getString("referenced_column"),
                rs.getString("constraint_name"),
                ReferentialAction.parse(rs.getString("on_delete")),
                ReferentialAction.parse(rs.getString("on_update")),
                rs.getBoolean("enforced"));
    }
}
