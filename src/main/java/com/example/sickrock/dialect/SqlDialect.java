package com.example.sickrock.dialect;

import com.example.sickrock.model.ColumnDescriptor;
import com.example.sickrock.model.ColumnSpec;
import com.example.sickrock.model.ForeignKeyDeclaration;
import com.example.sickrock.model.SemanticType;
import com.example.sickrock.model.TableStructure;
import org.springframework.dao.DataAccessException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Everything that differs between the supported databases: identifier quoting, the physical type
 * mapping, DDL for each abstract schema operation, CRUD statement templates and error translation.
 * Callers never build SQL around identifiers themselves.
 */
public interface SqlDialect {

    DialectKind kind();

    /**
     * Validates and quotes a table or column name.
     */
    String quote(String identifier);

    /**
     * Physical column type for a semantic type.
     *
     * @throws com.example.sickrock.exception.ValidationException when the type cannot be stored
     */
    String physicalType(SemanticType type);

    /**
     * Full column type as it must be repeated in DDL, rebuilt from the catalog's type name and size.
     */
    String declaredType(String typeName, int columnSize, int decimalDigits);

    /**
     * Semantic classification of a catalog type name; {@link SemanticType#UNSUPPORTED} when unmapped.
     */
    SemanticType classify(String physicalType, int columnSize);

    /**
     * Whether DDL participates in transactions. When false every plan must be natively atomic and
     * the caller compensates metadata failures with {@link StatementPlan#compensation()}.
     */
    boolean transactionalDdl();

    /**
     * Whether foreign keys are held physically by the database rather than checked by the engine.
     */
    boolean enforcesForeignKeys();

    /**
     * Whether a table configuration may name {@code db} as its backing database when the engine is
     * connected to {@code connectionCatalog}. Tables always live in the connection's database.
     */
    boolean acceptsDatabase(String db, String connectionCatalog);

    // DDL

    StatementPlan createTable(String table);

    StatementPlan dropTable(String table);

    StatementPlan renameTable(TableStructure table, String newName);

    StatementPlan addColumn(TableStructure table, ColumnSpec column);

    StatementPlan dropColumn(TableStructure table, String column);

    StatementPlan renameColumn(TableStructure table, String column, String newName);

    StatementPlan changeColumnType(TableStructure table, String column, SemanticType newType);

    StatementPlan addForeignKey(TableStructure table, ForeignKeyDeclaration foreignKey);

    StatementPlan dropForeignKey(TableStructure table, ForeignKeyDeclaration foreignKey);

    // CRUD templates, all with named parameters

    /**
     * {@code SELECT ... FROM table [WHERE ...] [ORDER BY ...] LIMIT :limit OFFSET :offset}.
     */
    String select(String table, List<String> columns, List<String> predicates, List<String> orderBy);

    String selectById(String table, List<String> columns);

    String count(String table, List<String> predicates);

    /**
     * Parameters are named after the columns, see {@link #parameterName(String)}.
     */
    String insert(String table, List<String> columns);

    String update(String table, List<String> columns);

    String deleteById(String table);

    /**
     * Query returning the id generated by the last insert on the current connection.
     */
    String lastInsertId();

    /**
     * Row lock suffix for a select that guards a read-modify-write, empty where writers are
     * serialized anyway.
     */
    String forUpdate();

    String parameterName(String column);

    /**
     * Bind value for a timestamp column.
     */
    Object timestampParameter(Instant instant);

    /**
     * Bind value for a decimal column.
     */
    Object decimalParameter(BigDecimal value);

    /**
     * ORDER BY expression for a column, ordering by value rather than by storage representation.
     */
    String sortExpression(ColumnDescriptor column);

    /**
     * Maps a Spring data access failure onto the engine's error taxonomy. Failures without a
     * mapping are returned unchanged.
     */
    RuntimeException translate(String context, DataAccessException ex);
}
