package com.example.sickrock.dialect;

import com.example.sickrock.exception.ConflictException;
import com.example.sickrock.exception.IntegrityException;
import com.example.sickrock.exception.TransientException;
import com.example.sickrock.exception.ValidationException;
import com.example.sickrock.model.ColumnDescriptor;
import com.example.sickrock.model.SemanticType;
import com.example.sickrock.model.TableStructure;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Statement templates shared by both dialects. Subclasses supply quoting, the type mapping and DDL.
 */
public abstract class AbstractSqlDialect implements SqlDialect {

    private static final String PARAMETER_PREFIX = "v_";

    /**
     * Catalog type name (upper case, without size or modifiers) to semantic type.
     */
    protected abstract Map<String, SemanticType> typeMapping();

    protected abstract Map<SemanticType, String> physicalTypes();

    protected abstract char quoteCharacter();

    @Override
    public String quote(String identifier) {
        Identifiers.validate(identifier, "identifier");
        char q = quoteCharacter();
        return q + identifier + q;
    }

    protected String quoteAll(List<String> identifiers) {
        return identifiers.stream().map(this::quote).collect(Collectors.joining(", "));
    }

    @Override
    public String physicalType(SemanticType type) {
        String physical = type == null ? null : physicalTypes().get(type);
        if (physical == null) {
            throw new ValidationException("type", "Unsupported column type: " + type);
        }
        return physical;
    }

    @Override
    public String declaredType(String typeName, int columnSize, int decimalDigits) {
        return typeName == null ? "" : typeName.trim();
    }

    @Override
    public SemanticType classify(String physicalType, int columnSize) {
        String normalized = normalizeTypeName(physicalType);
        if (normalized.isEmpty()) {
            return SemanticType.UNSUPPORTED;
        }
        return typeMapping().getOrDefault(normalized, SemanticType.UNSUPPORTED);
    }

    protected static String normalizeTypeName(String physicalType) {
        if (physicalType == null) {
            return "";
        }
        String normalized = physicalType.trim().toUpperCase(Locale.ROOT);
        int paren = normalized.indexOf('(');
        if (paren >= 0) {
            normalized = normalized.substring(0, paren);
        }
        normalized = normalized.replace(" UNSIGNED", "").replace(" ZEROFILL", "");
        return normalized.trim();
    }

    protected static ColumnDescriptor requireColumn(TableStructure table, String column) {
        return table.column(column)
                .orElseThrow(() -> new ValidationException(column, "Column " + column + " does not exist in " + table.tableName()));
    }

    @Override
    public String select(String table, List<String> columns, List<String> predicates, List<String> orderBy) {
        StringBuilder sql = new StringBuilder("SELECT ")
                .append(quoteAll(columns))
                .append(" FROM ")
                .append(quote(table));
        appendWhere(sql, predicates);
        if (orderBy != null && !orderBy.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", orderBy));
        }
        sql.append(" LIMIT :limit OFFSET :offset");
        return sql.toString();
    }

    @Override
    public String selectById(String table, List<String> columns) {
        return "SELECT " + quoteAll(columns) + " FROM " + quote(table) + " WHERE " + quote(TableStructure.ID_COLUMN) + " = :id";
    }

    @Override
    public String count(String table, List<String> predicates) {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM ").append(quote(table));
        appendWhere(sql, predicates);
        return sql.toString();
    }

    @Override
    public String insert(String table, List<String> columns) {
        String placeholders = columns.stream()
                .map(column -> ":" + parameterName(column))
                .collect(Collectors.joining(", "));
        return "INSERT INTO " + quote(table) + " (" + quoteAll(columns) + ") VALUES (" + placeholders + ")";
    }

    @Override
    public String update(String table, List<String> columns) {
        if (columns.isEmpty()) {
            throw new ValidationException("values", "At least one column must be updated");
        }
        String assignments = columns.stream()
                .map(column -> quote(column) + " = :" + parameterName(column))
                .collect(Collectors.joining(", "));
        return "UPDATE " + quote(table) + " SET " + assignments + " WHERE " + quote(TableStructure.ID_COLUMN) + " = :id";
    }

    @Override
    public String deleteById(String table) {
        return "DELETE FROM " + quote(table) + " WHERE " + quote(TableStructure.ID_COLUMN) + " = :id";
    }

    @Override
    public String parameterName(String column) {
        return PARAMETER_PREFIX + Identifiers.validate(column, "column");
    }

    @Override
    public String forUpdate() {
        return "";
    }

    @Override
    public Object decimalParameter(BigDecimal value) {
        return value;
    }

    @Override
    public String sortExpression(ColumnDescriptor column) {
        return quote(column.name());
    }

    private static void appendWhere(StringBuilder sql, List<String> predicates) {
        if (predicates != null && !predicates.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", predicates));
        }
    }

    @Override
    public RuntimeException translate(String context, DataAccessException ex) {
        if (ex instanceof DuplicateKeyException) {
            return new ConflictException(context, "Duplicate value in " + context + ": " + rootMessage(ex), ex);
        }
        if (ex instanceof DataIntegrityViolationException) {
            return new IntegrityException(context, "Integrity violation in " + context + ": " + rootMessage(ex), ex);
        }
        if (ex instanceof TransientDataAccessException) {
            return new TransientException("Temporary failure in " + context + ": " + rootMessage(ex), ex);
        }
        return ex;
    }

    protected static String rootMessage(Throwable ex) {
        Throwable current = ex;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.getClass().getSimpleName() : current.getMessage();
    }
}
