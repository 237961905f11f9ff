package com.example.sickrock.service;

import com.example.sickrock.dialect.SqlDialect;
import com.example.sickrock.exception.ValidationException;
import com.example.sickrock.model.ColumnDescriptor;
import com.example.sickrock.model.FieldValue;
import com.example.sickrock.model.SemanticType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts between caller values, {@link FieldValue}s and JDBC values according to a column's
 * semantic type. Inbound conversion is strict and reports the offending column; reading is lenient
 * so that rows holding unexpected values stay readable.
 */
@Component
public class ValueConverter {

    private static final Set<String> TRUE_VALUES = Set.of("1", "1.0", "true", "yes", "t", "y");
    private static final Set<String> FALSE_VALUES = Set.of("0", "0.0", "false", "no", "f", "n");

    /**
     * Integer text as databases cast it: digits with an optional sign and an all-zero fraction.
     * Exponent notation is refused because SQLite casts {@code '1e3'} to 1.
     */
    private static final Pattern INTEGER_TEXT = Pattern.compile("[+-]?\\d+(\\.0*)?");

    private final SqlDialect dialect;

    public ValueConverter(SqlDialect dialect) {
        this.dialect = dialect;
    }

    /**
     * Caller value to a tagged value of the column's type.
     *
     * @throws ValidationException when the value cannot be represented in the column
     */
    public FieldValue toFieldValue(ColumnDescriptor column, Object input) {
        if (column.valueType() == SemanticType.UNSUPPORTED) {
            throw new ValidationException(column.name(), "Column " + column.name() + " has unsupported type "
                    + column.physicalType() + " and cannot be written");
        }
        return convert(column.name(), input, column.valueType());
    }

    public FieldValue convert(String field, Object input, SemanticType type) {
        Object value = input instanceof FieldValue fieldValue ? fieldValue.value() : input;
        if (value == null) {
            return FieldValue.nullValue();
        }
        if (value instanceof String text && text.isBlank() && type != SemanticType.TEXT) {
            return FieldValue.nullValue();
        }
        try {
            return switch (type) {
                case TEXT -> FieldValue.text(value instanceof Instant instant ? instant.toString() : String.valueOf(value));
                case INTEGER -> FieldValue.integer(toLong(value));
                case DECIMAL -> FieldValue.decimal(toBigDecimal(value));
                case BOOLEAN -> FieldValue.bool(toBoolean(value));
                case TIMESTAMP -> FieldValue.timestamp(requireMillisecondPrecision(toInstant(value)));
                default -> throw new ValidationException(field, "Values cannot be stored as " + type);
            };
        } catch (ArithmeticException | NumberFormatException | DateTimeParseException ex) {
            throw new ValidationException(field, "Value '" + value + "' is not a valid " + type.name().toLowerCase(Locale.ROOT)
                    + " for column " + field, ex);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException(field, ex.getMessage() + " for column " + field, ex);
        }
    }

    /**
     * Whether a stored value survives conversion to {@code target} without loss.
     */
    public boolean isRepresentable(Object stored, SemanticType target) {
        try {
            convert("value", stored, target);
            return true;
        } catch (ValidationException ex) {
            return false;
        }
    }

    /**
     * Bind value for a statement parameter.
     */
    public Object toParameter(FieldValue value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.kind() == FieldValue.Kind.TIMESTAMP) {
            return dialect.timestampParameter((Instant) value.value());
        }
        if (value.kind() == FieldValue.Kind.DECIMAL) {
            return dialect.decimalParameter((BigDecimal) value.value());
        }
        return value.value();
    }

    /**
     * JDBC value to a tagged value, falling back to text when the stored value does not match the
     * column's declared type.
     */
    public FieldValue read(ColumnDescriptor column, Object raw) {
        if (raw == null) {
            return FieldValue.nullValue();
        }
        if (raw instanceof byte[] bytes) {
            return FieldValue.text(new String(bytes, StandardCharsets.UTF_8));
        }
        SemanticType type = column.valueType();
        if (type == SemanticType.UNSUPPORTED || type == SemanticType.FOREIGN_KEY) {
            return FieldValue.text(String.valueOf(raw));
        }
        try {
            if (type == SemanticType.TIMESTAMP) {
                return FieldValue.timestamp(toInstant(raw));
            }
            return convert(column.name(), raw, type);
        } catch (ValidationException | DateTimeParseException | IllegalArgumentException | ArithmeticException ex) {
            return FieldValue.text(String.valueOf(raw));
        }
    }

    public Instant readTimestamp(Object raw) {
        if (raw == null) {
            return null;
        }
        try {
            return toInstant(raw);
        } catch (DateTimeParseException | IllegalArgumentException | ArithmeticException ex) {
            return null;
        }
    }

    private static long toLong(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.longValueExact();
        }
        if (value instanceof Boolean) {
            throw new IllegalArgumentException("Boolean is not an integer");
        }
        if (value instanceof String text && !INTEGER_TEXT.matcher(text.trim()).matches()) {
            throw new NumberFormatException("Not an integer: " + text);
        }
        return toBigDecimal(value).longValueExact();
    }

    /**
     * Negative scales (from exponent input such as {@code 1e3}) are widened to zero so the value
     * reads back as written in plain notation.
     */
    private static BigDecimal toBigDecimal(Object value) {
        BigDecimal decimal = parseDecimal(value);
        return decimal.scale() < 0 ? decimal.setScale(0) : decimal;
    }

    private static BigDecimal parseDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new NumberFormatException("Not a finite number: " + d);
            }
            return BigDecimal.valueOf(d);
        }
        if (value instanceof BigInteger big) {
            return new BigDecimal(big);
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.longValue());
        }
        if (value instanceof String text) {
            return new BigDecimal(text.trim());
        }
        throw new IllegalArgumentException("Unsupported numeric value of type " + value.getClass().getSimpleName());
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            BigDecimal decimal = toBigDecimal(number);
            if (decimal.compareTo(BigDecimal.ONE) == 0) {
                return true;
            }
            if (decimal.signum() == 0) {
                return false;
            }
            throw new IllegalArgumentException("Number " + number + " is not a boolean");
        }
        String text = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(text)) {
            return true;
        }
        if (FALSE_VALUES.contains(text)) {
            return false;
        }
        throw new IllegalArgumentException("Value '" + value + "' is not a boolean");
    }

    private static Instant requireMillisecondPrecision(Instant instant) {
        if (instant.getNano() % 1_000_000 != 0) {
            throw new IllegalArgumentException("Timestamp " + instant + " is more precise than milliseconds");
        }
        return instant;
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof LocalDateTime local) {
            return local.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof java.sql.Timestamp timestamp) {
            // DATETIME carries no zone; the engine writes UTC wall-clock time
            return timestamp.toLocalDateTime().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate().atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime offset) {
            return offset.toInstant();
        }
        if (value instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Number number) {
            return Instant.ofEpochSecond(toLong(number));
        }
        if (value instanceof String text) {
            return parseTimestamp(text.trim());
        }
        throw new IllegalArgumentException("Unsupported timestamp value of type " + value.getClass().getSimpleName());
    }

    private static Instant parseTimestamp(String text) {
        String normalized = text.length() > 10 && text.charAt(10) == ' '
                ? text.substring(0, 10) + 'T' + text.substring(11)
                : text;
        if (normalized.length() == 10) {
            return LocalDate.parse(normalized).atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        try {
            return OffsetDateTime.parse(normalized).toInstant();
        } catch (DateTimeParseException ignored) {
            return LocalDateTime.parse(normalized).toInstant(ZoneOffset.UTC);
        }
    }
}
