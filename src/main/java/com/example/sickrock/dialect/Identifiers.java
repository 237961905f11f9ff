package com.example.sickrock.dialect;

import com.example.sickrock.exception.ValidationException;

import java.util.regex.Pattern;

/**
 * Grammar for table and column names. Identifiers cannot be bound as statement parameters, so
 * every name is checked here before it is spliced into SQL text.
 */
public final class Identifiers {

    public static final int MAX_LENGTH = 64;

    /**
     * Prefix of engine-owned scratch tables; user identifiers may not start with it.
     */
    public static final String RESERVED_PREFIX = "_sr_";

    private static final Pattern SAFE = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    private Identifiers() {
    }

    public static String validate(String identifier, String type) {
        if (identifier == null || identifier.isBlank()) {
            throw new ValidationException(type, type + " name must not be blank");
        }
        if (!SAFE.matcher(identifier).matches()) {
            throw new ValidationException(identifier, "Invalid " + type + " name: " + identifier);
        }
        if (identifier.length() > MAX_LENGTH) {
            throw new ValidationException(identifier, type + " name is longer than " + MAX_LENGTH + " characters: " + identifier);
        }
        if (identifier.regionMatches(true, 0, RESERVED_PREFIX, 0, RESERVED_PREFIX.length())) {
            throw new ValidationException(identifier, type + " name uses the reserved prefix " + RESERVED_PREFIX);
        }
        return identifier;
    }

    public static boolean isValid(String identifier) {
        return identifier != null
                && identifier.length() <= MAX_LENGTH
                && SAFE.matcher(identifier).matches()
                && !identifier.regionMatches(true, 0, RESERVED_PREFIX, 0, RESERVED_PREFIX.length());
    }

    /**
     * Renders a validated identifier as a SQL string literal, for catalog tables keyed by name.
     */
    public static String literal(String identifier) {
        validate(identifier, "identifier");
        return "'" + identifier + "'";
    }
}
