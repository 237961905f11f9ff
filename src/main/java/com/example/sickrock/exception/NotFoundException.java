package com.example.sickrock.exception;

/**
 * Unknown table, row or view. Distinct from an empty result.
 */
public class NotFoundException extends EngineException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, null, message, null);
    }

    public static NotFoundException table(String tableName) {
        return new NotFoundException("Table not found: " + tableName);
    }

    public static NotFoundException item(String tableName, long id) {
        return new NotFoundException("Item " + id + " not found in table " + tableName);
    }

    public static NotFoundException view(long viewId) {
        return new NotFoundException("View not found: " + viewId);
    }
}
