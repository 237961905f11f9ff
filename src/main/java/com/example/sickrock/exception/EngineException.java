package com.example.sickrock.exception;

/**
 * Base of every failure the engine reports to its callers.
 */
public abstract class EngineException extends RuntimeException {

    private final ErrorKind kind;
    private final String field;

    protected EngineException(ErrorKind kind, String field, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.field = field;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Name of the offending identifier or column, when there is one.
     */
    public String getField() {
        return field;
    }
}
