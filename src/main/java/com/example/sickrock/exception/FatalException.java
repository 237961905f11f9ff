package com.example.sickrock.exception;

/**
 * Schema reconciliation is impossible, e.g. a configured table has no physical counterpart.
 * Surfaced to the caller and never repaired automatically.
 */
public class FatalException extends EngineException {

    public FatalException(String field, String message) {
        super(ErrorKind.FATAL, field, message, null);
    }

    public FatalException(String field, String message, Throwable cause) {
        super(ErrorKind.FATAL, field, message, cause);
    }
}
