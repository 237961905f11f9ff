package com.example.sickrock.exception;

/**
 * Connection, busy or lock timeout. Safe for the caller to retry.
 */
public class TransientException extends EngineException {

    public TransientException(String message) {
        super(ErrorKind.TRANSIENT, null, message, null);
    }

    public TransientException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT, null, message, cause);
    }
}
