package com.example.sickrock.exception;

public class IntegrityException extends EngineException {

    public IntegrityException(String field, String message) {
        super(ErrorKind.INTEGRITY, field, message, null);
    }

    public IntegrityException(String field, String message, Throwable cause) {
        super(ErrorKind.INTEGRITY, field, message, cause);
    }
}
