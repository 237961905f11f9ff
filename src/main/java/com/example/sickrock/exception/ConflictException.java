package com.example.sickrock.exception;

public class ConflictException extends EngineException {

    public ConflictException(String field, String message) {
        super(ErrorKind.CONFLICT, field, message, null);
    }

    public ConflictException(String field, String message, Throwable cause) {
        super(ErrorKind.CONFLICT, field, message, cause);
    }
}
