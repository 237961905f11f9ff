package com.example.sickrock.exception;

public class ValidationException extends EngineException {

    public ValidationException(String field, String message) {
        super(ErrorKind.VALIDATION, field, message, null);
    }

    public ValidationException(String field, String message, Throwable cause) {
        super(ErrorKind.VALIDATION, field, message, cause);
    }
}
