package com.example.sickrock.exception;

public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    CONFLICT,
    INTEGRITY,
    TRANSIENT,
    FATAL;

    /**
     * Only transient failures may be retried by the caller; the engine never retries.
     */
    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
