package com.logsense.anomaly.engine;

/**
 * Base type for every input problem that rejects a detection call before any model is built.
 * Carries the offending request field so callers can point at it.
 */
public abstract class InvalidBatchException extends IllegalArgumentException {

    private final String field;

    protected InvalidBatchException(String message, String field) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
