package com.logsense.anomaly.engine;

/**
 * A sample is missing a required field or carries a non-numeric value.
 */
public class SchemaException extends InvalidBatchException {

    public SchemaException(String message, String field) {
        super(message, field);
    }
}
