package com.logsense.anomaly.engine;

public class EmptyBatchException extends InvalidBatchException {

    public EmptyBatchException() {
        super("batch must contain at least one point", "points");
    }
}
