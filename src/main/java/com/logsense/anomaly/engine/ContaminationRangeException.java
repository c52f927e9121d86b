package com.logsense.anomaly.engine;

public class ContaminationRangeException extends InvalidBatchException {

    public ContaminationRangeException(double contamination) {
        super(String.format("contamination must be in [%.2f, %.2f], got %s",
                ThresholdSelector.MIN_CONTAMINATION, ThresholdSelector.MAX_CONTAMINATION, contamination),
                "contamination");
    }
}
