package com.logsense.anomaly.engine;

import com.logsense.anomaly.model.AnomalyRecord;
import com.logsense.anomaly.model.RunSummary;

import java.util.List;

/**
 * Durable sink for completed detection runs. Implementations assign the run id and
 * creation time and store the summary together with its anomaly records.
 */
public interface RunRecorder {

    /**
     * @param totalPoints number of points that were scored
     * @param anomalies   flagged records, highest score first
     * @return the stored run summary
     * @throws RuntimeException when the run could not be stored
     */
    RunSummary record(int totalPoints, List<AnomalyRecord> anomalies);
}
