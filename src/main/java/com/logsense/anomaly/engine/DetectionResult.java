package com.logsense.anomaly.engine;

import com.logsense.anomaly.model.AnomalyRecord;
import com.logsense.anomaly.model.ScoredPoint;

import java.util.List;

/**
 * Output of one detection call.
 *
 * @param totalPoints  batch size
 * @param scoredPoints every point in batch order with its score and label
 * @param anomalies    explained records for the flagged points, highest score first
 */
public record DetectionResult(int totalPoints, List<ScoredPoint> scoredPoints, List<AnomalyRecord> anomalies) {

    public int anomaliesFound() {
        return anomalies.size();
    }
}
