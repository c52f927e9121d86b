package com.logsense.anomaly.model;

/**
 * A batch sample together with its position in the batch, its anomaly score and its label.
 */
public record ScoredPoint(MetricPoint point, int position, double score, boolean anomaly) {}
