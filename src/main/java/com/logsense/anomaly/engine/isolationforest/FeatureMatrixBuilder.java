package com.logsense.anomaly.engine.isolationforest;

import com.logsense.anomaly.engine.EmptyBatchException;
import com.logsense.anomaly.engine.SchemaException;
import com.logsense.anomaly.model.MetricPoint;

import java.util.List;

/**
 * Turns a batch into a row-major feature matrix: one row per point, in batch order,
 * columns in {@link MetricFeature} declaration order (cpu, ram, disk, latency_ms).
 */
public final class FeatureMatrixBuilder {

    private FeatureMatrixBuilder() {}

    public static double[][] build(List<MetricPoint> batch) {
        if (batch == null || batch.isEmpty()) {
            throw new EmptyBatchException();
        }

        double[][] matrix = new double[batch.size()][MetricFeature.COUNT];
        for (int row = 0; row < batch.size(); row++) {
            MetricPoint point = batch.get(row);
            if (point == null) {
                throw new SchemaException("points[" + row + "] is null", "points[" + row + "]");
            }
            if (point.getTs() == null) {
                throw new SchemaException("points[" + row + "] is missing required field 'ts'",
                        "points[" + row + "].ts");
            }
            for (MetricFeature feature : MetricFeature.values()) {
                Double value = feature.valueOf(point);
                String field = "points[" + row + "]." + feature.fieldName();
                if (value == null) {
                    throw new SchemaException("points[" + row + "] is missing required field '"
                            + feature.fieldName() + "'", field);
                }
                if (!Double.isFinite(value)) {
                    throw new SchemaException("points[" + row + "] has non-numeric value " + value
                            + " for '" + feature.fieldName() + "'", field);
                }
                matrix[row][feature.ordinal()] = value;
            }
        }
        return matrix;
    }
}
