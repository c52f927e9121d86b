package com.logsense.anomaly.engine.isolationforest;

import com.logsense.anomaly.model.MetricPoint;

import java.util.function.Function;

/**
 * Feature columns of the matrix, in column order. The declaration order is part of the
 * contract: it fixes matrix column indices and breaks ties between explained fields.
 */
public enum MetricFeature {

    CPU("cpu", MetricPoint::getCpu),
    RAM("ram", MetricPoint::getRam),
    DISK("disk", MetricPoint::getDisk),
    LATENCY_MS("latency_ms", MetricPoint::getLatencyMs);

    public static final int COUNT = values().length;

    private final String fieldName;
    private final Function<MetricPoint, Double> accessor;

    MetricFeature(String fieldName, Function<MetricPoint, Double> accessor) {
        this.fieldName = fieldName;
        this.accessor = accessor;
    }

    /** Wire name of the field, also the name reported by explanations. */
    public String fieldName() {
        return fieldName;
    }

    public Double valueOf(MetricPoint point) {
        return accessor.apply(point);
    }

    public static MetricFeature ofColumn(int column) {
        return values()[column];
    }
}
