package com.logsense.anomaly.engine;

import com.logsense.anomaly.engine.isolationforest.MetricFeature;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Names the fields of a flagged row that sit furthest from the batch, measured as
 * |value - batch mean| / (population std + epsilon).
 *
 * This is a quick heuristic, not a feature attribution: it does not look at the trees and
 * need not agree with what actually isolated the row.
 */
public final class FieldExplainer {

    static final double EPSILON = 1e-9;

    public static final int MAX_FIELDS = 2;

    private final double[] means;
    private final double[] stdDevs;

    private FieldExplainer(double[] means, double[] stdDevs) {
        this.means = means;
        this.stdDevs = stdDevs;
    }

    /**
     * Capture per-column mean and population standard deviation of the batch.
     */
    public static FieldExplainer fit(double[][] data) {
        int columns = MetricFeature.COUNT;
        double[] means = new double[columns];
        double[] stdDevs = new double[columns];

        for (double[] row : data) {
            for (int f = 0; f < columns; f++) {
                means[f] += row[f];
            }
        }
        for (int f = 0; f < columns; f++) {
            means[f] /= data.length;
        }
        for (double[] row : data) {
            for (int f = 0; f < columns; f++) {
                double d = row[f] - means[f];
                stdDevs[f] += d * d;
            }
        }
        for (int f = 0; f < columns; f++) {
            stdDevs[f] = Math.sqrt(stdDevs[f] / data.length);
        }
        return new FieldExplainer(means, stdDevs);
    }

    public double[] standardize(double[] row) {
        double[] z = new double[row.length];
        for (int f = 0; f < row.length; f++) {
            z[f] = (row[f] - means[f]) / (stdDevs[f] + EPSILON);
        }
        return z;
    }

    /**
     * Field names of the row ranked by absolute standardized deviation, most suspicious first.
     * Ties keep column order (cpu, ram, disk, latency_ms).
     */
    public List<String> explain(double[] row) {
        double[] z = standardize(row);
        List<Integer> columns = IntStream.range(0, z.length).boxed().collect(Collectors.toCollection(ArrayList::new));
        // List.sort is stable, equal deviations stay in declaration order
        columns.sort(Comparator.comparingDouble((Integer f) -> Math.abs(z[f])).reversed());

        return columns.stream()
                .limit(MAX_FIELDS)
                .map(f -> MetricFeature.ofColumn(f).fieldName())
                .toList();
    }

    public static String note(List<String> fields) {
        return "Unusual behavior detected. Check: " + String.join(", ", fields);
    }

    public double[] getMeans() { return means.clone(); }
    public double[] getStdDevs() { return stdDevs.clone(); }
}
