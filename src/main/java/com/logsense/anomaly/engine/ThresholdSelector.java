package com.logsense.anomaly.engine;

import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Labels the {@code round(n * contamination)} highest scoring rows as anomalous.
 * Equal scores are ordered by batch position, earliest first.
 */
public final class ThresholdSelector {

    public static final double MIN_CONTAMINATION = 0.01;
    public static final double MAX_CONTAMINATION = 0.30;

    private ThresholdSelector() {}

    public static void validate(double contamination) {
        if (!(contamination >= MIN_CONTAMINATION && contamination <= MAX_CONTAMINATION)) {
            throw new ContaminationRangeException(contamination);
        }
    }

    /**
     * Number of rows to flag in a batch of {@code n}: round-half-up of n * contamination,
     * clamped to [0, n].
     */
    public static int anomalyCount(int n, double contamination) {
        validate(contamination);
        long k = Math.round(n * contamination);
        return (int) Math.max(0, Math.min(k, n));
    }

    public static boolean[] select(double[] scores, double contamination) {
        int k = anomalyCount(scores.length, contamination);
        boolean[] flags = new boolean[scores.length];

        IntStream.range(0, scores.length)
                .boxed()
                .sorted(Comparator.comparingDouble((Integer row) -> scores[row]).reversed()
                        .thenComparingInt(row -> row))
                .limit(k)
                .forEach(row -> flags[row] = true);

        return flags;
    }
}
