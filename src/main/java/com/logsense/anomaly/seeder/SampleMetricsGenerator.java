package com.logsense.anomaly.seeder;

import com.logsense.anomaly.model.MetricPoint;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Synthetic host metrics for demos and manual testing.
 *
 * Baseline: cpu ~ N(28, 6), ram ~ N(58, 5), disk ~ N(18, 4), latency ~ N(110, 12).
 * max(3, 2% of n) distinct samples get extra cpu (+N(35, 10)), disk (+N(30, 10)) and
 * latency (+N(500, 200)). Every value is clipped to a plausible range and rounded to 2 decimals.
 */
@Component
public class SampleMetricsGenerator {

    public static final int MAX_POINTS = 5000;

    private static final DateTimeFormatter TS_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    public SampleBatch generate(int n, int intervalSeconds, long seed, Instant start) {
        if (n < 1 || n > MAX_POINTS) {
            throw new IllegalArgumentException("points must be in [1, " + MAX_POINTS + "], got " + n);
        }
        if (intervalSeconds < 1) {
            throw new IllegalArgumentException("intervalSeconds must be >= 1, got " + intervalSeconds);
        }

        Random random = new Random(seed);
        double[] cpu = new double[n];
        double[] ram = new double[n];
        double[] disk = new double[n];
        double[] latency = new double[n];

        for (int i = 0; i < n; i++) {
            cpu[i] = clip(gaussian(random, 28, 6), 1, 95);
            ram[i] = clip(gaussian(random, 58, 5), 10, 95);
            disk[i] = clip(gaussian(random, 18, 4), 1, 95);
            latency[i] = clip(gaussian(random, 110, 12), 20, 1500);
        }

        int[] spikes = pickDistinct(n, Math.min(n, Math.max(3, (int) (n * 0.02))), random);
        for (int i : spikes) {
            cpu[i] = clip(cpu[i] + gaussian(random, 35, 10), 1, 99);
            disk[i] = clip(disk[i] + gaussian(random, 30, 10), 1, 99);
            latency[i] = clip(latency[i] + gaussian(random, 500, 200), 20, 2000);
        }

        LocalDateTime first = LocalDateTime.ofInstant(start.truncatedTo(ChronoUnit.SECONDS), ZoneOffset.UTC);
        List<MetricPoint> points = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            points.add(MetricPoint.builder()
                    .ts(first.plusSeconds((long) i * intervalSeconds).format(TS_FORMAT))
                    .cpu(round2(cpu[i]))
                    .ram(round2(ram[i]))
                    .disk(round2(disk[i]))
                    .latencyMs(round2(latency[i]))
                    .build());
        }

        int[] sorted = spikes.clone();
        Arrays.sort(sorted);
        return new SampleBatch(points, Arrays.stream(sorted).boxed().toList());
    }

    private static int[] pickDistinct(int n, int k, Random random) {
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) indices[i] = i;
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        return Arrays.copyOf(indices, k);
    }

    private static double gaussian(Random random, double mean, double stdDev) {
        return mean + random.nextGaussian() * stdDev;
    }

    private static double clip(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
