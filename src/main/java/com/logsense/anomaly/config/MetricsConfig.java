package com.logsense.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDetection(int totalPoints, int anomaliesFound, long elapsedNanos) {
        Counter.builder("detection.runs.count")
                .register(registry)
                .increment();

        Counter.builder("detection.anomalies.count")
                .register(registry)
                .increment(anomaliesFound);

        DistributionSummary.builder("detection.batch.size")
                .register(registry)
                .record(totalPoints);

        Timer.builder("detection.duration")
                .register(registry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordRejected(String reason) {
        Counter.builder("detection.rejected.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordRecorderFailure() {
        Counter.builder("detection.record.failure.count")
                .register(registry)
                .increment();
    }
}
