package com.logsense.anomaly.service;

import com.logsense.anomaly.config.DetectionConfig;
import com.logsense.anomaly.config.MetricsConfig;
import com.logsense.anomaly.engine.AnomalyDetector;
import com.logsense.anomaly.engine.DetectionResult;
import com.logsense.anomaly.engine.DetectionSettings;
import com.logsense.anomaly.engine.InvalidBatchException;
import com.logsense.anomaly.engine.RunRecorder;
import com.logsense.anomaly.model.DetectResponse;
import com.logsense.anomaly.model.MetricPoint;
import com.logsense.anomaly.model.RunSummary;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Main orchestrator for batch detection.
 *
 * Flow:
 * 1. Resolve detection settings (request contamination or configured default)
 * 2. Score the batch via the AnomalyDetector (validation happens before any tree is built)
 * 3. Hand the result to the RunRecorder
 * 4. Return the result, flagged as unsaved if recording failed
 */
@Service
public class DetectionService {

    private static final Logger log = LoggerFactory.getLogger(DetectionService.class);

    private final AnomalyDetector detector;
    private final RunRecorder runRecorder;
    private final DetectionConfig detectionConfig;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;

    public DetectionService(AnomalyDetector detector,
                            RunRecorder runRecorder,
                            DetectionConfig detectionConfig,
                            MetricsConfig metricsConfig,
                            Tracer tracer) {
        this.detector = detector;
        this.runRecorder = runRecorder;
        this.detectionConfig = detectionConfig;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
    }

    /**
     * Score a batch, record the run and return the flagged points.
     *
     * @param points        samples in caller order
     * @param contamination expected anomalous fraction, or null for the configured default
     * @throws InvalidBatchException when the batch or the contamination is rejected
     */
    @Observed(name = "detection.detect", contextualName = "detect-batch")
    public DetectResponse detect(List<MetricPoint> points, Double contamination) {
        DetectionSettings settings = detectionConfig.toSettings(contamination);

        long start = System.nanoTime();
        DetectionResult result;
        try {
            result = detector.detect(points, settings);
        } catch (InvalidBatchException e) {
            metricsConfig.recordRejected(e.getClass().getSimpleName());
            log.info("Rejected batch: {}", e.getMessage());
            throw e;
        }
        long elapsed = System.nanoTime() - start;

        metricsConfig.recordDetection(result.totalPoints(), result.anomaliesFound(), elapsed);
        log.info("Scored batch: points={}, contamination={}, anomalies={}, elapsedMs={}",
                result.totalPoints(), settings.getContamination(), result.anomaliesFound(), elapsed / 1_000_000);

        RunSummary run = recordRun(result);

        return DetectResponse.builder()
                .totalPoints(result.totalPoints())
                .anomaliesFound(result.anomaliesFound())
                .anomalies(result.anomalies())
                .runId(run != null ? run.getId() : null)
                .saved(run != null)
                .build();
    }

    /**
     * @return the stored run, or null if the recorder failed; the scoring outcome stands either way
     */
    private RunSummary recordRun(DetectionResult result) {
        Span span = tracer.nextSpan()
                .name("detection.record")
                .tag("run.total_points", String.valueOf(result.totalPoints()))
                .tag("run.anomalies_found", String.valueOf(result.anomaliesFound()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            RunSummary run = runRecorder.record(result.totalPoints(), result.anomalies());
            span.tag("run.id", String.valueOf(run.getId()));
            return run;
        } catch (RuntimeException e) {
            span.error(e);
            metricsConfig.recordRecorderFailure();
            log.error("Failed to record run ({} points, {} anomalies); returning unsaved result",
                    result.totalPoints(), result.anomaliesFound(), e);
            return null;
        } finally {
            span.end();
        }
    }
}
