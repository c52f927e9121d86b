package com.logsense.anomaly.engine;

import com.logsense.anomaly.engine.isolationforest.FeatureMatrixBuilder;
import com.logsense.anomaly.engine.isolationforest.IsolationForest;
import com.logsense.anomaly.model.AnomalyRecord;
import com.logsense.anomaly.model.MetricPoint;
import com.logsense.anomaly.model.ScoredPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores one batch end to end.
 *
 * Flow:
 * 1. Validate contamination, then build the feature matrix (rejects empty or malformed batches)
 * 2. Train an isolation forest over the batch
 * 3. Score every row and shift the isolation score by {@link #DECISION_OFFSET}
 * 4. Flag the round(n * contamination) highest scores
 * 5. Explain each flagged row against the batch's own mean and spread
 *
 * Holds no state between calls; the forest is garbage once the method returns.
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    /**
     * Subtracted from the isolation score so that 0 marks a point isolated as fast as an
     * average point; positive values are more anomalous.
     */
    public static final double DECISION_OFFSET = 0.5;

    public DetectionResult detect(List<MetricPoint> batch, DetectionSettings settings) {
        ThresholdSelector.validate(settings.getContamination());
        double[][] matrix = FeatureMatrixBuilder.build(batch);

        long start = System.nanoTime();
        IsolationForest forest = IsolationForest.train(matrix, settings.getNumTrees(),
                settings.getSubsampleSize(), settings.getSeed(), settings.getParallelism());
        double[] isolation = forest.isolationScores(matrix, settings.getParallelism());
        log.debug("Scored {} points with {} trees (psi={}, seed={}) in {} ms",
                matrix.length, forest.getTrees().size(), forest.getSampleSize(), forest.getSeed(),
                (System.nanoTime() - start) / 1_000_000);

        double[] scores = new double[isolation.length];
        for (int i = 0; i < isolation.length; i++) {
            scores[i] = isolation[i] - DECISION_OFFSET;
        }

        boolean[] flags = ThresholdSelector.select(scores, settings.getContamination());
        FieldExplainer explainer = FieldExplainer.fit(matrix);

        List<ScoredPoint> scored = new ArrayList<>(batch.size());
        List<ScoredPoint> flagged = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            ScoredPoint point = new ScoredPoint(batch.get(i), i, scores[i], flags[i]);
            scored.add(point);
            if (flags[i]) {
                flagged.add(point);
            }
        }

        flagged.sort(Comparator.comparingDouble(ScoredPoint::score).reversed()
                .thenComparingInt(ScoredPoint::position));

        List<AnomalyRecord> anomalies = new ArrayList<>(flagged.size());
        for (ScoredPoint point : flagged) {
            List<String> fields = explainer.explain(matrix[point.position()]);
            anomalies.add(AnomalyRecord.builder()
                    .ts(point.point().getTs())
                    .score(point.score())
                    .fields(fields)
                    .note(FieldExplainer.note(fields))
                    .build());
        }

        return new DetectionResult(batch.size(), List.copyOf(scored), List.copyOf(anomalies));
    }
}
