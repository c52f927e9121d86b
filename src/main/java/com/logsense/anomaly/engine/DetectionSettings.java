package com.logsense.anomaly.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Everything a detection call depends on besides the batch itself. Passed by value into the
 * engine; nothing in the engine reads configuration or randomness from anywhere else.
 */
@Value
@Builder(toBuilder = true)
public class DetectionSettings {

    // Expected fraction of anomalous points, in [0.01, 0.30]
    @Builder.Default
    double contamination = 0.05;

    // Number of isolation trees in the ensemble
    @Builder.Default
    int numTrees = 200;

    // Rows sampled per tree (psi), capped at the batch size
    @Builder.Default
    int subsampleSize = 256;

    // Master seed; identical seed + batch gives identical scores
    @Builder.Default
    long seed = 42L;

    // Worker threads for tree growth and scoring, 1 = calling thread only
    @Builder.Default
    int parallelism = 1;
}
