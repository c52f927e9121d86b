package com.logsense.anomaly.config;

import com.logsense.anomaly.engine.DetectionSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Used when a request does not carry its own contamination
    private double defaultContamination = 0.05;

    // Isolation trees per forest
    private int numTrees = 200;

    // Rows sampled per tree (psi); batches smaller than this use every row
    private int subsampleSize = 256;

    // Master seed for tree construction. Same seed + same batch = same scores.
    private long seed = 42L;

    // Threads used to grow trees and score rows inside one request. 1 keeps everything on the request thread.
    private int parallelism = 1;

    // Default page size of GET /runs
    private int historyLimit = 25;

    /**
     * Snapshot of the current defaults, with the request's contamination when it has one.
     */
    public DetectionSettings toSettings(Double contamination) {
        return DetectionSettings.builder()
                .contamination(contamination != null ? contamination : defaultContamination)
                .numTrees(numTrees)
                .subsampleSize(subsampleSize)
                .seed(seed)
                .parallelism(parallelism)
                .build();
    }
}
