package com.logsense.anomaly.controller;

import com.logsense.anomaly.config.DetectionConfig;
import com.logsense.anomaly.engine.ThresholdSelector;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/config")
@Tag(name = "Config", description = "View and modify runtime detection defaults")
public class ConfigController {

    private final DetectionConfig detectionConfig;

    public ConfigController(DetectionConfig detectionConfig) {
        this.detectionConfig = detectionConfig;
    }

    @Operation(summary = "Get detection defaults")
    @GetMapping("/detection")
    public ResponseEntity<Map<String, Object>> getDetectionConfig() {
        return ResponseEntity.ok(Map.of(
                "defaultContamination", detectionConfig.getDefaultContamination(),
                "numTrees", detectionConfig.getNumTrees(),
                "subsampleSize", detectionConfig.getSubsampleSize(),
                "seed", detectionConfig.getSeed(),
                "parallelism", detectionConfig.getParallelism(),
                "historyLimit", detectionConfig.getHistoryLimit()
        ));
    }

    @Operation(summary = "Update detection defaults",
            description = "Changes apply to the next request but reset on restart.")
    @PutMapping("/detection")
    public ResponseEntity<?> updateDetectionConfig(@RequestBody Map<String, Object> body) {
        double contamination = toDouble(body, "defaultContamination", detectionConfig.getDefaultContamination());
        int numTrees = toInt(body, "numTrees", detectionConfig.getNumTrees());
        int subsampleSize = toInt(body, "subsampleSize", detectionConfig.getSubsampleSize());
        long seed = toLong(body, "seed", detectionConfig.getSeed());
        int parallelism = toInt(body, "parallelism", detectionConfig.getParallelism());
        int historyLimit = toInt(body, "historyLimit", detectionConfig.getHistoryLimit());

        if (contamination < ThresholdSelector.MIN_CONTAMINATION || contamination > ThresholdSelector.MAX_CONTAMINATION) {
            return badRequest("defaultContamination must be in [0.01, 0.30]", "defaultContamination");
        }
        if (numTrees < 1) return badRequest("numTrees must be >= 1", "numTrees");
        if (subsampleSize < 1) return badRequest("subsampleSize must be >= 1", "subsampleSize");
        if (parallelism < 1) return badRequest("parallelism must be >= 1", "parallelism");
        if (historyLimit < 1) return badRequest("historyLimit must be >= 1", "historyLimit");

        detectionConfig.setDefaultContamination(contamination);
        detectionConfig.setNumTrees(numTrees);
        detectionConfig.setSubsampleSize(subsampleSize);
        detectionConfig.setSeed(seed);
        detectionConfig.setParallelism(parallelism);
        detectionConfig.setHistoryLimit(historyLimit);

        return getDetectionConfig();
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private long toLong(Map<String, Object> body, String key, long defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.longValue();
        try { return Long.parseLong(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }
}
