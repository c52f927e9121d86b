package com.logsense.anomaly.controller;

import com.logsense.anomaly.seeder.SampleBatch;
import com.logsense.anomaly.seeder.SampleMetricsGenerator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/samples")
@Tag(name = "Samples", description = "Synthetic metrics batches for trying out detection")
public class SampleController {

    private final SampleMetricsGenerator generator;

    public SampleController(SampleMetricsGenerator generator) {
        this.generator = generator;
    }

    @Operation(summary = "Generate a sample batch",
            description = "Baseline host metrics with a few injected cpu/disk/latency spikes. The same seed " +
                    "always yields the same values; timestamps start at the current time. " +
                    "The `points` array can be posted to `/detect` as is.")
    @GetMapping
    public ResponseEntity<?> generate(
            @Parameter(description = "Number of samples, 1 to 5000", example = "240")
            @RequestParam(defaultValue = "240") int points,
            @Parameter(description = "Seconds between samples", example = "60")
            @RequestParam(defaultValue = "60") int intervalSeconds,
            @Parameter(description = "Random seed", example = "42")
            @RequestParam(defaultValue = "42") long seed) {
        try {
            SampleBatch batch = generator.generate(points, intervalSeconds, seed, Instant.now());
            return ResponseEntity.ok(batch);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
