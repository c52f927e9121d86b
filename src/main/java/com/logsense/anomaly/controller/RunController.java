package com.logsense.anomaly.controller;

import com.aerospike.client.AerospikeException;
import com.logsense.anomaly.config.DetectionConfig;
import com.logsense.anomaly.model.AnomalyRecord;
import com.logsense.anomaly.model.RunSummary;
import com.logsense.anomaly.repository.RunRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/runs")
@Tag(name = "Runs", description = "History of recorded detection runs")
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final RunRepository runRepository;
    private final DetectionConfig detectionConfig;

    public RunController(RunRepository runRepository, DetectionConfig detectionConfig) {
        this.runRepository = runRepository;
        this.detectionConfig = detectionConfig;
    }

    @Operation(summary = "List recent runs", description = "Most recent runs first.")
    @GetMapping
    public ResponseEntity<?> listRuns(
            @Parameter(description = "Max number of runs to return (defaults to detection.history-limit)", example = "25")
            @RequestParam(required = false) Integer limit) {
        int effective = limit != null ? limit : detectionConfig.getHistoryLimit();
        if (effective < 1) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must be >= 1", "field", "limit"));
        }
        List<RunSummary> runs = runRepository.findRecent(effective);
        return ResponseEntity.ok(runs);
    }

    @Operation(summary = "Get a run summary")
    @GetMapping("/{runId}")
    public ResponseEntity<RunSummary> getRun(
            @Parameter(description = "Run ID", example = "17")
            @PathVariable long runId) {
        RunSummary run = runRepository.findById(runId);
        if (run == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(run);
    }

    @Operation(summary = "Get the anomalies of a run", description = "Highest score first.")
    @GetMapping("/{runId}/anomalies")
    public ResponseEntity<List<AnomalyRecord>> getRunAnomalies(
            @Parameter(description = "Run ID", example = "17")
            @PathVariable long runId) {
        if (runRepository.findById(runId) == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(runRepository.findAnomalies(runId));
    }

    @ExceptionHandler(AerospikeException.class)
    public ResponseEntity<Map<String, String>> storeUnavailable(AerospikeException e) {
        log.warn("Run history unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "Run history is temporarily unavailable"));
    }
}
