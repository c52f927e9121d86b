package com.logsense.anomaly.controller;

import com.logsense.anomaly.engine.InvalidBatchException;
import com.logsense.anomaly.model.DetectRequest;
import com.logsense.anomaly.model.DetectResponse;
import com.logsense.anomaly.model.MetricPoint;
import com.logsense.anomaly.service.CsvMetricParser;
import com.logsense.anomaly.service.DetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/detect")
@Tag(name = "Detection", description = "Score a batch of metrics samples and flag the anomalous ones")
public class DetectionController {

    private final DetectionService detectionService;
    private final CsvMetricParser csvMetricParser;

    public DetectionController(DetectionService detectionService, CsvMetricParser csvMetricParser) {
        this.detectionService = detectionService;
        this.csvMetricParser = csvMetricParser;
    }

    @Operation(summary = "Detect anomalies in a batch",
            description = "Trains an Isolation Forest on the submitted batch, flags the round(n * contamination) " +
                    "highest scoring samples and names the two fields that deviate most for each. " +
                    "The run is recorded; `saved=false` means scoring succeeded but recording did not.")
    @PostMapping
    public ResponseEntity<?> detect(@RequestBody DetectRequest request) {
        try {
            DetectResponse response = detectionService.detect(request.getPoints(), request.getContamination());
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return badRequest(e);
        }
    }

    @Operation(summary = "Detect anomalies in an uploaded CSV",
            description = "CSV with header `ts,cpu,ram,disk,latency_ms`. A missing column or a non-numeric " +
                    "value rejects the file before scoring.")
    @PostMapping(value = "/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> detectCsv(
            @Parameter(description = "CSV file with header ts,cpu,ram,disk,latency_ms")
            @RequestParam("file") MultipartFile file,
            @Parameter(description = "Expected anomalous fraction in [0.01, 0.30]", example = "0.05")
            @RequestParam(required = false) Double contamination) {
        List<MetricPoint> points;
        try (InputStream in = file.getInputStream()) {
            points = csvMetricParser.parse(in);
        } catch (IllegalArgumentException e) {
            return badRequest(e);
        } catch (IOException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unreadable CSV: " + e.getMessage(), "field", "file"));
        }

        try {
            return ResponseEntity.ok(detectionService.detect(points, contamination));
        } catch (IllegalArgumentException e) {
            return badRequest(e);
        }
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadableBody(HttpMessageNotReadableException e) {
        String detail = e.getMostSpecificCause().getMessage();
        return ResponseEntity.badRequest().body(Map.of(
                "error", "Malformed batch: " + (detail != null ? detail.lines().findFirst().orElse(detail) : "unreadable body"),
                "field", "points"));
    }

    private ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        Map<String, String> body = new HashMap<>();
        body.put("error", e.getMessage());
        if (e instanceof InvalidBatchException invalid) {
            body.put("field", invalid.getField());
        }
        return ResponseEntity.badRequest().body(body);
    }
}
