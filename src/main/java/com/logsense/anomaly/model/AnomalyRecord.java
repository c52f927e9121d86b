package com.logsense.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "A flagged sample with its score and the fields that stood out most")
public class AnomalyRecord {

    @Schema(description = "Timestamp of the flagged sample", example = "2026-10-18T09:30:00")
    String ts;

    @Schema(description = "Anomaly score, higher is more anomalous. Positive means the sample was isolated "
            + "faster than a typical sample of the batch", example = "0.21")
    double score;

    @Schema(description = "Most suspicious fields, most to least suspicious (at most 2)",
            example = "[\"latency_ms\", \"cpu\"]")
    List<String> fields;

    @Schema(description = "Human readable hint", example = "Unusual behavior detected. Check: latency_ms, cpu")
    String note;
}
