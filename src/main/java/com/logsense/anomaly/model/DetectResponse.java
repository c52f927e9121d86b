package com.logsense.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of scoring one batch")
public class DetectResponse {

    @JsonProperty("total_points")
    @Schema(description = "Number of samples scored", example = "240")
    private int totalPoints;

    @JsonProperty("anomalies_found")
    @Schema(description = "Number of samples flagged", example = "12")
    private int anomaliesFound;

    @Schema(description = "Flagged samples, highest score first")
    private List<AnomalyRecord> anomalies;

    @JsonProperty("run_id")
    @Schema(description = "Identifier of the recorded run, null when recording failed", example = "17", nullable = true)
    private Long runId;

    @Schema(description = "Whether the run and its anomalies were durably recorded", example = "true")
    private boolean saved;
}
