package com.logsense.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Summary of one completed detection run")
public class RunSummary {

    @Schema(description = "Run identifier, increasing with every recorded run", example = "17")
    long id;

    @JsonProperty("created_at")
    @Schema(description = "ISO-8601 UTC instant the run was recorded", example = "2026-10-18T09:31:02.114Z")
    String createdAt;

    @JsonProperty("total_points")
    @Schema(description = "Number of samples in the scored batch", example = "240")
    int totalPoints;

    @JsonProperty("anomalies_found")
    @Schema(description = "Number of samples flagged as anomalous", example = "12")
    int anomaliesFound;
}
