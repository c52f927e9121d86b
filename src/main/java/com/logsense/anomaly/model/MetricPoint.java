package com.logsense.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One host metrics sample. Numeric fields are boxed so that a field absent from the
 * request body can be told apart from a genuine zero reading.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "A single metrics sample inside a detection batch")
public class MetricPoint {

    @Schema(description = "ISO-8601 timestamp of the sample (not required to be unique or sorted)",
            example = "2026-10-18T09:30:00")
    String ts;

    @Schema(description = "CPU utilisation in percent", example = "28.4")
    Double cpu;

    @Schema(description = "Memory utilisation in percent", example = "57.9")
    Double ram;

    @Schema(description = "Disk utilisation in percent", example = "18.2")
    Double disk;

    @JsonProperty("latency_ms")
    @Schema(description = "Request latency in milliseconds", example = "112.5")
    Double latencyMs;
}
