package com.logsense.anomaly.model;

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
@Schema(description = "A batch of metrics samples to score")
public class DetectRequest {

    @Schema(description = "Samples in caller order. The order is kept in the result")
    private List<MetricPoint> points;

    @Schema(description = "Expected fraction of anomalous samples, in [0.01, 0.30]. Defaults to detection.default-contamination",
            example = "0.05", minimum = "0.01", maximum = "0.30")
    private Double contamination;
}
