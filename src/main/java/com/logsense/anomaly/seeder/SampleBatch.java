package com.logsense.anomaly.seeder;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.logsense.anomaly.model.MetricPoint;

import java.util.List;

/**
 * A generated batch and the positions that received injected spikes, in ascending order.
 */
public record SampleBatch(List<MetricPoint> points,
                          @JsonProperty("spike_positions") List<Integer> spikePositions) {}
