package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Health indicators of the learning loop, computed over a user's cycle history.
 * All ratios are in [0.0, 1.0].
 */
public record CvrfPerformanceMetrics(
    @JsonProperty("totalCycles")         int    totalCycles,
    @JsonProperty("averageLearningRate") double averageLearningRate,
    @JsonProperty("beliefStability")     double beliefStability,
    @JsonProperty("insightQuality")      double insightQuality,
    @JsonProperty("overfitRisk")         double overfitRisk,
    @JsonProperty("adaptationSpeed")     double adaptationSpeed
) {}
