package com.cvrfplatform.belief.dto;

import com.cvrfplatform.common.model.EpisodeMetrics;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Body of {@code POST /episodes/close}: realized metrics plus the learning switch.
 * {@code runCvrf} defaults to true; false defers the comparison to the batch job.
 */
public record CloseEpisodeRequest(
    @JsonProperty("portfolioReturn")  double              portfolioReturn,
    @JsonProperty("sharpeRatio")      double              sharpeRatio,
    @JsonProperty("maxDrawdown")      double              maxDrawdown,
    @JsonProperty("endDate")          Instant             endDate,
    @JsonProperty("decisionOutcomes") Map<String, Double> decisionOutcomes,  // decision id → return
    @JsonProperty("runCvrf")          Boolean             runCvrf
) {

    public EpisodeMetrics toMetrics() {
        return new EpisodeMetrics(portfolioReturn, sharpeRatio, maxDrawdown, endDate, decisionOutcomes);
    }

    public boolean runCvrfOrDefault() {
        return runCvrf == null || runCvrf;
    }
}
