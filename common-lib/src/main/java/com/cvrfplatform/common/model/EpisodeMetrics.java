package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Realized performance supplied by the metrics provider when an episode closes.
 *
 * <p>{@code endDate} is nullable (the manager's clock is used).
 * {@code decisionOutcomes} maps decision id → realized return; decisions absent
 * from the map are neither profitable nor losing.
 */
public record EpisodeMetrics(
    @JsonProperty("portfolioReturn")  double              portfolioReturn,
    @JsonProperty("sharpeRatio")      double              sharpeRatio,
    @JsonProperty("maxDrawdown")      double              maxDrawdown,
    @JsonProperty("endDate")          Instant             endDate,
    @JsonProperty("decisionOutcomes") Map<String, Double> decisionOutcomes
) {

    public EpisodeMetrics {
        decisionOutcomes = decisionOutcomes == null
            ? Map.of()
            : Collections.unmodifiableMap(new HashMap<>(decisionOutcomes));
    }

    public static EpisodeMetrics of(double portfolioReturn, double sharpeRatio, double maxDrawdown) {
        return new EpisodeMetrics(portfolioReturn, sharpeRatio, maxDrawdown, null, Map.of());
    }

    public EpisodeMetrics withOutcomes(Map<String, Double> outcomes) {
        return new EpisodeMetrics(portfolioReturn, sharpeRatio, maxDrawdown, endDate, outcomes);
    }
}
