package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Beliefs as committed by one cycle, flattened for timeline charts.
 */
public record BeliefSnapshot(
    @JsonProperty("date")              LocalDate                 date,              // UTC day of the cycle
    @JsonProperty("timestamp")         Instant                   timestamp,
    @JsonProperty("cycleId")           String                    cycleId,
    @JsonProperty("cycleNumber")       int                       cycleNumber,
    @JsonProperty("version")           long                      version,
    @JsonProperty("factorWeights")     SortedMap<String, Double> factorWeights,
    @JsonProperty("factorConfidences") SortedMap<String, Double> factorConfidences,
    @JsonProperty("regime")            MarketRegime              regime,
    @JsonProperty("regimeConfidence")  double                    regimeConfidence,
    @JsonProperty("riskTolerance")     double                    riskTolerance,
    @JsonProperty("volatilityTarget")  double                    volatilityTarget,
    @JsonProperty("performanceDelta")  double                    performanceDelta,
    @JsonProperty("insightCount")      int                       insightCount
) {

    public BeliefSnapshot {
        factorWeights     = factorWeights == null
            ? Collections.emptySortedMap() : Collections.unmodifiableSortedMap(new TreeMap<>(factorWeights));
        factorConfidences = factorConfidences == null
            ? Collections.emptySortedMap() : Collections.unmodifiableSortedMap(new TreeMap<>(factorConfidences));
    }
}
