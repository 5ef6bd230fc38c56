package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Belief-derived guidance handed to the external portfolio optimizer.
 * Read-only projection of a {@link BeliefState}; carries no portfolio weights.
 */
public record OptimizationConstraints(
    @JsonProperty("beliefVersion")    long                           beliefVersion,
    @JsonProperty("regime")           MarketRegime                   regime,
    @JsonProperty("factorTargets")    SortedMap<String, FactorTarget> factorTargets,
    @JsonProperty("maxWeight")        double                         maxWeight,
    @JsonProperty("minWeight")        double                         minWeight,
    @JsonProperty("volatilityTarget") double                         volatilityTarget,
    @JsonProperty("riskBudget")       double                         riskBudget
) {

    public OptimizationConstraints {
        factorTargets = factorTargets == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(factorTargets));
    }

    /** Target factor tilt with a confidence-scaled tolerance band. */
    public record FactorTarget(
        @JsonProperty("target")    double target,
        @JsonProperty("tolerance") double tolerance
    ) {}
}
