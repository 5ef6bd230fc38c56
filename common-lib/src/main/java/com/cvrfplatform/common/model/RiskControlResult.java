package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of the within-episode CVaR check. A proposal only: nothing in the engine
 * acts on it and no portfolio weight is changed.
 */
public record RiskControlResult(
    @JsonProperty("currentCvar")    double             currentCvar,
    @JsonProperty("threshold")      double             threshold,
    @JsonProperty("triggered")      boolean            triggered,
    @JsonProperty("adjustmentType") RiskAdjustmentType adjustmentType,
    @JsonProperty("magnitude")      double             magnitude,
    @JsonProperty("targets")        List<String>       targets
) {

    public RiskControlResult {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public static RiskControlResult notTriggered(double cvar, double threshold) {
        return new RiskControlResult(cvar, threshold, false, RiskAdjustmentType.NONE, 0.0, List.of());
    }
}
