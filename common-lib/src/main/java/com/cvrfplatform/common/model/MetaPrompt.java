package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Explainability summary of one cycle's direction and learnings. Produced for
 * downstream readers only; nothing in the engine consumes it.
 *
 * <p>{@code factorAdjustments} holds the applied weight delta per factor, keyed
 * alphabetically so the rendered text is reproducible.
 */
public record MetaPrompt(
    @JsonProperty("optimizationDirection") String                    optimizationDirection,
    @JsonProperty("keyLearnings")          List<String>              keyLearnings,
    @JsonProperty("factorAdjustments")     SortedMap<String, Double> factorAdjustments,
    @JsonProperty("riskGuidance")          String                    riskGuidance,
    @JsonProperty("timingInsights")        String                    timingInsights
) {

    public MetaPrompt {
        keyLearnings = keyLearnings == null ? List.of() : List.copyOf(keyLearnings);
        factorAdjustments = factorAdjustments == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(factorAdjustments));
    }

    public static MetaPrompt noSignal() {
        return new MetaPrompt("Hold current beliefs: no significant insight in this comparison",
            List.of(), null, "Risk parameters unchanged", "No timing signal");
    }
}
