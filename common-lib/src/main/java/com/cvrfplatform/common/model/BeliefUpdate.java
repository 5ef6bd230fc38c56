package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One field-level change applied by a cycle.
 *
 * <p>Numeric fields carry {@code Double} old/new values and a {@code delta};
 * categorical fields ({@code currentRegime}) carry enum names and a null delta;
 * {@code conceptualPriors} carries the retained prior ids before and after.
 * Factor fields are named {@code factorWeights.<factor>} and
 * {@code factorConfidences.<factor>}.
 */
public record BeliefUpdate(
    @JsonProperty("field")        String field,
    @JsonProperty("oldValue")     Object oldValue,
    @JsonProperty("newValue")     Object newValue,
    @JsonProperty("delta")        Double delta,
    @JsonProperty("learningRate") double learningRate,
    @JsonProperty("rationale")    String rationale
) {

    public static BeliefUpdate numeric(String field, double oldValue, double newValue,
                                       double learningRate, String rationale) {
        return new BeliefUpdate(field, oldValue, newValue, newValue - oldValue, learningRate, rationale);
    }

    public static BeliefUpdate categorical(String field, Enum<?> oldValue, Enum<?> newValue,
                                           double learningRate, String rationale) {
        return new BeliefUpdate(field, oldValue.name(), newValue.name(), null, learningRate, rationale);
    }

    public static BeliefUpdate membership(String field, List<String> oldIds, List<String> newIds,
                                          double learningRate, String rationale) {
        return new BeliefUpdate(field, List.copyOf(oldIds), List.copyOf(newIds), null, learningRate, rationale);
    }
}
