package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sentiment reading attached to a decision by the upstream sentiment model.
 * {@code confidence} is in [0.0, 1.0].
 */
public record SentimentSignal(
    @JsonProperty("label")      SentimentLabel label,
    @JsonProperty("confidence") double         confidence
) {}
