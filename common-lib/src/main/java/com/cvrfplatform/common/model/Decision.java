package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A single portfolio action recorded during an episode.
 *
 * <ul>
 *   <li>{@code factors}      : factor snapshot at decision time, factor name → standardized
 *       exposure. Always a sorted, unmodifiable map.</li>
 *   <li>{@code sentiment}    : nullable; sentiment reading the decision was taken on.</li>
 *   <li>{@code outcomeReturn}: nullable; realized return stamped from the metrics provider
 *       when the episode closes. Its sign decides profitable vs losing.</li>
 * </ul>
 */
public record Decision(
    @JsonProperty("id")            String                   id,
    @JsonProperty("symbol")        String                   symbol,
    @JsonProperty("action")        TradeAction              action,
    @JsonProperty("weightBefore")  double                   weightBefore,
    @JsonProperty("weightAfter")   double                   weightAfter,
    @JsonProperty("reason")        String                   reason,
    @JsonProperty("confidence")    double                   confidence,
    @JsonProperty("factors")       SortedMap<String, Double> factors,
    @JsonProperty("sentiment")     SentimentSignal          sentiment,
    @JsonProperty("timestamp")     Instant                  timestamp,
    @JsonProperty("outcomeReturn") Double                   outcomeReturn
) {

    public Decision {
        factors = factors == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(factors));
    }

    public static Decision of(String symbol, TradeAction action, double weightBefore, double weightAfter,
                              String reason, double confidence, Map<String, Double> factors,
                              Instant timestamp) {
        return new Decision(null, symbol, action, weightBefore, weightAfter, reason, confidence,
            factors == null ? null : new TreeMap<>(factors), null, timestamp, null);
    }

    public Decision withId(String newId) {
        return new Decision(newId, symbol, action, weightBefore, weightAfter, reason,
            confidence, factors, sentiment, timestamp, outcomeReturn);
    }

    public Decision withTimestamp(Instant newTimestamp) {
        return new Decision(id, symbol, action, weightBefore, weightAfter, reason,
            confidence, factors, sentiment, newTimestamp, outcomeReturn);
    }

    public Decision withSentiment(SentimentSignal newSentiment) {
        return new Decision(id, symbol, action, weightBefore, weightAfter, reason,
            confidence, factors, newSentiment, timestamp, outcomeReturn);
    }

    public Decision withOutcome(Double outcome) {
        return new Decision(id, symbol, action, weightBefore, weightAfter, reason,
            confidence, factors, sentiment, timestamp, outcome);
    }

    /** (symbol, action) pair used by the decision-overlap measure. */
    @JsonIgnore
    public String signature() {
        return symbol + "|" + action;
    }

    @JsonIgnore
    public boolean isProfitable() {
        return outcomeReturn != null && outcomeReturn > 0.0;
    }

    @JsonIgnore
    public boolean isLosing() {
        return outcomeReturn != null && outcomeReturn < 0.0;
    }
}
