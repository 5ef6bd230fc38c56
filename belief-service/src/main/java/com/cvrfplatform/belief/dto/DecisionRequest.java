package com.cvrfplatform.belief.dto;

import com.cvrfplatform.common.model.Decision;
import com.cvrfplatform.common.model.SentimentSignal;
import com.cvrfplatform.common.model.TradeAction;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Body of {@code POST /decisions}. Id and outcome are assigned by the service;
 * {@code timestamp} defaults to the server clock.
 */
public record DecisionRequest(
    @JsonProperty("symbol")       String              symbol,
    @JsonProperty("action")       TradeAction         action,
    @JsonProperty("weightBefore") double              weightBefore,
    @JsonProperty("weightAfter")  double              weightAfter,
    @JsonProperty("reason")       String              reason,
    @JsonProperty("confidence")   double              confidence,
    @JsonProperty("factors")      Map<String, Double> factors,     // factor name → standardized exposure
    @JsonProperty("sentiment")    SentimentSignal     sentiment,   // optional
    @JsonProperty("timestamp")    Instant             timestamp
) {

    public Decision toDecision() {
        return Decision.of(symbol, action, weightBefore, weightAfter, reason, confidence, factors, timestamp)
            .withSentiment(sentiment);
    }
}
