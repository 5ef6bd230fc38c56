package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A bounded trading period with an ordered decision log and realized metrics.
 *
 * <p>Immutable: {@link #withDecision} and {@link #complete} return new instances.
 * Decision order is insertion order and is semantically significant.
 * {@code endDate} is null while the episode is {@link EpisodeStatus#ACTIVE}.
 */
public record Episode(
    @JsonProperty("id")              String         id,
    @JsonProperty("userId")          String         userId,
    @JsonProperty("episodeNumber")   int            episodeNumber,
    @JsonProperty("startDate")       Instant        startDate,
    @JsonProperty("endDate")         Instant        endDate,
    @JsonProperty("decisions")       List<Decision> decisions,
    @JsonProperty("portfolioReturn") double         portfolioReturn,
    @JsonProperty("sharpeRatio")     double         sharpeRatio,
    @JsonProperty("maxDrawdown")     double         maxDrawdown,
    @JsonProperty("status")          EpisodeStatus  status
) {

    public Episode {
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
    }

    public static Episode start(String id, String userId, int episodeNumber, Instant startDate) {
        return new Episode(id, userId, episodeNumber, startDate, null, List.of(),
            0.0, 0.0, 0.0, EpisodeStatus.ACTIVE);
    }

    public Episode withDecision(Decision decision) {
        List<Decision> appended = new ArrayList<>(decisions.size() + 1);
        appended.addAll(decisions);
        appended.add(decision);
        return new Episode(id, userId, episodeNumber, startDate, endDate, appended,
            portfolioReturn, sharpeRatio, maxDrawdown, status);
    }

    /**
     * Freezes the episode: stamps end date, metrics and per-decision outcomes and
     * transitions to {@link EpisodeStatus#COMPLETED}.
     */
    public Episode complete(EpisodeMetrics metrics, Instant closedAt) {
        Map<String, Double> outcomes = metrics.decisionOutcomes();
        List<Decision> stamped = new ArrayList<>(decisions.size());
        for (Decision d : decisions) {
            Double outcome = d.id() != null ? outcomes.get(d.id()) : null;
            stamped.add(outcome != null ? d.withOutcome(outcome) : d);
        }
        return new Episode(id, userId, episodeNumber, startDate, closedAt, stamped,
            metrics.portfolioReturn(), metrics.sharpeRatio(), metrics.maxDrawdown(),
            EpisodeStatus.COMPLETED);
    }

    @JsonIgnore
    public boolean isActive() {
        return status == EpisodeStatus.ACTIVE;
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == EpisodeStatus.COMPLETED;
    }
}
