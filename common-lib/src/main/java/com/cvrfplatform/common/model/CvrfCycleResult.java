package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Immutable record of one completed comparison/update cycle. Appended to the
 * user's cycle history and never modified afterwards.
 *
 * <p>{@code beliefChanged} is false for a no-signal cycle: the comparison ran but
 * no insight survived, so {@code newBeliefState} equals the prior state and the
 * version was not bumped.
 */
public record CvrfCycleResult(
    @JsonProperty("cycleId")           String                  cycleId,
    @JsonProperty("cycleNumber")       int                     cycleNumber,
    @JsonProperty("userId")            String                  userId,
    @JsonProperty("timestamp")         Instant                 timestamp,
    @JsonProperty("episodeComparison") EpisodeComparison       episodeComparison,
    @JsonProperty("extractedInsights") List<ConceptualInsight> extractedInsights,
    @JsonProperty("metaPrompt")        MetaPrompt              metaPrompt,
    @JsonProperty("beliefUpdates")     List<BeliefUpdate>      beliefUpdates,
    @JsonProperty("newBeliefState")    BeliefState             newBeliefState,
    @JsonProperty("explanation")       String                  explanation,
    @JsonProperty("learningRate")      double                  learningRate,
    @JsonProperty("beliefChanged")     boolean                 beliefChanged
) {

    public CvrfCycleResult {
        extractedInsights = extractedInsights == null ? List.of() : List.copyOf(extractedInsights);
        beliefUpdates     = beliefUpdates == null ? List.of() : List.copyOf(beliefUpdates);
    }
}
