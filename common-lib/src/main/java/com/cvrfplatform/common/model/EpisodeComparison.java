package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Structured diff between two completed episodes.
 *
 * <ul>
 *   <li>{@code performanceDelta}: later.portfolioReturn − earlier.portfolioReturn</li>
 *   <li>{@code decisionOverlap} : Jaccard similarity of (symbol, action) pairs, [0.0, 1.0]</li>
 *   <li>{@code profitableTrades}/{@code losingTrades}: partition of the later episode's
 *       decisions by outcome sign</li>
 *   <li>{@code comparedAt}      : the later episode's end date</li>
 * </ul>
 */
public record EpisodeComparison(
    @JsonProperty("earlierEpisodeId") String         earlierEpisodeId,
    @JsonProperty("laterEpisodeId")   String         laterEpisodeId,
    @JsonProperty("betterEpisodeId")  String         betterEpisodeId,
    @JsonProperty("worseEpisodeId")   String         worseEpisodeId,
    @JsonProperty("performanceDelta") double         performanceDelta,
    @JsonProperty("decisionOverlap")  double         decisionOverlap,
    @JsonProperty("profitableTrades") List<Decision> profitableTrades,
    @JsonProperty("losingTrades")     List<Decision> losingTrades,
    @JsonProperty("comparedAt")       Instant        comparedAt
) {

    public EpisodeComparison {
        profitableTrades = profitableTrades == null ? List.of() : List.copyOf(profitableTrades);
        losingTrades     = losingTrades == null ? List.of() : List.copyOf(losingTrades);
    }
}
