package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Compact read view of an episode for listings.
 */
public record EpisodeSummary(
    @JsonProperty("id")              String        id,
    @JsonProperty("episodeNumber")   int           episodeNumber,
    @JsonProperty("status")          EpisodeStatus status,
    @JsonProperty("startDate")       Instant       startDate,
    @JsonProperty("endDate")         Instant       endDate,
    @JsonProperty("decisionCount")   int           decisionCount,
    @JsonProperty("portfolioReturn") double        portfolioReturn,
    @JsonProperty("sharpeRatio")     double        sharpeRatio,
    @JsonProperty("maxDrawdown")     double        maxDrawdown,
    @JsonProperty("headline")        String        headline
) {}
