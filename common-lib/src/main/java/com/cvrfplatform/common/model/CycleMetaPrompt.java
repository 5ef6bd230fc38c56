package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * The meta-prompt of the latest cycle with the episodes it came from.
 */
public record CycleMetaPrompt(
    @JsonProperty("cycleNumber")      int        cycleNumber,
    @JsonProperty("generatedAt")      Instant    generatedAt,
    @JsonProperty("metaPrompt")       MetaPrompt metaPrompt,
    @JsonProperty("earlierEpisodeId") String     earlierEpisodeId,
    @JsonProperty("laterEpisodeId")   String     laterEpisodeId,
    @JsonProperty("performanceDelta") double     performanceDelta
) {

    public static CycleMetaPrompt of(CvrfCycleResult cycle) {
        EpisodeComparison c = cycle.episodeComparison();
        return new CycleMetaPrompt(cycle.cycleNumber(), cycle.timestamp(), cycle.metaPrompt(),
            c.earlierEpisodeId(), c.laterEpisodeId(), c.performanceDelta());
    }
}
