package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of closing an episode.
 *
 * <ul>
 *   <li>{@code coldStart}     true when no earlier completed episode existed, so no
 *       comparison ran and beliefs stayed untouched. Not an error.</li>
 *   <li>{@code cycleDeferred} true when the caller asked to defer learning to the batch job.</li>
 *   <li>{@code cycleResult}   null unless a cycle ran inline.</li>
 * </ul>
 */
public record EpisodeCloseResult(
    @JsonProperty("episode")       Episode         episode,
    @JsonProperty("cycleResult")   CvrfCycleResult cycleResult,
    @JsonProperty("coldStart")     boolean         coldStart,
    @JsonProperty("cycleDeferred") boolean         cycleDeferred
) {

    public static EpisodeCloseResult coldStart(Episode episode) {
        return new EpisodeCloseResult(episode, null, true, false);
    }

    public static EpisodeCloseResult deferred(Episode episode) {
        return new EpisodeCloseResult(episode, null, false, true);
    }

    public static EpisodeCloseResult withCycle(Episode episode, CvrfCycleResult result) {
        return new EpisodeCloseResult(episode, result, false, false);
    }
}
