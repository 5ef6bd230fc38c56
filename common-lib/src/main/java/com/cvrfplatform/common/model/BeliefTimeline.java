package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Belief evolution over a trailing window of days, oldest snapshot first.
 *
 * <ul>
 *   <li>{@code factors}          : every factor name seen in the window, sorted</li>
 *   <li>{@code regimeTransitions}: snapshots whose regime differs from the one before</li>
 * </ul>
 */
public record BeliefTimeline(
    @JsonProperty("days")              int                  days,
    @JsonProperty("snapshots")         List<BeliefSnapshot> snapshots,
    @JsonProperty("factors")           List<String>         factors,
    @JsonProperty("regimeTransitions") int                  regimeTransitions
) {

    public BeliefTimeline {
        snapshots = snapshots == null ? List.of() : List.copyOf(snapshots);
        factors   = factors == null ? List.of() : List.copyOf(factors);
    }
}
