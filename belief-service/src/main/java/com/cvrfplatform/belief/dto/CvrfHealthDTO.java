package com.cvrfplatform.belief.dto;

import com.cvrfplatform.common.model.MarketRegime;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-user learning-loop status for {@code GET /health}.
 */
public record CvrfHealthDTO(
    @JsonProperty("userId")              String       userId,
    @JsonProperty("status")              String       status,
    @JsonProperty("beliefVersion")       long         beliefVersion,
    @JsonProperty("currentRegime")       MarketRegime currentRegime,
    @JsonProperty("activeEpisodeNumber") Integer      activeEpisodeNumber,  // null when no episode is open
    @JsonProperty("totalCycles")         int          totalCycles,
    @JsonProperty("cyclePending")        boolean      cyclePending,         // deferred cycle queued
    @JsonProperty("cycleInFlight")       boolean      cycleInFlight
) {}
