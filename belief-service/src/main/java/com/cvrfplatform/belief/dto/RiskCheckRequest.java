package com.cvrfplatform.belief.dto;

import com.cvrfplatform.common.model.PortfolioPosition;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Body of {@code POST /risk}: realized period returns so far, oldest first, and current holdings. */
public record RiskCheckRequest(
    @JsonProperty("returns")   List<Double>            returns,
    @JsonProperty("positions") List<PortfolioPosition> positions
) {}
