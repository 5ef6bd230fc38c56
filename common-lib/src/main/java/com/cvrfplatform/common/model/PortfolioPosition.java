package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PortfolioPosition(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("weight") double weight
) {}
