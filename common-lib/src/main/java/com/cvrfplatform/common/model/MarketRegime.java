package com.cvrfplatform.common.model;

/**
 * Coarse market condition held in the belief state. Drives the learning-rate
 * stability factor and the regime multiplier applied to optimizer constraints.
 */
public enum MarketRegime {
    BULL,
    BEAR,
    SIDEWAYS,
    VOLATILE
}
