package com.cvrfplatform.common.model;

/**
 * Proposed within-episode risk response, ordered by severity.
 */
public enum RiskAdjustmentType {
    NONE,
    REBALANCE,
    HEDGE,
    REDUCE_EXPOSURE
}
