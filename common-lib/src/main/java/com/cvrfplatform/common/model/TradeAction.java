package com.cvrfplatform.common.model;

public enum TradeAction {
    BUY,
    SELL,
    HOLD,
    REBALANCE
}
