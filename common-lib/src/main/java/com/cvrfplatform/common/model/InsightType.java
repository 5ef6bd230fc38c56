package com.cvrfplatform.common.model;

/**
 * <ul>
 *   <li>{@link #FACTOR}: a factor exposure separated profitable from losing trades</li>
 *   <li>{@link #SENTIMENT}: the sentiment readings behind winning or losing trades</li>
 *   <li>{@link #TIMING}: winners and losers were entered at clearly different times</li>
 *   <li>{@link #RISK}: drawdown control differed between the episodes, or was breached</li>
 *   <li>{@link #ALLOCATION}: position size concentrated a gain or a loss</li>
 *   <li>{@link #REGIME}: performance reversed while decisions changed, a structural shift</li>
 * </ul>
 */
public enum InsightType {
    FACTOR,
    SENTIMENT,
    TIMING,
    RISK,
    ALLOCATION,
    REGIME
}
