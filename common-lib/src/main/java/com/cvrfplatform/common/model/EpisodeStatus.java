package com.cvrfplatform.common.model;

/**
 * Episode lifecycle. An episode is created {@link #ACTIVE} and moves to
 * {@link #COMPLETED} exactly once, after which it is immutable.
 */
public enum EpisodeStatus {
    ACTIVE,
    COMPLETED
}
