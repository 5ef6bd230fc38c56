package com.cvrfplatform.common.model;

public enum SentimentLabel {
    POSITIVE,
    NEGATIVE,
    NEUTRAL
}
